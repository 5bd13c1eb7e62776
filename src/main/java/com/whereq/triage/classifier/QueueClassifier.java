package com.whereq.triage.classifier;

import com.whereq.triage.config.QueueTierCatalog;
import com.whereq.triage.model.QueueTier;
import com.whereq.triage.model.SubmissionPreconditions;
import com.whereq.triage.model.TierLimits;
import com.whereq.triage.model.UserTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ordered-threshold classifier picking the queue tier for a submission.
 * Thresholds are inclusive; the first matching rule wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueClassifier {

    /**
     * General tiers in evaluation order; anything that fits none of them goes to ULTRA_HEAVY
     */
    private static final List<QueueTier> GENERAL_ORDER = List.of(
        QueueTier.INSTANT_PROCESSING,
        QueueTier.FAST_PROCESSING,
        QueueTier.STANDARD_PROCESSING,
        QueueTier.HEAVY_PROCESSING
    );

    private final QueueTierCatalog catalog;

    /**
     * Determine the queue for a file
     *
     * @param fileSize size in bytes, must be positive
     * @param complexity complexity in [0,1]
     * @param userTier tier of the submitting user
     * @return the chosen queue
     */
    public QueueTier determineOptimalQueue(long fileSize, double complexity, UserTier userTier) {
        SubmissionPreconditions.checkFileSize(fileSize);
        SubmissionPreconditions.checkComplexity(complexity);
        SubmissionPreconditions.checkUserTier(userTier);

        TierLimits priorityLimits = catalog.get(QueueTier.PRIORITY_PROCESSING);
        if (!priorityLimits.getEligibleUserTiers().isEmpty()
                && priorityLimits.isEligible(userTier)
                && priorityLimits.accommodates(fileSize, complexity)) {
            return QueueTier.PRIORITY_PROCESSING;
        }

        for (QueueTier tier : GENERAL_ORDER) {
            if (catalog.get(tier).accommodates(fileSize, complexity)) {
                return tier;
            }
        }

        return QueueTier.ULTRA_HEAVY;
    }
}
