package com.whereq.triage.estimator;

import com.whereq.triage.model.SimilarFileAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Estimates how expensive a file will be to analyse, as a score in [0,1].
 * Missing information falls back to neutral defaults; estimation never fails.
 */
@Slf4j
@Component
public class ComplexityEstimator {

    private static final long MB = 1024L * 1024L;

    private static final double SIZE_WEIGHT = 0.4;
    private static final double EXTENSION_WEIGHT = 0.3;
    private static final double HISTORY_WEIGHT = 0.3;

    private static final double DEFAULT_EXTENSION_SCORE = 0.5;
    private static final double DEFAULT_HISTORY_SCORE = 0.5;

    private static final Map<String, Double> EXTENSION_SCORES = Map.of(
        ".csv", 0.2,
        ".xls", 0.5,
        ".xlsx", 0.6,
        ".xlsm", 0.8 // macros
    );

    /**
     * Files within this ratio of the submitted size count as similar
     */
    private static final double SIMILARITY_RATIO = 0.2;
    private static final int MAX_SIMILAR_FILES = 10;

    /**
     * Estimate the complexity of a file
     *
     * @param fileSize size in bytes
     * @param fileName original file name
     * @param history past analyses of other files
     * @return complexity in [0,1]
     */
    public double estimateComplexity(long fileSize, String fileName, List<SimilarFileAnalysis> history) {
        double sizeScore = sizeScore(fileSize);
        double extensionScore = extensionScore(fileName);
        double historyScore = historicalScore(fileSize, history);

        double complexity = SIZE_WEIGHT * sizeScore
            + EXTENSION_WEIGHT * extensionScore
            + HISTORY_WEIGHT * historyScore;

        log.debug("Complexity for {} ({} bytes): size={}, extension={}, history={} -> {}",
            fileName, fileSize, sizeScore, extensionScore, historyScore, complexity);

        return Math.min(complexity, 1.0);
    }

    double sizeScore(long fileSize) {
        if (fileSize <= MB) {
            return 0.1;
        } else if (fileSize <= 5 * MB) {
            return 0.3;
        } else if (fileSize <= 20 * MB) {
            return 0.5;
        } else if (fileSize <= 50 * MB) {
            return 0.7;
        }
        return 0.9;
    }

    double extensionScore(String fileName) {
        if (fileName == null) {
            return DEFAULT_EXTENSION_SCORE;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return DEFAULT_EXTENSION_SCORE;
        }
        String extension = fileName.substring(dot).toLowerCase(Locale.ROOT);
        return EXTENSION_SCORES.getOrDefault(extension, DEFAULT_EXTENSION_SCORE);
    }

    /**
     * Bucket the average AI tier used by up to ten files within ±20% of the submitted size
     */
    double historicalScore(long fileSize, List<SimilarFileAnalysis> history) {
        if (history == null || history.isEmpty()) {
            return DEFAULT_HISTORY_SCORE;
        }

        double lower = fileSize * (1 - SIMILARITY_RATIO);
        double upper = fileSize * (1 + SIMILARITY_RATIO);

        double averageTier = history.stream()
            .filter(analysis -> analysis.getFileSize() >= lower && analysis.getFileSize() <= upper)
            .limit(MAX_SIMILAR_FILES)
            .mapToDouble(SimilarFileAnalysis::getAiTierUsed)
            .average()
            .orElse(Double.NaN);

        if (Double.isNaN(averageTier)) {
            return DEFAULT_HISTORY_SCORE;
        }
        if (averageTier <= 1.3) {
            return 0.3;
        } else if (averageTier <= 1.7) {
            return 0.6;
        }
        return 0.9;
    }
}
