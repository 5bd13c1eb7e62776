package com.whereq.triage.estimator;

import com.whereq.triage.model.SimilarFileAnalysis;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ComplexityEstimatorTest {

    private static final long MB = 1024L * 1024L;

    private final ComplexityEstimator estimator = new ComplexityEstimator();

    @Test
    void sizeScoreUsesInclusiveBuckets() {
        assertThat(estimator.sizeScore(MB)).isEqualTo(0.1);
        assertThat(estimator.sizeScore(MB + 1)).isEqualTo(0.3);
        assertThat(estimator.sizeScore(5 * MB)).isEqualTo(0.3);
        assertThat(estimator.sizeScore(20 * MB)).isEqualTo(0.5);
        assertThat(estimator.sizeScore(50 * MB)).isEqualTo(0.7);
        assertThat(estimator.sizeScore(50 * MB + 1)).isEqualTo(0.9);
    }

    @Test
    void extensionScoreIsCaseInsensitiveAndDefaultsToHalf() {
        assertThat(estimator.extensionScore("data.CSV")).isEqualTo(0.2);
        assertThat(estimator.extensionScore("legacy.xls")).isEqualTo(0.5);
        assertThat(estimator.extensionScore("report.xlsx")).isEqualTo(0.6);
        assertThat(estimator.extensionScore("macros.XLSM")).isEqualTo(0.8);
        assertThat(estimator.extensionScore("notes.txt")).isEqualTo(0.5);
        assertThat(estimator.extensionScore("no-extension")).isEqualTo(0.5);
        assertThat(estimator.extensionScore("trailing.")).isEqualTo(0.5);
        assertThat(estimator.extensionScore(null)).isEqualTo(0.5);
    }

    @Test
    void historyDefaultsWhenMissingOrDissimilar() {
        assertThat(estimator.historicalScore(10 * MB, null)).isEqualTo(0.5);
        assertThat(estimator.historicalScore(10 * MB, List.of())).isEqualTo(0.5);

        List<SimilarFileAnalysis> farAway = List.of(new SimilarFileAnalysis(100 * MB, 3.0));
        assertThat(estimator.historicalScore(10 * MB, farAway)).isEqualTo(0.5);
    }

    @Test
    void historyBucketsAverageTierOfSimilarFiles() {
        long size = 10 * MB;
        assertThat(estimator.historicalScore(size, List.of(
            new SimilarFileAnalysis(size, 1.0),
            new SimilarFileAnalysis(size + size / 10, 1.6)))).isEqualTo(0.3);

        assertThat(estimator.historicalScore(size, List.of(
            new SimilarFileAnalysis(size - size / 10, 1.5)))).isEqualTo(0.6);

        assertThat(estimator.historicalScore(size, List.of(
            new SimilarFileAnalysis(size, 2.0),
            new SimilarFileAnalysis(size, 3.0),
            new SimilarFileAnalysis(500 * MB, 1.0)))).isEqualTo(0.9);
    }

    @Test
    void historyConsidersAtMostTenSimilarFiles() {
        long size = 2 * MB;
        List<SimilarFileAnalysis> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(new SimilarFileAnalysis(size, 1.0));
        }
        // would push the average above 1.7 if it were counted
        for (int i = 0; i < 30; i++) {
            history.add(new SimilarFileAnalysis(size, 3.0));
        }

        assertThat(estimator.historicalScore(size, history)).isEqualTo(0.3);
    }

    @Test
    void weightedSumOfSubScores() {
        // 0.4 * 0.1 + 0.3 * 0.6 + 0.3 * 0.5
        double complexity = estimator.estimateComplexity(800 * 1024, "small.xlsx", List.of());
        assertThat(complexity).isCloseTo(0.37, within(1e-9));

        // 0.4 * 0.9 + 0.3 * 0.8 + 0.3 * 0.9
        double heaviest = estimator.estimateComplexity(200 * MB, "huge.xlsm",
            List.of(new SimilarFileAnalysis(200 * MB, 3.0)));
        assertThat(heaviest).isCloseTo(0.87, within(1e-9));
        assertThat(heaviest).isLessThanOrEqualTo(1.0);
    }
}
