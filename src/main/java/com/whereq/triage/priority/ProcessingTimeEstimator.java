package com.whereq.triage.priority;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rough, human readable processing time shown to the user after submission
 */
@Component
public class ProcessingTimeEstimator {

    private static final long MB = 1024L * 1024L;

    /**
     * Estimate the processing time of a file
     *
     * @param fileSize size in bytes
     * @param complexity complexity in [0,1]
     * @return Korean duration text such as "45초", "2분" or "1.5시간"
     */
    public String estimateProcessingTime(long fileSize, double complexity) {
        long seconds = estimateSeconds(fileSize, complexity);

        if (seconds < 60) {
            return seconds + "초";
        } else if (seconds < 3600) {
            return (seconds / 60) + "분";
        }
        BigDecimal hours = BigDecimal.valueOf(seconds)
            .divide(BigDecimal.valueOf(3600), 1, RoundingMode.HALF_UP);
        return hours.toPlainString() + "시간";
    }

    long estimateSeconds(long fileSize, double complexity) {
        long baseSeconds;
        if (fileSize <= MB) {
            baseSeconds = 15;
        } else if (fileSize <= 10 * MB) {
            baseSeconds = 45;
        } else if (fileSize <= 50 * MB) {
            baseSeconds = 120;
        } else {
            baseSeconds = 300;
        }
        return Math.round(baseSeconds * (1 + complexity));
    }
}
