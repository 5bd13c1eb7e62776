package com.whereq.triage.model;

import com.whereq.triage.exception.InvalidSubmissionException;

/**
 * Fail-fast checks shared by the classification steps
 */
public final class SubmissionPreconditions {

    private SubmissionPreconditions() {
    }

    public static void checkFileSize(long fileSize) {
        if (fileSize <= 0) {
            throw new InvalidSubmissionException("File size must be positive, got " + fileSize);
        }
    }

    public static void checkComplexity(double complexity) {
        if (Double.isNaN(complexity) || complexity < 0.0 || complexity > 1.0) {
            throw new InvalidSubmissionException("Complexity must be within [0,1], got " + complexity);
        }
    }

    public static void checkUserTier(UserTier userTier) {
        if (userTier == null) {
            throw new InvalidSubmissionException("User tier is required");
        }
    }
}
