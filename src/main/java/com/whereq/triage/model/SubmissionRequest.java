package com.whereq.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One request to analyse an uploaded file. Lives only for the duration of the assignment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionRequest {
    private String fileId;

    private String userId;

    /**
     * Original file name, used for its extension
     */
    private String fileName;

    /**
     * File size in bytes
     */
    private long fileSize;

    private UserTier userTier;

    @Builder.Default
    private RequestedPriority requestedPriority = RequestedPriority.NORMAL;

    @Builder.Default
    private List<SimilarFileAnalysis> similarFileHistory = List.of();
}
