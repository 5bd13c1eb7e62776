package com.whereq.triage.dto;

import com.whereq.triage.model.RequestedPriority;
import com.whereq.triage.model.SimilarFileAnalysis;
import com.whereq.triage.model.SubmissionRequest;
import com.whereq.triage.model.UserTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to analyse an uploaded Excel file
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisSubmitRequest {

    @NotBlank
    private String fileId;

    @NotBlank
    private String userId;

    /**
     * Original file name, e.g. "report.xlsx"
     */
    @NotBlank
    private String fileName;

    /**
     * File size in bytes
     */
    @Positive
    private long fileSize;

    @NotNull
    private UserTier userTier;

    /**
     * urgent, high, normal (default) or low
     */
    private RequestedPriority requestedPriority;

    /**
     * Past analyses used for complexity estimation
     */
    @Valid
    @Builder.Default
    private List<SimilarFileAnalysis> similarFileHistory = new ArrayList<>();

    public SubmissionRequest toSubmission() {
        return SubmissionRequest.builder()
            .fileId(fileId)
            .userId(userId)
            .fileName(fileName)
            .fileSize(fileSize)
            .userTier(userTier)
            .requestedPriority(requestedPriority == null ? RequestedPriority.NORMAL : requestedPriority)
            .similarFileHistory(similarFileHistory == null ? List.of() : similarFileHistory)
            .build();
    }
}
