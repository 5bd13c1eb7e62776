package com.whereq.triage.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.triage.model.QueueAssignment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for an analysis submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisSubmitResponse {

    /**
     * Queue placement, absent when the submission failed
     */
    private QueueAssignment assignment;

    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    public static AnalysisSubmitResponse accepted(QueueAssignment assignment, Instant submittedAt) {
        return AnalysisSubmitResponse.builder()
            .assignment(assignment)
            .submittedAt(submittedAt)
            .build();
    }

    /**
     * Create error response
     */
    public static AnalysisSubmitResponse error(String message, Instant submittedAt) {
        return AnalysisSubmitResponse.builder()
            .errorMessage(message)
            .submittedAt(submittedAt)
            .build();
    }
}
