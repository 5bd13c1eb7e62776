package com.whereq.triage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Failure report sent by a worker
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobFailureRequest {
    private String errorMessage;
}
