package com.mikov.emailvalidator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request model for batch validation, filtering, statistics and normalization.
 *
 * @author zahari.mikov
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkEmailValidationRequest {

    private List<String> emails;

    /**
     * Whether to query MX records; defaults to true like the single-address endpoint.
     */
    private boolean checkMx = true;
}
