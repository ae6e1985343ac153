package com.mikov.emailvalidator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregated counts over a batch of emails. Categories are counted independently,
 * so one address can add to both {@code invalid} and {@code invalidFormat}.
 * {@code noMx} stays 0 when MX records were not checked.
 *
 * @author zahari.mikov
 */
@Data
@Builder
public class ValidationStatistics {

    private final int total;
    private final int valid;
    private final int invalid;
    private final int disposable;

    @JsonProperty("invalid_format")
    private final int invalidFormat;

    @JsonProperty("no_mx")
    private final int noMx;
}
