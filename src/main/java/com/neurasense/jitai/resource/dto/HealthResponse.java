package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Health check response.
 */
@Schema(description = "Health response")
public class HealthResponse {

    @Schema(example = "UP")
    public String status;

    @JsonProperty("rules_loaded")
    @Schema(example = "12")
    public int rulesLoaded;

    public HealthResponse(String status, int rulesLoaded) {
        this.status = status;
        this.rulesLoaded = rulesLoaded;
    }
}
