package com.neurasense.jitai.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Acknowledgement of an outcome report. Identical whether or not the report changed a record.
 */
@Schema(description = "Outcome acknowledgement")
public class OutcomeResponse {

    @Schema(example = "true")
    public boolean success;

    @Schema(example = "recorded")
    public String message;

    public OutcomeResponse(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static OutcomeResponse recorded() {
        return new OutcomeResponse(true, "recorded");
    }
}
