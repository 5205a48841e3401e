package com.neurasense.jitai.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Standard error response for API endpoints.
 */
@Schema(description = "Error response")
public class ErrorResponse {

    @Schema(example = "INVALID_STATUS")
    public String code;

    @Schema(example = "status must be one of opened, completed, dismissed, abandoned")
    public String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
