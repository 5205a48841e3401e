package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neurasense.jitai.ruleset.RulesetRegistry;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Rule reload response.
 */
@Schema(description = "Rule reload response")
public class ReloadResponse {

    @Schema(example = "true")
    public boolean success;

    @Schema(example = "SUCCESS")
    public String status;

    public String message;

    @JsonProperty("old_version")
    public int oldVersion;

    @JsonProperty("new_version")
    public int newVersion;

    @JsonProperty("rules_loaded")
    public int rulesLoaded;

    public static ReloadResponse of(RulesetRegistry.ReloadResult result, int rulesLoaded) {
        ReloadResponse response = new ReloadResponse();
        response.success = result.success();
        response.status = result.status();
        response.message = result.message();
        response.oldVersion = result.oldVersion();
        response.newVersion = result.newVersion();
        response.rulesLoaded = rulesLoaded;
        return response;
    }
}
