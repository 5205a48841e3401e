package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.neurasense.jitai.domain.Rule;
import com.neurasense.jitai.domain.Ruleset;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Summary of the active rule snapshot.
 */
@Schema(description = "Active ruleset status")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RulesetStatus {

    @JsonProperty("version")
    public int version;

    @JsonProperty("source")
    @Schema(example = "/etc/jitai/rules.json")
    public String source;

    @JsonProperty("last_modified")
    public Instant lastModified;

    @JsonProperty("rule_count")
    public int ruleCount;

    @JsonProperty("enabled_count")
    public long enabledCount;

    @JsonProperty("skipped_count")
    public int skippedCount;

    @JsonProperty("default_action_count")
    public int defaultActionCount;

    @JsonProperty("rules")
    public List<Rule> rules;

    public static RulesetStatus of(Ruleset ruleset) {
        RulesetStatus status = new RulesetStatus();
        status.version = ruleset.getVersion();
        status.source = ruleset.getSource();
        status.lastModified = ruleset.getLastModified();
        status.ruleCount = ruleset.size();
        status.enabledCount = ruleset.enabledCount();
        status.skippedCount = ruleset.getSkippedCount();
        status.defaultActionCount = ruleset.getDefaultActions().size();
        status.rules = ruleset.getRules();
        return status;
    }
}
