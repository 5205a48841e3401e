package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Metrics response.
 */
@Schema(description = "Metrics response")
public class MetricsResponse {

    @JsonProperty("ruleset_version")
    public int rulesetVersion;

    @JsonProperty("rules_loaded")
    public int rulesLoaded;

    @JsonProperty("catalog_size")
    public int catalogSize;

    @JsonProperty("jvm_uptime_ms")
    @Schema(description = "JVM uptime in ms")
    public long jvmUptime;

    @JsonProperty("jvm_memory_bytes")
    @Schema(description = "JVM used memory in bytes")
    public long jvmMemory;

    // ========== Engine Counters ==========

    @JsonProperty("engine_counters")
    @Schema(description = "Engine observability counters")
    public Map<String, Long> engineCounters;
}
