package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a parsed rule document.
 * <p>
 * The registry publishes one snapshot at a time and replaces it wholesale on reload, so
 * readers never observe a partially parsed document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Ruleset {

    private static final Ruleset EMPTY = new Ruleset(0, List.of(), List.of(), null, "empty", null, 0);

    @JsonProperty("version")
    private final int version;

    @JsonProperty("rules")
    private final List<Rule> rules;

    @JsonProperty("default_actions")
    private final List<RuleAction> defaultActions;

    @JsonProperty("default_task")
    private final CompanionTask defaultTask;

    @JsonProperty("source")
    private final String source;

    @JsonProperty("last_modified")
    private final Instant lastModified;

    @JsonProperty("skipped_rules")
    private final int skippedCount;

    public Ruleset(int version,
                   List<Rule> rules,
                   List<RuleAction> defaultActions,
                   CompanionTask defaultTask,
                   String source,
                   Instant lastModified,
                   int skippedCount) {
        this.version = version;
        this.rules = List.copyOf(rules);
        this.defaultActions = List.copyOf(defaultActions);
        this.defaultTask = defaultTask;
        this.source = source;
        this.lastModified = lastModified;
        this.skippedCount = skippedCount;
    }

    /**
     * A snapshot with no rules and no defaults; used before the first successful load.
     */
    public static Ruleset empty() {
        return EMPTY;
    }

    public static Ruleset of(List<Rule> rules, List<RuleAction> defaultActions, CompanionTask defaultTask) {
        return new Ruleset(1, rules, defaultActions, defaultTask, "inline", null, 0);
    }

    public int getVersion() {
        return version;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public List<RuleAction> getDefaultActions() {
        return defaultActions;
    }

    public CompanionTask getDefaultTask() {
        return defaultTask;
    }

    public String getSource() {
        return source;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    @JsonIgnore
    public int size() {
        return rules.size();
    }

    @JsonIgnore
    public long enabledCount() {
        return rules.stream().filter(Rule::isEnabled).count();
    }

    @Override
    public String toString() {
        return "Ruleset{" +
                "version=" + version +
                ", rules=" + rules.size() +
                ", source='" + source + '\'' +
                ", skipped=" + skippedCount +
                '}';
    }
}
