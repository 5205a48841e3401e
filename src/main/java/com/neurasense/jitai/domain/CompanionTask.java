package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Short micro-task suggested alongside the selected actions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CompanionTask {

    @JsonProperty("text")
    private final String text;

    @JsonProperty("reason")
    private final String reason;

    public CompanionTask(String text, String reason) {
        this.text = text;
        this.reason = reason;
    }

    public String getText() {
        return text;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompanionTask that = (CompanionTask) o;
        return Objects.equals(text, that.text) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, reason);
    }
}
