package com.convoflow.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Context accumulation strategy of a node; {@code summary_prompt} is used with RESET_WITH_SUMMARY. */
public final class ContextStrategyConfig {

    private final ContextStrategy strategy;
    private final String summaryPrompt;

    @JsonCreator
    public ContextStrategyConfig(
            @JsonProperty("strategy") ContextStrategy strategy,
            @JsonProperty("summary_prompt") String summaryPrompt) {
        this.strategy = strategy != null ? strategy : ContextStrategy.APPEND;
        this.summaryPrompt = summaryPrompt;
    }

    public ContextStrategy getStrategy() {
        return strategy;
    }

    @JsonProperty("summary_prompt")
    public String getSummaryPrompt() {
        return summaryPrompt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContextStrategyConfig that = (ContextStrategyConfig) o;
        return strategy == that.strategy && Objects.equals(summaryPrompt, that.summaryPrompt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, summaryPrompt);
    }
}
