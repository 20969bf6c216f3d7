package com.demoBank.advisor.response.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One grounded value read from a tool output, a slot or the knowledge base.
 *
 * @param factId     stable id, e.g. {@code spend.net_cashflow.30d}
 * @param label      localized display label
 * @param value      raw value (number, text, boolean or list)
 * @param valueText  formatted value; the only text an answer may show for this fact
 * @param unit       unit such as VND or %, may be empty
 * @param timeframe  window the value covers, may be empty
 * @param sourceTool tool (or extraction step) that produced the value
 * @param sourcePath field path inside the source output
 */
public record Fact(
        @JsonProperty("fact_id") String factId,
        @JsonProperty("label") String label,
        @JsonProperty("value") Object value,
        @JsonProperty("value_text") String valueText,
        @JsonProperty("unit") String unit,
        @JsonProperty("timeframe") String timeframe,
        @JsonProperty("source_tool") String sourceTool,
        @JsonProperty("source_path") String sourcePath) {

    public Fact {
        Objects.requireNonNull(factId, "factId");
        label = label == null ? "" : label;
        valueText = valueText == null ? "" : valueText;
        unit = unit == null ? "" : unit;
        timeframe = timeframe == null ? "" : timeframe;
        sourceTool = sourceTool == null ? "" : sourceTool;
        sourcePath = sourcePath == null ? "" : sourcePath;
    }

    /**
     * Numeric value, or null when the value is not a number.
     */
    public Double numericValue() {
        return value instanceof Number number ? number.doubleValue() : null;
    }
}
