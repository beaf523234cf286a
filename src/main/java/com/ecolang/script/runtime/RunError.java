package com.ecolang.script.runtime;

import java.util.Collections;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Structured fatal error. Immutable; position data is added through
 * {@link #withPosition}, which only fills fields that are still empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"code", "message", "line", "column", "context", "hint"})
public final class RunError {
    private final ErrorCode code;
    private final String message;
    private final Integer line;
    private final Integer column;
    private final String lineText;
    private final String hint;

    public RunError(ErrorCode code, String message, Integer line, Integer column, String lineText, String hint) {
        if (code == null) throw new IllegalArgumentException("code is null");
        this.code = code;
        this.message = (message == null) ? "" : message;
        this.line = line;
        this.column = column;
        this.lineText = lineText;
        this.hint = hint;
    }

    public static RunError of(ErrorCode code, String message) {
        return new RunError(code, message, null, null, null, null);
    }

    public RunError withPosition(int line, int column, String lineText, String hint) {
        return new RunError(
                code,
                message,
                (this.line != null) ? this.line : Integer.valueOf(line),
                (this.column != null) ? this.column : Integer.valueOf(column),
                (this.lineText != null) ? this.lineText : lineText,
                (this.hint != null) ? this.hint : hint
        );
    }

    @JsonProperty("code")
    public ErrorCode getCode() { return code; }

    @JsonProperty("message")
    public String getMessage() { return message; }

    @JsonProperty("line")
    public Integer getLine() { return line; }

    @JsonProperty("column")
    public Integer getColumn() { return column; }

    @JsonIgnore
    public String getLineText() { return lineText; }

    @JsonProperty("context")
    Map<String, String> context() {
        return (lineText == null) ? null : Collections.singletonMap("line_text", lineText);
    }

    @JsonProperty("hint")
    public String getHint() { return hint; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(code).append(": ").append(message);
        if (line != null) {
            sb.append(" (line ").append(line);
            if (column != null) sb.append(", column ").append(column);
            sb.append(')');
        }
        return sb.toString();
    }
}
