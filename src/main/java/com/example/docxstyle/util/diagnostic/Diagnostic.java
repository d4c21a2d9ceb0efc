package com.example.docxstyle.util.diagnostic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 单条诊断信息
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Diagnostic {

    @JsonProperty("kind")
    private final DiagnosticKind kind;

    @JsonProperty("source")
    private final String source;

    @JsonProperty("message")
    private final String message;

    public Diagnostic(DiagnosticKind kind, String source, String message) {
        this.kind = kind;
        this.source = source;
        this.message = message;
    }

    public DiagnosticKind getKind() { return kind; }

    public String getSource() { return source; }

    public String getMessage() { return message; }

    @Override
    public String toString() {
        return kind + "[" + source + "]: " + message;
    }
}
