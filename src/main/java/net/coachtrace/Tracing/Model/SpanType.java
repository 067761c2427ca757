package net.coachtrace.Tracing.Model;

/**
 * Kind of work a span represents.
 */
public enum SpanType {
    LLM("llm"),
    TOOL("tool"),
    RETRIEVAL("retrieval"),
    GENERAL("general");

    private final String value;

    SpanType(String value) {
        this.value = value;
    }

    /**
     * Lower-case name used in span metadata and by the backend.
     */
    public String getValue() {
        return value;
    }
}
