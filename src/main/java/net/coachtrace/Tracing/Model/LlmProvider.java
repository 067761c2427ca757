package net.coachtrace.Tracing.Model;

//LLM PROVIDERS RECORDED ON LLM SPANS
public enum LlmProvider {
    ANTHROPIC("anthropic"),
    OPENAI("openai"),
    COHERE("cohere"),
    GOOGLE("google"),
    CUSTOM("custom");

    private final String value;

    LlmProvider(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
