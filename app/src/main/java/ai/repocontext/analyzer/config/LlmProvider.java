package ai.repocontext.analyzer.config;

import java.util.Locale;

/**
 * Supported chat model providers.
 */
public enum LlmProvider {
    OLLAMA("llama3.1"),
    GEMINI("gemini-2.5-flash"),
    GROQ("llama-3.3-70b-versatile");

    private final String defaultModel;

    LlmProvider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public static LlmProvider from(String value) {
        if (value == null) {
            return OLLAMA;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ollama", "" -> OLLAMA;
            case "gemini" -> GEMINI;
            case "groq" -> GROQ;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
