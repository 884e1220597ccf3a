package ai.repocontext.analyzer.agent;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;

final class AnalyzerPrompts {

    static final String ANALYZER_PERSONA = "You are a repository analyzer. "
            + "Analyze the repository structure and content using the provided tools. "
            + "Focus on the user's prompt and find relevant information.";

    private AnalyzerPrompts() {
    }

    static SystemMessage persona() {
        return SystemMessage.from(ANALYZER_PERSONA);
    }

    static UserMessage initialRequest(String prompt, String rootListing) {
        return UserMessage.from("Analyze the following repository structure and provide a summary, "
                + "focusing on the user's prompt: '" + prompt + "'\n\n"
                + "Repository structure:\n" + rootListing);
    }
}
