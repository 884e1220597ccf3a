package ai.repocontext.analyzer.cli;

import ai.repocontext.analyzer.agent.HistoryOrder;
import ai.repocontext.analyzer.config.LogFormat;
import java.net.URI;
import picocli.CommandLine;

@CommandLine.Command(name = "repo-context-analyzer", mixinStandardHelpOptions = true,
        description = "Answers a prompt about a GitHub repository by letting an LLM browse its contents")
public class CliArguments {

    @CommandLine.Option(names = {"-r", "--repo"}, description = "Repository as owner/name or URL", paramLabel = "REPO")
    private String repository;

    @CommandLine.Option(names = {"-p", "--prompt"}, description = "Question to answer about the repository", paramLabel = "TEXT")
    private String prompt;

    @CommandLine.Option(names = "--branch", description = "Branch, tag or commit to read (defaults to the repository default branch)", paramLabel = "REF")
    private String branch;

    @CommandLine.Option(names = "--events-url", description = "WebSocket relay receiving file-viewed events", paramLabel = "URL")
    private URI eventsUrl;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json",
            converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--history-order", description = "Tool reply ordering: results-first or assistant-first (default: assistant-first for groq, results-first otherwise)",
            converter = OptionConverters.HistoryOrderConverter.class)
    private HistoryOrder historyOrder;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public String repository() {
        return repository;
    }

    public String prompt() {
        return prompt;
    }

    public String branch() {
        return branch;
    }

    public URI eventsUrl() {
        return eventsUrl;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public HistoryOrder historyOrder() {
        return historyOrder;
    }

    public boolean verbose() {
        return verbose;
    }
}
