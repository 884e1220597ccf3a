package ai.repocontext.analyzer.cli;

import ai.repocontext.analyzer.agent.AnalysisResult;
import ai.repocontext.analyzer.agent.AnalyzerFactory;
import ai.repocontext.analyzer.agent.CancellationToken;
import ai.repocontext.analyzer.agent.RepositoryAnalyzer;
import ai.repocontext.analyzer.config.Config;
import ai.repocontext.analyzer.config.ConfigLoader;
import ai.repocontext.analyzer.config.SystemEnvironmentReader;
import ai.repocontext.analyzer.events.EventChannel;
import ai.repocontext.analyzer.events.WebSocketEventChannel;
import ai.repocontext.analyzer.logging.LoggingConfigurator;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and analyzer.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_ANALYSIS_FAILED = 1;
    static final int EXIT_CONFIGURATION_ERROR = 3;
    private static final Duration EVENT_CHANNEL_TIMEOUT = Duration.ofSeconds(10);

    private final ConfigLoader configLoader;
    private final AnalyzerFactory analyzerFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new AnalyzerFactory());
    }

    CliApplication(ConfigLoader configLoader, AnalyzerFactory analyzerFactory) {
        this.configLoader = configLoader;
        this.analyzerFactory = analyzerFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }

        Config config;
        RepositoryAnalyzer analyzer;
        try {
            config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), config.verbose());
            analyzer = analyzerFactory.create(config);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println("Configuration error: " + ex.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        if (!config.secrets().hasGithubToken()) {
            LOGGER.warn("GITHUB_TOKEN is not set; repository contents cannot be read");
        }
        LOGGER.info("Analyzing {} with {} (history order {})",
                config.repository(), config.llmConfig().label(), config.historyOrder());

        AnalysisResult result;
        Optional<WebSocketEventChannel> channel = openEventChannel(config.eventsUrl());
        try {
            result = analyzer.analyze(config.repository(), config.prompt(),
                    channel.map(EventChannel.class::cast), CancellationToken.none());
        } finally {
            channel.ifPresent(WebSocketEventChannel::close);
        }

        commandLine.getOut().println(result.text());
        commandLine.getOut().flush();
        LOGGER.info("Analysis finished with status {} after {} turn(s)", result.status(), result.iterations());
        return result.status().isSuccessful() ? 0 : EXIT_ANALYSIS_FAILED;
    }

    private Optional<WebSocketEventChannel> openEventChannel(Optional<URI> eventsUrl) {
        if (eventsUrl.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(WebSocketEventChannel.connect(eventsUrl.get(), EVENT_CHANNEL_TIMEOUT));
        } catch (IOException ex) {
            LOGGER.warn("Continuing without event channel: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
