package ai.repocontext.analyzer.cli;

import ai.repocontext.analyzer.agent.HistoryOrder;
import ai.repocontext.analyzer.config.LogFormat;
import picocli.CommandLine;

/**
 * picocli converters for the enum-valued options.
 */
final class OptionConverters {

    private OptionConverters() {
    }

    static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return LogFormat.from(value);
        }
    }

    static final class HistoryOrderConverter implements CommandLine.ITypeConverter<HistoryOrder> {
        @Override
        public HistoryOrder convert(String value) {
            return HistoryOrder.from(value);
        }
    }
}
