package ai.repocontext.analyzer.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * One-line JSON layout. MDC entries such as {@code repository} and {@code turn} become top-level
 * fields unless they collide with a reserved field name.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final Set<String> RESERVED = Set.of("timestamp", "level", "logger", "thread", "message", "error");

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256);
        builder.append('{');
        appendField(builder, "timestamp",
                ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        appendField(builder.append(','), "level", String.valueOf(event.getLevel()));
        appendField(builder.append(','), "logger", event.getLoggerName());
        appendField(builder.append(','), "thread", event.getThreadName());
        appendField(builder.append(','), "message", event.getFormattedMessage());

        for (Map.Entry<String, String> entry : sortedMdc(event).entrySet()) {
            if (!RESERVED.contains(entry.getKey())) {
                appendField(builder.append(','), entry.getKey(), entry.getValue());
            }
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            String summary = throwable.getMessage() == null
                    ? throwable.getClassName()
                    : throwable.getClassName() + ": " + throwable.getMessage();
            appendField(builder.append(','), "error", summary);
        }

        builder.append('}');
        builder.append(System.lineSeparator());
        return builder.toString();
    }

    private void appendField(StringBuilder builder, String name, String value) {
        builder.append(quote(name)).append(':').append(quote(value));
    }

    private Map<String, String> sortedMdc(ILoggingEvent event) {
        Map<String, String> map;
        try {
            map = event.getMDCPropertyMap();
        } catch (RuntimeException ex) {
            // events built outside a logger context have no MDC adapter
            return Map.of();
        }
        return map == null ? Map.of() : new TreeMap<>(map);
    }

    private String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        escaped.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('"');
        return escaped.toString();
    }
}
