package org.corpusgate.obs;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-lines logger for gate progress and diagnostics.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.closed = false;
    }

    /**
     * Logger bound to {@code System.err}; closing it flushes but leaves the stream open.
     */
    public static StructuredJsonLinesLogger toStandardError(Clock clock) {
        OutputStream nonClosing = new FilterOutputStream(System.err) {
            @Override
            public void close() throws IOException {
                flush();
            }
        };
        return new StructuredJsonLinesLogger(nonClosing, clock, true);
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        String safeLevel = normalizeLevel(level);
        String safeMessage = message == null ? "" : message;
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", safeLevel);
        event.put("message", safeMessage);
        event.putAll(safeCorrelation.asFields());
        for (Map.Entry<String, ?> entry : safeFields.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank() || event.containsKey(key)) {
                continue;
            }
            event.put(key, entry.getValue());
        }

        writeLine(JsonEncoder.encode(event));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase(Locale.ROOT);
    }
}
