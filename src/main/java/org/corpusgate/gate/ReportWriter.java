package org.corpusgate.gate;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.corpusgate.harness.RunResult;

/**
 * Writes the details (JSON lines, appended per file) and summary artifacts of one run.
 *
 * <p>Both artifact names carry the run timestamp. Existing artifacts are never overwritten:
 * opening a writer for a timestamp whose artifacts already exist fails.
 */
public final class ReportWriter implements Closeable {
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private static final String DETAILS_SUFFIX = "_details.jsonl";
    private static final String SUMMARY_SUFFIX = "_summary.json";

    private final ArtifactPaths paths;
    private final GateArtifactRenderer renderer;
    private final BufferedWriter details;
    private boolean closed;

    private ReportWriter(ArtifactPaths paths, GateArtifactRenderer renderer, BufferedWriter details) {
        this.paths = paths;
        this.renderer = renderer;
        this.details = details;
    }

    public static String timestamp(Clock clock) {
        return LocalDateTime.now(Objects.requireNonNull(clock, "clock")).format(TIMESTAMP_FORMAT);
    }

    public static ArtifactPaths artifactPaths(Path reportsDir, String timestamp) {
        Objects.requireNonNull(reportsDir, "reportsDir");
        Objects.requireNonNull(timestamp, "timestamp");
        Path normalized = reportsDir.normalize();
        return new ArtifactPaths(
            normalized.resolve(timestamp + DETAILS_SUFFIX),
            normalized.resolve(timestamp + SUMMARY_SUFFIX)
        );
    }

    /**
     * Creates the reports directory and an empty details artifact.
     */
    public static ReportWriter open(ArtifactPaths paths, GateArtifactRenderer renderer)
        throws GateSetupException, IOException {
        Objects.requireNonNull(paths, "paths");
        Objects.requireNonNull(renderer, "renderer");
        if (Files.exists(paths.detailsJsonl()) || Files.exists(paths.summaryJson())) {
            throw new GateSetupException(
                GateSetupException.SetupFailure.ARTIFACT_EXISTS,
                "report artifacts already exist for this timestamp: " + paths.detailsJsonl()
            );
        }
        Path parent = paths.detailsJsonl().toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter details = Files.newBufferedWriter(
            paths.detailsJsonl(),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE_NEW,
            StandardOpenOption.WRITE
        );
        return new ReportWriter(paths, renderer, details);
    }

    public ArtifactPaths paths() {
        return paths;
    }

    /**
     * Appends one details record and flushes it, so a crashed run still leaves its evidence.
     */
    public void append(RunResult result) throws IOException {
        ensureOpen();
        details.write(renderer.toDetailsLine(result));
        details.write('\n');
        details.flush();
    }

    public void writeSummary(GateSummary summary, GateThresholds thresholds, GateDecision decision) throws IOException {
        ensureOpen();
        String json = renderer.toSummaryJson(summary, thresholds, decision, paths);
        Files.writeString(
            paths.summaryJson(),
            json + "\n",
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE_NEW,
            StandardOpenOption.WRITE
        );
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        details.close();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("report writer is already closed");
        }
    }

    public record ArtifactPaths(Path detailsJsonl, Path summaryJson) {
        public ArtifactPaths {
            Objects.requireNonNull(detailsJsonl, "detailsJsonl");
            Objects.requireNonNull(summaryJson, "summaryJson");
        }
    }
}
