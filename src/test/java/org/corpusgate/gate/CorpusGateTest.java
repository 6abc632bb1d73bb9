package org.corpusgate.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bson.Document;
import org.corpusgate.harness.InvocationResult;
import org.corpusgate.harness.ProgramInvoker;
import org.corpusgate.harness.RunResult;
import org.corpusgate.manifest.Category;
import org.corpusgate.obs.JsonEncoder;
import org.corpusgate.obs.StructuredJsonLinesLogger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusGateTest {
    static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-02-23T10:00:00Z"), ZoneOffset.UTC);
    static final String STRUCTURED_OUTPUT = "{\"sections\":[{\"content\":[{\"type\":\"paragraph\"}]}]}";

    @TempDir
    Path tempDir;

    @Test
    void smallCorpusFailsOnlyOnCorpusSize() throws Exception {
        Fixture fixture = new Fixture(tempDir).files(Category.A, 50);

        CorpusGate.GateOutcome outcome = newGate(fixture, new ByteArrayOutputStream(), Set.of())
            .run(fixture.config().build());

        assertFalse(outcome.passed());
        assertEquals(
            List.of(GateEvaluator.CORPUS_SIZE_GATE),
            outcome.decision().failedChecks().stream().map(GateCheck::gateId).toList()
        );
        assertEquals(50, outcome.summary().okCount());
        assertEquals(1.0d, outcome.summary().deterministicRate());
    }

    @Test
    void weakCategoryFailsTheGateAndArtifactsRecordIt() throws Exception {
        Fixture fixture = new Fixture(tempDir)
            .files(Category.A, 80)
            .files(Category.B, 20)
            .files(Category.C, 20);
        Set<String> failing = Set.of("A/000.hwp", "A/001.hwp", "B/000.hwp", "B/001.hwp", "B/002.hwp", "B/003.hwp");
        ByteArrayOutputStream logs = new ByteArrayOutputStream();

        CorpusGate.GateOutcome outcome = newGate(fixture, logs, failing).run(fixture.config().build());

        assertFalse(outcome.passed());
        assertEquals(
            List.of("min-success-B"),
            outcome.decision().failedChecks().stream().map(GateCheck::gateId).toList()
        );
        assertEquals(78, outcome.summary().category(Category.A).matchCount());
        assertEquals(16, outcome.summary().category(Category.B).matchCount());
        assertEquals(Map.of("encrypted", 6), outcome.summary().failuresByType());

        Path details = fixture.reports.resolve("20260223-100000_details.jsonl");
        assertEquals(details, outcome.artifacts().detailsJsonl());
        List<String> lines = Files.readAllLines(details, StandardCharsets.UTF_8);
        assertEquals(120, lines.size());
        assertEquals("A/000.hwp", Document.parse(lines.get(0)).getString("relpath"));
        assertEquals("C/019.hwp", Document.parse(lines.get(119)).getString("relpath"));

        Document summary = Document.parse(Files.readString(outcome.artifacts().summaryJson(), StandardCharsets.UTF_8));
        Document successRate = summary.get("per_category", Document.class).get("success_rate", Document.class);
        assertEquals(0.975d, ((Number) successRate.get("A")).doubleValue());
        assertEquals(0.8d, ((Number) successRate.get("B")).doubleValue());
        assertEquals(Boolean.FALSE, summary.get("gate", Document.class).getBoolean("passed"));

        String logText = logs.toString(StandardCharsets.UTF_8);
        assertTrue(logText.contains("\"message\":\"gate run started\""));
        assertTrue(logText.contains("\"relpath\":\"B/000.hwp\""));
        assertTrue(logText.contains("\"message\":\"gate run finished\""));
    }

    @Test
    void resultsFollowManifestOrder() throws Exception {
        Fixture fixture = new Fixture(tempDir).files(Category.C, 3).files(Category.A, 2);

        CorpusGate.GateOutcome outcome = newGate(fixture, new ByteArrayOutputStream(), Set.of())
            .run(fixture.config().thresholds(new GateThresholds(0, 0.95d, 0.85d, 0.80d, 0.99d)).build());

        assertTrue(outcome.passed());
        assertEquals(
            List.of("C/000.hwp", "C/001.hwp", "C/002.hwp", "A/000.hwp", "A/001.hwp"),
            outcome.results().stream().map(RunResult::relpath).toList()
        );
    }

    @Test
    void missingCorpusAbortsBeforeAnyArtifact() throws Exception {
        Fixture fixture = new Fixture(tempDir);
        ByteArrayOutputStream logs = new ByteArrayOutputStream();

        GateSetupException exception = assertThrows(
            GateSetupException.class,
            () -> newGate(fixture, logs, Set.of()).run(fixture.config().corpusDir(tempDir.resolve("absent")).build())
        );

        assertEquals(GateSetupException.SetupFailure.CORPUS_DIR_MISSING, exception.failure());
        assertFalse(Files.exists(fixture.reports));
        assertTrue(logs.toString(StandardCharsets.UTF_8).contains("\"level\":\"ERROR\""));
    }

    @Test
    void missingProgramAbortsBeforeAnyArtifact() throws Exception {
        Fixture fixture = new Fixture(tempDir).files(Category.A, 1);

        GateSetupException exception = assertThrows(
            GateSetupException.class,
            () -> newGate(fixture, new ByteArrayOutputStream(), Set.of())
                .run(fixture.config().program(tempDir.resolve("no-program")).build())
        );

        assertEquals(GateSetupException.SetupFailure.PROGRAM_MISSING, exception.failure());
        assertFalse(Files.exists(fixture.reports));
    }

    static CorpusGate newGate(Fixture fixture, ByteArrayOutputStream logs, Set<String> failingRelpaths) {
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(logs, FIXED_CLOCK, true);
        return new CorpusGate(FIXED_CLOCK, logger, config -> fakeProgram(fixture.corpus, failingRelpaths));
    }

    static ProgramInvoker fakeProgram(Path corpus, Set<String> failingRelpaths) {
        return (subcommand, file) -> {
            String relpath = CorpusEnumerator.relativize(corpus.toAbsolutePath().normalize(), file);
            if (failingRelpaths.contains(relpath)) {
                return InvocationResult.of(1, "", "error: document is encrypted", 4L);
            }
            return InvocationResult.of(0, STRUCTURED_OUTPUT, "", 4L);
        };
    }

    /**
     * Corpus directory, manifest, placeholder program and reports location under one temp dir.
     */
    static final class Fixture {
        final Path corpus;
        final Path manifest;
        final Path program;
        final Path reports;
        private final List<Map<String, Object>> items = new ArrayList<>();

        Fixture(Path root) throws IOException {
            this.corpus = root.resolve("corpus");
            this.manifest = root.resolve("manifest.json");
            this.program = Files.writeString(root.resolve("program"), "#!/bin/sh\n");
            this.reports = root.resolve("reports");
        }

        Fixture files(Category category, int count) throws IOException {
            for (int i = 0; i < count; i++) {
                String relpath = String.format("%s/%03d.hwp", category.key(), i);
                Path file = corpus.resolve(relpath);
                Files.createDirectories(file.getParent());
                Files.writeString(file, relpath);
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("relpath", relpath);
                item.put("category", category.key());
                items.add(item);
            }
            Map<String, Object> root = new LinkedHashMap<>();
            root.put("version", "1");
            root.put("items", items);
            Files.writeString(manifest, JsonEncoder.encode(root));
            return this;
        }

        GateConfig.Builder config() {
            return GateConfig.builder()
                .corpusDir(corpus)
                .manifest(manifest)
                .program(program)
                .reportsDir(reports);
        }
    }
}
