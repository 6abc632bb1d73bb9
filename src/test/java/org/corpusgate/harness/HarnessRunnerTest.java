package org.corpusgate.harness;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.corpusgate.manifest.Category;
import org.junit.jupiter.api.Test;

class HarnessRunnerTest {
    private static final String STRUCTURED_OUTPUT =
        "{\"sections\":[{\"content\":[{\"type\":\"paragraph\"},{\"type\":\"table\"}]}]}";
    private static final CorpusFile FILE = new CorpusFile(Path.of("/corpus/a/doc.hwp"), "a/doc.hwp", Category.A, 4096L);

    @Test
    void successfulFileRecordsHashesAndStats() {
        ScriptedInvoker invoker = new ScriptedInvoker()
            .respond("info", InvocationResult.of(0, "version 5", "", 3L))
            .respond("json", InvocationResult.of(0, STRUCTURED_OUTPUT, "", 10L));

        RunResult result = new HarnessRunner(invoker, false).run(FILE);

        assertTrue(result.ok());
        assertTrue(result.errorKind().isEmpty());
        assertEquals(Boolean.TRUE, result.deterministic().orElseThrow());
        assertTrue(result.isDeterministicSuccess());
        assertEquals(DeterminismChecker.sha256Hex(STRUCTURED_OUTPUT.getBytes(StandardCharsets.UTF_8)),
            result.outSha256A().orElseThrow());
        assertEquals(new StructureStats(1, 1, 1), result.stats().orElseThrow());
        assertEquals(23L, result.timingMillis());
        assertEquals(4096L, result.sizeBytes());
        assertEquals(List.of("info", "json", "json"), invoker.calls());
        assertTrue(result.mdDeterministic().isEmpty());
    }

    @Test
    void differingStructuredOutputIsSuccessButNotDeterministic() {
        ScriptedInvoker invoker = new ScriptedInvoker()
            .respond("info", InvocationResult.of(0, "", "", 1L))
            .respond("json", InvocationResult.of(0, "{\"sections\":[]}", "", 1L))
            .respond("json", InvocationResult.of(0, "{\"sections\":[], \"ts\": 1}", "", 1L));

        RunResult result = new HarnessRunner(invoker, false).run(FILE);

        assertTrue(result.ok());
        assertEquals(Boolean.FALSE, result.deterministic().orElseThrow());
        assertFalse(result.isDeterministicSuccess());
    }

    @Test
    void timeoutWithoutMatchingTextIsClassifiedAsTimeout() {
        ScriptedInvoker invoker = new ScriptedInvoker()
            .respond("info", InvocationResult.of(0, "", "", 2L))
            .respond("json", InvocationResult.of(InvocationResult.TIMEOUT_EXIT_CODE, "{\"sect", "", 30_000L));

        RunResult result = new HarnessRunner(invoker, false).run(FILE);

        assertFalse(result.ok());
        assertEquals(ErrorKind.TIMEOUT, result.errorKind().orElseThrow());
        assertTrue(result.deterministic().isEmpty());
        assertTrue(result.stats().isEmpty());
        assertEquals(60_002L, result.timingMillis());
    }

    @Test
    void failureTextAnywhereDecidesTheKind() {
        ScriptedInvoker invoker = new ScriptedInvoker()
            .respond("info", InvocationResult.of(1, "", "Error: document is distribution-only", 1L))
            .respond("json", InvocationResult.of(0, STRUCTURED_OUTPUT, "", 1L));

        RunResult result = new HarnessRunner(invoker, false).run(FILE);

        assertFalse(result.ok());
        assertEquals(ErrorKind.DISTRIBUTION, result.errorKind().orElseThrow());
    }

    @Test
    void markdownInvocationsRunOnlyWhenEnabled() {
        ScriptedInvoker invoker = new ScriptedInvoker()
            .respond("info", InvocationResult.of(0, "", "", 1L))
            .respond("json", InvocationResult.of(0, STRUCTURED_OUTPUT, "", 1L))
            .respond("markdown", InvocationResult.of(0, "# Title", "", 1L))
            .respond("markdown", InvocationResult.of(0, "# Title ", "", 1L));

        RunResult result = new HarnessRunner(invoker, true).run(FILE);

        assertEquals(List.of("info", "json", "json", "markdown", "markdown"), invoker.calls());
        assertTrue(result.ok());
        assertEquals(Boolean.FALSE, result.mdDeterministic().orElseThrow());
        assertTrue(result.mdSha256A().isPresent());
        assertEquals(Boolean.TRUE, result.deterministic().orElseThrow());
        assertEquals(5L, result.timingMillis());
    }

    @Test
    void failingMarkdownFailsTheFile() {
        ScriptedInvoker invoker = new ScriptedInvoker()
            .respond("info", InvocationResult.of(0, "", "", 1L))
            .respond("json", InvocationResult.of(0, STRUCTURED_OUTPUT, "", 1L))
            .respond("markdown", InvocationResult.of(3, "", "", 1L));

        RunResult result = new HarnessRunner(invoker, true).run(FILE);

        assertFalse(result.ok());
        assertEquals(ErrorKind.PARSE_ERROR, result.errorKind().orElseThrow());
        assertTrue(result.mdDeterministic().isEmpty());
    }

    @Test
    void dominantExitCodeFollowsPriorityOrder() {
        InvocationResult ok = InvocationResult.of(0, "", "", 0L);
        InvocationResult timedOut = InvocationResult.of(InvocationResult.TIMEOUT_EXIT_CODE, "", "", 0L);
        InvocationResult failed = InvocationResult.of(2, "", "", 0L);

        assertEquals(2, HarnessRunner.dominantExitCode(ok, failed, null, null, timedOut));
        assertEquals(124, HarnessRunner.dominantExitCode(timedOut, failed, null, null, ok));
        assertEquals(124, HarnessRunner.dominantExitCode(ok, ok, null, null, timedOut));
        assertEquals(0, HarnessRunner.dominantExitCode(ok, ok, null, null, ok));
    }

    /**
     * Replays queued results per subcommand; the last queued result repeats.
     */
    private static final class ScriptedInvoker implements ProgramInvoker {
        private final Map<String, List<InvocationResult>> responses = new HashMap<>();
        private final Map<String, Integer> served = new HashMap<>();
        private final List<String> calls = new ArrayList<>();

        ScriptedInvoker respond(String subcommand, InvocationResult result) {
            responses.computeIfAbsent(subcommand, ignored -> new ArrayList<>()).add(result);
            return this;
        }

        List<String> calls() {
            return calls;
        }

        @Override
        public InvocationResult invoke(String subcommand, Path file) {
            calls.add(subcommand);
            List<InvocationResult> queued = responses.get(subcommand);
            if (queued == null) {
                throw new AssertionError("unexpected subcommand " + subcommand);
            }
            int index = served.merge(subcommand, 1, Integer::sum) - 1;
            return queued.get(Math.min(index, queued.size() - 1));
        }
    }
}
