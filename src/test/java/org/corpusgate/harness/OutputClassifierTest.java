package org.corpusgate.harness;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class OutputClassifierTest {
    private final OutputClassifier classifier = new OutputClassifier();

    @Test
    void textRulesApplyInPriorityOrder() {
        assertEquals(ErrorKind.ENCRYPTED, classifier.classify("Distribution document is ENCRYPTED", 1));
        assertEquals(ErrorKind.ENCRYPTED, classifier.classify("unsupported encryption scheme", 1));
        assertEquals(ErrorKind.DISTRIBUTION, classifier.classify("distribution doc, size limit too", 1));
        assertEquals(ErrorKind.SIZE_LIMIT, classifier.classify("record Limit Exceeded", 1));
        assertEquals(ErrorKind.SIZE_LIMIT, classifier.classify("SizeLimit reached", 1));
    }

    @Test
    void timeoutIsDecidedByExitStatusOnly() {
        assertEquals(ErrorKind.TIMEOUT, classifier.classify("", InvocationResult.TIMEOUT_EXIT_CODE));
        assertEquals(ErrorKind.PARSE_ERROR, classifier.classify("operation timeout while reading", 1));
    }

    @Test
    void textMatchWinsOverTimeoutExitStatus() {
        assertEquals(
            ErrorKind.ENCRYPTED,
            classifier.classify("partial: file is encrypted", InvocationResult.TIMEOUT_EXIT_CODE)
        );
    }

    @Test
    void fallsBackToParseError() {
        assertEquals(ErrorKind.PARSE_ERROR, classifier.classify("unexpected record tag 0x42", 101));
        assertEquals(ErrorKind.PARSE_ERROR, classifier.classify((String) null, 1));
    }

    @Test
    void combinesStderrBeforeStdoutAcrossInvocations() {
        List<InvocationResult> invocations = List.of(
            InvocationResult.of(0, "info-out", "", 1L),
            InvocationResult.of(2, "json-out", "json-err", 1L)
        );

        assertEquals("json-err\ninfo-outjson-out", OutputClassifier.combinedText(invocations));
        assertEquals(ErrorKind.PARSE_ERROR, classifier.classify(invocations, 2));
    }
}
