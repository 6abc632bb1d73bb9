package org.corpusgate.harness;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps the captured output of a failed file to exactly one {@link ErrorKind}.
 *
 * <p>Rules are evaluated top-down and the first match wins. The text rules look at output only
 * and ignore exit status; the timeout rule looks at exit status only. A timed-out invocation
 * whose partial output mentions encryption is therefore classified as encrypted.
 */
public final class OutputClassifier {
    private static final List<Rule> DEFAULT_RULES = List.of(
        Rule.textContainsAny(ErrorKind.ENCRYPTED, "encrypted", "encryption"),
        Rule.textContainsAny(ErrorKind.DISTRIBUTION, "distribution"),
        Rule.textContainsAny(ErrorKind.SIZE_LIMIT, "size limit", "sizelimit", "limit exceeded"),
        Rule.exitCode(ErrorKind.TIMEOUT, InvocationResult.TIMEOUT_EXIT_CODE)
    );

    private final List<Rule> rules;
    private final ErrorKind fallback;

    public OutputClassifier() {
        this(DEFAULT_RULES, ErrorKind.PARSE_ERROR);
    }

    OutputClassifier(List<Rule> rules, ErrorKind fallback) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    /**
     * Classifies a failed file from all of its invocations.
     *
     * @param invocations every invocation performed for the file, in execution order
     * @param dominantExitCode exit status that stands for the file as a whole
     */
    public ErrorKind classify(List<InvocationResult> invocations, int dominantExitCode) {
        Objects.requireNonNull(invocations, "invocations");
        return classify(combinedText(invocations), dominantExitCode);
    }

    public ErrorKind classify(String capturedText, int dominantExitCode) {
        String lowered = capturedText == null ? "" : capturedText.toLowerCase(Locale.ROOT);
        for (Rule rule : rules) {
            if (rule.matches(lowered, dominantExitCode)) {
                return rule.kind();
            }
        }
        return fallback;
    }

    /**
     * All standard error followed by all standard output.
     */
    static String combinedText(List<InvocationResult> invocations) {
        StringBuilder stderr = new StringBuilder();
        StringBuilder stdout = new StringBuilder();
        for (InvocationResult invocation : invocations) {
            stderr.append(new String(invocation.stderr(), StandardCharsets.UTF_8));
            stdout.append(new String(invocation.stdout(), StandardCharsets.UTF_8));
        }
        return stderr.append('\n').append(stdout).toString();
    }

    interface Rule {
        ErrorKind kind();

        boolean matches(String loweredText, int dominantExitCode);

        static Rule textContainsAny(ErrorKind kind, String... phrases) {
            List<String> needles = List.of(phrases);
            return new Rule() {
                @Override
                public ErrorKind kind() {
                    return kind;
                }

                @Override
                public boolean matches(String loweredText, int dominantExitCode) {
                    for (String needle : needles) {
                        if (loweredText.contains(needle)) {
                            return true;
                        }
                    }
                    return false;
                }
            };
        }

        static Rule exitCode(ErrorKind kind, int expectedExitCode) {
            return new Rule() {
                @Override
                public ErrorKind kind() {
                    return kind;
                }

                @Override
                public boolean matches(String loweredText, int dominantExitCode) {
                    return dominantExitCode == expectedExitCode;
                }
            };
        }
    }
}
