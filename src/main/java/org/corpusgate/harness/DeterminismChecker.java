package org.corpusgate.harness;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Compares two independent invocations by the SHA-256 of their standard output.
 */
public final class DeterminismChecker {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    public Verdict compare(InvocationResult first, InvocationResult second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        return new Verdict(first.stdoutSha256(), second.stdoutSha256());
    }

    public static String sha256Hex(byte[] content) {
        MessageDigest digest = newSha256();
        return toHex(digest.digest(Objects.requireNonNull(content, "content")));
    }

    static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm is unavailable", e);
        }
    }

    static String toHex(byte[] bytes) {
        char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int value = bytes[i] & 0xFF;
            chars[i * 2] = HEX[value >>> 4];
            chars[i * 2 + 1] = HEX[value & 0x0F];
        }
        return new String(chars);
    }

    public record Verdict(String firstSha256, String secondSha256) {
        public Verdict {
            Objects.requireNonNull(firstSha256, "firstSha256");
            Objects.requireNonNull(secondSha256, "secondSha256");
        }

        public boolean deterministic() {
            return firstSha256.equals(secondSha256);
        }
    }
}
