package org.corpusgate.harness;

/**
 * Classified reason for a failed corpus file.
 */
public enum ErrorKind {
    ENCRYPTED("encrypted"),
    DISTRIBUTION("distribution"),
    SIZE_LIMIT("size_limit"),
    TIMEOUT("timeout"),
    PARSE_ERROR("parse_error");

    private final String key;

    ErrorKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
