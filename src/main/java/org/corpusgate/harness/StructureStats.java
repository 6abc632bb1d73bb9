package org.corpusgate.harness;

/**
 * Structural counts read from a structured-output document.
 */
public record StructureStats(int sections, int paragraphs, int tables) {
    public StructureStats {
        if (sections < 0 || paragraphs < 0 || tables < 0) {
            throw new IllegalArgumentException("structure counts must be >= 0");
        }
    }
}
