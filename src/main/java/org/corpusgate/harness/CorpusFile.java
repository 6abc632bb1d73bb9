package org.corpusgate.harness;

import java.nio.file.Path;
import java.util.Objects;
import org.corpusgate.manifest.Category;

/**
 * One resolved corpus file: where it is, how reports name it and which bucket it counts in.
 */
public record CorpusFile(Path path, String relpath, Category category, long sizeBytes) {
    public CorpusFile {
        Objects.requireNonNull(path, "path");
        if (relpath == null || relpath.isBlank()) {
            throw new IllegalArgumentException("relpath must not be blank");
        }
        category = category == null ? Category.UNLABELED : category;
        if (sizeBytes < 0L) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
    }
}
