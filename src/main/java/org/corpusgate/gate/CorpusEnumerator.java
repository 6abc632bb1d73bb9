package org.corpusgate.gate;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.corpusgate.harness.CorpusFile;
import org.corpusgate.manifest.Category;

/**
 * Resolves the ordered list of corpus files for a run.
 *
 * <p>When the manifest names files, it decides both which files run and in what order; entries
 * that are not regular files under the corpus root are skipped. Without usable manifest entries
 * the corpus root is scanned recursively and sorted by relative path.
 */
public final class CorpusEnumerator {
    private final String extension;

    public CorpusEnumerator(String extension) {
        String normalized = Objects.requireNonNull(extension, "extension").trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("extension must not be blank");
        }
        this.extension = normalized;
    }

    /**
     * @param maxFiles cap applied after resolution; {@code 0} means no cap
     */
    public List<CorpusFile> resolve(Path corpusRoot, Map<String, Category> categories, int maxFiles)
        throws GateSetupException, IOException {
        Objects.requireNonNull(corpusRoot, "corpusRoot");
        Objects.requireNonNull(categories, "categories");
        if (maxFiles < 0) {
            throw new IllegalArgumentException("maxFiles must be >= 0");
        }
        if (!Files.isDirectory(corpusRoot)) {
            throw new GateSetupException(
                GateSetupException.SetupFailure.CORPUS_DIR_MISSING,
                "corpus dir not found: " + corpusRoot.toAbsolutePath().normalize()
            );
        }

        List<CorpusFile> files = fromManifest(corpusRoot, categories);
        if (files.isEmpty()) {
            files = scan(corpusRoot, categories);
        }
        if (maxFiles > 0 && files.size() > maxFiles) {
            files = files.subList(0, maxFiles);
        }
        if (files.isEmpty()) {
            throw new GateSetupException(
                GateSetupException.SetupFailure.NO_CORPUS_FILES,
                "no ." + extension + " files under: " + corpusRoot.toAbsolutePath().normalize()
            );
        }
        return List.copyOf(files);
    }

    private static List<CorpusFile> fromManifest(Path corpusRoot, Map<String, Category> categories) throws IOException {
        Path root = corpusRoot.toAbsolutePath().normalize();
        List<CorpusFile> files = new ArrayList<>(categories.size());
        for (Map.Entry<String, Category> entry : categories.entrySet()) {
            Path candidate = root.resolve(entry.getKey()).normalize();
            if (!candidate.startsWith(root) || !Files.isRegularFile(candidate)) {
                continue;
            }
            files.add(new CorpusFile(candidate, entry.getKey(), entry.getValue(), Files.size(candidate)));
        }
        return files;
    }

    private List<CorpusFile> scan(Path corpusRoot, Map<String, Category> categories) throws IOException {
        Path root = corpusRoot.toAbsolutePath().normalize();
        String suffix = "." + extension;
        List<CorpusFile> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path path, BasicFileAttributes attributes) throws IOException {
                if (path.getFileName().toString().endsWith(suffix) && Files.isRegularFile(path)) {
                    String relpath = relativize(root, path);
                    files.add(new CorpusFile(path, relpath, categories.get(relpath), Files.size(path)));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path path, IOException exception) {
                // unreadable entries are not part of the corpus
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(Comparator.comparing(CorpusFile::relpath));
        return files;
    }

    static String relativize(Path root, Path file) {
        Path relative = root.relativize(file);
        List<String> parts = new ArrayList<>(relative.getNameCount());
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }
}
