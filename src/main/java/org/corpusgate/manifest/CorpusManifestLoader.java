package org.corpusgate.manifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads corpus manifests (JSON or YAML).
 *
 * <p>A missing, unreadable or malformed manifest is not an error: the gate then runs with every
 * file unlabeled, so {@link #loadLenient(Path)} returns an empty manifest instead of failing.
 */
public final class CorpusManifestLoader {
    private CorpusManifestLoader() {}

    public static CorpusManifest loadLenient(final Path manifestPath) {
        Objects.requireNonNull(manifestPath, "manifestPath");
        if (!Files.isRegularFile(manifestPath)) {
            return CorpusManifest.empty();
        }
        try {
            final String content = Files.readString(manifestPath, StandardCharsets.UTF_8);
            return parse(content, manifestPath.getFileName().toString());
        } catch (IOException | RuntimeException recovered) {
            return CorpusManifest.empty();
        }
    }

    /**
     * Category mapping in manifest order; empty when the manifest is absent or unusable.
     */
    public static Map<String, Category> loadCategoryMap(final Path manifestPath) {
        return loadLenient(manifestPath).categoryByRelpath();
    }

    static CorpusManifest parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            return parseYaml(content);
        }
        return CorpusManifest.fromJson(content);
    }

    private static CorpusManifest parseYaml(final String content) {
        final Object root = new Yaml().load(content);
        if (!(root instanceof Map<?, ?> rawMap)) {
            return CorpusManifest.empty();
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return CorpusManifest.fromMap(normalized);
    }
}
