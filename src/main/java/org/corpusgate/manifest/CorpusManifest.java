package org.corpusgate.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Corpus manifest produced by the corpus scanner: hashes and metadata, never file content.
 *
 * <p>Decoding is lenient. Unknown fields are ignored, items without a relative path are dropped
 * and malformed optional fields fall back to empty values.
 */
public record CorpusManifest(String version, String generatedFrom, List<ManifestItem> items) {
    public CorpusManifest {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    public static CorpusManifest empty() {
        return new CorpusManifest(null, null, List.of());
    }

    public static CorpusManifest fromJson(final String json) {
        final Document document = Document.parse(Objects.requireNonNull(json, "json"));
        return fromMap(document);
    }

    public static CorpusManifest fromMap(final Map<String, Object> root) {
        Objects.requireNonNull(root, "root");
        final List<ManifestItem> items = new ArrayList<>();
        if (root.get("items") instanceof List<?> rawItems) {
            for (final Object rawItem : rawItems) {
                final ManifestItem item = ManifestItem.fromObject(rawItem);
                if (item != null) {
                    items.add(item);
                }
            }
        }
        return new CorpusManifest(optionalText(root.get("version")), optionalText(root.get("generated_from")), items);
    }

    /**
     * Relative path to category, in manifest order. A repeated path keeps its first position
     * and its last category.
     */
    public Map<String, Category> categoryByRelpath() {
        final Map<String, Category> categories = new LinkedHashMap<>();
        for (final ManifestItem item : items) {
            categories.put(item.relpath(), item.category());
        }
        return Collections.unmodifiableMap(categories);
    }

    public record ManifestItem(
            String id,
            String relpath,
            String sha256,
            Long sizeBytes,
            Category category,
            Map<String, Object> flags,
            Provenance source,
            String notes) {
        public ManifestItem {
            relpath = requireText(relpath, "relpath");
            category = category == null ? Category.UNLABELED : category;
            flags = flags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
            source = source == null ? Provenance.UNKNOWN : source;
        }

        static ManifestItem fromObject(final Object rawItem) {
            if (!(rawItem instanceof Map<?, ?> item)) {
                return null;
            }
            final String relpath = optionalText(item.get("relpath"));
            if (relpath == null) {
                return null;
            }
            return new ManifestItem(
                    optionalText(item.get("id")),
                    relpath,
                    optionalText(item.get("sha256")),
                    item.get("size_bytes") instanceof Number size ? size.longValue() : null,
                    Category.fromManifestValue(item.get("category")),
                    stringKeyed(item.get("flags")),
                    Provenance.fromObject(item.get("source")),
                    optionalText(item.get("notes")));
        }
    }

    public record Provenance(String url, String licenseNote) {
        static final Provenance UNKNOWN = new Provenance(null, null);

        static Provenance fromObject(final Object rawSource) {
            if (!(rawSource instanceof Map<?, ?> source)) {
                return UNKNOWN;
            }
            return new Provenance(optionalText(source.get("url")), optionalText(source.get("license_note")));
        }
    }

    private static Map<String, Object> stringKeyed(final Object rawValue) {
        if (!(rawValue instanceof Map<?, ?> rawMap)) {
            return Map.of();
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            if (entry.getValue() != null) {
                normalized.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return normalized;
    }

    private static String optionalText(final Object value) {
        if (!(value instanceof String text)) {
            return null;
        }
        final String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String requireText(final String value, final String fieldName) {
        final String normalized = optionalText(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }
}
