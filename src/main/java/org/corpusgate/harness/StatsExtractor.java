package org.corpusgate.harness;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;

/**
 * Best-effort structure counts from structured output.
 *
 * <p>Expects {@code {"sections": [{"content": [{"type": "paragraph"}, ...]}, ...]}}. Output that is
 * not such a document yields no stats; it never affects the success verdict.
 */
public final class StatsExtractor {
    static final String SECTIONS = "sections";
    static final String CONTENT = "content";
    static final String TYPE = "type";
    static final String PARAGRAPH = "paragraph";
    static final String TABLE = "table";

    public Optional<StructureStats> extract(byte[] structuredOutput) {
        if (structuredOutput == null || structuredOutput.length == 0) {
            return Optional.empty();
        }
        final Document document;
        try {
            document = Document.parse(new String(structuredOutput, StandardCharsets.UTF_8));
        } catch (RuntimeException unparsable) {
            return Optional.empty();
        }

        List<?> sections = document.get(SECTIONS) instanceof List<?> list ? list : List.of();
        int paragraphs = 0;
        int tables = 0;
        for (Object section : sections) {
            if (!(section instanceof Map<?, ?> sectionMap)) {
                return Optional.empty();
            }
            if (!(sectionMap.get(CONTENT) instanceof List<?> blocks)) {
                continue;
            }
            for (Object block : blocks) {
                if (!(block instanceof Map<?, ?> blockMap)) {
                    return Optional.empty();
                }
                Object type = blockMap.get(TYPE);
                if (PARAGRAPH.equals(type)) {
                    paragraphs++;
                } else if (TABLE.equals(type)) {
                    tables++;
                }
            }
        }
        return Optional.of(new StructureStats(sections.size(), paragraphs, tables));
    }
}
