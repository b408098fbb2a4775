package io.mnemos.core.tool;

import io.mnemos.core.embedding.TextChunk;
import io.mnemos.core.embedding.TextChunker;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless handlers referenced by class and method name from the bundled {@code builtin} definitions.
 */
public final class BuiltinHandlers {

    private BuiltinHandlers() {
    }

    public static Map<String, Object> currentTime(Map<String, Object> input) {
        String zone = ToolInputs.string(input, "timezone", "UTC");
        ZonedDateTime now = ZonedDateTime.now(ZoneId.of(zone));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("timezone", now.getZone().getId());
        result.put("iso", now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        result.put("day_of_week", now.getDayOfWeek().toString());
        return result;
    }

    public static Map<String, Object> chunkText(Map<String, Object> input) {
        String text = ToolInputs.required(input, "text");
        TextChunker chunker = new TextChunker(
            ToolInputs.integer(input, "chunk_size", TextChunker.DEFAULT_SIZE),
            ToolInputs.integer(input, "chunk_overlap", TextChunker.DEFAULT_OVERLAP),
            ToolInputs.string(input, "separator", "\n")
        );
        List<Map<String, Object>> chunks = new ArrayList<>();
        for (TextChunk chunk : chunker.chunk(text)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("index", chunk.index());
            row.put("text", chunk.text());
            row.put("start_char", chunk.startChar());
            row.put("end_char", chunk.endChar());
            row.put("char_count", chunk.charCount());
            chunks.add(row);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", chunks.size());
        result.put("chunks", chunks);
        return result;
    }
}
