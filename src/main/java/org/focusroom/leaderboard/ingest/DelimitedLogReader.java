package org.focusroom.leaderboard.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads the header-prefixed, comma-delimited raw logs into column-name keyed rows.
 * A missing file is an empty table.
 */
public final class DelimitedLogReader {

    private DelimitedLogReader() {}

    public static List<Map<String, String>> read(Path file) {
        if (!Files.exists(file)) {
            return Collections.emptyList();
        }
        try {
            return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LogStoreException("Failed to read " + file, e);
        }
    }

    public static List<Map<String, String>> parse(List<String> lines) {
        List<String> nonBlank = lines.stream()
            .filter(line -> !line.isBlank())
            .collect(Collectors.toList());
        if (nonBlank.size() < 2) {
            return Collections.emptyList();
        }

        String[] headers = splitLine(nonBlank.get(0));
        List<Map<String, String>> rows = new ArrayList<>(nonBlank.size() - 1);
        for (String line : nonBlank.subList(1, nonBlank.size())) {
            String[] values = splitLine(line);
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < headers.length; i++) {
                row.put(headers[i], i < values.length ? values[i] : "");
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Split on every comma, keeping trailing empty columns; values are trimmed.
     * Quotes are kept; the presence user list is unquoted by its parser.
     */
    public static String[] splitLine(String line) {
        String[] parts = line.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return parts;
    }

    /**
     * Strip one pair of surrounding quotes. A value quoted on one side only is returned as is.
     */
    public static String unquote(String value) {
        if (value != null && value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
