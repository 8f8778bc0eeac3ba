package com.autoposter.variation;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Pulls the lines that explain a failure out of ffmpeg's console output.
 */
public final class DiagnosticParser {

    private static final List<String> MARKERS = List.of(
            "error", "invalid", "no such file", "not found", "unknown encoder",
            "permission denied", "could not", "failed", "unable to");

    private static final int MAX_LINES = 5;

    private DiagnosticParser() {
    }

    public static String parse(String output) {
        if (output == null || output.isBlank()) {
            return "";
        }
        List<String> lines = output.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());

        List<String> relevant = lines.stream()
                .filter(DiagnosticParser::isRelevant)
                .collect(Collectors.toList());

        // Nothing recognisable, fall back to the tail of the output
        List<String> picked = relevant.isEmpty() ? lines : relevant;
        int from = Math.max(0, picked.size() - MAX_LINES);
        return String.join(" | ", picked.subList(from, picked.size()));
    }

    private static boolean isRelevant(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return MARKERS.stream().anyMatch(lower::contains);
    }
}
