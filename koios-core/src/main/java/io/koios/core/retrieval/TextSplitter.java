package io.koios.core.retrieval;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recursive character splitter. Tries paragraph breaks first, then lines,
 * then words, then single characters, and merges the pieces back into chunks
 * no longer than {@code chunkSize} that overlap by up to {@code chunkOverlap}.
 */
public final class TextSplitter {
    private static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

    private final int chunkSize;
    private final int chunkOverlap;

    public TextSplitter(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be in [0, chunkSize)");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return split(text, SEPARATORS);
    }

    private List<String> split(String text, List<String> separators) {
        String separator = separators.get(separators.size() - 1);
        List<String> remaining = List.of();
        for (int i = 0; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                remaining = separators.subList(i + 1, separators.size());
                break;
            }
        }

        List<String> chunks = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        for (String piece : pieces(text, separator)) {
            if (piece.length() < chunkSize) {
                pending.add(piece);
                continue;
            }
            if (!pending.isEmpty()) {
                chunks.addAll(merge(pending, separator));
                pending = new ArrayList<>();
            }
            if (remaining.isEmpty()) {
                chunks.add(piece);
            } else {
                chunks.addAll(split(piece, remaining));
            }
        }
        if (!pending.isEmpty()) {
            chunks.addAll(merge(pending, separator));
        }
        return chunks;
    }

    private List<String> pieces(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                pieces.add(String.valueOf(text.charAt(i)));
            }
            return pieces;
        }
        for (String piece : text.split(Pattern.quote(separator), -1)) {
            if (!piece.isEmpty()) {
                pieces.add(piece);
            }
        }
        return pieces;
    }

    private List<String> merge(List<String> pieces, String separator) {
        int separatorLength = separator.length();
        List<String> chunks = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        int total = 0;

        for (String piece : pieces) {
            int length = piece.length();
            if (total + length + (window.isEmpty() ? 0 : separatorLength) > chunkSize) {
                if (!window.isEmpty()) {
                    addChunk(chunks, window, separator);
                    while (total > chunkOverlap
                        || (total > 0 && total + length + (window.isEmpty() ? 0 : separatorLength) > chunkSize)) {
                        String dropped = window.removeFirst();
                        total -= dropped.length() + (window.isEmpty() ? 0 : separatorLength);
                    }
                }
            }
            window.addLast(piece);
            total += length + (window.size() > 1 ? separatorLength : 0);
        }
        addChunk(chunks, window, separator);
        return chunks;
    }

    private void addChunk(List<String> chunks, Deque<String> window, String separator) {
        String chunk = String.join(separator, window).trim();
        if (!chunk.isEmpty()) {
            chunks.add(chunk);
        }
    }
}
