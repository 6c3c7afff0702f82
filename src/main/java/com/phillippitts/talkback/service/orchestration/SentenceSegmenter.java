package com.phillippitts.talkback.service.orchestration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Incremental sentence segmentation of a streamed language-model response.
 *
 * <p>Tokens are appended as they arrive; every sentence that becomes complete is returned
 * immediately so synthesis can start before the response is finished.
 *
 * <p><b>Rules:</b>
 * <ul>
 *   <li>{@code .}, {@code !} and {@code ?} are sentence terminators; a run of them
 *       ({@code ?!}, {@code ...}) closes as one</li>
 *   <li>A terminator directly after a known abbreviation ({@code Dr}, {@code Mr}, {@code Mrs},
 *       {@code Ms}, {@code vs}, {@code etc}, {@code e.g}, {@code i.e}) does not close a sentence</li>
 *   <li>A terminator closes only when followed by whitespace or the end of the buffer;
 *       one followed by other text ({@code 4.5}, {@code example.com}) is skipped</li>
 *   <li>Sentences are trimmed; empty sentences are never emitted</li>
 * </ul>
 *
 * <p>Not thread-safe; used from the session loop only.
 */
final class SentenceSegmenter {

    private static final List<String> ABBREVIATIONS = List.of("Dr", "Mr", "Mrs", "Ms", "vs", "etc", "e.g", "i.e");

    private final StringBuilder buffer = new StringBuilder();

    /**
     * Appends a token and returns the sentences it completed, in order.
     */
    List<String> append(String token) {
        if (token == null || token.isEmpty()) {
            return List.of();
        }
        buffer.append(token);
        return drainCompleteSentences();
    }

    /**
     * Returns the remaining fragment as a final sentence and empties the buffer.
     */
    Optional<String> flush() {
        String rest = buffer.toString().trim();
        buffer.setLength(0);
        return rest.isEmpty() ? Optional.empty() : Optional.of(rest);
    }

    void reset() {
        buffer.setLength(0);
    }

    /** Text accumulated since the last emitted sentence. */
    String pending() {
        return buffer.toString();
    }

    private List<String> drainCompleteSentences() {
        List<String> sentences = new ArrayList<>();
        int searchFrom = 0;
        while (true) {
            int terminator = indexOfTerminator(searchFrom);
            if (terminator < 0) {
                break;
            }
            if (endsWithAbbreviation(terminator)) {
                searchFrom = terminator + 1;
                continue;
            }
            int end = terminator + 1;
            while (end < buffer.length() && isTerminator(buffer.charAt(end))) {
                end++;
            }
            if (end < buffer.length() && !Character.isWhitespace(buffer.charAt(end))) {
                searchFrom = end;
                continue;
            }
            String sentence = buffer.substring(0, end).trim();
            buffer.delete(0, end);
            stripLeadingWhitespace();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
            searchFrom = 0;
        }
        return sentences;
    }

    private int indexOfTerminator(int from) {
        for (int i = from; i < buffer.length(); i++) {
            if (isTerminator(buffer.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private boolean endsWithAbbreviation(int terminator) {
        for (String abbreviation : ABBREVIATIONS) {
            int start = terminator - abbreviation.length();
            if (start < 0) {
                continue;
            }
            if (!buffer.substring(start, terminator).equals(abbreviation)) {
                continue;
            }
            // Whole word only: "tvs." is not "vs."
            if (start == 0 || !Character.isLetter(buffer.charAt(start - 1))) {
                return true;
            }
        }
        return false;
    }

    private void stripLeadingWhitespace() {
        int i = 0;
        while (i < buffer.length() && Character.isWhitespace(buffer.charAt(i))) {
            i++;
        }
        buffer.delete(0, i);
    }

    private static boolean isTerminator(char c) {
        return c == '.' || c == '!' || c == '?';
    }
}
