package ai.longdoc.translator.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits text into ordered spans at natural boundaries without adding or removing characters.
 *
 * <p>Within each window of {@code maxSize} characters the cut point is searched from the
 * strongest to the weakest boundary: paragraph break, line break, sentence terminator, space.
 * A boundary is only accepted when it lies at or after 70% of the window; otherwise the
 * window is cut hard at {@code maxSize}.
 */
public class BoundaryChunker {

    static final double FLOOR_RATIO = 0.7;

    private static final String PARAGRAPH_BREAK = "\n\n";
    private static final String LINE_BREAK = "\n";
    private static final String SPACE = " ";
    private static final List<String> SENTENCE_TERMINATORS = List.of(". ", "! ", "? ", ".\n", "!\n", "?\n");

    public List<String> chunk(String text, int maxSize) {
        Objects.requireNonNull(text, "text");
        if (maxSize <= 0) {
            throw new ChunkingException("maxSize must be greater than zero but was " + maxSize);
        }
        if (text.length() <= maxSize) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int floor = (int) (FLOOR_RATIO * maxSize);
        int start = 0;
        while (start < text.length()) {
            int idealEnd = start + maxSize;
            if (idealEnd >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }
            int end = start + findCut(text.substring(start, idealEnd), floor, maxSize);
            chunks.add(text.substring(start, end));
            start = end;
        }
        return List.copyOf(chunks);
    }

    /**
     * Returns the cut offset inside {@code window}, always in {@code [1, maxSize]}.
     */
    private int findCut(String window, int floor, int maxSize) {
        int position = window.lastIndexOf(PARAGRAPH_BREAK);
        if (position >= floor) {
            return position + PARAGRAPH_BREAK.length();
        }
        position = window.lastIndexOf(LINE_BREAK);
        if (position >= floor) {
            return position + LINE_BREAK.length();
        }
        position = lastSentenceTerminator(window);
        if (position >= floor) {
            return position + 2;
        }
        position = window.lastIndexOf(SPACE);
        if (position >= floor) {
            return position + SPACE.length();
        }
        return maxSize;
    }

    private int lastSentenceTerminator(String window) {
        int best = -1;
        for (String terminator : SENTENCE_TERMINATORS) {
            best = Math.max(best, window.lastIndexOf(terminator));
        }
        return best;
    }
}
