package software.amazon.keyword.matcher;

import software.amazon.keyword.matcher.input.CodePointText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Replaces matched spans of a text with a replacement code point repeated to the span's length. The text never
 * changes length in code points, so offsets of spans not yet applied stay valid.
 */
final class Redactor {

    // lowest start first; among equal starts, the longest keyword first
    private static final Comparator<KeywordMatch> LEFTMOST_LONGEST_ORDER =
            Comparator.comparingInt(KeywordMatch::getStartOffset)
                    .thenComparing(Comparator.comparingInt(KeywordMatch::length).reversed());

    private static final Comparator<KeywordMatch> DESCENDING_START =
            Comparator.comparingInt(KeywordMatch::getStartOffset).reversed();

    private Redactor() { }

    static String redact(final CodePointText text, final List<KeywordMatch> matches, final RedactionPolicy policy,
                         final int replacement) {
        if (matches.isEmpty()) {
            return text.toString();
        }

        final List<KeywordMatch> spans = policy == RedactionPolicy.LEFTMOST_LONGEST
                ? selectLeftmostLongest(matches)
                : new ArrayList<>(matches);
        spans.sort(DESCENDING_START);

        final int[] codePoints = text.toArray();
        final boolean[] redacted = new boolean[codePoints.length];
        for (KeywordMatch span : spans) {
            for (int i = span.getStartOffset(); i <= span.getEndOffset(); i++) {
                // a code point already covered by a later span is left as it is
                if (!redacted[i]) {
                    codePoints[i] = replacement;
                    redacted[i] = true;
                }
            }
        }
        return new String(codePoints, 0, codePoints.length);
    }

    private static List<KeywordMatch> selectLeftmostLongest(final List<KeywordMatch> matches) {
        final List<KeywordMatch> candidates = new ArrayList<>(matches);
        candidates.sort(LEFTMOST_LONGEST_ORDER);

        final List<KeywordMatch> selected = new ArrayList<>();
        KeywordMatch last = null;
        for (KeywordMatch candidate : candidates) {
            if (last == null || !last.overlaps(candidate)) {
                selected.add(candidate);
                last = candidate;
            }
        }
        return selected;
    }
}
