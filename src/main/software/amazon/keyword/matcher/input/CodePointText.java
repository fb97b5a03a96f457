package software.amazon.keyword.matcher.input;

import javax.annotation.Nonnull;
import java.util.Arrays;

/**
 * Text segmented into Unicode code points, the symbol unit of the keyword automaton. Offsets reported by the matcher
 * are indexes into this sequence, so a character outside the Basic Multilingual Plane counts once, not twice as it
 * would in a Java {@code char} index.
 */
public class CodePointText {

    private final int[] codePoints;

    private CodePointText(int[] codePoints) {
        this.codePoints = codePoints;
    }

    public static CodePointText of(@Nonnull final String text) {
        return new CodePointText(text.codePoints().toArray());
    }

    public int length() {
        return codePoints.length;
    }

    public boolean isEmpty() {
        return codePoints.length == 0;
    }

    public int codePointAt(int index) {
        return codePoints[index];
    }

    /**
     * @return a copy of the code points, safe to modify
     */
    public int[] toArray() {
        return Arrays.copyOf(codePoints, codePoints.length);
    }

    /**
     * Number of code points in a string, without segmenting it.
     */
    public static int lengthOf(@Nonnull final String text) {
        return text.codePointCount(0, text.length());
    }

    /**
     * @return the code point index of the first surrogate not paired with its other half, or -1 if there is none
     */
    public static int indexOfUnpairedSurrogate(@Nonnull final String text) {
        int index = 0;
        for (int offset = 0; offset < text.length(); index++) {
            final int codePoint = text.codePointAt(offset);
            if (Character.getType(codePoint) == Character.SURROGATE) {
                return index;
            }
            offset += Character.charCount(codePoint);
        }
        return -1;
    }

    @Override
    public String toString() {
        return new String(codePoints, 0, codePoints.length);
    }
}
