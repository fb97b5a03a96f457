package software.amazon.keyword.matcher;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * One occurrence of a keyword in scanned text. Offsets count Unicode code points from the start of the text and both
 * ends are inclusive.
 */
@Immutable
public final class KeywordMatch {

    private final String keyword;
    private final int startOffset;
    private final int endOffset;

    public KeywordMatch(final String keyword, final int startOffset, final int endOffset) {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid match range [" + startOffset + "," + endOffset + "]");
        }
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public String getKeyword() {
        return keyword;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    /**
     * @return the number of code points covered by the match
     */
    public int length() {
        return endOffset - startOffset + 1;
    }

    /**
     * @return true if the two matches cover at least one common code point
     */
    boolean overlaps(KeywordMatch other) {
        return startOffset <= other.endOffset && other.startOffset <= endOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        KeywordMatch that = (KeywordMatch) o;
        return startOffset == that.startOffset && endOffset == that.endOffset && keyword.equals(that.keyword);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, startOffset, endOffset);
    }

    @Override
    public String toString() {
        return keyword + "@[" + startOffset + "," + endOffset + "]";
    }
}
