package software.amazon.keyword.matcher;

/**
 * Decides which matched spans {@link KeywordMachine#redact(String)} replaces when matches overlap.
 */
public enum RedactionPolicy {

    /**
     * Every code point covered by at least one match is replaced, once. Overlapping matches therefore redact the union
     * of their spans; for {@code "aa"} and {@code "aaa"} on {@code "aaaa"} the whole text is replaced.
     */
    MASK_ALL,

    /**
     * Spans are selected left to right without overlap: the match with the lowest start wins, the longest keyword
     * breaks a tie, and any match overlapping an already selected span is skipped. For {@code "aa"} and {@code "aaa"} on
     * {@code "aaaa"} only the first three code points are replaced.
     */
    LEFTMOST_LONGEST
}
