package software.amazon.keyword.matcher;

/**
 * Configuration for a KeywordMachine.
 */
public class MachineConfiguration {

    private static final int DEFAULT_REPLACEMENT = '*';

    /**
     * Which spans redact() replaces when matches overlap.
     */
    private final RedactionPolicy redactionPolicy;

    /**
     * The code point redact() writes over each redacted code point when the caller does not supply one.
     */
    private final int replacement;

    /**
     * Empty keywords would match at every position of every text, so by default adding one is an error. Keyword lists
     * read from files often carry blank lines, and setting this flag to true makes the builder skip them instead.
     */
    private final boolean emptyKeywordsIgnored;

    private MachineConfiguration(RedactionPolicy redactionPolicy, int replacement, boolean emptyKeywordsIgnored) {
        this.redactionPolicy = redactionPolicy;
        this.replacement = replacement;
        this.emptyKeywordsIgnored = emptyKeywordsIgnored;
    }

    public static MachineConfiguration defaults() {
        return new Builder().build();
    }

    public RedactionPolicy getRedactionPolicy() {
        return redactionPolicy;
    }

    public int getReplacement() {
        return replacement;
    }

    public boolean isEmptyKeywordsIgnored() {
        return emptyKeywordsIgnored;
    }

    @Override
    public String toString() {
        return "MachineConfiguration{redactionPolicy=" + redactionPolicy
                + ", replacement=" + new String(Character.toChars(replacement))
                + ", emptyKeywordsIgnored=" + emptyKeywordsIgnored + "}";
    }

    public static class Builder {

        private RedactionPolicy redactionPolicy = RedactionPolicy.MASK_ALL;
        private int replacement = DEFAULT_REPLACEMENT;
        private boolean emptyKeywordsIgnored = false;

        public Builder withRedactionPolicy(RedactionPolicy redactionPolicy) {
            if (redactionPolicy == null) {
                throw new IllegalArgumentException("Redaction policy cannot be null");
            }
            this.redactionPolicy = redactionPolicy;
            return this;
        }

        public Builder withReplacement(int replacement) {
            if (!Character.isValidCodePoint(replacement)) {
                throw new IllegalArgumentException("Replacement is not a valid code point: " + replacement);
            }
            this.replacement = replacement;
            return this;
        }

        public Builder withEmptyKeywordsIgnored(boolean emptyKeywordsIgnored) {
            this.emptyKeywordsIgnored = emptyKeywordsIgnored;
            return this;
        }

        public MachineConfiguration build() {
            return new MachineConfiguration(redactionPolicy, replacement, emptyKeywordsIgnored);
        }
    }
}
