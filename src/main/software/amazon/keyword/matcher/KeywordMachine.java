package software.amazon.keyword.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.keyword.matcher.input.CodePointText;
import software.amazon.keyword.matcher.table.KeywordTable;
import software.amazon.keyword.matcher.table.MalformedTableException;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 *  An Aho-Corasick automaton that finds every occurrence of a fixed set of keywords in a single pass over a text,
 *  at a cost proportional to the length of the text plus the number of matches, however many keywords there are.
 *
 *  Machines are made by a {@link Builder}, which collects the keywords into a trie and then computes the failure
 *  links, or by {@link #fromTable(KeywordTable)}, which restores a machine exported with {@link #toTable()}. Either
 *  way a KeywordMachine is complete when it is constructed and is never modified afterwards, so any number of threads
 *  may search it without locking. Adding or removing a keyword means building a new machine.
 *
 *  Symbols are Unicode code points and every offset reported is a code point index. No normalization is applied;
 *  callers wanting case-insensitive matching should fold both keywords and text first.
 */
@ThreadSafe
@Immutable
public class KeywordMachine {

    private static final Logger LOG = LoggerFactory.getLogger(KeywordMachine.class);

    private final KeywordTrie trie;
    private final MachineConfiguration configuration;

    private KeywordMachine(final KeywordTrie trie, final MachineConfiguration configuration) {
        this.trie = trie;
        this.configuration = configuration;
    }

    public static Builder builder() {
        return new Builder(MachineConfiguration.defaults());
    }

    public static Builder builder(@Nonnull final MachineConfiguration configuration) {
        return new Builder(configuration);
    }

    /**
     * Build a machine with the default configuration.
     *
     * @param keywords the keywords, none of them empty
     * @return the machine
     */
    public static KeywordMachine of(final String... keywords) {
        return builder().addKeywords(Arrays.asList(keywords)).build();
    }

    public static KeywordMachine of(final Collection<String> keywords) {
        return builder().addKeywords(keywords).build();
    }

    /**
     * Return every occurrence of every keyword in the text, overlapping occurrences included.
     *
     * @param text the text to scan
     * @return matches ordered by end offset. Keywords ending at the same offset are listed longest first. The list may
     *         be empty but never null.
     */
    public List<KeywordMatch> search(@Nonnull final String text) {
        return Collections.unmodifiableList(KeywordFinder.findAll(text, trie));
    }

    /**
     * Scan only as far as the first offset at which a keyword ends.
     *
     * @param text the text to scan
     * @return the first match {@link #search(String)} would return, if any
     */
    public Optional<KeywordMatch> findFirst(@Nonnull final String text) {
        return KeywordFinder.findFirst(CodePointText.of(text), trie);
    }

    /**
     * @param text the text to scan
     * @return true if any keyword occurs in the text
     */
    public boolean containsAny(@Nonnull final String text) {
        return findFirst(text).isPresent();
    }

    /**
     * Replace each matched code point with the configured replacement, choosing spans with the configured
     * {@link RedactionPolicy}.
     *
     * @param text the text to redact
     * @return the redacted text, which has as many code points as the original
     */
    public String redact(@Nonnull final String text) {
        return redact(text, configuration.getReplacement());
    }

    /**
     * @param text the text to redact
     * @param replacement the code point to write over each redacted code point
     * @return the redacted text, which has as many code points as the original
     */
    public String redact(@Nonnull final String text, final int replacement) {
        if (!Character.isValidCodePoint(replacement)) {
            throw new IllegalArgumentException("Replacement is not a valid code point: " + replacement);
        }
        final CodePointText symbols = CodePointText.of(text);
        return Redactor.redact(symbols, KeywordFinder.findAll(symbols, trie), configuration.getRedactionPolicy(),
                replacement);
    }

    /**
     * @return the distinct keywords. For a built machine they are in the order they were first added; for a machine
     *         restored from a table, in the breadth-first order of the states that end them, shorter keywords first
     */
    public Set<String> getKeywords() {
        return trie.getKeywords();
    }

    /**
     * @return the number of states, root included
     */
    public int getStateCount() {
        return trie.size();
    }

    public MachineConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Export the machine in a form that can be stored and later passed to {@link #fromTable(KeywordTable)}. Only the
     * children and terminal keywords of each state are exported; failure links are recomputed on import.
     *
     * @return the table, with the root at id 0
     */
    public KeywordTable toTable() {
        return TableExporter.export(trie);
    }

    /**
     * Restore a machine from a table, with the default configuration.
     *
     * @throws MalformedTableException if the table has no root, refers to missing states, is not a tree, or lists an
     *         output keyword its state cannot produce
     */
    public static KeywordMachine fromTable(final KeywordTable table) {
        return fromTable(table, MachineConfiguration.defaults());
    }

    public static KeywordMachine fromTable(final KeywordTable table, @Nonnull final MachineConfiguration configuration) {
        final KeywordTrie trie = TableImporter.importTable(table);
        LOG.debug("Imported keyword machine with {} keywords and {} states", trie.getKeywords().size(), trie.size());
        return new KeywordMachine(trie, configuration);
    }

    /**
     * Like {@link #fromTable(KeywordTable)}, but reports a malformed table as an empty result instead of an exception,
     * for callers that fall back to rebuilding from their keyword list.
     *
     * @return the machine, or empty if the table is malformed
     */
    public static Optional<KeywordMachine> createFromTable(final KeywordTable table) {
        return createFromTable(table, MachineConfiguration.defaults());
    }

    public static Optional<KeywordMachine> createFromTable(final KeywordTable table,
                                                           @Nonnull final MachineConfiguration configuration) {
        try {
            return Optional.of(fromTable(table, configuration));
        } catch (MalformedTableException e) {
            LOG.warn("Rejected keyword table: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // visible for testing
    KeywordTrie getTrie() {
        return trie;
    }

    @Override
    public String toString() {
        return "KeywordMachine{keywords=" + trie.getKeywords().size() + ", states=" + trie.size() + "}";
    }

    /**
     * Collects keywords for a machine. Single use: once {@link #build()} has returned, the builder rejects further
     * keywords and further builds.
     */
    public static class Builder {

        private final MachineConfiguration configuration;
        private final KeywordTrie trie = new KeywordTrie();
        private boolean built = false;

        Builder(@Nonnull final MachineConfiguration configuration) {
            this.configuration = configuration;
        }

        /**
         * Add a keyword. Adding a keyword that is already present changes nothing.
         *
         * @param keyword the keyword
         * @return this builder
         * @throws IllegalArgumentException if the keyword is null, or empty while empty keywords are not ignored, or
         *         contains an unpaired surrogate
         * @throws IllegalStateException if the machine has already been built
         */
        public Builder addKeyword(final String keyword) {
            checkNotBuilt();
            if (keyword != null && keyword.isEmpty() && configuration.isEmptyKeywordsIgnored()) {
                LOG.debug("Skipping empty keyword");
                return this;
            }
            trie.insert(keyword);
            return this;
        }

        public Builder addKeywords(@Nonnull final Collection<String> keywords) {
            for (String keyword : keywords) {
                addKeyword(keyword);
            }
            return this;
        }

        /**
         * Compute the failure links and hand over the finished machine.
         *
         * @return the machine
         * @throws IllegalStateException if called a second time
         */
        public KeywordMachine build() {
            checkNotBuilt();
            built = true;
            FailureLinker.link(trie);
            LOG.debug("Built keyword machine with {} keywords and {} states", trie.getKeywords().size(), trie.size());
            return new KeywordMachine(trie, configuration);
        }

        private void checkNotBuilt() {
            if (built) {
                throw new IllegalStateException("This builder has already built its machine");
            }
        }
    }
}
