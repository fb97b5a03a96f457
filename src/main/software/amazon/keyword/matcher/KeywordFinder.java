package software.amazon.keyword.matcher;

import software.amazon.keyword.matcher.input.CodePointText;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Drives a linked trie over text one code point at a time and reports the keywords ending at each position.
 */
final class KeywordFinder {

    private KeywordFinder() { }

    /**
     * Return every occurrence of every keyword, overlapping ones included.
     *
     * @param text the text to scan
     * @param trie the linked trie
     * @return matches ordered by end offset. The list may be empty but never null.
     */
    static List<KeywordMatch> findAll(final CodePointText text, final KeywordTrie trie) {
        final ScanTask task = new ScanTask(trie, text);
        while (task.symbolsRemain()) {
            task.step();
        }
        return task.getMatches();
    }

    /**
     * Scan only as far as the first position where any keyword ends.
     *
     * @return the first match reported by a full scan, if any
     */
    static Optional<KeywordMatch> findFirst(final CodePointText text, final KeywordTrie trie) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        final ScanTask task = new ScanTask(trie, text);
        while (task.symbolsRemain()) {
            if (task.step()) {
                return Optional.of(task.getMatches().get(0));
            }
        }
        return Optional.empty();
    }

    static List<KeywordMatch> findAll(final String text, final KeywordTrie trie) {
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        return findAll(CodePointText.of(text), trie);
    }
}
