package software.amazon.keyword.matcher;

import software.amazon.keyword.matcher.input.CodePointText;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents the state of one scan of a text through a linked trie. Each scan gets its own task, so concurrent scans
 * of the same machine share nothing mutable.
 */
class ScanTask {

    private final KeywordTrie trie;
    final CodePointText text;

    // where the automaton is after the last consumed code point
    private KeywordState cursor;
    private int position = 0;

    private final List<KeywordMatch> matches = new ArrayList<>();

    ScanTask(final KeywordTrie trie, final CodePointText text) {
        this.trie = trie;
        this.text = text;
        this.cursor = trie.getRoot();
    }

    boolean symbolsRemain() {
        return position < text.length();
    }

    /**
     * Consume the next code point and collect the matches ending on it.
     *
     * @return true if at least one keyword ends at the consumed code point
     */
    boolean step() {
        final int codePoint = text.codePointAt(position);
        while (!cursor.hasChild(codePoint) && cursor.getId() != KeywordTrie.ROOT) {
            cursor = trie.getState(cursor.getFail());
        }
        final int next = cursor.getChild(codePoint);
        if (next != CodePointMap.NO_STATE) {
            cursor = trie.getState(next);
        }

        final List<String> output = cursor.getOutput();
        for (int i = 0; i < output.size(); i++) {
            matches.add(new KeywordMatch(output.get(i), position - cursor.getOutputLength(i) + 1, position));
        }
        position++;
        return !output.isEmpty();
    }

    List<KeywordMatch> getMatches() {
        return matches;
    }
}
