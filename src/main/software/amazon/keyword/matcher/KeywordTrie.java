package software.amazon.keyword.matcher;

import software.amazon.keyword.matcher.input.CodePointText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The arena that owns every state of a keyword automaton. States are addressed by their index in the arena and the
 * root is always state 0. Insertion only adds children and terminal keywords; failure links are left to
 * {@link FailureLinker}, and once it has run the trie refuses further insertions.
 */
class KeywordTrie {

    static final int ROOT = 0;

    private final List<KeywordState> states = new ArrayList<>();
    private final Set<String> keywords = new LinkedHashSet<>();
    private boolean linked = false;

    KeywordTrie() {
        states.add(new KeywordState(ROOT, 0));
    }

    /**
     * Add a keyword, creating a state for each code point transition not yet present.
     *
     * @param keyword the keyword, at least one code point long
     * @return false if the keyword was already present, in which case nothing changed
     * @throws IllegalArgumentException if the keyword is null or empty
     * @throws IllegalStateException if the trie has already been linked
     */
    boolean insert(final String keyword) {
        if (keyword == null || keyword.isEmpty()) {
            throw new IllegalArgumentException("Keyword must contain at least one character");
        }
        checkNotLinked();

        // validate before touching any state so that a bad keyword leaves the trie unchanged
        final int surrogate = CodePointText.indexOfUnpairedSurrogate(keyword);
        if (surrogate >= 0) {
            throw new IllegalArgumentException("Keyword contains an unpaired surrogate at code point " + surrogate);
        }
        final CodePointText symbols = CodePointText.of(keyword);

        KeywordState state = getRoot();
        for (int i = 0; i < symbols.length(); i++) {
            state = getState(childOf(state, symbols.codePointAt(i)));
        }
        state.addTerminalKeyword(keyword);
        return keywords.add(keyword);
    }

    /**
     * Returns the child of {@code parent} on {@code codePoint}, creating it if absent.
     */
    int childOf(final KeywordState parent, final int codePoint) {
        int child = parent.getChild(codePoint);
        if (child == CodePointMap.NO_STATE) {
            child = newState(parent.getDepth() + 1).getId();
            parent.putChild(codePoint, child);
        }
        return child;
    }

    KeywordState newState(int depth) {
        checkNotLinked();
        KeywordState state = new KeywordState(states.size(), depth);
        states.add(state);
        return state;
    }

    /**
     * Record a keyword that an imported state declares terminal.
     */
    void registerKeyword(final KeywordState state, final String keyword) {
        checkNotLinked();
        state.addTerminalKeyword(keyword);
        keywords.add(keyword);
    }

    KeywordState getRoot() {
        return states.get(ROOT);
    }

    KeywordState getState(int id) {
        return states.get(id);
    }

    int size() {
        return states.size();
    }

    Set<String> getKeywords() {
        return Collections.unmodifiableSet(keywords);
    }

    boolean isLinked() {
        return linked;
    }

    void markLinked() {
        linked = true;
    }

    private void checkNotLinked() {
        if (linked) {
            throw new IllegalStateException("Keywords cannot be added once failure links have been computed");
        }
    }
}
