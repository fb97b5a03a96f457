package software.amazon.keyword.matcher;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * Turns a trie into a searchable automaton by computing, for every state but the root, the failure link: the state
 * spelling the longest proper suffix of this state's path that is also a path in the trie. Each state's output is
 * closed over its failure link as soon as that link is set.
 */
final class FailureLinker {

    private FailureLinker() { }

    /**
     * Link every state of the trie. Linking an already-linked trie does nothing, so outputs are never unioned twice.
     *
     * @param trie the trie, complete with all its keywords
     */
    static void link(final KeywordTrie trie) {
        if (trie.isLinked()) {
            return;
        }

        final KeywordState root = trie.getRoot();
        root.linkAsRoot();

        // Breadth-first, so a state's failure target, which is always shallower, is linked before the state is
        final Queue<KeywordState> queue = new ArrayDeque<>();
        for (CodePointMap.Transition transition : root.getTransitions()) {
            KeywordState child = trie.getState(transition.getTarget());
            child.link(root);
            queue.add(child);
        }

        while (!queue.isEmpty()) {
            final KeywordState current = queue.remove();
            for (CodePointMap.Transition transition : current.getTransitions()) {
                final int codePoint = transition.getCodePoint();
                final KeywordState child = trie.getState(transition.getTarget());
                queue.add(child);
                child.link(findFailTarget(trie, current, codePoint));
            }
        }

        trie.markLinked();
    }

    // walk the parent's failure chain looking for a state that can consume the code point
    private static KeywordState findFailTarget(final KeywordTrie trie, final KeywordState parent,
                                               final int codePoint) {
        KeywordState candidate = trie.getState(parent.getFail());
        while (true) {
            int next = candidate.getChild(codePoint);
            if (next != CodePointMap.NO_STATE) {
                return trie.getState(next);
            }
            if (candidate.getId() == KeywordTrie.ROOT) {
                return candidate;
            }
            candidate = trie.getState(candidate.getFail());
        }
    }
}
