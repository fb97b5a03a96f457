package software.amazon.keyword.matcher;

import software.amazon.keyword.matcher.table.KeywordTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Flattens a trie into a {@link KeywordTable}. Ids are handed out breadth-first from a local counter, root first, with
 * siblings in code point order, so the same keyword set always exports to the same table.
 */
final class TableExporter {

    private static final Comparator<CodePointMap.Transition> BY_CODE_POINT =
            Comparator.comparingInt(CodePointMap.Transition::getCodePoint);

    private TableExporter() { }

    static KeywordTable export(final KeywordTrie trie) {
        final Map<Integer, KeywordTable.Entry> entries = new HashMap<>();
        final Queue<KeywordState> queue = new ArrayDeque<>();
        final Queue<Integer> ids = new ArrayDeque<>();
        int nextId = KeywordTable.ROOT_ID;

        queue.add(trie.getRoot());
        ids.add(nextId++);
        while (!queue.isEmpty()) {
            final KeywordState state = queue.remove();
            final int id = ids.remove();

            final List<CodePointMap.Transition> transitions = new ArrayList<>(state.getChildCount());
            for (CodePointMap.Transition transition : state.getTransitions()) {
                transitions.add(transition);
            }
            transitions.sort(BY_CODE_POINT);

            final Map<String, Integer> children = new LinkedHashMap<>();
            for (CodePointMap.Transition transition : transitions) {
                children.put(new String(Character.toChars(transition.getCodePoint())), nextId);
                queue.add(trie.getState(transition.getTarget()));
                ids.add(nextId++);
            }

            // only what ends here; the inherited part of the output is rebuilt by linking on import
            entries.put(id, new KeywordTable.Entry(children, new ArrayList<>(state.getTerminalKeywords())));
        }
        return new KeywordTable(entries);
    }
}
