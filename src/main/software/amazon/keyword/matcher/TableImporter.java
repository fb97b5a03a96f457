package software.amazon.keyword.matcher;

import software.amazon.keyword.matcher.input.CodePointText;
import software.amazon.keyword.matcher.table.KeywordTable;
import software.amazon.keyword.matcher.table.MalformedTableException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Rebuilds a linked trie from a {@link KeywordTable}. The work is done on a fresh trie that is only handed back once
 * the whole table has been validated and linked, so a malformed table never yields a partial automaton.
 *
 * Three passes: create a state for every table id reachable from the root, checking that the children form a tree;
 * wire the children and the terminal keywords; link. A table may list, at some state, keywords that the state only
 * inherits through its failure link (a table written with closed outputs). Those entries are redundant: they are not
 * added as terminal keywords, and linking must reproduce them.
 */
final class TableImporter {

    private final KeywordTable table;
    private final KeywordTrie trie = new KeywordTrie();

    // keyed by table id; states in breadth-first order, so keywords are registered in the order an export lists them
    private final Map<Integer, KeywordState> states = new LinkedHashMap<>();
    private final Map<Integer, Integer> parents = new HashMap<>();
    private final Map<Integer, Integer> symbols = new HashMap<>();
    private final Map<Integer, List<String>> inherited = new HashMap<>();

    private TableImporter(final KeywordTable table) {
        this.table = table;
    }

    /**
     * @throws MalformedTableException if the table does not describe a trie
     */
    static KeywordTrie importTable(final KeywordTable table) {
        if (table == null) {
            throw new MalformedTableException("Table is null");
        }
        TableImporter importer = new TableImporter(table);
        importer.createStates();
        importer.wireStates();
        importer.link();
        return importer.trie;
    }

    private void createStates() {
        if (!table.hasEntry(KeywordTable.ROOT_ID)) {
            throw new MalformedTableException("Table has no root state " + KeywordTable.ROOT_ID);
        }
        for (Integer id : table.getEntries().keySet()) {
            if (id < 0) {
                throw new MalformedTableException("State id " + id + " is negative");
            }
        }

        states.put(KeywordTable.ROOT_ID, trie.getRoot());
        final Queue<Integer> queue = new ArrayDeque<>();
        queue.add(KeywordTable.ROOT_ID);
        while (!queue.isEmpty()) {
            final int id = queue.remove();
            final KeywordTable.Entry entry = table.getEntry(id);
            if (entry == null) {
                throw new MalformedTableException("State " + id + " has no entry");
            }
            final int depth = states.get(id).getDepth();
            for (Map.Entry<String, Integer> child : entry.getChildren().entrySet()) {
                final String symbol = child.getKey();
                final Integer childId = child.getValue();
                if (symbol == null || CodePointText.lengthOf(symbol) != 1) {
                    throw new MalformedTableException("State " + id + " has a transition on '" + symbol
                            + "', which is not a single code point");
                }
                if (CodePointText.indexOfUnpairedSurrogate(symbol) >= 0) {
                    throw new MalformedTableException("State " + id + " has a transition on an unpaired surrogate");
                }
                if (childId == null || !table.hasEntry(childId)) {
                    throw new MalformedTableException("State " + id + " refers to missing state " + childId);
                }
                if (states.containsKey(childId)) {
                    throw new MalformedTableException("State " + childId + " is reached more than once, from state "
                            + id + "; the children do not form a tree");
                }
                states.put(childId, trie.newState(depth + 1));
                parents.put(childId, id);
                symbols.put(childId, symbol.codePointAt(0));
                queue.add(childId);
            }
        }

        if (states.size() != table.size()) {
            for (Integer id : table.getEntries().keySet()) {
                if (!states.containsKey(id)) {
                    throw new MalformedTableException("State " + id + " is not reachable from the root");
                }
            }
        }
    }

    private void wireStates() {
        for (Map.Entry<Integer, KeywordState> mapped : states.entrySet()) {
            final int id = mapped.getKey();
            final KeywordState state = mapped.getValue();
            final KeywordTable.Entry entry = table.getEntry(id);

            for (Map.Entry<String, Integer> child : entry.getChildren().entrySet()) {
                state.putChild(child.getKey().codePointAt(0), states.get(child.getValue()).getId());
            }

            for (String keyword : entry.getOutput()) {
                if (keyword == null || keyword.isEmpty()) {
                    throw new MalformedTableException("State " + id + " outputs an empty keyword");
                }
                if (CodePointText.indexOfUnpairedSurrogate(keyword) >= 0) {
                    throw new MalformedTableException("State " + id + " outputs a keyword with an unpaired surrogate");
                }
                if (!endsPath(id, keyword)) {
                    throw new MalformedTableException("State " + id + " outputs '" + keyword
                            + "', which is not a suffix of its path");
                }
                if (CodePointText.lengthOf(keyword) == state.getDepth()) {
                    trie.registerKeyword(state, keyword);
                } else {
                    inherited.computeIfAbsent(id, k -> new ArrayList<>()).add(keyword);
                }
            }
        }
    }

    private void link() {
        FailureLinker.link(trie);
        for (Map.Entry<Integer, List<String>> redundant : inherited.entrySet()) {
            final List<String> output = states.get(redundant.getKey()).getOutput();
            for (String keyword : redundant.getValue()) {
                if (!output.contains(keyword)) {
                    throw new MalformedTableException("State " + redundant.getKey() + " outputs '" + keyword
                            + "', but no state spelling it is terminal");
                }
            }
        }
    }

    // true if the keyword spells the last code points on the path from the root to the state
    private boolean endsPath(final int id, final String keyword) {
        final int[] codePoints = keyword.codePoints().toArray();
        if (codePoints.length > states.get(id).getDepth()) {
            return false;
        }
        int current = id;
        for (int i = codePoints.length - 1; i >= 0; i--) {
            if (symbols.get(current) != codePoints[i]) {
                return false;
            }
            current = parents.get(current);
        }
        return true;
    }
}
