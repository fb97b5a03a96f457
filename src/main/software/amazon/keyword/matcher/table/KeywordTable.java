package software.amazon.keyword.matcher.table;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The persistent form of a keyword automaton: for every state id, the state's children (single code point strings
 * mapped to child state ids) and its output keywords. State 0 is the root. Failure links are not part of the table;
 * they are recomputed whenever a table is turned back into a machine.
 *
 * A table is only a description. Nothing is checked on construction; {@code KeywordMachine.fromTable} validates it.
 */
@Immutable
public final class KeywordTable {

    public static final int ROOT_ID = 0;

    private final SortedMap<Integer, Entry> entries;

    public KeywordTable(@Nonnull final Map<Integer, Entry> entries) {
        this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    public SortedMap<Integer, Entry> getEntries() {
        return entries;
    }

    public Entry getEntry(int id) {
        return entries.get(id);
    }

    public boolean hasEntry(int id) {
        return entries.containsKey(id);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return entries.equals(((KeywordTable) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "KeywordTable" + entries;
    }

    /**
     * One state of the table.
     */
    @Immutable
    public static final class Entry {

        private final Map<String, Integer> children;
        private final List<String> output;

        public Entry(@Nonnull final Map<String, Integer> children, @Nonnull final List<String> output) {
            this.children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
            this.output = Collections.unmodifiableList(new ArrayList<>(output));
        }

        public Map<String, Integer> getChildren() {
            return children;
        }

        public List<String> getOutput() {
            return output;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Entry entry = (Entry) o;
            return children.equals(entry.children) && output.equals(entry.output);
        }

        @Override
        public int hashCode() {
            return Objects.hash(children, output);
        }

        @Override
        public String toString() {
            return "{children=" + children + ", output=" + output + "}";
        }
    }

    /**
     * Assembles a table one state at a time.
     */
    public static class Builder {

        private final Map<Integer, Map<String, Integer>> children = new TreeMap<>();
        private final Map<Integer, List<String>> outputs = new TreeMap<>();

        public Builder state(int id) {
            children.computeIfAbsent(id, k -> new LinkedHashMap<>());
            outputs.computeIfAbsent(id, k -> new ArrayList<>());
            return this;
        }

        public Builder child(int id, String symbol, int childId) {
            state(id);
            children.get(id).put(symbol, childId);
            return this;
        }

        public Builder output(int id, String keyword) {
            state(id);
            outputs.get(id).add(keyword);
            return this;
        }

        public KeywordTable build() {
            Map<Integer, Entry> entries = new TreeMap<>();
            for (Map.Entry<Integer, Map<String, Integer>> state : children.entrySet()) {
                entries.put(state.getKey(), new Entry(state.getValue(), outputs.get(state.getKey())));
            }
            return new KeywordTable(entries);
        }
    }
}
