package software.amazon.keyword.matcher;

import software.amazon.keyword.matcher.input.CodePointText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Represents a state in the keyword automaton, i.e. the prefix of one or more keywords. States live in the arena of a
 * {@link KeywordTrie} and refer to each other by id, so the failure links never create reference cycles.
 *
 * Before linking, the output holds only the keywords that end exactly at this state. Linking sets the failure link
 * and closes the output over it, after which the state is never modified again.
 */
class KeywordState {

    static final int UNLINKED = -1;

    private final int id;
    private final int depth;
    private final CodePointMap children = new CodePointMap();

    // the keywords spelled by the path to this state, at most one unless the trie was imported
    private final Set<String> terminalKeywords = new LinkedHashSet<>();

    private int fail = UNLINKED;
    private List<String> output = Collections.emptyList();
    private int[] outputLengths = new int[0];

    KeywordState(int id, int depth) {
        this.id = id;
        this.depth = depth;
    }

    int getId() {
        return id;
    }

    /**
     * @return the length, in code points, of the path from the root to this state
     */
    int getDepth() {
        return depth;
    }

    int getChild(int codePoint) {
        return children.get(codePoint);
    }

    boolean hasChild(int codePoint) {
        return children.containsKey(codePoint);
    }

    void putChild(int codePoint, int childId) {
        children.put(codePoint, childId);
    }

    Iterable<CodePointMap.Transition> getTransitions() {
        return children.transitions();
    }

    int getChildCount() {
        return children.size();
    }

    /**
     * @return true if the keyword was not already terminal here
     */
    boolean addTerminalKeyword(String keyword) {
        return terminalKeywords.add(keyword);
    }

    Set<String> getTerminalKeywords() {
        return Collections.unmodifiableSet(terminalKeywords);
    }

    int getFail() {
        return fail;
    }

    boolean isLinked() {
        return fail != UNLINKED;
    }

    /**
     * Sets the failure link and closes the output: the keywords ending here followed by every keyword already in the
     * output of the failure target. The target must have been linked first.
     */
    void link(KeywordState failTarget) {
        this.fail = failTarget.id;
        Set<String> closed = new LinkedHashSet<>(terminalKeywords);
        closed.addAll(failTarget.output);
        setOutput(closed);
    }

    /**
     * The root is its own failure target and only ever outputs its own keywords.
     */
    void linkAsRoot() {
        this.fail = id;
        setOutput(terminalKeywords);
    }

    private void setOutput(Set<String> keywords) {
        this.output = keywords.isEmpty() ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(keywords));
        this.outputLengths = new int[output.size()];
        for (int i = 0; i < outputLengths.length; i++) {
            outputLengths[i] = CodePointText.lengthOf(output.get(i));
        }
    }

    /**
     * @return the closed output once linked, empty before
     */
    List<String> getOutput() {
        return output;
    }

    /**
     * @return the length in code points of the i-th output keyword
     */
    int getOutputLength(int i) {
        return outputLengths[i];
    }

    @Override
    public String toString() {
        return "KS: id=" + id + " depth=" + depth + " fail=" + fail + " out=" + output;
    }
}
