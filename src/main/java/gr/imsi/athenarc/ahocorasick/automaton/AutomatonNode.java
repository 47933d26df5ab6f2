package gr.imsi.athenarc.ahocorasick.automaton;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * One state of the automaton. Links to other states are stored as node ids,
 * with {@link #NO_LINK} standing for "no such node".
 *
 * Nodes are only mutated by {@link TrieBuilder} and {@link FailureLinker} while
 * the automaton is being constructed; afterwards {@link #freeze()} makes the
 * children table immutable and no setter is reachable from outside the package.
 */
public class AutomatonNode<T> {

    public static final int NO_LINK = -1;

    private final int id;
    private final T atom;
    private Map<T, Integer> children = new HashMap<>();
    private int fail = NO_LINK;
    private int alternative = NO_LINK;
    private int match = NO_LINK;
    private int matchLen = NO_LINK;

    AutomatonNode(int id, T atom) {
        this.id = id;
        this.atom = atom;
    }

    public int getId() {
        return id;
    }

    /**
     * The atom consumed to reach this node from its parent, {@code null} for the root.
     */
    public T getAtom() {
        return atom;
    }

    public Map<T, Integer> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public boolean hasChild(T atom) {
        return children.containsKey(atom);
    }

    /**
     * @return the id of the child reached by {@code atom}, or {@link #NO_LINK}
     */
    public int getChild(T atom) {
        Integer child = children.get(atom);
        return child == null ? NO_LINK : child;
    }

    public int getFail() {
        return fail;
    }

    public int getAlternative() {
        return alternative;
    }

    public int getMatch() {
        return match;
    }

    public int getMatchLen() {
        return matchLen;
    }

    public boolean isMatch() {
        return match != NO_LINK;
    }

    void addChild(T atom, int childId) {
        children.put(atom, childId);
    }

    void setFail(int fail) {
        this.fail = fail;
    }

    void setAlternative(int alternative) {
        this.alternative = alternative;
    }

    void markMatch(int patternIndex, int matchLen) {
        this.match = patternIndex;
        this.matchLen = matchLen;
    }

    void freeze() {
        children = ImmutableMap.copyOf(children);
    }

    @Override
    public String toString() {
        return "AutomatonNode@" + id
            + " (atom=" + atom + ", fail=" + fail + ", alternative=" + alternative
            + ", match=" + match + ", children=" + children + ")";
    }
}
