package gr.imsi.athenarc.ahocorasick.automaton;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An Aho-Corasick machine over atoms of type {@code T}. Atoms only need
 * consistent {@code equals} and {@code hashCode}.
 *
 * The automaton is built once from the full pattern set and is immutable
 * afterwards. Scanning state is a plain node id owned by the caller, so any
 * number of threads can run independent scans over one instance without
 * synchronization.
 */
public final class Automaton<T> {
    private static final Logger LOG = LoggerFactory.getLogger(Automaton.class);

    public static final int ROOT = 0;

    private final ImmutableList<AutomatonNode<T>> nodes;
    private final int[] patternLengths;

    private Automaton(List<AutomatonNode<T>> nodes, int[] patternLengths) {
        for (AutomatonNode<T> node : nodes) {
            node.freeze();
        }
        this.nodes = ImmutableList.copyOf(nodes);
        this.patternLengths = patternLengths;
    }

    /**
     * Builds the trie for {@code patterns} and links it. The index of a pattern in
     * the list is the value reported for it by {@link #step}.
     *
     * Empty patterns are accepted and never match. When the same pattern occurs
     * more than once only the last occurrence's index is reported.
     *
     * @throws NullPointerException if the list, a pattern or an atom is null
     */
    public static <T> Automaton<T> build(@NotNull List<? extends List<? extends T>> patterns) {
        Preconditions.checkNotNull(patterns, "Patterns must not be null.");

        TrieBuilder<T> trieBuilder = new TrieBuilder<>();
        int[] patternLengths = new int[patterns.size()];
        for (int i = 0; i < patterns.size(); i++) {
            List<? extends T> pattern = patterns.get(i);
            trieBuilder.insert(i, pattern);
            patternLengths[i] = pattern.size();
        }

        List<AutomatonNode<T>> nodes = trieBuilder.getNodes();
        new FailureLinker<>(nodes).link();

        LOG.debug("Built automaton with {} nodes for {} patterns", nodes.size(), patterns.size());
        return new Automaton<>(nodes, patternLengths);
    }

    /**
     * Advances from {@code state} by one atom.
     *
     * If the state has no child for {@code atom}, failure links are followed
     * until a state that has one is found or the root is reached. From the
     * resulting child, its own match and then the whole alternative chain are
     * reported. When even the root has no child for the atom the scan restarts
     * at the root with no matches.
     *
     * @throws IndexOutOfBoundsException if {@code state} is not a node id of this automaton
     */
    public StepResult step(int state, T atom) {
        Preconditions.checkElementIndex(state, nodes.size(), "state");

        AutomatonNode<T> node = nodes.get(state);
        while (!node.hasChild(atom) && node.getId() != ROOT) {
            node = nodes.get(node.getFail());
        }

        int next = node.getChild(atom);
        if (next == AutomatonNode.NO_LINK) {
            return StepResult.noMatch(ROOT);
        }

        AutomatonNode<T> target = nodes.get(next);
        List<Integer> matches = new ArrayList<>();
        if (target.isMatch()) {
            matches.add(target.getMatch());
        }
        for (int alt = target.getAlternative(); alt != AutomatonNode.NO_LINK; alt = nodes.get(alt).getAlternative()) {
            matches.add(nodes.get(alt).getMatch());
        }
        return new StepResult(matches, next);
    }

    public AutomatonNode<T> getRoot() {
        return nodes.get(ROOT);
    }

    public AutomatonNode<T> getNode(int id) {
        return nodes.get(id);
    }

    public List<AutomatonNode<T>> getNodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public int getPatternCount() {
        return patternLengths.length;
    }

    public int getPatternLength(int patternIndex) {
        Preconditions.checkElementIndex(patternIndex, patternLengths.length, "patternIndex");
        return patternLengths[patternIndex];
    }
}
