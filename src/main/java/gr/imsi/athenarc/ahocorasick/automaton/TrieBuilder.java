package gr.imsi.athenarc.ahocorasick.automaton;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Overlays all patterns into a single prefix tree stored as a growable list of
 * nodes, where a node's id is its index in the list and id 0 is the root.
 *
 * A zero-length pattern never enters the walk below, so it creates no node and
 * is never reported as a match.
 */
class TrieBuilder<T> {
    private static final Logger LOG = LoggerFactory.getLogger(TrieBuilder.class);

    private final List<AutomatonNode<T>> nodes = new ArrayList<>();

    TrieBuilder() {
        AutomatonNode<T> root = new AutomatonNode<>(Automaton.ROOT, null);
        root.setAlternative(AutomatonNode.NO_LINK);
        nodes.add(root);
    }

    /**
     * Walks {@code pattern} from the root, following existing children and
     * appending a node for every atom that has none. The last node reached is
     * marked as the terminal of {@code patternIndex}; if an identical pattern was
     * inserted before, its index is overwritten.
     */
    void insert(int patternIndex, List<? extends T> pattern) {
        Preconditions.checkNotNull(pattern, "Pattern %s is null.", patternIndex);
        if (pattern.isEmpty()) {
            LOG.debug("Pattern {} is empty and will never match", patternIndex);
            return;
        }

        AutomatonNode<T> cur = nodes.get(Automaton.ROOT);
        for (int j = 0; j < pattern.size(); j++) {
            T atom = Preconditions.checkNotNull(pattern.get(j), "Pattern %s has a null atom at %s.", patternIndex, j);

            int childId = cur.getChild(atom);
            if (childId == AutomatonNode.NO_LINK) {
                AutomatonNode<T> node = new AutomatonNode<>(nodes.size(), atom);
                nodes.add(node);
                cur.addChild(atom, node.getId());
                cur = node;
            } else {
                cur = nodes.get(childId);
            }
        }

        if (cur.isMatch()) {
            LOG.debug("Pattern {} duplicates pattern {} and replaces it as the match", patternIndex, cur.getMatch());
        }
        cur.markMatch(patternIndex, pattern.size() - 1);
    }

    List<AutomatonNode<T>> getNodes() {
        return nodes;
    }
}
