package gr.imsi.athenarc.ahocorasick.automaton;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Computes the failure and alternative (output) links of a finished trie with a
 * breadth-first pass, so that every node's failure target is already linked
 * when the node itself is reached.
 */
class FailureLinker<T> {

    private final List<AutomatonNode<T>> nodes;

    FailureLinker(List<AutomatonNode<T>> nodes) {
        this.nodes = nodes;
    }

    void link() {
        AutomatonNode<T> root = nodes.get(Automaton.ROOT);
        root.setFail(root.getId());

        Deque<Integer> queue = new ArrayDeque<>();

        // depth-1 nodes have no shorter non-root suffix
        for (int childId : root.getChildren().values()) {
            AutomatonNode<T> child = nodes.get(childId);
            child.setFail(root.getId());
            child.setAlternative(root.getAlternative());
            queue.add(childId);
        }

        while (!queue.isEmpty()) {
            AutomatonNode<T> cur = nodes.get(queue.poll());

            for (Map.Entry<T, Integer> entry : cur.getChildren().entrySet()) {
                T atom = entry.getKey();
                AutomatonNode<T> child = nodes.get(entry.getValue());

                AutomatonNode<T> temp = nodes.get(cur.getFail());
                while (!temp.hasChild(atom) && temp.getId() != Automaton.ROOT) {
                    temp = nodes.get(temp.getFail());
                }

                int fail = temp.hasChild(atom) ? temp.getChild(atom) : root.getId();
                child.setFail(fail);

                AutomatonNode<T> failNode = nodes.get(fail);
                child.setAlternative(failNode.isMatch() ? fail : failNode.getAlternative());

                queue.add(child.getId());
            }
        }
    }
}
