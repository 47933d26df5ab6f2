package gr.imsi.athenarc.ahocorasick.visual;

import java.util.Map;
import java.util.function.Function;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.ahocorasick.automaton.Automaton;
import gr.imsi.athenarc.ahocorasick.automaton.AutomatonNode;

/**
 * Renders an automaton as a Graphviz digraph. Match nodes are double circles,
 * failure links dashed edges, alternative links dotted edges and trie
 * transitions solid edges labelled with their atom.
 */
public class DotRenderer {

    public static final String DEFAULT_FONT = "Helvetica,Arial,sans-serif";

    private final String font;

    public DotRenderer() {
        this(DEFAULT_FONT);
    }

    public DotRenderer(String font) {
        this.font = Preconditions.checkNotNull(font, "Font must not be null.");
    }

    public <T> String render(Automaton<T> automaton, Function<? super T, String> labelFn) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph finite_state_machine {\n");
        sb.append("  fontname=\"").append(font).append("\"\n");
        sb.append("  node [fontname=\"").append(font).append("\"]\n");
        sb.append("  edge [fontname=\"").append(font).append("\"]\n");
        sb.append("  rankdir=LR;\n");

        sb.append("  node [shape = doublecircle];");
        for (AutomatonNode<T> node : automaton.getNodes()) {
            if (node.isMatch()) {
                sb.append(' ').append(node.getId());
            }
        }
        sb.append(";\n");
        sb.append("  node [shape = circle];\n");

        for (AutomatonNode<T> node : automaton.getNodes()) {
            sb.append("  ").append(node.getId()).append(" -> ").append(node.getFail())
                .append(" [style = dashed, constraint=false];\n");

            if (node.getAlternative() != AutomatonNode.NO_LINK) {
                sb.append("  ").append(node.getId()).append(" -> ").append(node.getAlternative())
                    .append(" [style = dotted, constraint=false];\n");
            }

            for (Map.Entry<T, Integer> child : node.getChildren().entrySet()) {
                sb.append("  ").append(node.getId()).append(" -> ").append(child.getValue())
                    .append(" [label = \"").append(escape(String.valueOf(labelFn.apply(child.getKey())))).append("\"];\n");
            }
        }

        sb.append("}\n");
        return sb.toString();
    }

    static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
