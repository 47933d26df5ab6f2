package gr.imsi.athenarc.ahocorasick.atom;

import java.util.List;

/**
 * Turns text into the atom sequence the automaton works on.
 */
public interface AtomTokenizer<T> {

    List<T> tokenize(String text);

    /**
     * Short printable form of an atom, used for graph labels and reports.
     */
    String label(T atom);
}
