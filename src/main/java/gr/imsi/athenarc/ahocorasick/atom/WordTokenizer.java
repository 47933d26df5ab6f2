package gr.imsi.athenarc.ahocorasick.atom;

import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * Whitespace separated words; runs of whitespace never produce empty atoms.
 */
public class WordTokenizer extends AbstractAtomTokenizer<String> {

    private static final Splitter SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    public WordTokenizer() {
        this(false);
    }

    public WordTokenizer(boolean ignoreCase) {
        super(ignoreCase);
    }

    @Override
    protected List<String> split(String text) {
        return SPLITTER.splitToList(text);
    }

    @Override
    public String label(String atom) {
        return atom;
    }
}
