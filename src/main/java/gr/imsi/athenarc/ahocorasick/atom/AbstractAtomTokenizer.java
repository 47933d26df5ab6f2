package gr.imsi.athenarc.ahocorasick.atom;

import java.util.List;
import java.util.Locale;

import com.google.common.base.Preconditions;

public abstract class AbstractAtomTokenizer<T> implements AtomTokenizer<T> {

    private final boolean ignoreCase;

    protected AbstractAtomTokenizer(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    @Override
    public List<T> tokenize(String text) {
        Preconditions.checkNotNull(text, "Text must not be null.");
        return split(ignoreCase ? text.toLowerCase(Locale.ROOT) : text);
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    protected abstract List<T> split(String text);
}
