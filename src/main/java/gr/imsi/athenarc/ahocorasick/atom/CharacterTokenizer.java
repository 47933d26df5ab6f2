package gr.imsi.athenarc.ahocorasick.atom;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One atom per Unicode code point, so surrogate pairs are never split.
 */
public class CharacterTokenizer extends AbstractAtomTokenizer<Integer> {

    public CharacterTokenizer() {
        this(false);
    }

    public CharacterTokenizer(boolean ignoreCase) {
        super(ignoreCase);
    }

    @Override
    protected List<Integer> split(String text) {
        return text.codePoints().boxed().collect(Collectors.toList());
    }

    @Override
    public String label(Integer atom) {
        return new String(Character.toChars(atom));
    }
}
