package gr.imsi.athenarc.ahocorasick.atom;

import java.util.Locale;

public enum AtomType {
    CHARACTER,
    WORD,
    BYTE;

    public AtomTokenizer<?> tokenizer(boolean ignoreCase) {
        switch (this) {
            case CHARACTER:
                return new CharacterTokenizer(ignoreCase);
            case WORD:
                return new WordTokenizer(ignoreCase);
            case BYTE:
                return new ByteTokenizer(ignoreCase);
            default:
                throw new IllegalStateException("Unknown atom type: " + this);
        }
    }

    /**
     * Case-insensitive lookup, e.g. "char", "character", "word", "byte".
     */
    public static AtomType fromName(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "char":
            case "character":
                return CHARACTER;
            case "word":
            case "token":
                return WORD;
            case "byte":
                return BYTE;
            default:
                throw new IllegalArgumentException("Unknown atom type: " + name
                    + ". Supported types are: character, word, byte");
        }
    }
}
