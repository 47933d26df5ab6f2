package gr.imsi.athenarc.ahocorasick.atom;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.primitives.Bytes;

/**
 * UTF-8 bytes of the text. Labels are two-digit hex.
 */
public class ByteTokenizer extends AbstractAtomTokenizer<Byte> {

    public ByteTokenizer() {
        this(false);
    }

    public ByteTokenizer(boolean ignoreCase) {
        super(ignoreCase);
    }

    @Override
    protected List<Byte> split(String text) {
        return Bytes.asList(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String label(Byte atom) {
        return String.format("%02x", atom & 0xff);
    }
}
