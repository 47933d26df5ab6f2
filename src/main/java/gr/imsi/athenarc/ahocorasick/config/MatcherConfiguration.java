package gr.imsi.athenarc.ahocorasick.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.ahocorasick.atom.AtomType;
import gr.imsi.athenarc.ahocorasick.visual.DotRenderer;

public class MatcherConfiguration {
    private static final Logger LOG = LoggerFactory.getLogger(MatcherConfiguration.class);

    public static final String ATOMS_KEY = "matcher.atoms";
    public static final String IGNORE_CASE_KEY = "matcher.ignoreCase";
    public static final String DOT_FONT_KEY = "matcher.dot.font";

    private final AtomType atomType;
    private final boolean ignoreCase;
    private final String dotFont;

    private MatcherConfiguration(Builder builder) {
        this.atomType = builder.atomType;
        this.ignoreCase = builder.ignoreCase;
        this.dotFont = builder.dotFont;
    }

    public AtomType getAtomType() { return atomType; }
    public boolean isIgnoreCase() { return ignoreCase; }
    public String getDotFont() { return dotFont; }

    public Builder toBuilder() {
        return new Builder().atomType(atomType).ignoreCase(ignoreCase).dotFont(dotFont);
    }

    /**
     * Reads {@code /application.properties} from the classpath. A missing file
     * yields the defaults.
     */
    public static MatcherConfiguration load() {
        return load("/application.properties");
    }

    public static MatcherConfiguration load(String resource) {
        Properties properties = new Properties();
        try (InputStream input = MatcherConfiguration.class.getResourceAsStream(resource)) {
            if (input == null) {
                LOG.warn("Unable to find {} in resources, using defaults.", resource);
                return new Builder().build();
            }
            properties.load(input);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + resource, e);
        }
        return fromProperties(properties);
    }

    public static MatcherConfiguration fromProperties(Properties properties) {
        Builder builder = new Builder();
        String atoms = properties.getProperty(ATOMS_KEY);
        if (atoms != null) {
            builder.atomType(AtomType.fromName(atoms));
        }
        String ignoreCase = properties.getProperty(IGNORE_CASE_KEY);
        if (ignoreCase != null) {
            builder.ignoreCase(Boolean.parseBoolean(ignoreCase.trim()));
        }
        String font = properties.getProperty(DOT_FONT_KEY);
        if (font != null) {
            builder.dotFont(font.trim());
        }
        return builder.build();
    }

    public static class Builder {
        private AtomType atomType = AtomType.CHARACTER;
        private boolean ignoreCase = false;
        private String dotFont = DotRenderer.DEFAULT_FONT;

        public Builder atomType(AtomType atomType) { this.atomType = atomType; return this; }
        public Builder ignoreCase(boolean ignoreCase) { this.ignoreCase = ignoreCase; return this; }
        public Builder dotFont(String dotFont) { this.dotFont = dotFont; return this; }

        public MatcherConfiguration build() {
            return new MatcherConfiguration(this);
        }
    }

    @Override
    public String toString() {
        return "MatcherConfiguration{atomType=" + atomType + ", ignoreCase=" + ignoreCase + ", dotFont='" + dotFont + "'}";
    }
}
