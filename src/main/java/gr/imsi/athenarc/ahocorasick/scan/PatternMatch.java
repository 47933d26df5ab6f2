package gr.imsi.athenarc.ahocorasick.scan;

import java.util.Objects;

/**
 * A single occurrence of a pattern in the scanned input. {@code start} is
 * inclusive, {@code end} exclusive.
 */
public final class PatternMatch {
    private final int patternIndex;
    private final long start;
    private final long end;

    public PatternMatch(int patternIndex, long start, long end) {
        this.patternIndex = patternIndex;
        this.start = start;
        this.end = end;
    }

    public int getPatternIndex() {
        return patternIndex;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getLength() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatternMatch)) return false;
        PatternMatch that = (PatternMatch) o;
        return patternIndex == that.patternIndex && start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(patternIndex, start, end);
    }

    @Override
    public String toString() {
        return "PatternMatch{pattern=" + patternIndex + ", [" + start + ", " + end + ")}";
    }
}
