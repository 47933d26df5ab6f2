package gr.imsi.athenarc.ahocorasick.automaton;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * Outcome of feeding one atom to the automaton: the indices of every pattern
 * ending at that atom, longest first, and the state to continue from.
 */
public final class StepResult {
    private final List<Integer> matches;
    private final int state;

    public StepResult(List<Integer> matches, int state) {
        this.matches = ImmutableList.copyOf(matches);
        this.state = state;
    }

    static StepResult noMatch(int state) {
        return new StepResult(ImmutableList.of(), state);
    }

    public List<Integer> getMatches() {
        return matches;
    }

    public int getState() {
        return state;
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepResult)) return false;
        StepResult that = (StepResult) o;
        return state == that.state && matches.equals(that.matches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matches, state);
    }

    @Override
    public String toString() {
        return "StepResult{matches=" + matches + ", state=" + state + "}";
    }
}
