package gr.imsi.athenarc.ahocorasick.scan;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.ahocorasick.automaton.Automaton;
import gr.imsi.athenarc.ahocorasick.automaton.StepResult;

/**
 * A scan cursor over a shared {@link Automaton}. It keeps the current state and
 * the absolute position of the next atom, so input can be fed in chunks of any
 * size and offsets stay relative to the start of the stream.
 *
 * Not thread-safe; use one matcher per stream. The automaton itself can be
 * shared.
 */
public class StreamingMatcher<T> {

    private final Automaton<T> automaton;
    private int state = Automaton.ROOT;
    private long position = 0;

    public StreamingMatcher(Automaton<T> automaton) {
        this.automaton = Preconditions.checkNotNull(automaton, "Automaton must not be null.");
    }

    /**
     * Consumes one atom and returns every pattern that ends at it.
     */
    public List<PatternMatch> next(T atom) {
        StepResult result = automaton.step(state, atom);
        state = result.getState();
        long end = ++position;

        if (!result.hasMatches()) {
            return List.of();
        }
        List<PatternMatch> matches = new ArrayList<>(result.getMatches().size());
        for (int patternIndex : result.getMatches()) {
            matches.add(new PatternMatch(patternIndex, end - automaton.getPatternLength(patternIndex), end));
        }
        return matches;
    }

    public List<PatternMatch> feed(List<? extends T> chunk) {
        List<PatternMatch> matches = new ArrayList<>();
        for (T atom : chunk) {
            matches.addAll(next(atom));
        }
        return matches;
    }

    public int getState() {
        return state;
    }

    public long getPosition() {
        return position;
    }

    public void reset() {
        state = Automaton.ROOT;
        position = 0;
    }
}
