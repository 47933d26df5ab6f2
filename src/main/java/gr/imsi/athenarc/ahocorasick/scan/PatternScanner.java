package gr.imsi.athenarc.ahocorasick.scan;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.ahocorasick.automaton.Automaton;
import gr.imsi.athenarc.ahocorasick.automaton.StepResult;

/**
 * Batch scans of a whole input sequence. Every scan starts at the root and is
 * driven by {@link Automaton#step} one atom at a time.
 */
public class PatternScanner<T> {
    private static final Logger LOG = LoggerFactory.getLogger(PatternScanner.class);

    private final Automaton<T> automaton;
    private final List<? extends List<? extends T>> patterns;

    /**
     * @param automaton the automaton built from {@code patterns}
     * @param patterns the pattern list the automaton was built from; result lists are indexed like it
     */
    public PatternScanner(Automaton<T> automaton, List<? extends List<? extends T>> patterns) {
        Preconditions.checkNotNull(automaton, "Automaton must not be null.");
        Preconditions.checkNotNull(patterns, "Patterns must not be null.");
        Preconditions.checkArgument(patterns.size() == automaton.getPatternCount(),
            "Automaton was built from %s patterns, got %s.", automaton.getPatternCount(), patterns.size());
        this.automaton = automaton;
        this.patterns = patterns;
    }

    /**
     * Start offsets of every occurrence, one list per pattern, each in position order.
     */
    public List<List<Integer>> occurrencesByOffset(List<? extends T> input) {
        List<List<Integer>> indexes = new ArrayList<>(patterns.size());
        for (int i = 0; i < patterns.size(); i++) {
            indexes.add(new ArrayList<>());
        }
        scan(input, (patternIndex, position) ->
            indexes.get(patternIndex).add(position - (patterns.get(patternIndex).size() - 1)));
        return indexes;
    }

    /**
     * Number of (possibly overlapping) occurrences of each pattern.
     */
    public int[] countsByPattern(List<? extends T> input) {
        int[] counts = new int[patterns.size()];
        scan(input, (patternIndex, position) -> counts[patternIndex]++);
        return counts;
    }

    /**
     * All occurrences ordered by end position; matches ending at the same
     * position are ordered longest first.
     */
    public List<PatternMatch> findAll(List<? extends T> input) {
        List<PatternMatch> matches = new ArrayList<>();
        scan(input, (patternIndex, position) -> {
            int length = patterns.get(patternIndex).size();
            matches.add(new PatternMatch(patternIndex, position - length + 1L, position + 1L));
        });
        return matches;
    }

    private void scan(List<? extends T> input, MatchConsumer consumer) {
        Preconditions.checkNotNull(input, "Input must not be null.");
        int state = Automaton.ROOT;
        int matched = 0;
        for (int position = 0; position < input.size(); position++) {
            StepResult result = automaton.step(state, input.get(position));
            for (int patternIndex : result.getMatches()) {
                consumer.accept(patternIndex, position);
                matched++;
            }
            state = result.getState();
        }
        LOG.debug("Scanned {} atoms, {} matches", input.size(), matched);
    }

    @FunctionalInterface
    private interface MatchConsumer {
        void accept(int patternIndex, int position);
    }
}
