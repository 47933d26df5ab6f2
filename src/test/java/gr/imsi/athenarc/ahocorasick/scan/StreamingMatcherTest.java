package gr.imsi.athenarc.ahocorasick.scan;

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import gr.imsi.athenarc.ahocorasick.automaton.Automaton;

import static gr.imsi.athenarc.ahocorasick.util.NaiveMatcher.chars;

public class StreamingMatcherTest {

    private static final List<List<Character>> PATTERNS = chars(Arrays.asList("he", "she", "his", "hers", "s"));
    private static final String TEXT = "ushers shall see his sheep and hers";

    @Test
    public void testChunkedInputMatchesBatchScan() {
        Automaton<Character> automaton = Automaton.build(PATTERNS);
        List<Character> input = chars(TEXT);
        List<PatternMatch> expected = new PatternScanner<>(automaton, PATTERNS).findAll(input);

        for (int chunkSize = 1; chunkSize <= input.size(); chunkSize += 3) {
            StreamingMatcher<Character> matcher = new StreamingMatcher<>(automaton);
            List<PatternMatch> matches = new ArrayList<>();
            for (int from = 0; from < input.size(); from += chunkSize) {
                matches.addAll(matcher.feed(input.subList(from, Math.min(input.size(), from + chunkSize))));
            }
            assertEquals("chunk size " + chunkSize, expected, matches);
            assertEquals(input.size(), matcher.getPosition());
        }
    }

    @Test
    public void testMatchSpanningChunks() {
        StreamingMatcher<Character> matcher = new StreamingMatcher<>(Automaton.build(PATTERNS));

        assertTrue(matcher.feed(chars("xxh")).isEmpty());
        List<PatternMatch> matches = matcher.feed(chars("ers"));

        assertEquals(Arrays.asList(
            new PatternMatch(0, 2, 4),
            new PatternMatch(3, 2, 6),
            new PatternMatch(4, 5, 6)), matches);
    }

    @Test
    public void testResetReturnsToRoot() {
        StreamingMatcher<Character> matcher = new StreamingMatcher<>(Automaton.build(PATTERNS));
        matcher.feed(chars("sh"));
        assertNotEquals(Automaton.ROOT, matcher.getState());

        matcher.reset();

        assertEquals(Automaton.ROOT, matcher.getState());
        assertEquals(0, matcher.getPosition());
        assertEquals(Arrays.asList(new PatternMatch(0, 0, 2)), matcher.feed(chars("he")));
    }

    @Test
    public void testConcurrentScansShareOneAutomaton() throws Exception {
        Automaton<Character> automaton = Automaton.build(PATTERNS);
        PatternScanner<Character> scanner = new PatternScanner<>(automaton, PATTERNS);
        List<String> texts = Arrays.asList(TEXT, "she sells sea shells", "his hers he", "", "ssssss");

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<PatternMatch>>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String text = texts.get(i % texts.size());
                Callable<List<PatternMatch>> task = () -> new StreamingMatcher<>(automaton).feed(chars(text));
                futures.add(executor.submit(task));
            }
            for (int i = 0; i < futures.size(); i++) {
                List<Character> input = chars(texts.get(i % texts.size()));
                assertEquals(scanner.findAll(input), futures.get(i).get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
