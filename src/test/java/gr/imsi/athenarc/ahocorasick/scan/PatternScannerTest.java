package gr.imsi.athenarc.ahocorasick.scan;

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import gr.imsi.athenarc.ahocorasick.automaton.Automaton;
import gr.imsi.athenarc.ahocorasick.util.NaiveMatcher;

import static gr.imsi.athenarc.ahocorasick.util.NaiveMatcher.chars;

public class PatternScannerTest {

    private static PatternScanner<Character> scanner(List<String> patterns) {
        List<List<Character>> atoms = chars(patterns);
        return new PatternScanner<>(Automaton.build(atoms), atoms);
    }

    private static String randomString(Random random, int length, String alphabet) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    @Test
    public void testIndexes() {
        List<List<Integer>> indexes = scanner(Arrays.asList("o")).occurrencesByOffset(chars("foobarfoobazbarr"));

        assertEquals("incorrect number of matches", 4, indexes.get(0).size());
        assertEquals("wrong index", Integer.valueOf(1), indexes.get(0).get(0));
        assertEquals(Arrays.asList(1, 2, 7, 8), indexes.get(0));
    }

    @Test
    public void testOverlappingShortPatterns() {
        List<String> patterns = Arrays.asList("i", "in", "tin", "pin", "string");
        int[] counts = scanner(patterns).countsByPattern(chars("pinpiiistringingting"));

        assertArrayEquals(new int[]{7, 4, 1, 1, 1}, counts);
        for (int i = 0; i < patterns.size(); i++) {
            assertEquals(patterns.get(i), NaiveMatcher.count(chars(patterns.get(i)), chars("pinpiiistringingting")), counts[i]);
        }
    }

    @Test
    public void testSuffixChainCounts() {
        int[] counts = scanner(Arrays.asList("foobar", "oobar", "obar", "bar", "ar", "r"))
            .countsByPattern(chars("foobarfoobazbarr"));

        assertArrayEquals(new int[]{1, 1, 1, 2, 2, 3}, counts);
    }

    @Test
    public void testEmptyPatternNeverReported() {
        PatternScanner<Character> scanner = scanner(Arrays.asList("", "ab", ""));
        List<Character> input = chars("abab");

        assertArrayEquals(new int[]{0, 2, 0}, scanner.countsByPattern(input));
        assertTrue(scanner.occurrencesByOffset(input).get(0).isEmpty());
        assertTrue(scanner.occurrencesByOffset(input).get(2).isEmpty());
    }

    @Test
    public void testNoPatternsNoMatches() {
        PatternScanner<Character> scanner = scanner(new ArrayList<>());

        assertEquals(0, scanner.countsByPattern(chars("anything")).length);
        assertTrue(scanner.findAll(chars("anything")).isEmpty());
    }

    @Test
    public void testRandomizedAgainstNaiveScan() {
        Random random = new Random(42);
        for (int round = 0; round < 200; round++) {
            int patternCount = 1 + random.nextInt(8);
            List<String> patterns = new ArrayList<>();
            for (int i = 0; i < patternCount; i++) {
                patterns.add(randomString(random, random.nextInt(5), "abc"));
            }
            String text = randomString(random, random.nextInt(60), "abcd");
            List<Character> input = chars(text);
            PatternScanner<Character> scanner = scanner(patterns);

            int[] counts = scanner.countsByPattern(input);
            List<List<Integer>> offsets = scanner.occurrencesByOffset(input);
            for (int i = 0; i < patterns.size(); i++) {
                List<Character> pattern = chars(patterns.get(i));
                // a duplicated pattern is only reported under its last index
                boolean shadowed = patterns.subList(i + 1, patterns.size()).contains(patterns.get(i));
                List<Integer> expected = shadowed ? new ArrayList<>() : NaiveMatcher.offsets(pattern, input);

                String message = "pattern '" + patterns.get(i) + "' in '" + text + "'";
                assertEquals(message, expected.size(), counts[i]);
                assertEquals(message, expected, offsets.get(i));
                for (int offset : offsets.get(i)) {
                    assertEquals(message, pattern, input.subList(offset, offset + pattern.size()));
                }
            }
        }
    }

    @Test
    public void testSuffixCompleteness() {
        List<String> patterns = Arrays.asList("abcd", "bcd", "cd", "d", "xcd");
        List<PatternMatch> matches = scanner(patterns).findAll(chars("zabcd"));

        Set<Integer> endingAtFive = new HashSet<>();
        for (PatternMatch match : matches) {
            if (match.getEnd() == 5) {
                endingAtFive.add(match.getPatternIndex());
            }
        }
        assertEquals(new HashSet<>(Arrays.asList(0, 1, 2, 3)), endingAtFive);
        assertEquals(new PatternMatch(0, 1, 5), matches.get(0));
        assertEquals(new PatternMatch(3, 4, 5), matches.get(3));
    }

    @Test
    public void testFindAllOrderedByEndPosition() {
        List<PatternMatch> matches = scanner(Arrays.asList("ab", "b", "bab")).findAll(chars("abab"));

        List<PatternMatch> expected = Arrays.asList(
            new PatternMatch(0, 0, 2),
            new PatternMatch(1, 1, 2),
            new PatternMatch(2, 1, 4),
            new PatternMatch(0, 2, 4),
            new PatternMatch(1, 3, 4));
        assertEquals(expected, matches);
    }

    @Test
    public void testBuildingTwiceGivesSameResults() {
        List<String> patterns = Arrays.asList("he", "she", "his", "hers", "e");
        List<Character> input = chars("ushers and his sheep");

        PatternScanner<Character> first = scanner(patterns);
        PatternScanner<Character> second = scanner(patterns);

        assertArrayEquals(first.countsByPattern(input), second.countsByPattern(input));
        assertEquals(first.occurrencesByOffset(input), second.occurrencesByOffset(input));
        assertEquals(first.findAll(input), second.findAll(input));
    }

    @Test
    public void testWorksOverNonCharacterAtoms() {
        List<List<String>> patterns = Arrays.asList(
            Arrays.asList("to", "be"),
            Arrays.asList("be"),
            Arrays.asList("or", "not", "to", "be"));
        List<String> input = Arrays.asList("to", "be", "or", "not", "to", "be");
        PatternScanner<String> scanner = new PatternScanner<>(Automaton.build(patterns), patterns);

        assertArrayEquals(new int[]{2, 2, 1}, scanner.countsByPattern(input));
        assertEquals(Arrays.asList(0, 4), scanner.occurrencesByOffset(input).get(0));
        assertEquals(Arrays.asList(2), scanner.occurrencesByOffset(input).get(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsPatternListOfDifferentSize() {
        List<List<Character>> atoms = chars(Arrays.asList("a", "b"));
        new PatternScanner<>(Automaton.build(atoms), atoms.subList(0, 1));
    }
}
