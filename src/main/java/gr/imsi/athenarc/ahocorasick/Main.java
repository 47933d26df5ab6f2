package gr.imsi.athenarc.ahocorasick;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.ahocorasick.atom.CharacterTokenizer;
import gr.imsi.athenarc.ahocorasick.automaton.Automaton;
import gr.imsi.athenarc.ahocorasick.config.MatcherConfiguration;
import gr.imsi.athenarc.ahocorasick.scan.PatternScanner;
import gr.imsi.athenarc.ahocorasick.visual.DotRenderer;

public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final String INPUT = "pinpiiistringingting";
    static final List<String> PATTERNS = List.of("i", "in", "tin", "pin", "string");

    public static void main(String[] args) {
        MatcherConfiguration config = MatcherConfiguration.load();
        LOG.info("Running example with {}", config);

        CharacterTokenizer tokenizer = new CharacterTokenizer(config.isIgnoreCase());

        // each pattern must itself be a sequence of atoms
        List<List<Integer>> patterns = new ArrayList<>();
        for (String pattern : PATTERNS) {
            patterns.add(tokenizer.tokenize(pattern));
        }

        Automaton<Integer> automaton = Automaton.build(patterns);

        System.out.println(new DotRenderer(config.getDotFont()).render(automaton, tokenizer::label));

        int[] counts = new PatternScanner<>(automaton, patterns).countsByPattern(tokenizer.tokenize(INPUT));
        System.out.print(formatCounts(PATTERNS, counts));
    }

    static String formatCounts(List<String> patterns, int[] counts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < patterns.size(); i++) {
            sb.append(String.format("%-10s %d%n", patterns.get(i), counts[i]));
        }
        return sb.toString();
    }
}
