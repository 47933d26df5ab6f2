package gr.imsi.athenarc.ahocorasick.experiments;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.ahocorasick.atom.AtomTokenizer;
import gr.imsi.athenarc.ahocorasick.atom.AtomType;
import gr.imsi.athenarc.ahocorasick.automaton.Automaton;
import gr.imsi.athenarc.ahocorasick.config.MatcherConfiguration;
import gr.imsi.athenarc.ahocorasick.scan.PatternScanner;
import gr.imsi.athenarc.ahocorasick.visual.DotRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Command line driver: builds an automaton from a pattern file (one pattern per
 * line), scans an input file and writes per-pattern counts and timings as CSV.
 */
public class Experiments {

    private static final Logger LOG = LoggerFactory.getLogger(Experiments.class);

    @Parameter(names = "-patterns", description = "Path of the patterns file, one pattern per line")
    public String patternsFile;

    @Parameter(names = "-input", description = "Path of the input file to scan")
    public String inputFile;

    @Parameter(names = "-atoms", description = "Atom type (character/word/byte), overrides the configuration")
    public String atoms;

    @Parameter(names = "-ignoreCase", description = "Lower-case patterns and input before matching")
    private boolean ignoreCase;

    @Parameter(names = "-config", description = "Path to a matcher properties file", required = false)
    public String configFile;

    @Parameter(names = "-out", description = "The output folder")
    private String outFolder = "output";

    @Parameter(names = "-dot", description = "Write the automaton as a Graphviz file to this path", required = false)
    private String dotFile;

    @Parameter(names = "-runs", description = "Times to build and scan", required = false)
    private Integer runs = 5;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public Experiments() {

    }

    public static void main(String... args) throws IOException {
        Experiments experiments = new Experiments();
        JCommander jCommander = new JCommander(experiments);
        jCommander.parse(args);
        if (experiments.help) {
            jCommander.usage();
        } else {
            experiments.run();
        }
    }

    private void run() throws IOException {
        Preconditions.checkNotNull(patternsFile, "No patterns file specified.");
        Preconditions.checkNotNull(inputFile, "No input file specified.");
        Preconditions.checkNotNull(outFolder, "No out folder specified.");
        Preconditions.checkArgument(runs != null && runs > 0, "Runs must be a positive number.");

        MatcherConfiguration config = createConfiguration();
        LOG.info("Matching {} against {} with {}", patternsFile, inputFile, config);
        runWith(config.getAtomType().tokenizer(config.isIgnoreCase()), config);
    }

    MatcherConfiguration createConfiguration() throws IOException {
        MatcherConfiguration config;
        if (configFile != null) {
            Properties properties = new Properties();
            try (InputStream input = Files.newInputStream(Paths.get(configFile))) {
                properties.load(input);
            }
            config = MatcherConfiguration.fromProperties(properties);
        } else {
            config = MatcherConfiguration.load();
        }

        MatcherConfiguration.Builder builder = config.toBuilder();
        if (atoms != null) {
            builder.atomType(AtomType.fromName(atoms));
        }
        if (ignoreCase) {
            builder.ignoreCase(true);
        }
        return builder.build();
    }

    private <T> void runWith(AtomTokenizer<T> tokenizer, MatcherConfiguration config) throws IOException {
        List<String> patternLines = Files.readAllLines(Paths.get(patternsFile), StandardCharsets.UTF_8);
        String text = new String(Files.readAllBytes(Paths.get(inputFile)), StandardCharsets.UTF_8);

        List<List<T>> patterns = new ArrayList<>(patternLines.size());
        for (String line : patternLines) {
            patterns.add(tokenizer.tokenize(line));
        }
        List<T> input = tokenizer.tokenize(text);

        Path outPath = Paths.get(outFolder);
        Files.createDirectories(outPath);

        Automaton<T> automaton = timeRuns(patterns, input, outPath.resolve("timings.csv"));
        writeCounts(patternLines, new PatternScanner<>(automaton, patterns), input, outPath.resolve("counts.csv"));

        if (dotFile != null) {
            String dot = new DotRenderer(config.getDotFont()).render(automaton, tokenizer::label);
            Files.write(Paths.get(dotFile), dot.getBytes(StandardCharsets.UTF_8));
            LOG.info("Wrote automaton graph to {}", dotFile);
        }
    }

    private <T> Automaton<T> timeRuns(List<List<T>> patterns, List<T> input, Path timingsFile) {
        Automaton<T> automaton = null;
        try (FileWriter fileWriter = new FileWriter(timingsFile.toFile(), false)) {
            CsvWriter csvWriter = new CsvWriter(fileWriter, new CsvWriterSettings());
            csvWriter.writeHeaders("run", "Build Time (sec)", "Scan Time (sec)", "Nodes", "Matches");

            Stopwatch stopwatch = Stopwatch.createUnstarted();
            for (int run = 0; run < runs; run++) {
                stopwatch.start();
                automaton = Automaton.build(patterns);
                double buildTime = stopwatch.elapsed(TimeUnit.NANOSECONDS) / Math.pow(10d, 9);
                stopwatch.reset();

                PatternScanner<T> scanner = new PatternScanner<>(automaton, patterns);
                stopwatch.start();
                List<List<Integer>> offsets = scanner.occurrencesByOffset(input);
                double scanTime = stopwatch.elapsed(TimeUnit.NANOSECONDS) / Math.pow(10d, 9);
                stopwatch.reset();

                long matches = offsets.stream().mapToLong(List::size).sum();
                LOG.info("Run {}: build {} sec, scan {} sec, {} nodes, {} matches",
                    run, buildTime, scanTime, automaton.size(), matches);
                csvWriter.writeRow(run, buildTime, scanTime, automaton.size(), matches);
            }
            csvWriter.close();
        } catch (IOException e) {
            LOG.error("Error while writing timings: ", e);
            throw new RuntimeException("Error while writing timings: " + e.getMessage(), e);
        }
        return automaton;
    }

    private <T> void writeCounts(List<String> patternLines, PatternScanner<T> scanner, List<T> input, Path countsFile) throws IOException {
        int[] counts = scanner.countsByPattern(input);
        List<List<Integer>> offsets = scanner.occurrencesByOffset(input);

        try (FileWriter fileWriter = new FileWriter(countsFile.toFile(), false)) {
            CsvWriter csvWriter = new CsvWriter(fileWriter, new CsvWriterSettings());
            csvWriter.writeHeaders("pattern #", "pattern", "count", "first offset");
            for (int i = 0; i < patternLines.size(); i++) {
                int firstOffset = offsets.get(i).isEmpty() ? -1 : offsets.get(i).get(0);
                csvWriter.writeRow(i, patternLines.get(i), counts[i], firstOffset);
            }
            csvWriter.close();
        }
        LOG.info("Wrote counts for {} patterns to {}", patternLines.size(), countsFile);
    }
}
