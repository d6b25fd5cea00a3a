package io.github.linepicker.cli;

import io.github.linepicker.LineSource;
import io.github.linepicker.RankedCandidate;
import io.github.linepicker.Ranker;
import io.github.linepicker.ScoringConfig;
import io.github.linepicker.exception.NoInputException;
import io.github.linepicker.util.ScoringSettings;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/**
 * Non-interactive front end: reads candidate lines from standard input, ranks them against the query given with
 * {@code --filter}, and prints the result to standard output.
 */
@CommandLine.Command(
        name = "linepicker",
        version = "linepicker " + LinePickerCli.VERSION,
        description = "Fuzzy-filters lines read from standard input.")
public final class LinePickerCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(LinePickerCli.class);

    static final String VERSION = "0.0.1";

    static final int EXIT_MATCHED = 0;
    static final int EXIT_NO_MATCH = 1;
    static final int EXIT_NO_INPUT = 2;

    @CommandLine.Option(
            names = {"-h", "--help"},
            usageHelp = true,
            description = "Show this help message and exit.")
    private boolean helpRequested = false;

    @CommandLine.Option(
            names = {"-v", "--version"},
            versionHelp = true,
            description = "Print version information and exit.")
    private boolean versionRequested = false;

    @CommandLine.Option(
            names = {"-f", "--filter"},
            required = true,
            description = "Query to rank standard input against. An empty query prints the input unchanged.")
    private String query = "";

    @CommandLine.Option(names = "--first", description = "Print only the best-ranked line.")
    private boolean firstOnly = false;

    @CommandLine.Option(names = "--scores", description = "Prefix each line with its score and a tab.")
    private boolean showScores = false;

    @CommandLine.Option(
            names = "--config",
            description = "Scoring properties file. Defaults to scoring.properties in the config directory.")
    @Nullable
    private Path configFile;

    private final InputStream in;
    private final PrintStream out;

    public LinePickerCli() {
        this(System.in, new PrintStream(System.out, true, StandardCharsets.UTF_8));
    }

    LinePickerCli(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LinePickerCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        ScoringConfig config = configFile != null ? ScoringSettings.load(configFile) : ScoringSettings.load();

        List<String> candidates;
        try {
            candidates = LineSource.readLines(in);
        } catch (NoInputException e) {
            logger.error(e.getMessage());
            return EXIT_NO_INPUT;
        }

        var ranked = new Ranker(config).rankDetailed(query, candidates);
        if (ranked.isEmpty()) {
            logger.debug("No line matched '{}'", query);
            return EXIT_NO_MATCH;
        }

        var toPrint = firstOnly ? ranked.subList(0, 1) : ranked;
        for (RankedCandidate entry : toPrint) {
            out.println(showScores ? entry.score() + "\t" + entry.text() : entry.text());
        }
        out.flush();
        return EXIT_MATCHED;
    }
}
