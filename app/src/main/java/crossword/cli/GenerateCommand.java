package crossword.cli;

import crossword.core.GridConfig;
import crossword.core.model.Grid;
import crossword.core.model.PlacedWord;
import crossword.layout.NumberedEntry;
import crossword.layout.WordNumbering;
import crossword.select.SelectionReport;
import crossword.select.TrialSelector;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the `generate` command. */
final class GenerateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

  static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage: generate (--words A,B,C | --file words.txt | --example name) [options]",
          "  --width N            grid width (default " + CliOptions.DEFAULT_SIZE + ")",
          "  --height N           grid height (default " + CliOptions.DEFAULT_SIZE + ")",
          "  --size N             sets width and height",
          "  --wrap               wrap horizontally (cylindrical grid)",
          "  --trials N           trials per worker (default 1000)",
          "  --workers N          concurrent workers (default 4)",
          "  --seed N             base seed for reproducible runs",
          "  --time-budget-ms N   stop workers at the next trial after N ms",
          "  --json               print a JSON report to stdout");

  private final PrintStream out;

  GenerateCommand(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  int execute(String[] args) throws IOException {
    CliOptions options = parseArgs(args);
    if (options.help()) {
      out.println(USAGE);
      return 0;
    }

    List<String> words = loadWords(options);
    GridConfig config = new GridConfig(options.width(), options.height(), options.wrap());
    TrialSelector selector = new TrialSelector(options.selectionOptions());
    SelectionReport report = selector.select(config, words);

    if (options.json()) {
      out.println(new JsonReportBuilder().build(report));
    } else {
      logSummary(report);
    }
    return report.completed() ? 0 : 3;
  }

  CliOptions parseArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= effectiveArgs.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = effectiveArgs[++i];
        }
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--words", OptionSpec.withValue((b, raw) -> b.words(CliParsers.parseWords(raw))));
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.wordFile(raw)));
    specs.put("--example", OptionSpec.withValue((b, raw) -> b.exampleName(raw)));
    specs.put(
        "--width", OptionSpec.withValue((b, raw) -> b.width(CliParsers.parseInt(raw, "--width"))));
    specs.put(
        "--height",
        OptionSpec.withValue((b, raw) -> b.height(CliParsers.parseInt(raw, "--height"))));
    specs.put(
        "--size", OptionSpec.withValue((b, raw) -> b.size(CliParsers.parseInt(raw, "--size"))));
    specs.put("--wrap", OptionSpec.flag(b -> b.wrap(true)));
    specs.put(
        "--trials",
        OptionSpec.withValue((b, raw) -> b.trialsPerWorker(CliParsers.parseInt(raw, "--trials"))));
    specs.put(
        "--workers",
        OptionSpec.withValue((b, raw) -> b.workers(CliParsers.parseInt(raw, "--workers"))));
    specs.put(
        "--seed", OptionSpec.withValue((b, raw) -> b.seed(CliParsers.parseLong(raw, "--seed"))));
    specs.put(
        "--time-budget-ms",
        OptionSpec.withValue(
            (b, raw) -> b.timeBudgetMs(CliParsers.parseLong(raw, "--time-budget-ms"))));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    specs.put("--help", OptionSpec.flag(b -> b.help(true)));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("generate".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private List<String> loadWords(CliOptions options) throws IOException {
    if (options.hasInlineWords()) {
      return options.words();
    }
    if (options.hasWordFile()) {
      return CliParsers.loadWordsFromFile(options.wordFile());
    }
    if (options.hasExample()) {
      return CliParsers.loadExampleByName(options.exampleName());
    }
    throw new IllegalStateException("Missing word list input.");
  }

  private void logSummary(SelectionReport report) {
    Grid grid = report.grid();
    LOG.info(
        "Density {} with {} of {} word(s) placed",
        String.format(Locale.ROOT, "%.3f", report.density()),
        grid.wordCount(),
        report.rankedWords().size());
    for (String row : JsonReportBuilder.rows(grid)) {
      LOG.info("  {}", row);
    }
    for (PlacedWord word : grid.placedWords()) {
      LOG.info("  {} at ({}, {}) {}", word.word(), word.x(), word.y(), word.direction());
    }
    for (NumberedEntry entry : WordNumbering.number(grid)) {
      LOG.debug("  {} {}", entry.label(), entry.answer());
    }
    List<String> unplaced = report.unplacedWords();
    if (!unplaced.isEmpty()) {
      LOG.info("Unplaced: {}", String.join(", ", unplaced));
    }
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
