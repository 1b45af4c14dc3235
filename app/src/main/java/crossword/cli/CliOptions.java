package crossword.cli;

import crossword.core.SelectionOptions;
import java.util.List;

record CliOptions(
    List<String> words,
    String wordFile,
    String exampleName,
    int width,
    int height,
    boolean wrap,
    int trialsPerWorker,
    int workers,
    Long seed,
    long timeBudgetMs,
    boolean json,
    boolean help) {

  static final int DEFAULT_SIZE = 15;

  CliOptions {
    words = words == null ? List.of() : List.copyOf(words);
  }

  boolean hasInlineWords() {
    return !words.isEmpty();
  }

  boolean hasWordFile() {
    return wordFile != null && !wordFile.isBlank();
  }

  boolean hasExample() {
    return exampleName != null && !exampleName.isBlank();
  }

  SelectionOptions selectionOptions() {
    return new SelectionOptions(trialsPerWorker, workers, seed, timeBudgetMs);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private List<String> words = List.of();
    private String wordFile;
    private String exampleName;
    private int width = DEFAULT_SIZE;
    private int height = DEFAULT_SIZE;
    private boolean wrap;
    private int trialsPerWorker = SelectionOptions.DEFAULT_TRIALS_PER_WORKER;
    private int workers = SelectionOptions.DEFAULT_WORKERS;
    private Long seed;
    private long timeBudgetMs;
    private boolean json;
    private boolean help;

    Builder words(List<String> words) {
      if (words != null) {
        this.words = List.copyOf(words);
      }
      return this;
    }

    Builder wordFile(String wordFile) {
      this.wordFile = wordFile;
      return this;
    }

    Builder exampleName(String exampleName) {
      this.exampleName = exampleName;
      return this;
    }

    Builder width(int width) {
      this.width = width;
      return this;
    }

    Builder height(int height) {
      this.height = height;
      return this;
    }

    Builder size(int size) {
      this.width = size;
      this.height = size;
      return this;
    }

    Builder wrap(boolean wrap) {
      this.wrap = wrap;
      return this;
    }

    Builder trialsPerWorker(int trialsPerWorker) {
      this.trialsPerWorker = trialsPerWorker;
      return this;
    }

    Builder workers(int workers) {
      this.workers = workers;
      return this;
    }

    Builder seed(Long seed) {
      this.seed = seed;
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      this.timeBudgetMs = timeBudgetMs;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    Builder help(boolean help) {
      this.help = help;
      return this;
    }

    CliOptions build() {
      int sources = 0;
      if (!words.isEmpty()) sources++;
      if (wordFile != null && !wordFile.isBlank()) sources++;
      if (exampleName != null && !exampleName.isBlank()) sources++;
      if (!help && sources == 0) {
        throw new IllegalArgumentException("Provide exactly one of --words, --file or --example");
      }
      if (sources > 1) {
        throw new IllegalArgumentException("Provide at most one of --words, --file or --example");
      }
      return new CliOptions(
          words,
          wordFile,
          exampleName,
          width,
          height,
          wrap,
          trialsPerWorker,
          workers,
          seed,
          timeBudgetMs,
          json,
          help);
    }
  }
}
