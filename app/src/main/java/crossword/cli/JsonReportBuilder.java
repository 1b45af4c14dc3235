package crossword.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import crossword.core.model.Grid;
import crossword.core.model.PlacedWord;
import crossword.layout.NumberedEntry;
import crossword.layout.WordNumbering;
import crossword.select.SelectionReport;
import crossword.select.WorkerOutcome;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  static final char EMPTY_CELL = '.';

  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(SelectionReport report) {
    Grid grid = report.grid();
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(report));
    root.put("density", report.density());
    root.put("rows", rows(grid));
    root.put("placed_words", placedWords(grid.placedWords()));
    root.put("unplaced_words", report.unplacedWords());
    root.put("entries", entries(WordNumbering.number(grid)));
    root.put("workers", workers(report.workers()));
    if (report.terminationReason() != null) {
      root.put("termination_reason", report.terminationReason());
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(SelectionReport report) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("width", report.config().width());
    meta.put("height", report.config().height());
    meta.put("wrap", report.config().wrap());
    meta.put("seed", report.baseSeed());
    meta.put("trials", report.trialsRun());
    meta.put("time_ms", report.elapsedMillis());
    return meta;
  }

  static List<String> rows(Grid grid) {
    List<String> rows = new ArrayList<>(grid.height());
    for (String row : grid.rows()) {
      rows.add(row.replace(Grid.EMPTY, EMPTY_CELL));
    }
    return rows;
  }

  private List<Map<String, Object>> placedWords(List<PlacedWord> words) {
    List<Map<String, Object>> list = new ArrayList<>(words.size());
    for (PlacedWord word : words) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("word", word.word());
      map.put("x", word.x());
      map.put("y", word.y());
      map.put("direction", word.direction().name().toLowerCase(Locale.ROOT));
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> entries(List<NumberedEntry> entries) {
    List<Map<String, Object>> list = new ArrayList<>(entries.size());
    for (NumberedEntry entry : entries) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("number", entry.number());
      map.put("label", entry.label());
      map.put("x", entry.x());
      map.put("y", entry.y());
      map.put("answer", entry.answer());
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> workers(List<WorkerOutcome> outcomes) {
    List<Map<String, Object>> list = new ArrayList<>(outcomes.size());
    for (WorkerOutcome outcome : outcomes) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("worker", outcome.worker());
      map.put("trials", outcome.trialsRun());
      if (outcome.hasResult()) {
        map.put("best_density", outcome.best().density());
        map.put("best_seed", outcome.bestSeed());
      }
      if (outcome.stopReason() != null) {
        map.put("stop_reason", outcome.stopReason());
      }
      list.add(map);
    }
    return list;
  }
}
