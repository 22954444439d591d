package nl.adgroot.texnormalizer.tex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import nl.adgroot.texnormalizer.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MainFileSelector {

  private static final String DOCUMENT_CLASS = "\\documentclass";

  private final TexSourceReader reader;
  private final Set<String> artifactNames;
  private final Logger log;

  public MainFileSelector() {
    this(new AppConfig());
  }

  public MainFileSelector(AppConfig cfg) {
    this(new TexSourceReader(cfg.reading), cfg.normalization, LoggerFactory.getLogger(MainFileSelector.class));
  }

  public MainFileSelector(TexSourceReader reader, AppConfig.NormalizationConfig cfg, Logger log) {
    this.reader = reader;
    this.artifactNames = Set.of(cfg.flattenedFileName, cfg.additionalFileName);
    this.log = log;
  }

  /**
   * Picks the document root: the .tex file directly under {@code directory} that declares a
   * document class and has the most lines. Ties go to the first file name in sorted order.
   *
   * @return file name relative to {@code directory}, or empty when no file qualifies
   */
  public Optional<String> select(Path directory) throws IOException {
    String best = null;
    long bestLines = -1;

    for (Path candidate : candidates(directory)) {
      String content;
      try {
        content = reader.read(candidate);
      } catch (IOException e) {
        log.warn("Could not read {}: {}", candidate, e.getMessage());
        continue;
      }

      if (!declaresDocumentClass(content)) continue;

      long lines = content.lines().count();
      if (lines > bestLines) {
        best = candidate.getFileName().toString();
        bestLines = lines;
      }
    }

    if (best == null) {
      log.error("Main .tex file not found in {}", directory);
    } else {
      log.info("Selected main file {} ({} lines)", best, bestLines);
    }
    return Optional.ofNullable(best);
  }

  /**
   * All .tex files in the whole tree, artifacts excluded, sorted by relative path.
   */
  public List<Path> allTexFiles(Path directory) throws IOException {
    try (Stream<Path> stream = Files.walk(directory)) {
      return stream
          .filter(Files::isRegularFile)
          .filter(this::isTexSource)
          .sorted(Comparator.comparing(p -> directory.relativize(p).toString().replace('\\', '/')))
          .toList();
    }
  }

  static boolean declaresDocumentClass(String content) {
    for (String line : content.split("\\R")) {
      int idx = line.indexOf(DOCUMENT_CLASS);
      if (idx >= 0 && !CommentStripper.isInComment(line, idx)) {
        return true;
      }
    }
    return false;
  }

  private List<Path> candidates(Path directory) throws IOException {
    List<Path> out = new ArrayList<>();
    try (Stream<Path> stream = Files.list(directory)) {
      stream
          .filter(Files::isRegularFile)
          .filter(this::isTexSource)
          .forEach(out::add);
    }
    // deterministic order, Files.list has none
    out.sort(Comparator.comparing(p -> p.getFileName().toString()));
    return out;
  }

  private boolean isTexSource(Path p) {
    String name = p.getFileName().toString();
    return name.endsWith(".tex") && !artifactNames.contains(name);
  }
}
