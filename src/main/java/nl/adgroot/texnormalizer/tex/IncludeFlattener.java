package nl.adgroot.texnormalizer.tex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import nl.adgroot.texnormalizer.config.AppConfig;
import nl.adgroot.texnormalizer.tex.records.IncludeDirective;
import nl.adgroot.texnormalizer.tex.records.NormalizationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inlines {@code \input} and {@code \include} targets recursively into one text.
 */
public class IncludeFlattener {

  // \input{file}, \input {file}, \input file, same for \include
  // group(1)=command, group(2)=braced target, group(3)=bare target
  private static final Pattern DIRECTIVE = Pattern.compile(
      "\\\\(input|include)(?:\\s*\\{([^}]+)\\}|\\s+([^\\s{}]+))"
  );

  private final TexSourceReader reader;
  private final int maxDepth;
  private final Logger log;

  public IncludeFlattener() {
    this(new AppConfig());
  }

  public IncludeFlattener(AppConfig cfg) {
    this(new TexSourceReader(cfg.reading), cfg.normalization.maxIncludeDepth,
        LoggerFactory.getLogger(IncludeFlattener.class));
  }

  public IncludeFlattener(TexSourceReader reader, int maxDepth, Logger log) {
    this.reader = reader;
    this.maxDepth = Math.max(1, maxDepth);
    this.log = log;
  }

  /**
   * Flattens {@code mainFile} (relative to {@code directory}).
   *
   * @param issues receives one entry per include target that could not be inlined
   * @throws IOException             when the main file itself cannot be read
   * @throws CyclicIncludeException  when includes nest deeper than the configured maximum
   */
  public String flatten(Path directory, String mainFile, List<NormalizationIssue> issues) throws IOException {
    Path root = directory.toAbsolutePath().normalize();
    Path main = root.resolve(mainFile).normalize();

    String content = reader.read(main);
    String flattened = expand(root, main, content, 0, issues);

    log.info("Flattened the .tex files with {}", mainFile);
    return flattened;
  }

  /** Directives in {@code content}, in order, skipping escaped and commented-out ones. */
  public static List<IncludeDirective> findDirectives(String content) {
    List<IncludeDirective> out = new ArrayList<>();
    Matcher m = DIRECTIVE.matcher(content);
    while (m.find()) {
      if (CommentStripper.isEscaped(content, m.start()) || CommentStripper.isInComment(content, m.start())) {
        continue;
      }

      IncludeDirective.Kind kind = "input".equals(m.group(1))
          ? IncludeDirective.Kind.INPUT
          : IncludeDirective.Kind.INCLUDE;
      boolean braced = m.group(2) != null;
      String target = (braced ? m.group(2) : m.group(3)).trim();

      out.add(new IncludeDirective(kind, target, braced, m.start(), m.end()));
    }
    return out;
  }

  private String expand(Path root, Path file, String content, int depth, List<NormalizationIssue> issues)
      throws IOException {
    List<IncludeDirective> directives = findDirectives(content);
    if (directives.isEmpty()) {
      return content;
    }

    StringBuilder out = new StringBuilder(content.length());
    int last = 0;
    for (IncludeDirective directive : directives) {
      out.append(content, last, directive.start());
      out.append(inline(root, file, directive, depth + 1, issues));
      last = directive.end();
    }
    out.append(content, last, content.length());
    return out.toString();
  }

  private String inline(Path root, Path includingFile, IncludeDirective directive, int depth,
      List<NormalizationIssue> issues) throws IOException {

    Optional<Path> target = resolve(root, includingFile.getParent(), directive);
    if (target.isEmpty()) {
      missing(issues, directive.targetFileName() + " not found for " + directive.asWritten()
          + " (included from " + root.relativize(includingFile) + ")");
      return "";
    }

    if (depth > maxDepth) {
      throw new CyclicIncludeException(target.get(), depth);
    }

    String content;
    try {
      content = reader.read(target.get());
    } catch (IOException e) {
      missing(issues, root.relativize(target.get()) + " could not be read: " + e.getMessage());
      return "";
    }

    return expand(root, target.get(), content, depth, issues);
  }

  /**
   * Resolves against the including file's directory first, then against the tree root (where
   * latex itself resolves relative paths). Targets outside the tree are never returned.
   */
  private Optional<Path> resolve(Path root, Path baseDir, IncludeDirective directive) {
    String name = directive.targetFileName();
    List<Path> bases = baseDir == null || baseDir.equals(root) ? List.of(root) : List.of(baseDir, root);

    for (Path base : bases) {
      Path candidate;
      try {
        candidate = base.resolve(name).normalize();
      } catch (InvalidPathException e) {
        log.warn("Invalid include target '{}': {}", name, e.getMessage());
        return Optional.empty();
      }

      if (!candidate.startsWith(root)) {
        log.warn("Include target {} lies outside {}, skipping", candidate, root);
        continue;
      }
      if (Files.isRegularFile(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private void missing(List<NormalizationIssue> issues, String detail) {
    log.warn("Skipping include: {}", detail);
    issues.add(new NormalizationIssue(NormalizationIssue.Kind.MISSING_INCLUDE_TARGET, detail));
  }
}
