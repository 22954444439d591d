package nl.adgroot.texnormalizer.tex;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import nl.adgroot.texnormalizer.config.AppConfig;
import nl.adgroot.texnormalizer.tex.records.BraceSpan;
import nl.adgroot.texnormalizer.tex.records.DefinitionRecord;
import nl.adgroot.texnormalizer.tex.records.NormalizationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the macro definitions and package imports of a paper so they can be loaded again
 * from the slides (ADDITIONAL.tex).
 *
 * <p>{@code \def}, {@code \DeclareMathOperator} and {@code \DeclarePairedDelimiter} are taken line
 * by line, {@code \newcommand} through {@link BraceScanner}, {@code &#92;usepackage} lines are wrapped
 * in {@code \IfFileExists} so a package missing from the slide build does not break it.
 */
public class DefinitionExtractor {

  public static final String EMPTY_PLACEHOLDER = "% No additional definitions or packages found.";

  private static final List<String> LINE_DECLARATIONS = List.of(
      "\\def", "\\DeclareMathOperator", "\\DeclarePairedDelimiter"
  );

  private static final String USEPACKAGE = "\\usepackage";

  // usepackage[opts]{name} or usepackage{a,b}
  // group(1)=options incl. brackets, group(2)=package list
  private static final Pattern USEPACKAGE_CLAUSE = Pattern.compile(
      "\\\\usepackage\\s*(\\[[^\\]]*\\])?\\s*\\{([^}]*)\\}"
  );

  // \newcommand{\foo}[2][default]{  or  \newcommand\foo{
  private static final Pattern NEWCOMMAND = Pattern.compile(
      "\\\\newcommand\\*?\\s*(\\\\[\\w@]+|\\{\\s*\\\\[\\w@]+\\s*\\})\\s*(\\[[0-9]+\\])?\\s*(\\[[^\\]]*\\])?\\s*\\{"
  );

  private final Set<String> commentedOutPackages;
  private final Logger log;

  public DefinitionExtractor() {
    this(new AppConfig().packages);
  }

  public DefinitionExtractor(AppConfig.PackagesConfig cfg) {
    this(cfg, LoggerFactory.getLogger(DefinitionExtractor.class));
  }

  public DefinitionExtractor(AppConfig.PackagesConfig cfg, Logger log) {
    this.commentedOutPackages = cfg.commentOut == null ? Set.of() : Set.copyOf(cfg.commentOut);
    this.log = log;
  }

  /**
   * @param latex     normalized document
   * @param sourceDir directory of the paper sources, checked for local .sty overrides (nullable)
   * @param issues    receives malformed declarations that were skipped
   * @return records in the order they first appear in {@code latex}
   */
  public List<DefinitionRecord> extract(String latex, Path sourceDir, List<NormalizationIssue> issues) {
    if (latex == null || latex.isEmpty()) {
      return List.of();
    }

    List<DefinitionRecord> records = new ArrayList<>();
    records.addAll(extractLineDeclarations(latex, sourceDir, issues));
    records.addAll(extractNewCommands(latex, issues));

    // stable: records sharing a line keep their order
    records.sort(Comparator.comparingInt(DefinitionRecord::offset));

    log.info("Extracted {} definitions and package imports", records.size());
    return records;
  }

  /** Contents of ADDITIONAL.tex. Never empty, so slides can always {@code \input} it. */
  public static String render(List<DefinitionRecord> records) {
    if (records == null || records.isEmpty()) {
      return EMPTY_PLACEHOLDER;
    }
    return String.join("\n", records.stream().map(DefinitionRecord::text).toList());
  }

  List<DefinitionRecord> extractNewCommands(String latex, List<NormalizationIssue> issues) {
    List<DefinitionRecord> out = new ArrayList<>();
    Matcher m = NEWCOMMAND.matcher(latex);
    int from = 0;

    while (from < latex.length() && m.find(from)) {
      int start = m.start();
      if (CommentStripper.isEscaped(latex, start) || CommentStripper.isInComment(latex, start)) {
        from = m.end();
        continue;
      }

      Optional<BraceSpan> span = BraceScanner.scan(latex, start, m.end() - 1);
      if (span.isEmpty()) {
        String detail = "Unbalanced braces in " + m.group().strip() + " at offset " + start;
        log.warn("{}, skipping", detail);
        issues.add(new NormalizationIssue(NormalizationIssue.Kind.UNBALANCED_DELIMITER, detail));
        from = m.end();
        continue;
      }

      out.add(new DefinitionRecord(DefinitionRecord.Kind.MACRO_DEFINITION, span.get().slice(latex), start));
      from = span.get().end();
    }
    return out;
  }

  List<DefinitionRecord> extractLineDeclarations(String latex, Path sourceDir, List<NormalizationIssue> issues) {
    List<DefinitionRecord> out = new ArrayList<>();

    List<String> accumulated = new ArrayList<>();
    int accumulatedOffset = -1;
    List<String> pendingPackage = new ArrayList<>();
    int pendingPackageOffset = -1;
    int offset = 0;

    for (String line : latex.split("\n", -1)) {
      String stripped = line.strip();

      if (!pendingPackage.isEmpty() && startsStatement(stripped)) {
        // the open package clause was never closed, do not let it swallow this line
        unclosedPackage(pendingPackage, pendingPackageOffset, issues);
        pendingPackage.clear();
      }

      if (!pendingPackage.isEmpty()) {
        // options of a usepackage continuing on the following lines
        pendingPackage.add(line);
        String joined = joinPackageLines(pendingPackage);
        if (isCompletePackageClause(joined)) {
          out.addAll(rewriteUsePackage(joined, pendingPackageOffset, sourceDir));
          pendingPackage.clear();
        }
      } else if (!accumulated.isEmpty()) {
        // still inside a multi-line declaration
        accumulated.add(stripped);
        if (stripped.endsWith("}")) {
          out.add(macro(accumulated, accumulatedOffset));
          accumulated.clear();
        }
      } else if (startsWithDeclaration(stripped)) {
        accumulated.add(stripped);
        accumulatedOffset = offset;
        if (stripped.endsWith("}")) {
          out.add(macro(accumulated, accumulatedOffset));
          accumulated.clear();
        }
      } else if (stripped.startsWith(USEPACKAGE)) {
        if (isOpenPackageClause(line)) {
          pendingPackage.add(line);
          pendingPackageOffset = offset;
        } else {
          out.addAll(rewriteUsePackage(line, offset, sourceDir));
        }
      }

      offset += line.length() + 1;
    }

    if (!accumulated.isEmpty()) {
      String detail = "Declaration never closed: " + accumulated.get(0) + " at offset " + accumulatedOffset;
      log.warn("{}, skipping", detail);
      issues.add(new NormalizationIssue(NormalizationIssue.Kind.UNBALANCED_DELIMITER, detail));
    }
    if (!pendingPackage.isEmpty()) {
      unclosedPackage(pendingPackage, pendingPackageOffset, issues);
    }
    return out;
  }

  /**
   * A usepackage line whose {@code [options]} or {@code {names}} group is not closed on the same
   * line, or that has no names group yet.
   */
  private static boolean isOpenPackageClause(String line) {
    String main = mainPart(line);
    if (isCompletePackageClause(main)) {
      return false;
    }
    return count(main, '[') > count(main, ']') || count(main, '{') > count(main, '}') || main.indexOf('{') < 0;
  }

  private static boolean isCompletePackageClause(String line) {
    return USEPACKAGE_CLAUSE.matcher(mainPart(line)).lookingAt();
  }

  /**
   * Joins the lines of one usepackage clause with single spaces. Comments inside the clause are
   * dropped, the comment of the last line is kept.
   */
  private static String joinPackageLines(List<String> lines) {
    List<String> parts = new ArrayList<>(lines.size());
    for (String line : lines) {
      String main = mainPart(line);
      if (!main.isEmpty()) parts.add(main);
    }
    String last = lines.get(lines.size() - 1);
    int commentIdx = CommentStripper.commentStart(last);
    String comment = commentIdx < 0 ? "" : " " + last.substring(commentIdx).stripTrailing();
    return String.join(" ", parts) + comment;
  }

  private void unclosedPackage(List<String> lines, int offset, List<NormalizationIssue> issues) {
    String detail = "Package clause never closed: " + lines.get(0).strip() + " at offset " + offset;
    log.warn("{}, skipping", detail);
    issues.add(new NormalizationIssue(NormalizationIssue.Kind.UNBALANCED_DELIMITER, detail));
  }

  private static boolean startsStatement(String stripped) {
    return stripped.startsWith(USEPACKAGE)
        || stripped.startsWith("\\documentclass")
        || stripped.startsWith("\\begin{document}")
        || stripped.startsWith("\\newcommand")
        || startsWithDeclaration(stripped);
  }

  private static String mainPart(String line) {
    int commentIdx = CommentStripper.commentStart(line);
    return (commentIdx < 0 ? line : line.substring(0, commentIdx)).strip();
  }

  private static int count(String text, char c) {
    int n = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == c) n++;
    }
    return n;
  }

  /**
   * Wraps one {@code &#92;usepackage} line as {@code \IfFileExists{pkg.sty}{...}{}} and comments it out
   * when the package is known to clash with beamer or a local pkg.sty would shadow it.
   */
  List<DefinitionRecord> rewriteUsePackage(String line, int offset, Path sourceDir) {
    int commentIdx = CommentStripper.commentStart(line);
    String mainPart = mainPart(line);
    String comment = commentIdx < 0 ? "" : line.substring(commentIdx).stripTrailing();

    Matcher m = USEPACKAGE_CLAUSE.matcher(mainPart);
    List<String> names = m.lookingAt() ? splitPackageNames(m.group(2)) : List.of();
    if (names.isEmpty()) {
      return List.of(packageRecord(mainPart + comment, offset));
    }

    if (names.size() == 1) {
      return List.of(packageRecord(guard(names.get(0), mainPart, comment, sourceDir), offset));
    }

    // usepackage{a,b}: one guard per package, the options apply to each
    String options = m.group(1) == null ? "" : m.group(1);
    List<DefinitionRecord> out = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      String name = names.get(i);
      String clause = USEPACKAGE + options + "{" + name + "}";
      String trailing = i == names.size() - 1 ? comment : "";
      out.add(packageRecord(guard(name, clause, trailing, sourceDir), offset));
    }
    return out;
  }

  private String guard(String packageName, String clause, String comment, Path sourceDir) {
    String wrapped = "\\IfFileExists{" + packageName + ".sty}{" + clause + "}{}" + comment;
    if (commentedOutPackages.contains(packageName) || hasLocalStyle(sourceDir, packageName)) {
      return "% " + wrapped;
    }
    return wrapped;
  }

  private boolean hasLocalStyle(Path sourceDir, String packageName) {
    if (sourceDir == null) return false;
    try {
      return Files.exists(sourceDir.resolve(packageName + ".sty"));
    } catch (InvalidPathException e) {
      log.debug("Not a valid package file name: {}", packageName);
      return false;
    }
  }

  private static boolean startsWithDeclaration(String stripped) {
    for (String token : LINE_DECLARATIONS) {
      if (stripped.startsWith(token)) return true;
    }
    return false;
  }

  private static List<String> splitPackageNames(String list) {
    List<String> out = new ArrayList<>();
    for (String raw : list.split(",")) {
      String name = raw.strip();
      if (!name.isEmpty()) out.add(name);
    }
    return out;
  }

  private static DefinitionRecord macro(List<String> lines, int offset) {
    return new DefinitionRecord(DefinitionRecord.Kind.MACRO_DEFINITION, String.join(" ", lines), offset);
  }

  private static DefinitionRecord packageRecord(String text, int offset) {
    return new DefinitionRecord(DefinitionRecord.Kind.PACKAGE_DECLARATION, text, offset);
  }
}
