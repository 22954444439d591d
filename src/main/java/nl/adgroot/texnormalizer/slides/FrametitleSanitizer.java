package nl.adgroot.texnormalizer.slides;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import nl.adgroot.texnormalizer.tex.BraceScanner;
import nl.adgroot.texnormalizer.tex.CommentStripper;
import nl.adgroot.texnormalizer.tex.records.BraceSpan;

/**
 * Escapes bare ampersands in frame titles of generated beamer code. An unescaped {@code &} in a
 * title is a fatal "misplaced alignment tab" error for pdflatex.
 *
 * <p>Handles {@code \begin{frame}<overlay>[options]{Title}} and
 * {@code \frametitle<overlay>[short]{Title}}; overlay, options and short title are optional.
 * Already escaped ampersands are left alone, so sanitizing twice changes nothing.
 */
public class FrametitleSanitizer {

  private static final Pattern FRAME_HEADER = Pattern.compile(
      "\\\\begin\\{frame\\}|\\\\frametitle(?![A-Za-z])"
  );
  private static final Pattern BARE_AMPERSAND = Pattern.compile("(?<!\\\\)&");

  public String sanitize(String beamerCode) {
    if (beamerCode == null || beamerCode.isEmpty()) {
      return "";
    }

    List<int[]> groups = new ArrayList<>();
    Matcher m = FRAME_HEADER.matcher(beamerCode);
    int from = 0;
    while (from < beamerCode.length() && m.find(from)) {
      if (CommentStripper.isEscaped(beamerCode, m.start())) {
        from = m.end();
        continue;
      }
      boolean frameEnvironment = m.group().startsWith("\\begin");
      from = Math.max(m.end(), collectGroups(beamerCode, m.end(), frameEnvironment, groups));
    }

    if (groups.isEmpty()) {
      return beamerCode;
    }

    StringBuilder out = new StringBuilder(beamerCode.length() + 16);
    int last = 0;
    for (int[] g : groups) {
      out.append(beamerCode, last, g[0]);
      out.append(escapeAmpersands(beamerCode.substring(g[0], g[1])));
      last = g[1];
    }
    out.append(beamerCode, last, beamerCode.length());
    return out.toString();
  }

  static String escapeAmpersands(String group) {
    return BARE_AMPERSAND.matcher(group).replaceAll("\\\\&");
  }

  /**
   * Adds the argument groups following a frame header to {@code groups}, but only when a title
   * group is present. Returns the position after the title, or {@code pos} when nothing matched.
   *
   * <p>For {@code \begin{frame}} the title must start on the same line: a brace group on the next
   * line is frame content (often a tabular, where the ampersands are meant).
   */
  private static int collectGroups(String code, int pos, boolean frameEnvironment, List<int[]> groups) {
    List<int[]> found = new ArrayList<>(3);
    int i = skipBlanks(code, pos, frameEnvironment);

    if (i < code.length() && code.charAt(i) == '<') {
      int close = code.indexOf('>', i);
      if (close < 0) return pos;
      found.add(new int[] {i, close + 1});
      i = skipBlanks(code, close + 1, frameEnvironment);
    }

    if (i < code.length() && code.charAt(i) == '[') {
      int close = code.indexOf(']', i);
      if (close < 0) return pos;
      found.add(new int[] {i, close + 1});
      i = skipBlanks(code, close + 1, frameEnvironment);
    }

    if (i >= code.length() || code.charAt(i) != '{') {
      return pos;
    }
    Optional<BraceSpan> title = BraceScanner.group(code, i);
    if (title.isEmpty()) {
      return pos;
    }

    found.add(new int[] {title.get().start(), title.get().end()});
    groups.addAll(found);
    return title.get().end();
  }

  private static int skipBlanks(String code, int from, boolean sameLine) {
    int i = from;
    while (i < code.length() && Character.isWhitespace(code.charAt(i))) {
      if (sameLine && code.charAt(i) == '\n') break;
      i++;
    }
    return i;
  }
}
