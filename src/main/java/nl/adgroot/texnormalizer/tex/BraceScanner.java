package nl.adgroot.texnormalizer.tex;

import java.util.Optional;

import nl.adgroot.texnormalizer.tex.records.BraceSpan;

/**
 * Finds the end of a brace-delimited command argument.
 *
 * <p>Scanning starts right after the opening brace with depth 0. Every opening brace raises the
 * depth, every closing brace lowers it, and the span closes on the brace that would take the depth
 * to -1. Escaped braces are skipped as a two character unit. Line breaks are ordinary characters,
 * so arguments may span lines.
 */
public final class BraceScanner {

  private BraceScanner() {
    // utility class
  }

  /**
   * @param text        text to scan
   * @param start       start of the command invocation (becomes the span start)
   * @param openBrace   index of the opening brace of the argument to balance
   * @return span from {@code start} to just past the matching closing brace, or empty when the
   *     text ends before the braces balance
   */
  public static Optional<BraceSpan> scan(String text, int start, int openBrace) {
    if (text == null || openBrace < start || openBrace >= text.length() || text.charAt(openBrace) != '{') {
      return Optional.empty();
    }

    int depth = 0;
    int i = openBrace + 1;
    while (i < text.length()) {
      char c = text.charAt(i);

      // \{ and \} do not count, \\ is a line break and must not escape the next brace
      if (c == '\\' && i + 1 < text.length() && isEscapable(text.charAt(i + 1))) {
        i += 2;
        continue;
      }

      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == -1) {
          return Optional.of(new BraceSpan(start, i + 1));
        }
      }
      i++;
    }
    return Optional.empty();
  }

  /** Balances the argument opening at {@code openBrace}; the span starts at that brace. */
  public static Optional<BraceSpan> group(String text, int openBrace) {
    return scan(text, openBrace, openBrace);
  }

  private static boolean isEscapable(char c) {
    return c == '{' || c == '}' || c == '\\';
  }
}
