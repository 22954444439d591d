package nl.adgroot.texnormalizer.tex;

/**
 * Removes {@code %} comments line by line. The text before the comment and the line break stay.
 */
public class CommentStripper {

  private static final String URL_COMMAND = "\\url{";

  public String strip(String text) {
    if (text == null || text.isEmpty()) {
      return text == null ? "" : text;
    }

    StringBuilder out = new StringBuilder(text.length());
    int lineStart = 0;
    while (lineStart <= text.length()) {
      int newline = text.indexOf('\n', lineStart);
      int lineEnd = newline < 0 ? text.length() : newline;

      // keep a CRLF terminator intact
      int contentEnd = lineEnd;
      if (contentEnd > lineStart && text.charAt(contentEnd - 1) == '\r') {
        contentEnd--;
      }

      String line = text.substring(lineStart, contentEnd);
      int comment = commentStart(line);
      out.append(comment < 0 ? line : line.substring(0, comment));
      out.append(text, contentEnd, lineEnd);

      if (newline < 0) break;
      out.append('\n');
      lineStart = newline + 1;
    }
    return out.toString();
  }

  /**
   * Index of the first {@code %} in {@code line} that starts a comment, or -1.
   * Escaped percent signs ({@code \%}) and those inside a {@code &#92;url{...}} argument do not count.
   */
  public static int commentStart(String line) {
    int i = 0;
    while (i < line.length()) {
      char c = line.charAt(i);

      if (c == '\\' && line.startsWith(URL_COMMAND, i) && !isEscaped(line, i)) {
        int close = urlArgumentEnd(line, i + URL_COMMAND.length());
        if (close < 0) {
          // url runs past the line end, nothing left to strip
          return -1;
        }
        i = close + 1;
        continue;
      }

      if (c == '%' && !isEscaped(line, i)) {
        return i;
      }
      i++;
    }
    return -1;
  }

  /** Whether position {@code idx} of {@code text} lies after a comment start on its own line. */
  public static boolean isInComment(String text, int idx) {
    int lineStart = text.lastIndexOf('\n', idx - 1) + 1;
    return commentStart(text.substring(lineStart, idx)) >= 0;
  }

  /** A character is escaped when an odd number of backslashes precedes it. */
  public static boolean isEscaped(CharSequence text, int idx) {
    int backslashes = 0;
    for (int j = idx - 1; j >= 0 && text.charAt(j) == '\\'; j--) {
      backslashes++;
    }
    return backslashes % 2 == 1;
  }

  private static int urlArgumentEnd(String line, int from) {
    int depth = 0;
    for (int i = from; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        if (depth == 0) return i;
        depth--;
      }
    }
    return -1;
  }
}
