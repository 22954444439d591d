package nl.adgroot.texnormalizer.tex.records;

/**
 * Half-open range {@code [start, end)} of a command invocation whose brace argument is balanced.
 * {@code end} points just past the closing brace.
 */
public record BraceSpan(int start, int end) {

  public BraceSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
  }

  public String slice(String text) {
    return text.substring(start, end);
  }
}
