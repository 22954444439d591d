package nl.adgroot.texnormalizer.tex.records;

/**
 * One {@code \input} / {@code \include} occurrence inside a file being flattened.
 *
 * @param kind    which command was used
 * @param target  file name as written (trimmed, without forced .tex suffix)
 * @param braced  {@code \input{name}} versus {@code \input name}
 * @param start   offset of the backslash
 * @param end     offset just past the directive
 */
public record IncludeDirective(Kind kind, String target, boolean braced, int start, int end) {

  public enum Kind { INPUT, INCLUDE }

  /** The directive in its normalized surface form, e.g. {@code \input{intro}} or {@code \include chap1}. */
  public String asWritten() {
    String command = kind == Kind.INPUT ? "\\input" : "\\include";
    return braced ? command + "{" + target + "}" : command + " " + target;
  }

  /** Target with a {@code .tex} suffix appended when it has none. */
  public String targetFileName() {
    return target.endsWith(".tex") ? target : target + ".tex";
  }
}
