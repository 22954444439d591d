package nl.adgroot.texnormalizer.slides;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class FrametitleSanitizerTest {

  private final FrametitleSanitizer sanitizer = new FrametitleSanitizer();

  @Test
  void frametitle_bareAmpersand_isEscaped() {
    assertEquals("\\frametitle{Q\\&A}", sanitizer.sanitize("\\frametitle{Q&A}"));
  }

  @Test
  void frametitle_alreadyEscaped_isUnchanged() {
    assertEquals("\\frametitle{R\\&D}", sanitizer.sanitize("\\frametitle{R\\&D}"));
  }

  @Test
  void frametitle_overlayAndShortTitle_areEscapedToo() {
    assertEquals(
        "\\frametitle<2->[P\\&L]{Profit \\& Loss}",
        sanitizer.sanitize("\\frametitle<2->[P&L]{Profit & Loss}"));
  }

  @Test
  void frametitle_nestedBracesInTitle() {
    assertEquals("\\frametitle{\\textbf{A} \\& B}", sanitizer.sanitize("\\frametitle{\\textbf{A} & B}"));
  }

  @Test
  void beginFrame_titleIsEscaped_bodyIsNot() {
    String code = """
        \\begin{frame}[fragile]{Tips & Tricks}
        \\begin{tabular}{cc} a & b \\end{tabular}
        \\end{frame}""";
    String expected = """
        \\begin{frame}[fragile]{Tips \\& Tricks}
        \\begin{tabular}{cc} a & b \\end{tabular}
        \\end{frame}""";

    assertEquals(expected, sanitizer.sanitize(code));
  }

  @Test
  void beginFrame_groupOnNextLine_isFrameContent() {
    String code = """
        \\begin{frame}
        {\\begin{tabular}{cc} a & b \\end{tabular}}
        \\end{frame}""";

    assertEquals(code, sanitizer.sanitize(code));
  }

  @Test
  void sanitize_isIdempotent() {
    String code = """
        \\documentclass{beamer}
        \\begin{document}
        \\begin{frame}{Risks & Rewards}
          \\frametitle<1>[R&R]{Risks & Rewards}
        \\end{frame}
        \\end{document}""";

    String once = sanitizer.sanitize(code);

    assertNotEquals(code, once);
    assertEquals(once, sanitizer.sanitize(once));
  }

  @Test
  void sanitize_nullOrEmpty_returnsEmpty() {
    assertEquals("", sanitizer.sanitize(null));
    assertEquals("", sanitizer.sanitize(""));
  }
}
