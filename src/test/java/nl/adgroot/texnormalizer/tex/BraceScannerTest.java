package nl.adgroot.texnormalizer.tex;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import nl.adgroot.texnormalizer.tex.records.BraceSpan;
import org.junit.jupiter.api.Test;

class BraceScannerTest {

  @Test
  void scan_nestedBraces_spansWholeInvocation() {
    String text = "\\newcommand{\\foo}{a{b{c}d}e} rest";
    int open = text.indexOf("{a");

    Optional<BraceSpan> span = BraceScanner.scan(text, 0, open);

    assertTrue(span.isPresent());
    assertEquals("\\newcommand{\\foo}{a{b{c}d}e}", span.get().slice(text));
  }

  @Test
  void scan_escapedOpeningBrace_isNotCounted() {
    String text = "\\newcommand{\\foo}{a\\{b}";

    Optional<BraceSpan> span = BraceScanner.scan(text, 0, text.indexOf("{a"));

    assertTrue(span.isPresent());
    assertEquals(text.length(), span.get().end());
  }

  @Test
  void group_escapedClosingBrace_doesNotCloseTheGroup() {
    String text = "{a\\}b} tail";

    Optional<BraceSpan> span = BraceScanner.group(text, 0);

    assertEquals("{a\\}b}", span.orElseThrow().slice(text));
  }

  @Test
  void group_lineBreakBeforeBrace_stillCountsTheBrace() {
    // \\ is a line break, the brace after it is a real one
    String text = "{a\\\\}b}";

    Optional<BraceSpan> span = BraceScanner.group(text, 0);

    assertEquals("{a\\\\}", span.orElseThrow().slice(text));
  }

  @Test
  void group_spansMultipleLines() {
    String text = "{\n  \\mathbf{#1}\n}\nafter";

    Optional<BraceSpan> span = BraceScanner.group(text, 0);

    assertEquals("{\n  \\mathbf{#1}\n}", span.orElseThrow().slice(text));
  }

  @Test
  void scan_unbalanced_returnsEmpty() {
    String text = "\\newcommand{\\foo}{a{b}";

    assertTrue(BraceScanner.scan(text, 0, text.indexOf("{a")).isEmpty());
  }

  @Test
  void scan_positionIsNotABrace_returnsEmpty() {
    assertTrue(BraceScanner.scan("abc", 0, 1).isEmpty());
    assertTrue(BraceScanner.scan("abc", 0, 10).isEmpty());
    assertTrue(BraceScanner.scan(null, 0, 0).isEmpty());
  }
}
