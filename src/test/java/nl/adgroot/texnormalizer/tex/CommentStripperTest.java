package nl.adgroot.texnormalizer.tex;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CommentStripperTest {

  private final CommentStripper stripper = new CommentStripper();

  @Test
  void strip_removesTrailingComment_keepsNewline() {
    assertEquals("text \nmore", stripper.strip("text % comment\nmore"));
  }

  @Test
  void strip_escapedPercent_isKept() {
    assertEquals("50\\% of cases ", stripper.strip("50\\% of cases % remark"));
  }

  @Test
  void strip_fullCommentLine_leavesEmptyLine() {
    assertEquals("\ntext", stripper.strip("%comment\ntext"));
  }

  @Test
  void strip_percentAfterLineBreakCommand_isAComment() {
    // \\ followed by % : the backslashes escape each other, not the percent
    assertEquals("line\\\\", stripper.strip("line\\\\% comment"));
  }

  @Test
  void strip_percentInsideUrl_isKept() {
    assertEquals("\\url{http://x.org/a%20b} ", stripper.strip("\\url{http://x.org/a%20b} % c"));
  }

  @Test
  void strip_keepsCrLfAndTrailingNewline() {
    assertEquals("a \r\nb\n", stripper.strip("a % c\r\nb\n"));
  }

  @Test
  void strip_nullOrEmpty_returnsEmpty() {
    assertEquals("", stripper.strip(null));
    assertEquals("", stripper.strip(""));
  }

  @Test
  void isInComment_onlyAfterCommentStartOnSameLine() {
    String text = "a % b\nc";
    assertTrue(CommentStripper.isInComment(text, text.indexOf('b')));
    assertFalse(CommentStripper.isInComment(text, text.indexOf('c')));
    assertFalse(CommentStripper.isInComment(text, 0));
  }
}
