package nl.adgroot.texnormalizer.tex;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import nl.adgroot.texnormalizer.tex.records.NormalizationIssue;
import org.junit.jupiter.api.Test;

class AppendixTrimmerTest {

  private final AppendixTrimmer trimmer = new AppendixTrimmer();
  private final List<NormalizationIssue> issues = new ArrayList<>();

  @Test
  void trim_removesAppendixBody_keepsEndDocument() {
    String tex = "intro\n\\appendix\n\\section{Proofs}\nlong proof\n\\end{document}\n";

    assertEquals("intro\n\\end{document}\n", trimmer.trim(tex, issues));
    assertTrue(issues.isEmpty());
  }

  @Test
  void trim_withoutAppendix_returnsInput() {
    String tex = "intro\n\\end{document}\n";

    assertEquals(tex, trimmer.trim(tex, issues));
    assertTrue(issues.isEmpty());
  }

  @Test
  void trim_appendixWithoutEndDocument_returnsInputAndReportsIssue() {
    String tex = "intro \\appendix proofs";

    assertEquals(tex, trimmer.trim(tex, issues));
    assertEquals(1, issues.size());
    assertEquals(NormalizationIssue.Kind.APPENDIX_MARKER_WITHOUT_END, issues.get(0).kind());
  }

  @Test
  void trim_ignoresEndDocumentBeforeTheAppendix() {
    String tex = "x \\end{document} y \\appendix z \\end{document}";

    assertEquals("x \\end{document} y \\end{document}", trimmer.trim(tex, issues));
  }

  @Test
  void trim_longerCommandStartingWithAppendix_isNotAMarker() {
    String tex = "\\renewcommand{\\appendixname}{Anhang} body \\end{document}";

    assertEquals(tex, trimmer.trim(tex, issues));
    assertTrue(issues.isEmpty());
  }
}
