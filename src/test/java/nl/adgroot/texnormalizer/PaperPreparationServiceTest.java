package nl.adgroot.texnormalizer;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import nl.adgroot.texnormalizer.config.AppConfig;
import nl.adgroot.texnormalizer.tex.DefinitionExtractor;
import nl.adgroot.texnormalizer.tex.records.DefinitionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PaperPreparationServiceTest {

  @TempDir
  Path tmp;

  private final AppConfig cfg = new AppConfig();

  @BeforeEach
  void paper() throws IOException {
    write("main.tex", """
        \\documentclass{article}
        \\usepackage{xcolor}
        \\newcommand{\\R}{\\mathbb{R}}
        \\begin{document}
        \\input{sections/intro}
        \\includegraphics{figs/plot.png}
        \\appendix
        Proofs
        \\end{document}
        """);
    write("sections/intro.tex", "Intro % todo\n");
    write("figs/plot.png", "");
  }

  @Test
  void loadAndPrepare_collectsDocumentDefinitionsAndImages() throws IOException {
    PreparedPaper paper = new PaperPreparationService(cfg).loadAndPrepare(tmp);

    assertEquals("""
        \\documentclass{article}
        \\usepackage{xcolor}
        \\newcommand{\\R}{\\mathbb{R}}
        \\begin{document}
        Intro\s

        \\includegraphics{figs/plot.png}
        \\end{document}
        """, paper.document().content());

    List<String> definitions = paper.definitions().stream().map(DefinitionRecord::text).toList();
    assertEquals(List.of(
        "% \\IfFileExists{xcolor.sty}{\\usepackage{xcolor}}{}",
        "\\newcommand{\\R}{\\mathbb{R}}"), definitions);

    assertEquals(List.of("figs/plot.png"), paper.imageFiles());
    assertTrue(paper.issues().isEmpty());
  }

  @Test
  void artifactWriter_writesBothFilesNextToTheSources() throws IOException {
    PreparedPaper paper = new PaperPreparationService(cfg).loadAndPrepare(tmp);
    ArtifactWriter writer = new ArtifactWriter(cfg.normalization);

    Path flattened = writer.writeFlattened(tmp, "% header\n\n", paper.document().content());
    Path additional = writer.writeAdditional(tmp, paper);

    assertEquals(tmp.resolve("FLATTENED.tex"), flattened);
    assertEquals("% header\n\n" + paper.document().content(), Files.readString(flattened, StandardCharsets.UTF_8));
    assertEquals(DefinitionExtractor.render(paper.definitions()), Files.readString(additional, StandardCharsets.UTF_8));
  }

  @Test
  void artifactWriter_noDefinitions_writesPlaceholder() throws IOException {
    PreparedPaper empty = new PreparedPaper(
        new PaperPreparationService(cfg).loadAndPrepare(tmp).document(), List.of(), List.of(), List.of());

    Path additional = new ArtifactWriter().writeAdditional(tmp.resolve("out"), empty);

    assertEquals(DefinitionExtractor.EMPTY_PLACEHOLDER, Files.readString(additional, StandardCharsets.UTF_8));
  }

  @Test
  void loadAndPrepare_secondRun_ignoresItsOwnArtifacts() throws IOException {
    PaperPreparationService svc = new PaperPreparationService(cfg);
    PreparedPaper first = svc.loadAndPrepare(tmp);
    ArtifactWriter writer = new ArtifactWriter(cfg.normalization);
    writer.writeFlattened(tmp, "", first.document().content());
    writer.writeAdditional(tmp, first);

    PreparedPaper second = svc.loadAndPrepare(tmp);

    assertEquals(first.document().content(), second.document().content());
    assertEquals(first.definitions(), second.definitions());
  }

  private void write(String relative, String content) throws IOException {
    Path file = tmp.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content, StandardCharsets.UTF_8);
  }
}
