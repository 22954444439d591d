package nl.adgroot.texnormalizer.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

  @TempDir
  Path tmp;

  @Test
  void loadDefault_readsBundledConfig() throws IOException {
    AppConfig cfg = ConfigLoader.loadDefault();

    assertEquals(64, cfg.normalization.maxIncludeDepth);
    assertEquals("FLATTENED.tex", cfg.normalization.flattenedFileName);
    assertTrue(cfg.packages.commentOut.contains("xcolor"));
    assertEquals("UTF-8", cfg.reading.charsets.get(0));
    assertEquals(120, cfg.source.timeoutSeconds);
  }

  @Test
  void load_partialFile_keepsDefaultsForTheRest() throws IOException {
    Path file = tmp.resolve("config.json");
    Files.writeString(file, """
        {
          "normalization": { "maxIncludeDepth": 5 },
          "packages": { "commentOut": ["tikz"] },
          "somethingNew": true
        }
        """);

    AppConfig cfg = ConfigLoader.load(file);

    assertEquals(5, cfg.normalization.maxIncludeDepth);
    assertEquals("ADDITIONAL.tex", cfg.normalization.additionalFileName);
    assertEquals(List.of("tikz"), cfg.packages.commentOut);
    assertEquals(".pdf", cfg.figures.imageExtensions.get(0));
  }

  @Test
  void load_missingFile_throws() {
    assertThrows(IOException.class, () -> ConfigLoader.load(tmp.resolve("absent.json")));
  }
}
