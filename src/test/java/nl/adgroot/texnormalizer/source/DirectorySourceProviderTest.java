package nl.adgroot.texnormalizer.source;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import nl.adgroot.texnormalizer.NormalizationPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectorySourceProviderTest {

  @TempDir
  Path root;

  private final ExecutorService exec = Executors.newSingleThreadExecutor();
  private DirectorySourceProvider provider;

  @BeforeEach
  void setUp() throws IOException {
    Path paper = Files.createDirectories(root.resolve("2505.18102"));
    Files.writeString(paper.resolve("main.tex"), "\\documentclass{article}\n% secret\nBody\n", StandardCharsets.UTF_8);
    Files.createDirectories(root.resolve("empty"));

    provider = new DirectorySourceProvider(root, new NormalizationPipeline());
  }

  @AfterEach
  void tearDown() {
    exec.shutdownNow();
  }

  @Test
  void fetch_returnsNormalizedLatex() throws IOException {
    assertEquals("\\documentclass{article}\n\nBody\n", provider.fetch("2505.18102"));
  }

  @Test
  void fetch_rejectsIdsOutsideTheRoot() {
    assertThrows(IOException.class, () -> provider.fetch("../2505.18102"));
    assertThrows(IOException.class, () -> provider.fetch("."));
    assertThrows(IOException.class, () -> provider.fetch(" "));
  }

  @Test
  void fetch_unknownId_throws() {
    assertThrows(IOException.class, () -> provider.fetch("9999.99999"));
  }

  @Test
  void retriever_reportsPaperWithoutMainDocumentAsUnavailable() {
    BoundedSourceRetriever retriever = new BoundedSourceRetriever(provider, exec, Duration.ofSeconds(10));

    assertTrue(retriever.retrieve("2505.18102").isAvailable());
    assertFalse(retriever.retrieve("empty").isAvailable());
  }
}
