package nl.adgroot.texnormalizer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import nl.adgroot.texnormalizer.config.AppConfig;
import nl.adgroot.texnormalizer.tex.DefinitionExtractor;
import nl.adgroot.texnormalizer.tex.records.DefinitionRecord;

/**
 * Writes FLATTENED.tex and ADDITIONAL.tex. Both are new files next to the sources, the sources
 * themselves are never modified.
 */
public class ArtifactWriter {

  private final String flattenedFileName;
  private final String additionalFileName;

  public ArtifactWriter() {
    this(new AppConfig().normalization);
  }

  public ArtifactWriter(AppConfig.NormalizationConfig cfg) {
    this.flattenedFileName = cfg.flattenedFileName;
    this.additionalFileName = cfg.additionalFileName;
  }

  /**
   * @param header provenance comment lines put before the document, may be empty
   */
  public Path writeFlattened(Path outDir, String header, String content) throws IOException {
    Files.createDirectories(outDir);
    Path target = outDir.resolve(flattenedFileName);
    String text = (header == null ? "" : header) + content;
    Files.writeString(target, text, StandardCharsets.UTF_8);
    return target;
  }

  public Path writeAdditional(Path outDir, PreparedPaper paper) throws IOException {
    return writeAdditional(outDir, paper.definitions());
  }

  public Path writeAdditional(Path outDir, List<DefinitionRecord> definitions) throws IOException {
    Files.createDirectories(outDir);
    Path target = outDir.resolve(additionalFileName);
    Files.writeString(target, DefinitionExtractor.render(definitions), StandardCharsets.UTF_8);
    return target;
  }
}
