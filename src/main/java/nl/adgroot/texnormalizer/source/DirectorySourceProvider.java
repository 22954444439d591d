package nl.adgroot.texnormalizer.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import nl.adgroot.texnormalizer.NormalizationPipeline;

/**
 * Serves papers already unpacked under {@code <root>/<documentId>/}, normalized on the fly.
 */
public class DirectorySourceProvider implements LatexSourceProvider {

  private final Path root;
  private final NormalizationPipeline pipeline;

  public DirectorySourceProvider(Path root, NormalizationPipeline pipeline) {
    this.root = root.toAbsolutePath().normalize();
    this.pipeline = pipeline;
  }

  @Override
  public String fetch(String documentId) throws IOException {
    if (documentId == null || documentId.isBlank()) {
      throw new IOException("Missing document id");
    }

    Path dir = root.resolve(documentId.strip()).normalize();
    if (!dir.startsWith(root) || dir.equals(root)) {
      throw new IOException("Invalid document id: " + documentId);
    }
    if (!Files.isDirectory(dir)) {
      throw new IOException("No sources for " + documentId + " in " + root);
    }

    return pipeline.normalize(dir).content();
  }
}
