package nl.adgroot.texnormalizer.tex;

import java.nio.file.Path;

public class CyclicIncludeException extends NormalizationException {

  private final Path file;
  private final int depth;

  public CyclicIncludeException(Path file, int depth) {
    super("Include depth " + depth + " exceeded while flattening " + file
        + " (cyclic \\input or \\include?)");
    this.file = file;
    this.depth = depth;
  }

  public Path getFile() {
    return file;
  }

  public int getDepth() {
    return depth;
  }
}
