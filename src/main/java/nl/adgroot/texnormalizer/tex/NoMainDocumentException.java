package nl.adgroot.texnormalizer.tex;

import java.nio.file.Path;

public class NoMainDocumentException extends NormalizationException {

  private final Path directory;

  public NoMainDocumentException(Path directory) {
    super("No .tex file with a \\documentclass line in " + directory);
    this.directory = directory;
  }

  public Path getDirectory() {
    return directory;
  }
}
