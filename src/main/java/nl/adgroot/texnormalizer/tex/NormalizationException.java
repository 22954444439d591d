package nl.adgroot.texnormalizer.tex;

/**
 * Aborts a normalization run. Recoverable problems are reported as
 * {@link nl.adgroot.texnormalizer.tex.records.NormalizationIssue} instead.
 */
public class NormalizationException extends RuntimeException {

  public NormalizationException(String message) {
    super(message);
  }

  public NormalizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
