package nl.adgroot.texnormalizer.tex.records;

/**
 * A problem the normalizer routed around. Fatal conditions are thrown instead.
 */
public record NormalizationIssue(Kind kind, String detail) {

  public enum Kind {
    MISSING_INCLUDE_TARGET,
    UNBALANCED_DELIMITER,
    APPENDIX_MARKER_WITHOUT_END
  }
}
