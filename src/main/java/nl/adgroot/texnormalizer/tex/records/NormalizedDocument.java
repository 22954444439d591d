package nl.adgroot.texnormalizer.tex.records;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of flatten + strip comments + trim appendix.
 * - content: the single-file document, without provenance header
 * - issues: recoverable problems encountered on the way, in order
 */
public record NormalizedDocument(
    Path sourceDir,
    String mainFile,
    String content,
    List<NormalizationIssue> issues
) {

  public NormalizedDocument {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public boolean hasIssues() {
    return !issues.isEmpty();
  }

  public List<NormalizationIssue> issuesOf(NormalizationIssue.Kind kind) {
    return issues.stream().filter(i -> i.kind() == kind).toList();
  }
}
