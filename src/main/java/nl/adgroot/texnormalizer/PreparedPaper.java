package nl.adgroot.texnormalizer;

import java.util.List;

import nl.adgroot.texnormalizer.tex.records.DefinitionRecord;
import nl.adgroot.texnormalizer.tex.records.NormalizationIssue;
import nl.adgroot.texnormalizer.tex.records.NormalizedDocument;

/**
 * Everything slide generation needs from one paper.
 * - document: normalized single-file LaTeX
 * - definitions: ADDITIONAL.tex records, first-seen order
 * - imageFiles: figure files shipped with the sources, relative paths
 * - issues: recoverable problems of normalization and extraction
 */
public record PreparedPaper(
    NormalizedDocument document,
    List<DefinitionRecord> definitions,
    List<String> imageFiles,
    List<NormalizationIssue> issues
) {

  public PreparedPaper {
    definitions = List.copyOf(definitions);
    imageFiles = List.copyOf(imageFiles);
    issues = List.copyOf(issues);
  }
}
