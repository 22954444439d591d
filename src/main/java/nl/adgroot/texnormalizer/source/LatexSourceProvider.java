package nl.adgroot.texnormalizer.source;

import java.io.IOException;

/**
 * Supplies the raw LaTeX of a paper. Network or cache backed, the normalizer does not care.
 */
@FunctionalInterface
public interface LatexSourceProvider {

  /**
   * @param documentId logical identifier, e.g. an arXiv id such as {@code 2505.18102}
   * @throws IOException when the source cannot be obtained
   */
  String fetch(String documentId) throws IOException;
}
