package nl.adgroot.texnormalizer.source;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Leading comment lines of FLATTENED.tex telling where the paper came from.
 */
public final class ProvenanceHeader {

  private static final String ABS_URL = "https://arxiv.org/abs/";

  private ProvenanceHeader() {
    // utility class
  }

  /**
   * @param arxivId  paper id, required
   * @param uploaded first publication date, the date line is left out when null
   */
  public static String render(String arxivId, LocalDate uploaded) {
    if (arxivId == null || arxivId.isBlank()) {
      throw new IllegalArgumentException("arxivId must not be blank");
    }

    StringBuilder header = new StringBuilder();
    if (uploaded != null) {
      header.append("% This paper was uploaded to arxiv on ")
          .append(uploaded.format(DateTimeFormatter.ISO_LOCAL_DATE))
          .append('\n');
    }
    header.append("% The link to this paper is ").append(ABS_URL).append(arxivId.strip()).append('\n');
    header.append('\n');
    return header.toString();
  }
}
