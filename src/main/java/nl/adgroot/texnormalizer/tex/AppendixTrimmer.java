package nl.adgroot.texnormalizer.tex;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import nl.adgroot.texnormalizer.config.AppConfig;
import nl.adgroot.texnormalizer.tex.records.NormalizationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts everything between the appendix marker and the closing {@code \end{document}}.
 */
public class AppendixTrimmer {

  private final Pattern appendixMarker;
  private final String endDocumentMarker;
  private final Logger log;

  public AppendixTrimmer() {
    this(new AppConfig().normalization);
  }

  public AppendixTrimmer(AppConfig.NormalizationConfig cfg) {
    this(cfg, LoggerFactory.getLogger(AppendixTrimmer.class));
  }

  public AppendixTrimmer(AppConfig.NormalizationConfig cfg, Logger log) {
    // \appendix but not \appendixname, \appendixpage, ...
    this.appendixMarker = Pattern.compile(Pattern.quote(cfg.appendixMarker) + "(?![A-Za-z])");
    this.endDocumentMarker = cfg.endDocumentMarker;
    this.log = log;
  }

  public String trim(String texContent, List<NormalizationIssue> issues) {
    if (texContent == null || texContent.isEmpty()) {
      return texContent == null ? "" : texContent;
    }

    Matcher m = appendixMarker.matcher(texContent);
    if (!m.find()) {
      log.info("No appendix found in tex content.");
      return texContent;
    }
    int appendixStart = m.start();

    // some papers contain \end{document} several times, only the one after the appendix counts
    int appendixEnd = texContent.indexOf(endDocumentMarker, appendixStart);
    if (appendixEnd < 0) {
      String detail = "No " + endDocumentMarker + " found after " + m.group() + " at offset " + appendixStart;
      log.warn("{}, leaving content unchanged", detail);
      issues.add(new NormalizationIssue(NormalizationIssue.Kind.APPENDIX_MARKER_WITHOUT_END, detail));
      return texContent;
    }

    log.info("Removed appendix from tex content ({} characters).", appendixEnd - appendixStart);
    return texContent.substring(0, appendixStart) + texContent.substring(appendixEnd);
  }
}
