package nl.adgroot.texnormalizer.slides;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import nl.adgroot.texnormalizer.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure generated beamer code loads the paper's extracted definitions.
 */
public class AdditionalInputInjector {

  private static final Pattern BEAMER_DOCUMENTCLASS = Pattern.compile(
      "\\\\documentclass\\s*(?:\\[[^\\]]*\\])?\\s*\\{beamer\\}"
  );

  private final String inputLine;
  private final Logger log;

  public AdditionalInputInjector() {
    this(new AppConfig().normalization);
  }

  public AdditionalInputInjector(AppConfig.NormalizationConfig cfg) {
    this(cfg, LoggerFactory.getLogger(AdditionalInputInjector.class));
  }

  public AdditionalInputInjector(AppConfig.NormalizationConfig cfg, Logger log) {
    this.inputLine = "\\input{" + cfg.additionalFileName + "}";
    this.log = log;
  }

  /**
   * Inserts the input line right after {@code \documentclass{beamer}}, or at the very top when the
   * code has no beamer document class. Code that already loads the file is returned unchanged.
   */
  public String ensureInput(String beamerCode) {
    if (beamerCode == null || beamerCode.isEmpty()) {
      return beamerCode;
    }
    if (beamerCode.contains(inputLine)) {
      return beamerCode;
    }

    Matcher m = BEAMER_DOCUMENTCLASS.matcher(beamerCode);
    if (!m.find()) {
      log.warn("{} is missing and there is no beamer documentclass. Added at the top.", inputLine);
      return inputLine + "\n" + beamerCode;
    }

    return beamerCode.substring(0, m.end()) + "\n" + inputLine + beamerCode.substring(m.end());
  }
}
