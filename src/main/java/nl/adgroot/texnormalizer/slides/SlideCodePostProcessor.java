package nl.adgroot.texnormalizer.slides;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import nl.adgroot.texnormalizer.llm.CodeBlockResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a model answer into compilable slide source: take the first latex block, escape frame
 * titles and load ADDITIONAL.tex.
 */
public class SlideCodePostProcessor {

  private static final String LANGUAGE = "latex";

  private final FrametitleSanitizer sanitizer;
  private final AdditionalInputInjector injector;
  private final Logger log;

  public SlideCodePostProcessor() {
    this(new FrametitleSanitizer(), new AdditionalInputInjector());
  }

  public SlideCodePostProcessor(FrametitleSanitizer sanitizer, AdditionalInputInjector injector) {
    this(sanitizer, injector, LoggerFactory.getLogger(SlideCodePostProcessor.class));
  }

  public SlideCodePostProcessor(FrametitleSanitizer sanitizer, AdditionalInputInjector injector, Logger log) {
    this.sanitizer = sanitizer;
    this.injector = injector;
    this.log = log;
  }

  /** Empty when the answer holds no latex block. */
  public Optional<String> process(CodeBlockResponse response) {
    Optional<String> code = response.firstCodeBlock(LANGUAGE);
    if (code.isEmpty() || code.get().isBlank()) {
      log.error("No beamer code found in the response.");
      return Optional.empty();
    }
    return Optional.of(injector.ensureInput(sanitizer.sanitize(code.get())));
  }

  /**
   * Sanitizes an existing slides file in place before it goes to the compiler.
   *
   * @return true when the file was rewritten
   */
  public boolean sanitizeFile(Path slidesTex) throws IOException {
    if (!Files.isRegularFile(slidesTex)) {
      return false;
    }
    String original = Files.readString(slidesTex, StandardCharsets.UTF_8);
    String sanitized = sanitizer.sanitize(original);
    if (sanitized.equals(original)) {
      return false;
    }
    Files.writeString(slidesTex, sanitized, StandardCharsets.UTF_8);
    log.info("Escaped ampersands in frame titles of {}", slidesTex);
    return true;
  }
}
