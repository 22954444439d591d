package nl.adgroot.texnormalizer.tex;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.texnormalizer.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads .tex files that are not always UTF-8 (older arXiv uploads are often latin-1 or cp1252).
 */
public class TexSourceReader {

  private final List<Charset> charsets;
  private final Logger log;

  public TexSourceReader() {
    this(new AppConfig().reading);
  }

  public TexSourceReader(AppConfig.ReadingConfig cfg) {
    this(cfg, LoggerFactory.getLogger(TexSourceReader.class));
  }

  public TexSourceReader(AppConfig.ReadingConfig cfg, Logger log) {
    this.charsets = toCharsets(cfg.charsets);
    this.log = log;
  }

  public String read(Path file) throws IOException {
    byte[] bytes = Files.readAllBytes(file);

    for (Charset cs : charsets) {
      try {
        return cs.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
      } catch (CharacterCodingException e) {
        log.debug("{} is not valid {}", file, cs.name());
      }
    }

    log.warn("Could not decode {} with {}, replacing invalid bytes", file, charsets);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static List<Charset> toCharsets(List<String> names) {
    List<Charset> out = new ArrayList<>();
    if (names != null) {
      for (String name : names) {
        if (name == null || name.isBlank()) continue;
        out.add(Charset.forName(name.trim()));
      }
    }
    if (out.isEmpty()) {
      out.add(StandardCharsets.UTF_8);
    }
    return out;
  }
}
