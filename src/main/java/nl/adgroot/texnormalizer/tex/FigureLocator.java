package nl.adgroot.texnormalizer.tex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import nl.adgroot.texnormalizer.config.AppConfig;

/**
 * Lists the figures a slide generator may use: image files shipped with the sources and the
 * paths referenced by {@code \includegraphics}.
 */
public class FigureLocator {

  private static final Pattern INCLUDEGRAPHICS = Pattern.compile(
      "\\\\includegraphics\\s*(?:\\[[^\\]]*\\])?\\s*\\{([^}]*)\\}"
  );

  private final List<String> imageExtensions;

  public FigureLocator() {
    this(new AppConfig().figures);
  }

  public FigureLocator(AppConfig.FiguresConfig cfg) {
    this.imageExtensions = cfg.imageExtensions.stream()
        .map(e -> e.toLowerCase(Locale.ROOT))
        .toList();
  }

  /** Image files under {@code directory}, relative with '/' separators, sorted. */
  public List<String> findImageFiles(Path directory) throws IOException {
    try (Stream<Path> stream = Files.walk(directory)) {
      return stream
          .filter(Files::isRegularFile)
          .filter(this::isImage)
          .map(p -> directory.relativize(p).toString().replace('\\', '/'))
          .sorted()
          .toList();
    }
  }

  /** Targets of {@code \includegraphics}, in document order. */
  public static List<String> figureReferences(String latex) {
    List<String> out = new ArrayList<>();
    if (latex == null) return out;

    Matcher m = INCLUDEGRAPHICS.matcher(latex);
    while (m.find()) {
      String path = m.group(1).strip();
      if (!path.isEmpty()) out.add(path);
    }
    return out;
  }

  private boolean isImage(Path p) {
    String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
    for (String ext : imageExtensions) {
      if (name.endsWith(ext)) return true;
    }
    return false;
  }
}
