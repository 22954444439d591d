package nl.adgroot.texnormalizer.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public NormalizationConfig normalization = new NormalizationConfig();
  public PackagesConfig packages = new PackagesConfig();
  public ReadingConfig reading = new ReadingConfig();
  public FiguresConfig figures = new FiguresConfig();
  public SourceConfig source = new SourceConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class NormalizationConfig {
    // guards against \input cycles (a.tex -> b.tex -> a.tex)
    public int maxIncludeDepth = 64;

    public String flattenedFileName = "FLATTENED.tex";
    public String additionalFileName = "ADDITIONAL.tex";

    public String appendixMarker = "\\appendix";
    public String endDocumentMarker = "\\end{document}";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class PackagesConfig {
    // packages that clash with the beamer class when loaded a second time
    public List<String> commentOut = List.of(
        "amsthm", "color", "hyperref", "xcolor", "ragged2e", "times", "graphicx", "enumitem"
    );
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ReadingConfig {
    // tried in order, strict decoding
    public List<String> charsets = List.of("UTF-8", "windows-1252", "ISO-8859-1");
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FiguresConfig {
    public List<String> imageExtensions = List.of(".pdf", ".png", ".jpeg", ".jpg");
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SourceConfig {
    public int timeoutSeconds = 120;

    // one sub directory per document id
    public String sourceRoot = "source";
  }
}
