package nl.adgroot.texnormalizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import nl.adgroot.texnormalizer.config.AppConfig;
import nl.adgroot.texnormalizer.config.ConfigLoader;
import nl.adgroot.texnormalizer.source.BoundedSourceRetriever;
import nl.adgroot.texnormalizer.source.DirectorySourceProvider;
import nl.adgroot.texnormalizer.source.ProvenanceHeader;
import nl.adgroot.texnormalizer.source.SourceResult;
import nl.adgroot.texnormalizer.tex.DefinitionExtractor;
import nl.adgroot.texnormalizer.tex.NormalizationException;
import nl.adgroot.texnormalizer.tex.records.DefinitionRecord;
import nl.adgroot.texnormalizer.tex.records.NormalizationIssue;

/**
 * Usage:
 * <pre>
 *   Main &lt;sourceDir&gt; [arxivId] [uploadDate yyyy-MM-dd]
 *   Main --fetch &lt;documentId&gt; [uploadDate yyyy-MM-dd]
 * </pre>
 *
 * <p>The first form writes FLATTENED.tex and ADDITIONAL.tex into {@code sourceDir}. The second
 * looks the paper up under the configured source root, with the configured time budget.
 */
public class Main {

  private static final String FETCH = "--fetch";

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args.length >= 1 && FETCH.equals(args[0])) {
      AppConfig cfg;
      try {
        cfg = ConfigLoader.loadDefault();
      } catch (IOException e) {
        System.err.println("Could not read config: " + e.getMessage());
        return 1;
      }
      return fetch(cfg, Arrays.copyOfRange(args, 1, args.length));
    }

    if (args.length < 1 || args.length > 3) {
      usage();
      return 2;
    }

    Path sourceDir = Path.of(args[0]);
    if (!Files.isDirectory(sourceDir)) {
      System.err.println("Not a directory: " + sourceDir);
      return 2;
    }

    String header;
    try {
      header = header(args);
    } catch (DateTimeParseException e) {
      System.err.println("Invalid upload date, expected yyyy-MM-dd: " + e.getParsedString());
      return 2;
    } catch (IllegalArgumentException e) {
      System.err.println("Invalid arxiv id: " + e.getMessage());
      usage();
      return 2;
    }

    try {
      AppConfig cfg = ConfigLoader.loadDefault();

      PaperPreparationService svc = new PaperPreparationService(cfg);
      ArtifactWriter writer = new ArtifactWriter(cfg.normalization);

      PreparedPaper paper = svc.loadAndPrepare(sourceDir);
      Path flattened = writer.writeFlattened(sourceDir, header, paper.document().content());
      Path additional = writer.writeAdditional(sourceDir, paper);

      System.out.println("Main file   : " + paper.document().mainFile());
      System.out.println("Flattened   : " + flattened.toAbsolutePath());
      System.out.println("Definitions : " + paper.definitions().size() + " -> " + additional.toAbsolutePath());
      System.out.println("Images      : " + paper.imageFiles().size());
      printIssues(paper.issues());
      return 0;

    } catch (NormalizationException | IOException e) {
      System.err.println("Normalization failed: " + e.getMessage());
      return 1;
    }
  }

  /**
   * Retrieves {@code <sourceRoot>/<documentId>} through a {@link BoundedSourceRetriever} and
   * writes the artifacts next to it.
   */
  static int fetch(AppConfig cfg, String[] args) {
    if (args.length < 1 || args.length > 2) {
      usage();
      return 2;
    }
    String documentId = args[0].strip();
    if (documentId.isEmpty()) {
      usage();
      return 2;
    }

    try (AppExecutors executors = AppExecutors.create()) {
      LocalDate uploaded = args.length == 2 ? LocalDate.parse(args[1]) : null;

      Path root = Path.of(cfg.source.sourceRoot);
      BoundedSourceRetriever retriever = new BoundedSourceRetriever(
          new DirectorySourceProvider(root, new NormalizationPipeline(cfg)),
          executors.sourcePool(),
          Duration.ofSeconds(cfg.source.timeoutSeconds));

      SourceResult result = retriever.retrieve(documentId);
      if (!result.isAvailable()) {
        System.err.println("No LaTeX source for " + documentId + ": " + result.reason());
        return 1;
      }

      Path outDir = root.resolve(documentId);
      List<NormalizationIssue> issues = new ArrayList<>();
      List<DefinitionRecord> definitions =
          new DefinitionExtractor(cfg.packages).extract(result.latex(), outDir, issues);

      ArtifactWriter writer = new ArtifactWriter(cfg.normalization);
      Path flattened = writer.writeFlattened(outDir, ProvenanceHeader.render(documentId, uploaded), result.latex());
      Path additional = writer.writeAdditional(outDir, definitions);

      System.out.println("Flattened   : " + flattened.toAbsolutePath());
      System.out.println("Definitions : " + definitions.size() + " -> " + additional.toAbsolutePath());
      printIssues(issues);
      return 0;

    } catch (IOException e) {
      System.err.println("Writing artifacts failed: " + e.getMessage());
      return 1;
    } catch (DateTimeParseException e) {
      System.err.println("Invalid upload date, expected yyyy-MM-dd: " + e.getParsedString());
      return 2;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return 1;
    }
  }

  private static String header(String[] args) {
    if (args.length < 2) return "";
    LocalDate uploaded = args.length == 3 ? LocalDate.parse(args[2]) : null;
    return ProvenanceHeader.render(args[1], uploaded);
  }

  private static void printIssues(List<NormalizationIssue> issues) {
    for (NormalizationIssue issue : issues) {
      System.out.println("WARN " + issue.kind() + ": " + issue.detail());
    }
  }

  private static void usage() {
    System.err.println("Usage: Main <sourceDir> [arxivId] [uploadDate yyyy-MM-dd]");
    System.err.println("       Main --fetch <documentId> [uploadDate yyyy-MM-dd]");
  }
}
