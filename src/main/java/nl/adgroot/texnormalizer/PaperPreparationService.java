package nl.adgroot.texnormalizer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.texnormalizer.config.AppConfig;
import nl.adgroot.texnormalizer.tex.DefinitionExtractor;
import nl.adgroot.texnormalizer.tex.FigureLocator;
import nl.adgroot.texnormalizer.tex.records.DefinitionRecord;
import nl.adgroot.texnormalizer.tex.records.NormalizationIssue;
import nl.adgroot.texnormalizer.tex.records.NormalizedDocument;

public class PaperPreparationService {

  private final NormalizationPipeline pipeline;
  private final DefinitionExtractor extractor;
  private final FigureLocator figures;

  public PaperPreparationService(AppConfig cfg) {
    this(new NormalizationPipeline(cfg), new DefinitionExtractor(cfg.packages), new FigureLocator(cfg.figures));
  }

  public PaperPreparationService(NormalizationPipeline pipeline, DefinitionExtractor extractor, FigureLocator figures) {
    this.pipeline = pipeline;
    this.extractor = extractor;
    this.figures = figures;
  }

  public PreparedPaper loadAndPrepare(Path sourceDir) throws IOException {
    NormalizedDocument document = pipeline.normalize(sourceDir);

    List<NormalizationIssue> issues = new ArrayList<>(document.issues());
    List<DefinitionRecord> definitions = extractor.extract(document.content(), sourceDir, issues);
    List<String> imageFiles = figures.findImageFiles(sourceDir);

    return new PreparedPaper(document, definitions, imageFiles, issues);
  }
}
