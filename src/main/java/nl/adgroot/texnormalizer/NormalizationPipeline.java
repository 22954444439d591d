package nl.adgroot.texnormalizer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.texnormalizer.config.AppConfig;
import nl.adgroot.texnormalizer.tex.AppendixTrimmer;
import nl.adgroot.texnormalizer.tex.CommentStripper;
import nl.adgroot.texnormalizer.tex.IncludeFlattener;
import nl.adgroot.texnormalizer.tex.MainFileSelector;
import nl.adgroot.texnormalizer.tex.NoMainDocumentException;
import nl.adgroot.texnormalizer.tex.TexSourceReader;
import nl.adgroot.texnormalizer.tex.records.NormalizationIssue;
import nl.adgroot.texnormalizer.tex.records.NormalizedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selector -> flattener -> comment stripper -> appendix trimmer. Single threaded, reads the source
 * tree and never writes to it.
 */
public class NormalizationPipeline {

  private final TexSourceReader reader;
  private final MainFileSelector selector;
  private final IncludeFlattener flattener;
  private final CommentStripper stripper;
  private final AppendixTrimmer trimmer;
  private final Logger log;

  /** Production default */
  public NormalizationPipeline() {
    this(new AppConfig());
  }

  public NormalizationPipeline(AppConfig cfg) {
    this(cfg, LoggerFactory.getLogger(NormalizationPipeline.class));
  }

  public NormalizationPipeline(AppConfig cfg, Logger log) {
    this.reader = new TexSourceReader(cfg.reading);
    this.selector = new MainFileSelector(reader, cfg.normalization, LoggerFactory.getLogger(MainFileSelector.class));
    this.flattener = new IncludeFlattener(reader, cfg.normalization.maxIncludeDepth,
        LoggerFactory.getLogger(IncludeFlattener.class));
    this.stripper = new CommentStripper();
    this.trimmer = new AppendixTrimmer(cfg.normalization);
    this.log = log;
  }

  /**
   * @throws NoMainDocumentException when no file declares a document class
   * @throws IOException             when the main file cannot be read
   */
  public NormalizedDocument normalize(Path directory) throws IOException {
    String mainFile = selector.select(directory)
        .orElseThrow(() -> new NoMainDocumentException(directory));

    List<Path> texFiles = selector.allTexFiles(directory);
    log.info("Found {} .tex files (excluding generated artifacts).", texFiles.size());

    List<NormalizationIssue> issues = new ArrayList<>();
    String content;
    if (texFiles.size() == 1) {
      // a lone file is taken as is, even if it happens to contain \input lines
      content = reader.read(texFiles.get(0));
      log.info("Single .tex file, using {} without flattening", directory.relativize(texFiles.get(0)));
    } else {
      content = flattener.flatten(directory, mainFile, issues);
    }

    content = stripper.strip(content);
    content = trimmer.trim(content, issues);

    return new NormalizedDocument(directory, mainFile, content, issues);
  }
}
