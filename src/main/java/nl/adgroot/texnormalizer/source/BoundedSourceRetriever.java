package nl.adgroot.texnormalizer.source;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives a {@link LatexSourceProvider} a fixed time budget. A provider that hangs is cancelled and
 * reported as unavailable instead of blocking the caller.
 */
public class BoundedSourceRetriever {

  private final LatexSourceProvider provider;
  private final ExecutorService executor;
  private final Duration timeout;
  private final Logger log;

  public BoundedSourceRetriever(LatexSourceProvider provider, ExecutorService executor, Duration timeout) {
    this(provider, executor, timeout, LoggerFactory.getLogger(BoundedSourceRetriever.class));
  }

  public BoundedSourceRetriever(LatexSourceProvider provider, ExecutorService executor, Duration timeout,
      Logger log) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.log = log;
  }

  public SourceResult retrieve(String documentId) {
    Future<String> future = executor.submit(() -> provider.fetch(documentId));

    try {
      String latex = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (latex == null || latex.isBlank()) {
        log.warn("Empty LaTeX source for {}", documentId);
        return SourceResult.unavailable("empty source");
      }
      return SourceResult.available(latex);

    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Timed out retrieving LaTeX for {} after {}s", documentId, timeout.toSeconds());
      return SourceResult.unavailable("timed out after " + timeout.toSeconds() + "s");

    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      log.warn("Could not retrieve LaTeX for {}: {}", documentId, cause.toString());
      return SourceResult.unavailable(cause.toString());

    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return SourceResult.unavailable("interrupted");
    }
  }
}
