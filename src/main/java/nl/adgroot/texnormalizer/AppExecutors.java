package nl.adgroot.texnormalizer;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Threads used around the (single threaded) normalizer. Only source retrieval runs off the
 * calling thread, so it can be abandoned when it takes too long.
 */
public final class AppExecutors implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(AppExecutors.class);

  private final ExecutorService sourcePool;

  private AppExecutors(ExecutorService sourcePool) {
    this.sourcePool = sourcePool;
  }

  public static AppExecutors create() {
    ThreadFactory sourceTf = new ThreadFactory() {
      private final AtomicInteger n = new AtomicInteger(1);

      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, "source-fetch-" + n.getAndIncrement());
        // a hung fetch must not keep the JVM alive
        t.setDaemon(true);
        return t;
      }
    };

    return new AppExecutors(Executors.newCachedThreadPool(sourceTf));
  }

  public ExecutorService sourcePool() {
    return sourcePool;
  }

  @Override
  public void close() throws InterruptedException {
    sourcePool.shutdown();
    if (!sourcePool.awaitTermination(5, TimeUnit.SECONDS)) {
      sourcePool.shutdownNow();
      if (!sourcePool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Executor did not terminate: sourcePool");
      }
    }
  }
}
