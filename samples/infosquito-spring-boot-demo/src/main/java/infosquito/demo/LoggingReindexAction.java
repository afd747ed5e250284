package infosquito.demo;

import infosquito.ReindexAction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Stands in for a real data store reindex. Fails every {@code demo.fail-every}-th run
 * so the requeue path can be observed; 0 disables failures.
 */
@Component
public class LoggingReindexAction implements ReindexAction {

  private static final Logger log = LoggerFactory.getLogger(LoggingReindexAction.class);

  private final AtomicLong runs = new AtomicLong();
  private final long failEvery;

  public LoggingReindexAction(@Value("${demo.fail-every:0}") long failEvery) {
    this.failEvery = failEvery;
  }

  @Override
  public void reindex() {
    long run = runs.incrementAndGet();
    if (failEvery > 0 && run % failEvery == 0) {
      throw new IllegalStateException("simulated reindex failure on run " + run);
    }
    log.info("[Reindex] run {} complete", run);
  }
}
