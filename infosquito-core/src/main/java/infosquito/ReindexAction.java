package infosquito;

/**
 * The external reindexing operation triggered by {@code index.*} messages.
 *
 * <p>Implementations carry whatever configuration they need; the core only decides
 * when to call them and how to settle the triggering message.
 */
@FunctionalInterface
public interface ReindexAction {

  /**
   * Rebuilds the search index.
   *
   * @throws Exception if reindexing fails; the triggering message is requeued
   */
  void reindex() throws Exception;
}
