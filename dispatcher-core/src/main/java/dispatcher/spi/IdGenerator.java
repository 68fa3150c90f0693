package dispatcher.spi;

/**
 * Source of identifiers for events, notifications, registries and subscriptions.
 *
 * <p>Implementations must be safe for concurrent use: {@link #nextId()} never hands
 * out the same value twice and values are strictly increasing.
 *
 * @see dispatcher.util.DefaultIdGenerator
 */
public interface IdGenerator {

  /**
   * Returns the next numeric identifier.
   *
   * @return a value greater than any previously returned one
   */
  long nextId();

  /**
   * Returns a fresh opaque unique code, used for event codes and subscription function ids.
   *
   * @return a new unique string, never null
   */
  String nextCode();
}
