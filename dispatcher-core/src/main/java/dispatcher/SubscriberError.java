package dispatcher;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Diagnostic record of one subscriber that threw during dispatch.
 *
 * @param functionId id of the failed subscription
 * @param message the exception message, or the exception class name when it has none
 * @param subscriberName {@link Subscriber#name()} of the failed subscriber
 * @param namespace namespace that was dispatched
 * @param stackTrace full stack trace of the exception
 * @param cause the exception itself
 */
public record SubscriberError(
    String functionId,
    String message,
    String subscriberName,
    String namespace,
    String stackTrace,
    Throwable cause) {

  public SubscriberError {
    Objects.requireNonNull(functionId, "functionId");
    Objects.requireNonNull(subscriberName, "subscriberName");
    Objects.requireNonNull(namespace, "namespace");
  }

  /**
   * Captures a failure thrown by a subscriber.
   *
   * @param functionId id of the failed subscription
   * @param subscriberName name of the failed subscriber
   * @param namespace dispatched namespace
   * @param failure the thrown exception
   * @return a new error record
   */
  public static SubscriberError of(String functionId, String subscriberName, String namespace, Throwable failure) {
    Objects.requireNonNull(failure, "failure");
    String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
    StringWriter trace = new StringWriter();
    failure.printStackTrace(new PrintWriter(trace));
    return new SubscriberError(functionId, message, subscriberName, namespace, trace.toString(), failure);
  }

  @Override
  public String toString() {
    return "SubscriberError{functionId=" + functionId
        + ", subscriber=" + subscriberName
        + ", namespace=" + namespace
        + ", message=" + message + '}';
  }
}
