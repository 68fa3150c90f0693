package dispatcher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Immutable result of one {@link Dispatcher#dispatch} call.
 *
 * <p>{@link #content()} maps each subscriber's {@linkplain Subscriber#name() name} to the
 * value it returned, in invocation order. {@link #errors()} lists every subscriber that
 * threw. {@link #status()} is {@link NotificationStatus#FAILURE} as soon as one error was
 * recorded, even if later subscribers succeeded.
 *
 * <p>Dispatch never throws for subscriber failures, so callers inspect the status or
 * call {@link #handle()}:
 * <pre>{@code
 * Object total = dispatcher.dispatch(event, Namespaces.GLOBAL)
 *     .handle()
 *     .oneAndOnlyResult()
 *     .orElse(0);
 * }</pre>
 *
 * @see NotificationFactory
 */
public final class Notification {
    private static final Logger logger = Logger.getLogger(Notification.class.getName());

    private final long id;
    private final Event event;
    private final String namespace;
    private final Map<String, Object> content;
    private final List<SubscriberError> errors;
    private final NotificationStatus status;
    private final Instant start;
    private final Instant end;
    private final Duration duration;

    private Notification(long id, Builder builder) {
        this.id = id;
        this.event = builder.event;
        this.namespace = builder.namespace;
        this.content = Collections.unmodifiableMap(new LinkedHashMap<>(builder.content));
        this.errors = List.copyOf(builder.errors);
        this.status = builder.status == null ? NotificationStatus.SUCCESS : builder.status;
        this.start = builder.start;
        this.end = builder.end;
        this.duration = Duration.between(start, end);
    }

    public long id() {
        return id;
    }

    public Event event() {
        return event;
    }

    public String namespace() {
        return namespace;
    }

    /**
     * Returns the subscriber results keyed by subscriber name. The map is unmodifiable.
     *
     * @return subscriber name to result, in invocation order
     */
    public Map<String, Object> content() {
        return content;
    }

    public List<SubscriberError> errors() {
        return errors;
    }

    public NotificationStatus status() {
        return status;
    }

    public Instant start() {
        return start;
    }

    public Instant end() {
        return end;
    }

    /**
     * Returns {@code end - start}; never negative.
     *
     * @return the dispatch duration
     */
    public Duration duration() {
        return duration;
    }

    public double durationSeconds() {
        return duration.toNanos() / 1_000_000_000.0;
    }

    public boolean contains(String subscriberName) {
        return content.containsKey(subscriberName);
    }

    /**
     * Returns the result recorded for a subscriber.
     *
     * @param subscriberName the subscriber name
     * @return the result, may be null if the subscriber returned null
     * @throws NoSuchElementException if no result was recorded under that name
     */
    public Object get(String subscriberName) {
        if (!content.containsKey(subscriberName)) {
            throw new NoSuchElementException("Key '" + subscriberName + "' not found in notification content");
        }
        return content.get(subscriberName);
    }

    /**
     * Always fails: content is fixed when the notification is built.
     *
     * @param subscriberName ignored
     * @param value ignored
     * @throws ImmutableContentException always
     */
    public void put(String subscriberName, Object value) {
        throw new ImmutableContentException(subscriberName);
    }

    public List<String> functionNames() {
        return List.copyOf(content.keySet());
    }

    /**
     * Returns the recorded results in invocation order. Null results are kept.
     *
     * @return the results
     */
    public List<Object> functionResults() {
        return Collections.unmodifiableList(new ArrayList<>(content.values()));
    }

    /**
     * Returns the single recorded result.
     *
     * @return empty if no subscriber produced a result (or the only result was null),
     *     otherwise the result
     * @throws AmbiguousResultException if more than one subscriber produced a result
     */
    public Optional<Object> oneAndOnlyResult() {
        if (content.isEmpty()) {
            return Optional.empty();
        }
        if (content.size() > 1) {
            throw new AmbiguousResultException(content.size());
        }
        return Optional.ofNullable(content.values().iterator().next());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Fails if any subscriber threw during the dispatch.
     *
     * @return this notification, for chaining
     * @throws NotificationFailedException if {@link #errors()} is not empty
     */
    public Notification handle() {
        if (hasErrors()) {
            throw new NotificationFailedException(errors);
        }
        return this;
    }

    @Override
    public String toString() {
        return "Notification{id=" + id
            + ", event=" + event.name()
            + ", namespace=" + namespace
            + ", status=" + status
            + ", content=" + content
            + ", errors=" + errors
            + ", duration=" + duration + '}';
    }

    /**
     * Accumulating builder for {@link Notification}, populated while subscribers fire.
     *
     * <p>{@code start}, {@code end}, {@code event} and {@code namespace} are required.
     * Status defaults to {@link NotificationStatus#SUCCESS}.
     */
    public static final class Builder {
        private final NotificationFactory factory;
        private Instant start;
        private Instant end;
        private Event event;
        private String namespace;
        private final Map<String, Object> content = new LinkedHashMap<>();
        private final List<SubscriberError> errors = new ArrayList<>();
        private NotificationStatus status;

        Builder(NotificationFactory factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder start(Instant start) {
            this.start = start;
            return this;
        }

        public Builder end(Instant end) {
            this.end = end;
            return this;
        }

        public Builder event(Event event) {
            this.event = event;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        /**
         * Records a subscriber result. A later result under the same name replaces the earlier one.
         *
         * @param subscriberName the subscriber name
         * @param result the result, may be null
         * @return this builder
         */
        public Builder content(String subscriberName, Object result) {
            boolean replaced = content.containsKey(Objects.requireNonNull(subscriberName, "subscriberName"));
            content.put(subscriberName, result);
            if (replaced) {
                logger.fine(() -> "Content for '" + subscriberName + "' replaced by a later subscriber with the same name");
            }
            return this;
        }

        public Builder content(Map<String, ?> results) {
            results.forEach(this::content);
            return this;
        }

        public Builder error(SubscriberError error) {
            errors.add(Objects.requireNonNull(error, "error"));
            return this;
        }

        public Builder errors(Collection<SubscriberError> errors) {
            errors.forEach(this::error);
            return this;
        }

        public Builder status(NotificationStatus status) {
            this.status = status;
            return this;
        }

        /**
         * Returns the status set so far, or {@code null} if none was set.
         *
         * @return the current status
         */
        public NotificationStatus status() {
            return status;
        }

        public Event event() {
            return event;
        }

        /**
         * Builds the notification, assigning the next id from the factory.
         *
         * @return a new notification
         * @throws ConfigurationException if a required attribute is missing or {@code end} is before {@code start}
         */
        public Notification build() {
            List<String> missing = new ArrayList<>();
            if (end == null) missing.add("end");
            if (event == null) missing.add("event");
            if (namespace == null) missing.add("namespace");
            if (start == null) missing.add("start");
            if (!missing.isEmpty()) {
                throw new ConfigurationException("Missing required attributes to build Notification: " + missing);
            }
            if (end.isBefore(start)) {
                throw new ConfigurationException("end must not be before start");
            }
            return new Notification(factory.nextId(), this);
        }
    }
}
