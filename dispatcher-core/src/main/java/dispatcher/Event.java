package dispatcher;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * An event that subscribers can be registered against and that can be dispatched.
 *
 * <p>The identity ({@code code}, {@code id}, {@code name}) is immutable and defines
 * equality. The payload is a mutable key/value map that subscribers may read and write;
 * individual map operations are thread-safe, but sequences of them are not atomic.
 * {@link #lastNotified()} is updated by every dispatch that reached a subscriber registry.
 *
 * <p>Create instances through an {@link EventFactory} or the {@linkplain Builder builder}:
 * <pre>{@code
 * Event event = Event.builder()
 *     .name("OrderPlaced")
 *     .data("orderId", "order-123")
 *     .build();
 * }</pre>
 *
 * @see EventFactory
 */
public final class Event {
    private final String code;
    private final long id;
    private final String name;
    private final Map<String, Object> data;
    private volatile Instant lastNotified;

    Event(String code, long id, String name, Map<String, Object> data) {
        this.code = Objects.requireNonNull(code, "code");
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        this.data = Collections.synchronizedMap(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data));
    }

    /**
     * Creates a builder bound to the process-wide {@link EventFactory}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return EventFactory.defaultFactory().builder();
    }

    public String code() {
        return code;
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    /**
     * Returns a read-only view of the payload. Use {@link #put}, {@link #remove} and
     * {@link #clear} to modify it.
     *
     * @return live unmodifiable view of the payload
     */
    public Map<String, Object> data() {
        return Collections.unmodifiableMap(data);
    }

    /**
     * Returns the time of the last dispatch that reached a registry, or {@code null} if never dispatched.
     *
     * @return the last dispatch time, or {@code null}
     */
    public Instant lastNotified() {
        return lastNotified;
    }

    /**
     * Records the time a dispatch reached this event's registry. Called by the dispatch engine.
     *
     * @param at the dispatch time
     */
    public void markNotified(Instant at) {
        this.lastNotified = Objects.requireNonNull(at, "at");
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }

    /**
     * Returns the payload value for {@code key}.
     *
     * @param key the payload key
     * @return the value, may be null if null was stored
     * @throws NoSuchElementException if the key is not present
     */
    public Object get(String key) {
        synchronized (data) {
            if (!data.containsKey(key)) {
                throw new NoSuchElementException("Key '" + key + "' not found in event data");
            }
            return data.get(key);
        }
    }

    public Event put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        data.put(key, value);
        return this;
    }

    public Object remove(String key) {
        return data.remove(key);
    }

    public void clear() {
        data.clear();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Equivalent to {@link #equals(Object)} for two events.
     *
     * @param other the event to compare with
     * @return whether both events share code, id and name
     */
    public boolean sameAs(Event other) {
        return equals(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event that = (Event) o;
        return id == that.id && code.equals(that.code) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, id, name);
    }

    @Override
    public String toString() {
        return "Event{code=" + code + ", id=" + id + ", name=" + name + ", data=" + data + '}';
    }

    /**
     * Builder for {@link Event}. Obtain one from {@link Event#builder()} or
     * {@link EventFactory#builder()}.
     */
    public static final class Builder {
        private final EventFactory factory;
        private String name;
        private Map<String, Object> data;

        Builder(EventFactory factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        /**
         * Sets the event name used as the registry key.
         *
         * <p><b>Required.</b>
         *
         * @param name the event name
         * @return this builder
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Adds a payload entry. Repeated calls accumulate.
         *
         * @param key the payload key
         * @param value the payload value
         * @return this builder
         */
        public Builder data(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if (data == null) {
                data = new LinkedHashMap<>();
            }
            data.put(key, value);
            return this;
        }

        /**
         * Adds all entries of {@code values} to the payload. Repeated calls accumulate.
         *
         * @param values the payload entries
         * @return this builder
         */
        public Builder data(Map<String, ?> values) {
            Objects.requireNonNull(values, "values");
            values.forEach(this::data);
            return this;
        }

        /**
         * Builds the event, assigning a fresh id and code.
         *
         * @return a new event
         * @throws ConfigurationException if no name was set
         */
        public Event build() {
            if (name == null) {
                throw new ConfigurationException("Missing required attribute 'name' to build Event");
            }
            return factory.create(name, data);
        }
    }
}
