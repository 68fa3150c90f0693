package dispatcher;

import dispatcher.spi.IdGenerator;
import dispatcher.util.DefaultIdGenerator;

import java.util.Objects;

/**
 * Hands out {@link Notification.Builder}s whose notifications take ids from an {@link IdGenerator}.
 */
public final class NotificationFactory {
    private final IdGenerator idGenerator;

    public NotificationFactory(IdGenerator idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public NotificationFactory() {
        this(DefaultIdGenerator.shared());
    }

    public Notification.Builder builder() {
        return new Notification.Builder(this);
    }

    long nextId() {
        return idGenerator.nextId();
    }
}
