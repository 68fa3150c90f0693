package dispatcher;

import dispatcher.util.DefaultIdGenerator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class NotificationTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final DefaultIdGenerator ids = new DefaultIdGenerator(100);
    private final NotificationFactory factory = new NotificationFactory(ids);
    private final Event event = new EventFactory(ids).create("Ping");

    private Notification.Builder builder() {
        return factory.builder()
            .start(START)
            .end(START.plusMillis(250))
            .event(event)
            .namespace("test");
    }

    @Test
    void defaultsToSuccessWithEmptyContent() {
        Notification notification = builder().build();

        assertEquals(NotificationStatus.SUCCESS, notification.status());
        assertTrue(notification.content().isEmpty());
        assertFalse(notification.hasErrors());
        assertEquals(Duration.ofMillis(250), notification.duration());
        assertEquals(0.25, notification.durationSeconds(), 1e-9);
        assertSame(event, notification.event());
        assertEquals("test", notification.namespace());
    }

    @Test
    void buildReportsAllMissingAttributes() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> factory.builder().build());

        assertTrue(ex.getMessage().contains("end"));
        assertTrue(ex.getMessage().contains("event"));
        assertTrue(ex.getMessage().contains("namespace"));
        assertTrue(ex.getMessage().contains("start"));
    }

    @Test
    void buildRejectsEndBeforeStart() {
        assertThrows(ConfigurationException.class,
            () -> builder().end(START.minusMillis(1)).build());
    }

    @Test
    void contentKeepsInvocationOrder() {
        Notification notification = builder()
            .content("b", 2)
            .content("a", 1)
            .content("c", null)
            .build();

        assertEquals(List.of("b", "a", "c"), notification.functionNames());
        assertEquals(Arrays.asList(2, 1, null), notification.functionResults());
        assertTrue(notification.contains("c"));
        assertNull(notification.get("c"));
        assertEquals(1, notification.get("a"));
    }

    @Test
    void sameNameReplacesEarlierResultAndLogs() {
        Logger logger = Logger.getLogger(Notification.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Level previous = logger.getLevel();
        logger.setLevel(Level.FINE);
        logger.addHandler(handler);
        try {
            Notification notification = builder()
                .content("lambda", 1)
                .content("lambda", 2)
                .build();

            assertEquals(List.of("lambda"), notification.functionNames());
            assertEquals(2, notification.get("lambda"));
            assertEquals(1, records.size());
            assertEquals(Level.FINE, records.get(0).getLevel());
            assertTrue(records.get(0).getMessage().contains("'lambda'"));
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(previous);
        }
    }

    @Test
    void getUnknownNameThrows() {
        Notification notification = builder().build();

        assertThrows(NoSuchElementException.class, () -> notification.get("missing"));
    }

    @Test
    void contentCannotBeChanged() {
        Notification notification = builder().content("f", 1).build();

        assertThrows(ImmutableContentException.class, () -> notification.put("f", 2));
        assertThrows(UnsupportedOperationException.class, () -> notification.content().put("g", 3));
        assertEquals(1, notification.get("f"));
    }

    @Test
    void oneAndOnlyResultWithNoContentIsEmpty() {
        assertEquals(Optional.empty(), builder().build().oneAndOnlyResult());
    }

    @Test
    void oneAndOnlyResultWithSingleContent() {
        assertEquals(Optional.of(42), builder().content("f", 42).build().oneAndOnlyResult());
    }

    @Test
    void oneAndOnlyResultWithManyContentThrows() {
        Notification notification = builder().content("f", 1).content("g", 2).build();

        AmbiguousResultException ex = assertThrows(AmbiguousResultException.class,
            notification::oneAndOnlyResult);
        assertEquals(2, ex.resultCount());
    }

    @Test
    void handleReturnsNotificationWithoutErrors() {
        Notification notification = builder().content("f", 1).build();

        assertSame(notification, notification.handle());
    }

    @Test
    void handleThrowsWithErrors() {
        IllegalStateException boom = new IllegalStateException("boom");
        SubscriberError error = SubscriberError.of("fn-1", "audit", "test", boom);
        Notification notification = builder()
            .error(error)
            .status(NotificationStatus.FAILURE)
            .build();

        NotificationFailedException ex = assertThrows(NotificationFailedException.class, notification::handle);

        assertEquals(List.of(error), ex.errors());
        assertSame(boom, ex.getCause());
        assertTrue(ex.getMessage().contains("audit: boom"));
    }

    @Test
    void idsComeFromFactory() {
        Notification first = builder().build();
        Notification second = builder().build();

        assertEquals(first.id() + 1, second.id());
    }

    @Test
    void subscriberErrorCapturesStackTrace() {
        SubscriberError error = SubscriberError.of("fn-1", "audit", "test", new RuntimeException());

        assertEquals(RuntimeException.class.getName(), error.message());
        assertTrue(error.stackTrace().contains("NotificationTest"));
    }
}
