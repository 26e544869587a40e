package io.spekcheck.core.event;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("Notifier")
class NotifierTest {

    private final Object source = new Object();
    private final Notifier notifier = new Notifier(source);

    private ListAppender<ILoggingEvent> logAppender;
    private Logger notifierLogger;

    @BeforeEach
    void setUp() {
        notifierLogger = (Logger) LoggerFactory.getLogger(Notifier.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        notifierLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        notifierLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("listeners run in subscription order with the event payload")
    void deliversInOrder() {
        List<String> calls = new ArrayList<>();
        notifier.subscribe(EventKind.ADD, e -> calls.add("first:" + e.key() + "=" + e.value()));
        notifier.subscribe(EventKind.ADD, e -> calls.add("second:" + (e.source() == source)));

        notifier.publish(EventKind.ADD, "k", 1);

        assertThat(calls).containsExactly("first:k=1", "second:true");
    }

    @Test
    @DisplayName("listeners only receive the kind they subscribed to")
    void filtersByKind() {
        List<EventKind> seen = new ArrayList<>();
        notifier.subscribe(EventKind.CHANGE, e -> seen.add(e.kind()));

        notifier.publish(EventKind.ADD);
        notifier.publish(EventKind.CHANGE);
        notifier.publish(EventKind.CLEAR);

        assertThat(seen).containsExactly(EventKind.CHANGE);
    }

    @Test
    @DisplayName("unsubscribe removes exactly one subscription")
    void unsubscribe() {
        List<String> calls = new ArrayList<>();
        long first = notifier.subscribe(EventKind.CHANGE, e -> calls.add("a"));
        notifier.subscribe(EventKind.CHANGE, e -> calls.add("b"));

        assertThat(notifier.unsubscribe(first)).isTrue();
        assertThat(notifier.unsubscribe(first)).isFalse();
        notifier.publish(EventKind.CHANGE);

        assertThat(calls).containsExactly("b");
        assertThat(notifier.listenerCount(EventKind.CHANGE)).isEqualTo(1);
    }

    @Test
    @DisplayName("a failing listener is logged and does not stop the others")
    void failingListenerIsolated() {
        List<String> calls = new ArrayList<>();
        notifier.subscribe(EventKind.CHANGE, e -> {
            throw new IllegalStateException("boom");
        });
        notifier.subscribe(EventKind.CHANGE, e -> calls.add("after"));

        notifier.publish(EventKind.CHANGE);

        assertThat(calls).containsExactly("after");
        assertThat(logAppender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).contains("Listener failed on CHANGE").contains("boom");
                });
    }

    @Test
    @DisplayName("subscribing from a listener takes effect on the next publish")
    void subscribeDuringPublish() {
        List<String> calls = new ArrayList<>();
        notifier.subscribe(EventKind.CHANGE, e -> {
            calls.add("outer");
            notifier.subscribe(EventKind.CHANGE, inner -> calls.add("inner"));
        });

        notifier.publish(EventKind.CHANGE);
        assertThat(calls).containsExactly("outer");

        calls.clear();
        notifier.publish(EventKind.CHANGE);
        assertThat(calls).containsExactly("outer", "inner");
    }
}
