package com.regencredit.core.event;

import com.regencredit.core.community.UserType;
import com.regencredit.core.event.ProtocolEvents.UserDenied;
import com.regencredit.core.event.ProtocolEvents.UserRegistered;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EventBusTest {

    private final EventBus eventBus = new EventBus();

    @Test
    void handlersRunInSubscriptionOrder() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(UserRegistered.class, e -> calls.add("first"));
        eventBus.subscribe(UserRegistered.class, e -> calls.add("second"));
        eventBus.subscribeAll(e -> calls.add("all"));

        eventBus.publish(new UserRegistered("0x1", UserType.SUPPORTER, null, 1));

        assertThat(calls).containsExactly("first", "second", "all");
    }

    @Test
    void handlersOnlySeeTheirEventType() {
        List<ProtocolEvent> seen = new ArrayList<>();
        eventBus.subscribe(UserDenied.class, seen::add);

        eventBus.publish(new UserRegistered("0x1", UserType.SUPPORTER, null, 1));

        assertThat(seen).isEmpty();
    }

    @Test
    void handlerFailuresReachThePublisher() {
        eventBus.subscribe(UserDenied.class, e -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> eventBus.publish(new UserDenied("0x1", UserType.DEVELOPER, 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void unsubscribedHandlersStopReceiving() {
        List<ProtocolEvent> seen = new ArrayList<>();
        String id = eventBus.subscribe(UserDenied.class, seen::add);

        eventBus.unsubscribe(id);
        eventBus.publish(new UserDenied("0x1", UserType.DEVELOPER, 1));

        assertThat(seen).isEmpty();
        assertThat(eventBus.getSubscriberCount(UserDenied.class)).isZero();
    }
}
