package com.juggernaut.shared.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.juggernaut.shared.broker.BrokerSubscription;
import com.juggernaut.shared.broker.InMemoryMessageBroker;
import com.juggernaut.shared.codec.BusEvent;
import com.juggernaut.shared.codec.EnvelopeCodec;
import com.juggernaut.shared.codec.EventEnvelope;
import com.juggernaut.shared.exception.EnvelopeDecodeException;
import com.juggernaut.shared.support.Await;

class JuggernautClientTest {

    private final InMemoryMessageBroker broker = new InMemoryMessageBroker();
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final JuggernautClient client = new JuggernautClient(broker, codec, "juggernaut");

    @Test
    void publishSendsOneEnvelopeOnControlChannel() throws Exception {
        BrokerSubscription control = broker.subscribe(List.of("juggernaut"));

        client.publish("room", Map.of("message", "Hello World!"));

        JsonNode json = new ObjectMapper().readTree(control.next().orElseThrow().body());
        assertThat(json.get("channels").get(0).asText()).isEqualTo("room");
        assertThat(json.get("data").get("message").asText()).isEqualTo("Hello World!");
        control.close();
    }

    @Test
    void publishToSeveralChannelsCollapsesDuplicates() throws Exception {
        BrokerSubscription control = broker.subscribe(List.of("custom-key"));
        JuggernautClient custom = new JuggernautClient(broker, codec, "custom-key");

        custom.publish(List.of("a", "b", "a"), "x", List.of("s1"), Map.of());

        JsonNode json = new ObjectMapper().readTree(control.next().orElseThrow().body());
        assertThat(json.get("channels")).hasSize(2);
        assertThat(json.get("except").get(0).asText()).isEqualTo("s1");
        control.close();
    }

    @Test
    void eventChannelsUseKeyPrefix() {
        assertThat(client.eventChannels()).containsExactly(
                "juggernaut:subscribe", "juggernaut:unsubscribe", "juggernaut:custom");
    }

    @Test
    void subscribeListenYieldsEventsInDeliveryOrder() {
        try (EventStream events = client.subscribeListen()) {
            emit("subscribe", "s1");
            emit("custom", "s1");
            emit("unsubscribe", "s1");

            List<String> names = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                assertThat(events.hasNext()).isTrue();
                BusEvent event = events.next();
                names.add(event.event());
                assertThat(event.envelope().getSessionId()).isEqualTo("s1");
            }
            assertThat(names).containsExactly("subscribe", "custom", "unsubscribe");
        }
    }

    @Test
    void closedStreamEndsIteration() {
        EventStream events = client.subscribeListen();
        emit("subscribe", "s1");

        events.close();

        assertThat(events.isClosed()).isTrue();
        assertThat(events.hasNext()).isFalse();
        assertThatThrownBy(events::next).isInstanceOf(NoSuchElementException.class);
        assertThat(broker.subscriberCount("juggernaut:subscribe")).isZero();
    }

    @Test
    void malformedEventPropagatesDecodeError() {
        try (EventStream events = client.subscribeListen()) {
            broker.publish("juggernaut:subscribe", "oops".getBytes(StandardCharsets.UTF_8));

            assertThat(events.hasNext()).isTrue();
            assertThatThrownBy(events::next).isInstanceOf(EnvelopeDecodeException.class);
        }
    }

    @Test
    void handlerExceptionEndsSubscribeLoopAndReleasesSubscription() throws Exception {
        List<String> seen = new ArrayList<>();
        Thread producer = new Thread(() -> {
            awaitSubscribed();
            emit("subscribe", "s1");
            emit("unsubscribe", "s1");
        });
        producer.start();

        assertThatThrownBy(() -> client.subscribe((event, envelope) -> {
            seen.add(event);
            if (event.equals("unsubscribe")) {
                throw new IllegalStateException("stop");
            }
        })).isInstanceOf(IllegalStateException.class).hasMessage("stop");

        producer.join(5_000);
        assertThat(seen).containsExactly("subscribe", "unsubscribe");
        assertThat(broker.subscriberCount("juggernaut:subscribe")).isZero();
    }

    @Test
    void newCallCreatesIndependentStream() {
        EventStream first = client.subscribeListen();
        EventStream second = client.subscribeListen();
        first.close();

        emit("subscribe", "s2");

        assertThat(second.hasNext()).isTrue();
        assertThat(second.next().envelope().getSessionId()).isEqualTo("s2");
        second.close();
    }

    private void emit(String event, String sessionId) {
        EventEnvelope envelope = EventEnvelope.builder()
                .sessionId(sessionId)
                .meta(Map.of("user_id", "u1"))
                .build();
        broker.publish(client.channelFor(event), codec.encodeEvent(envelope));
    }

    private void awaitSubscribed() {
        Collection<String> channels = client.eventChannels();
        Await.until("client subscribed", () -> channels.stream().allMatch(c -> broker.subscriberCount(c) > 0));
    }
}
