package com.juggernaut.shared.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.util.backoff.BackOffExecution;

import com.juggernaut.shared.exception.BrokerException;

class RedisMessageBrokerTest {

    @Test
    @SuppressWarnings("unchecked")
    void publishSendsRawBytesToChannel() {
        RedisTemplate<String, byte[]> template = mock(RedisTemplate.class);
        RedisMessageBroker broker = new RedisMessageBroker(mock(RedisConnectionFactory.class), template);
        byte[] payload = "{\"channels\":[\"a\"]}".getBytes(StandardCharsets.UTF_8);

        broker.publish("juggernaut", payload);

        verify(template).convertAndSend("juggernaut", payload);
    }

    @Test
    void channelListenerQueuesMessagesWithChannelName() {
        QueueingSubscription subscription = new QueueingSubscription(() -> { });
        RedisMessageBroker.ChannelListener listener = new RedisMessageBroker.ChannelListener(subscription);

        listener.onMessage(new DefaultMessage(bytes("juggernaut:subscribe"), bytes("{}")), null);

        Optional<BrokerMessage> message = subscription.next();
        assertThat(message).isPresent();
        assertThat(message.get().channel()).isEqualTo("juggernaut:subscribe");
        assertThat(new String(message.get().body(), StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    @Test
    void losingLastChannelFailsSubscription() {
        QueueingSubscription subscription = new QueueingSubscription(() -> { });
        RedisMessageBroker.ChannelListener listener = new RedisMessageBroker.ChannelListener(subscription);

        listener.onChannelUnsubscribed(bytes("juggernaut:custom"), 1);
        assertThat(subscription.isClosed()).isFalse();

        listener.onChannelUnsubscribed(bytes("juggernaut:subscribe"), 0);
        assertThat(subscription.isClosed()).isTrue();
        assertThatThrownBy(subscription::next).isInstanceOf(BrokerException.class);
    }

    @Test
    void unsubscribeAfterCloseIsNotAFailure() {
        QueueingSubscription subscription = new QueueingSubscription(() -> { });
        RedisMessageBroker.ChannelListener listener = new RedisMessageBroker.ChannelListener(subscription);

        subscription.close();
        listener.onChannelUnsubscribed(bytes("juggernaut:subscribe"), 0);

        assertThat(subscription.next()).isEmpty();
    }

    @Test
    void lostConnectionFailsSubscriptionInsteadOfReconnecting() throws Exception {
        QueueingSubscription subscription = new QueueingSubscription(() -> { });
        CompletableFuture<Optional<BrokerMessage>> waiting = CompletableFuture.supplyAsync(subscription::next);

        BackOffExecution recovery = RedisMessageBroker.failOnConnectionLoss(subscription).start();

        assertThat(recovery.nextBackOff()).isEqualTo(BackOffExecution.STOP);
        assertThat(subscription.isClosed()).isTrue();
        assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(BrokerException.class)
                .hasRootCauseMessage("Redis subscription connection lost");
    }

    @Test
    void connectionLossAfterCloseEndsQuietly() {
        QueueingSubscription subscription = new QueueingSubscription(() -> { });
        subscription.close();

        RedisMessageBroker.failOnConnectionLoss(subscription).start().nextBackOff();

        assertThat(subscription.next()).isEmpty();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
