package com.juggernaut.shared.broker;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;

import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.SubscriptionListener;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import com.juggernaut.shared.exception.BrokerException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Redis Pub/Sub 기반 MessageBroker 구현체.
 *
 * 발행은 {@link RedisTemplate#convertAndSend(String, Object)} 로 즉시 반환되며,
 * 구독마다 전용 {@link RedisMessageListenerContainer} 를 만들어 메시지를 큐에 쌓는다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisMessageBroker implements MessageBroker {

    private final RedisConnectionFactory connectionFactory;
    private final RedisTemplate<String, byte[]> redisTemplate;

    @Override
    public void publish(String channel, byte[] message) {
        redisTemplate.convertAndSend(channel, message);
    }

    @Override
    public BrokerSubscription subscribe(Collection<String> channels) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);

        QueueingSubscription subscription = new QueueingSubscription(() -> shutdown(container));
        container.setErrorHandler(subscription::fail);
        container.setRecoveryBackoff(failOnConnectionLoss(subscription));

        List<ChannelTopic> topics = channels.stream().map(ChannelTopic::new).toList();
        container.addMessageListener(new ChannelListener(subscription), topics);

        try {
            container.afterPropertiesSet();
            container.start();
        } catch (RuntimeException e) {
            subscription.close();
            throw new BrokerException("Failed to subscribe to " + channels, e);
        }
        log.info("Subscribed to Redis channels {}", channels);
        return subscription;
    }

    /**
     * Replaces the container's reconnect loop. A lost connection ends the subscription
     * with a {@link BrokerException} instead of resubscribing and skipping the events
     * published while disconnected.
     */
    static BackOff failOnConnectionLoss(QueueingSubscription subscription) {
        return () -> () -> {
            subscription.fail(new BrokerException("Redis subscription connection lost"));
            return BackOffExecution.STOP;
        };
    }

    private static void shutdown(RedisMessageListenerContainer container) {
        try {
            container.stop();
            container.destroy();
        } catch (Exception e) {
            log.warn("Failed to shut down Redis listener container: {}", e.getMessage(), e);
        }
    }

    /**
     * Feeds the subscription queue and ends it when the server reports that no
     * channel is subscribed any more.
     */
    @RequiredArgsConstructor
    static class ChannelListener implements MessageListener, SubscriptionListener {

        private final QueueingSubscription subscription;

        @Override
        public void onMessage(Message message, byte[] pattern) {
            subscription.deliver(new String(message.getChannel(), StandardCharsets.UTF_8), message.getBody());
        }

        @Override
        public void onChannelUnsubscribed(byte[] channel, long count) {
            if (count == 0 && !subscription.isClosed()) {
                subscription.fail(new BrokerException("Redis closed the subscription to "
                        + new String(channel, StandardCharsets.UTF_8)));
            }
        }
    }
}
