package com.juggernaut.shared.broker;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;

/**
 * 인메모리 기반 MessageBroker 구현체.
 * 같은 프로세스 안의 구독자에게만 전달되므로 단일 인스턴스 환경이나 테스트에 적합합니다.
 * 다중 인스턴스/분산 환경에서는 Redis를 사용하세요.
 */
@Slf4j
public class InMemoryMessageBroker implements MessageBroker {

    // channel -> live subscriptions
    private final Map<String, Set<QueueingSubscription>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void publish(String channel, byte[] message) {
        Set<QueueingSubscription> targets = subscribers.get(channel);
        if (targets == null || targets.isEmpty()) {
            log.debug("No subscribers on {}, message dropped", channel);
            return;
        }
        for (QueueingSubscription subscription : targets) {
            subscription.deliver(channel, message);
        }
    }

    @Override
    public BrokerSubscription subscribe(Collection<String> channels) {
        List<String> topics = List.copyOf(channels);
        QueueingSubscription[] holder = new QueueingSubscription[1];
        QueueingSubscription subscription = new QueueingSubscription(() -> unregister(topics, holder[0]));
        holder[0] = subscription;

        for (String topic : topics) {
            subscribers.computeIfAbsent(topic, k -> ConcurrentHashMap.newKeySet()).add(subscription);
        }
        return subscription;
    }

    /** 현재 채널 구독자 수 (테스트/디버그용) */
    public int subscriberCount(String channel) {
        Set<QueueingSubscription> targets = subscribers.get(channel);
        return targets == null ? 0 : targets.size();
    }

    private void unregister(Collection<String> topics, QueueingSubscription subscription) {
        for (String topic : topics) {
            subscribers.computeIfPresent(topic, (k, set) -> {
                set.remove(subscription);
                return set.isEmpty() ? null : set;
            });
        }
    }
}
