package com.juggernaut.shared.broker;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.juggernaut.shared.exception.BrokerException;

import lombok.extern.slf4j.Slf4j;

/**
 * Push 방식으로 전달되는 브로커 메시지를 blocking pull 방식으로 바꿔주는 구독.
 *
 * 브로커 스레드는 {@link #deliver(String, byte[])} 로 메시지를 넣고,
 * 소비자 스레드는 {@link #next()} 로 도착 순서대로 꺼낸다.
 */
@Slf4j
public class QueueingSubscription implements BrokerSubscription {

    private static final BrokerMessage END = new BrokerMessage("", new byte[0]);
    private static final Throwable CLOSED = new Throwable("closed");

    private final BlockingQueue<BrokerMessage> queue = new LinkedBlockingQueue<>();
    // null = 열림, CLOSED = 정상 종료, 그 외 = 실패 원인
    private final AtomicReference<Throwable> termination = new AtomicReference<>();
    private final AtomicBoolean released = new AtomicBoolean();
    private final Runnable release;

    public QueueingSubscription(Runnable release) {
        this.release = release;
    }

    public void deliver(String channel, byte[] body) {
        if (termination.get() != null) {
            log.debug("Dropping message on {} for terminated subscription", channel);
            return;
        }
        queue.add(new BrokerMessage(channel, body));
    }

    /**
     * Terminates the subscription with an error. Messages still queued are discarded and
     * the consumer receives a {@link BrokerException}. Broker resources are released by
     * {@link #close()}, which the consumer is expected to call.
     */
    public void fail(Throwable cause) {
        if (termination.compareAndSet(null, cause)) {
            log.warn("Broker subscription failed: {}", cause.getMessage());
            queue.add(END);
        }
    }

    @Override
    public Optional<BrokerMessage> next() {
        if (termination.get() == null) {
            BrokerMessage message;
            try {
                message = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerException("Interrupted while waiting for a broker message", e);
            }
            if (message != END) {
                return Optional.of(message);
            }
        }
        Throwable cause = termination.get();
        if (cause != null && cause != CLOSED) {
            throw new BrokerException("Broker subscription failed", cause);
        }
        return Optional.empty();
    }

    @Override
    public boolean isClosed() {
        return termination.get() != null;
    }

    @Override
    public void close() {
        if (termination.compareAndSet(null, CLOSED)) {
            queue.clear();
            queue.add(END);
        }
        if (released.compareAndSet(false, true)) {
            release.run();
        }
    }
}
