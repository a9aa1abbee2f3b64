package com.juggernaut.shared.client;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

import com.juggernaut.shared.broker.BrokerMessage;
import com.juggernaut.shared.broker.BrokerSubscription;
import com.juggernaut.shared.codec.BusEvent;
import com.juggernaut.shared.codec.EnvelopeCodec;

/**
 * 이벤트 채널에서 수신한 메시지를 도착 순서대로 돌려주는 blocking iterator.
 *
 * {@link #hasNext()} 는 다음 메시지가 올 때까지 대기하며, {@link #close()} 가 호출되면
 * (다른 스레드에서라도) 대기를 끝내고 {@code false} 를 반환한다.
 * 디코딩 실패는 {@link #next()} 에서 {@link com.juggernaut.shared.exception.EnvelopeDecodeException} 으로 전달된다.
 */
public class EventStream implements Iterator<BusEvent>, AutoCloseable {

    private final BrokerSubscription subscription;
    private final EnvelopeCodec codec;

    private BrokerMessage pending;
    private boolean finished;

    EventStream(BrokerSubscription subscription, EnvelopeCodec codec) {
        this.subscription = subscription;
        this.codec = codec;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        Optional<BrokerMessage> message = subscription.next();
        if (message.isEmpty()) {
            finished = true;
            return false;
        }
        pending = message.get();
        return true;
    }

    @Override
    public BusEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Event stream is closed");
        }
        BrokerMessage message = pending;
        pending = null;
        return codec.decodeEvent(message.channel(), message.body());
    }

    public boolean isClosed() {
        return subscription.isClosed();
    }

    @Override
    public void close() {
        subscription.close();
    }
}
