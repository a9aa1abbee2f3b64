package com.juggernaut.shared.client;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.juggernaut.shared.broker.MessageBroker;
import com.juggernaut.shared.codec.BusEvent;
import com.juggernaut.shared.codec.EnvelopeCodec;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * juggernaut 서버와 브로커를 통해 통신하는 클라이언트.
 *
 * <ul>
 *   <li>{@link #publish} : 제어 채널({@code key})로 발행 봉투를 보낸다.</li>
 *   <li>{@link #subscribeListen()} : {@code <key>:subscribe}, {@code <key>:unsubscribe},
 *       {@code <key>:custom} 이벤트를 순서대로 읽는다.</li>
 * </ul>
 */
@Slf4j
public class JuggernautClient {

    public static final String DEFAULT_KEY = "juggernaut";

    public static final String EVENT_SUBSCRIBE = "subscribe";
    public static final String EVENT_UNSUBSCRIBE = "unsubscribe";
    public static final String EVENT_CUSTOM = "custom";

    private final MessageBroker broker;
    private final EnvelopeCodec codec;

    @Getter
    private final String key;

    public JuggernautClient(MessageBroker broker) {
        this(broker, new EnvelopeCodec(), DEFAULT_KEY);
    }

    public JuggernautClient(MessageBroker broker, EnvelopeCodec codec, String key) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.key = Objects.requireNonNull(key, "key");
    }

    public void publish(String channel, Object data) {
        publish(List.of(channel), data, null, Map.of());
    }

    public void publish(Collection<String> channels, Object data) {
        publish(channels, data, null, Map.of());
    }

    /**
     * 하나 이상의 채널로 데이터를 발행한다. 중복된 채널 이름은 하나로 합쳐진다.
     *
     * @param except  전달에서 제외할 세션 id 목록 (없으면 null)
     * @param options 봉투에 그대로 합쳐지는 추가 필드
     */
    public void publish(Collection<String> channels, Object data,
                        Collection<String> except, Map<String, ?> options) {
        byte[] envelope = codec.encodePublish(channels, data, except, options);
        broker.publish(key, envelope);
        log.debug("Published to {} via control channel {}", channels, key);
    }

    /**
     * 세 개의 이벤트 채널을 새로 구독한다.
     * 반환된 스트림은 닫히거나 구독이 실패할 때까지 끝나지 않는다.
     */
    public EventStream subscribeListen() {
        return new EventStream(broker.subscribe(eventChannels()), codec);
    }

    /**
     * Runs {@code handler} synchronously for every event until the stream ends.
     * An exception from the handler closes the subscription and propagates.
     */
    public void subscribe(EventHandler handler) {
        try (EventStream events = subscribeListen()) {
            while (events.hasNext()) {
                BusEvent event = events.next();
                handler.handle(event.event(), event.envelope());
            }
        }
    }

    public List<String> eventChannels() {
        return List.of(
                channelFor(EVENT_SUBSCRIBE),
                channelFor(EVENT_UNSUBSCRIBE),
                channelFor(EVENT_CUSTOM)
        );
    }

    public String channelFor(String event) {
        return key + EnvelopeCodec.CHANNEL_DELIMITER + event;
    }
}
