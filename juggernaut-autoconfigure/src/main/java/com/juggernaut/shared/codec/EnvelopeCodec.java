package com.juggernaut.shared.codec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.juggernaut.shared.exception.EnvelopeDecodeException;
import com.juggernaut.shared.exception.JuggernautException;

/**
 * juggernaut 와 주고받는 JSON 봉투(envelope)의 인코딩/디코딩.
 *
 * <ul>
 *   <li>발행: {@code {"channels": [...], "data": ..., "except": [...]}} + 추가 옵션</li>
 *   <li>수신: 채널 이름 {@code <key>:<event>} 과 {@link EventEnvelope} 본문</li>
 * </ul>
 */
public class EnvelopeCodec {

    public static final String CHANNEL_DELIMITER = ":";

    private static final String CHANNELS = "channels";
    private static final String DATA = "data";
    private static final String EXCEPT = "except";

    private final ObjectMapper objectMapper;

    public EnvelopeCodec() {
        this(defaultObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Builds the publish envelope. Channel names are deduplicated and sorted, so the
     * output is deterministic for the same set of channels. Entries of {@code options}
     * are applied last and win over {@code channels}, {@code data} and {@code except}.
     */
    public byte[] encodePublish(Collection<String> channels, Object data,
                                Collection<String> except, Map<String, ?> options) {
        Objects.requireNonNull(channels, "channels");

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(CHANNELS, sortedUnique(channels));
        envelope.put(DATA, data);
        if (except != null && !except.isEmpty()) {
            envelope.put(EXCEPT, sortedUnique(except));
        }
        if (options != null) {
            envelope.putAll(options);
        }

        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new JuggernautException("Failed to encode publish envelope for channels " + channels, e);
        }
    }

    /**
     * Decodes a message received on one of the event channels. The event name is
     * everything after the first {@value #CHANNEL_DELIMITER} of the channel name.
     *
     * @throws EnvelopeDecodeException if the channel has no event suffix or the
     *                                 payload is not a JSON object
     */
    public BusEvent decodeEvent(String channel, byte[] payload) {
        int delimiter = channel == null ? -1 : channel.indexOf(CHANNEL_DELIMITER);
        if (delimiter < 0) {
            throw new EnvelopeDecodeException("Channel name has no event suffix: " + channel, channel);
        }
        String event = channel.substring(delimiter + 1);

        if (payload == null) {
            throw new EnvelopeDecodeException("Empty event payload", channel);
        }

        EventEnvelope envelope;
        try {
            envelope = objectMapper.readValue(payload, EventEnvelope.class);
        } catch (IOException e) {
            throw new EnvelopeDecodeException("Malformed event envelope on channel " + channel, channel, e);
        }
        if (envelope == null) {
            throw new EnvelopeDecodeException("Event payload is JSON null", channel);
        }
        return new BusEvent(event, envelope);
    }

    public byte[] encodeEvent(EventEnvelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new JuggernautException("Failed to encode event envelope", e);
        }
    }

    private static List<String> sortedUnique(Collection<String> values) {
        return new ArrayList<>(new TreeSet<>(values));
    }
}
