package com.juggernaut.shared.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 브로커가 subscribe / unsubscribe / custom 채널로 보내는 이벤트 본문.
 *
 * {@code meta} 는 클라이언트가 연결 시 지정한 값이며 없을 수 있다.
 * 알 수 없는 필드는 {@link #getExtra()} 에 그대로 보존된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventEnvelope {

    @Setter
    @JsonProperty("session_id")
    private String sessionId;

    @Setter
    private Map<String, Object> meta;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    public boolean hasMeta() {
        return meta != null && !meta.isEmpty();
    }

    /**
     * Looks up a metadata field. Empty when there is no metadata, the field is
     * absent, or its value is JSON null.
     */
    public Optional<Object> metaValue(String key) {
        if (meta == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(meta.get(key));
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra == null ? Collections.emptyMap() : extra;
    }

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(name, value);
    }
}
