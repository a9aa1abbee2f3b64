package com.juggernaut.shared.presence.core;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.juggernaut.shared.client.EventStream;
import com.juggernaut.shared.client.JuggernautClient;
import com.juggernaut.shared.codec.BusEvent;
import com.juggernaut.shared.codec.EventEnvelope;
import com.juggernaut.shared.presence.dto.PresenceSnapshot;
import com.juggernaut.shared.presence.storage.ConnectionUpdate;
import com.juggernaut.shared.presence.storage.PresenceStore;

import lombok.extern.slf4j.Slf4j;

/**
 * 연결 단위의 subscribe / unsubscribe 이벤트를 사용자 단위의 접속 상태로 묶는 Roster.
 *
 * <p>Roster 자체는 상태를 갖지 않는다. 모든 판단은 {@link PresenceStore} 의 원자적 연산 결과에서
 * 나오므로 같은 저장소를 공유하는 여러 프로세스에서 동시에 실행할 수 있다.
 *
 * <p>사용 예:
 * <pre>{@code
 * Roster roster = new Roster(client, store);
 * roster.addListener(new RosterListener() {
 *     public void onSignedIn(String userId) { ... }
 * });
 * roster.run();   // 스트림이 닫힐 때까지 blocking
 * }</pre>
 *
 * <p>unsubscribe 없이 끊긴 연결은 저장소에 남으므로 해당 사용자는 계속 온라인으로 보인다.
 */
@Slf4j
public class Roster {

    private final JuggernautClient client;
    private final PresenceStore store;
    private final UserIdResolver userIdResolver;
    private final List<RosterListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean active = new AtomicBoolean();
    private final AtomicReference<EventStream> running = new AtomicReference<>();

    // run() 이 스트림을 등록하기 전에 들어온 stop() 도 놓치지 않도록 남겨 둔다
    private volatile boolean stopRequested;

    public Roster(JuggernautClient client, PresenceStore store) {
        this(client, store, new MetaKeyUserIdResolver(), List.of());
    }

    public Roster(JuggernautClient client, PresenceStore store,
                  UserIdResolver userIdResolver, Collection<? extends RosterListener> listeners) {
        this.client = Objects.requireNonNull(client, "client");
        this.store = Objects.requireNonNull(store, "store");
        this.userIdResolver = Objects.requireNonNull(userIdResolver, "userIdResolver");
        this.listeners.addAll(listeners);
    }

    public void addListener(RosterListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(RosterListener listener) {
        listeners.remove(listener);
    }

    /**
     * Consumes events until the stream is closed by {@link #stop()} or by the broker.
     * Decode, broker and store failures propagate and end the loop.
     *
     * @throws IllegalStateException if this roster is already running
     */
    public void run() {
        if (!active.compareAndSet(false, true)) {
            throw new IllegalStateException("Roster is already running");
        }
        try {
            if (stopRequested) {
                log.info("Roster stop requested before start, not subscribing");
                return;
            }
            EventStream events = client.subscribeListen();
            running.set(events);
            if (stopRequested) {
                events.close();
            }
            log.info("Roster listening on {}", client.eventChannels());
            try (events) {
                while (events.hasNext()) {
                    handleEvent(events.next());
                }
            } finally {
                running.set(null);
            }
            log.info("Roster event stream ended");
        } finally {
            stopRequested = false;
            active.set(false);
        }
    }

    /**
     * Closes the stream consumed by {@link #run()}. Safe to call from any thread.
     * A stop that arrives while {@code run()} is still subscribing, or before it starts,
     * ends that run as soon as the stream is registered.
     */
    public void stop() {
        stopRequested = true;
        EventStream events = running.get();
        if (events != null) {
            events.close();
        }
    }

    public boolean isRunning() {
        return running.get() != null;
    }

    public void handleEvent(BusEvent event) {
        handleEvent(event.event(), event.envelope());
    }

    public void handleEvent(String event, EventEnvelope envelope) {
        Optional<String> userId = userIdResolver.resolve(envelope);
        if (userId.isEmpty()) {
            log.debug("Ignoring {} event without user id", event);
            return;
        }

        boolean subscribe = JuggernautClient.EVENT_SUBSCRIBE.equals(event);
        boolean unsubscribe = JuggernautClient.EVENT_UNSUBSCRIBE.equals(event);
        if (!subscribe && !unsubscribe) {
            return;
        }
        if (envelope.getSessionId() == null) {
            log.warn("Ignoring {} event for user {} without session_id", event, userId.get());
            return;
        }

        if (subscribe) {
            onSubscribe(userId.get(), envelope);
        } else {
            onUnsubscribe(userId.get(), envelope);
        }
    }

    /**
     * 연결 추가. 추가 직전 연결 수가 0 이었던 경우에만 로그인으로 본다.
     * 온라인 사용자 집합은 저장소가 같은 원자적 연산 안에서 갱신한다.
     * 같은 세션의 중복 subscribe 는 아무것도 바꾸지 않는다.
     */
    public void onSubscribe(String userId, EventEnvelope envelope) {
        ConnectionUpdate update = store.addConnection(userId, envelope.getSessionId());
        if (!update.cameOnline()) {
            log.debug("User {} has {} connections", userId, update.count());
            return;
        }
        log.info("User {} signed in (session {})", userId, envelope.getSessionId());
        for (RosterListener listener : listeners) {
            listener.onSignedIn(userId);
        }
    }

    /**
     * 연결 제거. 마지막 연결이 실제로 제거된 경우에만 로그아웃으로 본다.
     */
    public void onUnsubscribe(String userId, EventEnvelope envelope) {
        ConnectionUpdate update = store.removeConnection(userId, envelope.getSessionId());
        if (!update.wentOffline()) {
            log.debug("User {} has {} connections", userId, update.count());
            return;
        }
        log.info("User {} signed out (session {})", userId, envelope.getSessionId());
        for (RosterListener listener : listeners) {
            listener.onSignedOut(userId);
        }
    }

    public Set<String> getOnlineUsers() {
        return store.onlineUsers();
    }

    public boolean isUserOnline(String userId) {
        return store.isOnline(userId);
    }

    public PresenceSnapshot getPresence(String userId) {
        Set<String> sessions = store.connections(userId);
        return new PresenceSnapshot(userId, !sessions.isEmpty(), sessions);
    }
}
