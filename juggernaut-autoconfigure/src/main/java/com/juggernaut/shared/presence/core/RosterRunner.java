package com.juggernaut.shared.presence.core;

import java.time.Duration;

import org.springframework.context.SmartLifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 애플리케이션 컨텍스트와 함께 Roster 를 전용 스레드에서 실행/종료한다.
 * run() 이 예외로 끝나면 로그만 남기고 재시작하지 않는다.
 */
@Slf4j
@RequiredArgsConstructor
public class RosterRunner implements SmartLifecycle {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final Roster roster;

    private volatile Thread worker;

    @Override
    public synchronized void start() {
        if (worker != null) {
            return;
        }
        Thread thread = new Thread(this::runRoster, "juggernaut-roster");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
    }

    @Override
    public synchronized void stop() {
        Thread thread = worker;
        worker = null;
        if (thread == null || !thread.isAlive()) {
            return;
        }
        // run() 이 아직 구독 중이어도 stop 요청은 남아 있으므로 한 번만 닫으면 된다
        roster.stop();
        try {
            thread.join(STOP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Roster thread did not stop within {}", STOP_TIMEOUT);
        }
    }

    @Override
    public boolean isRunning() {
        Thread thread = worker;
        return thread != null && thread.isAlive();
    }

    private void runRoster() {
        try {
            roster.run();
        } catch (RuntimeException e) {
            log.error("Roster terminated: {}", e.getMessage(), e);
        }
    }
}
