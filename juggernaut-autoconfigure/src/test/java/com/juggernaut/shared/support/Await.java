package com.juggernaut.shared.support;

import java.util.function.BooleanSupplier;

/**
 * 백그라운드 스레드의 상태 변화를 기다리는 테스트 헬퍼.
 */
public final class Await {

    private static final long TIMEOUT_MS = 5_000;

    private Await() {
    }

    public static void until(BooleanSupplier condition) {
        until("condition", condition);
    }

    public static void until(String description, BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError(description + " not met within " + TIMEOUT_MS + "ms");
            }
            Thread.onSpinWait();
        }
    }
}
