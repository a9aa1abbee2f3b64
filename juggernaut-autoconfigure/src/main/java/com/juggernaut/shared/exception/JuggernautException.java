package com.juggernaut.shared.exception;

/**
 * juggernaut 라이브러리에서 발생하는 모든 예외의 기반 클래스.
 */
public class JuggernautException extends RuntimeException {

    public JuggernautException(String message) {
        super(message);
    }

    public JuggernautException(String message, Throwable cause) {
        super(message, cause);
    }
}
