package com.juggernaut.shared.exception;

/**
 * 브로커 구독이 실패했을 때 이벤트 스트림 소비자에게 전달되는 예외.
 */
public class BrokerException extends JuggernautException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
