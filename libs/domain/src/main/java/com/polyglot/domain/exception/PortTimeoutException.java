package com.polyglot.domain.exception;

import java.time.Duration;

/** A port call exceeded the deadline its adapter enforces. */
public class PortTimeoutException extends PortException {

    private final Duration timeout;

    public PortTimeoutException(String port, Duration timeout, Throwable cause) {
        super(
                ErrorKind.PORT_TIMEOUT,
                port,
                "%s did not respond within %d ms".formatted(port, timeout.toMillis()),
                cause);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
