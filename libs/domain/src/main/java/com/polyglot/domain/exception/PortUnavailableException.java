package com.polyglot.domain.exception;

/** The system behind a port cannot be reached. */
public class PortUnavailableException extends PortException {

    public PortUnavailableException(String port, String reason, Throwable cause) {
        super(
                ErrorKind.PORT_UNAVAILABLE,
                port,
                "%s is unavailable: %s".formatted(port, reason),
                cause);
    }
}
