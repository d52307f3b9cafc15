package com.polyglot.domain.exception;

/** The AI tutor could not generate a reply or extract vocabulary. */
public class ProviderException extends PortException {

    private final String operation;

    public ProviderException(String operation, String reason) {
        this(operation, reason, null);
    }

    public ProviderException(String operation, String reason, Throwable cause) {
        super(
                ErrorKind.PROVIDER,
                "AiTutor",
                "AI tutor failed during %s: %s".formatted(operation, reason),
                cause);
        this.operation = operation;
    }

    /** The tutor capability that failed ("generateReply" or "extractVocabulary"). */
    public String operation() {
        return operation;
    }
}
