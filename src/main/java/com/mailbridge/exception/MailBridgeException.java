package com.mailbridge.exception;

import lombok.Getter;

/**
 * Operation failure tagged with its {@link ErrorKind}
 */
@Getter
public class MailBridgeException extends RuntimeException {

    private final ErrorKind kind;

    public MailBridgeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MailBridgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static MailBridgeException validation(String message) {
        return new MailBridgeException(ErrorKind.VALIDATION_FAILURE, message);
    }

    public static MailBridgeException connection(String message, Throwable cause) {
        return new MailBridgeException(ErrorKind.CONNECTION_FAILURE, message, cause);
    }
}
