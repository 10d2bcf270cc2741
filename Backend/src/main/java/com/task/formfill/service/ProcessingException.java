package com.task.formfill.service;

public class ProcessingException extends RuntimeException {

    private final ErrorKind kind;

    public ProcessingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProcessingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ProcessingException unsupported(String message) {
        return new ProcessingException(ErrorKind.UNSUPPORTED_INPUT, message);
    }

    public static ProcessingException validation(String message) {
        return new ProcessingException(ErrorKind.VALIDATION_FAILURE, message);
    }

    public static ProcessingException provider(String message, Throwable cause) {
        return new ProcessingException(ErrorKind.PROVIDER_FAILURE, message, cause);
    }
}
