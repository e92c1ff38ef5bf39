package org.opgraph;

public class OpGraphException extends RuntimeException {

    private final ErrorKind kind;

    public OpGraphException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OpGraphException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
