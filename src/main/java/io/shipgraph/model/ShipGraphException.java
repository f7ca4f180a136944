package io.shipgraph.model;

public class ShipGraphException extends RuntimeException {
    private final ErrorCode code;

    public ShipGraphException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ShipGraphException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
