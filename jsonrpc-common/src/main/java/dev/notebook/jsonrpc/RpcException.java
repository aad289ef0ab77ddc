package dev.notebook.jsonrpc;

import java.util.Objects;

/**
 * Protocol-level failure detected while decoding, validating or binding a request.
 */
public class RpcException extends Exception {

    private static final long serialVersionUID = 1L;

    private final RpcErrorCode errorCode;

    public RpcException(RpcErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public RpcException(RpcErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public RpcErrorCode errorCode() {
        return errorCode;
    }
}
