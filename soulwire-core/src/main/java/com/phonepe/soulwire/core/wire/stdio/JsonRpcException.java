package com.phonepe.soulwire.core.wire.stdio;

import lombok.Getter;

/**
 * Failure to be reported to the client as a JSON-RPC error object
 */
@Getter
public class JsonRpcException extends RuntimeException {
    private final int code;

    public JsonRpcException(int code, String message) {
        super(message);
        this.code = code;
    }
}
