package com.stashguard.rpc;

/**
 * Failure of an RPC call, carrying the status reported to the caller.
 */
public class RpcException extends Exception {

    private final RpcStatus status;

    public RpcException(RpcStatus status, String message) {
        super(message);
        this.status = status;
    }

    public RpcException(RpcStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public RpcStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "RpcException{" +
               "status=" + status +
               ", message='" + getMessage() + '\'' +
               '}';
    }
}
