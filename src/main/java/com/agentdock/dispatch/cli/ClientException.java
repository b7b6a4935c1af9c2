package com.agentdock.dispatch.cli;

/**
 * An error reported by the server's {@code {ok:false, code, message}} envelope,
 * or a transport failure talking to it.
 */
public class ClientException extends RuntimeException {

    private final int statusCode;
    private final String code;

    public ClientException(int statusCode, String code, String message) {
        super(message);
        this.statusCode = statusCode;
        this.code = code;
    }

    public ClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.code = "connection_failed";
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getCode() {
        return code;
    }
}
