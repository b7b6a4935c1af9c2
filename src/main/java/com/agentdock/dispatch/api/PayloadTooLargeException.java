package com.agentdock.dispatch.api;

import java.io.IOException;

/**
 * Raised while reading a request body that exceeds the configured JSON size limit.
 */
public class PayloadTooLargeException extends IOException {

    public PayloadTooLargeException(long limit) {
        super("Request body exceeds " + limit + " bytes");
    }
}
