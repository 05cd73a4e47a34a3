package com.qrwallet.config;

import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResponseErrorHandler;

/**
 * Leaves HTTP error statuses to the caller; only I/O failures raise exceptions.
 */
class PassThroughErrorHandler implements ResponseErrorHandler {

    @Override
    public boolean hasError(ClientHttpResponse response) {
        return false;
    }

    @Override
    public void handleError(ClientHttpResponse response) {
        // never called, hasError is always false
    }
}
