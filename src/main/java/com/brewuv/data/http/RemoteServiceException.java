package com.brewuv.data.http;

import java.io.IOException;

/**
 * Non-2xx answer from a remote service.
 */
public class RemoteServiceException extends IOException {
    private final int statusCode;
    private final String url;

    public RemoteServiceException(int statusCode, String url) {
        super("HTTP " + statusCode + " for " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    public boolean isRetryable() {
        return statusCode == 429 || statusCode >= 500;
    }
}
