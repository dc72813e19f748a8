package com.m2m.cloud.auth.transport;

import com.m2m.cloud.auth.error.TransportException;

import java.time.Duration;
import java.util.Map;

/**
 * Makes one HTTP request. Implementations never retry on their own.
 */
@FunctionalInterface
public interface Transport {

    /**
     * @param body    request payload, or {@code null}
     * @param timeout overall timeout, or {@code null} for the implementation default
     * @throws TransportException if no response could be obtained
     */
    Response request(String method, String url, Map<String, String> headers, byte[] body, Duration timeout);

    default Response request(String method, String url, Map<String, String> headers) {
        return request(method, url, headers, null, null);
    }
}
