package com.m2m.cloud.auth.transport;

import com.m2m.cloud.auth.error.TransportException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Transport} backed by {@link HttpClient}.
 */
public record JdkHttpTransport(HttpClient http) implements Transport {

    public JdkHttpTransport() {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    public JdkHttpTransport {
        Objects.requireNonNull(http, "http");
    }

    @Override
    public Response request(String method, String url, Map<String, String> headers, byte[] body, Duration timeout) {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(url))
                .method(method, body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofByteArray(body));
            if (headers != null) {
                headers.forEach(builder::header);
            }
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid request " + method + " " + url, e);
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }

        try {
            HttpResponse<byte[]> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            Map<String, String> responseHeaders = new HashMap<>();
            resp.headers().map().forEach((name, values) -> {
                if (!values.isEmpty()) {
                    responseHeaders.put(name, values.get(0));
                }
            });
            return new Response(resp.statusCode(), resp.body(), responseHeaders);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while calling " + url, ie);
        } catch (IOException e) {
            throw new TransportException("Failed to call " + url, e);
        }
    }
}
