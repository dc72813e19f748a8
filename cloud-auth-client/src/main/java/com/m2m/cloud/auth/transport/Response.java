package com.m2m.cloud.auth.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * An HTTP response. Header lookups ignore case. The body is copied in and out, so instances
 * are immutable and compare by content.
 */
public record Response(int status, byte[] data, Map<String, String> headers) {

    public Response {
        data = data == null ? new byte[0] : data.clone();
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public static Response of(int status, String body, Map<String, String> headers) {
        return new Response(status, body.getBytes(StandardCharsets.UTF_8), headers);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String text() {
        return new String(data, StandardCharsets.UTF_8);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Response other)) {
            return false;
        }
        return status == other.status && Arrays.equals(data, other.data) && headers.equals(other.headers);
    }

    @Override
    public int hashCode() {
        int headersHash = headers.entrySet().stream()
            .mapToInt(e -> e.getKey().toLowerCase(Locale.ROOT).hashCode() ^ Objects.hashCode(e.getValue()))
            .sum();
        return 31 * (31 * Integer.hashCode(status) + Arrays.hashCode(data)) + headersHash;
    }

    @Override
    public String toString() {
        return "Response[status=" + status + ", data=" + data.length + " bytes, headers=" + headers + "]";
    }
}
