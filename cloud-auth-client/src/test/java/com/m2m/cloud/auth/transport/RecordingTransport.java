package com.m2m.cloud.auth.transport;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Answers requests from a queue of canned responses and records what was sent.
 */
public class RecordingTransport implements Transport {

    private final Deque<Object> answers = new ArrayDeque<>();
    private final List<Request> requests = new ArrayList<>();

    public record Request(String method, String url, Map<String, String> headers, byte[] body, Duration timeout) {

        public String header(String name) {
            return headers.get(name);
        }

        public String bodyText() {
            return body == null ? null : new String(body, StandardCharsets.UTF_8);
        }
    }

    public RecordingTransport respond(int status, String body) {
        return respond(Response.of(status, body, Map.of()));
    }

    public RecordingTransport respondJson(int status, String body) {
        return respond(Response.of(status, body, Map.of("Content-Type", "application/json; charset=UTF-8")));
    }

    public RecordingTransport respond(Response response) {
        answers.add(response);
        return this;
    }

    public RecordingTransport fail(RuntimeException failure) {
        answers.add(failure);
        return this;
    }

    @Override
    public Response request(String method, String url, Map<String, String> headers, byte[] body, Duration timeout) {
        Map<String, String> sent = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            sent.putAll(headers);
        }
        requests.add(new Request(method, url, sent, body, timeout));

        Object answer = answers.poll();
        if (answer == null) {
            throw new IllegalStateException("Unexpected request " + method + " " + url);
        }
        if (answer instanceof RuntimeException failure) {
            throw failure;
        }
        return (Response) answer;
    }

    public List<Request> getRequests() {
        return requests;
    }

    public Request lastRequest() {
        if (requests.isEmpty()) {
            throw new IllegalStateException("No request was made");
        }
        return requests.get(requests.size() - 1);
    }
}
