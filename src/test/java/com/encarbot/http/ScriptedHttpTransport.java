package com.encarbot.http;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Transport that replays scripted outcomes. GETs consume the queue first and then fall
 * back to {@link #onGet}; POST bodies are recorded.
 */
public final class ScriptedHttpTransport implements HttpTransport {
    private final Deque<Object> script = new ArrayDeque<>();
    public final List<String> getUrls = new ArrayList<>();
    public final List<Map<String, String>> getHeaders = new ArrayList<>();
    public final List<String> postUrls = new ArrayList<>();
    public final List<String> postBodies = new ArrayList<>();
    public Function<String, HttpResult> onGet = url -> new HttpResult(500, "unscripted");
    public HttpResult postResponse = new HttpResult(200, "{\"ok\":true}");

    public ScriptedHttpTransport respond(int status, String body) {
        script.add(new HttpResult(status, body));
        return this;
    }

    public ScriptedHttpTransport fail(String message) {
        script.add(new IOException(message));
        return this;
    }

    @Override
    public synchronized HttpResult get(String url, Map<String, String> headers, Duration timeout) throws IOException {
        getUrls.add(url);
        getHeaders.add(headers);
        Object next = script.poll();
        if (next == null) {
            return onGet.apply(url);
        }
        if (next instanceof IOException e) {
            throw e;
        }
        return (HttpResult) next;
    }

    @Override
    public synchronized HttpResult postJson(String url, String json, Duration timeout) {
        postUrls.add(url);
        postBodies.add(json);
        return postResponse;
    }
}
