package com.encarbot.http;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Plain HTTP calls made outside the browser: the list endpoint and the chat bot API.
 */
public interface HttpTransport {
    HttpResult get(String url, Map<String, String> headers, Duration timeout) throws IOException, InterruptedException;

    HttpResult postJson(String url, String json, Duration timeout) throws IOException, InterruptedException;
}
