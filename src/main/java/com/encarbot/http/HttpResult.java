package com.encarbot.http;

public record HttpResult(int status, String body) {
    public HttpResult {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return status / 100 == 2;
    }
}
