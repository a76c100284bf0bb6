package com.deeplog.deeplog.context;

public final class ClientContextModels {

    private ClientContextModels() {
    }

    public record CsrfTokenResponse(String token) {
    }
}
