package com.skyquorum.sources.fetch;

public record TransportResponse(int statusCode, byte[] body) {
    public TransportResponse {
        body = body == null ? new byte[0] : body;
    }

    public boolean successful() {
        return statusCode / 100 == 2;
    }
}
