package com.skyquorum.sources.fetch;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * A single outbound call with no retry of its own.
 */
@FunctionalInterface
public interface HttpTransport {
    TransportResponse send(HttpRequest request) throws IOException, InterruptedException;

    static HttpTransport of(HttpClient httpClient) {
        return request -> {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            return new TransportResponse(response.statusCode(), response.body());
        };
    }

    static HttpTransport create(Duration connectTimeout) {
        return of(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }
}
