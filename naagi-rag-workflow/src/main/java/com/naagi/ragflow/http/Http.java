package com.naagi.ragflow.http;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HttpClient factory for the LLM and Qdrant adapters.
 */
public final class Http {

    private Http() {}

    public static HttpClient newClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }
}
