package com.climateplatform.collector.fetcher;

import com.climateplatform.collector.registry.SourceDescriptor;
import com.climateplatform.collector.registry.SourceRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/** Shared fixtures for fetchers exercised against a {@link MockWebServer}. */
final class FetcherTestSupport {

    /** 2024-01-10T12:00Z; the default window is therefore 2024-01-03..2024-01-09. */
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-10T12:00:00Z"), ZoneOffset.UTC);

    private FetcherTestSupport() {}

    static String baseUrl(MockWebServer server) {
        return "http://" + server.getHostName() + ":" + server.getPort();
    }

    static SourceRegistry registry(String sourceId, MockWebServer server, String apiKey, Map<String, Object> defaults) {
        return new SourceRegistry(List.of(new SourceDescriptor(
            sourceId, baseUrl(server), apiKey, Duration.ofSeconds(5), 2, Duration.ofMillis(10), defaults)));
    }

    static MockResponse json(String body) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
