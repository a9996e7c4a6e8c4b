package org.squadplanner.engine.api;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.squadplanner.engine.api.dto.ParameterSetDto;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ParameterApiClientImplTest {

    private static final String BODY = "{"
            + "\"config\": ["
            + "  {\"key\": \"horizon_length\", \"value\": 4, \"min_value\": 0, \"max_value\": 10},"
            + "  {\"key\": \"discount_factor\", \"value\": 0.9, \"description\": \"per-event discount\"}"
            + "],"
            + "\"curves\": ["
            + "  {\"name\": \"readiness_high\", \"kind\": \"logistic\","
            + "   \"parameters\": {\"midpoint\": 0.82, \"steepness\": 18, \"floor\": 0.3}}"
            + "],"
            + "\"version\": 7"
            + "}";

    private MockWebServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void stopServer() throws IOException {
        server.shutdown();
    }

    @Test
    void fetchesAndDecodesParameterSet() throws InterruptedException {
        server.enqueue(new MockResponse().setBody(BODY).setHeader("Content-Type", "application/json"));
        ParameterSource client = new ParameterApiClientImpl(server.url("/").toString());

        ParameterSetDto parameters = client.fetchParameters();

        assertNotNull(parameters);
        assertEquals(2, parameters.getConfig().size());
        assertEquals("horizon_length", parameters.getConfig().get(0).getKey());
        assertEquals(4.0, parameters.getConfig().get(0).getValue(), 0.0);
        assertEquals(10.0, parameters.getConfig().get(0).getMaxValue(), 0.0);
        assertNull(parameters.getConfig().get(1).getMinValue());
        assertEquals("logistic", parameters.getCurves().get(0).getKind());
        assertEquals(18.0, parameters.getCurves().get(0).getParameters().get("steepness"), 0.0);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("GET", request.getMethod());
        assertEquals("/v1/planner/parameters", request.getPath());
        assertNull(request.getHeader("Authorization"));
    }

    @Test
    void sendsBearerTokenWhenConfigured() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{}").setHeader("Content-Type", "application/json"));
        ParameterSource client = new ParameterApiClientImpl(server.url("/api").toString(), "s3cret");

        assertNotNull(client.fetchParameters());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("Bearer s3cret", request.getHeader("Authorization"));
        assertEquals("/api/v1/planner/parameters", request.getPath());
    }

    @Test
    void serverErrorYieldsNull() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        ParameterSource client = new ParameterApiClientImpl(server.url("/").toString());

        assertNull(client.fetchParameters());
    }

    @Test
    void malformedBodyYieldsNull() {
        server.enqueue(new MockResponse().setBody("not json").setHeader("Content-Type", "application/json"));
        ParameterSource client = new ParameterApiClientImpl(server.url("/").toString());

        assertNull(client.fetchParameters());
    }

    @Test
    void describesItsBaseUrl() {
        ParameterSource client = new ParameterApiClientImpl("http://localhost:9000");

        assertEquals("parameter API at http://localhost:9000/", client.describe());
    }
}
