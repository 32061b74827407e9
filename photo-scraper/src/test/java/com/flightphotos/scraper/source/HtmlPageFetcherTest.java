package com.flightphotos.scraper.source;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.flightphotos.scraper.model.PhotoSource;
import com.flightphotos.scraper.ratelimit.SourceRateLimiters;
import com.sun.net.httpserver.HttpServer;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HtmlPageFetcherTest {

    private HttpServer server;
    private String base;
    private SourceRateLimiters limiters;
    private HtmlPageFetcher fetcher;
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        respond("/ok", 200, "<html><body><div class='result'>hi</div></body></html>");
        respond("/missing", 404, "not here");
        respond("/blocked", 403, "forbidden");
        respond("/slow-down", 429, "too many");
        respond("/down", 503, "unavailable");
        respond("/teapot", 418, "teapot");
        server.createContext("/form", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            write(exchange, 200, "<html><body>posted</body></html>");
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();

        FlightPhotoProperties properties = new FlightPhotoProperties();
        limiters = new SourceRateLimiters(properties);
        fetcher = new HtmlPageFetcher(limiters, properties);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> write(exchange, status, body));
    }

    private static void write(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void okResponseIsParsedAndCountsAgainstTheLimiter() {
        Document page = fetcher.get(PhotoSource.JETPHOTOS, base + "/ok");

        assertThat(page.select(".result").text()).isEqualTo("hi");
        assertThat(limiters.forSource(PhotoSource.JETPHOTOS).inWindow()).isEqualTo(1);
        assertThat(limiters.forSource(PhotoSource.PLANESPOTTERS).inWindow()).isZero();
    }

    @Test
    void statusCodesMapToScrapeOutcomes() {
        assertThatThrownBy(() -> fetcher.get(PhotoSource.JETPHOTOS, base + "/missing"))
                .isInstanceOf(NoResultsException.class);
        assertThatThrownBy(() -> fetcher.get(PhotoSource.JETPHOTOS, base + "/blocked"))
                .isInstanceOf(SourceBlockedException.class);
        assertThatThrownBy(() -> fetcher.get(PhotoSource.JETPHOTOS, base + "/slow-down"))
                .isInstanceOf(SourceRateLimitedException.class);
        assertThatThrownBy(() -> fetcher.get(PhotoSource.JETPHOTOS, base + "/down"))
                .isInstanceOf(TransientScrapeException.class)
                .isNotInstanceOf(SourceRateLimitedException.class);
        assertThatThrownBy(() -> fetcher.get(PhotoSource.JETPHOTOS, base + "/teapot"))
                .isInstanceOf(StructuralParseException.class);
    }

    @Test
    void connectionFailureIsTransient() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        assertThatThrownBy(() -> fetcher.get(PhotoSource.AIRLINERS_NET, "http://127.0.0.1:" + closedPort + "/ok"))
                .isInstanceOf(TransientScrapeException.class)
                .hasFieldOrPropertyWithValue("source", "airlinersnet");
    }

    @Test
    void formIsUrlEncoded() {
        fetcher.postForm(PhotoSource.AIRPLANE_PICTURES, base + "/form", Map.of("apreg", "G-XLEA"));

        assertThat(lastBody.get()).isEqualTo("apreg=G-XLEA");
    }
}
