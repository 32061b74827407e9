package com.flightphotos.scraper.source;

import com.flightphotos.scraper.config.FlightPhotoProperties;
import com.flightphotos.scraper.model.PhotoSource;
import com.flightphotos.scraper.ratelimit.SourceRateLimiters;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fetches HTML pages from the photo sites.
 *
 * Every request takes a slot from the site's rate limiter first, so adapters that
 * page through results or open detail pages stay within the per-site budget.
 * HTTP outcomes are translated into the scrape exception taxonomy here, once,
 * instead of in each adapter.
 */
@Component
@Slf4j
public class HtmlPageFetcher {

    private final SourceRateLimiters rateLimiters;
    private final FlightPhotoProperties properties;
    private final HttpClient httpClient;

    public HtmlPageFetcher(SourceRateLimiters rateLimiters, FlightPhotoProperties properties) {
        this.rateLimiters = rateLimiters;
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getHttp().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public Document get(PhotoSource source, String url) {
        HttpRequest request = baseRequest(url).GET().build();
        return execute(source, request, url);
    }

    public Document postForm(PhotoSource source, String url, Map<String, String> form) {
        String body = form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));

        HttpRequest request = baseRequest(url)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return execute(source, request, url);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private HttpRequest.Builder baseRequest(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(properties.getHttp().getRequestTimeout())
                .header("User-Agent", properties.getHttp().getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9");
    }

    private Document execute(PhotoSource source, HttpRequest request, String url) {
        String key = source.key();
        try {
            rateLimiters.forSource(source).acquire();

            log.debug("{} {} {}", key, request.method(), url);
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();

            if (status == 200) {
                return Jsoup.parse(response.body(), url);
            }
            if (status == 404) {
                throw new NoResultsException(key, url);
            }
            if (status == 403) {
                throw new SourceBlockedException(key, source.domain() + " blocked the request (403)");
            }
            if (status == 429) {
                log.warn("Rate limited (429) by {}", source.domain());
                throw new SourceRateLimitedException(key, source.domain() + " returned 429");
            }
            if (status >= 500) {
                throw new TransientScrapeException(key, source.domain() + " returned HTTP " + status);
            }
            throw new StructuralParseException(key, source.domain() + " returned unexpected HTTP " + status + " for " + url);

        } catch (HttpTimeoutException e) {
            throw new TransientScrapeException(key, "Timed out fetching " + url, e);
        } catch (IOException e) {
            throw new TransientScrapeException(key, "I/O error fetching " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeInterruptedException(key, e);
        }
    }

    private static String encode(String val) {
        return URLEncoder.encode(val, StandardCharsets.UTF_8);
    }
}
