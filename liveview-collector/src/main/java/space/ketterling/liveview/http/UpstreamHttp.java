package space.ketterling.liveview.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.config.AppConfig;
import space.ketterling.liveview.metrics.UpstreamCallMetrics;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Shared GET transport for all upstream feeds.
 *
 * <p>
 * Every request carries the contact User-Agent and an explicit timeout. Each
 * outcome is recorded in {@link UpstreamCallMetrics} under the source name.
 * </p>
 */
public class UpstreamHttp {
    private static final Logger log = LoggerFactory.getLogger(UpstreamHttp.class);

    private final HttpClient http;
    private final String userAgent;
    private final Duration timeout;
    private final UpstreamCallMetrics metrics;

    /**
     * Creates a transport using the configured User-Agent and timeout.
     */
    public UpstreamHttp(AppConfig cfg, UpstreamCallMetrics metrics) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(cfg.httpTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
                cfg.userAgent(),
                Duration.ofSeconds(cfg.httpTimeoutSeconds()),
                metrics);
    }

    public UpstreamHttp(HttpClient http, String userAgent, Duration timeout, UpstreamCallMetrics metrics) {
        this.http = http;
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * Performs a GET and returns the body of a 2xx response.
     *
     * @throws UpstreamUnavailableException on non-2xx, I/O failure, timeout or
     *                                      interruption
     */
    public String get(String source, String url, String accept) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", accept)
                .GET()
                .build();

        long t0 = System.currentTimeMillis();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            metrics.record(source, false);
            throw new UpstreamUnavailableException(source, url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.record(source, false);
            throw new UpstreamUnavailableException(source, url, e);
        }

        long ms = System.currentTimeMillis() - t0;
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            metrics.record(source, false);
            log.debug("{} GET {} -> {} ({} ms)", source, url, resp.statusCode(), ms);
            throw new UpstreamUnavailableException(source, url, resp.statusCode());
        }
        metrics.record(source, true);
        log.debug("{} GET {} -> {} ({} ms)", source, url, resp.statusCode(), ms);
        return resp.body();
    }
}
