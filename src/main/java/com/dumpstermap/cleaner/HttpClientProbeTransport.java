package com.dumpstermap.cleaner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link WebsiteProbeTransport} backed by the JDK {@link HttpClient}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Sends a HEAD request with the configured User-Agent; no body is read.</li>
 *   <li>Redirects are followed, including https to http hops, so the final URL is reported.</li>
 *   <li>The probe timeout bounds both connection setup and the wait for response headers.</li>
 * </ul>
 * One client is shared by all probes of a validator; it holds no per-probe state.
 *
 * @author DumpsterMap Data Team
 * @since 1.0
 */
public class HttpClientProbeTransport implements WebsiteProbeTransport {
    private static final Logger logger = LoggerFactory.getLogger(HttpClientProbeTransport.class);

    private final HttpClient client;
    private final String userAgent;

    public HttpClientProbeTransport(Duration connectTimeout, String userAgent) {
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.ALWAYS)
            .connectTimeout(connectTimeout)
            .build();
        this.userAgent = userAgent == null || userAgent.isBlank() ? "DumpsterMapListingCleaner/1.0" : userAgent;
    }

    @Override
    public ProbeResponse probe(URI uri, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout)
            .header("User-Agent", userAgent)
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
        logger.debug("HEAD {} -> {} ({})", uri, response.statusCode(), response.uri());
        return new ProbeResponse(response.statusCode(), response.uri());
    }
}
