package com.dumpstermap.cleaner;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Network seam used by {@link WebsiteValidator} to check whether a website answers.
 * <p>
 * Implementations issue a lightweight existence check (HEAD semantics), follow redirects, and either return the
 * final status or throw. A timeout should surface as {@link java.net.http.HttpTimeoutException}.
 */
public interface WebsiteProbeTransport {

    /**
     * Response of a single probe.
     * @param statusCode final HTTP status after redirects
     * @param finalUri   URI that produced the final status
     */
    record ProbeResponse(int statusCode, URI finalUri) {}

    /**
     * Probes one URI.
     * @param uri     absolute http(s) URI
     * @param timeout budget for this probe only
     * @return final status and URI
     * @throws IOException          on connection failures and timeouts
     * @throws InterruptedException if the probing thread is interrupted
     */
    ProbeResponse probe(URI uri, Duration timeout) throws IOException, InterruptedException;
}
