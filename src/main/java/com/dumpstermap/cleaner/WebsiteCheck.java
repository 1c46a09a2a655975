package com.dumpstermap.cleaner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of probing one listing's website.
 * <p>
 * {@code status} is the HTTP status code as text ({@code "200"}, {@code "404"}) or a symbolic status:
 * {@code timeout}, {@code no_url}, or the simple class name of the failure ({@code ConnectException}).
 *
 * @param url       the URL actually probed (scheme added where missing)
 * @param status    status code or symbolic status
 * @param reachable true when a response with status below 400 arrived
 * @param finalUrl  URL after redirects, only present when a response arrived
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"url", "status", "reachable", "final_url"})
public record WebsiteCheck(
    @JsonProperty("url") String url,
    @JsonProperty("status") String status,
    @JsonProperty("reachable") boolean reachable,
    @JsonProperty("final_url") String finalUrl
) {
    public static final String TIMEOUT = "timeout";
    public static final String NO_URL = "no_url";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static WebsiteCheck ofStatus(String url, int statusCode, String finalUrl) {
        return new WebsiteCheck(url, Integer.toString(statusCode), statusCode < 400, finalUrl);
    }

    public static WebsiteCheck timeout(String url) {
        return new WebsiteCheck(url, TIMEOUT, false, null);
    }

    public static WebsiteCheck noUrl(String url) {
        return new WebsiteCheck(url, NO_URL, false, null);
    }

    public static WebsiteCheck error(String url, Throwable error) {
        return new WebsiteCheck(url, error.getClass().getSimpleName(), false, null);
    }

    /**
     * Verdict label used in statistics: {@code reachable} or {@code unreachable:<status>}.
     */
    @JsonIgnore
    public String verdict() {
        return reachable ? "reachable" : "unreachable:" + status;
    }

    /**
     * Output mapping with the JSON property names; {@code final_url} is omitted when absent.
     */
    Map<String, Object> toMap() {
        return MAPPER.convertValue(this, MAP_TYPE);
    }
}
