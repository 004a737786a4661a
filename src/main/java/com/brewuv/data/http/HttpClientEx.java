package com.brewuv.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Thin wrapper over {@link HttpClient} for the read-only JSON services the pipeline calls.
 */
public class HttpClientEx {
    static final String USER_AGENT = "brewuv/1.0";

    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        return getText(url, timeoutSeconds, null);
    }

    /**
     * GET {@code url}, optionally with an {@code Authorization} header value.
     *
     * @throws RemoteServiceException on a non-2xx status
     */
    public String getText(String url, int timeoutSeconds, String authorization) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT);
        if (authorization != null && !authorization.isEmpty()) {
            builder.header("Authorization", authorization);
        }
        HttpResponse<String> resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        throw new RemoteServiceException(resp.statusCode(), url);
    }

    public static String basicAuth(String user, String password) {
        if (user == null || user.isEmpty()) {
            return null;
        }
        String token = user + ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }
}
