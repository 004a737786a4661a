package com.brewuv.data;

import com.brewuv.config.Config;
import com.brewuv.core.diagnostics.CauseCode;
import com.brewuv.core.diagnostics.Outcome;
import com.brewuv.data.http.HttpClientEx;
import com.brewuv.model.CloudCoverSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Hourly cloud fraction from a Dark Sky compatible forecast API (e.g. Pirate Weather).
 * Without an API key no request is made and every lookup is unavailable.
 */
public class CloudCoverClient {
    private static final Logger log = LogManager.getLogger(CloudCoverClient.class);
    private static final String OWNER = "cloud-service";

    private final HttpClientEx http;
    private final String apiKey;
    private final String urlTemplate;
    private final int timeoutSec;
    private final double maxStationDistanceKm;

    public CloudCoverClient(Config config) {
        this(config, new HttpClientEx());
    }

    public CloudCoverClient(Config config, HttpClientEx http) {
        this.http = http;
        this.apiKey = config.getString("cloud.api_key");
        this.urlTemplate = config.getString("cloud.url_template");
        this.timeoutSec = Math.max(3, config.getInt("cloud.request_timeout_sec", 20));
        this.maxStationDistanceKm = config.getDouble("cloud.max_station_distance_km", 30.0);
    }

    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    /**
     * @param longitude Brewer convention, positive west; the service expects positive east
     */
    public Outcome<CloudCoverSeries> fetch(LocalDate date, double latitude, double longitude) {
        if (!isConfigured()) {
            return Outcome.failure(CauseCode.NOT_CONFIGURED, OWNER, "cloud.api_key is not set");
        }
        String at = LocalDateTime.of(date, LocalTime.MIDNIGHT).toString();
        if (at.length() == 16) {
            at = at + ":00";
        }
        String url = String.format(urlTemplate, apiKey, latitude, -longitude, at);
        String body;
        try {
            body = http.getText(url, timeoutSec);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(CauseCode.INTERRUPTED, OWNER, "interrupted");
        } catch (IOException | RuntimeException e) {
            log.warn("cloud cover request failed for {} ({}, {}): {}", date, latitude, longitude, e.getMessage());
            return Outcome.failure(EubrewnetClient.classifyFailure(e), OWNER, redact(e.getMessage()));
        }
        try {
            return parse(date, new JSONObject(body));
        } catch (JSONException e) {
            return Outcome.failure(CauseCode.PARSE_ERROR, OWNER, "cloud payload: " + e.getMessage());
        }
    }

    Outcome<CloudCoverSeries> parse(LocalDate date, JSONObject payload) {
        JSONObject flags = payload.optJSONObject("flags");
        if (flags != null) {
            JSONArray sources = flags.optJSONArray("sources");
            if (sources != null && !sources.toList().contains("madis")) {
                log.warn("cloud cover for {} may be imprecise, data sources: {}", date, sources.join(" "));
            }
            double nearest = flags.optDouble("nearest-station", 0.0);
            if (nearest > maxStationDistanceKm) {
                log.warn("cloud cover for {} may be imprecise, nearest station is {} km away", date, nearest);
            }
        }

        JSONObject hourly = payload.optJSONObject("hourly");
        JSONArray data = hourly == null ? null : hourly.optJSONArray("data");
        if (data == null) {
            return Outcome.failure(CauseCode.NO_DATA, OWNER, "no hourly data for " + date);
        }
        List<double[]> points = new ArrayList<>();
        for (int i = 0; i < data.length(); i++) {
            JSONObject hour = data.optJSONObject(i);
            if (hour == null || !hour.has("cloudCover")) {
                log.warn("no cloud cover for hour {} of {}", i, date);
                continue;
            }
            points.add(new double[]{i * 60.0, hour.getDouble("cloudCover")});
        }
        if (points.isEmpty()) {
            return Outcome.failure(CauseCode.NO_DATA, OWNER, "no cloud cover values for " + date);
        }
        double[] times = new double[points.size()];
        double[] values = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            times[i] = points.get(i)[0];
            values[i] = points.get(i)[1];
        }
        return Outcome.success(new CloudCoverSeries(times, values), OWNER);
    }

    private String redact(String message) {
        if (message == null) {
            return "";
        }
        return apiKey.isEmpty() ? message : message.replace(apiKey, "***");
    }
}
