package com.brewuv.data;

import com.brewuv.config.Config;
import com.brewuv.core.diagnostics.CauseCode;
import com.brewuv.core.diagnostics.Outcome;
import com.brewuv.data.http.HttpClientEx;
import com.brewuv.data.http.RemoteServiceException;
import com.brewuv.model.CalibrationRecord;
import com.brewuv.model.MeasurementSection;
import com.brewuv.model.OzoneRecord;
import com.brewuv.model.Position;
import com.brewuv.model.RawSample;
import com.brewuv.model.SectionHeader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only client for the EUBREWNET instrument network.
 * <p>
 * Every call returns an {@link Outcome}; network, status and payload problems are reported as failures, never thrown.
 */
public class EubrewnetClient {
    private static final Logger log = LogManager.getLogger(EubrewnetClient.class);
    private static final String OWNER = "eubrewnet";
    private static final DateTimeFormatter OZONE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final HttpClientEx http;
    private final String baseUrl;
    private final String authorization;
    private final int timeoutSec;
    private final int retryCount;
    private final long retrySleepMs;

    public EubrewnetClient(Config config) {
        this(config, new HttpClientEx());
    }

    public EubrewnetClient(Config config, HttpClientEx http) {
        this.http = http;
        this.baseUrl = trimSlash(config.getString("eubrewnet.base_url", "http://rbcce.aemet.es/eubrewnet"));
        this.authorization = HttpClientEx.basicAuth(config.getString("eubrewnet.user"), config.getString("eubrewnet.pass"));
        this.timeoutSec = Math.max(3, config.getInt("eubrewnet.request_timeout_sec", 30));
        this.retryCount = Math.max(0, config.getInt("eubrewnet.retry_count", 2));
        this.retrySleepMs = Math.max(0L, config.getLong("eubrewnet.retry_sleep_ms", 500L));
    }

    public Outcome<OzoneRecord> fetchOzone(String brewerId, LocalDate date) {
        String url = baseUrl + "/data/get/O3L1_5?brewerid=" + encode(brewerId) + "&date=" + date;
        Outcome<JSONArray> response = getJsonArray(url);
        if (!response.success) {
            return Outcome.failure(response.causeCode, OWNER, response.message());
        }
        try {
            JSONArray data = response.value;
            List<Double> times = new ArrayList<>();
            List<Double> values = new ArrayList<>();
            // first row holds the column names
            for (int i = 1; i < data.length(); i++) {
                JSONArray row = data.getJSONArray(i);
                String stamp = row.getString(1);
                LocalDateTime at = LocalDateTime.parse(stamp.substring(0, stamp.length() - 1), OZONE_TIMESTAMP);
                times.add(at.getHour() * 60 + at.getMinute() + at.getSecond() / 60.0);
                values.add(row.getDouble(9));
            }
            if (values.isEmpty()) {
                return Outcome.failure(CauseCode.NO_DATA, OWNER, "no ozone for " + brewerId + " on " + date);
            }
            return Outcome.success(new OzoneRecord(toArray(times), toArray(values), null), OWNER);
        } catch (JSONException | DateTimeParseException | StringIndexOutOfBoundsException e) {
            return Outcome.failure(CauseCode.PARSE_ERROR, OWNER, "ozone payload: " + e.getMessage());
        }
    }

    public Outcome<CalibrationRecord> fetchCalibration(String brewerId, LocalDate date) {
        String url = baseUrl + "/getdataold/getUVR?brewerid=" + encode(brewerId) + "&date=" + date;
        Outcome<JSONArray> response = getJsonArray(url);
        if (!response.success) {
            return Outcome.failure(response.causeCode, OWNER, response.message());
        }
        try {
            JSONArray wavelengths = response.value.getJSONArray(1);
            JSONArray values = response.value.getJSONArray(2);
            if (wavelengths.length() == 0 || wavelengths.length() != values.length()) {
                return Outcome.failure(CauseCode.NO_DATA, OWNER, "no calibration for " + brewerId + " on " + date);
            }
            double[] w = new double[wavelengths.length()];
            double[] v = new double[values.length()];
            for (int i = 0; i < w.length; i++) {
                w[i] = wavelengths.getDouble(i) / 10.0;
                v[i] = values.getDouble(i);
            }
            return Outcome.success(new CalibrationRecord(w, v), OWNER);
        } catch (JSONException | IllegalArgumentException e) {
            return Outcome.failure(CauseCode.PARSE_ERROR, OWNER, "calibration payload: " + e.getMessage());
        }
    }

    /**
     * UV scans of one day, all scan types. Duplicate wavelengths within a scan are averaged.
     */
    public Outcome<List<MeasurementSection>> fetchSections(String brewerId, LocalDate date) {
        String typesUrl = baseUrl + "/getdataold/getUVAvailableScanTypes?brewerid=" + encode(brewerId) + "&date=" + date;
        Outcome<JSONArray> types = getJsonArray(typesUrl);
        if (!types.success) {
            return Outcome.failure(types.causeCode, OWNER, types.message());
        }
        List<MeasurementSection> sections = new ArrayList<>();
        try {
            for (int t = 0; t < types.value.length(); t++) {
                String scanType = types.value.getString(t);
                String url = baseUrl + "/getdataold/getUV?scantype=" + encode(scanType)
                        + "&brewerid=" + encode(brewerId) + "&date=" + date;
                Outcome<JSONArray> scans = getJsonArray(url);
                if (!scans.success) {
                    return Outcome.failure(scans.causeCode, OWNER, scans.message());
                }
                JSONArray data = scans.value;
                for (int i = 0; i + 4 < data.length(); i += 5) {
                    sections.add(toSection(scanType, data, i));
                }
            }
        } catch (JSONException | DateTimeParseException e) {
            return Outcome.failure(CauseCode.PARSE_ERROR, OWNER, "uv payload: " + e.getMessage());
        }
        if (sections.isEmpty()) {
            return Outcome.failure(CauseCode.NO_DATA, OWNER, "no uv scans for " + brewerId + " on " + date);
        }
        return Outcome.success(sections, OWNER);
    }

    private static MeasurementSection toSection(String scanType, JSONArray data, int offset) {
        JSONArray header = data.getJSONArray(offset);
        JSONArray times = data.getJSONArray(offset + 1);
        JSONArray wavelengths = data.getJSONArray(offset + 2);
        JSONArray steps = data.getJSONArray(offset + 3);
        JSONArray counts = data.getJSONArray(offset + 4);

        SectionHeader sectionHeader = SectionHeader.builder()
                .scanType(scanType)
                .integrationTime(header.getDouble(2))
                .deadTime(header.getDouble(3))
                .cycles(header.getInt(4))
                .date(LocalDate.parse(header.getString(5)))
                .place(header.optString(6, ""))
                .position(new Position(header.getDouble(7), header.getDouble(8)))
                .temperature(header.getDouble(9))
                .pressure(header.getDouble(10))
                .darkCount(header.getDouble(11))
                .build();

        // wavelength -> {sum time, sum step, sum events, count}
        Map<Double, double[]> grouped = new TreeMap<>();
        for (int i = 0; i < times.length(); i++) {
            double wavelength = wavelengths.getDouble(i) / 10.0;
            double[] acc = grouped.computeIfAbsent(wavelength, k -> new double[4]);
            acc[0] += times.getDouble(i);
            acc[1] += steps.getDouble(i);
            acc[2] += counts.getDouble(i);
            acc[3] += 1;
        }
        List<RawSample> samples = new ArrayList<>(grouped.size());
        for (Map.Entry<Double, double[]> entry : grouped.entrySet()) {
            double[] acc = entry.getValue();
            samples.add(new RawSample(acc[0] / acc[3], entry.getKey(), (int) Math.round(acc[1] / acc[3]), acc[2] / acc[3]));
        }
        return new MeasurementSection(sectionHeader, samples);
    }

    private Outcome<JSONArray> getJsonArray(String url) {
        String lastError = "";
        CauseCode lastCause = CauseCode.RUNTIME_ERROR;
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            try {
                log.info("requesting {}", url);
                String body = http.getText(url, timeoutSec, authorization);
                return Outcome.success(new JSONArray(body), OWNER);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Outcome.failure(CauseCode.INTERRUPTED, OWNER, "interrupted while requesting " + url);
            } catch (JSONException e) {
                return Outcome.failure(CauseCode.PARSE_ERROR, OWNER, "invalid json from " + url + ": " + e.getMessage());
            } catch (IOException | RuntimeException e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                lastCause = classifyFailure(e);
                log.warn("eubrewnet request failed attempt={} url={} err={}", attempt + 1, url, lastError);
                if (attempt >= retryCount || !isRetryable(e)) {
                    break;
                }
                try {
                    Thread.sleep(retrySleepMs * (attempt + 1));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return Outcome.failure(CauseCode.INTERRUPTED, OWNER, "interrupted while retrying " + url);
                }
            }
        }
        return Outcome.failure(lastCause, OWNER, lastError);
    }

    static CauseCode classifyFailure(Exception e) {
        if (e instanceof HttpTimeoutException) {
            return CauseCode.TIMEOUT;
        }
        if (e instanceof RemoteServiceException) {
            return ((RemoteServiceException) e).getStatusCode() == 429 ? CauseCode.RATE_LIMITED : CauseCode.HTTP_ERROR;
        }
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return CauseCode.TIMEOUT;
        }
        return CauseCode.HTTP_ERROR;
    }

    private static boolean isRetryable(Exception e) {
        if (e instanceof RemoteServiceException) {
            return ((RemoteServiceException) e).isRetryable();
        }
        return e instanceof IOException;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static double[] toArray(List<Double> in) {
        double[] out = new double[in.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = in.get(i);
        }
        return out;
    }
}
