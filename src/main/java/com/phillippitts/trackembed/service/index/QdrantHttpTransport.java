package com.phillippitts.trackembed.service.index;

import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link VectorIndexTransport} speaking the Qdrant REST API over OkHttp.
 *
 * <p>Every instance owns its own connection pool, so discarding a handle after a connection
 * failure also discards its pooled sockets. Status codes map to
 * {@link TransportFailureException.Kind}: I/O errors to {@code CONNECTION}, 5xx to
 * {@code SERVICE_UNAVAILABLE}, other non-2xx to {@code REJECTED}, unparseable bodies to
 * {@code MALFORMED_RESPONSE}.
 */
public class QdrantHttpTransport implements VectorIndexTransport {

    private static final MediaType JSON = MediaType.parse("application/json");
    static final String API_KEY_HEADER = "api-key";

    private final OkHttpClient http;
    private final HttpUrl baseUrl;
    private final String apiKey;

    public QdrantHttpTransport(OkHttpClient baseClient, String baseUrl, String apiKey, Duration requestTimeout) {
        Objects.requireNonNull(baseClient, "baseClient");
        HttpUrl parsed = HttpUrl.parse(Objects.requireNonNull(baseUrl, "baseUrl"));
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid vector index URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.apiKey = apiKey;
        this.http = baseClient.newBuilder()
                .connectionPool(new ConnectionPool())
                .connectTimeout(requestTimeout)
                .readTimeout(requestTimeout)
                .writeTimeout(requestTimeout)
                .build();
    }

    @Override
    public void ping() {
        request("GET", List.of(), null, null);
    }

    @Override
    public List<String> listCollections() {
        JSONObject resp = request("GET", List.of("collections"), null, null);
        return read("list collections", () -> {
            JSONArray arr = resp.getJSONObject("result").getJSONArray("collections");
            List<String> names = new ArrayList<>(arr.length());
            for (int i = 0; i < arr.length(); i++) {
                names.add(arr.getJSONObject(i).getString("name"));
            }
            return names;
        });
    }

    @Override
    public void createCollection(String name, int dimension, DistanceMetric metric) {
        JSONObject vectors = new JSONObject()
                .put("size", dimension)
                .put("distance", metric.wireName());
        request("PUT", List.of("collections", name), null, new JSONObject().put("vectors", vectors));
    }

    @Override
    public void deleteCollection(String name) {
        request("DELETE", List.of("collections", name), null, null);
    }

    @Override
    public void upsert(String collection, List<IndexPoint> points) {
        JSONObject body = write("upsert", () -> {
            JSONArray arr = new JSONArray();
            for (IndexPoint p : points) {
                arr.put(new JSONObject()
                        .put("id", p.id())
                        .put("vector", toJson(p.vector()))
                        .put("payload", new JSONObject(p.payload())));
            }
            return new JSONObject().put("points", arr);
        });
        request("PUT", List.of("collections", collection, "points"), "wait", body);
    }

    @Override
    public List<ScoredPoint> search(String collection, float[] vector, int limit, double scoreThreshold) {
        JSONObject body = write("search", () -> new JSONObject()
                .put("vector", toJson(vector))
                .put("limit", limit)
                .put("score_threshold", scoreThreshold)
                .put("with_payload", true));
        JSONObject resp = request("POST", List.of("collections", collection, "points", "search"), null, body);
        return read("search", () -> {
            JSONArray hits = resp.getJSONArray("result");
            List<ScoredPoint> out = new ArrayList<>(hits.length());
            for (int i = 0; i < hits.length(); i++) {
                JSONObject hit = hits.getJSONObject(i);
                out.add(new ScoredPoint(String.valueOf(hit.get("id")), hit.getDouble("score"),
                        payload(hit.optJSONObject("payload"))));
            }
            return out;
        });
    }

    @Override
    public List<IndexPoint> retrieve(String collection, List<String> ids, boolean withVectors) {
        JSONObject body = new JSONObject()
                .put("ids", new JSONArray(ids))
                .put("with_vector", withVectors)
                .put("with_payload", true);
        JSONObject resp = request("POST", List.of("collections", collection, "points"), null, body);
        return read("retrieve", () -> {
            JSONArray points = resp.getJSONArray("result");
            List<IndexPoint> out = new ArrayList<>(points.length());
            for (int i = 0; i < points.length(); i++) {
                JSONObject p = points.getJSONObject(i);
                JSONArray vec = p.optJSONArray("vector");
                out.add(new IndexPoint(String.valueOf(p.get("id")), vec == null ? null : toFloats(vec),
                        payload(p.optJSONObject("payload"))));
            }
            return out;
        });
    }

    @Override
    public void delete(String collection, List<String> ids) {
        JSONObject body = new JSONObject().put("points", new JSONArray(ids));
        request("POST", List.of("collections", collection, "points", "delete"), "wait", body);
    }

    @Override
    public void close() {
        http.connectionPool().evictAll();
    }

    private JSONObject request(String method, List<String> segments, String flagParam, JSONObject body) {
        HttpUrl.Builder url = baseUrl.newBuilder();
        for (String segment : segments) {
            url.addPathSegment(segment);
        }
        if (flagParam != null) {
            url.addQueryParameter(flagParam, "true");
        }
        Request.Builder b = new Request.Builder().url(url.build());
        if (apiKey != null && !apiKey.isBlank()) {
            b.addHeader(API_KEY_HEADER, apiKey);
        }
        b.method(method, body == null ? null : RequestBody.create(body.toString(), JSON));

        String target = method + " /" + String.join("/", segments);
        try (Response resp = http.newCall(b.build()).execute()) {
            ResponseBody rb = resp.body();
            String text = rb != null ? rb.string() : "";
            if (resp.code() >= 500) {
                throw new TransportFailureException(TransportFailureException.Kind.SERVICE_UNAVAILABLE,
                        target + " returned " + resp.code());
            }
            if (!resp.isSuccessful()) {
                throw new TransportFailureException(TransportFailureException.Kind.REJECTED,
                        target + " returned " + resp.code() + ": " + abbreviate(text));
            }
            try {
                return text.isBlank() ? new JSONObject() : new JSONObject(text);
            } catch (JSONException e) {
                throw new TransportFailureException(TransportFailureException.Kind.MALFORMED_RESPONSE,
                        target + " returned an unparseable body", e);
            }
        } catch (IOException e) {
            throw new TransportFailureException(TransportFailureException.Kind.CONNECTION,
                    target + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a request body; a value JSON cannot carry (NaN, infinity) rejects the request
     * before it is sent.
     */
    private static JSONObject write(String what, Supplier<JSONObject> builder) {
        try {
            return builder.get();
        } catch (JSONException e) {
            throw new TransportFailureException(TransportFailureException.Kind.REJECTED,
                    "Cannot encode " + what + " request: " + e.getMessage(), e);
        }
    }

    /**
     * Runs {@code parser} over a parsed response; a missing or mistyped field is a malformed response.
     */
    private static <T> T read(String what, Supplier<T> parser) {
        try {
            return parser.get();
        } catch (JSONException e) {
            throw new TransportFailureException(TransportFailureException.Kind.MALFORMED_RESPONSE,
                    "Unexpected " + what + " response: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> payload(JSONObject obj) {
        Map<String, Object> out = new HashMap<>();
        if (obj == null) {
            return out;
        }
        for (String key : obj.keySet()) {
            if (!obj.isNull(key)) {
                Object v = obj.get(key);
                out.put(key, v instanceof JSONObject || v instanceof JSONArray ? v.toString() : v);
            }
        }
        return out;
    }

    static JSONArray toJson(float[] vector) {
        JSONArray arr = new JSONArray();
        for (float v : vector) {
            arr.put(v);
        }
        return arr;
    }

    private static float[] toFloats(JSONArray arr) {
        float[] out = new float[arr.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = arr.getFloat(i);
        }
        return out;
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
