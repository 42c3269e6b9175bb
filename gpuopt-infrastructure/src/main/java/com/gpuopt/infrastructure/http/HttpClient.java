package com.gpuopt.infrastructure.http;

import okhttp3.FormBody;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Simple wrapper around OkHttp for GET/POST requests.
 * Every call is bounded by the configured timeout; non-2xx answers raise {@link IOException}.
 */
public class HttpClient {

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;

    public HttpClient(Duration timeout) {
        this.client = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    public String get(String url, Headers headers) throws IOException {
        Request req = new Request.Builder()
                .url(url)
                .headers(headers)
                .get()
                .build();
        return execute(req);
    }

    public String post(String url, RequestBody body, Headers headers) throws IOException {
        Request req = new Request.Builder()
                .url(url)
                .headers(headers)
                .post(body)
                .build();
        return execute(req);
    }

    public String postJson(String url, String json, Headers headers) throws IOException {
        return post(url, RequestBody.create(json, JSON), headers);
    }

    public String postForm(String url, Map<String, String> fields, Headers headers) throws IOException {
        FormBody.Builder form = new FormBody.Builder();
        fields.forEach(form::add);
        return post(url, form.build(), headers);
    }

    private String execute(Request req) throws IOException {
        try (Response resp = client.newCall(req).execute()) {
            String body = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                throw new IOException("HTTP " + resp.code() + " => " + body);
            }
            return body;
        }
    }
}
