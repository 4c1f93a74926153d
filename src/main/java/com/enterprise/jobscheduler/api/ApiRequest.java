package com.enterprise.jobscheduler.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * An HTTP-style request, independent of any server library
 */
public class ApiRequest {

    private final String method;
    private final String path;
    private final Map<String, String> queryParameters;
    private final String body;

    public ApiRequest(String method, String path, Map<String, String> queryParameters, String body) {
        this.method = method != null ? method.toUpperCase(Locale.ROOT) : "";
        this.path = path != null ? path : "";
        this.queryParameters = queryParameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(queryParameters))
            : Collections.emptyMap();
        this.body = body;
    }

    public static ApiRequest get(String path) {
        return new ApiRequest("GET", path, null, null);
    }

    public static ApiRequest get(String path, Map<String, String> queryParameters) {
        return new ApiRequest("GET", path, queryParameters, null);
    }

    public static ApiRequest post(String path, String body) {
        return new ApiRequest("POST", path, null, body);
    }

    public static ApiRequest delete(String path) {
        return new ApiRequest("DELETE", path, null, null);
    }

    public String getMethod() { return method; }

    public String getPath() { return path; }

    public Map<String, String> getQueryParameters() { return queryParameters; }

    public String getQueryParameter(String name) {
        return queryParameters.get(name);
    }

    public String getBody() { return body; }

    @Override
    public String toString() {
        return method + " " + path + (queryParameters.isEmpty() ? "" : " " + queryParameters);
    }
}
