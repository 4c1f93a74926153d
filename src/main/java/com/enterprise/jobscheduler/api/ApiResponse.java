package com.enterprise.jobscheduler.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status code, headers and JSON body of a handled request
 */
public class ApiResponse {

    private final int statusCode;
    private final Map<String, String> headers;
    private final String body;

    public ApiResponse(int statusCode, Map<String, String> headers, String body) {
        this.statusCode = statusCode;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
    }

    public int getStatusCode() { return statusCode; }

    public Map<String, String> getHeaders() { return headers; }

    public String getBody() { return body; }

    @Override
    public String toString() {
        return "ApiResponse{statusCode=" + statusCode + ", body=" + body + '}';
    }
}
