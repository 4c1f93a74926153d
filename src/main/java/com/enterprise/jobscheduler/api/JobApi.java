package com.enterprise.jobscheduler.api;

import com.enterprise.jobscheduler.core.Job;
import com.enterprise.jobscheduler.exception.JobNotFoundException;
import com.enterprise.jobscheduler.exception.JobValidationException;
import com.enterprise.jobscheduler.exception.SchedulingException;
import com.enterprise.jobscheduler.service.JobDetails;
import com.enterprise.jobscheduler.service.JobRequest;
import com.enterprise.jobscheduler.service.JobService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JSON request handling for the job HTTP surface.
 *
 * <pre>
 * POST   /jobs        create a job
 * GET    /jobs        list jobs       ?type&amp;status&amp;limit
 * GET    /jobs/{id}   job details     ?invocationLimit&amp;invocationStatus
 * DELETE /jobs/{id}   delete a job
 * OPTIONS *           CORS preflight
 * </pre>
 *
 * Every response carries the CORS headers.
 */
public class JobApi {

    private static final Logger logger = LoggerFactory.getLogger(JobApi.class);

    private static final String JOBS_PATH = "/jobs";

    static final Map<String, String> HEADERS;

    static {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Access-Control-Allow-Origin", "*");
        headers.put("Access-Control-Allow-Headers", "Content-Type,X-Amz-Date,Authorization,X-Api-Key");
        headers.put("Access-Control-Allow-Methods", "GET,POST,DELETE,OPTIONS");
        HEADERS = Collections.unmodifiableMap(headers);
    }

    private final JobService jobService;
    private final ObjectMapper objectMapper;

    public JobApi(JobService jobService) {
        this.jobService = jobService;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Handle one request. Never throws; failures become error responses.
     */
    public ApiResponse handle(ApiRequest request) {
        logger.debug("Handling {}", request);

        if ("OPTIONS".equals(request.getMethod())) {
            return new ApiResponse(200, HEADERS, "");
        }

        String path = normalize(request.getPath());
        if (JOBS_PATH.equals(path)) {
            switch (request.getMethod()) {
                case "POST":
                    return createJob(request);
                case "GET":
                    return listJobs(request);
                default:
                    return notFound("Route not found");
            }
        }

        if (path.startsWith(JOBS_PATH + "/") && path.indexOf('/', JOBS_PATH.length() + 1) < 0) {
            String jobId = path.substring(JOBS_PATH.length() + 1);
            switch (request.getMethod()) {
                case "GET":
                    return getJob(jobId, request);
                case "DELETE":
                    return deleteJob(jobId);
                default:
                    return notFound("Route not found");
            }
        }

        return notFound("Route not found");
    }

    private ApiResponse createJob(ApiRequest request) {
        if (request.getBody() == null || request.getBody().trim().isEmpty()) {
            return error(400, "Request body is required", null);
        }

        JobRequest jobRequest;
        try {
            jobRequest = objectMapper.readValue(request.getBody(), JobRequest.class);
        } catch (JsonProcessingException e) {
            logger.warn("Rejected malformed job request: {}", e.getOriginalMessage());
            return error(400, "Invalid JSON body", e.getOriginalMessage());
        }

        try {
            Job job = jobService.createJob(jobRequest);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "Job created successfully");
            body.put("job", job);
            return respond(201, body);

        } catch (JobValidationException e) {
            return error(400, e.getMessage(), null);
        } catch (SchedulingException | RuntimeException e) {
            logger.error("Error creating job", e);
            return error(500, "Failed to create job", e.getMessage());
        }
    }

    private ApiResponse listJobs(ApiRequest request) {
        Integer limit;
        try {
            limit = positiveInt(request.getQueryParameter("limit"), "limit");
        } catch (JobValidationException e) {
            return error(400, e.getMessage(), null);
        }

        try {
            List<Job> jobs = jobService.listJobs(request.getQueryParameter("type"),
                                                 request.getQueryParameter("status"), limit);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("count", jobs.size());
            body.put("jobs", jobs);
            return respond(200, body);

        } catch (RuntimeException e) {
            logger.error("Error fetching jobs", e);
            return error(500, "Failed to fetch jobs", e.getMessage());
        }
    }

    private ApiResponse getJob(String rawJobId, ApiRequest request) {
        Optional<UUID> jobId = parseId(rawJobId);
        if (jobId.isEmpty()) {
            return notFound("Job not found");
        }

        Integer invocationLimit;
        try {
            invocationLimit = positiveInt(request.getQueryParameter("invocationLimit"), "invocationLimit");
        } catch (JobValidationException e) {
            return error(400, e.getMessage(), null);
        }

        try {
            JobDetails details = jobService.getJobDetails(jobId.get(), invocationLimit,
                                                          request.getQueryParameter("invocationStatus"));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("job", details.getJob());
            body.put("invocations", details.getInvocations());
            body.put("statistics", details.getStatistics());
            return respond(200, body);

        } catch (JobNotFoundException e) {
            return notFound("Job not found");
        } catch (RuntimeException e) {
            logger.error("Error fetching job {}", rawJobId, e);
            return error(500, "Failed to fetch job", e.getMessage());
        }
    }

    private ApiResponse deleteJob(String rawJobId) {
        Optional<UUID> jobId = parseId(rawJobId);
        if (jobId.isEmpty()) {
            return notFound("Job not found");
        }

        try {
            Job deleted = jobService.deleteJob(jobId.get());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "Job deleted successfully");
            body.put("jobId", deleted.getId());
            body.put("jobName", deleted.getName());
            return respond(200, body);

        } catch (JobNotFoundException e) {
            return notFound("Job not found");
        } catch (RuntimeException e) {
            logger.error("Error deleting job {}", rawJobId, e);
            return error(500, "Failed to delete job", e.getMessage());
        }
    }

    private static String normalize(String path) {
        String normalized = path;
        int query = normalized.indexOf('?');
        if (query >= 0) {
            normalized = normalized.substring(0, query);
        }
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static Optional<UUID> parseId(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            logger.debug("Malformed job ID '{}'", value);
            return Optional.empty();
        }
    }

    private static Integer positiveInt(String value, String field) throws JobValidationException {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            logger.debug("Malformed {} '{}'", field, value);
        }
        throw new JobValidationException(field, field + " must be a positive integer");
    }

    private ApiResponse notFound(String message) {
        return error(404, message, null);
    }

    private ApiResponse error(int statusCode, String message, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (details != null) {
            body.put("details", details);
        }
        return respond(statusCode, body);
    }

    private ApiResponse respond(int statusCode, Object body) {
        try {
            return new ApiResponse(statusCode, HEADERS, objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize response body", e);
            return new ApiResponse(500, HEADERS, "{\"error\":\"Failed to serialize response\"}");
        }
    }
}
