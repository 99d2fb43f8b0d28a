package com.flagship.media_ledger.stitch.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Job runner reached over HTTP.
 *
 * POST {base}/executions submits a spec and answers {"execution_id": ...};
 * GET {base}/executions/{id} answers {"status": "RUNNING|SUCCEEDED|FAILED"}.
 */
@Component
@Slf4j
public class HttpJobRunnerClient implements JobRunnerClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpJobRunnerClient(RestTemplateBuilder restTemplateBuilder,
                               @Value("${stitch-runner.base-url}") String baseUrl,
                               @Value("${stitch-runner.connect-timeout:2s}") Duration connectTimeout,
                               @Value("${stitch-runner.read-timeout:10s}") Duration readTimeout) {
        this.restTemplate = restTemplateBuilder
            .setConnectTimeout(connectTimeout)
            .setReadTimeout(readTimeout)
            .build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String submit(StitchJobSpec spec) {
        try {
            SubmitResponse response = restTemplate.postForObject(baseUrl + "/executions", spec, SubmitResponse.class);
            if (response == null || response.executionId == null || response.executionId.isBlank()) {
                throw new JobRunnerException("Runner returned no execution id for job " + spec.getJobId());
            }
            log.info("Runner accepted job {} as execution {}", spec.getJobId(), response.executionId);
            return response.executionId;
        } catch (RestClientException e) {
            throw new JobRunnerException("Runner rejected job " + spec.getJobId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public RunnerStatus getStatus(String executionId) {
        try {
            StatusResponse response = restTemplate.getForObject(
                baseUrl + "/executions/{id}", StatusResponse.class, executionId);
            if (response == null || response.status == null) {
                throw new JobRunnerException("Runner returned no status for execution " + executionId);
            }
            return RunnerStatus.valueOf(response.status.trim().toUpperCase());
        } catch (RestClientException e) {
            throw new JobRunnerException("Status lookup failed for execution " + executionId, e);
        } catch (IllegalArgumentException e) {
            throw new JobRunnerException("Unrecognized runner status for execution " + executionId, e);
        }
    }

    static class SubmitResponse {
        @JsonProperty("execution_id")
        public String executionId;
    }

    static class StatusResponse {
        @JsonProperty("status")
        public String status;
    }
}
