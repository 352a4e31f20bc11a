package com.kmg.batch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.batch.model.BatchPoll;
import com.kmg.batch.model.BatchStatus;
import com.kmg.batch.model.RequestCounts;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link BatchGateway} over the OpenAI Files and Batches HTTP API.
 */
@Component
public class OpenAiBatchGateway implements BatchGateway {
    private final RestClient restClient;

    public OpenAiBatchGateway(@Qualifier("providerRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String upload(byte[] content, String fileName) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("purpose", "batch");
        parts.add("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return fileName;
            }
        });

        JsonNode response = call(GatewayFailure.UPLOAD, "File upload", () -> restClient.post()
                .uri("/files")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(parts)
                .retrieve()
                .body(JsonNode.class));
        return requireText(response, "id", GatewayFailure.UPLOAD, "File upload");
    }

    @Override
    public String submitBatch(String fileId, String endpoint, String completionWindow) {
        Map<String, String> request = Map.of(
                "input_file_id", fileId,
                "endpoint", endpoint,
                "completion_window", completionWindow
        );
        JsonNode response = call(GatewayFailure.SUBMIT, "Batch submission", () -> restClient.post()
                .uri("/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class));
        return requireText(response, "id", GatewayFailure.SUBMIT, "Batch submission");
    }

    @Override
    public BatchPoll pollBatch(String batchId) {
        JsonNode response = call(GatewayFailure.POLL, "Batch poll", () -> restClient.get()
                .uri("/batches/{id}", batchId)
                .retrieve()
                .body(JsonNode.class));
        if (response == null) {
            throw new GatewayException(GatewayFailure.POLL, "Batch poll returned no body for " + batchId);
        }

        JsonNode countsNode = response.path("request_counts");
        RequestCounts counts = new RequestCounts(
                countsNode.path("total").asInt(0),
                countsNode.path("completed").asInt(0),
                countsNode.path("failed").asInt(0)
        );

        List<String> errors = new ArrayList<>();
        for (JsonNode error : response.path("errors").path("data")) {
            String message = error.path("message").asText("");
            if (!message.isBlank()) {
                errors.add(message);
            }
        }

        return new BatchPoll(
                batchId,
                BatchStatus.fromWire(response.path("status").asText(null)),
                counts,
                textOrNull(response, "output_file_id"),
                textOrNull(response, "error_file_id"),
                errors
        );
    }

    @Override
    public byte[] fetch(String fileId) {
        byte[] content = call(GatewayFailure.DOWNLOAD, "File download", () -> restClient.get()
                .uri("/files/{id}/content", fileId)
                .retrieve()
                .body(byte[].class));
        return content == null ? new byte[0] : content;
    }

    private <T> T call(GatewayFailure failure, String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw new GatewayException(failure,
                    action + " failed (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new GatewayException(failure, action + " failed: connection error: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new GatewayException(failure, action + " failed: " + e.getMessage(), e);
        }
    }

    private String requireText(JsonNode response, String field, GatewayFailure failure, String action) {
        String value = response == null ? null : textOrNull(response, field);
        if (value == null) {
            throw new GatewayException(failure, action + " response has no " + field);
        }
        return value;
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
