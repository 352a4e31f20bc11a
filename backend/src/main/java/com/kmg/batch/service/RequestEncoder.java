package com.kmg.batch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kmg.batch.config.BatchProperties;
import com.kmg.batch.model.EncodedBatch;
import com.kmg.batch.model.EncodedRequest;
import com.kmg.batch.model.RecordTable;
import com.kmg.batch.model.SkippedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns records into provider request lines. A record whose image is missing, unreadable or too
 * large is skipped, never failed.
 */
@Service
public class RequestEncoder {
    private static final Logger log = LoggerFactory.getLogger(RequestEncoder.class);
    private static final Map<String, String> MIME_TYPES = Map.of(
            "png", "image/png",
            "webp", "image/webp",
            "gif", "image/gif"
    );

    private final BatchProperties properties;
    private final ObjectMapper objectMapper;

    public RequestEncoder(BatchProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public EncodedBatch encode(RecordTable table, Collection<Integer> indices) {
        BatchProperties.Encoder encoder = properties.getEncoder();
        if (table.columnIndex(encoder.getImageColumn()) < 0 || table.columnIndex(encoder.getPromptColumn()) < 0) {
            throw new RecordTableException("Record table lacks required columns: "
                    + encoder.getImageColumn() + ", " + encoder.getPromptColumn());
        }

        List<EncodedRequest> requests = new ArrayList<>();
        List<SkippedRecord> skipped = new ArrayList<>();
        for (int index : indices) {
            if (index < 0 || index >= table.size()) {
                skipped.add(new SkippedRecord(index, "row outside record table"));
                continue;
            }
            String imagePath = table.value(index, encoder.getImageColumn());
            String prompt = table.value(index, encoder.getPromptColumn());
            Optional<String> problem = encodeOne(index, imagePath, prompt, requests);
            problem.ifPresent(reason -> {
                log.warn("Skipping row {} ({}): {}", index + 1, imagePath, reason);
                skipped.add(new SkippedRecord(index, reason));
            });
        }

        log.info("Encoded {} requests, skipped {}", requests.size(), skipped.size());
        return new EncodedBatch(requests, skipped);
    }

    /**
     * JSONL bytes of the encoded requests, one request per line.
     */
    public byte[] toJsonl(EncodedBatch batch) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            for (EncodedRequest request : batch.requests()) {
                out.write(objectMapper.writeValueAsBytes(request.payload()));
                out.write('\n');
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize batch requests", e);
        }
        return out.toByteArray();
    }

    public void writeSkipped(List<SkippedRecord> skipped, Path file) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("skipped_rows: " + skipped.size());
        for (SkippedRecord record : skipped) {
            lines.add((record.index() + 1) + "\t" + record.reason());
        }
        Files.write(file, lines, StandardCharsets.UTF_8);
    }

    private Optional<String> encodeOne(int index, String imagePath, String prompt, List<EncodedRequest> requests) {
        BatchProperties.Encoder encoder = properties.getEncoder();
        if (imagePath == null || imagePath.isBlank()) {
            return Optional.of("no image path");
        }

        Path image = Path.of(imagePath);
        byte[] bytes;
        try {
            if (!Files.isRegularFile(image)) {
                return Optional.of("file does not exist");
            }
            long size = Files.size(image);
            if (size > encoder.getMaxImageBytes()) {
                return Optional.of(String.format(Locale.ROOT, "file too large: %.1fMB", size / 1024.0 / 1024.0));
            }
            bytes = Files.readAllBytes(image);
        } catch (IOException e) {
            return Optional.of("read error: " + e.getMessage());
        }

        String base64 = Base64.getEncoder().encodeToString(bytes);
        if (base64.length() > encoder.getMaxEncodedBytes()) {
            return Optional.of(String.format(Locale.ROOT, "encoded too large: %.1fMB", base64.length() / 1024.0 / 1024.0));
        }

        String text = prompt == null ? "" : prompt;
        if (text.length() > encoder.getMaxPromptChars()) {
            log.warn("Truncating prompt of row {} from {} chars", index + 1, text.length());
            text = text.substring(0, encoder.getMaxPromptChars()) + "...";
        }

        String customId = EncodedRequest.customIdFor(index);
        requests.add(new EncodedRequest(index, customId, buildPayload(customId, text, mimeType(image), base64)));
        return Optional.empty();
    }

    private ObjectNode buildPayload(String customId, String prompt, String mimeType, String base64) {
        BatchProperties.Encoder encoder = properties.getEncoder();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("custom_id", customId);
        root.put("method", "POST");
        root.put("url", properties.getProvider().getEndpoint());

        ObjectNode body = root.putObject("body");
        body.put("model", encoder.getModel());
        ArrayNode messages = body.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        content.addObject()
                .put("type", "text")
                .put("text", prompt);
        content.addObject()
                .put("type", "image_url")
                .putObject("image_url")
                .put("url", "data:" + mimeType + ";base64," + base64);
        body.put("max_tokens", encoder.getMaxTokens());
        body.put("temperature", encoder.getTemperature());
        return root;
    }

    private String mimeType(Path image) {
        String name = image.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return "image/jpeg";
        }
        return MIME_TYPES.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), "image/jpeg");
    }
}
