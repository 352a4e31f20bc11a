package com.kmg.batch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.batch.model.Outcome;
import com.kmg.batch.model.ParsedLine;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses one line of a provider result file. Every non-blank line yields exactly one of: an
 * outcome, an unmatched id, or an undecodable line.
 */
@Component
public class ResultLineParser {
    private static final Pattern CUSTOM_ID = Pattern.compile("row_(\\d+)");

    private final ObjectMapper objectMapper;

    public ResultLineParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses every line of a result file. Lines are decoded one at a time, so a line that is not
     * valid UTF-8 comes back as undecodable and the lines after it are still read.
     *
     * @return one entry per line, in file order
     */
    public List<ParsedLine> parseFile(Path file) throws IOException {
        List<ParsedLine> parsed = new ArrayList<>();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            ByteArrayOutputStream line = new ByteArrayOutputStream();
            int next;
            while ((next = in.read()) != -1) {
                if (next == '\n') {
                    parsed.add(parse(line.toByteArray()));
                    line.reset();
                } else {
                    line.write(next);
                }
            }
            if (line.size() > 0) {
                parsed.add(parse(line.toByteArray()));
            }
        }
        return parsed;
    }

    ParsedLine parse(byte[] line) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return parse(decoder.decode(ByteBuffer.wrap(line)).toString());
        } catch (CharacterCodingException e) {
            return ParsedLine.undecodable("invalid UTF-8");
        }
    }

    public ParsedLine parse(String line) {
        if (line == null || line.isBlank()) {
            return ParsedLine.blank();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return ParsedLine.undecodable(e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ParsedLine.undecodable("not a JSON object");
        }

        String customId = root.path("custom_id").asText("");
        Matcher matcher = CUSTOM_ID.matcher(customId);
        if (!matcher.matches()) {
            return ParsedLine.unmatched(customId);
        }
        int index;
        try {
            index = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return ParsedLine.unmatched(customId);
        }

        return ParsedLine.outcome(index, outcomeOf(root));
    }

    private Outcome outcomeOf(JsonNode root) {
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            return Outcome.error(describeError(error));
        }

        JsonNode response = root.get("response");
        if (response == null || response.isNull()) {
            return Outcome.error("no response");
        }

        JsonNode body = response.get("body");
        int statusCode = response.path("status_code").asInt(200);
        if (statusCode != 200) {
            JsonNode bodyError = body == null ? null : body.get("error");
            String detail = bodyError == null || bodyError.isNull() ? "" : ": " + describeError(bodyError);
            return Outcome.error("status " + statusCode + detail);
        }
        if (body == null || body.isNull()) {
            return Outcome.error("no body");
        }

        JsonNode choices = body.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            return Outcome.error("no choices");
        }

        JsonNode message = choices.get(0).get("message");
        if (message == null || message.isNull() || !message.isObject()) {
            return Outcome.error("no message");
        }

        String refusal = textOf(message.get("refusal"));
        if (!refusal.isBlank()) {
            return Outcome.refusal(refusal);
        }
        String content = textOf(message.get("content"));
        if (content.isBlank()) {
            return Outcome.error("empty content");
        }
        return Outcome.content(content);
    }

    private String describeError(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        String message = error.path("message").asText("");
        if (!message.isBlank()) {
            return message;
        }
        String code = error.path("code").asText("");
        return code.isBlank() ? error.toString() : code;
    }

    private String textOf(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText("");
    }
}
