package com.m2m.shared.token;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Getter;

@Getter
public class ProviderApiException extends RuntimeException {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int status;
    private final String code;
    private final String body;

    public ProviderApiException(int status, String code, String body) {
        super("Provider call failed: HTTP " + status + (code == null ? "" : " " + code));
        this.status = status;
        this.code = code;
        this.body = body;
    }

    /**
     * Builds the exception from a raw error response, taking the marker from the JSON
     * {@code summary}, {@code error} or {@code code} field, whichever comes first.
     */
    public static ProviderApiException decode(int status, String body) {
        if (body == null || body.isBlank()) {
            return new ProviderApiException(status, null, body);
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            return new ProviderApiException(status, firstText(node, "summary", "error", "code"), body);
        } catch (IOException ex) {
            return new ProviderApiException(status, null, body);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
