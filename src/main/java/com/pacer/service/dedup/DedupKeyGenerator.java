package com.pacer.service.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacer.model.RequestDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives a fixed-length key identifying logically identical requests.
 *
 * Key material:
 * 1. Upper-cased method
 * 2. Normalized URL
 * 3. Headers, lower-cased and sorted, without volatile ones
 * 4. Body serialized with recursively sorted keys
 *
 * The material is joined with {@code |} and hashed with SHA-256.
 */
@Slf4j
@Component
public class DedupKeyGenerator {

    private static final Set<String> VOLATILE_HEADERS = Set.of("authorization", "user-agent", "x-request-id");

    private final ObjectMapper objectMapper;

    public DedupKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Generate the dedup key for a request.
     *
     * @return SHA-256 hash (64 hex chars)
     */
    public String generate(RequestDescriptor request) {
        List<String> parts = new ArrayList<>();
        parts.add(request.normalizedMethod());
        parts.add(normalizeUrl(request.getUrl()));

        String headers = canonicalHeaders(request.getHeaders());
        if (!headers.isEmpty()) {
            parts.add(headers);
        }

        if (request.getBody() != null) {
            parts.add(canonicalBody(request.getBody()));
        }

        return DigestUtils.sha256Hex(String.join("|", parts));
    }

    String normalizeUrl(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        try {
            URI uri = URI.create(trimmed).normalize();
            String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
            String host = uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
            if (scheme == null || host == null) {
                return uri.toString();
            }
            return new URI(scheme, uri.getUserInfo(), host, uri.getPort(),
                    uri.getPath(), uri.getQuery(), uri.getFragment()).toString();
        } catch (Exception e) {
            log.debug("URL not normalizable, using as-is: {}", trimmed);
            return trimmed;
        }
    }

    /**
     * Headers keyed by lower-cased name. Names that differ only in case are
     * merged: their values are sorted and joined with a comma.
     */
    String canonicalHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return "";
        }

        TreeMap<String, List<String>> grouped = new TreeMap<>();
        headers.forEach((name, value) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!VOLATILE_HEADERS.contains(lower)) {
                grouped.computeIfAbsent(lower, k -> new ArrayList<>()).add(value == null ? "" : value);
            }
        });

        if (grouped.isEmpty()) {
            return "";
        }

        TreeMap<String, String> relevant = new TreeMap<>();
        grouped.forEach((name, values) -> {
            Collections.sort(values);
            relevant.put(name, String.join(",", values));
        });

        try {
            return objectMapper.writeValueAsString(relevant);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize headers", e);
        }
    }

    String canonicalBody(Object body) {
        try {
            JsonNode node = objectMapper.valueToTree(body);
            StringBuilder sb = new StringBuilder();
            serializeNode(node, sb);
            return sb.toString();
        } catch (IllegalArgumentException e) {
            log.debug("Body not convertible to JSON, using toString: {}", e.getMessage());
            return String.valueOf(body);
        }
    }

    private void serializeNode(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            sb.append("null");
        } else if (node.isObject()) {
            sb.append("{");
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            boolean first = true;
            for (String fieldName : fieldNames) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                sb.append("\"").append(escapeJson(fieldName)).append("\":");
                serializeNode(node.get(fieldName), sb);
            }
            sb.append("}");
        } else if (node.isArray()) {
            sb.append("[");
            boolean first = true;
            for (JsonNode element : node) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                serializeNode(element, sb);
            }
            sb.append("]");
        } else if (node.isTextual()) {
            sb.append("\"").append(escapeJson(node.asText())).append("\"");
        } else {
            sb.append(node.asText());
        }
    }

    private String escapeJson(String text) {
        return text
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
