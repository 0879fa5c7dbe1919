package com.pacer.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacer.model.RequestDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;
import java.util.Set;

/**
 * Default {@link RequestExecutor} backed by Spring WebClient.
 *
 * POST, PUT and PATCH send the body as JSON. Other methods send it as query
 * parameters. Any non-2xx status becomes a {@code WebClientResponseException}.
 */
@Slf4j
@Component
public class WebClientRequestExecutor implements RequestExecutor {

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final ObjectMapper objectMapper;

    public WebClientRequestExecutor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<JsonNode> execute(WebClient client, RequestDescriptor request) {
        return Mono.defer(() -> send(client, request));
    }

    private Mono<JsonNode> send(WebClient client, RequestDescriptor request) {
        String method = request.normalizedMethod();
        boolean sendsBody = request.getBody() != null && BODY_METHODS.contains(method);

        WebClient.RequestBodySpec spec = client.method(HttpMethod.valueOf(method))
                .uri(buildUri(request, sendsBody))
                .headers(h -> request.getHeaders().forEach(h::set));

        WebClient.RequestHeadersSpec<?> ready = sendsBody
                ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.getBody())
                : spec;

        Mono<JsonNode> response = ready
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), ClientResponse::createException)
                .bodyToMono(JsonNode.class);

        if (request.getTimeout() != null) {
            response = response.timeout(request.getTimeout());
        }

        return response
                .doOnSuccess(body -> log.debug("Request succeeded: {} {}", method, request.getUrl()))
                .doOnError(error -> log.debug("Request failed: {} {}: {}", method, request.getUrl(), error.toString()));
    }

    private URI buildUri(RequestDescriptor request, boolean sendsBody) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.getUrl());
        if (!sendsBody && request.getBody() != null) {
            toQueryParams(request.getBody()).forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.encode().build().toUri();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toQueryParams(Object body) {
        if (body instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        JsonNode node = objectMapper.valueToTree(body);
        if (!node.isObject()) {
            throw new IllegalArgumentException("Query parameters require an object body, got "
                    + body.getClass().getSimpleName());
        }
        return objectMapper.convertValue(node, Map.class);
    }
}
