package com.pacer.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.pacer.model.RequestDescriptor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Executes exactly one physical HTTP request.
 * Implementations parse the response body and signal an error for any
 * transport failure or non-success status. They never retry.
 */
@FunctionalInterface
public interface RequestExecutor {

    /**
     * Issue the request on the given pooled client.
     *
     * @param client  pooled client from the {@link ConnectionManager}
     * @param request request description
     * @return parsed response body; empty when the response has no body
     */
    Mono<JsonNode> execute(WebClient client, RequestDescriptor request);
}
