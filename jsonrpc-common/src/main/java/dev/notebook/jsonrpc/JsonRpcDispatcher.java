package dev.notebook.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes JSON-RPC 2.0 request bodies, runs each call against a {@link MethodRegistry} and
 * assembles the response body.
 *
 * <p>Requests that fail envelope validation, and bodies that fail to parse, are always answered
 * with a {@code null} id since the caller cannot be trusted to have sent a notification. Valid
 * notifications never produce a response, including when the call fails.
 *
 * <p>Whole bodies are dispatched one at a time; a batch is never interleaved with another request.
 */
public final class JsonRpcDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonRpcDispatcher.class);

    private final MethodRegistry registry;
    private final ObjectMapper mapper;
    private final ObjectReader reader;
    private final RpcResponses responses;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonRpcDispatcher(MethodRegistry registry, ObjectMapper mapper) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.responses = new RpcResponses(mapper);
    }

    /**
     * Handles one raw request body.
     * @param remote description of the caller, used for logging only
     * @param body raw UTF-8 request bytes
     * @return the serialized response, or empty when nothing must be sent back
     */
    public Optional<String> handle(String remote, byte[] body) {
        Wire.rx(remote, new String(body, StandardCharsets.UTF_8));
        Optional<JsonNode> response;
        lock.lock();
        try {
            response = dispatch(body);
        } finally {
            lock.unlock();
        }
        if (response.isEmpty()) {
            LOGGER.debug("No response body for request from {}", remote);
            return Optional.empty();
        }
        String json = serialize(response.get());
        Wire.tx(remote, json);
        return Optional.of(json);
    }

    Optional<JsonNode> dispatch(byte[] body) {
        JsonNode root;
        try {
            root = reader.readTree(body);
        } catch (IOException e) {
            LOGGER.debug("Unparseable request body", e);
            return Optional.of(responses.error(NullNode.getInstance(), RpcErrorCode.PARSE_ERROR, e));
        }
        if (root == null || root.isMissingNode()) {
            RpcException empty = new RpcException(RpcErrorCode.PARSE_ERROR, "Empty request body");
            return Optional.of(responses.error(NullNode.getInstance(), RpcErrorCode.PARSE_ERROR, empty));
        }

        if (root.isArray()) {
            if (root.isEmpty()) {
                return Optional.of(invalidRequest("Batch must not be empty"));
            }
            ArrayNode batch = mapper.createArrayNode();
            for (JsonNode entry : root) {
                process(entry).ifPresent(batch::add);
            }
            return batch.isEmpty() ? Optional.empty() : Optional.of(batch);
        }
        if (root.isObject()) {
            return process(root);
        }
        return Optional.of(invalidRequest("Request must be an object or a non-empty array"));
    }

    private Optional<JsonNode> process(JsonNode node) {
        RpcRequest request;
        try {
            request = RpcRequest.from(node);
        } catch (RpcException e) {
            LOGGER.debug("Rejected request envelope: {}", e.getMessage());
            return Optional.of(responses.error(NullNode.getInstance(), e.errorCode(), e));
        }

        try {
            RpcMethod method = registry.lookup(request.method())
                .orElseThrow(() -> new RpcException(RpcErrorCode.METHOD_NOT_FOUND,
                    "Unknown method: " + request.method()));
            List<Object> arguments = ArgumentBinder.bind(method, request.params());
            Object result = method.handler().handle(arguments);
            if (request.isNotification()) {
                return Optional.empty();
            }
            return Optional.of(responses.success(request.id(), mapper.valueToTree(result)));
        } catch (RpcException e) {
            LOGGER.debug("Call to {} failed: {}", request.method(), e.getMessage());
            return failure(request, e.errorCode(), e);
        } catch (Exception e) {
            LOGGER.warn("Call to {} raised an error", request.method(), e);
            return failure(request, RpcErrorCode.INTERNAL_ERROR, e);
        }
    }

    private Optional<JsonNode> failure(RpcRequest request, RpcErrorCode code, Exception failure) {
        if (request.isNotification()) {
            LOGGER.warn("Dropping {} for notification {}: {}", code, request.method(), failure.getMessage());
            return Optional.empty();
        }
        return Optional.of(responses.error(request.id(), code, failure));
    }

    private JsonNode invalidRequest(String message) {
        RpcException failure = new RpcException(RpcErrorCode.INVALID_REQUEST, message);
        return responses.error(NullNode.getInstance(), RpcErrorCode.INVALID_REQUEST, failure);
    }

    private String serialize(JsonNode response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
