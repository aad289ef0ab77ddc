package dev.notebook.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Builds response envelopes.
 */
final class RpcResponses {

    private final ObjectMapper mapper;

    RpcResponses(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ObjectNode success(JsonNode id, JsonNode result) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", RpcRequest.VERSION);
        response.set("id", id == null ? NullNode.getInstance() : id);
        response.set("result", result == null ? NullNode.getInstance() : result);
        return response;
    }

    ObjectNode error(JsonNode id, RpcErrorCode code, Throwable failure) {
        ObjectNode data = mapper.createObjectNode();
        data.put("message", String.valueOf(failure.getMessage()));
        if (code == RpcErrorCode.INTERNAL_ERROR) {
            data.put("stacktrace", stackTrace(failure));
        }

        ObjectNode error = mapper.createObjectNode();
        error.put("code", code.code());
        error.put("message", code.message());
        error.set("data", data);

        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", RpcRequest.VERSION);
        response.set("id", id == null ? NullNode.getInstance() : id);
        response.set("error", error);
        return response;
    }

    private static String stackTrace(Throwable failure) {
        StringWriter writer = new StringWriter();
        failure.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
