package dev.notebook.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A request envelope that passed protocol validation. {@code id} and {@code params} are
 * {@code null} when absent from the wire.
 */
public record RpcRequest(JsonNode id, String method, JsonNode params) {

    public static final String VERSION = "2.0";

    public boolean isNotification() {
        return id == null || id.isNull();
    }

    static RpcRequest from(JsonNode node) throws RpcException {
        if (node == null || !node.isObject()) {
            throw invalid("Request must be an object");
        }
        JsonNode version = node.get("jsonrpc");
        if (version == null || !version.isTextual() || !VERSION.equals(version.textValue())) {
            throw invalid("Invalid jsonrpc: must be \"2.0\"");
        }
        JsonNode id = node.get("id");
        if (id != null && !(id.isNull() || id.isTextual() || id.isNumber())) {
            throw invalid("Invalid id: must be null, string or number");
        }
        JsonNode method = node.get("method");
        if (method == null || !method.isTextual()) {
            throw invalid("Invalid method: must be string");
        }
        JsonNode params = node.get("params");
        if (params != null && !(params.isArray() || params.isObject())) {
            throw invalid("Invalid params: must be array or object");
        }
        return new RpcRequest(id, method.textValue(), params);
    }

    private static RpcException invalid(String message) {
        return new RpcException(RpcErrorCode.INVALID_REQUEST, message);
    }
}
