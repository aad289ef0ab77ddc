package dev.notebook.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Argument types a registered method can declare. Each type converts a JSON value into the Java
 * value handed to the handler, or rejects it.
 */
public enum ParamType {

    STRING {
        @Override
        Object convert(JsonNode value) throws RpcException {
            if (value == null || !value.isTextual()) {
                throw mismatch("string", value);
            }
            return value.textValue();
        }
    },

    NULLABLE_STRING {
        @Override
        Object convert(JsonNode value) throws RpcException {
            if (value == null || value.isNull()) {
                return null;
            }
            return STRING.convert(value);
        }
    },

    INTEGER {
        @Override
        Object convert(JsonNode value) throws RpcException {
            if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
                throw mismatch("integer", value);
            }
            return value.intValue();
        }
    };

    abstract Object convert(JsonNode value) throws RpcException;

    private static RpcException mismatch(String expected, JsonNode actual) {
        String found = actual == null ? "missing" : actual.getNodeType().name().toLowerCase();
        return new RpcException(RpcErrorCode.INVALID_PARAMS, "Expected " + expected + " but found " + found);
    }
}
