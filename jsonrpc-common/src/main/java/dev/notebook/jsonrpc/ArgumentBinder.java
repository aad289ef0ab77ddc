package dev.notebook.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Binds positional or named JSON params onto a method's declared parameter list.
 */
final class ArgumentBinder {

    private ArgumentBinder() {
    }

    static List<Object> bind(RpcMethod method, JsonNode params) throws RpcException {
        List<ParamSpec> specs = method.params();
        if (params == null) {
            if (!specs.isEmpty()) {
                throw invalidParams(method, "expected " + specs.size() + " arguments but got none");
            }
            return List.of();
        }
        List<Object> arguments = new ArrayList<>(specs.size());
        if (params.isArray()) {
            if (params.size() != specs.size()) {
                throw invalidParams(method, "expected " + specs.size() + " arguments but got " + params.size());
            }
            for (int i = 0; i < specs.size(); i++) {
                arguments.add(convert(method, specs.get(i), params.get(i)));
            }
            return arguments;
        }
        for (ParamSpec spec : specs) {
            if (!params.has(spec.name())) {
                throw invalidParams(method, "missing argument '" + spec.name() + "'");
            }
            arguments.add(convert(method, spec, params.get(spec.name())));
        }
        Iterator<String> names = params.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (specs.stream().noneMatch(spec -> spec.name().equals(name))) {
                throw invalidParams(method, "unexpected argument '" + name + "'");
            }
        }
        return arguments;
    }

    private static Object convert(RpcMethod method, ParamSpec spec, JsonNode value) throws RpcException {
        try {
            return spec.type().convert(value);
        } catch (RpcException e) {
            throw invalidParams(method, "argument '" + spec.name() + "': " + e.getMessage());
        }
    }

    private static RpcException invalidParams(RpcMethod method, String detail) {
        return new RpcException(RpcErrorCode.INVALID_PARAMS, method.name() + "(): " + detail);
    }
}
