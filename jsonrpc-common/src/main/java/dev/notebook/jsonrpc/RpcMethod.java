package dev.notebook.jsonrpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named operation: its declared parameters and the handler that runs it.
 */
public record RpcMethod(String name, String description, List<ParamSpec> params, RpcHandler handler) {

    public RpcMethod {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        params = List.copyOf(params);
        description = description == null ? "" : description;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {

        private final String name;
        private final List<ParamSpec> params = new ArrayList<>();
        private String description;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder param(ParamSpec param) {
            for (ParamSpec existing : params) {
                if (existing.name().equals(param.name())) {
                    throw new IllegalArgumentException("Duplicate parameter " + param.name() + " on " + name);
                }
            }
            params.add(param);
            return this;
        }

        public RpcMethod handler(RpcHandler handler) {
            return new RpcMethod(name, description, params, handler);
        }
    }
}
