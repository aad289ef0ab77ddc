package dev.notebook.jsonrpc;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed lookup table from method name to {@link RpcMethod}. Built once, read concurrently.
 */
public final class MethodRegistry {

    private final Map<String, RpcMethod> methods;

    private MethodRegistry(Map<String, RpcMethod> methods) {
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RpcMethod> lookup(String name) {
        return Optional.ofNullable(methods.get(name));
    }

    public Collection<RpcMethod> methods() {
        return methods.values();
    }

    public static final class Builder {

        private final Map<String, RpcMethod> methods = new LinkedHashMap<>();

        public Builder register(RpcMethod method) {
            if (methods.containsKey(method.name())) {
                throw new IllegalArgumentException("Cannot register a duplicate handler for method " + method.name());
            }
            methods.put(method.name(), method);
            return this;
        }

        public MethodRegistry build() {
            if (methods.isEmpty()) {
                throw new IllegalStateException("At least one method must be registered");
            }
            return new MethodRegistry(methods);
        }
    }
}
