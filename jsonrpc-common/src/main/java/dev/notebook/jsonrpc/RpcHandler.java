package dev.notebook.jsonrpc;

import java.util.List;

/**
 * Invoked with arguments that were already bound and type checked against the method's
 * {@link ParamSpec}s, in declaration order. The returned value is serialized as the result.
 */
@FunctionalInterface
public interface RpcHandler {
    Object handle(List<Object> arguments) throws Exception;
}
