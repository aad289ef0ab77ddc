package dev.notebook.jsonrpc;

import java.util.Objects;

/**
 * Declares one named, typed parameter of a registered method.
 */
public record ParamSpec(String name, ParamType type) {

    public ParamSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static ParamSpec string(String name) {
        return new ParamSpec(name, ParamType.STRING);
    }

    public static ParamSpec nullableString(String name) {
        return new ParamSpec(name, ParamType.NULLABLE_STRING);
    }

    public static ParamSpec integer(String name) {
        return new ParamSpec(name, ParamType.INTEGER);
    }
}
