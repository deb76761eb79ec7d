package com.jsemit.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record FunctionExpression(
    Optional<String> name,  // Empty for anonymous functions
    List<String> params,
    Node body
) implements Expression {
    public FunctionExpression {
        name = name == null ? Optional.empty() : name;
        params = List.copyOf(params);
        Objects.requireNonNull(body, "body");
    }

    public FunctionExpression(List<String> params, Node body) {
        this(Optional.empty(), params, body);
    }

    public FunctionExpression(String name, List<String> params, Node body) {
        this(Optional.of(name), params, body);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionExpression(this);
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }
}
