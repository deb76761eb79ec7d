package com.jsemit.ast;

public interface PropertyVisitor<R> {
    R visitLiteralKey(ObjectProperty.LiteralKey property);

    R visitComputedKey(ObjectProperty.ComputedKey property);

    R visitGetter(ObjectProperty.Getter property);

    R visitSetter(ObjectProperty.Setter property);
}
