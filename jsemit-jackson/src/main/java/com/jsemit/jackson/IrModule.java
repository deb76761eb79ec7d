package com.jsemit.jackson;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.jsemit.ast.*;

/**
 * Jackson module that configures serialization/deserialization for the IR classes.
 *
 * This module handles:
 * - Polymorphic node types via the "type" property, named after {@link Node#type()}
 * - Polymorphic object literal entries via the "kind" property, named after {@link ObjectProperty#kind()}
 */
public class IrModule extends SimpleModule {

    public IrModule() {
        super("IrModule", new Version(1, 0, 0, null, "com.jsemit", "jsemit-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(ObjectProperty.class, PropertyMixin.class);
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = NullLiteral.class, name = "NullLiteral"),
        @JsonSubTypes.Type(value = NumericLiteral.class, name = "NumericLiteral"),
        @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
        @JsonSubTypes.Type(value = TemplateLiteral.class, name = "TemplateLiteral"),
        @JsonSubTypes.Type(value = BooleanLiteral.class, name = "BooleanLiteral"),
        @JsonSubTypes.Type(value = UnaryExpression.class, name = "UnaryExpression"),
        @JsonSubTypes.Type(value = BinaryExpression.class, name = "BinaryExpression"),
        @JsonSubTypes.Type(value = ArrayLiteral.class, name = "ArrayLiteral"),
        @JsonSubTypes.Type(value = IndexExpression.class, name = "IndexExpression"),
        @JsonSubTypes.Type(value = ObjectLiteral.class, name = "ObjectLiteral"),
        @JsonSubTypes.Type(value = PropertyAccess.class, name = "PropertyAccess"),
        @JsonSubTypes.Type(value = FunctionExpression.class, name = "FunctionExpression"),
        @JsonSubTypes.Type(value = CallExpression.class, name = "CallExpression"),
        @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
        @JsonSubTypes.Type(value = ConditionalExpression.class, name = "ConditionalExpression"),
        @JsonSubTypes.Type(value = TypeofExpression.class, name = "TypeofExpression"),
        @JsonSubTypes.Type(value = BlockStatement.class, name = "BlockStatement"),
        @JsonSubTypes.Type(value = VariableDeclaration.class, name = "VariableDeclaration"),
        @JsonSubTypes.Type(value = AssignmentStatement.class, name = "AssignmentStatement"),
        @JsonSubTypes.Type(value = WhileStatement.class, name = "WhileStatement"),
        @JsonSubTypes.Type(value = ForStatement.class, name = "ForStatement"),
        @JsonSubTypes.Type(value = ForInStatement.class, name = "ForInStatement"),
        @JsonSubTypes.Type(value = IfStatement.class, name = "IfStatement"),
        @JsonSubTypes.Type(value = ReturnStatement.class, name = "ReturnStatement"),
        @JsonSubTypes.Type(value = ThrowStatement.class, name = "ThrowStatement"),
        @JsonSubTypes.Type(value = LabeledStatement.class, name = "LabeledStatement"),
        @JsonSubTypes.Type(value = BreakStatement.class, name = "BreakStatement"),
        @JsonSubTypes.Type(value = ContinueStatement.class, name = "ContinueStatement")
    })
    private interface NodeMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = ObjectProperty.LiteralKey.class, name = "LiteralKey"),
        @JsonSubTypes.Type(value = ObjectProperty.ComputedKey.class, name = "ComputedKey"),
        @JsonSubTypes.Type(value = ObjectProperty.Getter.class, name = "Getter"),
        @JsonSubTypes.Type(value = ObjectProperty.Setter.class, name = "Setter")
    })
    private interface PropertyMixin {
    }
}
