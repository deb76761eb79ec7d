package com.jsemit.printer;

import com.jsemit.ast.*;

import java.util.List;

/**
 * Writes one tree into a buffer. Statement variants visit as statements (terminator included,
 * no leading indentation); expression variants visit as bare expressions. A new generator is
 * created per print call.
 */
final class CodeGenerator implements NodeVisitor<Void>, PropertyVisitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private final String indentUnit;
    private int depth;

    CodeGenerator(String indentUnit, int depth) {
        this.indentUnit = indentUnit;
        this.depth = depth;
    }

    String result() {
        return out.toString();
    }

    // ==================== Layout ====================

    private void add(String text) {
        out.append(text);
    }

    void newline() {
        out.append('\n');
        writeIndent();
    }

    void writeIndent() {
        for (int i = 0; i < depth; i++) {
            out.append(indentUnit);
        }
    }

    /**
     * Braces around {@code statements}, each on its own line one level deeper. Empty blocks
     * print as {@code {}}.
     */
    private void block(List<Node> statements) {
        if (statements.isEmpty()) {
            add("{}");
            return;
        }
        add("{");
        depth++;
        for (Node statement : statements) {
            newline();
            statement(statement);
        }
        depth--;
        newline();
        add("}");
    }

    /**
     * Control-flow and function bodies always print braced; a block body is not braced twice.
     */
    private void body(Node body) {
        if (body instanceof BlockStatement block) {
            block(block.body());
        } else {
            block(List.of(body));
        }
    }

    // ==================== Entry points ====================

    void statement(Node node) {
        if (node instanceof Expression) {
            int start = out.length();
            expression(node, Precedence.LOWEST);
            guardStatementStart(start);
            add(";");
        } else {
            node.accept(this);
        }
    }

    void expression(Node node, int minPrecedence) {
        boolean parens = Precedence.of(node) < minPrecedence;
        if (parens) {
            add("(");
        }
        if (node instanceof AssignmentStatement assignment) {
            assignment(assignment);
        } else {
            node.accept(this);
        }
        if (parens) {
            add(")");
        }
    }

    /**
     * An expression statement may not begin with "{" or "function": the parser would read a
     * block or a declaration. Wraps what was written since {@code start} when it does.
     */
    private void guardStatementStart(int start) {
        if (startsAmbiguously(start)) {
            out.insert(start, '(');
            add(")");
        }
    }

    private boolean startsAmbiguously(int start) {
        if (start < out.length() && out.charAt(start) == '{') {
            return true;
        }
        String keyword = "function";
        int after = start + keyword.length();
        if (after < out.length() && keyword.contentEquals(out.subSequence(start, after))) {
            char next = out.charAt(after);
            return next == ' ' || next == '(';
        }
        return false;
    }

    private void assignment(AssignmentStatement node) {
        expression(node.target(), Precedence.MEMBER);
        add(" = ");
        expression(node.value(), Precedence.ASSIGNMENT);
    }

    private void arguments(List<Node> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                add(", ");
            }
            expression(nodes.get(i), Precedence.ASSIGNMENT);
        }
    }

    private void propertyName(String name) {
        add(JsStrings.isIdentifier(name) ? name : JsStrings.quote(name));
    }

    // ==================== Literals ====================

    @Override
    public Void visitNullLiteral(NullLiteral node) {
        add("null");
        return null;
    }

    @Override
    public Void visitNumericLiteral(NumericLiteral node) {
        add(JsNumbers.format(node.value()));
        return null;
    }

    @Override
    public Void visitStringLiteral(StringLiteral node) {
        add(JsStrings.quote(node.value()));
        return null;
    }

    @Override
    public Void visitTemplateLiteral(TemplateLiteral node) {
        add("`");
        add(node.raw());
        add("`");
        return null;
    }

    @Override
    public Void visitBooleanLiteral(BooleanLiteral node) {
        add(node.value() ? "true" : "false");
        return null;
    }

    // ==================== Expressions ====================

    @Override
    public Void visitUnaryExpression(UnaryExpression node) {
        UnaryOperator operator = node.operator();
        add(operator.symbol());
        int start = out.length();
        if (operator == UnaryOperator.SPREAD) {
            expression(node.argument(), Precedence.ASSIGNMENT);
            return null;
        }
        expression(node.argument(), Precedence.UNARY);
        // "- -x" must not collapse into the decrement operator
        if ((operator == UnaryOperator.NEGATE || operator == UnaryOperator.PLUS)
            && start < out.length()
            && out.charAt(start) == operator.symbol().charAt(0)) {
            out.insert(start, ' ');
        }
        return null;
    }

    @Override
    public Void visitBinaryExpression(BinaryExpression node) {
        int precedence = node.operator().precedence();
        expression(node.left(), precedence);
        add(" ");
        add(node.operator().symbol());
        add(" ");
        // Left-associative: an equal-precedence right operand keeps its parentheses
        expression(node.right(), precedence + 1);
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteral node) {
        add("[");
        arguments(node.elements());
        add("]");
        return null;
    }

    @Override
    public Void visitIndexExpression(IndexExpression node) {
        expression(node.object(), Precedence.MEMBER);
        add("[");
        expression(node.index(), Precedence.LOWEST);
        add("]");
        return null;
    }

    @Override
    public Void visitObjectLiteral(ObjectLiteral node) {
        List<ObjectProperty> properties = node.properties();
        if (properties.isEmpty()) {
            add("{}");
            return null;
        }
        add("{");
        depth++;
        for (int i = 0; i < properties.size(); i++) {
            newline();
            properties.get(i).accept(this);
            if (i < properties.size() - 1) {
                add(",");
            }
        }
        depth--;
        newline();
        add("}");
        return null;
    }

    @Override
    public Void visitPropertyAccess(PropertyAccess node) {
        expression(node.object(), Precedence.MEMBER);
        if (JsStrings.isIdentifier(node.property())) {
            add(".");
            add(node.property());
        } else {
            add("[");
            add(JsStrings.quote(node.property()));
            add("]");
        }
        return null;
    }

    @Override
    public Void visitFunctionExpression(FunctionExpression node) {
        add("function ");
        node.name().ifPresent(this::add);
        add("(");
        add(String.join(", ", node.params()));
        add(") ");
        body(node.body());
        return null;
    }

    @Override
    public Void visitCallExpression(CallExpression node) {
        expression(node.callee(), Precedence.MEMBER);
        add("(");
        arguments(node.arguments());
        add(")");
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node) {
        add(node.name());
        return null;
    }

    @Override
    public Void visitConditionalExpression(ConditionalExpression node) {
        expression(node.test(), Precedence.CONDITIONAL + 1);
        add(" ? ");
        expression(node.consequent(), Precedence.ASSIGNMENT);
        add(" : ");
        expression(node.alternate(), Precedence.ASSIGNMENT);
        return null;
    }

    @Override
    public Void visitTypeofExpression(TypeofExpression node) {
        add("typeof ");
        expression(node.argument(), Precedence.UNARY);
        return null;
    }

    // ==================== Object properties ====================

    @Override
    public Void visitLiteralKey(ObjectProperty.LiteralKey property) {
        propertyName(property.key());
        add(": ");
        expression(property.value(), Precedence.ASSIGNMENT);
        return null;
    }

    @Override
    public Void visitComputedKey(ObjectProperty.ComputedKey property) {
        add("[");
        expression(property.key(), Precedence.ASSIGNMENT);
        add("]: ");
        expression(property.value(), Precedence.ASSIGNMENT);
        return null;
    }

    @Override
    public Void visitGetter(ObjectProperty.Getter property) {
        add("get ");
        propertyName(property.name());
        add("() ");
        block(property.body());
        return null;
    }

    @Override
    public Void visitSetter(ObjectProperty.Setter property) {
        add("set ");
        propertyName(property.name());
        add("(");
        add(property.param());
        add(") ");
        block(property.body());
        return null;
    }

    // ==================== Statements ====================

    @Override
    public Void visitBlockStatement(BlockStatement node) {
        block(node.body());
        return null;
    }

    @Override
    public Void visitVariableDeclaration(VariableDeclaration node) {
        add("let ");
        add(node.name());
        if (node.init().isPresent()) {
            add(" = ");
            expression(node.init().get(), Precedence.ASSIGNMENT);
        }
        add(";");
        return null;
    }

    @Override
    public Void visitAssignmentStatement(AssignmentStatement node) {
        int start = out.length();
        assignment(node);
        guardStatementStart(start);
        add(";");
        return null;
    }

    @Override
    public Void visitWhileStatement(WhileStatement node) {
        add("while (");
        expression(node.test(), Precedence.LOWEST);
        add(") ");
        body(node.body());
        return null;
    }

    @Override
    public Void visitForStatement(ForStatement node) {
        add("for (let ");
        add(node.variable());
        add(" = ");
        expression(node.init(), Precedence.ASSIGNMENT);
        add("; ");
        expression(node.test(), Precedence.LOWEST);
        add("; ");
        expression(node.update(), Precedence.LOWEST);
        add(") ");
        body(node.body());
        return null;
    }

    @Override
    public Void visitForInStatement(ForInStatement node) {
        add("for (let ");
        add(node.variable());
        add(" in ");
        expression(node.object(), Precedence.LOWEST);
        add(") ");
        body(node.body());
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatement node) {
        add("if (");
        expression(node.test(), Precedence.LOWEST);
        add(") ");
        body(node.consequent());
        if (node.alternate().isPresent()) {
            Node alternate = node.alternate().get();
            add(" else ");
            if (alternate instanceof IfStatement) {
                // else-if chains stay flat
                statement(alternate);
            } else {
                body(alternate);
            }
        }
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement node) {
        add("return");
        if (node.argument().isPresent()) {
            add(" ");
            expression(node.argument().get(), Precedence.LOWEST);
        }
        add(";");
        return null;
    }

    @Override
    public Void visitThrowStatement(ThrowStatement node) {
        add("throw ");
        expression(node.argument(), Precedence.LOWEST);
        add(";");
        return null;
    }

    @Override
    public Void visitLabeledStatement(LabeledStatement node) {
        add(node.label());
        add(": ");
        statement(node.body());
        return null;
    }

    @Override
    public Void visitBreakStatement(BreakStatement node) {
        add("break");
        node.label().ifPresent(label -> add(" " + label));
        add(";");
        return null;
    }

    @Override
    public Void visitContinueStatement(ContinueStatement node) {
        add("continue");
        node.label().ifPresent(label -> add(" " + label));
        add(";");
        return null;
    }
}
