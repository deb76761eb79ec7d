package com.jsemit.printer;

import com.jsemit.ast.Node;
import com.jsemit.ast.Statement;

import java.util.List;
import java.util.Objects;

/**
 * Turns IR trees into formatted JavaScript source.
 *
 * <p>Output is deterministic: the same tree always prints to the same text. Each variant has a
 * single rendering; the only content-dependent choices are key quoting and parenthesization.
 * The printer does not validate the tree: whatever it is given is printed, and a tree that is
 * not legal JavaScript (a stray {@code continue}, a reserved word as a variable name) shows up
 * only when the text is run.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 *
 * <pre>{@code
 * JsPrinter printer = new JsPrinter();
 * String js = printer.printProgram(List.of(
 *     new VariableDeclaration("x", new NumericLiteral(8.0)),
 *     new ReturnStatement(new Identifier("x"))));
 * }</pre>
 */
public final class JsPrinter {

    /**
     * Canonical indentation unit: four spaces.
     */
    public static final String DEFAULT_INDENT = "    ";

    private final String indentUnit;

    public JsPrinter() {
        this(DEFAULT_INDENT);
    }

    public JsPrinter(String indentUnit) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit");
    }

    public String indentUnit() {
        return indentUnit;
    }

    /**
     * Prints a single node at depth zero. Statements include their terminator; expressions are
     * printed bare.
     */
    public String print(Node node) {
        return print(node, 0);
    }

    /**
     * Prints a single node whose first line is already positioned at {@code depth}; continuation
     * lines and nested blocks are indented relative to it.
     */
    public String print(Node node, int depth) {
        CodeGenerator generator = new CodeGenerator(indentUnit, depth);
        if (node instanceof Statement) {
            generator.statement(node);
        } else {
            generator.expression(node, Precedence.LOWEST);
        }
        return generator.result();
    }

    /**
     * Prints {@code statements} as a program body: one statement per line, expressions
     * terminated like statements.
     */
    public String printProgram(List<? extends Node> statements) {
        return printProgram(statements, 0);
    }

    /**
     * Like {@link #printProgram(List)}, with every line indented to {@code depth}.
     */
    public String printProgram(List<? extends Node> statements, int depth) {
        CodeGenerator generator = new CodeGenerator(indentUnit, depth);
        for (int i = 0; i < statements.size(); i++) {
            if (i == 0) {
                generator.writeIndent();
            } else {
                generator.newline();
            }
            generator.statement(statements.get(i));
        }
        return generator.result();
    }
}
