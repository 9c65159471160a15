package com.jslowering.codegen;

import com.jslowering.ast.*;

import java.util.List;

/**
 * Static constructors for synthesized syntax tree nodes. Synthesized nodes carry no
 * source position.
 */
public final class AstFactory {

    private AstFactory() {
        // Utility class
    }

    public static Identifier createIdentifier(String name) {
        return new Identifier(name);
    }

    public static Literal createNumberLiteral(int value) {
        return new Literal(value, Integer.toString(value));
    }

    public static Literal createStringLiteral(String value) {
        return new Literal(value, "'" + value + "'");
    }

    public static ArrayExpression createEmptyArrayLiteral() {
        return new ArrayExpression(List.of());
    }

    public static BlockStatement createBlock(Statement... statements) {
        return new BlockStatement(List.of(statements));
    }

    public static BlockStatement createBlock(List<Statement> statements) {
        return new BlockStatement(List.copyOf(statements));
    }

    /**
     * Returns the statements of {@code statement} when it is a block, otherwise a singleton list.
     */
    public static List<Statement> statementsOf(Statement statement) {
        if (statement instanceof BlockStatement block) {
            return block.body();
        }
        return List.of(statement);
    }

    /**
     * {@code kind name = initializer}, with no initializer when {@code initializer} is null.
     */
    public static VariableDeclaration createVariableDeclaration(String kind, Identifier name, Expression initializer) {
        return new VariableDeclaration(List.of(new VariableDeclarator(name, initializer)), kind);
    }

    public static VariableDeclaration createVariableStatement(String kind, String name, Expression initializer) {
        return createVariableDeclaration(kind, createIdentifier(name), initializer);
    }

    public static ExpressionStatement createExpressionStatement(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static ExpressionStatement createAssignmentStatement(Expression left, Expression right) {
        return createExpressionStatement(createAssignment(left, right));
    }

    public static AssignmentExpression createAssignment(Expression left, Expression right) {
        return new AssignmentExpression("=", left, right);
    }

    /**
     * {@code object.name}
     */
    public static MemberExpression createMemberExpression(Expression object, String name) {
        return new MemberExpression(object, createIdentifier(name), false);
    }

    public static MemberExpression createMemberExpression(String object, String name) {
        return createMemberExpression(createIdentifier(object), name);
    }

    /**
     * {@code object[member]}
     */
    public static MemberExpression createMemberLookupExpression(Expression object, Expression member) {
        return new MemberExpression(object, member, true);
    }

    public static CallExpression createCallExpression(Expression callee, Expression... arguments) {
        return new CallExpression(callee, List.of(arguments));
    }

    public static ExpressionStatement createCallStatement(Expression callee, Expression... arguments) {
        return createExpressionStatement(createCallExpression(callee, arguments));
    }

    public static BinaryExpression createBinaryExpression(Expression left, String operator, Expression right) {
        return new BinaryExpression(operator, left, right);
    }

    public static UnaryExpression createUnaryExpression(String operator, Expression argument) {
        return new UnaryExpression(operator, argument);
    }

    public static UpdateExpression createPostfixExpression(Expression argument, String operator) {
        return new UpdateExpression(operator, false, argument);
    }

    public static IfStatement createIfStatement(Expression test, Statement consequent, Statement alternate) {
        return new IfStatement(test, consequent, alternate);
    }

    public static ContinueStatement createContinueStatement() {
        return new ContinueStatement(null);
    }

    public static ForStatement createForStatement(Node init, Expression test, Expression update, Statement body) {
        return new ForStatement(init, test, update, body);
    }

    public static ForInStatement createForInStatement(Node left, Expression right, Statement body) {
        return new ForInStatement(left, right, body);
    }

    public static ForEachStatement createForEachStatement(VariableDeclaration left, Expression right, Statement body) {
        return new ForEachStatement(left, right, body);
    }

    public static YieldStatement createYieldStatement(Expression argument, boolean isYieldFor) {
        return new YieldStatement(argument, isYieldFor);
    }
}
