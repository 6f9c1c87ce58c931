package org.autosemi.astvisitor;

import org.autosemi.astnode.*;

/**
 * The Visitor interface defines a visit method for each concrete node type of the AST.
 */
public interface Visitor {
    void visit(BlockNode node);

    void visit(OperatorNode node);

    void visit(BinaryOperatorNode node);

    void visit(IdentifierNode node);

    void visit(NumberNode node);

    void visit(StringNode node);

    void visit(ListNode node);

    void visit(ArrayLiteralNode node);

    void visit(DeclarationNode node);

    void visit(IfNode node);

    void visit(LoopNode node);

    void visit(ForNode node);

    void visit(FunctionNode node);
}
