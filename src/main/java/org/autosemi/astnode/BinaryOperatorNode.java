package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The BinaryOperatorNode class represents an infix operation.
 * Calls, indexing and field access are infix operations too: `(`, `[` and `.`
 * with the callee, collection or receiver on the left.
 */
public class BinaryOperatorNode extends AbstractNode {
    public final String operator;
    public final Node left;
    public final Node right;

    public BinaryOperatorNode(String operator, Node left, Node right, int tokenIndex) {
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
