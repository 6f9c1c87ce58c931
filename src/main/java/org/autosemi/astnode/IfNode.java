package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The IfNode class represents `if condition { ... } [else ...]`, both as a statement
 * and as an expression. The else branch is a BlockNode, another IfNode, or null.
 */
public class IfNode extends AbstractNode {
    public final Node condition;
    public final BlockNode thenBranch;
    public final Node elseBranch;

    public IfNode(Node condition, BlockNode thenBranch, Node elseBranch, int tokenIndex) {
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
