package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The OperatorNode class represents a prefix or postfix operator applied to one operand,
 * and the control-flow keywords `return`, `break`, `continue` and `throw`.
 * The operand is null for `continue` and for `return` / `break` without a value.
 */
public class OperatorNode extends AbstractNode {
    /**
     * The operand on which the operator is applied.
     */
    public Node operand;
    /**
     * The operator represented by this node.
     */
    public String operator;

    /**
     * Constructs a new OperatorNode with the specified operator and operand.
     *
     * @param operator   the operator or keyword
     * @param operand    the operand, or null
     * @param tokenIndex the index of the token in the source code
     */
    public OperatorNode(String operator, Node operand, int tokenIndex) {
        this.operator = operator;
        this.operand = operand;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
