package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

import java.util.List;

/**
 * The BlockNode class represents a brace-delimited sequence of statements,
 * or the statement list of a whole program.
 */
public class BlockNode extends AbstractNode {
    /**
     * The statements contained in this block.
     */
    public final List<Node> elements;

    /**
     * True if the last element is an unterminated expression whose value is the
     * value of the block (implicit return).
     */
    public boolean hasTail;

    /**
     * Constructs a new BlockNode with the specified list of child nodes.
     *
     * @param elements   the list of child nodes to be stored in this BlockNode
     * @param tokenIndex the index of the token in the source code
     */
    public BlockNode(List<Node> elements, int tokenIndex) {
        this.elements = elements;
        this.tokenIndex = tokenIndex;
        this.hasTail = false;
    }

    /**
     * Returns the implicit return value of the block, or null if the block ends with a terminator.
     */
    public Node tail() {
        return hasTail ? elements.get(elements.size() - 1) : null;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
