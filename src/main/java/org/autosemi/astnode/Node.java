package org.autosemi.astnode;

import org.autosemi.astvisitor.Visitor;

/**
 * The Node interface represents a node in the abstract syntax tree (AST).
 * Every node can be visited by a {@link Visitor} and remembers the index of
 * the token it was parsed from.
 */
public interface Node {
    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    void accept(Visitor visitor);

    int getIndex();

    void setIndex(int tokenIndex);
}
