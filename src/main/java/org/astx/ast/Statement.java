package org.astx.ast;

/**
 * A node that is executed for its effect and produces no value.
 */
public abstract class Statement extends AstNode {
}
