package com.disassembly.composition;

/**
 * Where a node sits in its tree, which decides the amount-in-parent rule.
 */
public enum NodePosition {
    /** Base product: no parent, no amount in parent. */
    ROOT,
    /** Component: has a parent and a positive amount in parent. */
    COMPONENT
}
