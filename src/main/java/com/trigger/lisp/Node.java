package com.trigger.lisp;

/**
 * Node of a parsed rule program.
 */
public interface Node {

    /**
     * Offset of the node in its source.
     */
    int position();
}
