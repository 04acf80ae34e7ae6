package com.trigger.lisp;

import java.util.List;

/**
 * A parenthesized form: a special form or a function call.
 */
public record ListNode(List<Node> elements, int position) implements Node {

    public ListNode {
        elements = List.copyOf(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public Node head() {
        return elements.get(0);
    }

    public List<Node> arguments() {
        return elements.subList(1, elements.size());
    }
}
