package com.trigger.lisp;

import java.util.List;

/**
 * Root of a parsed source: its top-level forms, evaluated in order.
 *
 * @param name  Source name, used in error messages
 * @param forms Top-level forms
 */
public record ProgramNode(String name, List<Node> forms) implements Node {

    public ProgramNode {
        forms = List.copyOf(forms);
    }

    @Override
    public int position() {
        return 0;
    }
}
