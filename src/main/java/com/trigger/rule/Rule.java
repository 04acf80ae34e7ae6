package com.trigger.rule;

import com.trigger.lisp.Parser;
import com.trigger.lisp.ProgramNode;
import com.trigger.lisp.Scope;
import com.trigger.scope.GlobalScope;
import com.trigger.value.Value;
import com.trigger.variable.VariableManager;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.util.Objects;

/**
 * A named program, parsed once and re-evaluated against the same scope on every run.
 */
public final class Rule {

    private final String name;
    private final ProgramNode program;
    private final Scope scope;

    Rule(String name, ProgramNode program, Scope scope) {
        this.name = Objects.requireNonNull(name, "name");
        this.program = Objects.requireNonNull(program, "program");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    /**
     * Read and parse a rule, binding it to a new global scope over the given variables.
     *
     * @param name      Rule name, usually its file name
     * @param reader    Rule source
     * @param variables Variables the rule reads and writes
     * @return Parsed rule
     * @throws IOException if the source cannot be read
     * @throws com.trigger.exception.RuleParseException if the source does not parse
     */
    public static Rule load(String name, Reader reader, VariableManager variables) throws IOException {
        StringWriter source = new StringWriter();
        reader.transferTo(source);
        return parse(name, source.toString(), variables);
    }

    /**
     * Parse a rule from source text.
     *
     * @throws com.trigger.exception.RuleParseException if the source does not parse
     */
    public static Rule parse(String name, String source, VariableManager variables) {
        ProgramNode program = Parser.parse(name, source);
        return new Rule(name, program, new GlobalScope(variables));
    }

    /**
     * Evaluate the rule. Errors from the program propagate unchanged.
     *
     * @return Value of the last top-level form
     */
    public Value run() {
        return scope.eval(program);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "Rule[" + name + "]";
    }
}
