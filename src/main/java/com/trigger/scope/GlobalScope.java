package com.trigger.scope;

import com.trigger.exception.UnsupportedScopeOperationException;
import com.trigger.lisp.DefaultScope;
import com.trigger.lisp.FunctionValue;
import com.trigger.lisp.Node;
import com.trigger.lisp.Scope;
import com.trigger.value.Value;
import com.trigger.variable.VariableManager;

import java.util.Objects;

/**
 * Root of a rule's scope chain whose symbol table is the variable manager.
 * <p>
 * Lookups and assignments that fall through every lexical scope land here and become
 * variable reads and writes, so an assignment in a rule body persists the variable and
 * may trigger further rule runs. Declarations, branching and enclosing belong to the
 * lexical scopes above and are rejected at this level.
 */
public class GlobalScope implements Scope {

    public static final String RUN = "run";
    public static final String LOG = "log";

    private final VariableManager variables;
    private final FunctionValue runAction;
    private final FunctionValue logAction;

    public GlobalScope(VariableManager variables) {
        this(variables, new RunFunction(), new LogFunction());
    }

    GlobalScope(VariableManager variables, RunFunction run, LogFunction log) {
        this.variables = Objects.requireNonNull(variables, "variables");
        this.runAction = new FunctionValue(RUN, run);
        this.logAction = new FunctionValue(LOG, log);
    }

    @Override
    public Value get(String symbol) {
        return variables.get(symbol);
    }

    @Override
    public void set(String symbol, Value value) {
        variables.set(symbol, value);
    }

    @Override
    public void create(String symbol, Value value) {
        throw new UnsupportedScopeOperationException("create '" + symbol + "'");
    }

    @Override
    public Scope branch() {
        throw new UnsupportedScopeOperationException("branch");
    }

    @Override
    public void enclose(Scope parent) {
        throw new UnsupportedScopeOperationException("enclose");
    }

    /**
     * Evaluate in a fresh lexical scope enclosed by this one, with the built-in
     * actions bound.
     */
    @Override
    public Value eval(Node node) {
        Scope scope = new DefaultScope();
        scope.enclose(this);
        scope.create(RUN, runAction);
        scope.create(LOG, logAction);
        return scope.eval(node);
    }
}
