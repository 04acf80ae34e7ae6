package com.trigger.lisp;

import com.trigger.exception.ArgumentException;
import com.trigger.exception.EvaluationException;
import com.trigger.exception.UndefinedSymbolException;
import com.trigger.lisp.LispConfig.SpecialForms;
import com.trigger.value.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lexical scope holding local bindings, with an optional parent.
 * <p>
 * A scope created with the public constructor has the standard library bound;
 * scopes created by {@link #branch()} only see it through their parent.
 * Instances are not thread-safe; every evaluation uses its own chain.
 */
public class DefaultScope implements Scope {

    private final Map<String, Value> bindings = new HashMap<>();
    private Scope parent;

    public DefaultScope() {
        StandardLibrary.register(this);
    }

    private DefaultScope(Scope parent) {
        this.parent = parent;
    }

    @Override
    public Value get(String symbol) {
        Value value = bindings.get(symbol);
        if (value != null) {
            return value;
        }
        if (parent != null) {
            return parent.get(symbol);
        }
        throw new UndefinedSymbolException(symbol);
    }

    @Override
    public void set(String symbol, Value value) {
        if (bindings.containsKey(symbol)) {
            bindings.put(symbol, value);
            return;
        }
        if (parent != null) {
            parent.set(symbol, value);
            return;
        }
        throw new UndefinedSymbolException(symbol);
    }

    @Override
    public void create(String symbol, Value value) {
        if (bindings.containsKey(symbol)) {
            throw new EvaluationException("symbol already defined in current scope: " + symbol);
        }
        bindings.put(symbol, value);
    }

    @Override
    public Scope branch() {
        return new DefaultScope(this);
    }

    @Override
    public void enclose(Scope parent) {
        if (this.parent != null) {
            throw new EvaluationException("scope is already enclosed");
        }
        this.parent = parent;
    }

    @Override
    public Value eval(Node node) {
        if (node instanceof LiteralNode literal) {
            return literal.value();
        }
        if (node instanceof SymbolNode symbol) {
            return get(symbol.name());
        }
        if (node instanceof ListNode list) {
            return evalList(list);
        }
        if (node instanceof ProgramNode program) {
            return evalBody(this, program.forms());
        }
        throw new EvaluationException("cannot evaluate node " + node);
    }

    private Value evalList(ListNode list) {
        if (list.isEmpty()) {
            return Value.nil();
        }

        if (list.head() instanceof SymbolNode head && SpecialForms.ALL.contains(head.name())) {
            return evalSpecialForm(head.name(), list.arguments());
        }

        Value function = eval(list.head());
        if (!(function instanceof FunctionValue callable)) {
            throw new EvaluationException("cannot call non-function value " + function);
        }

        List<Value> args = new ArrayList<>(list.arguments().size());
        for (Node arg : list.arguments()) {
            args.add(eval(arg));
        }
        return callable.call(args);
    }

    private Value evalSpecialForm(String form, List<Node> args) {
        return switch (form) {
            case SpecialForms.VAR -> evalVar(args);
            case SpecialForms.SET -> evalSet(args);
            case SpecialForms.DO -> evalBody(branch(), args);
            case SpecialForms.IF -> evalIf(args);
            case SpecialForms.AND -> evalAnd(args);
            case SpecialForms.OR -> evalOr(args);
            case SpecialForms.FUNC -> evalFunc(args);
            default -> throw new EvaluationException("unknown special form: " + form);
        };
    }

    private Value evalVar(List<Node> args) {
        if (args.isEmpty() || args.size() > 2) {
            throw new EvaluationException("var takes a symbol and an optional value");
        }
        String symbol = symbolName(args.get(0), SpecialForms.VAR);
        Value value = args.size() == 2 ? eval(args.get(1)) : Value.nil();
        create(symbol, value);
        return value;
    }

    private Value evalSet(List<Node> args) {
        if (args.size() != 2) {
            throw new EvaluationException("set takes a symbol and a value");
        }
        String symbol = symbolName(args.get(0), SpecialForms.SET);
        Value value = eval(args.get(1));
        set(symbol, value);
        return value;
    }

    private Value evalIf(List<Node> args) {
        if (args.size() < 2 || args.size() > 3) {
            throw new EvaluationException("if takes a condition, a then branch and an optional else branch");
        }
        if (eval(args.get(0)).isTruthy()) {
            return eval(args.get(1));
        }
        return args.size() == 3 ? eval(args.get(2)) : Value.nil();
    }

    private Value evalAnd(List<Node> args) {
        Value result = Value.of(true);
        for (Node arg : args) {
            result = eval(arg);
            if (!result.isTruthy()) {
                return result;
            }
        }
        return result;
    }

    private Value evalOr(List<Node> args) {
        Value result = Value.of(false);
        for (Node arg : args) {
            result = eval(arg);
            if (result.isTruthy()) {
                return result;
            }
        }
        return result;
    }

    // (func name (params...) body...) or (func (params...) body...)
    private Value evalFunc(List<Node> args) {
        int index = 0;
        String name = null;
        if (!args.isEmpty() && args.get(0) instanceof SymbolNode symbol) {
            name = symbol.name();
            index++;
        }
        if (index >= args.size() || !(args.get(index) instanceof ListNode paramList)) {
            throw new EvaluationException("func takes an optional name, a parameter list and a body");
        }

        List<String> params = new ArrayList<>();
        for (Node param : paramList.elements()) {
            params.add(symbolName(param, SpecialForms.FUNC));
        }
        List<Node> body = args.subList(index + 1, args.size());
        String displayName = name == null ? "lambda" : name;

        FunctionValue function = new FunctionValue(displayName, callArgs -> {
            if (callArgs.size() != params.size()) {
                throw new ArgumentException(displayName + " takes " + params.size()
                        + " argument(s), got " + callArgs.size());
            }
            Scope local = branch();
            for (int i = 0; i < params.size(); i++) {
                local.create(params.get(i), callArgs.get(i));
            }
            return evalBody(local, body);
        });

        if (name != null) {
            create(name, function);
        }
        return function;
    }

    private static Value evalBody(Scope scope, List<Node> forms) {
        Value result = Value.nil();
        for (Node form : forms) {
            result = scope.eval(form);
        }
        return result;
    }

    private static String symbolName(Node node, String form) {
        if (node instanceof SymbolNode symbol) {
            return symbol.name();
        }
        throw new EvaluationException(form + " expects a symbol, got " + node);
    }
}
