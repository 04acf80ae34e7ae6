package com.trigger.lisp;

import com.trigger.exception.ArgumentException;
import com.trigger.exception.EvaluationException;
import com.trigger.value.FloatValue;
import com.trigger.value.IntegerValue;
import com.trigger.value.StringValue;
import com.trigger.value.Value;
import com.trigger.value.ValueType;

import java.util.List;
import java.util.function.IntPredicate;

/**
 * Functions available to every rule: arithmetic, comparison, logic and strings.
 * <p>
 * Integer arithmetic stays integral; any float operand promotes the result to float.
 */
final class StandardLibrary {

    private StandardLibrary() {
    }

    static void register(Scope scope) {
        define(scope, "+", StandardLibrary::add);
        define(scope, "-", StandardLibrary::subtract);
        define(scope, "*", StandardLibrary::multiply);
        define(scope, "/", StandardLibrary::divide);
        define(scope, "==", StandardLibrary::equal);
        define(scope, "!=", StandardLibrary::notEqual);
        define(scope, "<", args -> compare("<", args, c -> c < 0));
        define(scope, "<=", args -> compare("<=", args, c -> c <= 0));
        define(scope, ">", args -> compare(">", args, c -> c > 0));
        define(scope, ">=", args -> compare(">=", args, c -> c >= 0));
        define(scope, "not", StandardLibrary::not);
        define(scope, "string", StandardLibrary::string);
        define(scope, "error", StandardLibrary::error);
    }

    private static void define(Scope scope, String name, Callable callable) {
        scope.create(name, new FunctionValue(name, callable));
    }

    private static Value add(List<Value> args) {
        if (!args.isEmpty() && args.stream().allMatch(a -> a.type() == ValueType.STRING)) {
            StringBuilder sb = new StringBuilder();
            args.forEach(a -> sb.append(((StringValue) a).value()));
            return Value.of(sb.toString());
        }
        requireNumbers("+", args);
        if (anyFloat(args)) {
            double sum = 0;
            for (Value arg : args) {
                sum += asDouble(arg);
            }
            return Value.of(sum);
        }
        long sum = 0;
        for (Value arg : args) {
            sum += ((IntegerValue) arg).value();
        }
        return Value.of(sum);
    }

    private static Value subtract(List<Value> args) {
        requireAtLeast("-", args, 1);
        requireNumbers("-", args);
        if (args.size() == 1) {
            Value only = args.get(0);
            return only instanceof IntegerValue i ? Value.of(-i.value()) : Value.of(-asDouble(only));
        }
        if (anyFloat(args)) {
            double result = asDouble(args.get(0));
            for (Value arg : args.subList(1, args.size())) {
                result -= asDouble(arg);
            }
            return Value.of(result);
        }
        long result = ((IntegerValue) args.get(0)).value();
        for (Value arg : args.subList(1, args.size())) {
            result -= ((IntegerValue) arg).value();
        }
        return Value.of(result);
    }

    private static Value multiply(List<Value> args) {
        requireNumbers("*", args);
        if (anyFloat(args)) {
            double product = 1;
            for (Value arg : args) {
                product *= asDouble(arg);
            }
            return Value.of(product);
        }
        long product = 1;
        for (Value arg : args) {
            product *= ((IntegerValue) arg).value();
        }
        return Value.of(product);
    }

    private static Value divide(List<Value> args) {
        requireAtLeast("/", args, 2);
        requireNumbers("/", args);
        if (anyFloat(args)) {
            double result = asDouble(args.get(0));
            for (Value arg : args.subList(1, args.size())) {
                result /= asDouble(arg);
            }
            return Value.of(result);
        }
        long result = ((IntegerValue) args.get(0)).value();
        for (Value arg : args.subList(1, args.size())) {
            long divisor = ((IntegerValue) arg).value();
            if (divisor == 0) {
                throw new EvaluationException("division by zero");
            }
            result /= divisor;
        }
        return Value.of(result);
    }

    private static Value equal(List<Value> args) {
        requireAtLeast("==", args, 2);
        Value first = args.get(0);
        for (Value arg : args.subList(1, args.size())) {
            if (!first.equals(arg)) {
                return Value.of(false);
            }
        }
        return Value.of(true);
    }

    private static Value notEqual(List<Value> args) {
        requireExactly("!=", args, 2);
        return Value.of(!args.get(0).equals(args.get(1)));
    }

    private static Value compare(String name, List<Value> args, IntPredicate test) {
        requireExactly(name, args, 2);
        Value left = args.get(0);
        Value right = args.get(1);
        int comparison;
        if (left instanceof IntegerValue l && right instanceof IntegerValue r) {
            comparison = Long.compare(l.value(), r.value());
        } else if (isNumber(left) && isNumber(right)) {
            comparison = Double.compare(asDouble(left), asDouble(right));
        } else if (left instanceof StringValue l && right instanceof StringValue r) {
            comparison = l.value().compareTo(r.value());
        } else {
            throw new ArgumentException(name + " cannot compare " + left + " and " + right);
        }
        return Value.of(test.test(comparison));
    }

    private static Value not(List<Value> args) {
        requireExactly("not", args, 1);
        return Value.of(!args.get(0).isTruthy());
    }

    private static Value string(List<Value> args) {
        StringBuilder sb = new StringBuilder();
        args.forEach(a -> sb.append(a.display()));
        return Value.of(sb.toString());
    }

    private static Value error(List<Value> args) {
        if (args.size() != 1 || !(args.get(0) instanceof StringValue message)) {
            throw new ArgumentException("error takes a single string argument");
        }
        throw new EvaluationException(message.value());
    }

    private static void requireAtLeast(String name, List<Value> args, int count) {
        if (args.size() < count) {
            throw new ArgumentException(name + " takes at least " + count + " argument(s)");
        }
    }

    private static void requireExactly(String name, List<Value> args, int count) {
        if (args.size() != count) {
            throw new ArgumentException(name + " takes " + count + " argument(s), got " + args.size());
        }
    }

    private static void requireNumbers(String name, List<Value> args) {
        for (Value arg : args) {
            if (!isNumber(arg)) {
                throw new ArgumentException(name + " only takes numeric arguments, got " + arg);
            }
        }
    }

    private static boolean isNumber(Value value) {
        return value.type() == ValueType.INTEGER || value.type() == ValueType.FLOAT;
    }

    private static boolean anyFloat(List<Value> args) {
        return args.stream().anyMatch(a -> a.type() == ValueType.FLOAT);
    }

    private static double asDouble(Value value) {
        if (value instanceof IntegerValue i) {
            return i.value();
        }
        return ((FloatValue) value).value();
    }
}
