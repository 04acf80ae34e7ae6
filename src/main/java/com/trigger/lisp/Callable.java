package com.trigger.lisp;

import com.trigger.value.Value;

import java.util.List;

/**
 * A function invokable from rule code. Arguments arrive already evaluated.
 */
@FunctionalInterface
public interface Callable {

    Value call(List<Value> args);
}
