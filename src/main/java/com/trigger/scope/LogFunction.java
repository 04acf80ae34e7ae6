package com.trigger.scope;

import com.trigger.exception.ArgumentException;
import com.trigger.lisp.Callable;
import com.trigger.value.StringValue;
import com.trigger.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@code (log "message")}: writes a line to the {@code rules} logger. Returns {@code nil}.
 */
class LogFunction implements Callable {

    static final String LOGGER_NAME = "rules";

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public Value call(List<Value> args) {
        if (args.size() != 1) {
            throw new ArgumentException("log takes a single string argument, got " + args.size() + " arguments");
        }
        if (!(args.get(0) instanceof StringValue message)) {
            throw new ArgumentException("log takes a single string argument, got " + args.get(0));
        }
        log.info(message.value());
        return Value.nil();
    }
}
