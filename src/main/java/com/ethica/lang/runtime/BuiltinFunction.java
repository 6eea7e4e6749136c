package com.ethica.lang.runtime;

import java.util.List;

/** Functional interface for built-in (host) functions. */
@FunctionalInterface
public interface BuiltinFunction {
    Value call(List<Value> args);
}
