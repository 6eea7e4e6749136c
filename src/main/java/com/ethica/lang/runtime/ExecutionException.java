package com.ethica.lang.runtime;

import com.ethica.lang.EthicaException;

/** A fault raised while interpreting a program. */
public class ExecutionException extends EthicaException {

    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
