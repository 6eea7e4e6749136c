package com.ethica.lang;

/** Root of every fault raised by the EthicaLang pipeline. */
public class EthicaException extends RuntimeException {

    public EthicaException(String message) {
        super(message);
    }

    public EthicaException(String message, Throwable cause) {
        super(message, cause);
    }
}
