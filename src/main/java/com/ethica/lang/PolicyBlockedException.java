package com.ethica.lang;

/** Thrown by {@link EthicaLang#run} when compilation did not clear every enabled pass. */
public class PolicyBlockedException extends EthicaException {
    private final transient CompilationResult result;

    public PolicyBlockedException(CompilationResult result) {
        super("Execution blocked: " + result.blockingViolations().size() + " blocking violation(s)");
        this.result = result;
    }

    public CompilationResult result() {
        return result;
    }
}
