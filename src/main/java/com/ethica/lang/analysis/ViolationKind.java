package com.ethica.lang.analysis;

/**
 * Every policy violation an analysis pass can report. Blocking kinds fail
 * their pass; advisory kinds are reported but never prevent execution.
 */
public enum ViolationKind {
    // energy
    BUDGET_EXCEEDED("budget_exceeded", PassName.ENERGY, true),
    RECURSION_DETECTED("recursion_detected", PassName.ENERGY, false),
    EXCESSIVE_NESTING("excessive_nesting", PassName.ENERGY, false),
    UNBOUNDED_LOOP("unbounded_loop", PassName.ENERGY, false),
    HIGH_ITERATION_LOOP("high_iteration_loop", PassName.ENERGY, false),

    // ethics
    MISSING_CONSENT_ANNOTATION("missing_consent_annotation", PassName.ETHICS, true),
    MISSING_PROTECTION_ANNOTATION("missing_protection_annotation", PassName.ETHICS, true),
    DISALLOWED_OPERATION("disallowed_operation", PassName.ETHICS, true),
    UNAUTHORIZED_SENSITIVE_CALL("unauthorized_sensitive_call", PassName.ETHICS, true),
    UNAUTHORIZED_DATA_OPERATION("unauthorized_data_operation", PassName.ETHICS, true),
    DISALLOWED_OPERATION_CALL("disallowed_operation_call", PassName.ETHICS, true),
    UNPROTECTED_SENSITIVE_DATA("unprotected_sensitive_data", PassName.ETHICS, true),
    HARDCODED_SECRET("hardcoded_secret", PassName.ETHICS, true),

    // readability
    LOW_READABILITY("low_readability", PassName.READABILITY, true),
    HIGH_COMPLEXITY("high_complexity", PassName.READABILITY, false),
    DEEP_NESTING("deep_nesting", PassName.READABILITY, false),
    LONG_FUNCTION("long_function", PassName.READABILITY, false),
    POOR_NAMING("poor_naming", PassName.READABILITY, false),
    SHORT_VARIABLE_NAME("short_variable_name", PassName.READABILITY, false),
    NON_DESCRIPTIVE_NAME("non_descriptive_name", PassName.READABILITY, false),

    // cleverness
    TOO_MANY_PARAMETERS("too_many_parameters", PassName.CLEVERNESS, true),
    COMPLEX_ONE_LINER("complex_one_liner", PassName.CLEVERNESS, true),
    COMPLEX_ASSIGNMENT("complex_assignment", PassName.CLEVERNESS, true),
    DENSE_EXPRESSION("dense_expression", PassName.CLEVERNESS, true),
    CHAINED_COMPARISONS("chained_comparisons", PassName.CLEVERNESS, true),
    BITWISE_OPERATION("bitwise_operation", PassName.CLEVERNESS, true),
    MAGIC_NUMBER("magic_number", PassName.CLEVERNESS, true),
    COMPLEX_LIST_LITERAL("complex_list_literal", PassName.CLEVERNESS, true),
    COMPLEX_CONDITION("complex_condition", PassName.CLEVERNESS, true),
    COMPLEX_LOOP_CONDITION("complex_loop_condition", PassName.CLEVERNESS, true),
    COMPLEX_ITERABLE("complex_iterable", PassName.CLEVERNESS, true),
    COMPLEX_RETURN("complex_return", PassName.CLEVERNESS, true),
    TOO_MANY_ARGUMENTS("too_many_arguments", PassName.CLEVERNESS, true),
    EXCESSIVE_CHAINING("excessive_chaining", PassName.CLEVERNESS, true),
    EXCESSIVE_MEMBER_CHAINING("excessive_member_chaining", PassName.CLEVERNESS, true);

    public final String code;
    public final PassName pass;
    public final boolean blocking;

    ViolationKind(String code, PassName pass, boolean blocking) {
        this.code = code;
        this.pass = pass;
        this.blocking = blocking;
    }

    public static ViolationKind fromCode(String code) {
        for (ViolationKind k : values()) {
            if (k.code.equals(code)) return k;
        }
        throw new IllegalArgumentException("Unknown violation kind: " + code);
    }
}
