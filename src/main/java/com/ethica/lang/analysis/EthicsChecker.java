package com.ethica.lang.analysis;

import java.util.Locale;
import java.util.Map;

import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.FunctionCall;
import com.ethica.lang.parser.Ast.FunctionDef;
import com.ethica.lang.parser.Ast.Literal;
import com.ethica.lang.parser.Ast.LiteralKind;

/**
 * Requires consent/protection annotations around sensitive operations and
 * refuses operations the policy disallows outright.
 */
public class EthicsChecker extends AnalysisPass {
    private static final int PREVIEW_LENGTH = 30;

    private final EthicsPolicy policy;

    /** The function whose body is being walked, null at top level. */
    private FunctionDef enclosing;

    public EthicsChecker(EthicsConfig config) {
        super(PassName.ETHICS, config.strict());
        this.policy = config.policy();
    }

    @Override
    protected void reset() {
        enclosing = null;
    }

    @Override
    protected void finish(Map<String, Object> metrics) {
        metrics.put("strict_mode", isStrict());
        metrics.put("violation_count", violations().size());
    }

    private boolean enclosingHas(String annotation) {
        return enclosing != null && enclosing.hasAnnotation(annotation);
    }

    @Override
    public Walk visitFunctionDef(FunctionDef node) {
        FunctionDef previous = enclosing;
        String previousName = currentFunction;
        enclosing = node;
        currentFunction = node.name();
        try {
            if (checkDefinition(node).halted()) return Walk.HALT;
            return walkBlock(node.body());
        } finally {
            enclosing = previous;
            currentFunction = previousName;
        }
    }

    private Walk checkDefinition(FunctionDef node) {
        String name = node.name();

        if (policy.consentRequired().contains(name) && !node.hasAnnotation(policy.consentAnnotation())) {
            Walk w = report(ViolationKind.MISSING_CONSENT_ANNOTATION,
                    "Function \"" + name + "\" collects sensitive data but lacks @" + policy.consentAnnotation() + " annotation",
                    details("required_annotation", policy.consentAnnotation()));
            if (w.halted()) return w;
        }

        if (policy.protectionRequired().contains(name) && !node.hasAnnotation(policy.protectionAnnotation())) {
            Walk w = report(ViolationKind.MISSING_PROTECTION_ANNOTATION,
                    "Function \"" + name + "\" handles sensitive data but lacks @" + policy.protectionAnnotation() + " annotation",
                    details("required_annotation", policy.protectionAnnotation()));
            if (w.halted()) return w;
        }

        String lowered = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : policy.disallowed().entrySet()) {
            if (lowered.contains(e.getKey())) {
                Walk w = report(ViolationKind.DISALLOWED_OPERATION,
                        "Function \"" + name + "\" performs disallowed operation: " + e.getValue(),
                        details("operation", e.getKey()));
                if (w.halted()) return w;
            }
        }
        return Walk.CONTINUE;
    }

    @Override
    public Walk visitFunctionCall(FunctionCall node) {
        String name = node.calleeName();
        if (name != null) {
            if (policy.consentRequired().contains(name) && !enclosingHas(policy.consentAnnotation())) {
                Walk w = report(ViolationKind.UNAUTHORIZED_SENSITIVE_CALL,
                        "Calling \"" + name + "\" requires the containing function to have @" + policy.consentAnnotation(),
                        details("called_function", name));
                if (w.halted()) return w;
            }

            if (policy.protectionRequired().contains(name) && !enclosingHas(policy.protectionAnnotation())) {
                Walk w = report(ViolationKind.UNAUTHORIZED_DATA_OPERATION,
                        "Calling \"" + name + "\" requires the containing function to have @" + policy.protectionAnnotation(),
                        details("called_function", name));
                if (w.halted()) return w;
            }

            String lowered = name.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> e : policy.disallowed().entrySet()) {
                if (lowered.contains(e.getKey())) {
                    Walk w = report(ViolationKind.DISALLOWED_OPERATION_CALL,
                            "Calling \"" + name + "\": " + e.getValue(),
                            details("operation", e.getKey()));
                    if (w.halted()) return w;
                }
            }
        }
        return super.visitFunctionCall(node);
    }

    @Override
    public Walk visitAssignment(Assignment node) {
        String lowered = node.name().toLowerCase(Locale.ROOT);
        for (String hint : policy.sensitiveVariableHints()) {
            if (lowered.contains(hint) && !enclosingHas(policy.protectionAnnotation())) {
                Walk w = report(ViolationKind.UNPROTECTED_SENSITIVE_DATA,
                        "Variable \"" + node.name() + "\" appears to contain sensitive data but function lacks @"
                                + policy.protectionAnnotation(),
                        details("variable", node.name(), "hint", hint));
                if (w.halted()) return w;
            }
        }
        return walk(node.value());
    }

    @Override
    public Walk visitLiteral(Literal node) {
        if (node.kind() != LiteralKind.STRING) return Walk.CONTINUE;

        String text = (String) node.value();
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String hint : policy.secretHints()) {
            if (lowered.contains(hint)) {
                String preview = text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text;
                return report(ViolationKind.HARDCODED_SECRET,
                        "Potential hardcoded secret detected: \"" + preview + "\"",
                        details("value_preview", preview, "hint", hint));
            }
        }
        return Walk.CONTINUE;
    }
}
