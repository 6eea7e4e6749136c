package com.ethica.lang.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One reported policy violation. Data, never thrown. */
public final class Violation {
    public final ViolationKind kind;
    public final String message;
    /** Enclosing function name, or null at top level. */
    public final String function;
    public final Map<String, Object> details;

    public Violation(ViolationKind kind, String message, String function, Map<String, Object> details) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.function = function;
        this.details = (details == null || details.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String code() { return kind.code; }

    public boolean isBlocking() { return kind.blocking; }

    @Override
    public String toString() {
        String where = (function == null) ? "" : " (in " + function + ")";
        return kind.code + ": " + message + where;
    }
}
