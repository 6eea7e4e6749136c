package com.ethica.lang.report;

import java.util.Locale;

import com.ethica.lang.CompilationResult;
import com.ethica.lang.analysis.AnalysisReport;
import com.ethica.lang.analysis.Violation;
import com.ethica.lang.parser.PositionedException;
import com.ethica.lang.runtime.ExecutionException;
import com.ethica.lang.runtime.Value;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** JSON rendering of compilation results. */
public final class ReportJson {
    private static final ObjectMapper om = new ObjectMapper();

    private ReportJson() {}

    public static ObjectNode toJson(CompilationResult result) {
        return toJson(result, null);
    }

    /**
     * @param value execution result, or null when the program was not run
     */
    public static ObjectNode toJson(CompilationResult result, Value value) {
        ObjectNode root = om.createObjectNode();
        root.put("stage", result.stage.name().toLowerCase(Locale.ROOT));
        root.put("success", result.isSuccess());
        root.put("blocked", result.isBlocked());

        if (result.fault != null) {
            ObjectNode fault = root.putObject("fault");
            fault.put("type", result.fault.getClass().getSimpleName());
            fault.put("message", result.fault.getMessage());
            if (result.fault instanceof PositionedException) {
                PositionedException p = (PositionedException) result.fault;
                fault.put("line", p.line());
                fault.put("column", p.column());
            }
        }

        ArrayNode passes = root.putArray("passes");
        for (AnalysisReport r : result.reports) {
            passes.add(toJson(r));
        }

        if (value != null) {
            ObjectNode v = root.putObject("result");
            v.put("type", value.typeName());
            v.put("value", value.repr());
        }
        return root;
    }

    /**
     * A compiled program whose execution failed: the analysis passes plus an
     * {@code "execute"} stage fault.
     */
    public static ObjectNode executionFailure(CompilationResult result, ExecutionException error) {
        ObjectNode root = toJson(result, null);
        root.put("stage", "execute");
        root.put("success", false);
        ObjectNode fault = root.putObject("fault");
        fault.put("type", error.getClass().getSimpleName());
        fault.put("message", error.getMessage());
        return root;
    }

    public static ObjectNode toJson(AnalysisReport report) {
        ObjectNode n = om.createObjectNode();
        n.put("pass", report.pass.id);
        n.put("passed", report.passed);
        ArrayNode vs = n.putArray("violations");
        for (Violation v : report.violations) {
            vs.add(toJson(v));
        }
        n.set("metrics", om.valueToTree(report.metrics));
        return n;
    }

    public static ObjectNode toJson(Violation v) {
        ObjectNode n = om.createObjectNode();
        n.put("type", v.code());
        n.put("blocking", v.isBlocking());
        n.put("message", v.message);
        if (v.function != null) n.put("function", v.function);
        if (!v.details.isEmpty()) n.set("details", om.valueToTree(v.details));
        return n;
    }

    public static String pretty(CompilationResult result, Value value) {
        return pretty(toJson(result, value));
    }

    public static String pretty(ObjectNode node) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render report JSON", e);
        }
    }
}
