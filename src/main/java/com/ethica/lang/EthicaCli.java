package com.ethica.lang;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ethica.debug.Debug;
import com.ethica.debug.DebugLevel;
import com.ethica.lang.analysis.AnalysisConfig;
import com.ethica.lang.analysis.AnalysisReport;
import com.ethica.lang.analysis.Violation;
import com.ethica.lang.parser.Ast.Node;
import com.ethica.lang.parser.Token;
import com.ethica.lang.report.ReportJson;
import com.ethica.lang.runtime.ExecutionException;
import com.ethica.lang.runtime.Value;

/**
 * Command-line front end.
 *
 * <pre>
 *   ethica run|check|analyze &lt;file&gt; [--verbose] [--show-tokens] [--show-ast]
 *          [--no-energy] [--no-ethics] [--no-readability] [--no-cleverness]
 *          [--energy-budget N] [--min-readability N] [--config file.json] [--json]
 * </pre>
 *
 * Exit codes: 0 success, 1 blocked or failed, 2 usage error, 3 unreadable file.
 */
public final class EthicaCli {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNREADABLE = 3;

    private static final Set<String> COMMANDS = Set.of("run", "check", "analyze");
    private static final Set<String> VALUED = Set.of("energy-budget", "min-readability", "config");
    private static final Set<String> SWITCHES = Set.of("verbose", "show-tokens", "show-ast", "json",
            "no-energy", "no-ethics", "no-readability", "no-cleverness");

    private static final String USAGE =
            "Usage: ethica run|check|analyze <file> [--verbose] [--show-tokens] [--show-ast]\n"
          + "       [--no-energy] [--no-ethics] [--no-readability] [--no-cleverness]\n"
          + "       [--energy-budget N] [--min-readability N] [--config file.json] [--json]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    private EthicaCli() {}

    /** Runs one command and returns its exit code. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        Map<String, String> flags;
        try {
            flags = parseArgs(args, positional);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (positional.size() != 2 || !COMMANDS.contains(positional.get(0))) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = positional.get(0);
        Path scriptPath = Path.of(positional.get(1));

        if (flags.containsKey("verbose")) {
            Debug.useSysOut();
            Debug.get().setThreshold(DebugLevel.DEBUG);
        }

        AnalysisConfig config;
        try {
            config = buildConfig(flags);
        } catch (IOException e) {
            err.println("Failed to read config file: " + flags.get("config"));
            return EXIT_UNREADABLE;
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        final String source;
        try {
            source = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            return EXIT_UNREADABLE;
        }

        EthicaLang engine = new EthicaLang(config);
        engine.setOutput(out::println);
        boolean json = flags.containsKey("json");

        CompilationResult result = engine.compile(source);

        if (flags.containsKey("show-tokens") && !json) {
            for (Token t : result.tokens) out.println(t);
        }
        if (flags.containsKey("show-ast") && result.program != null && !json) {
            for (Node stmt : result.program.statements()) out.println(stmt);
        }

        if (result.hasFault()) {
            if (json) out.println(ReportJson.pretty(result, null));
            else err.println(result.fault.getClass().getSimpleName() + ": " + result.fault.getMessage());
            return EXIT_FAILED;
        }

        boolean printAll = command.equals("analyze") || flags.containsKey("verbose");
        if (!json) printReports(result, printAll, out);

        if (result.isBlocked()) {
            if (json) out.println(ReportJson.pretty(result, null));
            else err.println("Compilation blocked: " + result.blockingViolations().size() + " blocking violation(s)");
            return EXIT_FAILED;
        }

        if (!command.equals("run")) {
            if (json) out.println(ReportJson.pretty(result, null));
            else out.println("Compilation successful");
            return EXIT_OK;
        }

        try {
            Value value = engine.execute(result.program);
            if (json) out.println(ReportJson.pretty(result, value));
            return EXIT_OK;
        } catch (ExecutionException e) {
            if (json) out.println(ReportJson.pretty(ReportJson.executionFailure(result, e)));
            else err.println("ExecutionException: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static AnalysisConfig buildConfig(Map<String, String> flags) throws IOException {
        AnalysisConfig config = AnalysisConfig.defaults();
        String file = flags.get("config");
        if (file != null) {
            config = AnalysisConfig.fromJson(Files.readString(Path.of(file), StandardCharsets.UTF_8));
        }

        if (flags.containsKey("energy-budget")) {
            config = config.withEnergy(config.energy().withBudget(parseLong("energy-budget", flags.get("energy-budget"))));
        }
        if (flags.containsKey("min-readability")) {
            config = config.withReadability(
                    config.readability().withMinScore(parseDouble("min-readability", flags.get("min-readability"))));
        }

        if (flags.containsKey("no-energy")) config = config.withEnergy(config.energy().withEnabled(false));
        if (flags.containsKey("no-ethics")) config = config.withEthics(config.ethics().withEnabled(false));
        if (flags.containsKey("no-readability")) config = config.withReadability(config.readability().withEnabled(false));
        if (flags.containsKey("no-cleverness")) config = config.withCleverness(config.cleverness().withEnabled(false));
        return config;
    }

    private static void printReports(CompilationResult result, boolean all, PrintStream out) {
        for (AnalysisReport r : result.reports) {
            if (!all && r.passed && r.violations.isEmpty()) continue;
            out.println("[" + r.pass.id + "] " + (r.passed ? "PASSED" : "FAILED"));
            for (Violation v : r.violations) {
                out.println("  " + (v.isBlocking() ? "error" : "note") + " " + v);
            }
            if (all) {
                for (Map.Entry<String, Object> m : r.metrics.entrySet()) {
                    out.println("  " + m.getKey() + " = " + m.getValue());
                }
            }
        }
    }

    private static long parseLong(String flag, String v) {
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + flag + " expects an integer, got '" + v + "'");
        }
    }

    private static double parseDouble(String flag, String v) {
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + flag + " expects a number, got '" + v + "'");
        }
    }

    /**
     * Minimal arg parser:
     *   --energy-budget=500 or --energy-budget 500
     *   --json --verbose
     * Anything not starting with "--" is positional.
     */
    static Map<String, String> parseArgs(String[] args, List<String> positional) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                positional.add(a);
                continue;
            }
            String key;
            String value;
            int eq = a.indexOf('=');
            if (eq >= 0) {
                key = a.substring(2, eq);
                value = a.substring(eq + 1);
            } else {
                key = a.substring(2);
                value = null;
            }

            if (VALUED.contains(key)) {
                if (value == null) {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("--" + key + " requires a value");
                    value = args[++i];
                }
                out.put(key, value);
            } else if (SWITCHES.contains(key)) {
                if (value != null) throw new IllegalArgumentException("--" + key + " takes no value");
                out.put(key, "true");
            } else {
                throw new IllegalArgumentException("Unknown option: --" + key);
            }
        }
        return out;
    }
}
