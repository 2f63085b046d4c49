package schemamigrator.cli;

import schemamigrator.exceptions.DatabaseException;
import schemamigrator.exceptions.MigrationException;
import schemamigrator.runner.MigrationRunner;
import schemamigrator.runner.MigrationStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command line front end over a {@link MigrationRunner}.
 *
 * <pre>
 * migrate  [--pretend]
 * rollback [--steps=N] [--pretend]
 * reset    [--pretend]
 * refresh  [--pretend]
 * status
 * generate &lt;name&gt; [--table=T] [--create]
 * help
 * </pre>
 *
 * <p>Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_FAILURE} when the
 * runner raises a {@link MigrationException} or a {@link DatabaseException},
 * {@value #EXIT_USAGE} for bad arguments.
 */
public final class MigrationCommandLine {

    private static final Logger log = LoggerFactory.getLogger(MigrationCommandLine.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final Map<String, Set<String>> OPTIONS = Map.of(
            "migrate", Set.of("pretend"),
            "rollback", Set.of("steps", "pretend"),
            "reset", Set.of("pretend"),
            "refresh", Set.of("pretend"),
            "status", Set.of(),
            "generate", Set.of("table", "create"),
            "help", Set.of());

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: <command> [options]",
            "",
            "Commands:",
            "  migrate  [--pretend]                  Apply all pending migrations",
            "  rollback [--steps=N] [--pretend]      Revert the last N batches (default 1)",
            "  reset    [--pretend]                  Revert every applied migration",
            "  refresh  [--pretend]                  Reset, then migrate",
            "  status                                List migrations and whether they ran",
            "  generate <name> [--table=T] [--create] Write a new migration source file",
            "  help                                  Show this message");

    private final MigrationRunner runner;
    private final PrintStream out;
    private final PrintStream err;

    public MigrationCommandLine(MigrationRunner runner) {
        this(runner, System.out, System.err);
    }

    public MigrationCommandLine(MigrationRunner runner, PrintStream out, PrintStream err) {
        this.runner = runner;
        this.out = out;
        this.err = err;
    }

    /**
     * Run one command.
     *
     * @param args command followed by its arguments
     * @return process exit code
     */
    public int execute(String... args) {
        Arguments parsed;
        try {
            parsed = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            switch (parsed.command) {
                case "migrate":
                    printNames(runner.migrate(parsed.flag("pretend")),
                            parsed.flag("pretend") ? "Would migrate" : "Migrated", "Nothing to migrate.");
                    break;
                case "rollback":
                    printNames(runner.rollback(parsed.intOption("steps", 1), parsed.flag("pretend")),
                            parsed.flag("pretend") ? "Would roll back" : "Rolled back", "Nothing to rollback.");
                    break;
                case "reset":
                    printNames(runner.reset(parsed.flag("pretend")),
                            parsed.flag("pretend") ? "Would roll back" : "Rolled back", "Nothing to reset.");
                    break;
                case "refresh":
                    printNames(runner.refresh(parsed.flag("pretend")),
                            parsed.flag("pretend") ? "Would migrate" : "Migrated", "Nothing to migrate.");
                    break;
                case "status":
                    printStatus(runner.status());
                    break;
                case "generate":
                    Path file = runner.generate(parsed.positional.get(0),
                            parsed.options.get("table"), parsed.flag("create"));
                    out.println("Created migration: " + file);
                    break;
                case "help":
                    out.println(USAGE);
                    break;
                default:
                    throw new IllegalStateException("Unhandled command " + parsed.command);
            }
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (MigrationException e) {
            log.debug("Command {} failed", parsed.command, e);
            err.println("Error: " + e.getMessage());
            if (e.getMigrationName() != null) {
                err.println("Migration: " + e.getMigrationName());
            }
            printRetryHint(e.isRetryable());
            return EXIT_FAILURE;
        } catch (DatabaseException e) {
            // bookkeeping reads and writes outside a migration body
            log.debug("Command {} failed in the database", parsed.command, e);
            err.println("Error: " + e.getMessage());
            printRetryHint(e.isRetryable());
            return EXIT_FAILURE;
        }
    }

    private void printRetryHint(boolean retryable) {
        if (retryable) {
            err.println("The failure looks transient (deadlock or lock timeout); re-run the same command.");
        }
    }

    private void printNames(List<String> names, String verb, String nothing) {
        if (names.isEmpty()) {
            out.println(nothing);
            return;
        }
        for (String name : names) {
            out.println(verb + ": " + name);
        }
    }

    private void printStatus(List<MigrationStatus> statuses) {
        if (statuses.isEmpty()) {
            out.println("No migrations registered.");
            return;
        }
        int width = "Migration".length();
        for (MigrationStatus s : statuses) {
            width = Math.max(width, s.name().length());
        }
        String format = "%-" + width + "s  %-4s  %s%n";
        out.printf(format, "Migration", "Ran?", "Batch");
        for (MigrationStatus s : statuses) {
            out.printf(format, s.name(), s.ran() ? "Yes" : "No", s.batch() == null ? "-" : s.batch());
        }
    }

    /** Parsed command, {@code --key=value} options, {@code --flag} switches and positionals. */
    static final class Arguments {
        final String command;
        final Map<String, String> options;
        final List<String> positional;

        private Arguments(String command, Map<String, String> options, List<String> positional) {
            this.command = command;
            this.options = options;
            this.positional = positional;
        }

        static Arguments parse(String... args) {
            if (args == null || args.length == 0) {
                throw new IllegalArgumentException("no command given");
            }
            String command = args[0];
            Set<String> allowed = OPTIONS.get(command);
            if (allowed == null) {
                throw new IllegalArgumentException("unknown command: " + command);
            }

            Map<String, String> options = new LinkedHashMap<>();
            List<String> positional = new ArrayList<>();
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--")) {
                    int eq = arg.indexOf('=');
                    String key = eq < 0 ? arg.substring(2) : arg.substring(2, eq);
                    String value = eq < 0 ? "true" : arg.substring(eq + 1);
                    if (!allowed.contains(key)) {
                        throw new IllegalArgumentException("unknown option for " + command + ": --" + key);
                    }
                    options.put(key, value);
                } else {
                    positional.add(arg);
                }
            }

            int expectedPositional = command.equals("generate") ? 1 : 0;
            if (positional.size() != expectedPositional) {
                throw new IllegalArgumentException(expectedPositional == 1
                        ? "generate needs exactly one migration name"
                        : command + " takes no positional arguments");
            }
            return new Arguments(command, options, positional);
        }

        boolean flag(String name) {
            return Boolean.parseBoolean(options.get(name));
        }

        int intOption(String name, int defaultValue) {
            String value = options.get(name);
            if (value == null) return defaultValue;
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < 1) {
                    throw new IllegalArgumentException("--" + name + " must be a positive integer, got " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + name + " must be a positive integer, got " + value);
            }
        }
    }
}
