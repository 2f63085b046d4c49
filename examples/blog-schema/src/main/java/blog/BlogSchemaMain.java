package blog;

import schemamigrator.cli.MigrationCommandLine;
import schemamigrator.config.MigrationConfigLoader;
import schemamigrator.exceptions.MigrationException;
import schemamigrator.port.SchemaPort;
import schemamigrator.port.memory.InMemorySchemaPort;
import schemamigrator.runner.MigrationRunner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a sequence of migration commands against an in-memory blog database.
 *
 * <p>The store lives only as long as the process, so each argument is one whole
 * command and they run in order:
 * <pre>
 * BlogSchemaMain "migrate" "status" "rollback --steps=1" "status"
 * </pre>
 * Without arguments it runs {@code migrate} then {@code status}. Stops at the
 * first command that fails and exits with its code.
 *
 * @see MigrationCommandLine
 */
public class BlogSchemaMain {

    private static final Logger log = LoggerFactory.getLogger(BlogSchemaMain.class);

    public static void main(String[] args) {
        int code = run(args.length == 0 ? new String[] {"migrate", "status"} : args);
        if (code != MigrationCommandLine.EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String... commands) {
        return run(new InMemorySchemaPort(), commands);
    }

    static int run(SchemaPort port, String... commands) {
        try (MigrationRunner runner = new MigrationRunner(port, MigrationConfigLoader.load())) {
            try {
                int loaded = runner.loadMigrations();
                log.info("Loaded {} migration(s)", loaded);
            } catch (MigrationException e) {
                log.error("Cannot load migrations: {}", e.getMessage(), e);
                return MigrationCommandLine.EXIT_FAILURE;
            }

            MigrationCommandLine cli = new MigrationCommandLine(runner);
            for (String command : commands) {
                List<String> args = new ArrayList<>(List.of(command.trim().split("\\s+")));
                System.out.println("> " + String.join(" ", args));
                int code = cli.execute(args.toArray(new String[0]));
                if (code != MigrationCommandLine.EXIT_OK) {
                    return code;
                }
            }
            return MigrationCommandLine.EXIT_OK;
        }
    }
}
