package de.bsommerfeld.wbm.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.wbm.archive.ArchiveException;
import de.bsommerfeld.wbm.core.config.ArchiveConfig;
import de.bsommerfeld.wbm.core.config.ConfigLoader;
import de.bsommerfeld.wbm.core.util.StorageUtils;
import de.bsommerfeld.wbm.db.TweetStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command line entry point of {@code wbm}. Runs the startup sequence
 * <strong>parse arguments → load config → apply overrides → wire → run</strong>
 * and maps the result to an exit code.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@code 0}: the command succeeded</li>
 * <li>{@code 1}: the command failed or reported problems</li>
 * <li>{@code 2}: the command line was malformed</li>
 * </ul>
 */
public final class WbmMain {

    private static final Logger LOG = LoggerFactory.getLogger(WbmMain.class);

    static final int EXIT_USAGE = 2;

    private WbmMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one invocation and returns its exit code instead of exiting.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Invocation invocation;
        try {
            invocation = Invocation.parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println();
            err.print(Invocation.usage());
            return EXIT_USAGE;
        }

        if (invocation.verbose()) {
            setRootLevel(Level.DEBUG);
        }

        ArchiveConfig config;
        try {
            config = loadConfig(invocation);
        } catch (IOException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage(), e);
            return CommandRunner.EXIT_FAILURE;
        }
        invocation.applyTo(config);
        if (config.isDebugMode()) {
            setRootLevel(Level.DEBUG);
        }

        Injector injector = Guice.createInjector(new ArchiveModule(config));
        CommandRunner runner = injector.getInstance(CommandRunner.class);

        try {
            return runner.run(invocation, out);
        } catch (UsageException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (ArchiveException e) {
            LOG.error("{} failed ({}): {}", invocation.command().commandName(), e.kind(), e.getMessage(), e);
            return CommandRunner.EXIT_FAILURE;
        } catch (TweetStoreException e) {
            LOG.error("{} failed: {}", invocation.command().commandName(), e.getMessage(), e);
            return CommandRunner.EXIT_FAILURE;
        } catch (ProvisionException e) {
            // Raised by the index provider when the database cannot be opened.
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("{} failed: {}", invocation.command().commandName(), cause.getMessage(), cause);
            return CommandRunner.EXIT_FAILURE;
        }
    }

    private static ArchiveConfig loadConfig(Invocation invocation) throws IOException {
        Path configPath = invocation.configPath() != null
                ? invocation.configPath()
                : StorageUtils.getDefaultConfigPath();
        LOG.debug("Loading configuration from {}", configPath.toAbsolutePath());
        return ConfigLoader.load(configPath);
    }

    /** Lowers or raises the root logger; a no-op when logback is not the binding. */
    static void setRootLevel(Level level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }
}
