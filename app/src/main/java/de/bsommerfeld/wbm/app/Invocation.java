package de.bsommerfeld.wbm.app;

import de.bsommerfeld.wbm.core.config.ArchiveConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * A parsed {@code wbm} command line. Global options must precede the command;
 * everything after it is an operand.
 *
 * <pre>
 * wbm [--config &lt;file&gt;] [--dir &lt;store&gt;] [--db &lt;file&gt;] [-p &lt;n&gt;] [-v] &lt;command&gt; [operands]
 * </pre>
 */
public record Invocation(Path configPath, Path storeDir, Path databasePath, Integer parallelism,
        boolean verbose, Command command, List<String> operands) {

    public Invocation {
        operands = List.copyOf(operands);
    }

    public static Invocation parse(String[] args) throws UsageException {
        Path configPath = null;
        Path storeDir = null;
        Path databasePath = null;
        Integer parallelism = null;
        boolean verbose = false;

        int i = 0;
        while (i < args.length && args[i].startsWith("-")) {
            String option = args[i];
            switch (option) {
                case "--config" -> configPath = Paths.get(value(args, i++, option));
                case "--dir" -> storeDir = Paths.get(value(args, i++, option));
                case "--db" -> databasePath = Paths.get(value(args, i++, option));
                case "-p", "--parallelism" -> parallelism = parallelism(value(args, i++, option));
                case "-v", "--verbose" -> verbose = true;
                default -> throw new UsageException("Unknown option: " + option);
            }
            i++;
        }

        if (i >= args.length) {
            throw new UsageException("Missing command");
        }
        String name = args[i++];
        Command command = Command.byName(name)
                .orElseThrow(() -> new UsageException("Unknown command: " + name));

        List<String> operands = new ArrayList<>();
        for (; i < args.length; i++) {
            operands.add(args[i]);
        }
        if (!command.accepts(operands.size())) {
            throw new UsageException("Usage: wbm " + command.usage());
        }

        return new Invocation(configPath, storeDir, databasePath, parallelism, verbose, command, operands);
    }

    /** Applies the options given on the command line over the loaded file values. */
    public void applyTo(ArchiveConfig config) {
        if (storeDir != null) {
            config.setStoreDir(storeDir);
        }
        if (databasePath != null) {
            config.setDatabasePath(databasePath);
        }
        if (parallelism != null) {
            config.setParallelism(parallelism);
        }
        if (verbose) {
            config.setDebugMode(true);
        }
    }

    public String operand(int index) {
        return operands.get(index);
    }

    public String operandOrEmpty(int index) {
        return index < operands.size() ? operands.get(index) : "";
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index + 1 >= args.length) {
            throw new UsageException("Option " + option + " requires a value");
        }
        return args[index + 1];
    }

    private static int parallelism(String value) throws UsageException {
        try {
            int n = Integer.parseInt(value);
            if (n < 1) {
                throw new UsageException("Parallelism must be at least 1: " + value);
            }
            return n;
        } catch (NumberFormatException e) {
            throw new UsageException("Parallelism is not a number: " + value);
        }
    }

    public static String usage() {
        StringBuilder sb = new StringBuilder(
                "Usage: wbm [--config <file>] [--dir <store>] [--db <file>] [-p <n>] [-v] <command>\n\nCommands:\n");
        for (Command command : Command.values()) {
            sb.append("  ").append(command.usage()).append('\n');
        }
        return sb.toString();
    }
}
