package de.bsommerfeld.wbm.app;

import java.util.Arrays;
import java.util.Optional;

/**
 * Subcommands of {@code wbm}, with the operand counts each accepts.
 */
public enum Command {

    CREATE("create", 0, 0, ""),
    EXTRACT("extract", 1, 1, "<digest>"),
    LIST("list", 0, 1, "[prefix]"),
    DIGESTS("digests", 0, 1, "[prefix]"),
    DIGESTS_RAW("digests-raw", 1, 1, "<dir>"),
    ADD_FILE("add-file", 1, 1, "<input>"),
    INIT_INDEX("init-index", 0, 0, ""),
    TWEETS("tweets", 1, Integer.MAX_VALUE, "<id>..."),
    USERS("users", 0, 0, "");

    private final String name;
    private final int minOperands;
    private final int maxOperands;
    private final String synopsis;

    Command(String name, int minOperands, int maxOperands, String synopsis) {
        this.name = name;
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
        this.synopsis = synopsis;
    }

    public String commandName() {
        return name;
    }

    public boolean accepts(int operands) {
        return operands >= minOperands && operands <= maxOperands;
    }

    /** Whether the command opens the tweet index. */
    public boolean usesIndex() {
        return this == INIT_INDEX || this == TWEETS || this == USERS;
    }

    public String usage() {
        return synopsis.isEmpty() ? name : name + " " + synopsis;
    }

    public static Optional<Command> byName(String name) {
        return Arrays.stream(values()).filter(c -> c.name.equals(name)).findFirst();
    }
}
