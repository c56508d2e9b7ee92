package de.bsommerfeld.wbm.app;

import de.bsommerfeld.wbm.core.config.ArchiveConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvocationTest {

    @Test
    void parse_shouldReadGlobalOptionsBeforeCommand() throws UsageException {
        Invocation inv = Invocation.parse(new String[] {
                "--config", "c.toml", "--dir", "store", "--db", "t.db", "-p", "3", "-v", "list", "ab" });

        assertEquals(Paths.get("c.toml"), inv.configPath());
        assertEquals(Paths.get("store"), inv.storeDir());
        assertEquals(Paths.get("t.db"), inv.databasePath());
        assertEquals(Integer.valueOf(3), inv.parallelism());
        assertTrue(inv.verbose());
        assertEquals(Command.LIST, inv.command());
        assertEquals(List.of("ab"), inv.operands());
    }

    @Test
    void parse_shouldLeaveUnsetOptionsNull() throws UsageException {
        Invocation inv = Invocation.parse(new String[] { "users" });

        assertNull(inv.configPath());
        assertNull(inv.storeDir());
        assertNull(inv.parallelism());
        assertFalse(inv.verbose());
        assertTrue(inv.operands().isEmpty());
    }

    @Test
    void parse_shouldTreatDashedTokensAfterCommandAsOperands() throws UsageException {
        Invocation inv = Invocation.parse(new String[] { "tweets", "1", "-2" });

        assertEquals(List.of("1", "-2"), inv.operands());
    }

    @Test
    void parse_shouldRejectMissingCommand() {
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "-v" }));
    }

    @Test
    void parse_shouldRejectUnknownCommand() {
        UsageException e = assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "purge" }));
        assertTrue(e.getMessage().contains("purge"));
    }

    @Test
    void parse_shouldRejectUnknownOption() {
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "--force", "create" }));
    }

    @Test
    void parse_shouldRejectOptionWithoutValue() {
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "--dir" }));
    }

    @Test
    void parse_shouldRejectBadParallelism() {
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "-p", "0", "digests" }));
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "-p", "many", "digests" }));
    }

    @Test
    void parse_shouldEnforceOperandCounts() {
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "extract" }));
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "create", "extra" }));
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "tweets" }));
        assertThrows(UsageException.class, () -> Invocation.parse(new String[] { "list", "a", "b" }));
    }

    @Test
    void applyTo_shouldOverrideOnlyGivenOptions() throws UsageException {
        ArchiveConfig config = new ArchiveConfig();
        Path originalDb = config.getDatabasePath();

        Invocation.parse(new String[] { "--dir", "elsewhere", "-p", "2", "-v", "create" }).applyTo(config);

        assertEquals(Paths.get("elsewhere"), config.getStoreDir());
        assertEquals(originalDb, config.getDatabasePath());
        assertEquals(2, config.getParallelism());
        assertTrue(config.isDebugMode());
    }

    @Test
    void usage_shouldListEveryCommand() {
        String usage = Invocation.usage();
        for (Command command : Command.values()) {
            assertTrue(usage.contains(command.commandName()), command.commandName());
        }
    }
}
