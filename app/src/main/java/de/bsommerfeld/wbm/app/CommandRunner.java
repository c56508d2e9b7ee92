package de.bsommerfeld.wbm.app;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.google.inject.name.Named;
import de.bsommerfeld.wbm.archive.ArchiveBootstrap;
import de.bsommerfeld.wbm.archive.ArchiveEntry;
import de.bsommerfeld.wbm.archive.ArchiveException;
import de.bsommerfeld.wbm.archive.ArchiveStore;
import de.bsommerfeld.wbm.archive.DigestPair;
import de.bsommerfeld.wbm.archive.FileLocation;
import de.bsommerfeld.wbm.archive.Outcome;
import de.bsommerfeld.wbm.archive.RawDigest;
import de.bsommerfeld.wbm.archive.VerificationSummary;
import de.bsommerfeld.wbm.archive.digest.Digests;
import de.bsommerfeld.wbm.core.config.ArchiveConfig;
import de.bsommerfeld.wbm.core.domain.UserRecord;
import de.bsommerfeld.wbm.db.TweetCapture;
import de.bsommerfeld.wbm.db.TweetIndex;
import de.bsommerfeld.wbm.db.TweetStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Executes one {@link Command} against the injected store and index. Results
 * go to {@code out}, one record per line; diagnostics go to the log.
 *
 * <p>
 * The index is only opened by the commands that need it and is closed again
 * before {@link #run} returns. Only {@code init-index} honours
 * {@code recreate-database}; queries never drop tables.
 */
public class CommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(CommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ArchiveConfig config;
    private final Provider<ArchiveStore> store;
    private final Provider<TweetIndex> index;
    private final Provider<TweetIndex> rebuildIndex;

    @Inject
    public CommandRunner(ArchiveConfig config, Provider<ArchiveStore> store, Provider<TweetIndex> index,
            @Named(ArchiveModule.REBUILD) Provider<TweetIndex> rebuildIndex) {
        this.config = config;
        this.store = store;
        this.index = index;
        this.rebuildIndex = rebuildIndex;
    }

    /**
     * @return {@link #EXIT_OK}, or {@link #EXIT_FAILURE} when the command ran
     *         but reported problems (corrupt entries, rejected input)
     * @throws UsageException if an operand is malformed
     */
    public int run(Invocation invocation, PrintStream out)
            throws UsageException, ArchiveException, TweetStoreException {
        Command command = invocation.command();
        LOG.debug("Running {} with {}", command.commandName(), invocation.operands());

        if (command == Command.INIT_INDEX) {
            try (TweetIndex ignored = rebuildIndex.get()) {
                LOG.info("Tweet index ready at {}{}", config.getDatabasePath().toAbsolutePath(),
                        config.isRecreateDatabase() ? " (recreated)" : "");
                return EXIT_OK;
            }
        }
        if (command.usesIndex()) {
            try (TweetIndex tweets = index.get()) {
                return switch (command) {
                    case TWEETS -> tweets(tweets, invocation.operands(), out);
                    case USERS -> users(tweets, out);
                    default -> throw new IllegalStateException("Not an index command: " + command);
                };
            }
        }

        return switch (command) {
            case CREATE -> create();
            case EXTRACT -> extract(invocation.operand(0), out);
            case LIST -> list(prefix(invocation.operandOrEmpty(0)), out);
            case DIGESTS -> digests(prefix(invocation.operandOrEmpty(0)));
            case DIGESTS_RAW -> digestsRaw(Paths.get(invocation.operand(0)), out);
            case ADD_FILE -> addFile(Paths.get(invocation.operand(0)), out);
            default -> throw new IllegalStateException("Not a store command: " + command);
        };
    }

    // =====================================================================
    // Store
    // =====================================================================

    private int create() throws ArchiveException {
        ArchiveStore created = ArchiveStore.create(config.getStoreDir());
        LOG.info("Archive store ready at {}", created.root().toAbsolutePath());
        return EXIT_OK;
    }

    private int extract(String digest, PrintStream out) throws UsageException, ArchiveException {
        if (!Digests.isValid(digest)) {
            throw new UsageException("Not a digest: " + digest);
        }
        Optional<String> content = store.get().extract(digest);
        if (content.isEmpty()) {
            LOG.info("No entry for {}", digest);
            return EXIT_OK;
        }
        out.print(content.get());
        out.flush();
        return EXIT_OK;
    }

    private int list(String prefix, PrintStream out) {
        int failures = 0;
        try (Stream<Outcome<ArchiveEntry>> entries = store.get().pathsForPrefix(prefix)) {
            Iterator<Outcome<ArchiveEntry>> it = entries.iterator();
            while (it.hasNext()) {
                Outcome<ArchiveEntry> entry = it.next();
                if (entry instanceof Outcome.Success<ArchiveEntry> success) {
                    out.println(success.value().digest());
                } else {
                    LOG.error("Unreadable entry: {}", entry.errorOrNull().getMessage());
                    failures++;
                }
            }
        }
        return failures == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private int digests(String prefix) {
        VerificationSummary summary;
        try (Stream<Outcome<DigestPair>> results = store.get().computeDigests(prefix, config.getParallelism())) {
            summary = VerificationSummary.tally(results);
        }
        return summary.isClean() ? EXIT_OK : EXIT_FAILURE;
    }

    private int digestsRaw(Path dir, PrintStream out) throws ArchiveException {
        for (RawDigest raw : ArchiveBootstrap.computeRawDigests(dir)) {
            out.println(raw.toCsvLine());
        }
        return EXIT_OK;
    }

    private int addFile(Path input, PrintStream out) throws ArchiveException {
        Optional<FileLocation> decision = store.get().addFile(input);
        if (decision.isEmpty()) {
            LOG.info("Already stored: {}", input);
            return EXIT_OK;
        }
        if (decision.get() instanceof FileLocation.Mismatch mismatch) {
            LOG.error("Rejected {}: name claims {} but content hashes to {}",
                    input, mismatch.expected(), mismatch.actual());
            return EXIT_FAILURE;
        }
        FileLocation.Available available = (FileLocation.Available) decision.get();
        out.println(input + "," + available.target());
        return EXIT_OK;
    }

    private static String prefix(String operand) throws UsageException {
        if (!Digests.isValidPrefix(operand)) {
            throw new UsageException("Not a digest prefix: " + operand);
        }
        return operand;
    }

    // =====================================================================
    // Index
    // =====================================================================

    private int tweets(TweetIndex tweets, List<String> operands, PrintStream out)
            throws UsageException, TweetStoreException {
        List<Long> ids = new ArrayList<>(operands.size());
        for (String operand : operands) {
            try {
                ids.add(Long.parseLong(operand));
            } catch (NumberFormatException e) {
                throw new UsageException("Not a tweet id: " + operand);
            }
        }

        for (TweetCapture capture : tweets.getTweets(ids)) {
            out.printf("%d\t%s\t@%s\t%s%n",
                    capture.tweet().id(), capture.digest(), capture.tweet().userScreenName(),
                    capture.tweet().text());
        }
        return EXIT_OK;
    }

    private int users(TweetIndex tweets, PrintStream out) throws TweetStoreException {
        for (UserRecord user : tweets.getUsers()) {
            out.printf("%d\t%s\t%s\t%s%n",
                    user.id(),
                    user.lastSeen() == null ? "-" : user.lastSeen(),
                    String.join(",", user.screenNames()),
                    String.join(",", user.names()));
        }
        return EXIT_OK;
    }
}
