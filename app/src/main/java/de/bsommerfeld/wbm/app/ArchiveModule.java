package de.bsommerfeld.wbm.app;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.wbm.archive.ArchiveStore;
import de.bsommerfeld.wbm.core.config.ArchiveConfig;
import de.bsommerfeld.wbm.db.SqlTweetIndex;
import de.bsommerfeld.wbm.db.TweetIndex;
import de.bsommerfeld.wbm.db.TweetStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module wiring the store and the index from an already loaded
 * {@link ArchiveConfig}. Both are created on first use, so commands that only
 * touch the store never open the database.
 */
public class ArchiveModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveModule.class);

    static final String REBUILD = "rebuild";

    private final ArchiveConfig config;

    public ArchiveModule(ArchiveConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(ArchiveConfig.class).toInstance(config);
    }

    @Provides
    @Singleton
    ArchiveStore provideArchiveStore(ArchiveConfig config) {
        LOG.debug("Using archive store at {}", config.getStoreDir().toAbsolutePath());
        return ArchiveStore.open(config.getStoreDir());
    }

    /** The index for queries. Never drops tables, whatever the config says. */
    @Provides
    @Singleton
    TweetIndex provideTweetIndex(ArchiveConfig config) throws TweetStoreException {
        return new SqlTweetIndex(config.getDatabasePath(), false);
    }

    /**
     * The index as opened by {@code init-index}: tables are dropped and
     * recreated when {@code recreate-database} is set.
     */
    @Provides
    @Named(REBUILD)
    TweetIndex provideRebuildIndex(ArchiveConfig config) throws TweetStoreException {
        return new SqlTweetIndex(config.getDatabasePath(), config.isRecreateDatabase());
    }
}
