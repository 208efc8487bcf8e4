package com.memclaw.memory.store;

import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class SqliteDataSources {

    private static final int BUSY_TIMEOUT_MS = 5_000;

    private SqliteDataSources() {}

    /**
     * One file holds both the memory table and the sync queue, so a memory insert and
     * its queue entry commit together.
     */
    public static DataSource open(Path dbPath) throws IOException {
        var parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        var config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        // writers take the lock up front instead of failing on upgrade
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        var ds = new SQLiteDataSource(config);
        ds.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        return ds;
    }
}
