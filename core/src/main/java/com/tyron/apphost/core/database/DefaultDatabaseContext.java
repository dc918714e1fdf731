package com.tyron.apphost.core.database;

import com.tyron.apphost.api.database.Database;
import com.tyron.apphost.api.database.DatabaseContext;
import org.jetbrains.annotations.Nullable;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DatabaseContext} configured from a connection string.
 * <p>
 * The database is considered configured when the connection string is non-blank. The
 * {@link Database} is opened on first access and reused afterwards.
 */
public class DefaultDatabaseContext implements DatabaseContext {

    private static final Logger LOG = Logger.getLogger(DefaultDatabaseContext.class.getName());

    private final String connectionString;
    private final DatabaseFactory factory;

    private final Object lock = new Object();
    private volatile Database database;

    public DefaultDatabaseContext(@Nullable String connectionString, DatabaseFactory factory) {
        if (factory == null) throw new IllegalArgumentException("factory == null");
        this.connectionString = connectionString;
        this.factory = factory;
    }

    @Override
    public boolean isDatabaseConfigured() {
        return connectionString != null && !connectionString.isBlank();
    }

    @Override
    public Database getDatabase() {
        Database existing = database;
        if (existing != null) {
            return existing;
        }
        if (!isDatabaseConfigured()) {
            throw new IllegalStateException("The database is not configured");
        }

        synchronized (lock) {
            if (database == null) {
                Database opened = factory.open(connectionString);
                if (opened == null) {
                    throw new IllegalStateException("DatabaseFactory returned null for the configured connection");
                }
                database = opened;
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Opened database " + opened.getClass().getName());
                }
            }
            return database;
        }
    }
}
