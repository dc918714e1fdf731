package com.tyron.apphost.core.database;

import com.tyron.apphost.api.database.Database;

/**
 * Opens the {@link Database} for a connection string.
 */
@FunctionalInterface
public interface DatabaseFactory {

    Database open(String connectionString);
}
