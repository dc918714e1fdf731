package com.tyron.apphost.api.database;

/**
 * Application-wide access to the database.
 */
public interface DatabaseContext {

    /**
     * @return true when a connection has been configured for this application.
     */
    boolean isDatabaseConfigured();

    /**
     * @return the database handle.
     * @throws IllegalStateException if the database is not configured.
     */
    Database getDatabase();
}
