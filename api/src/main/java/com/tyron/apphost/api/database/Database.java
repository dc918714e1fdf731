package com.tyron.apphost.api.database;

import com.tyron.apphost.api.service.Disposable;

/**
 * Handle to the underlying database connection resource.
 */
public interface Database extends Disposable {

    String getConnectionString();
}
