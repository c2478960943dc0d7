package com.querygate.engine;

import javax.sql.DataSource;

/**
 * Current pool of the engine connection; fails when the connection is down.
 */
@FunctionalInterface
interface DataSourceHandle {

    DataSource get() throws EngineException;
}
