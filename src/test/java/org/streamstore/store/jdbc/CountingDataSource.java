/*
 * Copyright 2014 the original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.streamstore.store.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Data source for tests that counts the connections it hands out and can be made to fail.
 *
 * @author Tommy Wassgren
 */
public class CountingDataSource implements DataSource {
    private final AtomicInteger connections = new AtomicInteger();
    private final JdbcDataSource delegate = new JdbcDataSource();
    private volatile boolean failing;

    public CountingDataSource(final String url) {
        delegate.setURL(url);
    }

    public int connections() {
        return connections.get();
    }

    public void failing(final boolean failing) {
        this.failing = failing;
    }

    @Override
    public Connection getConnection() throws SQLException {
        connections.incrementAndGet();
        if (failing) {
            throw new SQLException("Connection refused", "08001");
        }
        return delegate.getConnection();
    }

    @Override
    public Connection getConnection(final String username, final String password) throws SQLException {
        return getConnection();
    }

    @Override
    public int getLoginTimeout() {
        return 0;
    }

    @Override
    public PrintWriter getLogWriter() {
        return null;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException();
    }

    @Override
    public boolean isWrapperFor(final Class<?> iface) {
        return false;
    }

    @Override
    public void setLogWriter(final PrintWriter out) {
        // Not used
    }

    @Override
    public void setLoginTimeout(final int seconds) {
        // Not used
    }

    @Override
    public <T> T unwrap(final Class<T> iface) throws SQLException {
        throw new SQLException("Not a wrapper");
    }
}
