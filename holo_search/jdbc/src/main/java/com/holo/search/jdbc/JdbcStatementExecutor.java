// Copyright (c) 2025 OceanBase.
//
// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package com.holo.search.jdbc;

import com.holo.search.api.QueryExecutionException;
import com.holo.search.api.SqlFragment;
import com.holo.search.api.StatementExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Array;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs statements on one JDBC connection of the PostgreSQL driver.
 * <p>
 * Statements on the same executor are serialized. A {@code float[]} parameter is bound as a
 * {@code float4[]} array, every other parameter with {@link PreparedStatement#setObject(int, Object)}.
 * </p>
 */
public class JdbcStatementExecutor implements StatementExecutor {
    private final static Logger logger = LoggerFactory.getLogger(JdbcStatementExecutor.class);

    static final String VECTOR_ELEMENT_TYPE = "float4";

    protected final HoloConfig config;
    private Connection connection;

    public JdbcStatementExecutor(HoloConfig config) {
        this.config = config;
    }

    public synchronized JdbcStatementExecutor connect() throws IOException {
        if (connection != null) {
            return this;
        }
        logger.info("connect to hologres: {}", config.toDisplayString());
        try {
            connection = getConnection();
            connection.setAutoCommit(config.autocommit);
        } catch (SQLException e) {
            throw new QueryExecutionException("failed to connect to " + config.jdbcUrl(), e);
        }
        return this;
    }

    public synchronized boolean isConnected() {
        return connection != null;
    }

    protected Connection getConnection() throws SQLException {
        return DriverManager.getConnection(config.jdbcUrl(), config.access_key_id, config.access_key_secret);
    }

    @Override
    public synchronized void execute(SqlFragment statement) throws IOException {
        logger.info("execute sql is '{}'", statement.getSql());
        Connection conn = requireConnection();
        try (PreparedStatement preparedStatement = prepare(conn, statement)) {
            preparedStatement.execute();
            commitIfNeeded(conn);
        } catch (SQLException e) {
            rollbackIfNeeded(conn, e);
            throw new QueryExecutionException("failed to execute statement", statement.getSql(), e);
        }
    }

    @Override
    public List<Map<String, Object>> fetchAll(SqlFragment statement) throws IOException {
        return query(statement, 0);
    }

    @Override
    public List<Map<String, Object>> fetchMany(SqlFragment statement, int size) throws IOException {
        if (size <= 0) {
            throw new IllegalArgumentException("fetch size should be positive but got: " + size);
        }
        return query(statement, size);
    }

    private synchronized List<Map<String, Object>> query(SqlFragment statement, int maxRows) throws IOException {
        logger.info("query sql is '{}'", statement.getSql());
        Connection conn = requireConnection();
        try (PreparedStatement preparedStatement = prepare(conn, statement)) {
            if (maxRows > 0) {
                preparedStatement.setMaxRows(maxRows);
            }
            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                ResultSetMetaData metaData = resultSet.getMetaData();
                int columnCount = metaData.getColumnCount();
                while (resultSet.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        row.put(metaData.getColumnLabel(i), toJavaValue(resultSet.getObject(i)));
                    }
                    rows.add(row);
                }
            }
            commitIfNeeded(conn);
            logger.debug("query returned {} rows", rows.size());
            return rows;
        } catch (SQLException e) {
            rollbackIfNeeded(conn, e);
            throw new QueryExecutionException("failed to run query", statement.getSql(), e);
        }
    }

    private PreparedStatement prepare(Connection conn, SqlFragment statement) throws SQLException {
        PreparedStatement preparedStatement = conn.prepareStatement(statement.getSql());
        try {
            List<Object> params = statement.getParams();
            for (int i = 0; i < params.size(); i++) {
                Object param = params.get(i);
                if (param instanceof float[]) {
                    preparedStatement.setArray(i + 1, conn.createArrayOf(VECTOR_ELEMENT_TYPE, box((float[]) param)));
                } else {
                    preparedStatement.setObject(i + 1, param);
                }
            }
            return preparedStatement;
        } catch (SQLException e) {
            preparedStatement.close();
            throw e;
        }
    }

    private static Float[] box(float[] vector) {
        Float[] boxed = new Float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            boxed[i] = vector[i];
        }
        return boxed;
    }

    private static Object toJavaValue(Object value) throws SQLException {
        if (value instanceof Array) {
            Array array = (Array) value;
            try {
                return array.getArray();
            } finally {
                array.free();
            }
        }
        return value;
    }

    private void commitIfNeeded(Connection conn) throws SQLException {
        if (!config.autocommit) {
            conn.commit();
        }
    }

    private void rollbackIfNeeded(Connection conn, SQLException cause) {
        if (config.autocommit) {
            return;
        }
        try {
            conn.rollback();
        } catch (SQLException e) {
            logger.warn("failed to rollback", e);
            cause.addSuppressed(e);
        }
    }

    private Connection requireConnection() throws QueryExecutionException {
        if (connection == null) {
            throw new QueryExecutionException("not connected to hologres, call connect first");
        }
        return connection;
    }

    @Override
    public synchronized void close() throws IOException {
        if (connection == null) {
            return;
        }
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
            logger.info("connection closed");
        } catch (SQLException e) {
            throw new IOException(e);
        } finally {
            connection = null;
        }
    }
}
