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

import com.holo.search.api.SqlFragment;
import com.holo.search.api.SqlFragments;
import com.holo.search.api.StatementExecutor;
import com.holo.search.api.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Entry point of the SDK.
 * <pre>
 *   try (HoloClient client = HoloClient.connect(HoloConfig.of(json))) {
 *       HoloTable table = client.openTable("docs");
 *       List&lt;Map&lt;String, Object&gt;&gt; rows = table.searchText("content", "fox").limit(10).fetchAll();
 *   }
 * </pre>
 * A client owns one connection; statements from several threads are run one at a time.
 */
public class HoloClient implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(HoloClient.class);

    private static final Pattern GUC_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final HoloConfig config;
    private final StatementExecutor executor;

    public HoloClient(HoloConfig config, StatementExecutor executor) {
        this.config = config;
        this.executor = executor;
    }

    public static HoloClient connect(HoloConfig config) throws IOException {
        JdbcStatementExecutor executor = new JdbcStatementExecutor(config).connect();
        return new HoloClient(config, executor);
    }

    public static HoloClient connect(String parameters) throws IOException {
        return connect(HoloConfig.of(parameters));
    }

    public HoloConfig getConfig() { return config; }

    public void execute(String sql, Object... params) throws IOException {
        executor.execute(SqlFragment.of(sql, params));
    }

    public List<Map<String, Object>> fetchAll(String sql, Object... params) throws IOException {
        return executor.fetchAll(SqlFragment.of(sql, params));
    }

    public Map<String, Object> fetchOne(String sql, Object... params) throws IOException {
        return executor.fetchOne(SqlFragment.of(sql, params));
    }

    public boolean checkTableExists(String tableName) throws IOException {
        Map<String, Object> row = executor.fetchOne(SqlFragment.of(
                "SELECT EXISTS (SELECT 1 FROM information_schema.tables WHERE table_schema = ? AND table_name = ?)",
                config.schema, tableName));
        return row != null && Boolean.TRUE.equals(row.values().iterator().next());
    }

    public HoloTable openTable(String tableName) throws IOException {
        return openTable(tableName, null);
    }

    /**
     * @throws ValidationException if the table doesn't exist in the configured schema
     */
    public HoloTable openTable(String tableName, String alias) throws IOException {
        if (!checkTableExists(tableName)) {
            throw new ValidationException("table " + config.schema + "." + tableName + " does not exist");
        }
        logger.debug("open table {}.{}", config.schema, tableName);
        return new HoloTable(executor, config.schema, tableName, alias);
    }

    /**
     * @return a query builder without a table, for example to compare tokenizers
     */
    public QueryBuilder buildQuery() {
        return new QueryBuilder(executor, null);
    }

    public QueryBuilder buildQuery(String tableName) {
        return new QueryBuilder(executor, TableRef.of(tableName));
    }

    public HoloClient setGucOn(String name) throws IOException {
        return setGuc(name, "on");
    }

    public HoloClient setGucOff(String name) throws IOException {
        return setGuc(name, "off");
    }

    /**
     * Set a server configuration parameter for this session.
     */
    public HoloClient setGuc(String name, String value) throws IOException {
        if (name == null || !GUC_NAME.matcher(name).matches()) {
            throw new ValidationException("invalid guc name: " + name);
        }
        executor.execute(SqlFragment.of("SET " + name + " = " + quoteGucValue(value)));
        return this;
    }

    private static String quoteGucValue(String value) {
        if (value == null) {
            throw new ValidationException("guc value should not be null");
        }
        return value.equals("on") || value.equals("off") ? value
                : SqlFragments.quoteLiteral(value);
    }

    @Override
    public void close() throws IOException {
        executor.close();
    }
}
