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

package com.holo.search.api;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Runs compiled statements against the database.
 * <p>
 * Query builders only produce a {@link SqlFragment}; everything that blocks, talks to the network
 * or needs a connection lives behind this interface. Rows are returned as ordered
 * column name to value maps, exactly as the driver produced them.
 * </p>
 */
public interface StatementExecutor extends AutoCloseable {

    /**
     * Execute a statement whose result, if any, is discarded.
     */
    void execute(SqlFragment statement) throws IOException;

    List<Map<String, Object>> fetchAll(SqlFragment statement) throws IOException;

    /**
     * @return at most {@code size} rows
     */
    List<Map<String, Object>> fetchMany(SqlFragment statement, int size) throws IOException;

    /**
     * @return the first row, or null if the statement returned nothing
     */
    default Map<String, Object> fetchOne(SqlFragment statement) throws IOException {
        List<Map<String, Object>> rows = fetchMany(statement, 1);
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    void close() throws IOException;
}
