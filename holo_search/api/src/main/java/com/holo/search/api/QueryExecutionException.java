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

/**
 * A statement could not be run by the database, or there was no connection to run it on.
 */
public class QueryExecutionException extends IOException {
    private final String sql;

    public QueryExecutionException(String message) {
        this(message, null, null);
    }

    public QueryExecutionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public QueryExecutionException(String message, String sql, Throwable cause) {
        super(sql == null ? message : message + ". sql is '" + sql + "'", cause);
        this.sql = sql;
    }

    /** the failing statement, null if the failure was not caused by one */
    public String getSql() { return sql; }
}
