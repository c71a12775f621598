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

import com.holo.search.api.SqlFragments;
import com.holo.search.api.ValidationException;

import java.util.Objects;

/**
 * A table named in a {@code FROM} or {@code JOIN} clause, optionally schema-qualified and aliased.
 */
public final class TableRef {
    private final String name;
    private final String alias;

    private TableRef(String name, String alias) {
        if (name == null || name.trim().isEmpty()) {
            throw new ValidationException("table name should not be empty");
        }
        if (alias != null && (alias.trim().isEmpty() || alias.contains("."))) {
            throw new ValidationException("invalid table alias: '" + alias + "'");
        }
        this.name = name;
        this.alias = alias;
    }

    public static TableRef of(String name) {
        return new TableRef(name, null);
    }

    public static TableRef of(String name, String alias) {
        return new TableRef(name, alias);
    }

    public String getName() { return name; }
    /** may be null */
    public String getAlias() { return alias; }

    public TableRef withAlias(String alias) {
        return new TableRef(name, alias);
    }

    /**
     * @return for example {@code "wiki_articles" AS "a"}
     */
    public String toSql() {
        String quoted = SqlFragments.quoteIdentifier(name);
        return alias == null ? quoted : quoted + " AS " + SqlFragments.quoteIdentifier(alias);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableRef)) return false;
        TableRef tableRef = (TableRef) o;
        return name.equals(tableRef.name) && Objects.equals(alias, tableRef.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, alias);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
