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

import com.holo.search.api.FilterExpr;
import com.holo.search.api.JoinType;
import com.holo.search.api.SqlFragment;
import com.holo.search.api.ValidationException;

import java.util.Objects;

public final class JoinClause {
    private final JoinType type;
    private final TableRef table;
    private final FilterExpr condition;

    public JoinClause(JoinType type, TableRef table, FilterExpr condition) {
        this.type = Objects.requireNonNull(type, "join type should not be null");
        this.table = Objects.requireNonNull(table, "join table should not be null");
        if (type == JoinType.CROSS && condition != null) {
            throw new ValidationException("CROSS JOIN doesn't accept a join condition, but got: " + condition);
        }
        if (type != JoinType.CROSS && condition == null) {
            throw new ValidationException(type.getKeyword() + " needs a join condition");
        }
        this.condition = condition;
    }

    public JoinType getType() { return type; }
    public TableRef getTable() { return table; }
    /** null for a cross join */
    public FilterExpr getCondition() { return condition; }

    public SqlFragment render() {
        String head = type.getKeyword() + " " + table.toSql();
        if (condition == null) {
            return SqlFragment.of(head);
        }
        return condition.render().wrap(head + " ON ", "");
    }
}
