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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A piece of SQL text together with the values bound to its {@code ?} placeholders.
 * The parameters are kept in the order the placeholders appear in the text.
 */
public final class SqlFragment {
    public static final String PLACEHOLDER = "?";

    private final String sql;
    private final List<Object> params;

    public SqlFragment(String sql, List<?> params) {
        if (sql == null) {
            throw new IllegalArgumentException("sql is null");
        }
        this.sql = sql;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static SqlFragment of(String sql, Object... params) {
        return new SqlFragment(sql, Arrays.asList(params));
    }

    public String getSql() { return sql; }
    public List<Object> getParams() { return params; }

    /**
     * @return a fragment whose text is {@code prefix + sql + suffix}, with the same parameters.
     */
    public SqlFragment wrap(String prefix, String suffix) {
        return new SqlFragment(prefix + sql + suffix, params);
    }

    /**
     * Join fragments with a separator, concatenating their parameters in the same order.
     */
    public static SqlFragment join(String separator, List<SqlFragment> fragments) {
        StringBuilder sb = new StringBuilder();
        List<Object> allParams = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(fragments.get(i).sql);
            allParams.addAll(fragments.get(i).params);
        }
        return new SqlFragment(sb.toString(), allParams);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlFragment)) return false;
        SqlFragment other = (SqlFragment) o;
        // parameters may hold vectors, so compare them deeply
        return sql.equals(other.sql) && Arrays.deepEquals(params.toArray(), other.params.toArray());
    }

    @Override
    public int hashCode() {
        return 31 * sql.hashCode() + Arrays.deepHashCode(params.toArray());
    }

    @Override
    public String toString() {
        return "SqlFragment{" +
                "sql='" + sql + '\'' +
                ", params=" + Arrays.deepToString(params.toArray()) +
                '}';
    }
}
