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

import java.util.Arrays;
import java.util.List;

/**
 * Static factories for filter trees.
 * <pre>
 *   FilterExpr adult = Filters.of("age > ?", 18);
 *   FilterExpr filter = adult.and(Filters.of("status = 'active'").or(Filters.of("vip")));
 * </pre>
 */
public final class Filters {

    private Filters() {
    }

    public static FilterExpr of(String condition, Object... params) {
        return new AtomicFilterExpr(condition, params);
    }

    public static FilterExpr and(FilterExpr... children) {
        return new PredicateFilterExpr(FilterExpr.Type.AND, Arrays.asList(children));
    }

    public static FilterExpr and(List<? extends FilterExpr> children) {
        return new PredicateFilterExpr(FilterExpr.Type.AND, children);
    }

    public static FilterExpr or(FilterExpr... children) {
        return new PredicateFilterExpr(FilterExpr.Type.OR, Arrays.asList(children));
    }

    public static FilterExpr or(List<? extends FilterExpr> children) {
        return new PredicateFilterExpr(FilterExpr.Type.OR, children);
    }

    public static FilterExpr not(FilterExpr child) {
        return new PredicateFilterExpr(FilterExpr.Type.NOT, Arrays.asList(child));
    }

    public static TextSearchFilterExpr textSearch(String column, String expression) {
        return new TextSearchFilterExpr(column, expression, TextSearchOptions.defaults());
    }

    public static TextSearchFilterExpr textSearch(String column, String expression, TextSearchOptions options) {
        return new TextSearchFilterExpr(column, expression, options);
    }
}
