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

/**
 * A node of a boolean predicate tree which can be rendered into a SQL {@code WHERE} condition.
 * <p>
 * Nodes are immutable, so one tree can be shared by many query builders and threads.
 * Rendering is pure: the same tree always yields the same text and parameters.
 * </p>
 */
public interface FilterExpr {

    enum Type {
        ATOMIC,
        AND,
        OR,
        NOT,
        TEXT_SEARCH,
    }

    Type getType();

    /**
     * @return the condition text and the values bound to its placeholders
     */
    SqlFragment render();

    /**
     * @return a new {@code (this) AND (other)} node; both operands stay usable on their own
     */
    default FilterExpr and(FilterExpr other) {
        return new PredicateFilterExpr(Type.AND, Arrays.asList(this, other));
    }

    default FilterExpr or(FilterExpr other) {
        return new PredicateFilterExpr(Type.OR, Arrays.asList(this, other));
    }

    default FilterExpr not() {
        return new PredicateFilterExpr(Type.NOT, Arrays.asList(this));
    }
}
