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
 * A raw condition such as {@code age > 18}, used verbatim.
 * <p>
 * The condition text is trusted: it is not parsed, quoted or escaped. Values that come from
 * users should be passed as parameters and referenced with {@code ?} in the text.
 * </p>
 */
public class AtomicFilterExpr implements FilterExpr {
    private final SqlFragment condition;

    public AtomicFilterExpr(String condition, Object... params) {
        SqlFragments.requireText(condition, "filter condition");
        this.condition = new SqlFragment(condition, Arrays.asList(params));
    }

    @Override
    public Type getType() { return Type.ATOMIC; }

    @Override
    public SqlFragment render() {
        return condition;
    }

    @Override
    public String toString() {
        return condition.getSql();
    }
}
