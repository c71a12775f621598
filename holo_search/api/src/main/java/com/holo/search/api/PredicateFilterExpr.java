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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A logical connective over other filters: AND and OR take at least two children,
 * NOT exactly one. Each child is parenthesized when rendered, so the precedence of the
 * tree never depends on how the children themselves are written.
 */
public class PredicateFilterExpr implements FilterExpr {
    private final Type type;
    private final List<FilterExpr> children;

    public PredicateFilterExpr(Type type, List<? extends FilterExpr> children) {
        Objects.requireNonNull(type, "predicate type should not be null");
        Objects.requireNonNull(children, "children should not be null");
        switch (type) {
            case AND:
            case OR: {
                if (children.size() < 2) {
                    throw new ValidationException("at least 2 children for " + type + " filter, but got "
                            + children.size() + ". Use NOT or the filter itself for a single condition");
                }
            } break;
            case NOT: {
                if (children.size() != 1) {
                    throw new ValidationException("NOT filter needs exactly 1 child, but got " + children.size());
                }
            } break;
            default:
                throw new ValidationException("invalid predicate type: " + type);
        }
        for (FilterExpr child : children) {
            if (child == null) {
                throw new ValidationException("children of " + type + " filter should not be null");
            }
        }
        this.type = type;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public Type getType() { return type; }
    public List<FilterExpr> getChildren() { return children; }

    @Override
    public SqlFragment render() {
        if (type == Type.NOT) {
            return children.get(0).render().wrap("NOT (", ")");
        }
        List<SqlFragment> fragments = children.stream()
                .map(child -> child.render().wrap("(", ")"))
                .collect(Collectors.toList());
        return SqlFragment.join(type == Type.AND ? " AND " : " OR ", fragments);
    }

    @Override
    public String toString() {
        return render().getSql();
    }
}
