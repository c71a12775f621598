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
import java.util.List;
import java.util.Objects;

/**
 * A full-text predicate: the row matches when its {@code TEXT_SEARCH} score is positive, and,
 * if thresholds are set, when the score lies within them.
 * <p>
 * With a score alias the score is read from the select list column of that name instead of
 * evaluating the search function again; without one the function call is inlined.
 * For example, with alias {@code score} and a minimum of 0.5 the condition renders as
 * {@code ("score" > 0) AND ("score" >= ?)}.
 * </p>
 */
public class TextSearchFilterExpr implements FilterExpr {
    private final String column;
    private final String expression;
    private final TextSearchOptions options;
    private final Double minThreshold;
    private final Double maxThreshold;
    private final String scoreAlias;

    public TextSearchFilterExpr(String column, String expression, TextSearchOptions options,
                                Double minThreshold, Double maxThreshold, String scoreAlias) {
        SqlFragments.requireText(column, "text search column");
        this.column = column;
        this.expression = Objects.requireNonNull(expression, "search expression should not be null");
        this.options = options == null ? TextSearchOptions.defaults() : options;
        if (minThreshold != null && maxThreshold != null && minThreshold > maxThreshold) {
            throw new ValidationException("min threshold " + minThreshold + " is greater than max threshold "
                    + maxThreshold);
        }
        this.minThreshold = minThreshold;
        this.maxThreshold = maxThreshold;
        if (scoreAlias != null) {
            SqlFragments.requireText(scoreAlias, "score alias");
        }
        this.scoreAlias = scoreAlias;
    }

    public TextSearchFilterExpr(String column, String expression, TextSearchOptions options) {
        this(column, expression, options, null, null, null);
    }

    @Override
    public Type getType() { return Type.TEXT_SEARCH; }

    public String getColumn() { return column; }
    public String getExpression() { return expression; }
    public TextSearchOptions getOptions() { return options; }
    public Double getMinThreshold() { return minThreshold; }
    public Double getMaxThreshold() { return maxThreshold; }
    public String getScoreAlias() { return scoreAlias; }

    public boolean hasThreshold() {
        return minThreshold != null || maxThreshold != null;
    }

    /**
     * @return the relevance score expression this predicate is based on
     */
    public SqlFragment scoreExpression() {
        return SqlFragments.textSearch(column, expression, options);
    }

    @Override
    public SqlFragment render() {
        SqlFragment score = scoreAlias != null
                ? SqlFragment.of(SqlFragments.quoteIdentifier(scoreAlias))
                : scoreExpression();
        SqlFragment match = score.wrap("", " > 0");
        if (!hasThreshold()) {
            return match;
        }

        List<SqlFragment> parts = new ArrayList<>();
        parts.add(match.wrap("(", ")"));
        if (minThreshold != null) {
            parts.add(new SqlFragment("(" + score.getSql() + " >= " + SqlFragment.PLACEHOLDER + ")",
                    withParam(score.getParams(), minThreshold)));
        }
        if (maxThreshold != null) {
            parts.add(new SqlFragment("(" + score.getSql() + " <= " + SqlFragment.PLACEHOLDER + ")",
                    withParam(score.getParams(), maxThreshold)));
        }
        return SqlFragment.join(" AND ", parts);
    }

    private static List<Object> withParam(List<Object> params, Object value) {
        List<Object> result = new ArrayList<>(params);
        result.add(value);
        return result;
    }

    @Override
    public String toString() {
        return render().getSql();
    }
}
