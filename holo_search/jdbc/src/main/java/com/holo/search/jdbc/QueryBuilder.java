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

import com.holo.search.api.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Accumulates the clauses of one {@code SELECT} statement and compiles them into SQL.
 * <p>
 * Every mutator returns this builder, so calls can be chained:
 * <pre>
 *   SqlFragment query = new QueryBuilder(TableRef.of("docs"))
 *       .select("id")
 *       .selectTextSearch("content", "fox", "score")
 *       .whereTextSearch("content", "fox", TextSearchOptions.defaults(), 0.5)
 *       .orderBy("score", SortOrder.DESC)
 *       .limit(5)
 *       .compile();
 * </pre>
 * The clauses are always emitted in the order
 * {@code SELECT .. FROM .. JOIN .. WHERE .. ORDER BY .. LIMIT .. OFFSET ..}, whatever the order of
 * the calls. Mistakes such as an unknown tokenizer or a distance bound without a vector search
 * fail at the call that makes them, never in {@link #compile()}.
 * </p>
 * <p>
 * A builder belongs to the thread that builds the statement. It has no internal locking and
 * must not be shared between threads without external synchronization.
 * </p>
 */
public class QueryBuilder {
    private final static Logger logger = LoggerFactory.getLogger(QueryBuilder.class);

    /// Alias prefix of the score columns registered for a threshold when no score was selected.
    static final String INTERNAL_SCORE_PREFIX = "_text_search_score_";
    static final String DEFAULT_TOKENIZE_OUTPUT = "tokenize";

    private enum ComputedKind {
        VECTOR_DISTANCE,
        TEXT_SEARCH,
        TOKENIZE
    }

    private static final class ComputedColumn {
        final String alias;
        final ComputedKind kind;
        final SqlFragment expression;
        /// only set for TEXT_SEARCH columns
        final TextSearchFilterExpr search;

        ComputedColumn(String alias, ComputedKind kind, SqlFragment expression, TextSearchFilterExpr search) {
            this.alias = alias;
            this.kind = kind;
            this.expression = expression;
            this.search = search;
        }
    }

    private static final class OrderKey {
        final String column;
        final SortOrder order;

        OrderKey(String column, SortOrder order) {
            this.column = column;
            this.order = order;
        }
    }

    private final StatementExecutor executor;
    private final TableRef table;
    private final boolean inlineComputedReferences;

    private final List<String> selectItems = new ArrayList<>();
    private final Map<String, ComputedColumn> computedColumns = new LinkedHashMap<>();
    private final List<JoinClause> joins = new ArrayList<>();
    private final List<OrderKey> orderKeys = new ArrayList<>();
    private FilterExpr filter;
    private String distanceAlias;
    private Double minDistance;
    private Double maxDistance;
    private Integer limit;
    private Integer offset;
    private int internalScoreCount;

    public QueryBuilder(TableRef table) {
        this(null, table, false);
    }

    public QueryBuilder(StatementExecutor executor, TableRef table) {
        this(executor, table, false);
    }

    /**
     * @param executor runs the compiled statement for the {@code fetch*} methods, may be null
     *                 if the builder is only compiled
     * @param table the {@code FROM} table, null for a statement without one such as
     *              {@code SELECT TOKENIZE(?, 'jieba')}
     * @param inlineComputedReferences if true, conditions on a computed column repeat its
     *                                 expression instead of referencing its alias. Use it for
     *                                 engines that can't resolve select list aliases in {@code WHERE}.
     */
    public QueryBuilder(StatementExecutor executor, TableRef table, boolean inlineComputedReferences) {
        this.executor = executor;
        this.table = table;
        this.inlineComputedReferences = inlineComputedReferences;
    }

    public TableRef getTable() { return table; }

    /**
     * Add plain select items. Items are SQL expressions used verbatim, such as {@code id},
     * {@code a.id} or {@code count(*)}. An item that was already selected is ignored.
     */
    public QueryBuilder select(String... columns) {
        return select(Arrays.asList(columns));
    }

    public QueryBuilder select(List<String> columns) {
        Objects.requireNonNull(columns, "columns should not be null");
        for (String column : columns) {
            if (column == null || column.trim().isEmpty()) {
                throw new ValidationException("select item should not be empty");
            }
            if (selectItems.contains(column)) {
                logger.debug("select item {} is already selected", column);
                continue;
            }
            for (String alias : computedColumns.keySet()) {
                if (outputNameClashes(column, alias)) {
                    throw new ValidationException("select item '" + column
                            + "' clashes with the computed column '" + alias + "'");
                }
            }
            selectItems.add(column);
        }
        return this;
    }

    /**
     * Select the approximate distance between {@code column} and {@code vector} as {@code outputName}.
     * Only one vector search can be registered per statement.
     */
    public QueryBuilder selectVectorSearch(float[] vector, String column, DistanceMethod method, String outputName) {
        if (distanceAlias != null && !distanceAlias.equals(outputName)) {
            throw new ValidationException("a vector search is already selected as '" + distanceAlias + "'");
        }
        SqlFragment expression = SqlFragments.vectorDistance(column, vector, method);
        registerComputed(outputName, ComputedKind.VECTOR_DISTANCE, expression, null);
        distanceAlias = outputName;
        return this;
    }

    /**
     * Keep only rows whose distance is at least {@code distance}.
     * @throws ValidationException if no vector search was selected
     */
    public QueryBuilder minDistance(double distance) {
        requireDistanceColumn("min distance");
        if (maxDistance != null && distance > maxDistance) {
            throw new ValidationException("min distance " + distance + " is greater than max distance " + maxDistance);
        }
        minDistance = distance;
        return this;
    }

    /**
     * Keep only rows whose distance is at most {@code distance}.
     * @throws ValidationException if no vector search was selected
     */
    public QueryBuilder maxDistance(double distance) {
        requireDistanceColumn("max distance");
        if (minDistance != null && distance < minDistance) {
            throw new ValidationException("max distance " + distance + " is less than min distance " + minDistance);
        }
        maxDistance = distance;
        return this;
    }

    private void requireDistanceColumn(String what) {
        if (distanceAlias == null) {
            throw new ValidationException(what + " needs a vector search column, call selectVectorSearch first");
        }
    }

    public QueryBuilder selectTextSearch(String column, String expression, String outputName) {
        return selectTextSearch(column, expression, outputName, TextSearchOptions.defaults());
    }

    /**
     * Select the full-text relevance score of {@code expression} against {@code column} as {@code outputName}.
     */
    public QueryBuilder selectTextSearch(String column, String expression, String outputName,
                                         TextSearchOptions options) {
        TextSearchFilterExpr search = new TextSearchFilterExpr(column, expression, options);
        registerComputed(outputName, ComputedKind.TEXT_SEARCH, search.scoreExpression(), search);
        return this;
    }

    public QueryBuilder whereTextSearch(String column, String expression) {
        return whereTextSearch(column, expression, TextSearchOptions.defaults(), null, null, null);
    }

    public QueryBuilder whereTextSearch(String column, String expression, TextSearchOptions options) {
        return whereTextSearch(column, expression, options, null, null, null);
    }

    public QueryBuilder whereTextSearch(String column, String expression, TextSearchOptions options,
                                        Double minThreshold) {
        return whereTextSearch(column, expression, options, minThreshold, null, null);
    }

    /**
     * Keep only rows matching the full-text search, ANDed with the existing condition.
     * <p>
     * With a threshold the score is compared through a select list alias: {@code scoreName} if
     * given, else the alias of a selected text search with the same column, expression and options,
     * else a new internal score column named {@code _text_search_score_<n>}.
     * </p>
     * @throws ValidationException if {@code scoreName} is not a selected text search of this search
     */
    public QueryBuilder whereTextSearch(String column, String expression, TextSearchOptions options,
                                        Double minThreshold, Double maxThreshold, String scoreName) {
        TextSearchFilterExpr search = new TextSearchFilterExpr(column, expression, options);
        String alias = null;
        if (scoreName != null) {
            ComputedColumn computed = computedColumns.get(scoreName);
            if (computed == null || computed.kind != ComputedKind.TEXT_SEARCH) {
                throw new ValidationException("'" + scoreName + "' is not a selected text search score. " +
                        "Selected text search scores: " + aliasesOf(ComputedKind.TEXT_SEARCH));
            }
            if (!isSameSearch(computed, search)) {
                throw new ValidationException("score column '" + scoreName + "' was selected for a different search");
            }
            alias = scoreName;
        } else if (minThreshold != null || maxThreshold != null) {
            alias = findTextSearchAlias(search);
            if (alias == null) {
                alias = nextInternalScoreAlias();
                registerComputed(alias, ComputedKind.TEXT_SEARCH, search.scoreExpression(), search);
            }
        }

        String reference = inlineComputedReferences ? null : alias;
        return where(new TextSearchFilterExpr(column, expression, search.getOptions(),
                minThreshold, maxThreshold, reference));
    }

    private String findTextSearchAlias(TextSearchFilterExpr search) {
        for (ComputedColumn computed : computedColumns.values()) {
            if (isSameSearch(computed, search)) {
                return computed.alias;
            }
        }
        return null;
    }

    /**
     * Two searches are the same when expression and options are equal and the columns name the same
     * column of the FROM table, so {@code content} and {@code a.content} match on {@code docs AS a}.
     */
    private boolean isSameSearch(ComputedColumn computed, TextSearchFilterExpr other) {
        TextSearchFilterExpr search = computed.search;
        return search != null
                && unqualifiedColumn(search.getColumn()).equals(unqualifiedColumn(other.getColumn()))
                && search.getExpression().equals(other.getExpression())
                && search.getOptions().equals(other.getOptions());
    }

    /// strips a leading qualifier naming the FROM table, by alias or by name
    private String unqualifiedColumn(String column) {
        if (table == null) {
            return column;
        }
        if (table.getAlias() != null && column.startsWith(table.getAlias() + ".")) {
            return column.substring(table.getAlias().length() + 1);
        }
        if (column.startsWith(table.getName() + ".")) {
            return column.substring(table.getName().length() + 1);
        }
        return column;
    }

    private String nextInternalScoreAlias() {
        String alias;
        do {
            alias = INTERNAL_SCORE_PREFIX + internalScoreCount++;
        } while (computedColumns.containsKey(alias) || selectItems.contains(alias));
        return alias;
    }

    public QueryBuilder selectTokenize(String column, Tokenizer tokenizer) {
        return selectTokenize(column, tokenizer, DEFAULT_TOKENIZE_OUTPUT, null, null);
    }

    public QueryBuilder selectTokenize(String column, Tokenizer tokenizer, String outputName) {
        return selectTokenize(column, tokenizer, outputName, null, null);
    }

    /**
     * Select the tokens of {@code column} as {@code outputName}.
     */
    public QueryBuilder selectTokenize(String column, Tokenizer tokenizer, String outputName,
                                       Map<String, ?> tokenizerParams, List<TokenFilter> filters) {
        SqlFragment expression = SqlFragments.tokenize(column, tokenizer, tokenizerParams, filters);
        registerComputed(outputName, ComputedKind.TOKENIZE, expression, null);
        return this;
    }

    public QueryBuilder selectTokenizeText(String text, Tokenizer tokenizer, String outputName) {
        return selectTokenizeText(text, tokenizer, outputName, null, null);
    }

    /**
     * Select the tokens of a literal text as {@code outputName}. This doesn't need a table.
     */
    public QueryBuilder selectTokenizeText(String text, Tokenizer tokenizer, String outputName,
                                           Map<String, ?> tokenizerParams, List<TokenFilter> filters) {
        SqlFragment expression = SqlFragments.tokenizeText(text, tokenizer, tokenizerParams, filters);
        registerComputed(outputName, ComputedKind.TOKENIZE, expression, null);
        return this;
    }

    /**
     * Register a computed select list column. Registering an alias again with an identical
     * expression keeps the column in place. Any other expression under a taken alias fails.
     */
    private void registerComputed(String alias, ComputedKind kind, SqlFragment expression,
                                  TextSearchFilterExpr search) {
        if (alias == null || alias.trim().isEmpty()) {
            throw new ValidationException("output name of a computed column should not be empty");
        }
        ComputedColumn existing = computedColumns.get(alias);
        if (existing != null && existing.kind != kind) {
            throw new ValidationException("output name '" + alias + "' is already used by a "
                    + existing.kind + " column");
        }
        if (existing != null && !existing.expression.equals(expression)) {
            throw new ValidationException("output name '" + alias + "' is already used by a different "
                    + kind + " expression: " + existing.expression.getSql());
        }
        for (String item : selectItems) {
            if (outputNameClashes(item, alias)) {
                throw new ValidationException("output name '" + alias + "' clashes with the select item '" + item + "'");
            }
        }
        if (existing != null) {
            logger.debug("computed column {} is already selected", alias);
            return;
        }
        computedColumns.put(alias, new ComputedColumn(alias, kind, expression, search));
    }

    private String orderKeySql(OrderKey key) {
        return computedColumns.containsKey(key.column) ? SqlFragments.quoteIdentifier(key.column) : key.column;
    }

    private static boolean outputNameClashes(String selectItem, String alias) {
        return selectItem.equals(alias) || selectItem.endsWith("." + alias);
    }

    private List<String> aliasesOf(ComputedKind kind) {
        return computedColumns.values().stream()
                .filter(computed -> computed.kind == kind)
                .map(computed -> computed.alias)
                .collect(Collectors.toList());
    }

    /**
     * Add a condition, ANDed with the conditions added before.
     */
    public QueryBuilder where(FilterExpr condition) {
        Objects.requireNonNull(condition, "condition should not be null");
        filter = filter == null ? condition : filter.and(condition);
        return this;
    }

    public QueryBuilder where(String condition, Object... params) {
        return where(Filters.of(condition, params));
    }

    public QueryBuilder andWhere(FilterExpr condition) {
        return where(condition);
    }

    public QueryBuilder andWhere(String condition, Object... params) {
        return where(condition, params);
    }

    /**
     * Add a condition, ORed with everything added before.
     */
    public QueryBuilder orWhere(FilterExpr condition) {
        Objects.requireNonNull(condition, "condition should not be null");
        filter = filter == null ? condition : filter.or(condition);
        return this;
    }

    public QueryBuilder orWhere(String condition, Object... params) {
        return orWhere(Filters.of(condition, params));
    }

    /**
     * Append a join. Joins are emitted in the order they were added.
     * @param condition must be null for {@link JoinType#CROSS} and present for the other types
     */
    public QueryBuilder join(JoinType type, TableRef other, FilterExpr condition) {
        if (table == null) {
            throw new ValidationException("can't join " + other + " without a FROM table");
        }
        joins.add(new JoinClause(type, other, condition));
        return this;
    }

    public QueryBuilder join(JoinType type, TableRef other, String condition) {
        return join(type, other, condition == null ? null : Filters.of(condition));
    }

    public QueryBuilder innerJoin(TableRef other, String condition) {
        return join(JoinType.INNER, other, condition);
    }

    public QueryBuilder innerJoin(TableRef other, FilterExpr condition) {
        return join(JoinType.INNER, other, condition);
    }

    public QueryBuilder leftJoin(TableRef other, String condition) {
        return join(JoinType.LEFT, other, condition);
    }

    public QueryBuilder leftJoin(TableRef other, FilterExpr condition) {
        return join(JoinType.LEFT, other, condition);
    }

    public QueryBuilder rightJoin(TableRef other, String condition) {
        return join(JoinType.RIGHT, other, condition);
    }

    public QueryBuilder rightJoin(TableRef other, FilterExpr condition) {
        return join(JoinType.RIGHT, other, condition);
    }

    public QueryBuilder fullJoin(TableRef other, String condition) {
        return join(JoinType.FULL, other, condition);
    }

    public QueryBuilder fullJoin(TableRef other, FilterExpr condition) {
        return join(JoinType.FULL, other, condition);
    }

    public QueryBuilder crossJoin(TableRef other) {
        return join(JoinType.CROSS, other, (FilterExpr) null);
    }

    public QueryBuilder orderBy(String column) {
        return orderBy(column, SortOrder.ASC);
    }

    public QueryBuilder orderBy(String column, String order) {
        return orderBy(column, SortOrder.fromName(order));
    }

    /**
     * Add an order key. A key naming a computed column is quoted like its alias in the select list,
     * any other key is a SQL expression used verbatim like a select item, e.g. {@code a.id} or
     * {@code lower(title)}.
     */
    public QueryBuilder orderBy(String column, SortOrder order) {
        if (column == null || column.trim().isEmpty()) {
            throw new ValidationException("order by column should not be empty");
        }
        orderKeys.add(new OrderKey(column, Objects.requireNonNull(order, "sort order should not be null")));
        return this;
    }

    public QueryBuilder orderBy(List<String> columns) {
        for (String column : columns) {
            orderBy(column, SortOrder.ASC);
        }
        return this;
    }

    public QueryBuilder limit(int limit) {
        if (limit < 0) {
            throw new ValidationException("limit should not be negative but got: " + limit);
        }
        this.limit = limit;
        return this;
    }

    public QueryBuilder offset(int offset) {
        if (offset < 0) {
            throw new ValidationException("offset should not be negative but got: " + offset);
        }
        this.offset = offset;
        return this;
    }

    /**
     * Build the statement from the current state. The builder is not modified, so compiling
     * twice without changes gives the same statement.
     */
    public SqlFragment compile() {
        List<SqlFragment> items = new ArrayList<>();
        for (String item : selectItems) {
            items.add(SqlFragment.of(item));
        }
        for (ComputedColumn computed : computedColumns.values()) {
            items.add(computed.expression.wrap("", " AS " + SqlFragments.quoteIdentifier(computed.alias)));
        }
        if (items.isEmpty()) {
            items.add(SqlFragment.of("*"));
        }

        List<SqlFragment> clauses = new ArrayList<>();
        clauses.add(SqlFragment.join(", ", items).wrap("SELECT ", ""));
        if (table != null) {
            clauses.add(SqlFragment.of("FROM " + table.toSql()));
        }
        for (JoinClause join : joins) {
            clauses.add(join.render());
        }

        SqlFragment condition = buildCondition();
        if (condition != null) {
            clauses.add(condition.wrap("WHERE ", ""));
        }

        if (!orderKeys.isEmpty()) {
            clauses.add(SqlFragment.of("ORDER BY " + orderKeys.stream()
                    .map(key -> orderKeySql(key) + " " + key.order.name())
                    .collect(Collectors.joining(", "))));
        }
        if (limit != null) {
            clauses.add(SqlFragment.of("LIMIT " + limit));
        }
        if (offset != null) {
            clauses.add(SqlFragment.of("OFFSET " + offset));
        }

        SqlFragment statement = SqlFragment.join(" ", clauses);
        logger.debug("compiled query: {}", statement.getSql());
        return statement;
    }

    private SqlFragment buildCondition() {
        List<SqlFragment> conditions = new ArrayList<>();
        if (filter != null) {
            conditions.add(filter.render());
        }
        SqlFragment distanceBounds = buildDistanceBounds();
        if (distanceBounds != null) {
            conditions.add(distanceBounds);
        }

        if (conditions.isEmpty()) {
            return null;
        }
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        return SqlFragment.join(" AND ", conditions.stream()
                .map(fragment -> fragment.wrap("(", ")"))
                .collect(Collectors.toList()));
    }

    private SqlFragment buildDistanceBounds() {
        if (distanceAlias == null || (minDistance == null && maxDistance == null)) {
            return null;
        }
        SqlFragment distance = inlineComputedReferences
                ? computedColumns.get(distanceAlias).expression
                : SqlFragment.of(SqlFragments.quoteIdentifier(distanceAlias));

        List<SqlFragment> bounds = new ArrayList<>();
        if (minDistance != null) {
            bounds.add(compare(distance, ">=", minDistance));
        }
        if (maxDistance != null) {
            bounds.add(compare(distance, "<=", maxDistance));
        }
        return SqlFragment.join(" AND ", bounds);
    }

    private static SqlFragment compare(SqlFragment left, String operator, Object value) {
        List<Object> params = new ArrayList<>(left.getParams());
        params.add(value);
        return new SqlFragment(left.getSql() + " " + operator + " " + SqlFragment.PLACEHOLDER, params);
    }

    public List<Map<String, Object>> fetchAll() throws IOException {
        return requireExecutor().fetchAll(compile());
    }

    /**
     * @return the first row or null
     */
    public Map<String, Object> fetchOne() throws IOException {
        return requireExecutor().fetchOne(compile());
    }

    public List<Map<String, Object>> fetchMany(int size) throws IOException {
        if (size <= 0) {
            throw new ValidationException("fetch size should be positive but got: " + size);
        }
        return requireExecutor().fetchMany(compile(), size);
    }

    /**
     * @return the lines of the query plan
     */
    public List<String> explain() throws IOException {
        return planLines(compile().wrap("EXPLAIN ", ""));
    }

    public List<String> explainAnalyze() throws IOException {
        return planLines(compile().wrap("EXPLAIN ANALYZE ", ""));
    }

    private List<String> planLines(SqlFragment statement) throws IOException {
        return requireExecutor().fetchAll(statement).stream()
                .map(row -> row.values().stream().map(String::valueOf).collect(Collectors.joining(" ")))
                .collect(Collectors.toList());
    }

    private StatementExecutor requireExecutor() {
        if (executor == null) {
            throw new IllegalStateException("this query builder has no executor, it can only be compiled");
        }
        return executor;
    }

    @Override
    public String toString() {
        return compile().getSql();
    }
}
