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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.holo.search.api.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Handle of one table. It creates query builders over the table and runs the table level
 * statements: inserts, deletes, maintenance and index management.
 */
public class HoloTable {
    private final static Logger logger = LoggerFactory.getLogger(HoloTable.class);

    static final String VECTORS_PROPERTY = "vectors";
    static final String DEFAULT_DISTANCE_OUTPUT = "distance";
    static final String DEFAULT_SCORE_OUTPUT = "text_search_score";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Single line JSON with a space after {@code :} and {@code ,}, the layout the server side
     * tooling writes the {@code vectors} property in.
     */
    private static final class SpacedPrettyPrinter extends MinimalPrettyPrinter {
        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }

    private final StatementExecutor executor;
    private final String schema;
    private final String name;
    private final String alias;
    private final Map<String, DistanceMethod> columnDistanceMethods = new HashMap<>();
    private List<String> columns;

    public HoloTable(StatementExecutor executor, String schema, String name) {
        this(executor, schema, name, null);
    }

    public HoloTable(StatementExecutor executor, String schema, String name, String alias) {
        this.executor = executor;
        this.schema = schema == null ? HoloConfig.DEFAULT_SCHEMA : schema;
        this.name = TableRef.of(name, alias).getName();
        this.alias = alias;
    }

    public String getName() { return name; }
    /** may be null */
    public String getAlias() { return alias; }
    public String getSchema() { return schema; }

    public TableRef ref() {
        return TableRef.of(name, alias);
    }

    Map<String, DistanceMethod> getColumnDistanceMethods() {
        return Collections.unmodifiableMap(columnDistanceMethods);
    }

    /**
     * @return a new query builder over this table
     */
    public QueryBuilder newQuery() {
        return new QueryBuilder(executor, ref());
    }

    /**
     * @return a new query builder over this table under another alias
     */
    public QueryBuilder queryAs(String tableAlias) {
        return new QueryBuilder(executor, ref().withAlias(tableAlias));
    }

    public QueryBuilder select(String... columns) {
        return newQuery().select(columns);
    }

    public QueryBuilder select(List<String> columns) {
        return newQuery().select(columns);
    }

    /**
     * Query the rows whose {@code keyColumn} equals {@code keyValue}.
     * @param returnColumns the columns to return, all of them if null or empty
     */
    public QueryBuilder getByKey(String keyColumn, Object keyValue, List<String> returnColumns) {
        return selectColumns(returnColumns)
                .where(SqlFragments.quoteIdentifier(keyColumn) + " = " + SqlFragment.PLACEHOLDER, keyValue);
    }

    /**
     * Query the rows whose {@code keyColumn} is one of {@code keyValues}. An empty key list
     * selects nothing.
     */
    public QueryBuilder getMultiByKeys(String keyColumn, List<?> keyValues, List<String> returnColumns) {
        QueryBuilder query = selectColumns(returnColumns);
        if (keyValues == null || keyValues.isEmpty()) {
            return query.where("FALSE");
        }
        String placeholders = String.join(", ", Collections.nCopies(keyValues.size(), SqlFragment.PLACEHOLDER));
        return query.where(SqlFragments.quoteIdentifier(keyColumn) + " IN (" + placeholders + ")",
                keyValues.toArray());
    }

    private QueryBuilder selectColumns(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            return newQuery().select("*");
        }
        return newQuery().select(columns);
    }

    public QueryBuilder searchVector(float[] vector, String column, DistanceMethod distanceMethod) {
        return searchVector(vector, column, DEFAULT_DISTANCE_OUTPUT, distanceMethod);
    }

    /**
     * Select every column plus the distance to {@code vector}, nearest rows first.
     */
    public QueryBuilder searchVector(float[] vector, String column, String outputName,
                                     DistanceMethod distanceMethod) {
        return newQuery()
                .select("*")
                .selectVectorSearch(vector, column, distanceMethod, outputName)
                .orderBy(outputName, distanceMethod.nearestFirst());
    }

    /**
     * Same as {@link #searchVector(float[], String, String, DistanceMethod)} with the distance
     * method of the column's vector index.
     * @throws ValidationException if the column has no vector index
     */
    public QueryBuilder searchVector(float[] vector, String column, String outputName) throws IOException {
        return searchVector(vector, column, outputName, getColumnDistanceMethod(column));
    }

    private DistanceMethod getColumnDistanceMethod(String column) throws IOException {
        DistanceMethod method = columnDistanceMethods.get(column);
        if (method != null) {
            return method;
        }
        JsonNode info = getVectorIndexInfo();
        JsonNode columnInfo = info == null ? null : info.get(column);
        if (columnInfo == null || !columnInfo.hasNonNull("distance_method")) {
            throw new ValidationException("Distance method must be set, column " + column
                    + " of table " + name + " has no vector index");
        }
        method = DistanceMethod.fromName(columnInfo.get("distance_method").asText());
        columnDistanceMethods.put(column, method);
        return method;
    }

    /**
     * Query the rows matching a full-text search.
     * @param minThreshold lower bound of the relevance score, may be null
     * @param scoreName select the score under this name, may be null
     * @param returnAllColumns select every column of the table
     */
    public QueryBuilder searchText(String column, String expression, TextSearchOptions options,
                                   Double minThreshold, String scoreName, boolean returnAllColumns) {
        QueryBuilder query = newQuery();
        if (returnAllColumns || scoreName == null) {
            query.select("*");
        }
        if (scoreName != null) {
            query.selectTextSearch(column, expression, scoreName, options);
        }
        return query.whereTextSearch(column, expression, options, minThreshold, null, scoreName);
    }

    public QueryBuilder searchText(String column, String expression) {
        return searchText(column, expression, TextSearchOptions.defaults(), null, null, true);
    }

    /**
     * @return the tokens the tokenizer produces for {@code text}, null if the server returned nothing
     */
    public List<String> showTokenizeEffect(String text, Tokenizer tokenizer, Map<String, ?> tokenizerParams,
                                           List<TokenFilter> filters) throws IOException {
        Map<String, Object> row = new QueryBuilder(executor, null)
                .selectTokenizeText(text, tokenizer, QueryBuilder.DEFAULT_TOKENIZE_OUTPUT, tokenizerParams, filters)
                .fetchOne();
        return row == null ? null : toTokens(row.get(QueryBuilder.DEFAULT_TOKENIZE_OUTPUT));
    }

    public List<String> showTokenizeEffect(String text, Tokenizer tokenizer) throws IOException {
        return showTokenizeEffect(text, tokenizer, null, null);
    }

    /**
     * @return the tokens of {@code column} in the first row of the table, null if the table is empty
     */
    public List<String> showColumnTokenizeEffect(String column, Tokenizer tokenizer) throws IOException {
        Map<String, Object> row = newQuery().selectTokenize(column, tokenizer).fetchOne();
        return row == null ? null : toTokens(row.get(QueryBuilder.DEFAULT_TOKENIZE_OUTPUT));
    }

    private static List<String> toTokens(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Object[]) {
            return Arrays.stream((Object[]) value).map(String::valueOf).collect(Collectors.toList());
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).collect(Collectors.toList());
        }
        return Collections.singletonList(String.valueOf(value));
    }

    public HoloTable insertOne(List<?> values) throws IOException {
        return insertOne(values, null);
    }

    /**
     * @param columnNames the target columns, or null to fill the columns in table order
     */
    public HoloTable insertOne(List<?> values, List<String> columnNames) throws IOException {
        return insertMulti(Collections.singletonList(values), columnNames);
    }

    public HoloTable insertMulti(List<? extends List<?>> rows) throws IOException {
        return insertMulti(rows, null);
    }

    /**
     * Insert all rows with one statement. Vectors are passed as {@code float[]}.
     */
    public HoloTable insertMulti(List<? extends List<?>> rows, List<String> columnNames) throws IOException {
        if (rows == null || rows.isEmpty()) {
            logger.debug("nothing to insert into {}", name);
            return this;
        }
        executor.execute(valuesStatement("INSERT INTO ", rows, columnNames));
        return this;
    }

    /**
     * @return {@code <verb> "table" ("c1", "c2") VALUES (?, ?), (?, ?)}, the column list only if
     *         {@code columnNames} is not empty
     */
    private SqlFragment valuesStatement(String verb, List<? extends List<?>> rows, List<String> columnNames) {
        int width = columnNames != null && !columnNames.isEmpty() ? columnNames.size() : rows.get(0).size();
        if (width == 0) {
            throw new ValidationException("row to insert should not be empty");
        }
        String valuesTemplate = "(" + String.join(", ", Collections.nCopies(width, SqlFragment.PLACEHOLDER)) + ")";
        List<Object> params = new ArrayList<>();
        for (List<?> row : rows) {
            if (row.size() != width) {
                throw new ValidationException("row " + row + " has " + row.size() + " values but expected " + width);
            }
            params.addAll(row);
        }

        StringBuilder sb = new StringBuilder(verb).append(SqlFragments.quoteIdentifier(name));
        if (columnNames != null && !columnNames.isEmpty()) {
            sb.append(" (").append(columnNames.stream()
                    .map(SqlFragments::quoteIdentifier).collect(Collectors.joining(", "))).append(")");
        }
        sb.append(" VALUES ").append(String.join(", ", Collections.nCopies(rows.size(), valuesTemplate)));
        return new SqlFragment(sb.toString(), params);
    }

    public HoloTable upsertOne(String indexColumn, List<?> values, List<String> columnNames,
                               boolean update) throws IOException {
        return upsertOne(indexColumn, values, columnNames, update, null, null, null);
    }

    public HoloTable upsertOne(String indexColumn, List<?> values, List<String> columnNames, boolean update,
                               List<String> updateColumns, String updateAction,
                               String updateCondition) throws IOException {
        return upsertMulti(indexColumn, Collections.singletonList(values), columnNames, update,
                updateColumns, updateAction, updateCondition);
    }

    public HoloTable upsertMulti(String indexColumn, List<? extends List<?>> rows, List<String> columnNames,
                                 boolean update) throws IOException {
        return upsertMulti(indexColumn, rows, columnNames, update, null, null, null);
    }

    /**
     * Insert rows, resolving conflicts on {@code indexColumn} with
     * {@code ON CONFLICT ("index") DO UPDATE SET ..} or {@code DO NOTHING}.
     * @param columnNames the target columns, or null for all columns of the table in table order
     * @param update update the conflicting row if true, keep it if false
     * @param updateColumns the columns set from {@code EXCLUDED}, null for every column except the index column
     * @param updateAction a raw {@code SET} list used instead of {@code updateColumns}, may be null
     * @param updateCondition a raw condition limiting the update, may be null
     */
    public HoloTable upsertMulti(String indexColumn, List<? extends List<?>> rows, List<String> columnNames,
                                 boolean update, List<String> updateColumns, String updateAction,
                                 String updateCondition) throws IOException {
        if (indexColumn == null || indexColumn.trim().isEmpty()) {
            throw new ValidationException("index column of an upsert should not be empty");
        }
        if (updateColumns != null && !updateColumns.isEmpty() && updateAction != null) {
            throw new ValidationException("Only one of update columns or update action can be provided");
        }
        if (!update && updateCondition != null) {
            throw new ValidationException("update condition requires update to be enabled");
        }
        if (rows == null || rows.isEmpty()) {
            logger.debug("nothing to upsert into {}", name);
            return this;
        }
        List<String> targetColumns = columnNames == null || columnNames.isEmpty() ? getAllColumnNames() : columnNames;

        StringBuilder conflict = new StringBuilder(" ON CONFLICT (")
                .append(SqlFragments.quoteIdentifier(indexColumn)).append(")");
        if (!update) {
            conflict.append(" DO NOTHING");
        } else {
            String setList = updateAction;
            if (setList == null) {
                List<String> toUpdate = updateColumns != null && !updateColumns.isEmpty() ? updateColumns
                        : targetColumns.stream().filter(column -> !column.equals(indexColumn)).collect(Collectors.toList());
                if (toUpdate.isEmpty()) {
                    throw new ValidationException("no column to update besides the index column " + indexColumn);
                }
                setList = toUpdate.stream()
                        .map(column -> SqlFragments.quoteIdentifier(column) + " = EXCLUDED." + SqlFragments.quoteIdentifier(column))
                        .collect(Collectors.joining(", "));
            }
            conflict.append(" DO UPDATE SET ").append(setList);
            if (updateCondition != null) {
                conflict.append(" WHERE ").append(updateCondition);
            }
        }
        executor.execute(valuesStatement("INSERT INTO ", rows, targetColumns).wrap("", conflict.toString()));
        return this;
    }

    public HoloTable overwrite(List<? extends List<?>> rows) throws IOException {
        return overwrite(rows, null, null);
    }

    public HoloTable overwrite(QueryBuilder source) throws IOException {
        return overwrite(null, null, source == null ? null : source.compile());
    }

    /**
     * Replace the content of the table with {@code INSERT OVERWRITE}, from rows or from a query.
     * @param columnNames the target columns of {@code rows}, may be null
     * @param source a {@code SELECT} statement providing the new content, may be null
     * @throws ValidationException if none or both of {@code rows} and {@code source} are given
     */
    public HoloTable overwrite(List<? extends List<?>> rows, List<String> columnNames,
                               SqlFragment source) throws IOException {
        boolean hasRows = rows != null && !rows.isEmpty();
        if (!hasRows && source == null) {
            throw new ValidationException("Either values or values_expression must be provided");
        }
        if (hasRows && source != null) {
            throw new ValidationException("Only one of values or values_expression can be provided");
        }
        if (hasRows) {
            executor.execute(valuesStatement("INSERT OVERWRITE ", rows, columnNames));
        } else {
            executor.execute(source.wrap("INSERT OVERWRITE " + SqlFragments.quoteIdentifier(name) + " ", ""));
        }
        return this;
    }

    public HoloTable update(List<String> columns, List<?> values, FilterExpr condition) throws IOException {
        return update(columns, values, null, null, condition);
    }

    public HoloTable update(List<String> columns, List<?> values, String condition,
                            Object... params) throws IOException {
        return update(columns, values, null, null, condition == null ? null : Filters.of(condition, params));
    }

    /**
     * Set {@code columns} to {@code values} on the rows matching {@code condition}, every row if it is null.
     * @param tableAlias the alias of this table in the statement, null for the alias of this handle
     * @param from an extra table the condition may refer to, may be null
     */
    public HoloTable update(List<String> columns, List<?> values, String tableAlias, TableRef from,
                            FilterExpr condition) throws IOException {
        if (columns == null || columns.isEmpty()) {
            throw new ValidationException("columns to update should not be empty");
        }
        if (values == null || values.size() != columns.size()) {
            throw new ValidationException("got " + (values == null ? 0 : values.size()) + " values for "
                    + columns.size() + " columns to update");
        }
        String targetAlias = tableAlias != null ? tableAlias : alias;
        StringBuilder sb = new StringBuilder("UPDATE ").append(TableRef.of(name, targetAlias).toSql())
                .append(" SET ").append(columns.stream()
                        .map(column -> SqlFragments.quoteIdentifier(column) + " = " + SqlFragment.PLACEHOLDER)
                        .collect(Collectors.joining(", ")));
        if (from != null) {
            sb.append(" FROM ").append(from.toSql());
        }
        List<Object> params = new ArrayList<>(values);
        if (condition != null) {
            SqlFragment where = condition.render();
            sb.append(" WHERE ").append(where.getSql());
            params.addAll(where.getParams());
        }
        executor.execute(new SqlFragment(sb.toString(), params));
        return this;
    }

    public HoloTable delete(FilterExpr condition) throws IOException {
        SqlFragment where = condition.render();
        executor.execute(where.wrap("DELETE FROM " + SqlFragments.quoteIdentifier(name) + " WHERE ", ""));
        return this;
    }

    public HoloTable delete(String condition, Object... params) throws IOException {
        return delete(Filters.of(condition, params));
    }

    public HoloTable truncate() throws IOException {
        executor.execute(SqlFragment.of("TRUNCATE TABLE " + SqlFragments.quoteIdentifier(name)));
        return this;
    }

    public HoloTable vacuum() throws IOException {
        executor.execute(SqlFragment.of("VACUUM " + SqlFragments.quoteIdentifier(name)));
        return this;
    }

    public void drop() throws IOException {
        executor.execute(SqlFragment.of("DROP TABLE IF EXISTS " + SqlFragments.quoteIdentifier(name)));
        columnDistanceMethods.clear();
        columns = null;
    }

    /**
     * @return the column names of the table in table order. The first call reads them from
     *         {@code information_schema}, later calls return the cached list.
     */
    public List<String> getAllColumnNames() throws IOException {
        if (columns != null) {
            return columns;
        }
        List<Map<String, Object>> rows = executor.fetchAll(SqlFragment.of(
                "SELECT column_name FROM information_schema.columns " +
                        "WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position",
                schema, name));
        List<String> names = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            names.add(String.valueOf(row.values().iterator().next()));
        }
        if (names.isEmpty()) {
            throw new ValidationException("table " + schema + "." + name + " has no columns or doesn't exist");
        }
        columns = Collections.unmodifiableList(names);
        return columns;
    }

    public HoloTable setVectorIndex(String column, VectorIndexConfig config) throws IOException {
        Map<String, VectorIndexConfig> configs = new LinkedHashMap<>();
        configs.put(column, config);
        return setVectorIndexes(configs);
    }

    /**
     * Replace the vector indexes of the table. Columns that are not in {@code configs} lose
     * their index.
     */
    public HoloTable setVectorIndexes(Map<String, VectorIndexConfig> configs) throws IOException {
        ObjectNode vectors = objectMapper.createObjectNode();
        configs.forEach((column, config) -> vectors.set(column, config.toJson()));
        setVectorsProperty(vectors);
        columnDistanceMethods.clear();
        configs.forEach((column, config) -> columnDistanceMethods.put(column, config.getDistanceMethod()));
        return this;
    }

    public HoloTable deleteVectorIndexes() throws IOException {
        setVectorsProperty(objectMapper.createObjectNode());
        columnDistanceMethods.clear();
        return this;
    }

    private void setVectorsProperty(ObjectNode vectors) throws IOException {
        String json;
        try {
            json = objectMapper.writer(new SpacedPrettyPrinter()).writeValueAsString(vectors);
        } catch (JsonProcessingException e) {
            throw new ValidationException("failed to serialize vector index config", e);
        }
        executor.execute(SqlFragment.of(String.format("CALL set_table_property(%s, %s, %s)",
                SqlFragments.quoteLiteral(name), SqlFragments.quoteLiteral(VECTORS_PROPERTY),
                SqlFragments.quoteLiteral(json))));
    }

    /**
     * @return the vector index definitions keyed by column, or null if the table has none
     *         or they can't be parsed
     */
    public JsonNode getVectorIndexInfo() throws IOException {
        Map<String, Object> row = executor.fetchOne(SqlFragment.of(
                "SELECT property_value FROM hologres.hg_table_properties " +
                        "WHERE table_namespace = ? AND table_name = ? AND property_key = ?",
                schema, name, VECTORS_PROPERTY));
        if (row == null || row.isEmpty()) {
            return null;
        }
        Iterator<Object> values = row.values().iterator();
        Object value = values.next();
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.readTree(value.toString());
        } catch (JsonProcessingException e) {
            logger.warn("invalid vector index info of table {}: {}", name, value, e);
            return null;
        }
    }

    public HoloTable createTextIndex(String indexName, String column) throws IOException {
        return createTextIndex(indexName, column, null, null, null);
    }

    /**
     * Create a full-text index on {@code column} if no index with that name exists.
     * @param tokenizer null for the server default
     */
    public HoloTable createTextIndex(String indexName, String column, Tokenizer tokenizer,
                                     Map<String, ?> tokenizerParams, List<TokenFilter> filters) throws IOException {
        String sql = "CREATE INDEX IF NOT EXISTS " + SqlFragments.quoteIdentifier(indexName)
                + " ON " + SqlFragments.quoteIdentifier(name)
                + " USING FULLTEXT (" + SqlFragments.quoteIdentifier(column) + ")";
        String properties = textIndexProperties(tokenizer, tokenizerParams, filters);
        if (!properties.isEmpty()) {
            sql += " WITH (" + properties + ")";
        }
        executor.execute(SqlFragment.of(sql));
        return this;
    }

    public HoloTable setTextIndex(String indexName, Tokenizer tokenizer) throws IOException {
        return setTextIndex(indexName, tokenizer, null, null);
    }

    public HoloTable setTextIndex(String indexName, Tokenizer tokenizer, Map<String, ?> tokenizerParams,
                                  List<TokenFilter> filters) throws IOException {
        if (tokenizer == null) {
            throw new ValidationException("tokenizer should not be null");
        }
        executor.execute(SqlFragment.of("ALTER INDEX " + SqlFragments.quoteIdentifier(indexName)
                + " SET (" + textIndexProperties(tokenizer, tokenizerParams, filters) + ")"));
        return this;
    }

    /**
     * Restore the default analyzer of an index.
     * @param onlyAnalyzerParams reset the analyzer params but keep the tokenizer
     */
    public HoloTable resetTextIndex(String indexName, boolean onlyAnalyzerParams) throws IOException {
        String property = onlyAnalyzerParams ? "analyzer_params" : "tokenizer";
        executor.execute(SqlFragment.of("ALTER INDEX " + SqlFragments.quoteIdentifier(indexName)
                + " RESET (" + property + ")"));
        return this;
    }

    public HoloTable dropTextIndex(String indexName) throws IOException {
        executor.execute(SqlFragment.of("DROP INDEX IF EXISTS " + SqlFragments.quoteIdentifier(indexName)));
        return this;
    }

    private static String textIndexProperties(Tokenizer tokenizer, Map<String, ?> tokenizerParams,
                                              List<TokenFilter> filters) {
        List<String> properties = new ArrayList<>();
        if (tokenizer != null) {
            properties.add("tokenizer = " + SqlFragments.quoteLiteral(tokenizer.getSqlName()));
        }
        AnalyzerParams analyzerParams = new AnalyzerParams(
                tokenizer == null ? Tokenizer.JIEBA : tokenizer, tokenizerParams, filters);
        if (!analyzerParams.isPlainTokenizer()) {
            properties.add("analyzer_params = " + SqlFragments.analyzerParams(analyzerParams).getSql());
        }
        return String.join(", ", properties);
    }

    /**
     * @return one row per property of the full-text indexes of this table
     */
    public List<Map<String, Object>> getIndexProperties() throws IOException {
        return executor.fetchAll(SqlFragment.of(
                "SELECT index_id, table_namespace, table_name, index_name, property_key, property_value " +
                        "FROM hologres.hg_index_properties WHERE table_namespace = ? AND table_name = ?",
                schema, name));
    }

    @Override
    public String toString() {
        return "HoloTable{" + schema + "." + name + (alias == null ? "" : " AS " + alias) + "}";
    }
}
