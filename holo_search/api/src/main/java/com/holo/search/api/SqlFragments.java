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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builders of the SQL expressions that call the search functions of the server.
 * <p>
 * Enumerated settings (mode, operator, tokenizer, filters, distance method) are embedded as
 * literals only after they were resolved to their enum; caller text such as the search
 * expression or a tokenized string is always bound as a parameter.
 * </p>
 */
public final class SqlFragments {
    private final static Logger logger = LoggerFactory.getLogger(SqlFragments.class);

    /// The function names below are defined by the server, so we can't change them.
    public static final String TEXT_SEARCH_FUNCTION = "TEXT_SEARCH";
    public static final String TOKENIZE_FUNCTION = "TOKENIZE";

    private static final String IDENTIFIER_QUOTE = "\"";
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private SqlFragments() {
    }

    /**
     * Build a full-text relevance expression.
     * For example, {@code TEXT_SEARCH("content", ?, mode => 'match', operator => 'AND')}.
     * The expression evaluates to the relevance score, 0 when the row does not match.
     */
    public static SqlFragment textSearch(String column, String expression, TextSearchOptions options) {
        requireText(column, "column");
        Objects.requireNonNull(expression, "search expression should not be null");
        if (options == null) {
            options = TextSearchOptions.defaults();
        }

        StringBuilder sb = new StringBuilder(TEXT_SEARCH_FUNCTION).append('(');
        sb.append(quoteIdentifier(column)).append(", ").append(SqlFragment.PLACEHOLDER);
        sb.append(", mode => ").append(quoteLiteral(options.getMode().getSqlName()));

        // other modes have no operator, so it is dropped instead of rejected
        if (options.getOperator() != null && options.getMode().acceptsOperator()) {
            sb.append(", operator => ").append(quoteLiteral(options.getOperator().name()));
        }

        AnalyzerParams analyzerParams = options.getAnalyzerParams();
        if (analyzerParams != null) {
            sb.append(", analyzer_params => ").append(analyzerParams(analyzerParams).getSql());
        } else if (options.getTokenizer() != null) {
            sb.append(", tokenizer => ").append(quoteLiteral(options.getTokenizer().getSqlName()));
        }

        if (options.getSlop() != null && options.getMode() == SearchMode.PHRASE) {
            sb.append(", options => ").append(quoteLiteral("slop=" + options.getSlop() + ";"));
        }
        sb.append(')');
        return SqlFragment.of(sb.toString(), expression);
    }

    /**
     * Build a {@code TOKENIZE} call over a column.
     * For example, {@code TOKENIZE("content", 'jieba')}.
     */
    public static SqlFragment tokenize(String column, Tokenizer tokenizer,
                                       Map<String, ?> tokenizerParams, List<TokenFilter> filters) {
        requireText(column, "column");
        return tokenizeCall(quoteIdentifier(column), new ArrayList<>(), tokenizer, tokenizerParams, filters);
    }

    /**
     * Same as {@link #tokenize(String, Tokenizer, Map, List)} with the tokenizer given by name.
     * @throws ValidationException if the tokenizer is not one of {@link Tokenizer}
     */
    public static SqlFragment tokenize(String column, String tokenizer,
                                       Map<String, ?> tokenizerParams, List<TokenFilter> filters) {
        return tokenize(column, Tokenizer.fromName(tokenizer), tokenizerParams, filters);
    }

    /**
     * Build a {@code TOKENIZE} call over a literal text, which is bound as a parameter.
     */
    public static SqlFragment tokenizeText(String text, Tokenizer tokenizer,
                                           Map<String, ?> tokenizerParams, List<TokenFilter> filters) {
        Objects.requireNonNull(text, "text to tokenize should not be null");
        List<Object> params = new ArrayList<>();
        params.add(text);
        return tokenizeCall(SqlFragment.PLACEHOLDER, params, tokenizer, tokenizerParams, filters);
    }

    private static SqlFragment tokenizeCall(String input, List<Object> params, Tokenizer tokenizer,
                                            Map<String, ?> tokenizerParams, List<TokenFilter> filters) {
        if (tokenizer == null) {
            tokenizer = Tokenizer.JIEBA;
        }
        AnalyzerParams analyzerParams = new AnalyzerParams(tokenizer, tokenizerParams, filters);
        StringBuilder sb = new StringBuilder(TOKENIZE_FUNCTION).append('(');
        sb.append(input).append(", ").append(quoteLiteral(tokenizer.getSqlName()));
        if (!analyzerParams.isPlainTokenizer()) {
            sb.append(", ").append(analyzerParams(analyzerParams).getSql());
        }
        sb.append(')');
        return new SqlFragment(sb.toString(), params);
    }

    /**
     * Serialize an analyzer into the quoted JSON literal the server functions accept.
     * For example, {@code '{"tokenizer":{"type":"jieba","mode":"exact"},"filter":["lowercase"]}'}.
     */
    public static SqlFragment analyzerParams(AnalyzerParams params) {
        return SqlFragment.of(quoteLiteral(analyzerParamsJson(params)));
    }

    /**
     * @return the analyzer serialized as JSON, without SQL quoting
     */
    public static String analyzerParamsJson(AnalyzerParams params) {
        Objects.requireNonNull(params, "analyzer params should not be null");
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode tokenizerNode = root.putObject("tokenizer");
        tokenizerNode.put("type", params.getTokenizer().getSqlName());
        params.getTokenizerParams().forEach((key, value) -> tokenizerNode.set(key, objectMapper.valueToTree(value)));

        if (!params.getFilters().isEmpty()) {
            ArrayNode filterNode = root.putArray("filter");
            for (TokenFilter filter : params.getFilters()) {
                if (filter.getParams().isEmpty()) {
                    filterNode.add(filter.getType().getSqlName());
                } else {
                    ObjectNode node = filterNode.addObject();
                    node.put("type", filter.getType().getSqlName());
                    filter.getParams().forEach((key, value) -> node.set(key, objectMapper.valueToTree(value)));
                }
            }
        }

        try {
            String json = objectMapper.writeValueAsString(root);
            logger.debug("analyzer params json: {}", json);
            return json;
        } catch (JsonProcessingException e) {
            throw new ValidationException("failed to serialize analyzer params " + params, e);
        }
    }

    /**
     * Build an approximate vector distance expression.
     * For example, {@code approx_cosine_distance("feature", ?)} with the vector bound as {@code float[]}.
     */
    public static SqlFragment vectorDistance(String column, float[] vector, DistanceMethod method) {
        requireText(column, "column");
        Objects.requireNonNull(method, "distance method should not be null");
        if (vector == null || vector.length == 0) {
            throw new ValidationException("query vector should not be empty");
        }
        String sql = method.getFunctionName() + "(" + quoteIdentifier(column) + ", " + SqlFragment.PLACEHOLDER + ")";
        return SqlFragment.of(sql, (Object) vector.clone());
    }

    /**
     * Quote a possibly qualified identifier: {@code a.content} becomes {@code "a"."content"}.
     * A star stays unquoted.
     */
    public static String quoteIdentifier(String identifier) {
        requireText(identifier, "identifier");
        return Arrays.stream(identifier.split("\\.", -1))
                .map(part -> {
                    if (part.equals("*")) {
                        return part;
                    }
                    if (part.isEmpty()) {
                        throw new ValidationException("invalid identifier: " + identifier);
                    }
                    return IDENTIFIER_QUOTE + part.replace(IDENTIFIER_QUOTE, IDENTIFIER_QUOTE + IDENTIFIER_QUOTE)
                            + IDENTIFIER_QUOTE;
                })
                .collect(Collectors.joining("."));
    }

    /**
     * Convert a string into a SQL string literal, replacing {@code '} with {@code ''}.
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    static void requireText(String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException(what + " should not be empty");
        }
    }
}
