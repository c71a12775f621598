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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings of a {@code TEXT_SEARCH} call. Every {@code with*} method returns a copy.
 */
public final class TextSearchOptions {
    private static final TextSearchOptions DEFAULTS =
            new TextSearchOptions(SearchMode.MATCH, null, null, null, null, null);

    private final SearchMode mode;
    private final SearchOperator operator;
    private final Tokenizer tokenizer;
    private final Map<String, Object> tokenizerParams;
    private final List<TokenFilter> filters;
    private final Integer slop;

    private TextSearchOptions(SearchMode mode, SearchOperator operator, Tokenizer tokenizer,
                              Map<String, ?> tokenizerParams, List<TokenFilter> filters, Integer slop) {
        this.mode = Objects.requireNonNull(mode, "search mode should not be null");
        this.operator = operator;
        this.tokenizer = tokenizer;
        this.tokenizerParams = tokenizerParams == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tokenizerParams));
        this.filters = filters == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(filters));
        if (slop != null && slop < 0) {
            throw new ValidationException("slop should not be negative but got: " + slop);
        }
        this.slop = slop;
    }

    public static TextSearchOptions defaults() {
        return DEFAULTS;
    }

    public TextSearchOptions withMode(SearchMode mode) {
        return new TextSearchOptions(mode, operator, tokenizer, tokenizerParams, filters, slop);
    }

    public TextSearchOptions withMode(String mode) {
        return withMode(SearchMode.fromName(mode));
    }

    public TextSearchOptions withOperator(SearchOperator operator) {
        return new TextSearchOptions(mode, operator, tokenizer, tokenizerParams, filters, slop);
    }

    public TextSearchOptions withOperator(String operator) {
        return withOperator(SearchOperator.fromName(operator));
    }

    public TextSearchOptions withTokenizer(Tokenizer tokenizer) {
        return new TextSearchOptions(mode, operator, tokenizer, tokenizerParams, filters, slop);
    }

    public TextSearchOptions withTokenizer(String tokenizer) {
        return withTokenizer(Tokenizer.fromName(tokenizer));
    }

    public TextSearchOptions withTokenizerParams(Map<String, ?> tokenizerParams) {
        return new TextSearchOptions(mode, operator, tokenizer, tokenizerParams, filters, slop);
    }

    public TextSearchOptions withFilters(List<TokenFilter> filters) {
        return new TextSearchOptions(mode, operator, tokenizer, tokenizerParams, filters, slop);
    }

    public TextSearchOptions withSlop(int slop) {
        return new TextSearchOptions(mode, operator, tokenizer, tokenizerParams, filters, slop);
    }

    public SearchMode getMode() { return mode; }
    /** may be null, the server then uses OR */
    public SearchOperator getOperator() { return operator; }
    /** may be null, the server then uses the tokenizer of the full-text index */
    public Tokenizer getTokenizer() { return tokenizer; }
    public Map<String, Object> getTokenizerParams() { return tokenizerParams; }
    public List<TokenFilter> getFilters() { return filters; }
    public Integer getSlop() { return slop; }

    /**
     * @return the custom analyzer, or null when only a tokenizer name (or nothing) is configured
     */
    public AnalyzerParams getAnalyzerParams() {
        if (tokenizerParams.isEmpty() && filters.isEmpty()) {
            return null;
        }
        return new AnalyzerParams(tokenizer == null ? Tokenizer.JIEBA : tokenizer, tokenizerParams, filters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextSearchOptions)) return false;
        TextSearchOptions that = (TextSearchOptions) o;
        return mode == that.mode
                && operator == that.operator
                && tokenizer == that.tokenizer
                && tokenizerParams.equals(that.tokenizerParams)
                && filters.equals(that.filters)
                && Objects.equals(slop, that.slop);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, operator, tokenizer, tokenizerParams, filters, slop);
    }

    @Override
    public String toString() {
        return "TextSearchOptions{" +
                "mode=" + mode +
                ", operator=" + operator +
                ", tokenizer=" + tokenizer +
                ", tokenizerParams=" + tokenizerParams +
                ", filters=" + filters +
                ", slop=" + slop +
                '}';
    }
}
