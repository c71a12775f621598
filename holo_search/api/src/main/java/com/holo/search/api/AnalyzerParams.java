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
 * A custom analyzer: a tokenizer with its parameters followed by an ordered filter chain.
 */
public final class AnalyzerParams {
    private final Tokenizer tokenizer;
    private final Map<String, Object> tokenizerParams;
    private final List<TokenFilter> filters;

    public AnalyzerParams(Tokenizer tokenizer, Map<String, ?> tokenizerParams, List<TokenFilter> filters) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer should not be null");
        this.tokenizerParams = tokenizerParams == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tokenizerParams));
        this.filters = filters == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(filters));
        if (this.tokenizerParams.containsKey("type")) {
            throw new ValidationException("tokenizer parameters must not contain the key 'type'");
        }
        for (TokenFilter filter : this.filters) {
            Objects.requireNonNull(filter, "token filter chain should not contain null");
        }
    }

    public Tokenizer getTokenizer() { return tokenizer; }
    public Map<String, Object> getTokenizerParams() { return tokenizerParams; }
    public List<TokenFilter> getFilters() { return filters; }

    /**
     * @return true if nothing beyond the tokenizer name is configured
     */
    public boolean isPlainTokenizer() {
        return tokenizerParams.isEmpty() && filters.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalyzerParams)) return false;
        AnalyzerParams that = (AnalyzerParams) o;
        return tokenizer == that.tokenizer
                && tokenizerParams.equals(that.tokenizerParams)
                && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tokenizer, tokenizerParams, filters);
    }

    @Override
    public String toString() {
        return "AnalyzerParams{" +
                "tokenizer=" + tokenizer +
                ", tokenizerParams=" + tokenizerParams +
                ", filters=" + filters +
                '}';
    }
}
