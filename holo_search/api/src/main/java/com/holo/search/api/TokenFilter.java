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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of an analyzer's filter chain. Filters run in chain order, so
 * {@code [lowercase, stemmer]} and {@code [stemmer, lowercase]} may produce different tokens.
 */
public final class TokenFilter {
    private final TokenFilterType type;
    private final Map<String, Object> params;

    private TokenFilter(TokenFilterType type, Map<String, ?> params) {
        this.type = Objects.requireNonNull(type, "token filter type should not be null");
        this.params = params == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        if (this.params.containsKey("type")) {
            throw new ValidationException("token filter parameters must not contain the key 'type'");
        }
    }

    public static TokenFilter of(TokenFilterType type) {
        return new TokenFilter(type, null);
    }

    public static TokenFilter of(TokenFilterType type, Map<String, ?> params) {
        return new TokenFilter(type, params);
    }

    /**
     * @throws ValidationException if the name is not a known filter
     */
    public static TokenFilter of(String name) {
        return new TokenFilter(TokenFilterType.fromName(name), null);
    }

    public static TokenFilter of(String name, Map<String, ?> params) {
        return new TokenFilter(TokenFilterType.fromName(name), params);
    }

    public static TokenFilter lowercase() {
        return of(TokenFilterType.LOWERCASE);
    }

    public static TokenFilter stop(List<String> stopWords) {
        return of(TokenFilterType.STOP, Collections.singletonMap("stop_words", stopWords));
    }

    public static TokenFilter stemmer(String language) {
        return of(TokenFilterType.STEMMER, Collections.singletonMap("language", language));
    }

    public static TokenFilter length(int max) {
        if (max <= 0) {
            throw new ValidationException("max token length should be positive but got: " + max);
        }
        return of(TokenFilterType.LENGTH, Collections.singletonMap("max", max));
    }

    public static TokenFilter removePunct() {
        return of(TokenFilterType.REMOVEPUNCT);
    }

    public TokenFilterType getType() { return type; }
    public Map<String, Object> getParams() { return params; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenFilter)) return false;
        TokenFilter that = (TokenFilter) o;
        return type == that.type && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, params);
    }

    @Override
    public String toString() {
        return params.isEmpty() ? type.getSqlName() : type.getSqlName() + params;
    }
}
