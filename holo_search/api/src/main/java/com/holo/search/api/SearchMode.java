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

/**
 * How {@code TEXT_SEARCH} interprets the search expression.
 */
public enum SearchMode {
    /** keyword match, terms combined with the {@link SearchOperator} */
    MATCH("match", true),
    /** terms must appear as a phrase, optionally within a slop */
    PHRASE("phrase", false),
    /** boolean query syntax: +must -must_not "phrase"~slop */
    NATURAL_LANGUAGE("natural_language", false),
    /** the expression is one exact term, not tokenized */
    TERM("term", true);

    private final String sqlName;
    private final boolean acceptsOperator;

    SearchMode(String sqlName, boolean acceptsOperator) {
        this.sqlName = sqlName;
        this.acceptsOperator = acceptsOperator;
    }

    public String getSqlName() { return sqlName; }
    public boolean acceptsOperator() { return acceptsOperator; }

    public static SearchMode fromName(String name) {
        return NamedValues.fromName(SearchMode.class, "search mode", name, SearchMode::getSqlName, true);
    }
}
