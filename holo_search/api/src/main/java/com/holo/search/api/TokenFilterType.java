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

public enum TokenFilterType {
    LOWERCASE("lowercase"),
    STOP("stop"),
    STEMMER("stemmer"),
    LENGTH("length"),
    REMOVEPUNCT("removepunct"),
    PINYIN("pinyin");

    private final String sqlName;

    TokenFilterType(String sqlName) {
        this.sqlName = sqlName;
    }

    public String getSqlName() { return sqlName; }

    public static TokenFilterType fromName(String name) {
        return NamedValues.fromName(TokenFilterType.class, "token filter", name, TokenFilterType::getSqlName, true);
    }
}
