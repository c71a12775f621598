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
 * Distance methods supported by the vector index. Each one maps to an approximate distance
 * function on the server.
 */
public enum DistanceMethod {
    EUCLIDEAN("Euclidean", "approx_euclidean_distance", SortOrder.ASC),
    INNER_PRODUCT("InnerProduct", "approx_inner_product_distance", SortOrder.DESC),
    COSINE("Cosine", "approx_cosine_distance", SortOrder.DESC);

    private final String indexName;
    private final String functionName;
    private final SortOrder nearestFirst;

    DistanceMethod(String indexName, String functionName, SortOrder nearestFirst) {
        this.indexName = indexName;
        this.functionName = functionName;
        this.nearestFirst = nearestFirst;
    }

    /** the name used in the index definition, e.g. {@code Cosine} */
    public String getIndexName() { return indexName; }
    public String getFunctionName() { return functionName; }

    /** the order that puts the closest vectors first */
    public SortOrder nearestFirst() { return nearestFirst; }

    public static DistanceMethod fromName(String name) {
        return NamedValues.fromName(DistanceMethod.class, "distance method", name, DistanceMethod::getIndexName, true);
    }
}
