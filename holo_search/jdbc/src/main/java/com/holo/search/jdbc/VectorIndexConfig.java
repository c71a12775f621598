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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.holo.search.api.DistanceMethod;
import com.holo.search.api.ValidationException;

import java.util.Objects;

/**
 * Build settings of the HGraph vector index on one column.
 * Every builder parameter has the server's recommended default.
 */
public final class VectorIndexConfig {
    public static final String ALGORITHM = "HGraph";

    private final DistanceMethod distanceMethod;
    private String baseQuantizationType = "rabitq";
    private int maxDegree = 64;
    private int efConstruction = 400;
    private boolean useReorder = false;
    private String preciseQuantizationType = "fp32";
    private String preciseIoType = "block_memory_io";
    private int maxTotalSizeToMergeMb = 4096;
    private int buildThreadCount = 16;

    private VectorIndexConfig(DistanceMethod distanceMethod) {
        this.distanceMethod = Objects.requireNonNull(distanceMethod, "Distance method must be set");
    }

    public static VectorIndexConfig of(DistanceMethod distanceMethod) {
        return new VectorIndexConfig(distanceMethod);
    }

    public static VectorIndexConfig of(String distanceMethod) {
        return new VectorIndexConfig(DistanceMethod.fromName(distanceMethod));
    }

    public VectorIndexConfig baseQuantizationType(String type) {
        this.baseQuantizationType = requireText(type, "base quantization type");
        return this;
    }

    public VectorIndexConfig maxDegree(int maxDegree) {
        this.maxDegree = requirePositive(maxDegree, "max degree");
        return this;
    }

    public VectorIndexConfig efConstruction(int efConstruction) {
        this.efConstruction = requirePositive(efConstruction, "ef construction");
        return this;
    }

    public VectorIndexConfig useReorder(boolean useReorder) {
        this.useReorder = useReorder;
        return this;
    }

    public VectorIndexConfig preciseQuantizationType(String type) {
        this.preciseQuantizationType = requireText(type, "precise quantization type");
        return this;
    }

    public VectorIndexConfig preciseIoType(String type) {
        this.preciseIoType = requireText(type, "precise io type");
        return this;
    }

    public VectorIndexConfig maxTotalSizeToMergeMb(int size) {
        this.maxTotalSizeToMergeMb = requirePositive(size, "max total size to merge");
        return this;
    }

    public VectorIndexConfig buildThreadCount(int count) {
        this.buildThreadCount = requirePositive(count, "build thread count");
        return this;
    }

    public DistanceMethod getDistanceMethod() { return distanceMethod; }

    /**
     * @return the index definition of one column, in the field order the server documents
     */
    ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("algorithm", ALGORITHM);
        node.put("distance_method", distanceMethod.getIndexName());
        ObjectNode builderParams = node.putObject("builder_params");
        builderParams.put("max_degree", maxDegree);
        builderParams.put("ef_construction", efConstruction);
        builderParams.put("base_quantization_type", baseQuantizationType);
        builderParams.put("use_reorder", useReorder);
        builderParams.put("precise_quantization_type", preciseQuantizationType);
        builderParams.put("precise_io_type", preciseIoType);
        builderParams.put("max_total_size_to_merge_mb", maxTotalSizeToMergeMb);
        builderParams.put("build_thread_count", buildThreadCount);
        return node;
    }

    private static String requireText(String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException(what + " should not be empty");
        }
        return value;
    }

    private static int requirePositive(int value, String what) {
        if (value <= 0) {
            throw new ValidationException(what + " should be positive but got: " + value);
        }
        return value;
    }
}
