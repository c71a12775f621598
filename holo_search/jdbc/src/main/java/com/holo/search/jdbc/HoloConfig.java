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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Connection settings of a Hologres instance, parsed from a JSON string such as
 * <pre>
 *   {"host": "...", "port": 80, "database": "db", "access_key_id": "...", "access_key_secret": "..."}
 * </pre>
 */
public class HoloConfig {
    public static final String DEFAULT_SCHEMA = "public";

    public String host;
    public Integer port;
    public String database;
    public String access_key_id;
    public String access_key_secret;
    public String schema = DEFAULT_SCHEMA;
    public boolean autocommit = true;

    public static HoloConfig of(String parameters) {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            HoloConfig config = objectMapper.readValue(parameters, HoloConfig.class);
            config.validate();
            return config;
        } catch (JsonProcessingException e) {
            throw new RuntimeException(String.format("failed to parse json: %s", mask(parameters)), e);
        }
    }

    public static HoloConfig of(String host, int port, String database, String accessKeyId, String accessKeySecret) {
        HoloConfig config = new HoloConfig();
        config.host = host;
        config.port = port;
        config.database = database;
        config.access_key_id = accessKeyId;
        config.access_key_secret = accessKeySecret;
        config.validate();
        return config;
    }

    void validate() {
        if (host == null || port == null || database == null || access_key_id == null || access_key_secret == null) {
            throw new IllegalArgumentException("host, port, database, access_key_id or access_key_secret is null.");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("invalid port: " + port);
        }
        if (schema == null || schema.isEmpty()) {
            schema = DEFAULT_SCHEMA;
        }
    }

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s?currentSchema=%s", host, port, database, schema);
    }

    /// The raw input may carry the secret, so it is never logged as is.
    private static String mask(String parameters) {
        if (parameters == null) {
            return null;
        }
        return parameters.replaceAll("(\"access_key_secret\"\\s*:\\s*)\"[^\"]*\"", "$1\"****\"");
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    public String toDisplayString() {
        HoloConfig other = new HoloConfig();
        other.host = this.host;
        other.port = this.port;
        other.database = this.database;
        other.access_key_id = this.access_key_id;
        other.access_key_secret = "****";
        other.schema = this.schema;
        other.autocommit = this.autocommit;
        ObjectMapper objectMapper = new ObjectMapper();
        try {
            return objectMapper.writeValueAsString(other);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("failed to json string", e);
        }
    }
}
