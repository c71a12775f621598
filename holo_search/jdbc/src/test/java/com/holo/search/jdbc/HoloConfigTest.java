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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HoloConfigTest {

    private static final String JSON = "{\"host\": \"holo.example.com\", \"port\": 80, \"database\": \"search\", "
            + "\"access_key_id\": \"ak\", \"access_key_secret\": \"s3cret\", \"unknown\": 1}";

    @Test
    void shouldParseJsonWithDefaults() {
        HoloConfig config = HoloConfig.of(JSON);

        assertThat(config.host).isEqualTo("holo.example.com");
        assertThat(config.port).isEqualTo(80);
        assertThat(config.schema).isEqualTo("public");
        assertThat(config.autocommit).isTrue();
        assertThat(config.jdbcUrl()).isEqualTo("jdbc:postgresql://holo.example.com:80/search?currentSchema=public");
    }

    @Test
    void shouldReadSchemaAndAutocommit() {
        HoloConfig config = HoloConfig.of("{\"host\": \"h\", \"port\": 5432, \"database\": \"d\", "
                + "\"access_key_id\": \"ak\", \"access_key_secret\": \"sk\", \"schema\": \"wiki\", \"autocommit\": false}");

        assertThat(config.schema).isEqualTo("wiki");
        assertThat(config.autocommit).isFalse();
        assertThat(config.jdbcUrl()).endsWith("?currentSchema=wiki");
    }

    @Test
    void shouldMaskSecretInDisplayString() {
        HoloConfig config = HoloConfig.of(JSON);

        assertThat(config.toDisplayString()).contains("\"access_key_secret\":\"****\"").doesNotContain("s3cret");
        assertThat(config.toString()).doesNotContain("s3cret");
        assertThat(config.access_key_secret).isEqualTo("s3cret");
    }

    @Test
    void shouldRejectMissingFields() {
        assertThatThrownBy(() -> HoloConfig.of("{\"host\": \"h\", \"port\": 80}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is null");
    }

    @Test
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> HoloConfig.of("h", 70000, "d", "ak", "sk"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldWrapMalformedJsonWithoutLeakingSecret() {
        assertThatThrownBy(() -> HoloConfig.of("{\"access_key_secret\": \"s3cret\", "))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("failed to parse json")
                .hasMessageNotContaining("s3cret");
    }
}
