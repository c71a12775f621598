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

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lookup helper shared by the enumerations whose values travel to the server as names.
 */
final class NamedValues {

    private NamedValues() {
    }

    static <E extends Enum<E>> E fromName(Class<E> type, String kind, String name,
                                         Function<E, String> nameOf, boolean ignoreCase) {
        if (name != null) {
            for (E value : type.getEnumConstants()) {
                String candidate = nameOf.apply(value);
                if (ignoreCase ? candidate.equalsIgnoreCase(name) : candidate.equals(name)) {
                    return value;
                }
            }
        }
        throw new ValidationException("invalid " + kind + " '" + name + "'. Allowed values: " +
                Arrays.stream(type.getEnumConstants()).map(nameOf).collect(Collectors.joining(", ", "[", "]")));
    }
}
