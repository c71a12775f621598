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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlFragmentsTest {

    @Test
    void shouldBuildDefaultTextSearch() {
        SqlFragment fragment = SqlFragments.textSearch("content", "fox", TextSearchOptions.defaults());

        assertThat(fragment.getSql()).isEqualTo("TEXT_SEARCH(\"content\", ?, mode => 'match')");
        assertThat(fragment.getParams()).containsExactly("fox");
    }

    @Test
    void shouldEmitOperatorForMatchMode() {
        TextSearchOptions options = TextSearchOptions.defaults().withOperator("and");

        assertThat(SqlFragments.textSearch("content", "fox", options).getSql())
                .isEqualTo("TEXT_SEARCH(\"content\", ?, mode => 'match', operator => 'AND')");
    }

    @Test
    void shouldDropOperatorAndKeepSlopForPhraseMode() {
        TextSearchOptions options = TextSearchOptions.defaults()
                .withMode(SearchMode.PHRASE)
                .withOperator(SearchOperator.AND)
                .withSlop(2);

        assertThat(SqlFragments.textSearch("content", "quick fox", options).getSql())
                .isEqualTo("TEXT_SEARCH(\"content\", ?, mode => 'phrase', options => 'slop=2;')");
    }

    @Test
    void shouldIgnoreSlopOutsidePhraseMode() {
        TextSearchOptions options = TextSearchOptions.defaults().withSlop(3);

        assertThat(SqlFragments.textSearch("content", "fox", options).getSql()).doesNotContain("slop");
    }

    @Test
    void shouldNameTokenizerWithoutAnalyzerParams() {
        TextSearchOptions options = TextSearchOptions.defaults().withTokenizer("ik");

        assertThat(SqlFragments.textSearch("content", "fox", options).getSql())
                .isEqualTo("TEXT_SEARCH(\"content\", ?, mode => 'match', tokenizer => 'ik')");
    }

    @Test
    void shouldSerializeAnalyzerParams() {
        TextSearchOptions options = TextSearchOptions.defaults()
                .withTokenizer(Tokenizer.JIEBA)
                .withTokenizerParams(Collections.singletonMap("mode", "exact"))
                .withFilters(Collections.singletonList(TokenFilter.lowercase()));

        assertThat(SqlFragments.textSearch("content", "fox", options).getSql())
                .isEqualTo("TEXT_SEARCH(\"content\", ?, mode => 'match', analyzer_params => "
                        + "'{\"tokenizer\":{\"type\":\"jieba\",\"mode\":\"exact\"},\"filter\":[\"lowercase\"]}')");
    }

    @Test
    void shouldKeepFilterChainOrderAndEscapeQuotes() {
        AnalyzerParams params = new AnalyzerParams(Tokenizer.STANDARD, null, Arrays.asList(
                TokenFilter.stop(Arrays.asList("it's", "a")),
                TokenFilter.lowercase(),
                TokenFilter.length(20)));

        assertThat(SqlFragments.analyzerParamsJson(params)).isEqualTo(
                "{\"tokenizer\":{\"type\":\"standard\"},\"filter\":[{\"type\":\"stop\",\"stop_words\":[\"it's\",\"a\"]},"
                        + "\"lowercase\",{\"type\":\"length\",\"max\":20}]}");
        assertThat(SqlFragments.analyzerParams(params).getSql()).contains("\"it''s\"").startsWith("'").endsWith("'");
    }

    @Test
    void shouldBuildTokenizeOverColumn() {
        SqlFragment fragment = SqlFragments.tokenize("a.content", Tokenizer.JIEBA, null, null);

        assertThat(fragment.getSql()).isEqualTo("TOKENIZE(\"a\".\"content\", 'jieba')");
        assertThat(fragment.getParams()).isEmpty();
    }

    @Test
    void shouldBindTokenizedText() {
        Map<String, Object> tokenizerParams = new LinkedHashMap<>();
        tokenizerParams.put("mode", "exact");
        SqlFragment fragment = SqlFragments.tokenizeText("他来到北京清华大学", Tokenizer.JIEBA, tokenizerParams, null);

        assertThat(fragment.getSql())
                .isEqualTo("TOKENIZE(?, 'jieba', '{\"tokenizer\":{\"type\":\"jieba\",\"mode\":\"exact\"}}')");
        assertThat(fragment.getParams()).containsExactly("他来到北京清华大学");
    }

    @Test
    void shouldRejectUnknownTokenizerNamingAllowedValues() {
        assertThatThrownBy(() -> SqlFragments.tokenize("content", "klingon", null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("klingon")
                .hasMessageContaining("[jieba, ik, icu, whitespace, standard, keyword, simple, ngram, pinyin]");
    }

    @Test
    void shouldRejectUnknownTokenFilter() {
        assertThatThrownBy(() -> TokenFilter.of("uppercase"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("removepunct");
    }

    @Test
    void shouldRejectTypeKeyInFilterParams() {
        assertThatThrownBy(() -> TokenFilter.of(TokenFilterType.STOP, Collections.singletonMap("type", "x")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldBuildVectorDistanceWithCopiedVector() {
        float[] vector = {0.1f, 0.2f, 0.3f};
        SqlFragment fragment = SqlFragments.vectorDistance("feature", vector, DistanceMethod.COSINE);
        vector[0] = 9f;

        assertThat(fragment.getSql()).isEqualTo("approx_cosine_distance(\"feature\", ?)");
        assertThat((float[]) fragment.getParams().get(0)).containsExactly(0.1f, 0.2f, 0.3f);
    }

    @Test
    void shouldRejectEmptyVector() {
        assertThatThrownBy(() -> SqlFragments.vectorDistance("feature", new float[0], DistanceMethod.EUCLIDEAN))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldResolveDistanceMethodIgnoringCase() {
        assertThat(DistanceMethod.fromName("innerproduct")).isEqualTo(DistanceMethod.INNER_PRODUCT);
        assertThat(DistanceMethod.fromName("Euclidean").nearestFirst()).isEqualTo(SortOrder.ASC);
        assertThat(DistanceMethod.COSINE.nearestFirst()).isEqualTo(SortOrder.DESC);
    }

    @Test
    void shouldQuoteIdentifiers() {
        assertThat(SqlFragments.quoteIdentifier("content")).isEqualTo("\"content\"");
        assertThat(SqlFragments.quoteIdentifier("a.content")).isEqualTo("\"a\".\"content\"");
        assertThat(SqlFragments.quoteIdentifier("t.*")).isEqualTo("\"t\".*");
        assertThat(SqlFragments.quoteIdentifier("my\"col")).isEqualTo("\"my\"\"col\"");
        assertThatThrownBy(() -> SqlFragments.quoteIdentifier("a..b")).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldQuoteLiterals() {
        assertThat(SqlFragments.quoteLiteral("it's")).isEqualTo("'it''s'");
        assertThat(SqlFragments.quoteLiteral(null)).isEqualTo("NULL");
    }
}
