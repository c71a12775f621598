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

import com.holo.search.api.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryBuilderTest {

    private static final String FOX_SEARCH = "TEXT_SEARCH(\"content\", ?, mode => 'match')";
    private static final float[] VECTOR = {0.3f, 0.4f, 0.5f, 0.6f};

    private static QueryBuilder docs() {
        return new QueryBuilder(TableRef.of("docs"));
    }

    private static long placeholderCount(SqlFragment fragment) {
        return fragment.getSql().chars().filter(ch -> ch == '?').count();
    }

    @Test
    void shouldSelectStarWhenNothingSelected() {
        assertThat(docs().compile().getSql()).isEqualTo("SELECT * FROM \"docs\"");
    }

    @Test
    void shouldReferenceScoreAliasInWhere() {
        SqlFragment query = docs()
                .select("id")
                .selectTextSearch("content", "fox", "score")
                .whereTextSearch("content", "fox", TextSearchOptions.defaults(), 0.5)
                .limit(5)
                .compile();

        assertThat(query.getSql()).isEqualTo("SELECT id, " + FOX_SEARCH + " AS \"score\" FROM \"docs\" "
                + "WHERE (\"score\" > 0) AND (\"score\" >= ?) LIMIT 5");
        assertThat(query.getParams()).containsExactly("fox", 0.5);
    }

    @Test
    void shouldCompileSameStatementTwice() {
        QueryBuilder builder = docs()
                .select("id")
                .selectVectorSearch(VECTOR, "feature", DistanceMethod.COSINE, "distance")
                .maxDistance(0.9)
                .where("status = ?", "active")
                .orderBy("distance", SortOrder.DESC)
                .limit(10);

        assertThat(builder.compile()).isEqualTo(builder.compile());
    }

    @Test
    void shouldEmitClausesInFixedOrderWhateverTheCallOrder() {
        SqlFragment query = new QueryBuilder(TableRef.of("docs", "a"))
                .offset(20)
                .limit(10)
                .orderBy("a.id")
                .where("b.source = ?", "wiki")
                .innerJoin(TableRef.of("sources", "b"), "a.id = b.id")
                .select("a.id", "b.source")
                .compile();

        assertThat(query.getSql()).isEqualTo("SELECT a.id, b.source FROM \"docs\" AS \"a\" "
                + "INNER JOIN \"sources\" AS \"b\" ON a.id = b.id WHERE b.source = ? "
                + "ORDER BY a.id ASC LIMIT 10 OFFSET 20");
        assertThat(query.getParams()).containsExactly("wiki");
    }

    @Test
    void shouldKeepJoinsInInsertionOrder() {
        String sql = new QueryBuilder(TableRef.of("docs", "a"))
                .leftJoin(TableRef.of("sources", "b"), "a.id = b.id")
                .crossJoin(TableRef.of("tags"))
                .fullJoin(TableRef.of("authors", "c"), Filters.of("c.id = a.author_id"))
                .compile().getSql();

        assertThat(sql).isEqualTo("SELECT * FROM \"docs\" AS \"a\" LEFT JOIN \"sources\" AS \"b\" ON a.id = b.id "
                + "CROSS JOIN \"tags\" FULL JOIN \"authors\" AS \"c\" ON c.id = a.author_id");
    }

    @Test
    void shouldRejectConditionOnCrossJoin() {
        assertThatThrownBy(() -> docs().join(JoinType.CROSS, TableRef.of("tags"), "1 = 1"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("CROSS JOIN");
    }

    @Test
    void shouldRequireConditionOnInnerJoin() {
        assertThatThrownBy(() -> docs().join(JoinType.INNER, TableRef.of("tags"), (FilterExpr) null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectJoinWithoutFromTable() {
        assertThatThrownBy(() -> new QueryBuilder(null).crossJoin(TableRef.of("tags")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectDistanceBoundWithoutVectorSearch() {
        assertThatThrownBy(() -> docs().minDistance(0.5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("selectVectorSearch");
        assertThatThrownBy(() -> docs().maxDistance(0.5))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectMinDistanceAboveMaxDistance() {
        QueryBuilder builder = docs()
                .selectVectorSearch(VECTOR, "feature", DistanceMethod.EUCLIDEAN, "distance")
                .maxDistance(0.5);

        assertThatThrownBy(() -> builder.minDistance(0.8)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldBoundDistanceThroughAlias() {
        SqlFragment query = docs()
                .select("id")
                .selectVectorSearch(VECTOR, "feature", DistanceMethod.EUCLIDEAN, "distance")
                .minDistance(0.1)
                .maxDistance(0.7)
                .orderBy("distance")
                .compile();

        assertThat(query.getSql()).isEqualTo("SELECT id, approx_euclidean_distance(\"feature\", ?) AS \"distance\" "
                + "FROM \"docs\" WHERE \"distance\" >= ? AND \"distance\" <= ? ORDER BY \"distance\" ASC");
        assertThat((float[]) query.getParams().get(0)).containsExactly(VECTOR);
        assertThat(query.getParams().subList(1, 3)).containsExactly(0.1, 0.7);
    }

    @Test
    void shouldParenthesizeFilterAndDistanceBounds() {
        SqlFragment query = docs()
                .selectVectorSearch(VECTOR, "feature", DistanceMethod.COSINE, "distance")
                .where("a = ?", 1)
                .orWhere("b = ?", 2)
                .minDistance(0.7)
                .compile();

        assertThat(query.getSql()).endsWith("WHERE ((a = ?) OR (b = ?)) AND (\"distance\" >= ?)");
        assertThat(query.getParams().subList(1, 4)).containsExactly(1, 2, 0.7);
    }

    @Test
    void shouldRepeatExpressionsInInlineMode() {
        SqlFragment query = new QueryBuilder(null, TableRef.of("docs"), true)
                .selectVectorSearch(VECTOR, "feature", DistanceMethod.COSINE, "distance")
                .selectTextSearch("content", "fox", "score")
                .whereTextSearch("content", "fox", TextSearchOptions.defaults(), 0.5)
                .minDistance(0.2)
                .compile();

        String distance = "approx_cosine_distance(\"feature\", ?)";
        assertThat(query.getSql()).isEqualTo("SELECT " + distance + " AS \"distance\", " + FOX_SEARCH + " AS \"score\" "
                + "FROM \"docs\" WHERE ((" + FOX_SEARCH + " > 0) AND (" + FOX_SEARCH + " >= ?)) "
                + "AND (" + distance + " >= ?)");
        assertThat(placeholderCount(query)).isEqualTo(query.getParams().size());
        assertThat(query.getParams().get(3)).isEqualTo("fox");
        assertThat(query.getParams().get(4)).isEqualTo(0.5);
        assertThat(query.getParams().get(5)).isInstanceOf(float[].class);
        assertThat(query.getParams().get(6)).isEqualTo(0.2);
    }

    @Test
    void shouldInlineTextSearchWithoutThreshold() {
        SqlFragment query = docs().select("id").whereTextSearch("content", "fox").compile();

        assertThat(query.getSql()).isEqualTo("SELECT id FROM \"docs\" WHERE " + FOX_SEARCH + " > 0");
        assertThat(query.getParams()).containsExactly("fox");
    }

    @Test
    void shouldRegisterInternalScoreForThresholdWithoutSelect() {
        SqlFragment query = docs()
                .whereTextSearch("content", "fox", TextSearchOptions.defaults(), 0.5)
                .whereTextSearch("content", "dog", TextSearchOptions.defaults(), 0.1)
                .compile();

        assertThat(query.getSql()).isEqualTo("SELECT " + FOX_SEARCH + " AS \"_text_search_score_0\", "
                + FOX_SEARCH + " AS \"_text_search_score_1\" FROM \"docs\" "
                + "WHERE ((\"_text_search_score_0\" > 0) AND (\"_text_search_score_0\" >= ?)) "
                + "AND ((\"_text_search_score_1\" > 0) AND (\"_text_search_score_1\" >= ?))");
        assertThat(query.getParams()).containsExactly("fox", "dog", 0.5, 0.1);
    }

    @Test
    void shouldReuseInternalScoreForSameSearch() {
        SqlFragment query = docs()
                .whereTextSearch("content", "fox", TextSearchOptions.defaults(), 0.5)
                .whereTextSearch("content", "fox", TextSearchOptions.defaults(), null, 0.9, null)
                .compile();

        assertThat(query.getSql()).doesNotContain("_text_search_score_1");
    }

    @Test
    void shouldRejectUnknownScoreName() {
        assertThatThrownBy(() -> docs().whereTextSearch("content", "fox", TextSearchOptions.defaults(),
                0.5, null, "score"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'score' is not a selected text search score");
    }

    @Test
    void shouldRejectScoreNameOfDifferentSearch() {
        QueryBuilder builder = docs().selectTextSearch("content", "dog", "score");

        assertThatThrownBy(() -> builder.whereTextSearch("content", "fox", TextSearchOptions.defaults(),
                0.5, null, "score"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("different search");
    }

    @Test
    void shouldRejectReplacingReferencedScore() {
        QueryBuilder builder = docs()
                .selectTextSearch("content", "fox", "score")
                .whereTextSearch("content", "fox", TextSearchOptions.defaults(), 0.5, null, "score");

        assertThatThrownBy(() -> builder.selectTextSearch("content", "dog", "score"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectDifferentExpressionUnderTakenAlias() {
        QueryBuilder search = docs().selectTextSearch("content", "fox", "score");
        assertThatThrownBy(() -> search.selectTextSearch("title", "dog", "score"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already used by a different");

        QueryBuilder tokens = docs().selectTokenize("content", Tokenizer.JIEBA, "tok");
        assertThatThrownBy(() -> tokens.selectTokenize("title", Tokenizer.IK, "tok"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already used by a different");

        assertThat(search.compile().getSql()).isEqualTo("SELECT " + FOX_SEARCH + " AS \"score\" FROM \"docs\"");
        assertThat(search.compile().getParams()).containsExactly("fox");
    }

    @Test
    void shouldAcceptIdenticalComputedColumnAgain() {
        SqlFragment query = docs()
                .selectTextSearch("content", "fox", "score")
                .selectTokenize("content", Tokenizer.JIEBA, "tok")
                .selectTextSearch("content", "fox", "score")
                .selectTokenize("content", Tokenizer.JIEBA, "tok")
                .compile();

        assertThat(query.getSql()).isEqualTo("SELECT " + FOX_SEARCH + " AS \"score\", "
                + "TOKENIZE(\"content\", 'jieba') AS \"tok\" FROM \"docs\"");
        assertThat(query.getParams()).containsExactly("fox");
    }

    @Test
    void shouldReuseSelectedScoreForQualifiedColumn() {
        SqlFragment query = new QueryBuilder(TableRef.of("docs", "a"))
                .selectTextSearch("content", "fox", "score")
                .whereTextSearch("a.content", "fox", TextSearchOptions.defaults(), 0.0)
                .compile();

        assertThat(query.getSql()).isEqualTo("SELECT " + FOX_SEARCH + " AS \"score\" FROM \"docs\" AS \"a\" "
                + "WHERE (\"score\" > 0) AND (\"score\" >= ?)");
        assertThat(query.getSql().split("TEXT_SEARCH", -1)).hasSize(2);
        assertThat(query.getParams()).containsExactly("fox", 0.0);
    }

    @Test
    void shouldReuseSelectedScoreForColumnQualifiedByTableName() {
        SqlFragment query = docs()
                .selectTextSearch("docs.content", "fox", "score")
                .whereTextSearch("content", "fox", TextSearchOptions.defaults(), 0.2, null, "score")
                .compile();

        assertThat(query.getSql()).doesNotContain(QueryBuilder.INTERNAL_SCORE_PREFIX);
        assertThat(query.getParams()).containsExactly("fox", 0.2);
    }

    @Test
    void shouldRejectAliasUsedByOtherKind() {
        QueryBuilder builder = docs().selectTextSearch("content", "fox", "out");

        assertThatThrownBy(() -> builder.selectTokenize("content", Tokenizer.JIEBA, "out"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already used");
    }

    @Test
    void shouldRejectSecondVectorSearch() {
        QueryBuilder builder = docs().selectVectorSearch(VECTOR, "feature", DistanceMethod.COSINE, "d1");

        assertThatThrownBy(() -> builder.selectVectorSearch(VECTOR, "feature", DistanceMethod.COSINE, "d2"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectSelectItemClashingWithAlias() {
        QueryBuilder builder = docs().selectTextSearch("content", "fox", "score");

        assertThatThrownBy(() -> builder.select("a.score")).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldIgnoreDuplicateSelectItems() {
        assertThat(docs().select("id", "title").select("id").compile().getSql())
                .isEqualTo("SELECT id, title FROM \"docs\"");
    }

    @Test
    void shouldTokenizeTextsWithoutTable() {
        SqlFragment query = new QueryBuilder(null)
                .selectTokenizeText("他来到北京清华大学", Tokenizer.JIEBA, "jieba")
                .selectTokenizeText("他来到北京清华大学", Tokenizer.KEYWORD, "keyword")
                .compile();

        assertThat(query.getSql()).isEqualTo("SELECT TOKENIZE(?, 'jieba') AS \"jieba\", "
                + "TOKENIZE(?, 'keyword') AS \"keyword\"");
        assertThat(query.getParams()).hasSize(2);
    }

    @Test
    void shouldTokenizeColumnUnderDefaultName() {
        assertThat(docs().selectTokenize("a.content", Tokenizer.IK).compile().getSql())
                .isEqualTo("SELECT TOKENIZE(\"a\".\"content\", 'ik') AS \"tokenize\" FROM \"docs\"");
    }

    @Test
    void shouldMatchPlaceholdersAndParameters() {
        Map<String, Object> tokenizerParams = new LinkedHashMap<>();
        tokenizerParams.put("mode", "exact");
        SqlFragment query = new QueryBuilder(TableRef.of("docs", "a"))
                .select("a.id")
                .selectVectorSearch(VECTOR, "a.feature", DistanceMethod.INNER_PRODUCT, "distance")
                .selectTextSearch("a.content", "shandong university", "score",
                        TextSearchOptions.defaults().withOperator(SearchOperator.AND))
                .selectTokenize("a.content", Tokenizer.JIEBA, "tokens", tokenizerParams,
                        Collections.singletonList(TokenFilter.lowercase()))
                .leftJoin(TableRef.of("sources", "b"), Filters.of("a.id = b.id AND b.kind = ?", "wiki"))
                .whereTextSearch("a.content", "shandong university",
                        TextSearchOptions.defaults().withOperator(SearchOperator.AND), 0.1, 5.0, null)
                .where(Filters.of("a.year > ?", 2000).or(Filters.of("a.pinned")))
                .minDistance(0.3)
                .compile();

        assertThat(placeholderCount(query)).isEqualTo(query.getParams().size());
    }

    @Test
    void shouldRejectNegativeLimitAndOffset() {
        assertThatThrownBy(() -> docs().limit(-1)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> docs().offset(-1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectUnknownSortOrder() {
        assertThatThrownBy(() -> docs().orderBy("id", "sideways"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("[ASC, DESC]");
    }

    @Test
    void shouldOrderByManyColumns() {
        assertThat(docs().orderBy(Arrays.asList("a", "b")).orderBy("c", "desc").compile().getSql())
                .isEqualTo("SELECT * FROM \"docs\" ORDER BY a ASC, b ASC, c DESC");
    }

    @Test
    void shouldOrderLikeSelectItemsAndQuoteComputedAliases() {
        SqlFragment query = docs()
                .select("ID", "lower(title)")
                .selectTextSearch("content", "fox", "Score")
                .orderBy("Score", SortOrder.DESC)
                .orderBy("ID")
                .orderBy("lower(title)", SortOrder.DESC)
                .compile();

        assertThat(query.getSql()).isEqualTo("SELECT ID, lower(title), " + FOX_SEARCH + " AS \"Score\" "
                + "FROM \"docs\" ORDER BY \"Score\" DESC, ID ASC, lower(title) DESC");
    }

    @Test
    void shouldDelegateFetchToExecutor() throws Exception {
        StatementExecutor executor = mock(StatementExecutor.class);
        List<Map<String, Object>> rows = Collections.singletonList(Collections.singletonMap("id", 1));
        when(executor.fetchAll(any())).thenReturn(rows);
        when(executor.fetchMany(any(), anyInt())).thenReturn(rows);

        QueryBuilder builder = new QueryBuilder(executor, TableRef.of("docs")).select("id").limit(1);

        assertThat(builder.fetchAll()).isSameAs(rows);
        assertThat(builder.fetchMany(3)).isSameAs(rows);
        verify(executor).fetchAll(builder.compile());
        verify(executor).fetchMany(builder.compile(), 3);
    }

    @Test
    void shouldExplainCompiledStatement() throws Exception {
        StatementExecutor executor = mock(StatementExecutor.class);
        when(executor.fetchAll(any())).thenReturn(Arrays.asList(
                Collections.singletonMap("QUERY PLAN", "Limit"),
                Collections.singletonMap("QUERY PLAN", "  -> Seq Scan on docs")));

        QueryBuilder builder = new QueryBuilder(executor, TableRef.of("docs")).limit(1);

        assertThat(builder.explain()).containsExactly("Limit", "  -> Seq Scan on docs");
        verify(executor).fetchAll(SqlFragment.of("EXPLAIN SELECT * FROM \"docs\" LIMIT 1"));
    }

    @Test
    void shouldFailToFetchWithoutExecutor() {
        assertThatThrownBy(() -> docs().fetchAll()).isInstanceOf(IllegalStateException.class);
    }
}
