/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.minerva.app.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.minerva.app.exceptions.BadQueryException;
import com.rackspace.minerva.app.model.DataQuery;
import com.rackspace.minerva.app.model.DataSource;
import com.rackspace.minerva.app.model.MetricRequest;
import com.rackspace.minerva.app.model.ResolvedDataSource;
import com.rackspace.minerva.app.model.ResolvedDataSource.Kind;
import com.rackspace.minerva.app.model.SignedInUser;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ActiveProfiles("test")
@SpringBootTest(classes = {
    QueryRequestParser.class,
    DataSourceResolver.class,
    BatchClassifier.class,
    JacksonAutoConfiguration.class
})
public class QueryRequestParserTest {

  @MockBean
  DataSourceCacheService dataSourceCacheService;

  @Autowired
  QueryRequestParser queryRequestParser;

  @Autowired
  DataSourceResolver dataSourceResolver;

  @Autowired
  ObjectMapper objectMapper;

  private final SignedInUser user = new SignedInUser().setUserId(2).setOrgId(3).setLogin("admin");

  @Test
  public void testEmptyBatchFailsBeforeResolving() {
    StepVerifier.create(queryRequestParser.parse(user, false, new MetricRequest().setQueries(List.of())))
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(BadQueryException.class)
            .hasMessage("no queries found"))
        .verify();

    StepVerifier.create(queryRequestParser.parse(user, false, new MetricRequest()))
        .expectError(BadQueryException.class)
        .verify();

    verifyNoInteractions(dataSourceCacheService);
  }

  @Test
  public void testQueryWithoutDataSourceReference() throws Exception {
    StepVerifier.create(queryRequestParser.parse(user, false, request(query("{\"refId\":\"A\"}"))))
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(BadQueryException.class)
            .hasMessage("missing data source ID/UID"))
        .verify();

    verifyNoInteractions(dataSourceCacheService);
  }

  @Test
  public void testRepeatedUidResolvedOnce() throws Exception {
    final DataSource influx = dataSource(11, "influx-1", "influxdb");
    when(dataSourceCacheService.getDatasourceByUID("influx-1", user, false))
        .thenReturn(Mono.just(influx));

    StepVerifier.create(queryRequestParser.parse(user, false, request(
            query("{\"refId\":\"A\",\"datasource\":{\"uid\":\"influx-1\"}}"),
            query("{\"refId\":\"B\",\"datasource\":{\"uid\":\"influx-1\"}}"))))
        .assertNext(parsed -> {
          assertThat(parsed.isHasExpression()).isFalse();
          assertThat(parsed.getParsedQueries()).hasSize(2);
          assertThat(parsed.getParsedQueries().get(1).getDatasource())
              .isSameAs(parsed.getParsedQueries().get(0).getDatasource());
          assertThat(parsed.getParsedQueries().get(0).getDatasource().getDataSource())
              .isSameAs(influx);
        })
        .verifyComplete();

    verify(dataSourceCacheService, times(1)).getDatasourceByUID("influx-1", user, false);
  }

  @Test
  public void testExpressionDetectedAtAnyPosition() throws Exception {
    when(dataSourceCacheService.getDatasourceByUID("prom-1", user, false))
        .thenReturn(Mono.just(dataSource(5, "prom-1", "prometheus")));
    when(dataSourceCacheService.getDatasourceByUID("loki-1", user, false))
        .thenReturn(Mono.just(dataSource(6, "loki-1", "loki")));

    // expression first, then two different real data sources
    StepVerifier.create(queryRequestParser.parse(user, false, request(
            query("{\"refId\":\"C\",\"datasource\":{\"uid\":\"__expr__\"},\"type\":\"math\"}"),
            query("{\"refId\":\"A\",\"datasource\":{\"uid\":\"prom-1\"}}"),
            query("{\"refId\":\"B\",\"datasource\":{\"uid\":\"loki-1\"}}"))))
        .assertNext(parsed -> {
          assertThat(parsed.isHasExpression()).isTrue();
          assertThat(parsed.getParsedQueries())
              .extracting(pq -> pq.getDatasource().getKind())
              .containsExactly(Kind.EXPRESSION, Kind.REAL, Kind.REAL);
        })
        .verifyComplete();

    // expression last
    StepVerifier.create(queryRequestParser.parse(user, false, request(
            query("{\"refId\":\"A\",\"datasource\":{\"uid\":\"prom-1\"}}"),
            query("{\"refId\":\"B\",\"datasource\":\"-100\"}"))))
        .assertNext(parsed -> assertThat(parsed.isHasExpression()).isTrue())
        .verifyComplete();
  }

  @Test
  public void testMixedDataSourcesRejected() throws Exception {
    when(dataSourceCacheService.getDatasource(5, user, false))
        .thenReturn(Mono.just(dataSource(5, "prom-1", "prometheus")));

    StepVerifier.create(queryRequestParser.parse(user, false, request(
            query("{\"refId\":\"A\",\"datasourceId\":5}"),
            query("{\"refId\":\"B\",\"datasource\":{\"uid\":\"grafana\"}}"))))
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(BadQueryException.class)
            .hasMessage("all queries must use the same datasource"))
        .verify();
  }

  @Test
  public void testDefaultsApplied() throws Exception {
    when(dataSourceCacheService.getDatasource(5, user, false))
        .thenReturn(Mono.just(dataSource(5, "prom-1", "prometheus")));

    StepVerifier.create(queryRequestParser.parse(user, false,
            request(query("{\"datasourceId\":5,\"expr\":\"rate(x[5m])\"}"))))
        .assertNext(parsed -> {
          final DataQuery query = parsed.getParsedQueries().get(0).getQuery();
          assertThat(query.getRefId()).isEqualTo("A");
          assertThat(query.getMaxDataPoints()).isEqualTo(100);
          assertThat(query.getInterval()).isEqualTo(Duration.ofMillis(1000));
          assertThat(query.getQueryType()).isEmpty();
          assertThat(query.getJson()).contains("rate(x[5m])");
        })
        .verifyComplete();
  }

  @Test
  public void testExplicitQueryFields() throws Exception {
    when(dataSourceCacheService.getDatasourceByUID("prom-1", user, false))
        .thenReturn(Mono.just(dataSource(5, "prom-1", "prometheus")));

    StepVerifier.create(queryRequestParser.parse(user, false, request(query(
            "{\"refId\":\"Q1\",\"datasource\":{\"uid\":\"prom-1\",\"type\":\"prometheus\"},"
                + "\"maxDataPoints\":1500,\"intervalMs\":30000,\"queryType\":\"range\"}"))))
        .assertNext(parsed -> {
          final DataQuery query = parsed.getParsedQueries().get(0).getQuery();
          assertThat(query.getRefId()).isEqualTo("Q1");
          assertThat(query.getMaxDataPoints()).isEqualTo(1500);
          assertThat(query.getInterval()).isEqualTo(Duration.ofSeconds(30));
          assertThat(query.getQueryType()).isEqualTo("range");
        })
        .verifyComplete();
  }

  @Test
  public void testDataSourceIdTakesPrecedenceOverUid() throws Exception {
    when(dataSourceCacheService.getDatasource(5, user, true))
        .thenReturn(Mono.just(dataSource(5, "prom-1", "prometheus")));

    StepVerifier.create(queryRequestParser.parse(user, true, request(
            query("{\"refId\":\"A\",\"datasourceId\":5,\"datasource\":{\"uid\":\"prom-1\"}}"))))
        .expectNextCount(1)
        .verifyComplete();

    verify(dataSourceCacheService).getDatasource(5, user, true);
    verify(dataSourceCacheService, never()).getDatasourceByUID(anyString(), any(), anyBoolean());
  }

  @Test
  public void testLegacyBareDataSourceString() throws Exception {
    when(dataSourceCacheService.getDatasourceByUID("graphite-1", user, false))
        .thenReturn(Mono.just(dataSource(8, "graphite-1", "graphite")));

    StepVerifier.create(queryRequestParser.parse(user, false,
            request(query("{\"refId\":\"A\",\"datasource\":\"graphite-1\"}"))))
        .assertNext(parsed -> assertThat(parsed.getParsedQueries().get(0).getDatasource().getUid())
            .isEqualTo("graphite-1"))
        .verifyComplete();
  }

  @Test
  public void testInternalMetricsResolvedWithoutLookup() throws Exception {
    StepVerifier.create(queryRequestParser.parse(user, false,
            request(query("{\"refId\":\"A\",\"datasource\":{\"uid\":\"grafana\"}}"))))
        .assertNext(parsed -> {
          final ResolvedDataSource ds = parsed.getParsedQueries().get(0).getDatasource();
          assertThat(ds.getKind()).isEqualTo(Kind.INTERNAL_METRICS);
          assertThat(ds.getDataSource().getOrgId()).isEqualTo(3);
          assertThat(ds.getDataSource().getType()).isEqualTo("datasource");
          assertThat(parsed.isHasExpression()).isFalse();
        })
        .verifyComplete();

    verify(dataSourceCacheService, never()).getDatasource(anyLong(), any(), anyBoolean());
    verify(dataSourceCacheService, never()).getDatasourceByUID(anyString(), any(), anyBoolean());
  }

  @Test
  public void testEmptyResolutionIsBadQuery() throws Exception {
    when(dataSourceCacheService.getDatasource(4, user, false)).thenReturn(Mono.empty());

    StepVerifier.create(queryRequestParser.parse(user, false,
            request(query("{\"refId\":\"A\",\"datasourceId\":4}"))))
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(BadQueryException.class)
            .hasMessage("invalid data source ID"))
        .verify();
  }

  @Test
  public void testTimeRangeResolvedToUtcInstants() throws Exception {
    final Instant now = Instant.parse("2022-03-01T12:00:00Z");
    final QueryRequestParser parser = new QueryRequestParser(dataSourceResolver,
        new BatchClassifier(), objectMapper, Clock.fixed(now, ZoneOffset.UTC));

    final MetricRequest request = new MetricRequest()
        .setFrom("now-15m")
        .setTo("1646136000000")
        .setQueries(List.of(query("{\"refId\":\"A\",\"datasource\":\"__expr__\"}")));

    StepVerifier.create(parser.parse(user, false, request))
        .assertNext(parsed -> {
          final DataQuery query = parsed.getParsedQueries().get(0).getQuery();
          assertThat(query.getTimeRange().getFrom()).isEqualTo(Instant.parse("2022-03-01T11:45:00Z"));
          assertThat(query.getTimeRange().getTo()).isEqualTo(Instant.ofEpochMilli(1646136000000L));
        })
        .verifyComplete();

    StepVerifier.create(parser.parse(user, false, request.setFrom("yesterday")))
        .expectError(BadQueryException.class)
        .verify();
  }

  private DataSource dataSource(long id, String uid, String type) {
    return new DataSource()
        .setId(id)
        .setUid(uid)
        .setOrgId(3)
        .setType(type)
        .setJsonData(Map.of())
        .setSecureJsonData(Map.of());
  }

  private JsonNode query(String json) throws JsonProcessingException {
    return objectMapper.readTree(json);
  }

  private MetricRequest request(JsonNode... queries) {
    return new MetricRequest().setQueries(List.of(queries));
  }
}
