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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.minerva.app.exceptions.BadQueryException;
import com.rackspace.minerva.app.model.DataQuery;
import com.rackspace.minerva.app.model.MetricRequest;
import com.rackspace.minerva.app.model.ParsedRequest;
import com.rackspace.minerva.app.model.ResolvedDataSource;
import com.rackspace.minerva.app.model.SignedInUser;
import com.rackspace.minerva.app.model.TimeRange;
import com.rackspace.minerva.app.utils.DateTimeUtils;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns a raw {@link MetricRequest} into a {@link ParsedRequest}, resolving the data source
 * of every query.
 */
@Service
@Slf4j
public class QueryRequestParser {

  static final String DEFAULT_REF_ID = "A";
  static final long DEFAULT_MAX_DATA_POINTS = 100;
  static final long DEFAULT_INTERVAL_MS = 1000;

  private final DataSourceResolver dataSourceResolver;
  private final BatchClassifier batchClassifier;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Autowired
  public QueryRequestParser(DataSourceResolver dataSourceResolver,
                            BatchClassifier batchClassifier,
                            ObjectMapper objectMapper) {
    this(dataSourceResolver, batchClassifier, objectMapper, Clock.systemUTC());
  }

  QueryRequestParser(DataSourceResolver dataSourceResolver, BatchClassifier batchClassifier,
                     ObjectMapper objectMapper, Clock clock) {
    this.dataSourceResolver = dataSourceResolver;
    this.batchClassifier = batchClassifier;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public Mono<ParsedRequest> parse(SignedInUser user, boolean skipCache, MetricRequest request) {
    if (request.getQueries() == null || request.getQueries().isEmpty()) {
      return Mono.error(new BadQueryException("no queries found"));
    }

    return Mono.defer(() -> {
      final TimeRange timeRange =
          DateTimeUtils.parseTimeRange(request.getFrom(), request.getTo(), clock.instant());
      final ParsedRequest parsed = new ParsedRequest();
      final Map<String, ResolvedDataSource> datasourcesByUid = new HashMap<>();

      // concatMap keeps resolution sequential so the memo needs no locking
      return Flux.fromIterable(request.getQueries())
          .concatMap(query -> dataSourceResolver
              .resolve(user, skipCache, query, datasourcesByUid)
              .switchIfEmpty(Mono.error(() -> new BadQueryException("invalid data source ID")))
              .flatMap(datasource -> Mono.fromCallable(() -> {
                datasourcesByUid.put(datasource.getUid(), datasource);
                log.debug("Processing metrics query {}", query);
                batchClassifier.add(parsed, datasource, toDataQuery(query, timeRange));
                return datasource;
              })))
          .then(Mono.fromCallable(() -> {
            batchClassifier.verify(parsed);
            return parsed;
          }));
    });
  }

  private DataQuery toDataQuery(JsonNode query, TimeRange timeRange)
      throws JsonProcessingException {
    return new DataQuery()
        .setTimeRange(timeRange)
        .setRefId(textOrDefault(query, "refId", DEFAULT_REF_ID))
        .setMaxDataPoints(longOrDefault(query, "maxDataPoints", DEFAULT_MAX_DATA_POINTS))
        .setInterval(Duration.ofMillis(longOrDefault(query, "intervalMs", DEFAULT_INTERVAL_MS)))
        .setQueryType(textOrDefault(query, "queryType", ""))
        .setJson(objectMapper.writeValueAsString(query));
  }

  private static String textOrDefault(JsonNode query, String field, String defaultValue) {
    final JsonNode node = query.path(field);
    return node.isTextual() ? node.asText() : defaultValue;
  }

  private static long longOrDefault(JsonNode query, String field, long defaultValue) {
    final JsonNode node = query.path(field);
    return node.isNumber() ? node.asLong() : defaultValue;
  }
}
