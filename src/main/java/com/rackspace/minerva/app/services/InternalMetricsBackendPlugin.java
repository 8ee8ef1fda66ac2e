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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.minerva.app.model.DataFrame;
import com.rackspace.minerva.app.model.DataFrame.Field;
import com.rackspace.minerva.app.model.DataQuery;
import com.rackspace.minerva.app.model.DataResponse;
import com.rackspace.minerva.app.model.QueryDataRequest;
import com.rackspace.minerva.app.model.QueryDataResponse;
import com.rackspace.minerva.app.model.ResolvedDataSource;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Serves the built-in internal metrics data source. Only the <code>randomWalk</code> query
 * type is supported, which is also the default.
 */
@Component
@Slf4j
public class InternalMetricsBackendPlugin implements BackendPlugin {

  static final String QUERY_TYPE_RANDOM_WALK = "randomWalk";

  private final ObjectMapper objectMapper;
  private final Random random = new Random();

  @Autowired
  public InternalMetricsBackendPlugin(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public String getPluginId() {
    return ResolvedDataSource.INTERNAL_METRICS_TYPE;
  }

  @Override
  public Mono<QueryDataResponse> queryData(QueryDataRequest request) {
    return Mono.fromSupplier(() -> {
      final QueryDataResponse response = new QueryDataResponse();
      for (DataQuery query : request.getQueries()) {
        response.getResponses().put(query.getRefId(), execute(query));
      }
      return response;
    });
  }

  private DataResponse execute(DataQuery query) {
    final String queryType = StringUtils.defaultIfEmpty(query.getQueryType(), QUERY_TYPE_RANDOM_WALK);
    if (!QUERY_TYPE_RANDOM_WALK.equals(queryType)) {
      return new DataResponse().setError("invalid query type: " + queryType);
    }

    final int seriesCount;
    try {
      final JsonNode model = objectMapper.readTree(query.getJson());
      seriesCount = Math.max(1, model.path("seriesCount").asInt(1));
    } catch (IOException e) {
      log.debug("Unable to read query model for {}", query.getRefId(), e);
      return new DataResponse().setError("failed to parse query: " + e.getMessage());
    }

    final DataResponse response = new DataResponse();
    for (int i = 0; i < seriesCount; i++) {
      response.getFrames().add(randomWalk(query, i));
    }
    return response;
  }

  private DataFrame randomWalk(DataQuery query, int seriesIndex) {
    final Instant from = query.getTimeRange().getFrom();
    final Instant to = query.getTimeRange().getTo();
    final long maxPoints = Math.max(1, query.getMaxDataPoints());
    final long spanMs = Math.max(0, Duration.between(from, to).toMillis());
    final long stepMs = Math.max(Math.max(1, query.getIntervalMs()), spanMs / maxPoints);

    final Field time = new Field().setName("time").setType("time");
    final Field value = new Field().setName("value").setType("number");
    double walker = random.nextDouble() * 100;
    long points = 0;
    for (long ts = from.toEpochMilli(); ts < to.toEpochMilli() && points < maxPoints; ts += stepMs) {
      time.getValues().add(ts);
      value.getValues().add(walker);
      walker += random.nextDouble() - 0.5;
      points++;
    }

    final String name = seriesIndex == 0 ? query.getRefId() : query.getRefId() + "-series-" + seriesIndex;
    return new DataFrame()
        .setName(name)
        .setRefId(query.getRefId())
        .setFields(List.of(time, value));
  }
}
