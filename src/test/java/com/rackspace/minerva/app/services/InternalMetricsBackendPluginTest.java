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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.minerva.app.model.DataFrame;
import com.rackspace.minerva.app.model.DataQuery;
import com.rackspace.minerva.app.model.DataResponse;
import com.rackspace.minerva.app.model.QueryDataRequest;
import com.rackspace.minerva.app.model.TimeRange;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

public class InternalMetricsBackendPluginTest {

  private static final Instant TO = Instant.parse("2022-03-15T12:00:00Z");

  private final InternalMetricsBackendPlugin plugin =
      new InternalMetricsBackendPlugin(new ObjectMapper());

  @Test
  public void testRandomWalk() {
    final DataQuery query = query("A", "", "{\"refId\":\"A\"}")
        .setMaxDataPoints(10)
        .setInterval(Duration.ofSeconds(1));

    StepVerifier.create(plugin.queryData(new QueryDataRequest().setQueries(List.of(query))))
        .assertNext(response -> {
          final DataResponse dataResponse = response.getResponses().get("A");
          assertThat(dataResponse.getError()).isNull();
          assertThat(dataResponse.getFrames()).hasSize(1);

          final DataFrame frame = dataResponse.getFrames().get(0);
          assertThat(frame.getRefId()).isEqualTo("A");
          assertThat(frame.getFields()).extracting("name").containsExactly("time", "value");
          // one hour spread over at most 10 points
          final List<Object> times = frame.getFields().get(0).getValues();
          assertThat(times).hasSize(10);
          assertThat((long) times.get(1) - (long) times.get(0)).isEqualTo(360_000L);
          assertThat(frame.getFields().get(1).getValues()).hasSize(10);
        })
        .verifyComplete();
  }

  @Test
  public void testSeriesCount() {
    final DataQuery query = query("B", "randomWalk", "{\"refId\":\"B\",\"seriesCount\":3}");

    StepVerifier.create(plugin.queryData(new QueryDataRequest().setQueries(List.of(query))))
        .assertNext(response -> assertThat(response.getResponses().get("B").getFrames())
            .extracting("name")
            .containsExactly("B", "B-series-1", "B-series-2"))
        .verifyComplete();
  }

  @Test
  public void testUnknownQueryTypeIsPerQueryError() {
    final DataQuery good = query("A", "", "{}");
    final DataQuery bad = query("B", "search", "{}");

    StepVerifier.create(plugin.queryData(new QueryDataRequest().setQueries(List.of(good, bad))))
        .assertNext(response -> {
          assertThat(response.getResponses()).containsOnlyKeys("A", "B");
          assertThat(response.getResponses().get("A").getError()).isNull();
          assertThat(response.getResponses().get("B").getError())
              .isEqualTo("invalid query type: search");
          assertThat(response.hasErrors()).isTrue();
        })
        .verifyComplete();
  }

  private static DataQuery query(String refId, String queryType, String json) {
    return new DataQuery()
        .setRefId(refId)
        .setQueryType(queryType)
        .setMaxDataPoints(100)
        .setJson(json)
        .setTimeRange(new TimeRange(TO.minus(Duration.ofHours(1)), TO));
  }
}
