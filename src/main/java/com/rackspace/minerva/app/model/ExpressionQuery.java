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

package com.rackspace.minerva.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import java.time.Duration;
import lombok.Data;

@Data
public class ExpressionQuery {
  @JsonRawValue
  String json;

  @JsonIgnore
  Duration interval;

  String refId;

  long maxDataPoints;

  String queryType;

  DataSourceRef datasource;

  TimeRange timeRange;

  @JsonProperty("intervalMs")
  public long getIntervalMs() {
    return interval == null ? 0 : interval.toMillis();
  }
}
