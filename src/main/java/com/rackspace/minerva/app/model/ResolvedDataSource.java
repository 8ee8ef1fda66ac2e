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

import java.time.Instant;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A data source reference after resolution: either a configured data source or one of the
 * two reserved pseudo data sources, which are synthesized without a lookup.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ResolvedDataSource {

  public enum Kind {
    REAL,
    EXPRESSION,
    INTERNAL_METRICS
  }

  public static final String EXPRESSION_UID = "__expr__";
  /**
   * Used by clients that still send the numeric-looking uid of the expression source.
   */
  public static final String LEGACY_EXPRESSION_UID = "-100";
  public static final long EXPRESSION_ID = -100;
  public static final String EXPRESSION_TYPE = "__expr__";

  public static final String INTERNAL_METRICS_UID = "grafana";
  public static final long INTERNAL_METRICS_ID = -1;
  public static final String INTERNAL_METRICS_TYPE = "datasource";

  private final Kind kind;
  private final DataSource dataSource;

  private ResolvedDataSource(Kind kind, DataSource dataSource) {
    this.kind = kind;
    this.dataSource = dataSource;
  }

  public static ResolvedDataSource real(DataSource dataSource) {
    return new ResolvedDataSource(Kind.REAL, dataSource);
  }

  public static ResolvedDataSource expression() {
    return new ResolvedDataSource(Kind.EXPRESSION, new DataSource()
        .setId(EXPRESSION_ID)
        .setUid(EXPRESSION_UID)
        .setType(EXPRESSION_TYPE)
        .setName("Expression")
        .setJsonData(Map.of())
        .setSecureJsonData(Map.of()));
  }

  public static ResolvedDataSource internalMetrics(long orgId) {
    return new ResolvedDataSource(Kind.INTERNAL_METRICS, new DataSource()
        .setId(INTERNAL_METRICS_ID)
        .setUid(INTERNAL_METRICS_UID)
        .setOrgId(orgId)
        .setType(INTERNAL_METRICS_TYPE)
        .setName("-- Grafana --")
        .setAccess("proxy")
        .setJsonData(Map.of())
        .setSecureJsonData(Map.of())
        .setUpdated(Instant.EPOCH));
  }

  public static boolean isExpressionUid(String uid) {
    return EXPRESSION_UID.equals(uid) || LEGACY_EXPRESSION_UID.equals(uid);
  }

  public boolean isExpression() {
    return kind == Kind.EXPRESSION;
  }

  public String getUid() {
    return dataSource.getUid();
  }
}
