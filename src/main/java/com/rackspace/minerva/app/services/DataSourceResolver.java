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
import com.rackspace.minerva.app.exceptions.BadQueryException;
import com.rackspace.minerva.app.model.ResolvedDataSource;
import com.rackspace.minerva.app.model.SignedInUser;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Maps the data source reference of one raw query to a concrete data source.
 */
@Service
public class DataSourceResolver {

  private final DataSourceCacheService dataSourceCache;

  @Autowired
  public DataSourceResolver(DataSourceCacheService dataSourceCache) {
    this.dataSourceCache = dataSourceCache;
  }

  /**
   * Resolution order: the batch memo, the expression pseudo source, the internal metrics
   * pseudo source, a lookup by numeric id, then a lookup by uid. Lookup errors are
   * propagated as they are.
   *
   * @param query the raw query document
   * @param resolved data sources already resolved in this batch keyed by uid, only read here
   */
  public Mono<ResolvedDataSource> resolve(SignedInUser user, boolean skipCache, JsonNode query,
                                          Map<String, ResolvedDataSource> resolved) {
    final String uid = dataSourceUid(query);

    final ResolvedDataSource memo = resolved.get(uid);
    if (memo != null) {
      return Mono.just(memo);
    }

    if (ResolvedDataSource.isExpressionUid(uid)) {
      return Mono.just(ResolvedDataSource.expression());
    }

    if (ResolvedDataSource.INTERNAL_METRICS_UID.equals(uid)) {
      return Mono.just(ResolvedDataSource.internalMetrics(user.getOrgId()));
    }

    final JsonNode idNode = query.path("datasourceId");
    final long id = idNode.isNumber() ? idNode.asLong() : 0;
    if (id > 0) {
      return dataSourceCache.getDatasource(id, user, skipCache)
          .map(ResolvedDataSource::real);
    }

    if (!uid.isEmpty()) {
      return dataSourceCache.getDatasourceByUID(uid, user, skipCache)
          .map(ResolvedDataSource::real);
    }

    return Mono.error(new BadQueryException("missing data source ID/UID"));
  }

  /**
   * Reads <code>datasource.uid</code>, falling back to a bare <code>datasource</code>
   * string as sent by older clients.
   */
  static String dataSourceUid(JsonNode query) {
    final JsonNode datasource = query.path("datasource");
    final JsonNode uid = datasource.path("uid");
    if (uid.isTextual() && !uid.asText().isEmpty()) {
      return uid.asText();
    }
    if (datasource.isTextual()) {
      return datasource.asText();
    }
    return "";
  }
}
