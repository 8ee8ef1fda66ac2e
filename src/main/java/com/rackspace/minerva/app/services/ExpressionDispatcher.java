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

import com.rackspace.minerva.app.exceptions.BadQueryException;
import com.rackspace.minerva.app.exceptions.QueryDispatchException;
import com.rackspace.minerva.app.model.DataQuery;
import com.rackspace.minerva.app.model.DataSource;
import com.rackspace.minerva.app.model.DataSourceRef;
import com.rackspace.minerva.app.model.ExpressionQuery;
import com.rackspace.minerva.app.model.ExpressionRequest;
import com.rackspace.minerva.app.model.ParsedQuery;
import com.rackspace.minerva.app.model.ParsedRequest;
import com.rackspace.minerva.app.model.QueryDataResponse;
import com.rackspace.minerva.app.model.SignedInUser;
import com.rackspace.minerva.app.model.TimeRange;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Hands batches containing expression queries to the expression engine.
 */
@Service
public class ExpressionDispatcher {

  private final ExpressionService expressionService;

  @Autowired
  public ExpressionDispatcher(ExpressionService expressionService) {
    this.expressionService = expressionService;
  }

  public Mono<QueryDataResponse> dispatch(SignedInUser user, ParsedRequest parsedRequest) {
    return Mono.fromCallable(() -> buildRequest(user, parsedRequest))
        .flatMap(request -> expressionService.transformData(request)
            .onErrorMap(e -> new QueryDispatchException("expression request error", e)));
  }

  private ExpressionRequest buildRequest(SignedInUser user, ParsedRequest parsedRequest) {
    final ExpressionRequest request = new ExpressionRequest().setOrgId(user.getOrgId());
    for (ParsedQuery parsedQuery : parsedRequest.getParsedQueries()) {
      final DataQuery query = parsedQuery.getQuery();
      if (parsedQuery.getDatasource() == null || parsedQuery.getDatasource().getDataSource() == null) {
        throw new BadQueryException("query missing datasource info: " + query.getRefId());
      }
      final DataSource ds = parsedQuery.getDatasource().getDataSource();
      request.getQueries().add(new ExpressionQuery()
          .setJson(query.getJson())
          .setInterval(query.getInterval())
          .setRefId(query.getRefId())
          .setMaxDataPoints(query.getMaxDataPoints())
          .setQueryType(query.getQueryType())
          .setDatasource(new DataSourceRef(ds.getType(), ds.getUid()))
          .setTimeRange(new TimeRange(query.getTimeRange().getFrom(), query.getTimeRange().getTo())));
    }
    return request;
  }
}
