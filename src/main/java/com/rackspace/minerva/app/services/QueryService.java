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

import com.rackspace.minerva.app.config.AppProperties;
import com.rackspace.minerva.app.exceptions.QueryDispatchException;
import com.rackspace.minerva.app.model.MetricRequest;
import com.rackspace.minerva.app.model.ParsedRequest;
import com.rackspace.minerva.app.model.QueryDataResponse;
import com.rackspace.minerva.app.model.SignedInUser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point for running a batch of queries: parses it, then sends it either to the
 * expression engine or directly to the backend plugin of its data source.
 */
@Service
@Slf4j
public class QueryService {

  private final QueryRequestParser queryRequestParser;
  private final ExpressionDispatcher expressionDispatcher;
  private final PluginDispatcher pluginDispatcher;
  private final AppProperties appProperties;
  private final Counter expressionQueryCounter;
  private final Counter pluginQueryCounter;

  @Autowired
  public QueryService(QueryRequestParser queryRequestParser,
                      ExpressionDispatcher expressionDispatcher,
                      PluginDispatcher pluginDispatcher,
                      AppProperties appProperties,
                      MeterRegistry meterRegistry) {
    this.queryRequestParser = queryRequestParser;
    this.expressionDispatcher = expressionDispatcher;
    this.pluginDispatcher = pluginDispatcher;
    this.appProperties = appProperties;
    this.expressionQueryCounter = meterRegistry.counter("minerva.query", "path", "expression");
    this.pluginQueryCounter = meterRegistry.counter("minerva.query", "path", "plugin");
    log.info("Query service initialization");
  }

  /**
   * Stays pending until <code>shutdown</code> signals, then fails with a
   * {@link CancellationException}. Lets a supervisor tie the service's lifetime to its own.
   */
  public Mono<Void> run(Mono<?> shutdown) {
    return shutdown
        .then(Mono.error(() -> new CancellationException("query service stopped")));
  }

  /**
   * @param skipCache bypass the data source cache for lookups
   * @param handleExpressions when false, batches with expressions are still sent to the
   * plugin of their first data source
   */
  public Mono<QueryDataResponse> queryData(SignedInUser user, boolean skipCache,
                                           MetricRequest request, boolean handleExpressions) {
    return queryRequestParser.parse(user, skipCache, request)
        .flatMap(parsedRequest -> dispatch(user, parsedRequest, handleExpressions))
        .timeout(appProperties.getQueryTimeout())
        .onErrorMap(TimeoutException.class,
            e -> new QueryDispatchException("query timed out", e))
        .checkpoint();
  }

  private Mono<QueryDataResponse> dispatch(SignedInUser user, ParsedRequest parsedRequest,
                                           boolean handleExpressions) {
    if (handleExpressions && parsedRequest.isHasExpression()) {
      expressionQueryCounter.increment();
      return expressionDispatcher.dispatch(user, parsedRequest);
    }
    pluginQueryCounter.increment();
    return pluginDispatcher.dispatch(user, parsedRequest);
  }
}
