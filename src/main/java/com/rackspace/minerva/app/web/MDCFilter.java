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

package com.rackspace.minerva.app.web;

import com.rackspace.minerva.app.config.AppProperties;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

@Component
public class MDCFilter implements WebFilter {

  static final String X_B3_TRACE_ID = "X-B3-TraceId";
  static final String MDC_ORG_ID = "orgId";

  private final AppProperties appProperties;

  public MDCFilter(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    final HttpHeaders headers = exchange.getRequest().getHeaders();
    MDC.put(X_B3_TRACE_ID, headers.getFirst(X_B3_TRACE_ID));
    MDC.put(MDC_ORG_ID, headers.getFirst(appProperties.getOrgHeader()));
    return chain.filter(exchange);
  }
}
