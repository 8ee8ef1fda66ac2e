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

import com.rackspace.minerva.app.model.MetricRequest;
import com.rackspace.minerva.app.model.OAuthToken;
import com.rackspace.minerva.app.model.QueryDataResponse;
import com.rackspace.minerva.app.model.SignedInUser;
import com.rackspace.minerva.app.services.QueryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Data source query API. The caller is authenticated upstream and identified by headers.
 */
@RestController
@RequestMapping("/api/ds")
public class QueryDataController {

  private final QueryService queryService;

  @Autowired
  public QueryDataController(QueryService queryService) {
    this.queryService = queryService;
  }

  @PostMapping("/query")
  public Mono<ResponseEntity<QueryDataResponse>> queryData(
      @RequestBody MetricRequest request,
      @RequestHeader(value = "#{appProperties.orgHeader}") long orgId,
      @RequestHeader(value = "#{appProperties.userIdHeader}", required = false) Long userId,
      @RequestHeader(value = "#{appProperties.userHeader}", required = false) String login,
      @RequestHeader(value = "#{appProperties.noCacheHeader}", required = false) String noCache,
      @RequestHeader(value = "#{appProperties.accessTokenHeader}", required = false) String accessToken) {
    final SignedInUser user = new SignedInUser()
        .setOrgId(orgId)
        .setUserId(userId == null ? 0 : userId)
        .setLogin(login)
        .setForwardedToken(OAuthToken.fromHeaderValue(accessToken));
    return queryService.queryData(user, Boolean.parseBoolean(noCache), request, true)
        .map(response -> ResponseEntity
            .status(response.hasErrors() ? HttpStatus.BAD_REQUEST : HttpStatus.OK)
            .body(response));
  }
}
