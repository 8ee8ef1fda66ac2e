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
import com.rackspace.minerva.app.model.DataQuery;
import com.rackspace.minerva.app.model.ParsedQuery;
import com.rackspace.minerva.app.model.ParsedRequest;
import com.rackspace.minerva.app.model.ResolvedDataSource;
import org.springframework.stereotype.Component;

/**
 * Tracks whether a batch needs the expression engine and rejects batches that mix data
 * sources without one.
 */
@Component
public class BatchClassifier {

  public void add(ParsedRequest request, ResolvedDataSource datasource, DataQuery query) {
    request.getParsedQueries().add(new ParsedQuery(datasource, query));
    if (datasource.isExpression()) {
      request.setHasExpression(true);
    }
  }

  /**
   * Batches containing an expression may reference several data sources since the
   * expression engine fans out to them itself.
   */
  public void verify(ParsedRequest request) {
    if (request.isHasExpression()) {
      return;
    }
    final long distinct = request.getParsedQueries().stream()
        .map(parsedQuery -> parsedQuery.getDatasource().getUid())
        .distinct()
        .count();
    if (distinct > 1) {
      // mixed data source batches are only supported through expressions
      throw new BadQueryException("all queries must use the same datasource");
    }
  }
}
