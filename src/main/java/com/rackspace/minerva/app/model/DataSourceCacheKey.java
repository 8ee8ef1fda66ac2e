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

import lombok.Data;

/**
 * Cache key for data source lookups. Exactly one of {@code id} and {@code uid} is set.
 */
@Data
public class DataSourceCacheKey {
  final long orgId;
  final long id;
  final String uid;

  public static DataSourceCacheKey byId(long orgId, long id) {
    return new DataSourceCacheKey(orgId, id, null);
  }

  public static DataSourceCacheKey byUid(long orgId, String uid) {
    return new DataSourceCacheKey(orgId, 0, uid);
  }
}
