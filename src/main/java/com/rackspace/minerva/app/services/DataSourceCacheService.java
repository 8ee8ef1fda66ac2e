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

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.minerva.app.exceptions.DataSourceNotFoundException;
import com.rackspace.minerva.app.model.DataSource;
import com.rackspace.minerva.app.model.DataSourceCacheKey;
import com.rackspace.minerva.app.model.SignedInUser;
import com.rackspace.minerva.app.repos.DataSourceRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Looks up data sources within the caller's organization through a short lived cache.
 */
@Service
@Slf4j
public class DataSourceCacheService {

  private final DataSourceRepository dataSourceRepository;
  private final AsyncCache<DataSourceCacheKey, DataSource> dataSourceCache;
  private final Counter cacheHit;
  private final Counter cacheMiss;

  @Autowired
  public DataSourceCacheService(DataSourceRepository dataSourceRepository,
                                AsyncCache<DataSourceCacheKey, DataSource> dataSourceCache,
                                MeterRegistry meterRegistry) {
    this.dataSourceRepository = dataSourceRepository;
    this.dataSourceCache = dataSourceCache;
    cacheHit = meterRegistry.counter("minerva.datasource.cache", "result", "hit");
    cacheMiss = meterRegistry.counter("minerva.datasource.cache", "result", "miss");
  }

  public Mono<DataSource> getDatasource(long id, SignedInUser user, boolean skipCache) {
    final DataSourceCacheKey key = DataSourceCacheKey.byId(user.getOrgId(), id);
    return lookup(key, skipCache, () -> dataSourceRepository.findById(user.getOrgId(), id)
        .switchIfEmpty(Mono.error(() ->
            new DataSourceNotFoundException("data source not found: id=" + id))));
  }

  public Mono<DataSource> getDatasourceByUID(String uid, SignedInUser user, boolean skipCache) {
    final DataSourceCacheKey key = DataSourceCacheKey.byUid(user.getOrgId(), uid);
    return lookup(key, skipCache, () -> dataSourceRepository.findByUid(user.getOrgId(), uid)
        .switchIfEmpty(Mono.error(() ->
            new DataSourceNotFoundException("data source not found: uid=" + uid))));
  }

  private Mono<DataSource> lookup(DataSourceCacheKey key, boolean skipCache,
                                  Supplier<Mono<DataSource>> loader) {
    if (skipCache) {
      dataSourceCache.synchronous().invalidate(key);
    }
    return Mono.defer(() -> {
      final CompletableFuture<DataSource> cached = dataSourceCache.getIfPresent(key);
      if (cached != null) {
        cacheHit.increment();
        return fromSharedFuture(cached);
      }
      cacheMiss.increment();
      log.trace("Loading data source {}", key);
      // failed loads complete exceptionally and are evicted by the cache
      return fromSharedFuture(
          dataSourceCache.get(key, (k, executor) -> loader.get().toFuture()));
    });
  }

  /**
   * Cache entries are shared by concurrent lookups, so each subscriber gets a dependent
   * future. Cancelling one lookup then leaves the entry and the other lookups untouched.
   */
  private static Mono<DataSource> fromSharedFuture(CompletableFuture<DataSource> shared) {
    return Mono.fromFuture(shared.thenApply(Function.identity()));
  }
}
