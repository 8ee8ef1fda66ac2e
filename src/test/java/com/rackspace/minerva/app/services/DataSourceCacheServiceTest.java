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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.minerva.app.config.AppProperties;
import com.rackspace.minerva.app.config.CacheConfig;
import com.rackspace.minerva.app.exceptions.DataSourceNotFoundException;
import com.rackspace.minerva.app.model.DataSource;
import com.rackspace.minerva.app.model.DataSourceCacheKey;
import com.rackspace.minerva.app.model.SignedInUser;
import com.rackspace.minerva.app.repos.DataSourceRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Mocks out the repository to verify the caching behavior of data source lookups.
 */
@ActiveProfiles("test")
@SpringBootTest(classes = {
    CacheConfig.class,
    DataSourceCacheService.class,
    SimpleMeterRegistry.class
})
@EnableConfigurationProperties(AppProperties.class)
public class DataSourceCacheServiceTest {

  @MockBean
  DataSourceRepository dataSourceRepository;

  @Autowired
  DataSourceCacheService dataSourceCacheService;

  @Autowired
  AsyncCache<DataSourceCacheKey, DataSource> dataSourceCache;

  @Autowired
  MeterRegistry meterRegistry;

  private final SignedInUser user = new SignedInUser().setOrgId(1).setUserId(4);

  @AfterEach
  void tearDown() {
    dataSourceCache.synchronous().invalidateAll();
    reset(dataSourceRepository);
  }

  @Test
  public void testLookupByIdIsCached() {
    final DataSource ds = new DataSource().setId(5).setUid("prom-1").setOrgId(1).setType("prometheus");
    when(dataSourceRepository.findById(1, 5)).thenReturn(Mono.just(ds));
    final double hitsBefore = cacheHits();

    StepVerifier.create(dataSourceCacheService.getDatasource(5, user, false))
        .expectNext(ds)
        .verifyComplete();
    StepVerifier.create(dataSourceCacheService.getDatasource(5, user, false))
        .expectNext(ds)
        .verifyComplete();

    verify(dataSourceRepository, times(1)).findById(1, 5);
    assertThat(cacheHits() - hitsBefore).isEqualTo(1.0);
  }

  @Test
  public void testCancelledLookupLeavesConcurrentLookupIntact() {
    final DataSource ds = new DataSource().setId(5).setUid("prom-1").setOrgId(1).setType("prometheus");
    when(dataSourceRepository.findById(1, 5))
        .thenReturn(Mono.just(ds).delayElement(Duration.ofMillis(300)));

    final Disposable first = dataSourceCacheService.getDatasource(5, user, false).subscribe();

    StepVerifier.create(dataSourceCacheService.getDatasource(5, user, false))
        .then(first::dispose)
        .expectNext(ds)
        .expectComplete()
        .verify(Duration.ofSeconds(5));

    assertThat(first.isDisposed()).isTrue();
    verify(dataSourceRepository, times(1)).findById(1, 5);
    // the shared entry survived the cancellation
    StepVerifier.create(dataSourceCacheService.getDatasource(5, user, false))
        .expectNext(ds)
        .verifyComplete();
  }

  @Test
  public void testSkipCacheReloads() {
    final DataSource original = new DataSource().setId(5).setUid("prom-1").setOrgId(1).setUrl("http://a");
    final DataSource updated = new DataSource().setId(5).setUid("prom-1").setOrgId(1).setUrl("http://b");
    when(dataSourceRepository.findByUid(1, "prom-1"))
        .thenReturn(Mono.just(original), Mono.just(updated));

    StepVerifier.create(dataSourceCacheService.getDatasourceByUID("prom-1", user, false))
        .expectNext(original)
        .verifyComplete();
    StepVerifier.create(dataSourceCacheService.getDatasourceByUID("prom-1", user, true))
        .expectNext(updated)
        .verifyComplete();
    // the bypassing lookup refreshed the cached entry
    StepVerifier.create(dataSourceCacheService.getDatasourceByUID("prom-1", user, false))
        .expectNext(updated)
        .verifyComplete();

    verify(dataSourceRepository, times(2)).findByUid(1, "prom-1");
  }

  @Test
  public void testMissingDataSourceNotCached() {
    when(dataSourceRepository.findByUid(1, "nope")).thenReturn(Mono.empty());

    StepVerifier.create(dataSourceCacheService.getDatasourceByUID("nope", user, false))
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(DataSourceNotFoundException.class)
            .hasMessage("data source not found: uid=nope"))
        .verify();
    StepVerifier.create(dataSourceCacheService.getDatasourceByUID("nope", user, false))
        .expectError(DataSourceNotFoundException.class)
        .verify();

    verify(dataSourceRepository, times(2)).findByUid(1, "nope");
  }

  @Test
  public void testLookupsAreScopedToOrg() {
    final DataSource org1 = new DataSource().setId(5).setUid("shared").setOrgId(1);
    final DataSource org2 = new DataSource().setId(5).setUid("shared").setOrgId(2);
    when(dataSourceRepository.findByUid(1, "shared")).thenReturn(Mono.just(org1));
    when(dataSourceRepository.findByUid(2, "shared")).thenReturn(Mono.just(org2));

    StepVerifier.create(dataSourceCacheService.getDatasourceByUID("shared", user, false))
        .expectNext(org1)
        .verifyComplete();
    StepVerifier.create(dataSourceCacheService.getDatasourceByUID("shared",
            new SignedInUser().setOrgId(2), false))
        .expectNext(org2)
        .verifyComplete();
  }

  private double cacheHits() {
    return meterRegistry.get("minerva.datasource.cache").tag("result", "hit").counter().count();
  }
}
