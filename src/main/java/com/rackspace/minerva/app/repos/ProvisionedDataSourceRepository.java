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

package com.rackspace.minerva.app.repos;

import com.rackspace.minerva.app.config.DataSourceProvisioningProperties;
import com.rackspace.minerva.app.config.DataSourceProvisioningProperties.ProvisionedDataSource;
import com.rackspace.minerva.app.model.DataSource;
import com.rackspace.minerva.app.services.SecretsService;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Serves the data sources declared under <code>minerva.provisioning.datasources</code>.
 */
@Repository
@Slf4j
public class ProvisionedDataSourceRepository implements DataSourceRepository {

  private final List<DataSource> dataSources;

  @Autowired
  public ProvisionedDataSourceRepository(DataSourceProvisioningProperties properties,
                                         SecretsService secretsService) {
    final Instant loadedAt = Instant.now();
    this.dataSources = properties.getDatasources().stream()
        .map(provisioned -> toDataSource(provisioned, secretsService, loadedAt))
        .collect(Collectors.toUnmodifiableList());
    log.info("Provisioned {} data sources", dataSources.size());
  }

  @Override
  public Mono<DataSource> findById(long orgId, long id) {
    return Mono.justOrEmpty(dataSources.stream()
        .filter(ds -> ds.getOrgId() == orgId && ds.getId() == id)
        .findFirst());
  }

  @Override
  public Mono<DataSource> findByUid(long orgId, String uid) {
    return Mono.justOrEmpty(dataSources.stream()
        .filter(ds -> ds.getOrgId() == orgId && ds.getUid().equals(uid))
        .findFirst());
  }

  private static DataSource toDataSource(ProvisionedDataSource provisioned,
                                         SecretsService secretsService, Instant loadedAt) {
    final Map<String, byte[]> secureJsonData = new HashMap<>();
    provisioned.getSecureJsonData()
        .forEach((key, value) -> secureJsonData.put(key, secretsService.encrypt(value)));

    return new DataSource()
        .setId(provisioned.getId())
        .setUid(provisioned.getUid())
        .setOrgId(provisioned.getOrgId())
        .setName(provisioned.getName() == null ? provisioned.getUid() : provisioned.getName())
        .setType(provisioned.getType())
        .setAccess(provisioned.getAccess())
        .setUrl(provisioned.getUrl())
        .setUser(provisioned.getUser())
        .setDatabase(provisioned.getDatabase())
        .setBasicAuth(provisioned.isBasicAuth())
        .setBasicAuthUser(provisioned.getBasicAuthUser())
        .setJsonData(Map.copyOf(provisioned.getJsonData()))
        .setSecureJsonData(Map.copyOf(secureJsonData))
        .setUpdated(loadedAt);
  }
}
