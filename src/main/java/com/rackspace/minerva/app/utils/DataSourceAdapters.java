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

package com.rackspace.minerva.app.utils;

import com.rackspace.minerva.app.model.DataSource;
import com.rackspace.minerva.app.model.DataSourceInstanceSettings;
import com.rackspace.minerva.app.model.PluginUser;
import com.rackspace.minerva.app.model.SignedInUser;
import java.util.Map;

/**
 * Conversions from the service's own models into what backend plugins receive.
 */
public class DataSourceAdapters {

  private DataSourceAdapters() {
  }

  public static DataSourceInstanceSettings toInstanceSettings(
      DataSource ds, Map<String, String> decryptedSecureJsonData) {
    return new DataSourceInstanceSettings()
        .setId(ds.getId())
        .setUid(ds.getUid())
        .setName(ds.getName())
        .setUrl(ds.getUrl())
        .setUser(ds.getUser())
        .setDatabase(ds.getDatabase())
        .setBasicAuthEnabled(ds.isBasicAuth())
        .setBasicAuthUser(ds.getBasicAuthUser())
        .setJsonData(ds.getJsonData() == null ? Map.of() : ds.getJsonData())
        .setDecryptedSecureJsonData(decryptedSecureJsonData)
        .setUpdated(ds.getUpdated());
  }

  public static PluginUser toPluginUser(SignedInUser user) {
    if (user == null) {
      return null;
    }
    return new PluginUser()
        .setLogin(user.getLogin())
        .setName(user.getName())
        .setEmail(user.getEmail())
        .setRole(user.getOrgRole());
  }
}
