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

package com.rackspace.minerva.app.validation;

import com.rackspace.minerva.app.exceptions.UrlNotAllowedException;
import java.util.Map;

/**
 * Decides whether the service may send requests to a data source URL.
 */
public interface PluginRequestValidator {

  /**
   * @param url the data source URL
   * @param context optional request attributes, may be null
   * @throws UrlNotAllowedException when the URL must not be contacted
   */
  void validate(String url, Map<String, String> context);
}
