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

package com.rackspace.minerva.app.exceptions;

/**
 * Raised when the expression engine or a plugin backend fails to execute a batch. The
 * message names the dispatch path and the original failure is kept as the cause.
 */
public class QueryDispatchException extends RuntimeException {

  public QueryDispatchException(String message) {
    super(message);
  }

  public QueryDispatchException(String message, Throwable cause) {
    super(message + ": " + cause.getMessage(), cause);
  }
}
