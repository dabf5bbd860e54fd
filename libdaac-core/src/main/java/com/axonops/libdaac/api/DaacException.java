/*
 * Copyright 2025 AxonOps
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

package com.axonops.libdaac.api;

/**
 * Base exception for all libdaac errors.
 *
 * <p>Sealed class ensuring exhaustive handling of all error types.
 *
 * @since 1.0.0
 */
public sealed class DaacException extends RuntimeException
    permits InvalidPatternException, UnsupportedSearchException, ResourceException {

  public DaacException(String message) {
    super(message);
  }

  public DaacException(String message, Throwable cause) {
    super(message, cause);
  }
}
