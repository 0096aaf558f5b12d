/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.koe.sak.store;

import java.io.Serial;

/**
 * Raised when a log has moved on since the caller read it. The caller should re-read the log,
 * reconsider its intent and try again.
 */
public class ConcurrencyException extends RuntimeException {
  @Serial private static final long serialVersionUID = -6417755239203851930L;

  private final int expectedVersion;
  private final int actualVersion;

  public ConcurrencyException(int expectedVersion, int actualVersion) {
    this(expectedVersion, actualVersion, null);
  }

  public ConcurrencyException(int expectedVersion, int actualVersion, Throwable cause) {
    super(
        "Versjonskonflikt: forventet %d, fikk %d".formatted(expectedVersion, actualVersion),
        cause);
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public int getExpectedVersion() {
    return expectedVersion;
  }

  public int getActualVersion() {
    return actualVersion;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
