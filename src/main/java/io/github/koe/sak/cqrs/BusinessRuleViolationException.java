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

package io.github.koe.sak.cqrs;

import io.github.koe.sak.rules.Regel;
import io.github.koe.sak.rules.ValidationResult;
import java.io.Serial;

/** Raised when a candidate event breaks a business rule. Retrying the same event is pointless. */
public class BusinessRuleViolationException extends RuntimeException {
  @Serial private static final long serialVersionUID = -873502219564830418L;

  private final transient ValidationResult result;

  /**
   * @param result of a failed validation
   */
  public BusinessRuleViolationException(ValidationResult result) {
    super(result == null ? null : result.message());

    if (result == null || result.valid()) {
      throw new IllegalArgumentException("A failed validation result is required");
    }

    this.result = result;
  }

  public ValidationResult getResult() {
    return result;
  }

  public Regel getViolatedRule() {
    return result.violatedRule();
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/400">400 Bad
   *     Request</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 400;
  }
}
