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

package io.github.koe.sak.async;

import io.github.koe.sak.state.OverordnetStatus;
import io.github.koe.sak.state.SakState;
import java.time.Instant;

/**
 * Listing entry of a case.
 *
 * @param sakId of the case
 * @param sakstittel of the case
 * @param status overall status at the time of the latest append
 * @param sisteAktivitet timestamp of the latest event
 */
public record SakMetadata(
    String sakId, String sakstittel, OverordnetStatus status, Instant sisteAktivitet) {

  public static SakMetadata of(SakState state) {
    return new SakMetadata(
        state.sakId(), state.sakstittel(), state.overordnetStatus(), state.sisteAktivitet());
  }
}
