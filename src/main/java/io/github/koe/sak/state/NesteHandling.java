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

package io.github.koe.sak.state;

import io.github.koe.sak.event.AktorRolle;
import io.github.koe.sak.event.Spor;

/**
 * Hint about who should do what next.
 *
 * @param rolle expected to act, {@code null} when nothing is pending
 * @param handling is a human-readable description
 * @param spor the action concerns, {@code null} when it concerns the whole case
 */
public record NesteHandling(AktorRolle rolle, String handling, Spor spor) {
  static final NesteHandling INGEN = new NesteHandling(null, "Ingen ventende handlinger", null);
  static final NesteHandling UTSTED_EO =
      new NesteHandling(AktorRolle.BH, "Utstede endringsordre (EO)", null);
}
