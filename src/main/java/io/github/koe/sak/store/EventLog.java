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

import io.github.koe.sak.event.SakEvent;
import java.util.List;

/**
 * Snapshot of a case log.
 *
 * @param events in append order
 * @param version always equal to the number of events
 */
public record EventLog(List<SakEvent> events, int version) {
  private static final EventLog EMPTY = new EventLog(List.of(), 0);

  public EventLog {
    events = events == null ? List.of() : List.copyOf(events);

    if (version != events.size()) {
      throw new IllegalArgumentException(
          "Version %d does not match %d events".formatted(version, events.size()));
    }
  }

  public static EventLog empty() {
    return EMPTY;
  }

  public static EventLog of(List<SakEvent> events) {
    return new EventLog(events, events.size());
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }
}
