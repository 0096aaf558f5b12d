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
 * Append-only, per-case event log with optimistic concurrency.
 *
 * <p>Appends to the same case are linearised, appends to different cases are independent. Reads
 * never block writers and always observe a whole log, never a partially written one.
 */
public interface EventStore {
  /**
   * @param event to append
   * @param expectedVersion the caller observed
   * @return the new version, {@code expectedVersion + 1}
   * @throws ConcurrencyException when the log version differs from {@code expectedVersion}
   */
  default int append(SakEvent event, int expectedVersion) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    return appendBatch(List.of(event), expectedVersion);
  }

  /**
   * Appends all events or none of them.
   *
   * @param events of a single case, not empty
   * @param expectedVersion the caller observed
   * @return the new version, {@code expectedVersion + events.size()}
   * @throws IllegalArgumentException when the batch is empty or spans several cases
   * @throws ConcurrencyException when the log version differs from {@code expectedVersion}
   */
  int appendBatch(List<? extends SakEvent> events, int expectedVersion);

  /**
   * @param sakId of the case
   * @return events in append order with the current version, {@link EventLog#empty()} for an
   *     unknown case
   */
  EventLog getEvents(String sakId);

  /**
   * @return identifiers of every case which has at least one event
   */
  List<String> listSakIds();
}
