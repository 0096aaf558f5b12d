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

package io.github.koe.sak.event;

import java.time.Instant;
import java.util.UUID;

/** TE accepts or disputes an issued change order. */
public record EoSvarEvent(
    UUID eventId,
    String sakId,
    EventType eventType,
    Instant tidsstempel,
    String aktor,
    AktorRolle aktorRolle,
    String kommentar,
    UUID relatertEventId,
    Integer versjon,
    EoSvarData data)
    implements SakEvent {
  public EoSvarEvent {
    SakEvent.requireVariant(eventType, EoSvarEvent.class);
  }
}
