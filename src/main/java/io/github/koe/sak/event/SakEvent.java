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

/**
 * Immutable entry of a case log: a common envelope plus a type-specific {@link #data()} payload.
 *
 * <p>{@link #eventId()} and {@link #tidsstempel()} are always assigned by the server, see {@link
 * EventParser#parseCandidate(com.fasterxml.jackson.databind.JsonNode)}.
 */
// @formatter:off
public sealed interface SakEvent
    permits SakOpprettetEvent,
        GrunnlagEvent,
        VederlagEvent,
        FristEvent,
        TrukketEvent,
        GrunnlagResponsEvent,
        VederlagResponsEvent,
        FristResponsEvent,
        EoOpprettetEvent,
        EoKoeEvent,
        EoUtstedtEvent,
        EoSvarEvent,
        EoRevidertEvent {
// @formatter:on

  UUID eventId();

  String sakId();

  EventType eventType();

  Instant tidsstempel();

  /**
   * @return free-text name of the person who submitted the event
   */
  String aktor();

  AktorRolle aktorRolle();

  /**
   * @return optional free-text comment, may be {@code null}
   */
  String kommentar();

  /**
   * @return optional identifier of the event this one answers or revises, may be {@code null}
   */
  UUID relatertEventId();

  /**
   * @return optional revision counter of the affected track, may be {@code null}
   */
  Integer versjon();

  EventData data();

  /**
   * Guards the discriminant of a variant which covers several event types.
   *
   * @param eventType to check
   * @param variant expected to carry the event type
   * @return the event type if it belongs to the variant
   * @throws IllegalArgumentException when the event type belongs to another variant
   */
  static EventType requireVariant(EventType eventType, Class<? extends SakEvent> variant) {
    if (eventType == null) {
      throw new IllegalArgumentException("Event type cannot be null");
    }

    if (eventType.eventClass() != variant) {
      throw new IllegalArgumentException(
          "'%s' cannot be carried by %s".formatted(eventType, variant.getSimpleName()));
    }

    return eventType;
  }
}
