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

package io.github.koe.sak.rules;

import static io.github.koe.sak.rules.Regel.ACTIVE_CLAIM_EXISTS;
import static io.github.koe.sak.rules.Regel.CASE_NOT_CLOSED;
import static io.github.koe.sak.rules.Regel.CASE_NOT_EXISTS;
import static io.github.koe.sak.rules.Regel.EO_CAN_ISSUE;
import static io.github.koe.sak.rules.Regel.EO_CASE;
import static io.github.koe.sak.rules.Regel.EO_STATUS;
import static io.github.koe.sak.rules.Regel.GRUNNLAG_REQUIRED;
import static io.github.koe.sak.rules.Regel.NOT_LOCKED;
import static io.github.koe.sak.rules.Regel.ROLE_CHECK;
import static io.github.koe.sak.rules.Regel.TRACK_SENT;

import io.github.koe.sak.event.EventType;
import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.state.SakState;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Decides whether a candidate event may be appended to a case with the given state.
 *
 * <p>Every candidate goes through the common rules ({@link Regel#ROLE_CHECK}, {@link
 * Regel#CASE_NOT_CLOSED}) followed by the chain of its event type. The first broken rule ends the
 * check and is reported. The validator neither throws for broken rules nor changes the state.
 */
public final class BusinessRuleValidator {
  private static final List<Regel> FELLES = List.of(ROLE_CHECK, CASE_NOT_CLOSED);

  /**
   * @param candidate event about to be appended
   * @param state projected from the log the event would be appended to
   * @return verdict naming the first broken rule, if any
   */
  public ValidationResult validate(SakEvent candidate, SakState state) {
    if (candidate == null) {
      throw new IllegalArgumentException("Candidate event cannot be null");
    }

    if (state == null) {
      throw new IllegalArgumentException("State cannot be null");
    }

    for (Regel regel : reglerFor(candidate.eventType())) {
      final Optional<String> brudd = regel.brudd(candidate, state);
      if (brudd.isPresent()) {
        return ValidationResult.brudd(regel, brudd.get());
      }
    }

    return ValidationResult.ok();
  }

  /**
   * @param eventType of a candidate
   * @return rules checked for the type, in order
   */
  public static List<Regel> reglerFor(EventType eventType) {
    return Stream.concat(FELLES.stream(), kjedeFor(eventType).stream()).toList();
  }

  private static List<Regel> kjedeFor(EventType eventType) {
    return switch (eventType) {
      case SAK_OPPRETTET -> List.of(CASE_NOT_EXISTS);
      case GRUNNLAG_OPPRETTET -> List.of(NOT_LOCKED);
      case GRUNNLAG_OPPDATERT, GRUNNLAG_TRUKKET -> List.of(TRACK_SENT, NOT_LOCKED);
      case VEDERLAG_KRAV_SENDT, FRIST_KRAV_SENDT -> List.of(GRUNNLAG_REQUIRED);
      case VEDERLAG_KRAV_OPPDATERT,
          VEDERLAG_KRAV_TRUKKET,
          FRIST_KRAV_OPPDATERT,
          FRIST_KRAV_SPESIFISERT,
          FRIST_KRAV_TRUKKET -> List.of(GRUNNLAG_REQUIRED, ACTIVE_CLAIM_EXISTS);
      case RESPONS_GRUNNLAG, RESPONS_GRUNNLAG_OPPDATERT -> List.of(TRACK_SENT, NOT_LOCKED);
      case RESPONS_VEDERLAG, RESPONS_VEDERLAG_OPPDATERT, RESPONS_FRIST, RESPONS_FRIST_OPPDATERT ->
          List.of(TRACK_SENT);
      case EO_OPPRETTET,
          EO_KOE_LAGT_TIL,
          EO_KOE_FJERNET,
          EO_AKSEPTERT,
          EO_BESTRIDT,
          EO_REVIDERT -> List.of(EO_CASE, EO_STATUS);
      case EO_UTSTEDT -> List.of(EO_CAN_ISSUE);
    };
  }
}
