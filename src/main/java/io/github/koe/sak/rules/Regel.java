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

import io.github.koe.sak.event.AktorRolle;
import io.github.koe.sak.event.EventType;
import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.event.SaksType;
import io.github.koe.sak.event.Spor;
import io.github.koe.sak.state.EndringsordreTilstand;
import io.github.koe.sak.state.EoStatus;
import io.github.koe.sak.state.SakState;
import io.github.koe.sak.state.SporStatus;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Named business rules. A rule reports the user-facing reason it is broken, or nothing.
 *
 * <p>Rules never throw and never change the state they look at.
 */
public enum Regel {
  /** Only the party owning an event type may submit it. */
  ROLE_CHECK {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      final AktorRolle paakrevd = paakrevdRolle(event.eventType());
      if (paakrevd == null || paakrevd == event.aktorRolle()) {
        return Optional.empty();
      }

      return Optional.of("Kun %s kan utføre denne handlingen".formatted(paakrevd));
    }
  },

  /** A withdrawn or settled case accepts change order events only. */
  CASE_NOT_CLOSED {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      if (event.eventType().erEndringsordre() || !state.erLukket()) {
        return Optional.empty();
      }

      return Optional.of("Saken er lukket og kan ikke endres");
    }
  },

  CASE_NOT_EXISTS {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      return state.antallEvents() == 0 ? Optional.empty() : Optional.of("Saken finnes allerede");
    }
  },

  GRUNNLAG_REQUIRED {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      return state.grunnlag().status().erSendt()
          ? Optional.empty()
          : Optional.of("Grunnlag må være sendt før du kan sende krav");
    }
  },

  ACTIVE_CLAIM_EXISTS {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      final SporStatus status = statusOf(event.eventType().spor(), state);
      if (status.erSendt() && status != SporStatus.TRUKKET) {
        return Optional.empty();
      }

      return Optional.of(
          event.eventType().spor() == Spor.VEDERLAG
              ? "Ingen aktivt vederlagskrav å oppdatere"
              : "Ingen aktivt fristkrav å oppdatere");
    }
  },

  TRACK_SENT {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      final Spor spor = event.eventType().spor();
      if (statusOf(spor, state).erSendt()) {
        return Optional.empty();
      }

      final String navn = spor.name().toLowerCase(Locale.ROOT);
      return Optional.of(
          RESPONSER.contains(event.eventType())
              ? "Kan ikke besvare %s som ikke er sendt".formatted(navn)
              : "Kan ikke endre %s som ikke er sendt".formatted(navn));
    }
  },

  NOT_LOCKED {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      return state.grunnlag().laast()
          ? Optional.of("Grunnlag er låst og kan ikke endres")
          : Optional.empty();
    }
  },

  EO_CASE {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      return state.sakstype() == SaksType.ENDRINGSORDRE
          ? Optional.empty()
          : Optional.of("Handlingen gjelder bare endringsordresaker");
    }
  },

  /** The change order must be in a status the event can follow. */
  EO_STATUS {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      final EndringsordreTilstand eo = state.endringsordre();

      if (event.eventType() == EventType.EO_OPPRETTET) {
        return eo == null ? Optional.empty() : Optional.of("Endringsordren er allerede opprettet");
      }

      if (eo == null) {
        return Optional.of("Endringsordren er ikke opprettet");
      }

      final boolean tillatt =
          switch (event.eventType()) {
            case EO_KOE_LAGT_TIL, EO_KOE_FJERNET -> eo.status().kanEndreKoeSaker();
            case EO_AKSEPTERT, EO_BESTRIDT -> eo.status().kanBesvares();
            case EO_REVIDERT -> eo.status() == EoStatus.BESTRIDT;
            default -> true;
          };

      return tillatt
          ? Optional.empty()
          : Optional.of(
              "Endringsordre med status %s tillater ikke %s".formatted(
                  eo.status(), event.eventType()));
    }
  },

  EO_CAN_ISSUE {
    @Override
    Optional<String> brudd(SakEvent event, SakState state) {
      if (state.sakstype() == SaksType.ENDRINGSORDRE) {
        return Optional.empty();
      }

      if (state.eoUtstedt()) {
        return Optional.of("Endringsordre er allerede utstedt for denne saken");
      }

      return state.kanUtstedeEo()
          ? Optional.empty()
          : Optional.of("Alle aktive spor må være godkjent før EO kan utstedes");
    }
  };

  private static final Set<EventType> RESPONSER =
      EnumSet.of(
          EventType.RESPONS_GRUNNLAG,
          EventType.RESPONS_GRUNNLAG_OPPDATERT,
          EventType.RESPONS_VEDERLAG,
          EventType.RESPONS_VEDERLAG_OPPDATERT,
          EventType.RESPONS_FRIST,
          EventType.RESPONS_FRIST_OPPDATERT);

  /**
   * @param event candidate
   * @param state projected from the current log
   * @return user-facing reason when the candidate breaks the rule
   */
  abstract Optional<String> brudd(SakEvent event, SakState state);

  /**
   * @param eventType to look up
   * @return the only role allowed to submit the type, {@code null} when both are
   */
  static AktorRolle paakrevdRolle(EventType eventType) {
    return switch (eventType) {
      case SAK_OPPRETTET -> null;
      case GRUNNLAG_OPPRETTET,
          GRUNNLAG_OPPDATERT,
          GRUNNLAG_TRUKKET,
          VEDERLAG_KRAV_SENDT,
          VEDERLAG_KRAV_OPPDATERT,
          VEDERLAG_KRAV_TRUKKET,
          FRIST_KRAV_SENDT,
          FRIST_KRAV_OPPDATERT,
          FRIST_KRAV_SPESIFISERT,
          FRIST_KRAV_TRUKKET,
          EO_AKSEPTERT,
          EO_BESTRIDT -> AktorRolle.TE;
      case RESPONS_GRUNNLAG,
          RESPONS_GRUNNLAG_OPPDATERT,
          RESPONS_VEDERLAG,
          RESPONS_VEDERLAG_OPPDATERT,
          RESPONS_FRIST,
          RESPONS_FRIST_OPPDATERT,
          EO_OPPRETTET,
          EO_KOE_LAGT_TIL,
          EO_KOE_FJERNET,
          EO_UTSTEDT,
          EO_REVIDERT -> AktorRolle.BH;
    };
  }

  private static SporStatus statusOf(Spor spor, SakState state) {
    return switch (spor) {
      case GRUNNLAG -> state.grunnlag().status();
      case VEDERLAG -> state.vederlag().status();
      case FRIST -> state.frist().status();
      case SAK, ENDRINGSORDRE -> SporStatus.IKKE_RELEVANT;
    };
  }
}
