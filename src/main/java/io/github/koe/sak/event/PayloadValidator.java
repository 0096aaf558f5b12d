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

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Payload constraints which depend on the event type only, never on the state of the case.
 *
 * <p>Amounts are non-negative except {@link VederlagData#belopDirekte()}, where NS 8407 §34.3
 * allows a deduction.
 */
final class PayloadValidator {
  private static final int TITTEL_MIN_LENGTH = 3;
  private static final int TITTEL_MAX_LENGTH = 100;

  private PayloadValidator() {
    // Cannot be instantiated from the outside
  }

  static void validate(SakEvent event) {
    if (event instanceof SakOpprettetEvent sakOpprettet) {
      requireText(sakOpprettet.data().sakstittel(), "data.sakstittel", "Sakstittel må oppgis");
    } else if (event instanceof GrunnlagEvent grunnlag) {
      validateGrunnlag(grunnlag);
    } else if (event instanceof VederlagEvent vederlag) {
      validateVederlag(vederlag);
    } else if (event instanceof FristEvent frist) {
      validateFrist(frist);
    } else if (event instanceof GrunnlagResponsEvent respons) {
      requireValue(respons.data().resultat(), "data.resultat", ResponsResultat.class);
    } else if (event instanceof VederlagResponsEvent respons) {
      requireTrackResult(respons.data().resultat());
      requireNotNegative(respons.data().godkjentBelop(), "data.godkjent_belop");
    } else if (event instanceof FristResponsEvent respons) {
      requireTrackResult(respons.data().resultat());
      requireNotNegative(respons.data().godkjentDager(), "data.godkjent_dager");
    } else if (event instanceof EoOpprettetEvent eoOpprettet) {
      requireText(eoOpprettet.data().eoNummer(), "data.eo_nummer", "EO-nummer må oppgis");
    } else if (event instanceof EoKoeEvent eoKoe) {
      requireText(eoKoe.data().koeSakId(), "data.koe_sak_id", "KOE-sak må oppgis");
    } else if (event instanceof EoUtstedtEvent eoUtstedt) {
      final EoUtstedtData data = eoUtstedt.data();
      requireNotNegative(data.kompensasjonBelop(), "data.kompensasjon_belop");
      requireNotNegative(data.fradragBelop(), "data.fradrag_belop");
      requireNotNegative(data.fristDager(), "data.frist_dager");
    } else if (event instanceof EoRevidertEvent eoRevidert) {
      final EoRevidertData data = eoRevidert.data();
      requireNotNegative(data.kompensasjonBelop(), "data.kompensasjon_belop");
      requireNotNegative(data.fradragBelop(), "data.fradrag_belop");
      requireNotNegative(data.fristDager(), "data.frist_dager");
    }
    // Withdrawals and EO answers carry free text only
  }

  private static void validateGrunnlag(GrunnlagEvent event) {
    final GrunnlagData data = event.data();
    final boolean opprettet = event.eventType() == EventType.GRUNNLAG_OPPRETTET;

    if (opprettet || data.tittel() != null) {
      final String tittel = data.tittel() == null ? "" : data.tittel().strip();
      if (tittel.length() < TITTEL_MIN_LENGTH || tittel.length() > TITTEL_MAX_LENGTH) {
        throw new EventValidationException(
            "Tittel må være mellom %d og %d tegn".formatted(TITTEL_MIN_LENGTH, TITTEL_MAX_LENGTH),
            "data.tittel");
      }
    }

    if (opprettet) {
      requireText(data.hovedkategori(), "data.hovedkategori", "Hovedkategori må oppgis");
      requireText(data.beskrivelse(), "data.beskrivelse", "Beskrivelse må oppgis");
      if (data.datoOppdaget() == null) {
        throw new EventValidationException(
            "Dato for når forholdet ble oppdaget må oppgis", "data.dato_oppdaget");
      }
    }
  }

  private static void validateVederlag(VederlagEvent event) {
    final VederlagData data = event.data();
    final VederlagsMetode metode =
        requireValue(data.metode(), "data.metode", VederlagsMetode.class);

    if (event.eventType() == EventType.VEDERLAG_KRAV_SENDT) {
      requireText(data.begrunnelse(), "data.begrunnelse", "Begrunnelse må oppgis");
    }

    if (metode.harDirekteBelop()) {
      if (data.belopDirekte() == null) {
        throw new EventValidationException(
            "Beløp må oppgis for metoden %s".formatted(metode), "data.belop_direkte");
      }
    } else {
      requireNotNegative(data.kostnadsOverslag(), "data.kostnads_overslag");
    }
  }

  private static void validateFrist(FristEvent event) {
    final FristData data = event.data();
    final boolean spesifisering = event.eventType() == EventType.FRIST_KRAV_SPESIFISERT;

    if (!spesifisering) {
      requireValue(data.varselType(), "data.varsel_type", FristVarselType.class);
    }

    requireNotNegative(data.antallDager(), "data.antall_dager");

    final boolean kreverDager =
        spesifisering || (data.varselType() != null && data.varselType().kreverAntallDager());
    if (kreverDager && (data.antallDager() == null || data.antallDager() == 0)) {
      throw new EventValidationException(
          "Antall dager må være større enn 0 for et spesifisert krav", "data.antall_dager");
    }
  }

  private static void requireTrackResult(ResponsResultat resultat) {
    requireValue(resultat, "data.resultat", ResponsResultat.class);

    if (resultat == ResponsResultat.FRAFALT) {
      throw new EventValidationException(
          "Resultatet %s gjelder bare grunnlag".formatted(resultat), "data.resultat");
    }
  }

  private static void requireText(String value, String field, String message) {
    if (value == null || value.isBlank()) {
      throw new EventValidationException(message, field);
    }
  }

  private static <E extends Enum<E>> E requireValue(E value, String field, Class<E> type) {
    if (value == null) {
      final String options =
          Arrays.stream(type.getEnumConstants()).map(Enum::name).collect(Collectors.joining(", "));
      throw new EventValidationException(
          "Feltet '%s' må oppgis".formatted(field),
          field,
          Map.of(EventValidationException.GYLDIGE_VERDIER, options));
    }

    return value;
  }

  private static void requireNotNegative(BigDecimal value, String field) {
    if (value != null && value.signum() < 0) {
      throw new EventValidationException("Beløpet kan ikke være negativt", field);
    }
  }

  private static void requireNotNegative(Integer value, String field) {
    if (value != null && value < 0) {
      throw new EventValidationException("Antall dager kan ikke være negativt", field);
    }
  }
}
