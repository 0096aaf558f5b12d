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

import io.github.koe.sak.event.AktorRolle;
import io.github.koe.sak.event.EoKoeEvent;
import io.github.koe.sak.event.EoOpprettetEvent;
import io.github.koe.sak.event.EoRevidertEvent;
import io.github.koe.sak.event.EoUtstedtEvent;
import io.github.koe.sak.event.EventType;
import io.github.koe.sak.event.FristData;
import io.github.koe.sak.event.FristEvent;
import io.github.koe.sak.event.FristResponsEvent;
import io.github.koe.sak.event.GrunnlagEvent;
import io.github.koe.sak.event.GrunnlagResponsEvent;
import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.event.SakOpprettetEvent;
import io.github.koe.sak.event.Spor;
import io.github.koe.sak.event.VederlagData;
import io.github.koe.sak.event.VederlagEvent;
import io.github.koe.sak.event.VederlagResponsEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One line of a case history.
 *
 * @param eventId of the event
 * @param eventType of the event
 * @param tidsstempel of the event
 * @param aktor who submitted the event
 * @param aktorRolle of the submitter
 * @param spor the event belongs to
 * @param sammendrag human-readable summary
 */
public record TidslinjeInnslag(
    UUID eventId,
    EventType eventType,
    Instant tidsstempel,
    String aktor,
    AktorRolle aktorRolle,
    Spor spor,
    String sammendrag) {

  public static TidslinjeInnslag of(SakEvent event) {
    return new TidslinjeInnslag(
        event.eventId(),
        event.eventType(),
        event.tidsstempel(),
        event.aktor(),
        event.aktorRolle(),
        event.eventType().spor(),
        sammendragAv(event));
  }

  static String sammendragAv(SakEvent event) {
    return switch (event.eventType()) {
      case SAK_OPPRETTET -> "Sak opprettet: " + ((SakOpprettetEvent) event).data().sakstittel();
      case GRUNNLAG_OPPRETTET -> "Grunnlag sendt: " + ((GrunnlagEvent) event).data().tittel();
      case GRUNNLAG_OPPDATERT -> "Grunnlag oppdatert";
      case GRUNNLAG_TRUKKET -> "Grunnlag trukket";
      case VEDERLAG_KRAV_SENDT -> "Vederlagskrav sendt: " + krav(((VederlagEvent) event).data());
      case VEDERLAG_KRAV_OPPDATERT ->
          "Vederlagskrav oppdatert: " + krav(((VederlagEvent) event).data());
      case VEDERLAG_KRAV_TRUKKET -> "Vederlagskrav trukket";
      case FRIST_KRAV_SENDT -> "Fristkrav sendt: " + krav(((FristEvent) event).data());
      case FRIST_KRAV_OPPDATERT -> "Fristkrav oppdatert: " + krav(((FristEvent) event).data());
      case FRIST_KRAV_SPESIFISERT ->
          "Fristkrav spesifisert: " + krav(((FristEvent) event).data());
      case FRIST_KRAV_TRUKKET -> "Fristkrav trukket";
      case RESPONS_GRUNNLAG, RESPONS_GRUNNLAG_OPPDATERT ->
          "Svar på grunnlag: " + ((GrunnlagResponsEvent) event).data().resultat();
      case RESPONS_VEDERLAG, RESPONS_VEDERLAG_OPPDATERT ->
          svar("vederlag", (VederlagResponsEvent) event);
      case RESPONS_FRIST, RESPONS_FRIST_OPPDATERT -> svar("frist", (FristResponsEvent) event);
      case EO_OPPRETTET ->
          "Endringsordre %s opprettet".formatted(((EoOpprettetEvent) event).data().eoNummer());
      case EO_KOE_LAGT_TIL ->
          "KOE-sak %s lagt til".formatted(((EoKoeEvent) event).data().koeSakId());
      case EO_KOE_FJERNET ->
          "KOE-sak %s fjernet".formatted(((EoKoeEvent) event).data().koeSakId());
      case EO_UTSTEDT -> utstedt((EoUtstedtEvent) event);
      case EO_AKSEPTERT -> "Endringsordre akseptert";
      case EO_BESTRIDT -> "Endringsordre bestridt";
      case EO_REVIDERT ->
          "Endringsordre revidert (revisjon %s)"
              .formatted(((EoRevidertEvent) event).data().revisjonNummer());
    };
  }

  private static String krav(VederlagData data) {
    final BigDecimal belop = data.krevdBelop();
    return belop == null
        ? String.valueOf(data.metode())
        : "%s kr (%s)".formatted(belop.toPlainString(), data.metode());
  }

  private static String krav(FristData data) {
    return data.antallDager() == null
        ? "varsel uten antall dager"
        : "%d dager".formatted(data.antallDager());
  }

  private static String svar(String spor, VederlagResponsEvent event) {
    final BigDecimal godkjent = event.data().godkjentBelop();
    return godkjent == null
        ? "Svar på %s: %s".formatted(spor, event.data().resultat())
        : "Svar på %s: %s, %s kr"
            .formatted(spor, event.data().resultat(), godkjent.toPlainString());
  }

  private static String svar(String spor, FristResponsEvent event) {
    final Integer godkjent = event.data().godkjentDager();
    return godkjent == null
        ? "Svar på %s: %s".formatted(spor, event.data().resultat())
        : "Svar på %s: %s, %d dager".formatted(spor, event.data().resultat(), godkjent);
  }

  private static String utstedt(EoUtstedtEvent event) {
    final String eoNummer = event.data().eoNummer();
    return eoNummer == null
        ? "Endringsordre utstedt"
        : "Endringsordre %s utstedt".formatted(eoNummer);
  }
}
