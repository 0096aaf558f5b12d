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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of event discriminants.
 *
 * <p>Every constant names the lane it affects and the {@link SakEvent} variant carrying its
 * payload, so dispatching on a discriminant never needs a string comparison outside of this enum.
 */
public enum EventType {
  SAK_OPPRETTET("sak_opprettet", Spor.SAK, SakOpprettetEvent.class),

  GRUNNLAG_OPPRETTET("grunnlag_opprettet", Spor.GRUNNLAG, GrunnlagEvent.class),
  GRUNNLAG_OPPDATERT("grunnlag_oppdatert", Spor.GRUNNLAG, GrunnlagEvent.class),
  GRUNNLAG_TRUKKET("grunnlag_trukket", Spor.GRUNNLAG, TrukketEvent.class),

  VEDERLAG_KRAV_SENDT("vederlag_krav_sendt", Spor.VEDERLAG, VederlagEvent.class),
  VEDERLAG_KRAV_OPPDATERT("vederlag_krav_oppdatert", Spor.VEDERLAG, VederlagEvent.class),
  VEDERLAG_KRAV_TRUKKET("vederlag_krav_trukket", Spor.VEDERLAG, TrukketEvent.class),

  FRIST_KRAV_SENDT("frist_krav_sendt", Spor.FRIST, FristEvent.class),
  FRIST_KRAV_OPPDATERT("frist_krav_oppdatert", Spor.FRIST, FristEvent.class),
  FRIST_KRAV_SPESIFISERT("frist_krav_spesifisert", Spor.FRIST, FristEvent.class),
  FRIST_KRAV_TRUKKET("frist_krav_trukket", Spor.FRIST, TrukketEvent.class),

  RESPONS_GRUNNLAG("respons_grunnlag", Spor.GRUNNLAG, GrunnlagResponsEvent.class),
  RESPONS_GRUNNLAG_OPPDATERT(
      "respons_grunnlag_oppdatert", Spor.GRUNNLAG, GrunnlagResponsEvent.class),
  RESPONS_VEDERLAG("respons_vederlag", Spor.VEDERLAG, VederlagResponsEvent.class),
  RESPONS_VEDERLAG_OPPDATERT(
      "respons_vederlag_oppdatert", Spor.VEDERLAG, VederlagResponsEvent.class),
  RESPONS_FRIST("respons_frist", Spor.FRIST, FristResponsEvent.class),
  RESPONS_FRIST_OPPDATERT("respons_frist_oppdatert", Spor.FRIST, FristResponsEvent.class),

  EO_OPPRETTET("eo_opprettet", Spor.ENDRINGSORDRE, EoOpprettetEvent.class),
  EO_KOE_LAGT_TIL("eo_koe_lagt_til", Spor.ENDRINGSORDRE, EoKoeEvent.class),
  EO_KOE_FJERNET("eo_koe_fjernet", Spor.ENDRINGSORDRE, EoKoeEvent.class),
  EO_UTSTEDT("eo_utstedt", Spor.ENDRINGSORDRE, EoUtstedtEvent.class),
  EO_AKSEPTERT("eo_akseptert", Spor.ENDRINGSORDRE, EoSvarEvent.class),
  EO_BESTRIDT("eo_bestridt", Spor.ENDRINGSORDRE, EoSvarEvent.class),
  EO_REVIDERT("eo_revidert", Spor.ENDRINGSORDRE, EoRevidertEvent.class);

  private static final Map<String, EventType> BY_VALUE =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(type -> type.value, Function.identity()));

  private final String value;
  private final Spor spor;
  private final Class<? extends SakEvent> eventClass;

  EventType(String value, Spor spor, Class<? extends SakEvent> eventClass) {
    this.value = value;
    this.spor = spor;
    this.eventClass = eventClass;
  }

  /**
   * @param value is a wire discriminant, e.g. {@code grunnlag_opprettet}
   * @return matching type or {@link Optional#empty()} for unknown discriminants
   */
  public static Optional<EventType> find(String value) {
    if (value == null) {
      return Optional.empty();
    }

    return Optional.ofNullable(BY_VALUE.get(value));
  }

  @JsonCreator
  public static EventType fromValue(String value) {
    return find(value)
        .orElseThrow(() -> new IllegalArgumentException("Ukjent event_type: " + value));
  }

  @JsonValue
  public String value() {
    return value;
  }

  public Spor spor() {
    return spor;
  }

  public Class<? extends SakEvent> eventClass() {
    return eventClass;
  }

  public boolean erEndringsordre() {
    return spor == Spor.ENDRINGSORDRE;
  }

  @Override
  public String toString() {
    return value;
  }
}
