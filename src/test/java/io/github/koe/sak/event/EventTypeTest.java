package io.github.koe.sak.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class EventTypeTest {
  @Test
  void when_all_types_are_listed_there_are_twenty_four_distinct_discriminants() {
    assertEquals(24, EventType.values().length);
    assertEquals(
        24,
        Arrays.stream(EventType.values())
            .map(EventType::value)
            .collect(Collectors.toSet())
            .size());
  }

  @Test
  void when_known_discriminant_is_looked_up_it_is_found() {
    assertEquals(
        Optional.of(EventType.FRIST_KRAV_SPESIFISERT), EventType.find("frist_krav_spesifisert"));
    assertEquals(EventType.EO_KOE_LAGT_TIL, EventType.fromValue("eo_koe_lagt_til"));
  }

  @Test
  void when_unknown_discriminant_is_looked_up_it_is_not_found() {
    assertTrue(EventType.find("vederlag_krav_godkjent").isEmpty());
    assertTrue(EventType.find(null).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> EventType.fromValue("FRIST_KRAV_SENDT"));
  }

  @Test
  void when_type_is_printed_it_uses_the_wire_discriminant() {
    assertEquals("respons_vederlag_oppdatert", EventType.RESPONS_VEDERLAG_OPPDATERT.toString());
  }

  @Test
  void when_lane_is_requested_it_matches_the_prefix_of_the_discriminant() {
    assertEquals(Spor.SAK, EventType.SAK_OPPRETTET.spor());
    assertEquals(Spor.GRUNNLAG, EventType.RESPONS_GRUNNLAG_OPPDATERT.spor());
    assertEquals(Spor.VEDERLAG, EventType.VEDERLAG_KRAV_TRUKKET.spor());
    assertEquals(Spor.FRIST, EventType.RESPONS_FRIST.spor());
    assertTrue(EventType.EO_REVIDERT.erEndringsordre());
    assertFalse(EventType.GRUNNLAG_TRUKKET.erEndringsordre());
  }

  @Test
  void when_variant_does_not_carry_the_type_it_is_rejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SakEvent.requireVariant(EventType.VEDERLAG_KRAV_SENDT, FristEvent.class));
    assertThrows(
        IllegalArgumentException.class, () -> SakEvent.requireVariant(null, FristEvent.class));
    assertEquals(
        EventType.FRIST_KRAV_TRUKKET,
        SakEvent.requireVariant(EventType.FRIST_KRAV_TRUKKET, TrukketEvent.class));
  }
}
