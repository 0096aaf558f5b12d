package io.github.koe.sak.jooq;

import static io.github.koe.sak.test.Hendelser.SAK_ID;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;

class DslContextProviderTest {
  @Test
  void when_identity_provider_is_requested_with_null_argument_it_throws_an_exception() {
    assertThrows(IllegalArgumentException.class, () -> DslContextProvider.dslContextIdentity(null));
  }

  @Test
  void when_identity_provider_is_requested_with_correct_argument_it_returns_that_argument() {
    final var dslContext = DSL.using(SQLDialect.POSTGRES);

    final var dslContextProvider =
        assertDoesNotThrow(() -> DslContextProvider.dslContextIdentity(dslContext));

    final var providedDslContext = assertDoesNotThrow(() -> dslContextProvider.apply(SAK_ID));

    assertNotNull(providedDslContext);
    assertEquals(dslContext, providedDslContext);
    assertEquals(dslContext, dslContextProvider.apply("KOE-ANNEN"));
    assertEquals(List.of(dslContext), List.copyOf(dslContextProvider.all()));
  }
}
