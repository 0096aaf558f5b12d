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

/**
 * Compensation claim.
 *
 * @param metode of settlement
 * @param belopDirekte claimed sum for {@link VederlagsMetode#ENHETSPRISER} and {@link
 *     VederlagsMetode#FASTPRIS_TILBUD}; negative for a deduction
 * @param kostnadsOverslag cost estimate for {@link VederlagsMetode#REGNINGSARBEID}
 * @param begrunnelse justification
 */
public record VederlagData(
    VederlagsMetode metode,
    BigDecimal belopDirekte,
    BigDecimal kostnadsOverslag,
    String begrunnelse)
    implements EventData {

  /**
   * @return the amount which counts as claimed for the chosen method, may be {@code null}
   */
  public BigDecimal krevdBelop() {
    if (metode == VederlagsMetode.REGNINGSARBEID) {
      return kostnadsOverslag;
    }

    return belopDirekte;
  }
}
