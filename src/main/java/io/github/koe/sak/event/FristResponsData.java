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

import java.time.LocalDate;

/**
 * @param resultat of the assessment
 * @param godkjentDager days granted
 * @param nySluttdato agreed completion date
 * @param vilkarOppfylt whether the notice requirements of NS 8407 §33.4 were met
 * @param begrunnelse justification
 */
public record FristResponsData(
    ResponsResultat resultat,
    Integer godkjentDager,
    LocalDate nySluttdato,
    Boolean vilkarOppfylt,
    String begrunnelse)
    implements EventData {}
