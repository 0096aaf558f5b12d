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

/** Revision of a disputed change order. Absent values keep the previous revision's values. */
public record EoRevidertData(
    Integer revisjonNummer,
    String beskrivelse,
    BigDecimal kompensasjonBelop,
    BigDecimal fradragBelop,
    Integer fristDager)
    implements EventData {}
