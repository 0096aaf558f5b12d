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

package io.github.koe.sak.async;

import io.github.koe.sak.event.SakEvent;
import io.github.koe.sak.state.SakState;

/**
 * Tells outside systems that a case changed.
 *
 * @param sakId of the case
 * @param forrigeTilstand state before the append
 * @param nyTilstand state after the append
 * @param utlosendeEvent the appended event, the last one of a batch
 */
public record SakNotification(
    String sakId, SakState forrigeTilstand, SakState nyTilstand, SakEvent utlosendeEvent) {}
