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

/**
 * Receives a {@link SakNotification} after every committed append.
 *
 * <p>Delivery happens after the events are stored, so a failing sink cannot undo them.
 */
public interface SakNotificationSink {
  /**
   * @return an instance of sink which does not perform any operations
   */
  static SakNotificationSink empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param notification to deliver
   */
  void deliver(final SakNotification notification);

  /** Default implementation of the fake sink */
  final class NoOp implements SakNotificationSink {
    private static final SakNotificationSink INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void deliver(final SakNotification notification) {
      // Do nothing
    }
  }
}
