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

package io.github.koe.sak.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Exclusive in-process lock per case. An entry lives only while some thread holds or waits for it.
 */
final class SakLocks {
  private final Map<String, Entry> locks = new ConcurrentHashMap<>();

  <T> T withLock(String sakId, Supplier<T> action) {
    final Entry entry = locks.compute(sakId, (ignored, current) -> Entry.join(current));

    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      locks.computeIfPresent(sakId, (ignored, current) -> current.leave());
    }
  }

  int size() {
    return locks.size();
  }

  /** Guarded by the map: {@code users} only changes inside {@code compute} for its key. */
  private static final class Entry {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;

    private static Entry join(Entry current) {
      final Entry entry = current == null ? new Entry() : current;
      entry.users++;
      return entry;
    }

    private Entry leave() {
      users--;
      return users == 0 ? null : this;
    }
  }
}
