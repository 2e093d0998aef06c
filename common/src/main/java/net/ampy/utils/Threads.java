// This file is part of ampy.
// Copyright (C) 2013-2026  The ampy Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.ampy.utils;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.concurrent.DefaultThreadFactory;

/**
 * Timer helpers for the background refresh tasks. Timer threads are 
 * daemons so a forgotten timer never keeps the JVM alive.
 */
public class Threads {
  private static final Logger LOG = LoggerFactory.getLogger(Threads.class);

  /** Tick used by refresh timers. Refreshes run minutes apart. */
  public static final int DEFAULT_TICK_MS = 100;
  
  /**
   * Returns a new daemon timer with the default tick.
   * @param name The name to add to the thread name.
   * @return A started timer.
   */
  public static HashedWheelTimer newTimer(final String name) {
    return newTimer(DEFAULT_TICK_MS, name);
  }

  /**
   * Returns a new daemon timer.
   * @param tick_ms The tick duration in milliseconds.
   * @param name The name to add to the thread name.
   * @return A started timer.
   */
  public static HashedWheelTimer newTimer(final int tick_ms, 
                                          final String name) {
    if (tick_ms < 1) {
      throw new IllegalArgumentException("Tick must be at least 1ms: " 
          + tick_ms);
    }
    final HashedWheelTimer timer = new HashedWheelTimer(
        new DefaultThreadFactory(name, true), tick_ms, MILLISECONDS);
    timer.start();
    return timer;
  }
  
  /**
   * Stops the timer, logging any tasks that never ran.
   * @param timer A timer, may be null.
   * @param name The name used in the log.
   * @return The number of cancelled tasks.
   */
  public static int stop(final Timer timer, final String name) {
    if (timer == null) {
      return 0;
    }
    final Set<Timeout> pending = timer.stop();
    if (!pending.isEmpty()) {
      LOG.info("Stopped timer " + name + " with " + pending.size() 
          + " pending tasks");
    }
    return pending.size();
  }
}
