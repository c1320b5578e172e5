/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.opendata.harvest.rate;

import org.opendata.harvest.config.HarvestConfig;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reacts to server throttling (HTTP 429) by shrinking the worker pool and
 * escalating the wait before the next attempt.
 *
 * <p>Each throttle signal increments a consecutive-throttle counter and
 * returns a wait of {@code min(2^min(count, exponentCap), maxWait)} seconds.
 * The worker count is halved at most once per cooldown window and never drops
 * below the floor. Each successful response decrements the counter toward
 * zero.
 *
 * <p>All mutations happen under one lock. {@link #workerCount()} is a
 * lock-free snapshot read by the download engine between dispatch rounds.
 */
public class RateController {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateController.class);

  /** Largest exponent the throttle wait may reach; keeps {@code 2^n} seconds in range. */
  public static final int MAX_WAIT_EXPONENT = 30;

  private final int initialWorkers;
  private final int minWorkers;
  private final Duration cooldown;
  private final int waitExponentCap;
  private final Duration maxWait;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile int workers;
  private int throttleCount;
  private @Nullable Instant lastScaleDown;

  public RateController(int initialWorkers, int minWorkers, Duration cooldown,
      int waitExponentCap, Duration maxWait, Clock clock) {
    if (minWorkers <= 0 || initialWorkers < minWorkers) {
      throw new IllegalArgumentException("Require 0 < minWorkers <= initialWorkers, got "
          + minWorkers + " and " + initialWorkers);
    }
    if (waitExponentCap < 0 || waitExponentCap > MAX_WAIT_EXPONENT) {
      throw new IllegalArgumentException("Wait exponent cap must be in 0.." + MAX_WAIT_EXPONENT
          + ", got " + waitExponentCap);
    }
    this.initialWorkers = initialWorkers;
    this.minWorkers = minWorkers;
    this.cooldown = cooldown;
    this.waitExponentCap = waitExponentCap;
    this.maxWait = maxWait;
    this.clock = clock;
    this.workers = initialWorkers;
  }

  public static RateController fromConfig(HarvestConfig.RateLimitConfig config, Clock clock) {
    return new RateController(config.getInitialWorkers(), config.getMinWorkers(),
        config.getCooldown(), config.getWaitExponentCap(), config.getMaxWait(), clock);
  }

  /**
   * Records a throttle signal.
   *
   * @return How long the caller should wait before re-issuing the request
   */
  public Duration onThrottle() {
    lock.lock();
    try {
      throttleCount++;
      Instant now = clock.instant();
      if (lastScaleDown == null
          || Duration.between(lastScaleDown, now).compareTo(cooldown) >= 0) {
        int before = workers;
        workers = Math.max(minWorkers, before / 2);
        lastScaleDown = now;
        if (workers != before) {
          LOGGER.warn("Rate limited, workers {} -> {}", before, workers);
        }
      }
      long seconds = 1L << Math.min(throttleCount, waitExponentCap);
      Duration wait = Duration.ofSeconds(seconds);
      if (wait.compareTo(maxWait) > 0) {
        wait = maxWait;
      }
      LOGGER.debug("Throttle #{}, waiting {}s", throttleCount, wait.getSeconds());
      return wait;
    } finally {
      lock.unlock();
    }
  }

  /** Records a successful response. */
  public void onSuccess() {
    lock.lock();
    try {
      if (throttleCount > 0) {
        throttleCount--;
      }
    } finally {
      lock.unlock();
    }
  }

  /** Returns the worker count to use for the next dispatch round. */
  public int workerCount() {
    return workers;
  }

  public int initialWorkers() {
    return initialWorkers;
  }

  public int minWorkers() {
    return minWorkers;
  }

  public int throttleCount() {
    lock.lock();
    try {
      return throttleCount;
    } finally {
      lock.unlock();
    }
  }
}
