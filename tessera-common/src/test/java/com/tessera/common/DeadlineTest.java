/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.common;

import com.google.common.base.Ticker;
import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.PlanningTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    private static class ManualTicker extends Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(long duration, TimeUnit unit) {
            nanos.addAndGet(unit.toNanos(duration));
        }
    }

    @Test
    void shouldExpireAfterBudget() {
        ManualTicker ticker = new ManualTicker();
        Deadline deadline = Deadline.after(Duration.ofMillis(100), ticker);
        assertFalse(deadline.isExpired());
        assertEquals(100, deadline.remainingMillis());

        ticker.advance(60, TimeUnit.MILLISECONDS);
        assertEquals(40, deadline.remainingMillis());
        assertDoesNotThrow(() -> deadline.check("logical planning"));

        ticker.advance(40, TimeUnit.MILLISECONDS);
        assertTrue(deadline.isExpired());
        assertEquals(0, deadline.remainingMillis());
    }

    @Test
    void shouldReportStageOnTimeout() {
        ManualTicker ticker = new ManualTicker();
        Deadline deadline = Deadline.after(Duration.ofMillis(5), ticker);
        ticker.advance(1, TimeUnit.SECONDS);

        PlanningTimeoutException e = assertThrows(PlanningTimeoutException.class,
                () -> deadline.check("physical optimization"));
        assertEquals("physical optimization", e.getStage());
        assertEquals(ErrorCode.PLANNING_TIMEOUT, e.toQueryError().code());
        assertTrue(e.getMessage().contains("5 ms"));
    }

    @Test
    void shouldNeverExpireWithoutBudget() {
        Deadline deadline = Deadline.none();
        assertFalse(deadline.isExpired());
        assertEquals(Long.MAX_VALUE, deadline.remainingMillis());
    }

    @Test
    void shouldClampHugeBudgets() {
        ManualTicker ticker = new ManualTicker();
        ticker.advance(Long.MAX_VALUE / 4, TimeUnit.NANOSECONDS);

        Deadline millis = Deadline.after(Duration.ofMillis(Long.MAX_VALUE), ticker);
        Deadline seconds = Deadline.after(Duration.ofSeconds(Long.MAX_VALUE), ticker);
        assertFalse(millis.isExpired());
        assertFalse(seconds.isExpired());
        assertTrue(millis.remainingMillis() > TimeUnit.DAYS.toMillis(365L * 100));

        ticker.advance(3650, TimeUnit.DAYS);
        assertDoesNotThrow(() -> millis.check("canonicalization"));
    }

    @Test
    void shouldRejectNegativeBudget() {
        assertThrows(IllegalArgumentException.class, () -> Deadline.after(Duration.ofMillis(-1)));
    }
}
