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
import com.tessera.common.error.PlanningTimeoutException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A compilation deadline shared by every stage of one query's compilation. Stages call
 * {@link #check(String)} before blocking lookups against external views and between stages.
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(Ticker.systemTicker(), Long.MAX_VALUE, 0);
    // Expiry is compared by difference, so a budget must stay below half the nanosecond range.
    private static final long MAX_BUDGET_NANOS = Long.MAX_VALUE / 2;

    private final Ticker ticker;
    private final long expiresAtNanos;
    private final long budgetMillis;

    private Deadline(Ticker ticker, long expiresAtNanos, long budgetMillis) {
        this.ticker = ticker;
        this.expiresAtNanos = expiresAtNanos;
        this.budgetMillis = budgetMillis;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration budget) {
        return after(budget, Ticker.systemTicker());
    }

    /**
     * Budgets above roughly 146 years are clamped to that length.
     */
    public static Deadline after(Duration budget, Ticker ticker) {
        if (budget.isNegative()) {
            throw new IllegalArgumentException("budget must not be negative");
        }
        long nanos = budget.compareTo(Duration.ofNanos(MAX_BUDGET_NANOS)) >= 0 ? MAX_BUDGET_NANOS : budget.toNanos();
        return new Deadline(ticker, ticker.read() + nanos, TimeUnit.NANOSECONDS.toMillis(nanos));
    }

    public boolean isExpired() {
        return this != NONE && ticker.read() - expiresAtNanos >= 0;
    }

    public long remainingMillis() {
        if (this == NONE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(expiresAtNanos - ticker.read()));
    }

    /**
     * @param stage name of the work about to start, reported in the timeout error
     * @throws PlanningTimeoutException if the deadline has passed
     */
    public void check(String stage) {
        if (isExpired()) {
            throw new PlanningTimeoutException(stage, budgetMillis);
        }
    }
}
