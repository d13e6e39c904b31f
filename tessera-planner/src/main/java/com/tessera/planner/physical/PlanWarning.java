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

package com.tessera.planner.physical;

import javax.annotation.Nullable;

/**
 * Advisory note attached to a plan. Warnings never fail a compilation.
 *
 * @param code    stable machine readable code, e.g. {@code STATISTICS_UNAVAILABLE}
 * @param subject entity or field the warning is about, may be null
 * @param message human readable description
 */
public record PlanWarning(String code, @Nullable String subject, String message) {
    public static final String STATISTICS_UNAVAILABLE = "STATISTICS_UNAVAILABLE";
    public static final String OPTIMIZER_PASS_LIMIT = "OPTIMIZER_PASS_LIMIT";

    @Override
    public String toString() {
        return code + (subject == null ? "" : " [" + subject + "]") + ": " + message;
    }
}
