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

package com.tessera.psl;

import com.tessera.common.path.FieldPath;
import com.tessera.common.path.PathSegment;

/**
 * Scores how narrowly a projection pattern targets a field. Include/exclude conflicts on the same
 * field are decided by comparing the best scores of both sides; exclude wins a tie.
 */
public final class Specificity {
    public static final int LITERAL = 3;
    public static final int MAP_KEY = 2;
    public static final int LIST_MARKER = 1;
    public static final int MAP_WILDCARD = 1;
    public static final int WILDCARD = 1;
    public static final int RECURSIVE_WILDCARD = 0;

    private Specificity() {
    }

    public static int of(FieldPath pattern) {
        int score = 0;
        for (PathSegment segment : pattern.segments()) {
            score += of(segment);
        }
        return score;
    }

    public static int of(PathSegment segment) {
        if (segment instanceof PathSegment.Literal) {
            return LITERAL;
        }
        if (segment instanceof PathSegment.MapKey) {
            return MAP_KEY;
        }
        if (segment instanceof PathSegment.ListMarker) {
            return LIST_MARKER;
        }
        if (segment instanceof PathSegment.MapWildcard) {
            return MAP_WILDCARD;
        }
        if (segment instanceof PathSegment.Wildcard) {
            return WILDCARD;
        }
        return RECURSIVE_WILDCARD;
    }

    /**
     * True if an exclude pattern with score {@code exclude} removes a field an include pattern with
     * score {@code include} selected.
     */
    public static boolean excludeWins(int include, int exclude) {
        return exclude >= include;
    }
}
