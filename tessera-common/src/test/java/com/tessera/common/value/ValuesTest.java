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

package com.tessera.common.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Nested
    @DisplayName("Mapping loose objects into values")
    class FromObjects {

        @Test
        @DisplayName("Integral numbers become INT64, fractional numbers FLOAT64")
        void testNumbers() {
            assertEquals(new Int64Val(7), Values.of((Object) 7));
            assertEquals(new Int64Val(7), Values.of((Object) 7L));
            assertEquals(new Int64Val(7), Values.of(new BigDecimal("7.000")));
            assertEquals(new Float64Val(7.5), Values.of(new BigDecimal("7.5")));
            assertEquals(new Float64Val(2.5), Values.of((Object) 2.5f));
        }

        @Test
        @DisplayName("Collections become arrays of mapped elements")
        void testCollections() {
            Value value = Values.of(List.of(1, "a", true));

            ArrayVal array = assertInstanceOf(ArrayVal.class, value);
            assertEquals(List.of(new Int64Val(1), new StringVal("a"), BoolVal.TRUE), array.elements());
        }

        @Test
        @DisplayName("Temporal JDK types keep their kind")
        void testTemporal() {
            assertEquals(ValueKind.TIMESTAMP, Values.of(Instant.EPOCH).kind());
            assertEquals(ValueKind.DATE, Values.of(LocalDate.of(2024, 1, 31)).kind());
            assertEquals(ValueKind.DURATION, Values.of(Duration.ofSeconds(3)).kind());
        }

        @Test
        @DisplayName("Values pass through unchanged, null and unknown types are rejected")
        void testPassThroughAndRejects() {
            Value value = new StringVal("x");
            assertSame(value, Values.of((Object) value));
            assertThrows(IllegalArgumentException.class, () -> Values.of((Object) null));
            assertThrows(IllegalArgumentException.class, () -> Values.of(new Object()));
        }
    }

    @Nested
    @DisplayName("Comparing values")
    class Comparison {

        @Test
        @DisplayName("Numeric equality widens integers to floats")
        void testNumericEquality() {
            assertTrue(Values.equal(Values.of(5), Values.of(5.0)));
            assertFalse(Values.equal(Values.of(5), Values.of(5.5)));
            assertNotEquals(Values.of(5), Values.of(5.0));
        }

        @Test
        @DisplayName("Ordering is defined within a kind and across numeric kinds")
        void testOrdering() {
            assertTrue(Values.compare(Values.of(3), Values.of(4.5)) < 0);
            assertTrue(Values.compare(Values.of("b"), Values.of("a")) > 0);
            assertEquals(0, Values.compare(new DateVal(LocalDate.of(2024, 5, 1)), new DateVal(LocalDate.of(2024, 5, 1))));
            assertTrue(Values.compare(new BytesVal(new byte[]{1}), new BytesVal(new byte[]{1, 0})) < 0);
        }

        @Test
        @DisplayName("Booleans, arrays and mixed kinds are not comparable")
        void testIncomparable() {
            assertFalse(Values.isComparable(BoolVal.TRUE, BoolVal.FALSE));
            assertFalse(Values.isComparable(Values.of("1"), Values.of(1)));
            assertFalse(Values.isComparable(ArrayVal.of(Values.of(1)), ArrayVal.of(Values.of(2))));
            assertThrows(IllegalArgumentException.class, () -> Values.compare(Values.of("1"), Values.of(1)));
        }
    }

    @Test
    @DisplayName("Bytes are defensively copied")
    void testBytesCopy() {
        byte[] raw = {1, 2, 3};
        BytesVal value = new BytesVal(raw);
        raw[0] = 9;

        assertEquals(1, value.value()[0]);
        value.value()[1] = 9;
        assertEquals(2, value.value()[1]);
    }
}
