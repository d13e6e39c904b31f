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

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Binary value. The array is copied on the way in and on the way out.
 */
public final class BytesVal implements Value {
    private final byte[] value;

    public BytesVal(byte[] value) {
        Objects.requireNonNull(value, "value must not be null");
        this.value = value.clone();
    }

    public byte[] value() {
        return value.clone();
    }

    public int length() {
        return value.length;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.BYTES;
    }

    @Override
    public Object raw() {
        return value();
    }

    int compareTo(BytesVal other) {
        return Arrays.compare(value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BytesVal other)) return false;
        return Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "b64'" + Base64.getEncoder().encodeToString(value) + "'";
    }
}
