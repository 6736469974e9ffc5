/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.volz;

import java.util.Arrays;


/**
 * A mutable window over a byte array: the transforms read and write through
 * it and advance {@code index} as they go.
 */
public final class SliceByteArray {
    public byte[] array; // array.length is the slice capacity
    public int length;
    public int index;


    public SliceByteArray(byte[] array, int idx) {
        this(array, (array == null) ? 0 : array.length, idx);
    }


    /**
     * @param array the backing array
     * @param length the number of meaningful bytes
     * @param idx the current position
     */
    public SliceByteArray(byte[] array, int length, int idx) {
        if (array == null)
            throw new NullPointerException("The array cannot be null");
        if (length < 0)
            throw new IllegalArgumentException("The length cannot be negative");
        if (idx < 0)
            throw new IllegalArgumentException("The index cannot be negative");

        this.array = array;
        this.length = length;
        this.index = idx;
    }


    /**
     * Grows the backing array (keeping its content) so that it can hold at
     * least {@code capacity} bytes.
     *
     * @param capacity the requested capacity
     */
    public void ensureCapacity(int capacity) {
        if (this.array.length < capacity)
            this.array = Arrays.copyOf(this.array, Math.max(capacity, this.array.length + (this.array.length >> 1)));

        if (this.length < capacity)
            this.length = capacity;
    }


    /**
     * Copies the bytes located before the current index.
     *
     * @return a new array holding array[0..index)
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(this.array, this.index);
    }


    /**
     * @return true if the slice has a backing array and its index and length
     *         are not negative, with the index inside the array
     */
    public static boolean isValid(SliceByteArray sa) {
        return (sa != null) && (sa.array != null) && (sa.index >= 0) && (sa.length >= 0)
            && (sa.index <= sa.array.length);
    }
}
