// Protocol Buffers - Google's data interchange format
// Copyright 2008 Google Inc.  All rights reserved.
// https://developers.google.com/protocol-buffers/
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are
// met:
//
//     * Redistributions of source code must retain the above copyright
// notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above
// copyright notice, this list of conditions and the following disclaimer
// in the documentation and/or other materials provided with the
// distribution.
//     * Neither the name of Google Inc. nor the names of its
// contributors may be used to endorse or promote products derived from
// this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
// "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
// LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
// A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
// OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
// SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
// LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
// DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
// THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
// OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.


package com.hellblazer.stepwise.common;

import java.util.Arrays;

/**
 * Growable primitive float buffer for vertex position and normal streams
 */
public final class FloatArrayList {

    private static final int DEFAULT_CAPACITY = 48;

    private float[] array;
    private int     size;

    public FloatArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public FloatArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Negative capacity: " + initialCapacity);
        }
        array = new float[initialCapacity];
    }

    public static FloatArrayList of(float... values) {
        var list = new FloatArrayList(values.length);
        System.arraycopy(values, 0, list.array, 0, values.length);
        list.size = values.length;
        return list;
    }

    public void addFloat(float element) {
        if (size == array.length) {
            grow(size + 1);
        }
        array[size++] = element;
    }

    /** Append one xyz triple. */
    public void add3(float x, float y, float z) {
        ensureCapacity(size + 3);
        array[size++] = x;
        array[size++] = y;
        array[size++] = z;
    }

    public boolean addAll(FloatArrayList list) {
        if (list.size == 0) {
            return false;
        }
        ensureCapacity(size + list.size);
        System.arraycopy(list.array, 0, array, size, list.size);
        size += list.size;
        return true;
    }

    public void clear() {
        size = 0;
    }

    public void ensureCapacity(int minCapacity) {
        if (minCapacity > array.length) {
            grow(minCapacity);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final FloatArrayList other)) {
            return false;
        }
        return Arrays.equals(array, 0, size, other.array, 0, other.size);
    }

    public float getFloat(int index) {
        ensureIndexInRange(index);
        return array[index];
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + Float.floatToIntBits(array[i]);
        }
        return result;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Multiply every element by {@code factor}. */
    public void scale(float factor) {
        for (int i = 0; i < size; i++) {
            array[i] *= factor;
        }
    }

    public float setFloat(int index, float element) {
        ensureIndexInRange(index);
        float previousValue = array[index];
        array[index] = element;
        return previousValue;
    }

    public int size() {
        return size;
    }

    public float[] toArray() {
        return Arrays.copyOf(array, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index:" + index + ", Size:" + size);
        }
    }

    private void grow(int minCapacity) {
        if (minCapacity < 0) {
            throw new OutOfMemoryError();
        }
        int length = Math.max(minCapacity, ((array.length * 3) / 2) + 1);
        array = Arrays.copyOf(array, length);
    }
}
