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
 * Growable primitive int buffer, used for triangle index streams
 */
public final class IntArrayList {

    private static final int DEFAULT_CAPACITY = 16;

    /** The backing store for the list. */
    private int[] array;
    private int   size;

    public IntArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public IntArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Negative capacity: " + initialCapacity);
        }
        array = new int[initialCapacity];
    }

    /** Wrap a copy of the given values. */
    public static IntArrayList of(int... values) {
        var list = new IntArrayList(values.length);
        System.arraycopy(values, 0, list.array, 0, values.length);
        list.size = values.length;
        return list;
    }

    public void addInt(int element) {
        if (size == array.length) {
            grow(size + 1);
        }
        array[size++] = element;
    }

    /** Append three indices, one triangle. */
    public void addTriangle(int a, int b, int c) {
        ensureCapacity(size + 3);
        array[size++] = a;
        array[size++] = b;
        array[size++] = c;
    }

    /** Append every element of {@code other}, each shifted by {@code offset}. */
    public void addAllShifted(IntArrayList other, int offset) {
        ensureCapacity(size + other.size);
        for (int i = 0; i < other.size; i++) {
            array[size++] = other.array[i] + offset;
        }
    }

    public boolean addAll(IntArrayList list) {
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
        if (!(o instanceof final IntArrayList other)) {
            return false;
        }
        return Arrays.equals(array, 0, size, other.array, 0, other.size);
    }

    public int getInt(int index) {
        ensureIndexInRange(index);
        return array[index];
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + array[i];
        }
        return result;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Reverse the order of the elements in place. */
    public void reverse() {
        for (int i = 0, j = size - 1; i < j; i++, j--) {
            int t = array[i];
            array[i] = array[j];
            array[j] = t;
        }
    }

    public int setInt(int index, int element) {
        ensureIndexInRange(index);
        int previousValue = array[index];
        array[index] = element;
        return previousValue;
    }

    public int size() {
        return size;
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException(makeOutOfBoundsExceptionMessage(index));
        }
    }

    private void grow(int minCapacity) {
        if (minCapacity < 0) {
            // We can't actually represent a list this large.
            throw new OutOfMemoryError();
        }
        // Resize to 1.5x the size
        int length = Math.max(minCapacity, ((array.length * 3) / 2) + 1);
        array = Arrays.copyOf(array, length);
    }

    private String makeOutOfBoundsExceptionMessage(int index) {
        return "Index:" + index + ", Size:" + size;
    }
}
