/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.saxbitmap.sax;

import static com.amazon.saxbitmap.CommonUtils.checkArgument;

/**
 * The ordered set of symbols used by SAX words. Symbol {@code i} is the
 * {@code i}-th lowercase letter, so the natural ordering of strings over the
 * alphabet agrees with the ordering of the symbol indices.
 */
public class Alphabet {

    public static final int MIN_SIZE = 2;
    public static final int MAX_SIZE = 26;

    private static final char FIRST_SYMBOL = 'a';

    private final int size;

    public Alphabet(int size) {
        checkArgument(size >= MIN_SIZE && size <= MAX_SIZE,
                "alphabet size must be between " + MIN_SIZE + " and " + MAX_SIZE);
        this.size = size;
    }

    public int size() {
        return size;
    }

    public char symbol(int index) {
        checkArgument(index >= 0 && index < size, "incorrect symbol index " + index);
        return (char) (FIRST_SYMBOL + index);
    }

    /**
     * @param symbol a character
     * @return the position of the symbol in the alphabet, -1 if it is not part of
     *         it
     */
    public int indexOf(char symbol) {
        int index = symbol - FIRST_SYMBOL;
        return (index >= 0 && index < size) ? index : -1;
    }

    public char[] symbols() {
        char[] symbols = new char[size];
        for (int i = 0; i < size; i++) {
            symbols[i] = (char) (FIRST_SYMBOL + i);
        }
        return symbols;
    }

    @Override
    public boolean equals(Object other) {
        return (other instanceof Alphabet) && ((Alphabet) other).size == size;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(size);
    }

    @Override
    public String toString() {
        return new String(symbols());
    }
}
