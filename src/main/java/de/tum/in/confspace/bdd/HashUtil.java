/*
 * This file is part of ConfSpace.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * ConfSpace is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * ConfSpace is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ConfSpace. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.confspace.bdd;

final class HashUtil {
    // Called on every node lookup, so these stay as cheap as possible

    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int key) {
        return key;
    }

    static int hash(int firstKey, int secondKey) {
        return PRIME * firstKey + secondKey;
    }

    static int hash(int firstKey, int secondKey, int thirdKey) {
        return firstKey + secondKey + thirdKey;
    }

    static int hash(byte operation, int firstKey, int secondKey) {
        return (PRIME * operation) + firstKey + secondKey;
    }
}
