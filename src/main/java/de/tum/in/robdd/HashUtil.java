/*
 * This file is part of ROBDD.
 * Copyright (c) 2026 Tobias Meggendorfer.
 *
 * ROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * ROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

final class HashUtil {
    // FNV-1a over whole ints. Permutations of a (variable, low, high) triple hash differently.
    static final int PRIME = 0x1000193;
    static final int OFFSET_BASIS = 0x811C9DC5;

    private HashUtil() {}

    static int hash(int firstKey, int secondKey, int thirdKey) {
        int hash = OFFSET_BASIS;
        hash = (hash ^ firstKey) * PRIME;
        hash = (hash ^ secondKey) * PRIME;
        hash = (hash ^ thirdKey) * PRIME;
        return hash;
    }

    static int mod(int hash, int modulus) {
        int value = hash % modulus;
        return value < 0 ? value + modulus : value;
    }
}
