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

/* Table sizes are at most Integer.MAX_VALUE / 2, so trial division by odd numbers up to the square
 * root (at most ~33k steps) is cheap compared to the allocation that follows. */
final class Primes {
    private Primes() {}

    static boolean isPrime(int value) {
        if (value < 2) {
            return false;
        }
        if (value < 4) {
            return true;
        }
        if (value % 2 == 0 || value % 3 == 0) {
            return false;
        }
        for (long divisor = 5; divisor * divisor <= value; divisor += 6) {
            if (value % divisor == 0 || value % (divisor + 2) == 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the smallest prime bigger than or equal to {@code value} (and at least 3).
     */
    static int nextPrime(int value) {
        int candidate = Math.max(3, value | 1);
        while (!isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }
}
