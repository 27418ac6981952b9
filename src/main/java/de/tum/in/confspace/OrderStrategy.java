/*
 * This file is part of ConfSpace.
 * Copyright (c) 2023 The ConfSpace contributors.
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
package de.tum.in.confspace;

/**
 * The available variable order heuristics.
 */
public enum OrderStrategy {
    /** Descending number of occurrences. */
    FREQUENCY,
    /** Iterative centre-of-gravity refinement of the frequency order. */
    FORCE,
    /** The order given by the input file, frequency order if there is none. */
    SUGGESTED,
    /** Variables in index order. */
    NATURAL
}
