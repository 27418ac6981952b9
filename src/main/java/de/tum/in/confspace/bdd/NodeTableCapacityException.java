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

/**
 * Thrown when a node table has reached its configured capacity and garbage collection could not
 * free enough nodes, or when more variables are requested than a node can address. The diagram is left in a consistent state, but the operation that triggered
 * the exception has no result.
 */
public class NodeTableCapacityException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int capacity;

    public NodeTableCapacityException(int capacity) {
        super(String.format("Node table capacity of %d nodes exhausted", capacity));
        this.capacity = capacity;
    }

    public NodeTableCapacityException(String message, int capacity) {
        super(message);
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
