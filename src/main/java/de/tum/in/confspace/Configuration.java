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

import static de.tum.in.confspace.bdd.Util.checkArgument;

import java.util.BitSet;

/**
 * A total assignment of all variables of a formula, bit {@code i} being the value of the 0-based
 * variable {@code i}.
 */
public final class Configuration {
    private final BitSet values;
    private final int variableCount;

    public Configuration(BitSet values, int variableCount) {
        checkArgument(values.length() <= variableCount, "Assignment %s exceeds %d variables", values, variableCount);
        this.values = (BitSet) values.clone();
        this.variableCount = variableCount;
    }

    public static Configuration parse(String bits) {
        BitSet values = new BitSet(bits.length());
        for (int i = 0; i < bits.length(); i++) {
            char bit = bits.charAt(i);
            checkArgument(bit == '0' || bit == '1', "Invalid value '%s' at %d", bit, i);
            values.set(i, bit == '1');
        }
        return new Configuration(values, bits.length());
    }

    public int variableCount() {
        return variableCount;
    }

    public boolean get(int variable) {
        checkArgument(0 <= variable && variable < variableCount, "Unknown variable %d", variable);
        return values.get(variable);
    }

    public BitSet values() {
        return (BitSet) values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Configuration)) {
            return false;
        }
        Configuration that = (Configuration) o;
        return variableCount == that.variableCount && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return 31 * values.hashCode() + variableCount;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(variableCount);
        for (int i = 0; i < variableCount; i++) {
            builder.append(values.get(i) ? '1' : '0');
        }
        return builder.toString();
    }
}
