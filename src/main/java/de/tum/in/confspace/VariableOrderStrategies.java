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

public final class VariableOrderStrategies {
    private VariableOrderStrategies() {}

    public static VariableOrderStrategy of(AnalysisConfiguration configuration) {
        switch (configuration.orderStrategy()) {
            case FREQUENCY:
                return new FrequencyOrder();
            case FORCE:
                return new ForceDirectedOrder(configuration.forceRounds());
            case SUGGESTED:
                return new SuggestedOrder();
            case NATURAL:
                return new NaturalOrder();
            default:
                throw new AssertionError("Unknown strategy " + configuration.orderStrategy());
        }
    }
}
