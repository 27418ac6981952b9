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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Uses the order suggested by the input file ({@code c order ...}) and falls back to another
 * strategy if the file has none.
 */
public final class SuggestedOrder implements VariableOrderStrategy {
    private static final Logger logger = Logger.getLogger(SuggestedOrder.class.getName());

    private final VariableOrderStrategy fallback;

    public SuggestedOrder() {
        this(new FrequencyOrder());
    }

    public SuggestedOrder(VariableOrderStrategy fallback) {
        this.fallback = fallback;
    }

    @Override
    public VariableOrder plan(CnfFormula formula) {
        return formula.suggestedOrder().map(VariableOrder::of).orElseGet(() -> {
            logger.log(Level.FINE, "No suggested order available, using {0}", fallback);
            return fallback.plan(formula);
        });
    }

    @Override
    public String toString() {
        return "suggested(fallback " + fallback + ")";
    }
}
