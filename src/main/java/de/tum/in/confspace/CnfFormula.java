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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A propositional formula in conjunctive normal form, as read from a DIMACS file.
 *
 * <p>Clauses are kept in DIMACS notation: each literal is a non-zero signed integer whose magnitude
 * is the 1-based variable number. All other accessors use 0-based variable indices. The clause
 * arrays are shared and must not be modified.</p>
 */
public final class CnfFormula {
    private final int variableCount;
    private final int declaredVariableCount;
    private final int declaredClauseCount;
    private final List<int[]> clauses;
    private final int[] occurrences;
    @Nullable
    private final int[] suggestedOrder;
    private final List<String> diagnostics;

    CnfFormula(
            int variableCount,
            int declaredVariableCount,
            int declaredClauseCount,
            List<int[]> clauses,
            int[] occurrences,
            @Nullable int[] suggestedOrder,
            List<String> diagnostics) {
        checkArgument(variableCount > 0, "Formula needs at least one variable, got %d", variableCount);
        checkArgument(occurrences.length == variableCount, "Occurrence table does not match variables");
        this.variableCount = variableCount;
        this.declaredVariableCount = declaredVariableCount;
        this.declaredClauseCount = declaredClauseCount;
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
        this.occurrences = occurrences.clone();
        this.suggestedOrder = suggestedOrder == null ? null : suggestedOrder.clone();
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Creates a formula directly from clauses. Occurrences are counted for every literal whose
     * magnitude is at most {@code variableCount}; larger literals are kept as they are.
     */
    public static CnfFormula of(int variableCount, List<int[]> clauses) {
        int[] occurrences = new int[variableCount];
        for (int[] clause : clauses) {
            for (int literal : clause) {
                checkArgument(literal != 0, "Literal 0 inside a clause");
                int magnitude = Math.abs(literal);
                if (magnitude <= variableCount) {
                    occurrences[magnitude - 1] += 1;
                }
            }
        }
        return new CnfFormula(variableCount, variableCount, clauses.size(), clauses, occurrences, null, List.of());
    }

    public static CnfFormula of(int variableCount, int[]... clauses) {
        return of(variableCount, Arrays.asList(clauses));
    }

    /**
     * The effective number of variables, i.e. the size of the configuration vectors.
     */
    public int variableCount() {
        return variableCount;
    }

    /**
     * The variable count stated in the header, or {@code 0} if there was no usable header.
     */
    public int declaredVariableCount() {
        return declaredVariableCount;
    }

    public int declaredClauseCount() {
        return declaredClauseCount;
    }

    public List<int[]> clauses() {
        return clauses;
    }

    public int clauseCount() {
        return clauses.size();
    }

    /**
     * Number of literals (of either polarity) of the given 0-based variable over all clauses.
     */
    public int occurrences(int variable) {
        return occurrences[variable];
    }

    /**
     * A 0-based variable ranking given by an {@code c order ...} comment of the file, if any.
     */
    public Optional<int[]> suggestedOrder() {
        return suggestedOrder == null ? Optional.empty() : Optional.of(suggestedOrder.clone());
    }

    /**
     * Non-fatal problems found while reading, in file order.
     */
    public List<String> diagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return String.format("CNF(%d variables, %d clauses)", variableCount, clauses.size());
    }
}
