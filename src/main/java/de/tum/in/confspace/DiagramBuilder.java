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

import de.tum.in.confspace.bdd.Bdd;
import de.tum.in.confspace.bdd.NodeTable;
import de.tum.in.confspace.bdd.NodeTableCapacityException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the conjunction of all clauses of a formula.
 *
 * <p>Clauses are conjoined in batches: the clauses of each batch are conjoined on their own and only
 * the batch result is added to the running conjunction, which keeps the intermediate diagrams
 * small. Construction stops as soon as a batch or the running conjunction becomes false.</p>
 */
public final class DiagramBuilder {
    private static final Logger logger = Logger.getLogger(DiagramBuilder.class.getName());

    private final int batchSize;

    public DiagramBuilder(int batchSize) {
        checkArgument(batchSize > 0, "Batch size must be positive, got %d", batchSize);
        this.batchSize = batchSize;
    }

    /**
     * Declares the variables of the formula in the given order on the (fresh) {@code bdd} and builds
     * the function of the formula.
     */
    public ConfigurationSpace build(Bdd bdd, CnfFormula formula, VariableOrder order) {
        checkArgument(bdd.numberOfVariables() == 0, "Diagram already has variables");
        checkArgument(order.size() == formula.variableCount(), "Order of size %d for %d variables",
                order.size(), formula.variableCount());
        long start = System.currentTimeMillis();
        int variableCount = formula.variableCount();
        if (variableCount > NodeTable.MAXIMUM_VARIABLE) {
            throw new NodeTableCapacityException(String.format(
                    "Formula has %d variables, at most %d are supported", variableCount, NodeTable.MAXIMUM_VARIABLE),
                    NodeTable.MAXIMUM_VARIABLE);
        }
        bdd.createVariables(variableCount);

        List<String> diagnostics = new ArrayList<>();
        List<int[]> clauses = formula.clauses();
        int total = bdd.trueNode();
        for (int batchStart = 0; batchStart < clauses.size(); batchStart += batchSize) {
            int batchEnd = Math.min(batchStart + batchSize, clauses.size());
            int batch = bdd.trueNode();
            for (int index = batchStart; index < batchEnd; index++) {
                int clause = buildClause(bdd, clauses.get(index), index, order, diagnostics);
                if (clause == bdd.placeholder()) {
                    continue;
                }
                batch = bdd.consume(bdd.and(batch, clause), batch, clause);
                if (batch == bdd.falseNode()) {
                    logger.log(Level.WARNING, "Batch {0} became unsatisfiable at clause {1}", new Object[] {
                        batchStart / batchSize + 1, index + 1
                    });
                    break;
                }
            }
            total = bdd.consume(bdd.and(total, batch), total, batch);
            logger.log(Level.FINER, "Conjoined clauses up to {0}, diagram has {1} nodes", new Object[] {
                batchEnd, bdd.nodeCount(total)
            });
            if (total == bdd.falseNode()) {
                logger.log(Level.WARNING, "Formula became unsatisfiable after {0} clauses", batchEnd);
                break;
            }
        }
        if (!diagnostics.isEmpty()) {
            logger.log(Level.WARNING, "Skipped {0} invalid literals or clauses", diagnostics.size());
        }

        ConfigurationSpace space = new ConfigurationSpace(bdd, formula, order, total, diagnostics);
        // The space holds its own reference
        bdd.dereference(total);
        logger.log(Level.FINE, "Built diagram with {0} nodes in {1} ms", new Object[] {
            bdd.nodeCount(total), System.currentTimeMillis() - start
        });
        return space;
    }

    /**
     * Builds the disjunction of the literals of a clause, dropping literals beyond the variable count.
     *
     * @return The referenced clause node or {@link Bdd#placeholder()} if no literal is left.
     */
    private static int buildClause(Bdd bdd, int[] clause, int index, VariableOrder order, List<String> diagnostics) {
        int variableCount = order.size();
        int node = bdd.falseNode();
        boolean valid = false;
        for (int literal : clause) {
            int variable = Math.abs(literal) - 1;
            if (variable >= variableCount) {
                diagnostics.add(String.format(
                        "clause %d: skipping literal %d beyond variable count %d", index + 1, literal, variableCount));
                continue;
            }
            valid = true;
            int level = order.levelOf(variable);
            int literalNode = literal > 0 ? bdd.variableNode(level) : bdd.negatedVariableNode(level);
            node = bdd.updateWith(bdd.or(node, literalNode), node);
        }
        if (!valid) {
            diagnostics.add(String.format("clause %d: no valid literal, skipping clause", index + 1));
            return bdd.placeholder();
        }
        return node;
    }
}
