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
import static de.tum.in.confspace.bdd.Util.checkState;

import de.tum.in.confspace.bdd.Bdd;
import java.util.BitSet;
import java.util.List;

/**
 * The set of valid configurations of a formula, represented by a referenced diagram node.
 *
 * <p>Feature variable {@code v} of the formula is tested at diagram level
 * {@link VariableOrder#levelOf(int) order.levelOf(v)}. The space owns the reference to its root;
 * {@link #close()} releases it and collects all nodes which are no longer referenced, which is the
 * only point at which nodes of an analysis are reclaimed in bulk.</p>
 */
public final class ConfigurationSpace implements AutoCloseable {
    private final Bdd bdd;
    private final CnfFormula formula;
    private final VariableOrder order;
    private final int root;
    private final List<String> diagnostics;
    private boolean closed = false;

    ConfigurationSpace(Bdd bdd, CnfFormula formula, VariableOrder order, int root, List<String> diagnostics) {
        checkArgument(order.size() == formula.variableCount(), "Order does not match the formula");
        checkArgument(bdd.numberOfVariables() == formula.variableCount(), "Diagram does not match the formula");
        this.bdd = bdd;
        this.formula = formula;
        this.order = order;
        this.root = bdd.reference(root);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Bdd bdd() {
        return bdd;
    }

    public CnfFormula formula() {
        return formula;
    }

    public VariableOrder order() {
        return order;
    }

    public int root() {
        checkState(!closed, "Configuration space already closed");
        return root;
    }

    public int variableCount() {
        return formula.variableCount();
    }

    public boolean isUnsatisfiable() {
        return root == bdd.falseNode();
    }

    /**
     * Problems found while building the diagram, e.g. dropped literals.
     */
    public List<String> diagnostics() {
        return diagnostics;
    }

    /**
     * Returns the (saturated) node of the literal {@code variable = value}.
     */
    public int literalNode(int variable, boolean value) {
        int level = order.levelOf(variable);
        return value ? bdd.variableNode(level) : bdd.negatedVariableNode(level);
    }

    public boolean contains(Configuration configuration) {
        checkArgument(configuration.variableCount() == variableCount(), "Configuration size mismatch");
        BitSet levels = new BitSet(variableCount());
        for (int variable = 0; variable < variableCount(); variable++) {
            if (configuration.get(variable)) {
                levels.set(order.levelOf(variable));
            }
        }
        return bdd.evaluate(root(), levels);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        bdd.dereference(root);
        bdd.forceGc();
    }

    @Override
    public String toString() {
        return String.format("ConfigurationSpace(%s, root %d)", formula, root);
    }
}
