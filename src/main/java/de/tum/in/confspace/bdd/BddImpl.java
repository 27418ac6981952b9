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

import static de.tum.in.confspace.bdd.Util.checkArgument;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.BitSet;
import java.util.function.IntUnaryOperator;

/* Implementation notes:
 * - All operations are recursive. Recursion depth is bounded by the number of variables.
 * - Variable numbers increase while descending the tree of a particular node.
 * - Intermediate results are pushed onto the work stack until they are connected to their parent,
 *   so a GC triggered by node creation can't free them.
 */
@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "ReassignedVariable",
    "AssignmentToMethodParameter",
})
final class BddImpl extends NodeTable implements Bdd {
    private static final BigInteger TWO = BigInteger.valueOf(2L);
    private static final int[] EMPTY_INT_ARRAY = new int[0];

    private static final int TRUE_NODE = -1;
    private static final int FALSE_NODE = -2;

    private final BddCache cache;
    private int numberOfVariables;
    private int[] variableNodes;
    private int[] negatedVariableNodes;

    /* Low and high successors of each node */
    private int[] tree;

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    BddImpl(BddConfiguration configuration) {
        super(configuration);
        tree = new int[2 * tableSize()];
        cache = new BddCache(this, configuration);
        variableNodes = new int[32];
        negatedVariableNodes = new int[32];
        numberOfVariables = 0;
    }

    // Nodes

    @Override
    protected boolean childrenMatch(int candidate) {
        return tree[2 * candidate] == hashLookupLow && tree[2 * candidate + 1] == hashLookupHigh;
    }

    private int makeNode(int variable, int low, int high) {
        assert 0 <= variable;
        assert isLeaf(low) || variable < variableOf(low);
        assert isLeaf(high) || variable < variableOf(high);

        if (low == high) {
            return low;
        }

        hashLookupLow = low;
        hashLookupHigh = high;
        int node = findOrCreateNode(variable, hashCode(variable, low, high));
        tree[2 * node] = low;
        tree[2 * node + 1] = high;
        return node;
    }

    @Override
    public int low(int node) {
        assert isNodeValid(node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        assert isNodeValid(node);
        return tree[2 * node + 1];
    }

    @Override
    public boolean isLeaf(int node) {
        return node < 0;
    }

    // Variables and base nodes

    @Override
    public int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public int numberOfVariables() {
        return numberOfVariables;
    }

    @Override
    public int variableNode(int variableNumber) {
        assert 0 <= variableNumber && variableNumber < numberOfVariables;
        return variableNodes[variableNumber];
    }

    @Override
    public int negatedVariableNode(int variableNumber) {
        assert 0 <= variableNumber && variableNumber < numberOfVariables;
        return negatedVariableNodes[variableNumber];
    }

    @Override
    public int[] createVariables(int count) {
        checkArgument(count >= 0, "Negative variable count %d", count);
        if (count == 0) {
            return EMPTY_INT_ARRAY;
        }
        int newSize = numberOfVariables + count;
        checkArgument(newSize <= MAXIMUM_VARIABLE, "Too many variables: %d", newSize);
        if (newSize > variableNodes.length) {
            int growth = Math.max(variableNodes.length * 2, newSize);
            variableNodes = Arrays.copyOf(variableNodes, growth);
            negatedVariableNodes = Arrays.copyOf(negatedVariableNodes, growth);
        }

        int[] newVariableNodes = new int[count];
        for (int i = 0; i < count; i++) {
            int variable = numberOfVariables + i;
            int variableNode = saturateNode(makeNode(variable, FALSE_NODE, TRUE_NODE));
            int negatedNode = saturateNode(makeNode(variable, TRUE_NODE, FALSE_NODE));
            variableNodes[variable] = variableNode;
            negatedVariableNodes[variable] = negatedNode;
            newVariableNodes[i] = variableNode;
        }
        numberOfVariables = newSize;

        cache.variablesChanged();
        ensureWorkStackSize(numberOfVariables * 2);
        return newVariableNodes;
    }

    // Reading

    @Override
    public boolean evaluate(int node, BitSet assignment) {
        int current = node;
        while (current >= FIRST_NODE) {
            assert isNodeValid(current);
            current = assignment.get(variableOf(current)) ? high(current) : low(current);
        }
        return current == TRUE_NODE;
    }

    @Override
    public BigInteger countSatisfyingAssignments(int node) {
        return countSatisfyingAssignments(node, numberOfVariables);
    }

    @Override
    public BigInteger countSatisfyingAssignments(int node, int freeVariables) {
        assert isNodeValidOrLeaf(node);
        checkArgument(
                0 <= freeVariables && freeVariables <= numberOfVariables,
                "Invalid free variable count %d",
                freeVariables);
        if (node == FALSE_NODE) {
            return BigInteger.ZERO;
        }
        if (node == TRUE_NODE) {
            return TWO.pow(freeVariables);
        }
        int firstFreeVariable = numberOfVariables - freeVariables;
        int variable = variableOf(node);
        checkArgument(
                firstFreeVariable <= variable,
                "Node %d tests variable %d which is not among the %d free variables",
                node,
                variable,
                freeVariables);
        return TWO.pow(variable - firstFreeVariable).multiply(countSatisfyingAssignmentsRecursive(node));
    }

    /* Number of satisfying assignments over the variables variableOf(node), ..., n - 1 */
    private BigInteger countSatisfyingAssignmentsRecursive(int node) {
        assert isNodeValid(node);

        BigInteger cacheLookup = cache.lookupSatisfaction(node);
        if (cacheLookup != null) {
            return cacheLookup;
        }
        int hash = cache.lookupHash();

        int nodeVar = variableOf(node);
        BigInteger result = countBelow(low(node), nodeVar).add(countBelow(high(node), nodeVar));
        cache.putSatisfaction(hash, node, result);
        return result;
    }

    private BigInteger countBelow(int child, int parentVar) {
        if (child == FALSE_NODE) {
            return BigInteger.ZERO;
        }
        if (child == TRUE_NODE) {
            return TWO.pow(numberOfVariables - parentVar - 1);
        }
        return TWO.pow(variableOf(child) - parentVar - 1).multiply(countSatisfyingAssignmentsRecursive(child));
    }

    // Bdd operations

    @Override
    public int and(int node1, int node2) {
        assert isWorkStackEmpty();
        assert isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2);
        pushToWorkStack(node1);
        pushToWorkStack(node2);
        int result = andRecursive(node1, node2);
        popWorkStack(2);
        assert isWorkStackEmpty();
        return result;
    }

    private int andRecursive(int node1, int node2) {
        if (node1 == node2 || node2 == TRUE_NODE) {
            return node1;
        }
        if (node1 == FALSE_NODE || node2 == FALSE_NODE) {
            return FALSE_NODE;
        }
        if (node1 == TRUE_NODE) {
            return node2;
        }

        int node1var = variableOf(node1);
        int node2var = variableOf(node2);
        if (node2var < node1var || (node2var == node1var && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;
            int varSwap = node1var;
            node1var = node2var;
            node2var = varSwap;
        }

        if (cache.lookupAnd(node1, node2)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int lowNode;
        int highNode;
        if (node1var == node2var) {
            lowNode = pushToWorkStack(andRecursive(low(node1), low(node2)));
            highNode = pushToWorkStack(andRecursive(high(node1), high(node2)));
        } else {
            lowNode = pushToWorkStack(andRecursive(low(node1), node2));
            highNode = pushToWorkStack(andRecursive(high(node1), node2));
        }
        int resultNode = makeNode(node1var, lowNode, highNode);
        popWorkStack(2);
        cache.putAnd(hash, node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int or(int node1, int node2) {
        assert isWorkStackEmpty();
        assert isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2);
        pushToWorkStack(node1);
        pushToWorkStack(node2);
        int result = orRecursive(node1, node2);
        popWorkStack(2);
        assert isWorkStackEmpty();
        return result;
    }

    private int orRecursive(int node1, int node2) {
        if (node1 == TRUE_NODE || node2 == TRUE_NODE) {
            return TRUE_NODE;
        }
        if (node1 == FALSE_NODE || node1 == node2) {
            return node2;
        }
        if (node2 == FALSE_NODE) {
            return node1;
        }

        int node1var = variableOf(node1);
        int node2var = variableOf(node2);
        if (node2var < node1var || (node2var == node1var && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;
            int varSwap = node1var;
            node1var = node2var;
            node2var = varSwap;
        }

        if (cache.lookupOr(node1, node2)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int lowNode;
        int highNode;
        if (node1var == node2var) {
            lowNode = pushToWorkStack(orRecursive(low(node1), low(node2)));
            highNode = pushToWorkStack(orRecursive(high(node1), high(node2)));
        } else {
            lowNode = pushToWorkStack(orRecursive(low(node1), node2));
            highNode = pushToWorkStack(orRecursive(high(node1), node2));
        }
        int resultNode = makeNode(node1var, lowNode, highNode);
        popWorkStack(2);
        cache.putOr(hash, node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int not(int node) {
        assert isWorkStackEmpty();
        assert isNodeValidOrLeaf(node);
        pushToWorkStack(node);
        int result = notRecursive(node);
        popWorkStack();
        assert isWorkStackEmpty();
        return result;
    }

    private int notRecursive(int node) {
        if (node == FALSE_NODE) {
            return TRUE_NODE;
        }
        if (node == TRUE_NODE) {
            return FALSE_NODE;
        }

        if (cache.lookupNot(node)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int lowNode = pushToWorkStack(notRecursive(low(node)));
        int highNode = pushToWorkStack(notRecursive(high(node)));
        int resultNode = makeNode(variableOf(node), lowNode, highNode);
        popWorkStack(2);
        cache.putNot(hash, node, resultNode);
        return resultNode;
    }

    @Override
    public int restrict(int node, int variable, boolean value) {
        assert isWorkStackEmpty();
        assert isNodeValidOrLeaf(node);
        checkArgument(0 <= variable && variable < numberOfVariables, "Unknown variable %d", variable);
        if (isLeaf(node)) {
            return node;
        }
        pushToWorkStack(node);
        int result = restrictRecursive(node, variable, 2 * variable + (value ? 1 : 0));
        popWorkStack();
        assert isWorkStackEmpty();
        return result;
    }

    private int restrictRecursive(int node, int variable, int literal) {
        if (isLeaf(node)) {
            return node;
        }
        int nodeVar = variableOf(node);
        if (nodeVar > variable) {
            return node;
        }
        if (nodeVar == variable) {
            return (literal & 1) == 1 ? high(node) : low(node);
        }

        if (cache.lookupRestrict(node, literal)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int lowNode = pushToWorkStack(restrictRecursive(low(node), variable, literal));
        int highNode = pushToWorkStack(restrictRecursive(high(node), variable, literal));
        int resultNode = makeNode(nodeVar, lowNode, highNode);
        popWorkStack(2);
        cache.putRestrict(hash, node, literal, resultNode);
        return resultNode;
    }

    @Override
    public int exists(int node, BitSet quantifiedVariables) {
        assert isWorkStackEmpty();
        assert quantifiedVariables.length() <= numberOfVariables;
        if (isLeaf(node) || quantifiedVariables.isEmpty()) {
            return node;
        }
        if (quantifiedVariables.cardinality() == numberOfVariables) {
            return TRUE_NODE;
        }

        cache.initExists(quantifiedVariables);
        int[] quantifiedVariableArray = quantifiedVariables.stream().toArray();
        pushToWorkStack(node);
        int result = existsRecursive(node, 0, quantifiedVariableArray);
        popWorkStack();
        assert isWorkStackEmpty();
        return result;
    }

    private int existsRecursive(int node, int currentIndex, int[] quantifiedVariables) {
        if (isLeaf(node)) {
            return node;
        }
        int nodeVariable = variableOf(node);
        while (currentIndex < quantifiedVariables.length && quantifiedVariables[currentIndex] < nodeVariable) {
            currentIndex += 1;
        }
        if (currentIndex == quantifiedVariables.length) {
            return node;
        }

        if (cache.lookupExists(node)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int lowExists = pushToWorkStack(existsRecursive(low(node), currentIndex, quantifiedVariables));
        int highExists = pushToWorkStack(existsRecursive(high(node), currentIndex, quantifiedVariables));
        int resultNode;
        if (quantifiedVariables[currentIndex] == nodeVariable) {
            resultNode = orRecursive(lowExists, highExists);
        } else {
            resultNode = makeNode(nodeVariable, lowExists, highExists);
        }
        popWorkStack(2);
        cache.putExists(hash, node, resultNode);
        return resultNode;
    }

    // Management

    void invalidateCache() {
        cache.invalidate();
    }

    @Override
    public String toString() {
        return String.format("BDD@%d(%d)", tableSize(), System.identityHashCode(this));
    }

    @Override
    public String statistics() {
        return getStatistics() + '\n' + cache.getStatistics();
    }

    @Override
    protected void onGarbageCollection() {
        cache.invalidate();
    }

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, newSize * 2);
    }

    @Override
    protected int hashCode(int node, int variable) {
        return hashCode(variable, tree[2 * node], tree[2 * node + 1]);
    }

    private static int hashCode(int variable, int low, int high) {
        return HashUtil.hash(variable, low, high);
    }

    @Override
    protected int sumEachChild(int node, IntUnaryOperator operator) {
        return operator.applyAsInt(tree[2 * node]) + operator.applyAsInt(tree[2 * node + 1]);
    }
}
