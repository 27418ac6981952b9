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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Compares the diagram operations against explicit truth tables over a few variables.
 */
public class BddOperationsTest {
    private static final int VARIABLES = 6;
    private static final int ASSIGNMENTS = 1 << VARIABLES;
    private static final int STEPS = 3_000;

    public static Stream<BddConfiguration> configurations() {
        return Stream.of(
                ImmutableBddConfiguration.builder().build(),
                ImmutableBddConfiguration.builder().initialSize(16).build(),
                ImmutableBddConfiguration.builder()
                        .initialSize(16)
                        .useGarbageCollection(false)
                        .build());
    }

    private static BitSet assignment(int bits) {
        return BitSet.valueOf(new long[] {bits});
    }

    private static boolean[] truthTable(Bdd bdd, int node) {
        boolean[] table = new boolean[ASSIGNMENTS];
        for (int bits = 0; bits < ASSIGNMENTS; bits++) {
            table[bits] = bdd.evaluate(node, assignment(bits));
        }
        return table;
    }

    private static int countTrue(boolean[] table) {
        int count = 0;
        for (boolean value : table) {
            if (value) {
                count += 1;
            }
        }
        return count;
    }

    @ParameterizedTest
    @MethodSource("configurations")
    public void testRandomOperations(BddConfiguration configuration) {
        Random random = new Random(0L);
        BddImpl bdd = new BddImpl(configuration);
        bdd.createVariables(VARIABLES);

        List<Integer> nodes = new ArrayList<>();
        List<boolean[]> tables = new ArrayList<>();
        for (int variable = 0; variable < VARIABLES; variable++) {
            for (int node : new int[] {bdd.variableNode(variable), bdd.negatedVariableNode(variable)}) {
                nodes.add(node);
                tables.add(truthTable(bdd, node));
            }
        }

        for (int step = 0; step < STEPS; step++) {
            int index = random.nextInt(nodes.size());
            int node = nodes.get(index);
            boolean[] table = tables.get(index);
            int otherIndex = random.nextInt(nodes.size());
            int other = nodes.get(otherIndex);
            boolean[] otherTable = tables.get(otherIndex);

            int result;
            boolean[] expected = new boolean[ASSIGNMENTS];
            int operation = random.nextInt(5);
            if (operation == 0) {
                result = bdd.and(node, other);
                for (int bits = 0; bits < ASSIGNMENTS; bits++) {
                    expected[bits] = table[bits] && otherTable[bits];
                }
            } else if (operation == 1) {
                result = bdd.or(node, other);
                for (int bits = 0; bits < ASSIGNMENTS; bits++) {
                    expected[bits] = table[bits] || otherTable[bits];
                }
            } else if (operation == 2) {
                result = bdd.not(node);
                for (int bits = 0; bits < ASSIGNMENTS; bits++) {
                    expected[bits] = !table[bits];
                }
            } else if (operation == 3) {
                int variable = random.nextInt(VARIABLES);
                boolean value = random.nextBoolean();
                result = bdd.restrict(node, variable, value);
                for (int bits = 0; bits < ASSIGNMENTS; bits++) {
                    int fixed = value ? bits | (1 << variable) : bits & ~(1 << variable);
                    expected[bits] = table[fixed];
                }
            } else {
                int quantified = random.nextInt(ASSIGNMENTS);
                result = bdd.exists(node, assignment(quantified));
                for (int bits = 0; bits < ASSIGNMENTS; bits++) {
                    int base = bits & ~quantified;
                    // Enumerate all subsets of the quantified variables
                    int subset = quantified;
                    while (true) {
                        if (table[base | subset]) {
                            expected[bits] = true;
                            break;
                        }
                        if (subset == 0) {
                            break;
                        }
                        subset = (subset - 1) & quantified;
                    }
                }
            }
            bdd.reference(result);

            assertThat(truthTable(bdd, result), is(expected));
            assertThat(bdd.countSatisfyingAssignments(result), is(BigInteger.valueOf(countTrue(expected))));
            assertThat(bdd.isSatisfiable(result), is(countTrue(expected) > 0));
            // Equal functions are represented by the same node
            for (int i = 0; i < tables.size(); i++) {
                if (Arrays.equals(tables.get(i), expected)) {
                    assertThat(nodes.get(i), is(result));
                }
            }
            nodes.add(result);
            tables.add(expected);

            if (nodes.size() > 200) {
                int removed = 2 * VARIABLES + random.nextInt(nodes.size() - 2 * VARIABLES);
                bdd.dereference(nodes.remove(removed));
                tables.remove(removed);
            }
        }
        assertThat(bdd.check(), is(true));
    }

    @Test
    public void testCountWithFreeVariables() {
        Bdd bdd = BddFactory.buildBdd();
        bdd.createVariables(4);
        int node = bdd.reference(bdd.and(bdd.variableNode(2), bdd.negatedVariableNode(3)));
        assertThat(bdd.countSatisfyingAssignments(node, 2), is(BigInteger.ONE));
        assertThat(bdd.countSatisfyingAssignments(node, 3), is(BigInteger.TWO));
        assertThat(bdd.countSatisfyingAssignments(node), is(BigInteger.valueOf(4L)));
        assertThat(bdd.countSatisfyingAssignments(bdd.trueNode(), 3), is(BigInteger.valueOf(8L)));
        assertThat(bdd.countSatisfyingAssignments(bdd.falseNode(), 3), is(BigInteger.ZERO));
        assertThrows(IllegalArgumentException.class, () -> bdd.countSatisfyingAssignments(node, 1));
    }

    @Test
    public void testLargeCount() {
        Bdd bdd = BddFactory.buildBdd();
        bdd.createVariables(300);
        int node = bdd.reference(bdd.or(bdd.variableNode(0), bdd.variableNode(299)));
        BigInteger expected = BigInteger.TWO.pow(300).subtract(BigInteger.TWO.pow(298));
        assertThat(bdd.countSatisfyingAssignments(node), is(expected));
    }

    @Test
    public void testGarbageCollection() {
        BddImpl bdd = new BddImpl(ImmutableBddConfiguration.builder().build());
        bdd.createVariables(4);
        // Every variable and its negation
        assertThat(bdd.activeNodeCount(), is(8));

        int clause = bdd.reference(bdd.or(bdd.variableNode(0), bdd.variableNode(1)));
        int node = bdd.reference(bdd.and(clause, bdd.variableNode(2)));
        assertThat(bdd.nodeCount(node), is(3));
        assertThat(bdd.referenceCount(node), is(1));
        bdd.dereference(clause);
        // Only the clause itself is unreachable from referenced nodes
        assertThat(bdd.forceGc(), is(1));
        assertThat(bdd.isNodeValid(node), is(true));
        assertThat(bdd.nodeCount(node), is(3));

        bdd.dereference(node);
        assertThat(bdd.forceGc(), is(2));
        assertThat(bdd.activeNodeCount(), is(8));
        assertThat(bdd.check(), is(true));

        int unreferenced = bdd.and(bdd.variableNode(0), bdd.variableNode(1));
        assertThrows(IllegalStateException.class, () -> bdd.dereference(unreferenced));
    }

    @Test
    public void testCapacityLimit() {
        BddConfiguration configuration = ImmutableBddConfiguration.builder()
                .initialSize(64)
                .maximumNodeCount(300)
                .build();
        Bdd bdd = BddFactory.buildBdd(configuration);
        NodeTableCapacityException exception =
                assertThrows(NodeTableCapacityException.class, () -> BddBuilder.makeQueens(bdd, 8));
        assertThat(exception.capacity(), is(300));
    }

    @Test
    public void testInvalidVariableCount() {
        Bdd bdd = BddFactory.buildBdd();
        assertThrows(IllegalArgumentException.class, () -> bdd.createVariables(-1));
        assertThat(bdd.createVariables(0).length, is(0));
    }
}
