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

import static de.tum.in.confspace.bdd.Util.checkState;

import java.util.Arrays;
import java.util.function.IntUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hash-consing node store shared by all decision diagram implementations. Nodes are slots of a set
 * of parallel arrays; the subclass owns the children arrays and this class the metadata, the
 * unique table (open hashing with chains threaded through {@link #hashChain}) and the free list.
 */
public abstract class NodeTable implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    /* Metadata layout: <---VARIABLE (17)---><---REFERENCES (14)---><MARK (1)> */
    private static final int MARK_BIT = 1;
    private static final int REFERENCE_BITS = 14;
    private static final int REFERENCE_OFFSET = 1;
    private static final int REFERENCE_MASK = (1 << REFERENCE_BITS) - 1;
    private static final int REFERENCE_SATURATED = REFERENCE_MASK;
    private static final int REFERENCE_UNIT = 1 << REFERENCE_OFFSET;
    private static final int VARIABLE_BITS = 17;
    private static final int VARIABLE_OFFSET = REFERENCE_OFFSET + REFERENCE_BITS;
    private static final int INVALID_VARIABLE = (1 << VARIABLE_BITS) - 1;

    /* Largest variable number that can be stored in the metadata. */
    public static final int MAXIMUM_VARIABLE = INVALID_VARIABLE - 1;

    static {
        //noinspection ConstantValue
        assert VARIABLE_BITS + REFERENCE_BITS + 1 == Integer.SIZE;
    }

    // Use 0 as "not a node" so that freshly allocated arrays need no initialisation
    protected static final int NOT_A_NODE = 0;
    protected static final int FIRST_NODE = 1;

    private static final int MINIMUM_NODE_TABLE_SIZE = Primes.nextPrime(1_000);
    /* Below this share of free nodes after a collection at full capacity we give up. */
    private static final double MINIMUM_FREE_SHARE_AT_CAPACITY = 0.01d;

    private final double minimumFreeNodeAfterGc;
    private final double growthFactor;
    private final int maximumNodeCount;

    /* Approximation of dead node count, only used to decide whether a GC is worth a try. */
    private int approximateDeadNodeCount = 0;
    /* Invariant: every node with positive reference count has index <= biggestReferencedNode. */
    private int biggestReferencedNode;
    /* Invariant: every valid node has index <= biggestValidNode. */
    private int biggestValidNode;
    private int firstFreeNode;
    private int freeNodeCount;

    /* Nodes created during an operation are not referenced yet; the work stack keeps them (and the
     * operands) alive in case a GC is triggered in the middle of the operation. */
    private int[] workStack;
    private int workStackIndex = 0;

    private int[] metadata;
    /* For valid nodes: next node in the same hash bucket. For invalid nodes: next free node. */
    private int[] hashChain;
    private int[] hashToChainStart;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupHits = 0;
    private long growCount = 0;
    private long garbageCollectionCount = 0;
    private long garbageCollectedNodeCount = 0;
    private long garbageCollectionTime = 0;

    protected NodeTable(BddConfiguration configuration) {
        this.minimumFreeNodeAfterGc =
                configuration.useGarbageCollection() ? configuration.minimumFreeNodePercentageAfterGc() : 1.0;
        this.growthFactor = configuration.growthFactor();
        this.maximumNodeCount = Math.max(configuration.maximumNodeCount(), FIRST_NODE + 2);

        int tableSize = Math.min(
                Math.max(Primes.nextPrime(configuration.initialSize()), MINIMUM_NODE_TABLE_SIZE), maximumNodeCount);

        metadata = new int[tableSize];
        hashChain = new int[tableSize];
        hashToChainStart = new int[tableSize];
        Arrays.fill(metadata, dataMakeInvalid());

        // Slot 0 is "not a node", make any use of it fail fast
        hashChain[NOT_A_NODE] = Integer.MIN_VALUE;
        for (int i = FIRST_NODE; i < tableSize - 1; i++) {
            hashChain[i] = i + 1;
        }
        hashChain[tableSize - 1] = FIRST_NODE;
        firstFreeNode = FIRST_NODE;
        freeNodeCount = tableSize - FIRST_NODE;
        biggestReferencedNode = NOT_A_NODE;
        biggestValidNode = NOT_A_NODE;

        workStack = new int[32];
    }

    // Metadata encoding

    static int dataMake(int variable) {
        return variable << VARIABLE_OFFSET;
    }

    static int dataMakeInvalid() {
        return INVALID_VARIABLE << VARIABLE_OFFSET;
    }

    static int dataGetVariable(int data) {
        return data >>> VARIABLE_OFFSET;
    }

    static boolean dataIsValid(int data) {
        return dataGetVariable(data) != INVALID_VARIABLE;
    }

    static int dataGetReferenceCount(int data) {
        return (data >>> REFERENCE_OFFSET) & REFERENCE_MASK;
    }

    static boolean dataIsSaturated(int data) {
        return dataGetReferenceCount(data) == REFERENCE_SATURATED;
    }

    static boolean dataIsReferencedOrSaturated(int data) {
        return dataGetReferenceCount(data) > 0;
    }

    static boolean dataIsMarked(int data) {
        return (data & MARK_BIT) != 0;
    }

    // Basic node access

    @Override
    public final int placeholder() {
        return NOT_A_NODE;
    }

    @Override
    public int variableOf(int node) {
        assert isNodeValidOrLeaf(node);
        return isLeaf(node) ? -1 : dataGetVariable(metadata[node]);
    }

    public boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node <= biggestValidNode && dataIsValid(metadata[node]);
    }

    public boolean isNodeValidOrLeaf(int node) {
        return isLeaf(node) || isNodeValid(node);
    }

    public int tableSize() {
        return metadata.length;
    }

    // Work stack

    protected final void ensureWorkStackSize(int size) {
        if (size < workStack.length) {
            return;
        }
        workStack = Arrays.copyOf(workStack, Math.max(size + 1, workStack.length * 2));
    }

    protected final boolean isWorkStackEmpty() {
        return workStackIndex == 0;
    }

    /**
     * Pushes the given node onto the work stack. While a node is on the work stack, it will not be
     * garbage collected.
     *
     * @return The given {@code node}, to be used for chaining.
     */
    protected final int pushToWorkStack(int node) {
        assert isNodeValidOrLeaf(node);
        ensureWorkStackSize(workStackIndex);
        workStack[workStackIndex] = node;
        workStackIndex += 1;
        return node;
    }

    protected final void popWorkStack() {
        assert !isWorkStackEmpty();
        workStackIndex -= 1;
    }

    protected final void popWorkStack(int amount) {
        assert workStackIndex >= amount;
        workStackIndex -= amount;
    }

    // Reference counting

    @Override
    public int referenceCount(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return -1;
        }
        int data = metadata[node];
        return dataIsSaturated(data) ? -1 : dataGetReferenceCount(data);
    }

    @Override
    public int reference(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        int data = metadata[node];
        if (dataIsSaturated(data)) {
            return node;
        }
        metadata[node] = data + REFERENCE_UNIT;
        if (node > biggestReferencedNode) {
            biggestReferencedNode = node;
        }
        return node;
    }

    @Override
    public int dereference(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        int data = metadata[node];
        if (dataIsSaturated(data)) {
            return node;
        }
        int referenceCount = dataGetReferenceCount(data);
        checkState(referenceCount > 0, "Dereferencing unreferenced node %d", node);
        if (referenceCount == 1) {
            // Only an approximation: this node may have been the last one keeping its children alive,
            // or it may still be reachable from another referenced node
            approximateDeadNodeCount += 1;
            if (node == biggestReferencedNode) {
                int candidate = biggestReferencedNode - 1;
                while (candidate >= FIRST_NODE && !dataIsReferencedOrSaturated(metadata[candidate])) {
                    candidate -= 1;
                }
                biggestReferencedNode = Math.max(candidate, NOT_A_NODE);
            }
        }
        metadata[node] = data - REFERENCE_UNIT;
        return node;
    }

    @Override
    public int saturateNode(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        metadata[node] |= REFERENCE_SATURATED << REFERENCE_OFFSET;
        if (node > biggestReferencedNode) {
            biggestReferencedNode = node;
        }
        return node;
    }

    // Node creation

    /**
     * Checks whether the children of {@code candidate} equal the children currently being looked up.
     */
    protected abstract boolean childrenMatch(int candidate);

    /**
     * Returns the bucket hash of an existing node.
     */
    protected abstract int hashCode(int node, int variable);

    protected abstract void onGarbageCollection();

    protected abstract void onTableResize(int newSize);

    /**
     * Applies {@code operator} to both children of {@code node} and sums the results.
     */
    protected abstract int sumEachChild(int node, IntUnaryOperator operator);

    /**
     * Returns the existing node with the given variable and the children announced to
     * {@link #childrenMatch(int)}, or allocates a new slot for it. In the latter case the subclass
     * has to write the children into the returned slot.
     */
    protected int findOrCreateNode(int variable, int hashCode) {
        int[] metadata = this.metadata;
        int[] hashChain = this.hashChain;

        hashChainLookups += 1;
        int current = hashToChainStart[bucketOf(hashCode)];
        while (current != NOT_A_NODE) {
            if (dataGetVariable(metadata[current]) == variable && childrenMatch(current)) {
                hashChainLookupHits += 1;
                return current;
            }
            assert hashChain[current] != current;
            current = hashChain[current];
        }

        // Keep one free node as anchor of the free chain
        assert freeNodeCount > 0;
        if (freeNodeCount == 1) {
            ensureCapacity();
        }

        createdNodes += 1;
        int freeNode = firstFreeNode;
        firstFreeNode = this.hashChain[freeNode];
        freeNodeCount -= 1;
        assert !isNodeValid(freeNode) : "Overwriting existing node " + freeNode;

        this.metadata[freeNode] = dataMake(variable);
        if (biggestValidNode < freeNode) {
            biggestValidNode = freeNode;
        }
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    private int bucketOf(int hashCode) {
        int bucket = hashCode % hashToChainStart.length;
        return bucket < 0 ? bucket + hashToChainStart.length : bucket;
    }

    private void connectHashList(int node, int hashCode) {
        int bucket = bucketOf(hashCode);
        hashChain[node] = hashToChainStart[bucket];
        hashToChainStart[bucket] = node;
    }

    // Memory management

    @Override
    public int forceGc() {
        int freedNodes = doGarbageCollection(0);
        onGarbageCollection();
        return freedNodes;
    }

    /**
     * Frees space by garbage collection or, if that does not yield enough free nodes, grows the
     * table. Fails if the table is at its maximum size and even a full collection leaves it
     * (nearly) full.
     */
    private void ensureCapacity() {
        if (minimumFreeNodeAfterGc < 1.0 && approximateDeadNodeCount > 0) {
            logger.log(Level.FINE, "Running GC on {0} of size {1} with approximately {2} dead nodes", new Object[] {
                this, tableSize(), approximateDeadNodeCount
            });
            @SuppressWarnings("NumericCastThatLosesPrecision")
            int minimumFreeNodeCount = (int) (tableSize() * minimumFreeNodeAfterGc);
            int collected = doGarbageCollection(Math.max(minimumFreeNodeCount, 2));
            if (collected >= 0) {
                logger.log(Level.FINE, "Collected {0} nodes", collected);
                onGarbageCollection();
                return;
            }
            logger.log(Level.FINE, "Not enough free nodes after GC");
        }

        int oldSize = tableSize();
        if (oldSize >= maximumNodeCount) {
            if (minimumFreeNodeAfterGc < 1.0) {
                @SuppressWarnings("NumericCastThatLosesPrecision")
                int minimumFreeNodeCount = (int) Math.ceil(oldSize * MINIMUM_FREE_SHARE_AT_CAPACITY);
                int collected = doGarbageCollection(Math.max(minimumFreeNodeCount, 2));
                if (collected >= 0) {
                    logger.log(Level.FINE, "Collected {0} nodes at full capacity", collected);
                    onGarbageCollection();
                    return;
                }
            }
            logger.log(Level.WARNING, "Node table {0} exhausted its capacity of {1} nodes", new Object[] {
                this, maximumNodeCount
            });
            throw new NodeTableCapacityException(maximumNodeCount);
        }

        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(maximumNodeCount, Primes.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        assert oldSize < newSize;
        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});
        growCount += 1;

        onTableResize(newSize);
        metadata = Arrays.copyOf(metadata, newSize);
        hashChain = Arrays.copyOf(hashChain, newSize);
        hashToChainStart = new int[newSize];
        Arrays.fill(metadata, oldSize, newSize, dataMakeInvalid());

        // Rebuild the free chain in ascending order and re-hash all valid nodes into the new buckets
        int[] metadata = this.metadata;
        int[] hashChain = this.hashChain;
        hashChain[newSize - 1] = FIRST_NODE;
        for (int node = newSize - 2; node >= oldSize; node--) {
            hashChain[node] = node + 1;
        }
        int firstFree = oldSize;
        int freeCount = newSize - oldSize;
        for (int node = oldSize - 1; node >= FIRST_NODE; node--) {
            if (!dataIsValid(metadata[node])) {
                hashChain[node] = firstFree;
                firstFree = node;
                freeCount += 1;
            }
        }
        for (int node = oldSize - 1; node >= FIRST_NODE; node--) {
            int data = metadata[node];
            if (dataIsValid(data)) {
                connectHashList(node, hashCode(node, dataGetVariable(data)));
            }
        }
        this.firstFreeNode = firstFree;
        this.freeNodeCount = freeCount;

        assert check();
        onGarbageCollection();
    }

    /**
     * Marks everything reachable from the work stack and from referenced nodes, frees the rest.
     *
     * @return Number of freed nodes, or {@code -1} if less than {@code minimumFreeNodeCount} nodes
     *     would be free afterwards (in which case nothing is changed).
     */
    private int doGarbageCollection(int minimumFreeNodeCount) {
        assert isNoneMarked();
        long start = System.currentTimeMillis();

        int liveNodes = 0;
        for (int i = 0; i < workStackIndex; i++) {
            liveNodes += markAllUnmarkedBelow(workStack[i]);
        }
        int[] metadata = this.metadata;
        for (int node = FIRST_NODE; node <= biggestReferencedNode; node++) {
            int data = metadata[node];
            if (dataIsValid(data) && dataIsReferencedOrSaturated(data)) {
                liveNodes += markAllUnmarkedBelow(node);
            }
        }

        int freeCount = tableSize() - FIRST_NODE - liveNodes;
        if (freeCount < minimumFreeNodeCount) {
            unMarkAll();
            return -1;
        }

        Arrays.fill(hashToChainStart, NOT_A_NODE);
        int[] hashChain = this.hashChain;
        int firstFree = FIRST_NODE;
        for (int node = tableSize() - 1; node > biggestValidNode; node--) {
            hashChain[node] = firstFree;
            firstFree = node;
        }

        int biggestValid = biggestValidNode;
        for (int node = biggestValidNode; node >= FIRST_NODE; node--) {
            int data = metadata[node];
            if (dataIsMarked(data)) {
                int unmarked = data & ~MARK_BIT;
                metadata[node] = unmarked;
                connectHashList(node, hashCode(node, dataGetVariable(unmarked)));
            } else {
                metadata[node] = dataMakeInvalid();
                hashChain[node] = firstFree;
                firstFree = node;
                if (node == biggestValid) {
                    biggestValid -= 1;
                }
            }
        }

        int collected = freeCount - this.freeNodeCount;
        this.biggestValidNode = biggestValid;
        this.firstFreeNode = firstFree;
        this.freeNodeCount = freeCount;
        approximateDeadNodeCount = 0;

        garbageCollectionCount += 1;
        garbageCollectedNodeCount += collected;
        garbageCollectionTime += System.currentTimeMillis() - start;
        assert check();
        return collected;
    }

    // Marking

    private int markAllUnmarkedBelow(int node) {
        if (isLeaf(node)) {
            return 0;
        }
        int data = metadata[node];
        if (dataIsMarked(data)) {
            return 0;
        }
        metadata[node] = data | MARK_BIT;
        return 1 + sumEachChild(node, this::markAllUnmarkedBelow);
    }

    private int unMarkAllMarkedBelow(int node) {
        if (isLeaf(node)) {
            return 0;
        }
        int data = metadata[node];
        if (!dataIsMarked(data)) {
            return 0;
        }
        metadata[node] = data & ~MARK_BIT;
        return 1 + sumEachChild(node, this::unMarkAllMarkedBelow);
    }

    private int unMarkAll() {
        int count = 0;
        int[] metadata = this.metadata;
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            if (dataIsMarked(metadata[node])) {
                metadata[node] &= ~MARK_BIT;
                count += 1;
            }
        }
        return count;
    }

    private boolean isNoneMarked() {
        for (int node = FIRST_NODE; node < tableSize(); node++) {
            if (dataIsMarked(metadata[node])) {
                return false;
            }
        }
        return true;
    }

    // Reading

    @Override
    public int activeNodeCount() {
        assert isNoneMarked();
        int count = 0;
        for (int node = FIRST_NODE; node <= biggestReferencedNode; node++) {
            int data = metadata[node];
            if (dataIsValid(data) && dataIsReferencedOrSaturated(data)) {
                count += markAllUnmarkedBelow(node);
            }
        }
        int unmarked = unMarkAll();
        assert count == unmarked;
        return count;
    }

    @Override
    public int nodeCount(int node) {
        assert isNodeValidOrLeaf(node);
        assert isNoneMarked();
        int count = markAllUnmarkedBelow(node);
        if (count > 0) {
            int unmarked = unMarkAllMarkedBelow(node);
            assert count == unmarked : "Expected " + count + " but only unmarked " + unmarked;
        }
        return count;
    }

    // Integrity checks and utility

    /**
     * Performs integrity checks of the table invariants.
     *
     * @return True, so that it can be called from an {@code assert} statement.
     */
    boolean check() {
        checkState(biggestReferencedNode <= biggestValidNode || biggestReferencedNode == NOT_A_NODE);
        for (int node = biggestValidNode + 1; node < tableSize(); node++) {
            checkState(!dataIsValid(metadata[node]), "Node %d beyond biggest valid node is valid", node);
        }
        for (int node = biggestReferencedNode + 1; node < tableSize(); node++) {
            checkState(
                    !dataIsReferencedOrSaturated(metadata[node]),
                    "Node %d beyond biggest referenced node is referenced",
                    node);
        }
        int validCount = 0;
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            int data = metadata[node];
            if (!dataIsValid(data)) {
                continue;
            }
            validCount += 1;
            int variable = dataGetVariable(data);
            int parent = node;
            sumEachChild(node, child -> {
                checkState(isNodeValidOrLeaf(child), "Node %d has invalid child %d", parent, child);
                checkState(
                        isLeaf(child) || variable < dataGetVariable(metadata[child]),
                        "Node %d -> %d does not descend",
                        parent,
                        child);
                return 0;
            });
        }
        checkState(
                validCount == tableSize() - FIRST_NODE - freeNodeCount,
                "Invalid # of free nodes: #live=%d, size=%d, free=%d",
                validCount,
                tableSize(),
                freeNodeCount);
        return true;
    }

    public String getStatistics() {
        return String.format(
                "Node table statistics:%n"
                        + "Table size: %d (largest valid %d, largest referenced %d), %d created nodes, %d free%n"
                        + "Hash table: %d lookups, %d hits%n"
                        + "%d GC runs (%.2f s), %d freed, %d grows",
                tableSize(),
                biggestValidNode,
                biggestReferencedNode,
                createdNodes,
                freeNodeCount,
                hashChainLookups,
                hashChainLookupHits,
                garbageCollectionCount,
                garbageCollectionTime / 1000.0,
                garbageCollectedNodeCount,
                growCount);
    }
}
