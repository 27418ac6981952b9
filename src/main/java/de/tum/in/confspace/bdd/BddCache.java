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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Lossy operation caches of a {@link BddImpl}. Each cache is a direct-mapped array indexed by the
 * hash of the operands; a colliding put simply overwrites the previous entry.
 *
 * <p>Lookups follow a two-step protocol: a {@code lookupX} call computes and remembers the hash
 * (available via {@link #lookupHash()}) and, on a hit, the result (via {@link #lookupResult()}).
 * The recursive operation then passes the hash back to the matching {@code putX} call.</p>
 */
@SuppressWarnings("PMD.TooManyFields")
final class BddCache {
    private static final Logger logger = Logger.getLogger(BddCache.class.getName());

    private static final byte NOT_AN_OPERATION = 0;
    private static final byte BINARY_OPERATION_AND = 1;
    private static final byte BINARY_OPERATION_OR = 2;

    private static final int[] EMPTY_INT_ARRAY = new int[0];
    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];
    private static final BigInteger[] EMPTY_BIGINT_ARRAY = new BigInteger[0];

    private final NodeTable associatedBdd;
    private final int placeholder;
    private final BddConfiguration configuration;
    private final CacheStatistics binaryStatistics = new CacheStatistics();
    private final CacheStatistics negationStatistics = new CacheStatistics();
    private final CacheStatistics restrictStatistics = new CacheStatistics();
    private final CacheStatistics quantificationStatistics = new CacheStatistics();
    private final CacheStatistics satisfactionStatistics = new CacheStatistics();

    private int negationKeyCount = 0;
    private int[] negationCache = EMPTY_INT_ARRAY;

    private int binaryKeyCount = 0;
    private byte[] binaryOp = EMPTY_BYTE_ARRAY;
    private int[] binaryCache = EMPTY_INT_ARRAY;

    /* Entries: node, literal (2 * variable + value), result */
    private int restrictKeyCount = 0;
    private int[] restrictCache = EMPTY_INT_ARRAY;

    private BitSet quantificationSet = new BitSet();
    private int quantificationKeyCount = 0;
    private int[] quantificationCache = EMPTY_INT_ARRAY;

    private int satisfactionKeyCount = 0;
    private int[] satisfactionKey = EMPTY_INT_ARRAY;
    private BigInteger[] satisfactionResult = EMPTY_BIGINT_ARRAY;

    private int lookupHash = -1;
    private int lookupResult;

    BddCache(NodeTable associatedBdd, BddConfiguration configuration) {
        this.associatedBdd = associatedBdd;
        this.placeholder = associatedBdd.placeholder();
        this.configuration = configuration;
        this.lookupResult = placeholder;

        reallocateNegation();
        reallocateBinary();
        reallocateRestrict();
        reallocateQuantification();
        reallocateSatisfaction();
    }

    private static int mod(int value, int modulus) {
        int val = value % modulus;
        return val < 0 ? val + modulus : val;
    }

    private int keyCount(int divider) {
        return Primes.nextPrime(Math.max(associatedBdd.tableSize() / divider, 1));
    }

    boolean binarySymmetricWellOrdered(int node1, int node2) {
        int node1var = associatedBdd.variableOf(node1);
        int node2var = associatedBdd.variableOf(node2);
        return node1var < node2var || (node1var == node2var && node1 < node2);
    }

    int lookupHash() {
        return lookupHash;
    }

    int lookupResult() {
        return lookupResult;
    }

    void invalidate() {
        logger.log(Level.FINER, "Invalidating caches");
        negationStatistics.invalidation();
        reallocateNegation();
        binaryStatistics.invalidation();
        reallocateBinary();
        restrictStatistics.invalidation();
        reallocateRestrict();
        quantificationStatistics.invalidation();
        reallocateQuantification();
        satisfactionStatistics.invalidation();
        reallocateSatisfaction();
    }

    void variablesChanged() {
        satisfactionStatistics.invalidation();
        reallocateSatisfaction();
        quantificationStatistics.invalidation();
        reallocateQuantification();
    }

    // Negation

    boolean lookupNot(int inputNode) {
        assert associatedBdd.isNodeValid(inputNode);
        int hash = HashUtil.hash(inputNode);
        lookupHash = hash;
        int binStart = 2 * mod(hash, negationKeyCount);
        if (negationCache[binStart] == inputNode) {
            lookupResult = negationCache[binStart + 1];
            negationStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putNot(int hash, int inputNode, int resultNode) {
        assert associatedBdd.isNodeValid(inputNode) && associatedBdd.isNodeValidOrLeaf(resultNode);
        negationStatistics.put();
        int binStart = 2 * mod(hash, negationKeyCount);
        negationCache[binStart] = inputNode;
        negationCache[binStart + 1] = resultNode;
    }

    // Binary operations

    boolean lookupAnd(int inputNode1, int inputNode2) {
        assert binarySymmetricWellOrdered(inputNode1, inputNode2);
        return binaryLookup(BINARY_OPERATION_AND, inputNode1, inputNode2);
    }

    boolean lookupOr(int inputNode1, int inputNode2) {
        assert binarySymmetricWellOrdered(inputNode1, inputNode2);
        return binaryLookup(BINARY_OPERATION_OR, inputNode1, inputNode2);
    }

    void putAnd(int hash, int inputNode1, int inputNode2, int resultNode) {
        binaryPut(BINARY_OPERATION_AND, hash, inputNode1, inputNode2, resultNode);
    }

    void putOr(int hash, int inputNode1, int inputNode2, int resultNode) {
        binaryPut(BINARY_OPERATION_OR, hash, inputNode1, inputNode2, resultNode);
    }

    private boolean binaryLookup(byte operationId, int inputNode1, int inputNode2) {
        assert associatedBdd.isNodeValid(inputNode1) && associatedBdd.isNodeValid(inputNode2);
        int hash = HashUtil.hash(operationId, inputNode1, inputNode2);
        lookupHash = hash;
        int cachePosition = mod(hash, binaryKeyCount);
        int binStart = 3 * cachePosition;
        if (binaryOp[cachePosition] == operationId
                && binaryCache[binStart] == inputNode1
                && binaryCache[binStart + 1] == inputNode2) {
            lookupResult = binaryCache[binStart + 2];
            binaryStatistics.cacheHit();
            return true;
        }
        return false;
    }

    private void binaryPut(byte operationId, int hash, int inputNode1, int inputNode2, int resultNode) {
        assert associatedBdd.isNodeValidOrLeaf(resultNode);
        assert hash == HashUtil.hash(operationId, inputNode1, inputNode2);
        binaryStatistics.put();
        int cachePosition = mod(hash, binaryKeyCount);
        int binStart = 3 * cachePosition;
        binaryOp[cachePosition] = operationId;
        binaryCache[binStart] = inputNode1;
        binaryCache[binStart + 1] = inputNode2;
        binaryCache[binStart + 2] = resultNode;
    }

    // Restriction to a single literal

    boolean lookupRestrict(int inputNode, int literal) {
        assert associatedBdd.isNodeValid(inputNode) && literal >= 0;
        int hash = HashUtil.hash(literal, inputNode);
        lookupHash = hash;
        int binStart = 3 * mod(hash, restrictKeyCount);
        if (restrictCache[binStart] == inputNode && restrictCache[binStart + 1] == literal) {
            lookupResult = restrictCache[binStart + 2];
            restrictStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putRestrict(int hash, int inputNode, int literal, int resultNode) {
        assert associatedBdd.isNodeValid(inputNode) && associatedBdd.isNodeValidOrLeaf(resultNode);
        restrictStatistics.put();
        int binStart = 3 * mod(hash, restrictKeyCount);
        restrictCache[binStart] = inputNode;
        restrictCache[binStart + 1] = literal;
        restrictCache[binStart + 2] = resultNode;
    }

    // Existential quantification

    void initExists(BitSet quantificationSet) {
        if (Objects.equals(this.quantificationSet, quantificationSet)) {
            return;
        }
        this.quantificationSet = (BitSet) quantificationSet.clone();
        quantificationStatistics.invalidation();
        for (int i = 0; i < quantificationCache.length; i += 2) {
            quantificationCache[i] = placeholder;
        }
    }

    boolean lookupExists(int inputNode) {
        assert associatedBdd.isNodeValid(inputNode);
        int hash = HashUtil.hash(inputNode);
        lookupHash = hash;
        int binStart = 2 * mod(hash, quantificationKeyCount);
        if (quantificationCache[binStart] == inputNode) {
            lookupResult = quantificationCache[binStart + 1];
            quantificationStatistics.cacheHit();
            return true;
        }
        return false;
    }

    void putExists(int hash, int inputNode, int resultNode) {
        assert associatedBdd.isNodeValid(inputNode) && associatedBdd.isNodeValidOrLeaf(resultNode);
        quantificationStatistics.put();
        int binStart = 2 * mod(hash, quantificationKeyCount);
        quantificationCache[binStart] = inputNode;
        quantificationCache[binStart + 1] = resultNode;
    }

    // Model counting

    @Nullable
    BigInteger lookupSatisfaction(int node) {
        assert associatedBdd.isNodeValid(node);
        int hash = HashUtil.hash(node);
        lookupHash = hash;
        int cachePosition = mod(hash, satisfactionKeyCount);
        if (satisfactionKey[cachePosition] == node) {
            satisfactionStatistics.cacheHit();
            return satisfactionResult[cachePosition];
        }
        return null;
    }

    void putSatisfaction(int hash, int node, BigInteger satisfactionCount) {
        assert associatedBdd.isNodeValid(node);
        satisfactionStatistics.put();
        int cachePosition = mod(hash, satisfactionKeyCount);
        satisfactionKey[cachePosition] = node;
        satisfactionResult[cachePosition] = satisfactionCount;
    }

    // Allocation

    private void reallocateNegation() {
        negationKeyCount = keyCount(configuration.cacheNegationDivider());
        negationCache = new int[negationKeyCount * 2];
        if (placeholder != 0) {
            for (int i = 0; i < negationCache.length; i += 2) {
                negationCache[i] = placeholder;
            }
        }
    }

    private void reallocateBinary() {
        binaryKeyCount = keyCount(configuration.cacheBinaryDivider());
        binaryOp = new byte[binaryKeyCount];
        binaryCache = new int[binaryKeyCount * 3];
        Arrays.fill(binaryOp, NOT_AN_OPERATION);
    }

    private void reallocateRestrict() {
        restrictKeyCount = keyCount(configuration.cacheRestrictDivider());
        restrictCache = new int[restrictKeyCount * 3];
        if (placeholder != 0) {
            for (int i = 0; i < restrictCache.length; i += 3) {
                restrictCache[i] = placeholder;
            }
        }
    }

    private void reallocateQuantification() {
        quantificationKeyCount = keyCount(configuration.cacheQuantificationDivider());
        quantificationCache = new int[quantificationKeyCount * 2];
        if (placeholder != 0) {
            for (int i = 0; i < quantificationCache.length; i += 2) {
                quantificationCache[i] = placeholder;
            }
        }
    }

    private void reallocateSatisfaction() {
        satisfactionKeyCount = keyCount(configuration.cacheSatisfactionDivider());
        satisfactionKey = new int[satisfactionKeyCount];
        satisfactionResult = new BigInteger[satisfactionKeyCount];
        if (placeholder != 0) {
            Arrays.fill(satisfactionKey, placeholder);
        }
    }

    String getStatistics() {
        return String.format(
                "Negation: size %d%n %s%nBinary: size %d%n %s%nRestrict: size %d%n %s%n"
                        + "Quantification: size %d%n %s%nSatisfaction: size %d%n %s",
                negationKeyCount,
                negationStatistics,
                binaryKeyCount,
                binaryStatistics,
                restrictKeyCount,
                restrictStatistics,
                quantificationKeyCount,
                quantificationStatistics,
                satisfactionKeyCount,
                satisfactionStatistics);
    }

    private static final class CacheStatistics {
        private int hitCount = 0;
        private int hitCountSinceInvalidation = 0;
        private int putCount = 0;
        private int putCountSinceInvalidation = 0;
        private int invalidationCount = 0;

        void cacheHit() {
            hitCount += 1;
            hitCountSinceInvalidation += 1;
        }

        void put() {
            putCount += 1;
            putCountSinceInvalidation += 1;
        }

        void invalidation() {
            invalidationCount += 1;
            hitCountSinceInvalidation = 0;
            putCountSinceInvalidation = 0;
        }

        @Override
        public String toString() {
            float hitToPutRatio = (float) hitCount / (float) Math.max(putCount, 1);
            return String.format(
                    "Hits: %d (%d), puts: %d (%d), hit/put: %.2f, invalidations: %d",
                    hitCount,
                    hitCountSinceInvalidation,
                    putCount,
                    putCountSinceInvalidation,
                    hitToPutRatio,
                    invalidationCount);
        }
    }
}
