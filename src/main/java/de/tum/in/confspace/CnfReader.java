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

import de.tum.in.confspace.bdd.NodeTable;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Lenient reader for the DIMACS CNF format.
 *
 * <p>Lines starting with {@code c} or {@code %} are comments, except for {@code c order v1 v2 ...}
 * which suggests a (1-based) variable order. The header {@code p cnf <variables> <clauses>} is
 * optional. Clauses are whitespace separated literals terminated by {@code 0} and may span several
 * lines; the last clause may also be terminated by the end of the input. Problems which still allow
 * reading the formula (unparsable tokens, malformed header, empty clauses, ...) are recorded as
 * {@link CnfFormula#diagnostics() diagnostics}. Literals and header counts beyond
 * {@link NodeTable#MAXIMUM_VARIABLE} are skipped with a diagnostic.</p>
 */
public final class CnfReader {
    private static final Logger logger = Logger.getLogger(CnfReader.class.getName());
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String ORDER_COMMENT = "order";

    private CnfReader() {}

    public static CnfFormula read(Path path) throws IOException, InvalidFormatException {
        return read(path, false);
    }

    public static CnfFormula read(Path path, boolean strictVariableCount)
            throws IOException, InvalidFormatException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            CnfFormula formula = read(reader, strictVariableCount);
            logger.log(Level.FINE, "Read {0} from {1}", new Object[] {formula, path});
            return formula;
        }
    }

    public static CnfFormula read(BufferedReader reader) throws IOException, InvalidFormatException {
        return read(reader, false);
    }

    /**
     * Reads a formula.
     *
     * @param strictVariableCount
     *     If set and the header declares a positive variable count, that count is authoritative and
     *     literals beyond it are dropped. Otherwise the effective count is the maximum of the declared
     *     count and the largest literal magnitude.
     *
     * @throws InvalidFormatException
     *     If no variable count can be derived, i.e. neither the header nor any clause mentions a
     *     variable.
     */
    public static CnfFormula read(BufferedReader reader, boolean strictVariableCount)
            throws IOException, InvalidFormatException {
        ParseState state = new ParseState();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber += 1;
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            char first = stripped.charAt(0);
            if (first == 'c') {
                state.comment(stripped, lineNumber);
            } else if (first == '%') {
                continue;
            } else if (first == 'p') {
                state.header(stripped, lineNumber);
            } else {
                state.clauseLine(stripped, lineNumber);
            }
        }
        state.endOfInput(lineNumber);
        return state.finish(strictVariableCount);
    }

    private static final class ParseState {
        private final List<int[]> clauses = new ArrayList<>();
        private final List<String> diagnostics = new ArrayList<>();
        private int[] currentClause = new int[16];
        private int currentClauseSize = 0;
        private int currentClauseStartLine = 0;
        private int maximumVariable = 0;
        private int declaredVariables = 0;
        private int declaredClauses = 0;
        private boolean seenHeader = false;
        @Nullable
        private int[] suggestedOrder = null;
        private int suggestedOrderLine = 0;

        void comment(String line, int lineNumber) {
            String[] tokens = WHITESPACE.split(line);
            if (tokens.length < 2 || !"c".equals(tokens[0]) || !ORDER_COMMENT.equals(tokens[1])) {
                return;
            }
            if (suggestedOrder != null) {
                diagnostics.add(String.format("line %d: ignoring additional order comment", lineNumber));
                return;
            }
            int[] order = new int[tokens.length - 2];
            for (int i = 2; i < tokens.length; i++) {
                try {
                    order[i - 2] = Integer.parseInt(tokens[i]);
                } catch (NumberFormatException e) {
                    diagnostics.add(String.format(
                            "line %d: order comment has unparsable entry '%s', ignoring it", lineNumber, tokens[i]));
                    return;
                }
            }
            suggestedOrder = order;
            suggestedOrderLine = lineNumber;
        }

        void header(String line, int lineNumber) {
            String[] tokens = WHITESPACE.split(line);
            if (seenHeader) {
                diagnostics.add(String.format("line %d: ignoring additional header '%s'", lineNumber, line));
                return;
            }
            if (tokens.length != 4 || !"p".equals(tokens[0]) || !"cnf".equals(tokens[1])) {
                diagnostics.add(String.format("line %d: malformed header '%s'", lineNumber, line));
                return;
            }
            int variables;
            int clauseCount;
            try {
                variables = Integer.parseInt(tokens[2]);
                clauseCount = Integer.parseInt(tokens[3]);
            } catch (NumberFormatException e) {
                diagnostics.add(String.format("line %d: malformed header '%s'", lineNumber, line));
                return;
            }
            if (variables < 0 || clauseCount < 0) {
                diagnostics.add(String.format("line %d: negative counts in header '%s'", lineNumber, line));
                return;
            }
            if (variables > NodeTable.MAXIMUM_VARIABLE) {
                diagnostics.add(String.format(
                        "line %d: header declares %d variables, at most %d are supported, ignoring it",
                        lineNumber,
                        variables,
                        NodeTable.MAXIMUM_VARIABLE));
                return;
            }
            seenHeader = true;
            declaredVariables = variables;
            declaredClauses = clauseCount;
        }

        void clauseLine(String line, int lineNumber) {
            for (String token : WHITESPACE.split(line)) {
                int literal;
                try {
                    literal = Integer.parseInt(token);
                } catch (NumberFormatException e) {
                    diagnostics.add(String.format("line %d: skipping unparsable token '%s'", lineNumber, token));
                    continue;
                }
                if (literal == 0) {
                    endClause(lineNumber);
                } else if (literal == Integer.MIN_VALUE || Math.abs(literal) > NodeTable.MAXIMUM_VARIABLE) {
                    diagnostics.add(String.format("line %d: skipping literal %d out of range", lineNumber, literal));
                } else {
                    if (currentClauseSize == 0) {
                        currentClauseStartLine = lineNumber;
                    }
                    if (currentClauseSize == currentClause.length) {
                        currentClause = Arrays.copyOf(currentClause, currentClause.length * 2);
                    }
                    currentClause[currentClauseSize] = literal;
                    currentClauseSize += 1;
                    maximumVariable = Math.max(maximumVariable, Math.abs(literal));
                }
            }
        }

        void endOfInput(int lineNumber) {
            if (currentClauseSize > 0) {
                endClause(lineNumber);
            }
        }

        private void endClause(int lineNumber) {
            if (currentClauseSize == 0) {
                diagnostics.add(String.format("line %d: skipping empty clause", lineNumber));
                return;
            }
            clauses.add(Arrays.copyOf(currentClause, currentClauseSize));
            currentClauseSize = 0;
        }

        CnfFormula finish(boolean strictVariableCount) throws InvalidFormatException {
            int variableCount;
            List<int[]> acceptedClauses;
            if (strictVariableCount && declaredVariables > 0) {
                variableCount = declaredVariables;
                acceptedClauses = dropOutOfRangeLiterals(variableCount);
            } else {
                variableCount = Math.max(declaredVariables, maximumVariable);
                acceptedClauses = clauses;
                if (seenHeader && maximumVariable > declaredVariables) {
                    diagnostics.add(String.format(
                            "header declares %d variables, but clauses mention variable %d",
                            declaredVariables,
                            maximumVariable));
                }
            }
            if (variableCount == 0) {
                throw new InvalidFormatException("No variable count can be derived from the input");
            }
            if (seenHeader && declaredClauses != clauses.size()) {
                diagnostics.add(String.format(
                        "header declares %d clauses, but %d were read", declaredClauses, clauses.size()));
            }

            int[] occurrences = new int[variableCount];
            for (int[] clause : acceptedClauses) {
                for (int literal : clause) {
                    occurrences[Math.abs(literal) - 1] += 1;
                }
            }

            int[] order = suggestedOrder == null ? null : checkSuggestedOrder(suggestedOrder, variableCount);
            if (!diagnostics.isEmpty()) {
                logger.log(Level.WARNING, "Formula read with {0} diagnostics, first: {1}", new Object[] {
                    diagnostics.size(), diagnostics.get(0)
                });
            }
            return new CnfFormula(
                    variableCount,
                    declaredVariables,
                    declaredClauses,
                    acceptedClauses,
                    occurrences,
                    order,
                    diagnostics);
        }

        private List<int[]> dropOutOfRangeLiterals(int variableCount) {
            List<int[]> accepted = new ArrayList<>(clauses.size());
            for (int index = 0; index < clauses.size(); index++) {
                int[] clause = clauses.get(index);
                int[] kept = new int[clause.length];
                int size = 0;
                for (int literal : clause) {
                    if (Math.abs(literal) > variableCount) {
                        diagnostics.add(String.format(
                                "clause %d: dropping literal %d beyond declared variable count %d",
                                index + 1,
                                literal,
                                variableCount));
                    } else {
                        kept[size] = literal;
                        size += 1;
                    }
                }
                if (size == 0) {
                    diagnostics.add(String.format("clause %d: no literal left, skipping clause", index + 1));
                } else {
                    accepted.add(size == clause.length ? clause : Arrays.copyOf(kept, size));
                }
            }
            return accepted;
        }

        @Nullable
        private int[] checkSuggestedOrder(int[] oneBasedOrder, int variableCount) {
            if (oneBasedOrder.length != variableCount) {
                diagnostics.add(String.format(
                        "line %d: order comment lists %d variables instead of %d, ignoring it",
                        suggestedOrderLine,
                        oneBasedOrder.length,
                        variableCount));
                return null;
            }
            BitSet seen = new BitSet(variableCount);
            int[] order = new int[variableCount];
            for (int i = 0; i < variableCount; i++) {
                int variable = oneBasedOrder[i] - 1;
                if (variable < 0 || variable >= variableCount || seen.get(variable)) {
                    diagnostics.add(String.format(
                            "line %d: order comment is not a permutation (entry %d), ignoring it",
                            suggestedOrderLine,
                            oneBasedOrder[i]));
                    return null;
                }
                seen.set(variable);
                order[i] = variable;
            }
            return order;
        }
    }

    public static class InvalidFormatException extends Exception {
        private static final long serialVersionUID = 6127335418834069529L;

        public InvalidFormatException(String message) {
            super(message);
        }

        public InvalidFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
