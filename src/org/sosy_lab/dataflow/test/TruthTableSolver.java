// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.test;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.sosy_lab.dataflow.solver.Solver;
import org.sosy_lab.dataflow.value.AtomicBoolValue;
import org.sosy_lab.dataflow.value.BoolValue;
import org.sosy_lab.dataflow.value.ConjunctionValue;
import org.sosy_lab.dataflow.value.DisjunctionValue;
import org.sosy_lab.dataflow.value.NegationValue;

/**
 * A solver for tests that tries every assignment of the atoms in a query. Only usable for small
 * queries, but obviously correct.
 */
public class TruthTableSolver implements Solver {

  private static final int MAX_ATOMS = 20;

  private int numberOfQueries = 0;
  private Set<BoolValue> lastQuery = Set.of();

  @Override
  public Result solve(Set<BoolValue> pConstraints) {
    numberOfQueries++;
    lastQuery = Set.copyOf(pConstraints);

    Set<AtomicBoolValue> atomSet = new LinkedHashSet<>();
    Set<BoolValue> visited = new HashSet<>();
    for (BoolValue constraint : pConstraints) {
      collectAtoms(constraint, atomSet, visited);
    }
    List<AtomicBoolValue> atoms = new ArrayList<>(atomSet);
    checkArgument(atoms.size() <= MAX_ATOMS, "Query with %s atoms is too large", atoms.size());

    for (long bits = 0; bits < (1L << atoms.size()); bits++) {
      Map<AtomicBoolValue, Boolean> assignment = new HashMap<>();
      for (int i = 0; i < atoms.size(); i++) {
        assignment.put(atoms.get(i), ((bits >> i) & 1) == 1);
      }
      if (satisfies(pConstraints, assignment)) {
        return Result.SATISFIABLE;
      }
    }
    return Result.UNSATISFIABLE;
  }

  public int getNumberOfQueries() {
    return numberOfQueries;
  }

  public Set<BoolValue> getLastQuery() {
    return lastQuery;
  }

  private static boolean satisfies(
      Set<BoolValue> pConstraints, Map<AtomicBoolValue, Boolean> pAssignment) {
    Map<BoolValue, Boolean> memo = new HashMap<>();
    for (BoolValue constraint : pConstraints) {
      if (!evaluate(constraint, pAssignment, memo)) {
        return false;
      }
    }
    return true;
  }

  private static boolean evaluate(
      BoolValue pValue, Map<AtomicBoolValue, Boolean> pAssignment, Map<BoolValue, Boolean> pMemo) {
    Boolean known = pMemo.get(pValue);
    if (known != null) {
      return known;
    }
    boolean result;
    switch (pValue.getKind()) {
      case ATOMIC_BOOL:
        result = pAssignment.get(pValue);
        break;
      case NEGATION:
        result = !evaluate(((NegationValue) pValue).getSubValue(), pAssignment, pMemo);
        break;
      case CONJUNCTION:
        ConjunctionValue conjunction = (ConjunctionValue) pValue;
        result =
            evaluate(conjunction.getLeftSubValue(), pAssignment, pMemo)
                && evaluate(conjunction.getRightSubValue(), pAssignment, pMemo);
        break;
      case DISJUNCTION:
        DisjunctionValue disjunction = (DisjunctionValue) pValue;
        result =
            evaluate(disjunction.getLeftSubValue(), pAssignment, pMemo)
                || evaluate(disjunction.getRightSubValue(), pAssignment, pMemo);
        break;
      default:
        throw new AssertionError("Unhandled boolean value kind " + pValue.getKind());
    }
    pMemo.put(pValue, result);
    return result;
  }

  private static void collectAtoms(
      BoolValue pValue, Set<AtomicBoolValue> pAtoms, Set<BoolValue> pVisited) {
    if (!pVisited.add(pValue)) {
      return;
    }
    switch (pValue.getKind()) {
      case ATOMIC_BOOL:
        pAtoms.add((AtomicBoolValue) pValue);
        break;
      case NEGATION:
        collectAtoms(((NegationValue) pValue).getSubValue(), pAtoms, pVisited);
        break;
      case CONJUNCTION:
        collectAtoms(((ConjunctionValue) pValue).getLeftSubValue(), pAtoms, pVisited);
        collectAtoms(((ConjunctionValue) pValue).getRightSubValue(), pAtoms, pVisited);
        break;
      case DISJUNCTION:
        collectAtoms(((DisjunctionValue) pValue).getLeftSubValue(), pAtoms, pVisited);
        collectAtoms(((DisjunctionValue) pValue).getRightSubValue(), pAtoms, pVisited);
        break;
      default:
        throw new AssertionError("Unhandled boolean value kind " + pValue.getKind());
    }
  }
}
