// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.sosy_lab.dataflow.value.AtomicBoolValue;
import org.sosy_lab.dataflow.value.BoolValue;
import org.sosy_lab.dataflow.value.ConjunctionValue;
import org.sosy_lab.dataflow.value.DisjunctionValue;
import org.sosy_lab.dataflow.value.NegationValue;

/**
 * Builds the closed formula of a flow condition while substituting values. One instance serves
 * one request.
 *
 * <p>The formulas of the dependencies of a flow condition are built first and recorded as
 * substitutions for their tokens, which the constraints of the flow condition mention. All
 * intermediate results go into one cache keyed by value identity, so every value that is shared
 * in the dependency graph or inside a formula is rewritten exactly once.
 */
final class FlowConditionFormulaBuilder {

  private final FlowConditionGraph graph;
  private final BoolValueManager boolValues;

  private final Map<BoolValue, BoolValue> substitutionsCache;
  private final Set<AtomicBoolValue> visitedTokens = new HashSet<>();

  FlowConditionFormulaBuilder(
      FlowConditionGraph pGraph,
      BoolValueManager pBoolValues,
      Map<? extends BoolValue, ? extends BoolValue> pSubstitutions) {
    graph = pGraph;
    boolValues = pBoolValues;
    substitutionsCache = new HashMap<>(pSubstitutions);
  }

  BoolValue build(AtomicBoolValue pToken) {
    visitedTokens.add(pToken);
    BoolValue constraint = graph.getConstraint(pToken);
    if (constraint == null) {
      return boolValues.getBoolLiteralValue(true);
    }
    for (AtomicBoolValue dependency : graph.getDependencies(pToken)) {
      if (visitedTokens.add(dependency)) {
        substitutionsCache.put(dependency, build(dependency));
      }
    }
    return substitute(constraint);
  }

  private BoolValue substitute(BoolValue pValue) {
    BoolValue result = substitutionsCache.get(pValue);
    if (result != null) {
      return result;
    }

    switch (pValue.getKind()) {
      case ATOMIC_BOOL:
        result = pValue;
        break;
      case NEGATION:
        result = boolValues.getOrCreateNegation(substitute(((NegationValue) pValue).getSubValue()));
        break;
      case CONJUNCTION:
        ConjunctionValue conjunction = (ConjunctionValue) pValue;
        result =
            boolValues.getOrCreateConjunction(
                substitute(conjunction.getLeftSubValue()),
                substitute(conjunction.getRightSubValue()));
        break;
      case DISJUNCTION:
        DisjunctionValue disjunction = (DisjunctionValue) pValue;
        result =
            boolValues.getOrCreateDisjunction(
                substitute(disjunction.getLeftSubValue()),
                substitute(disjunction.getRightSubValue()));
        break;
      default:
        throw new AssertionError("Unhandled boolean value kind " + pValue.getKind());
    }
    substitutionsCache.put(pValue, result);
    return result;
  }
}
