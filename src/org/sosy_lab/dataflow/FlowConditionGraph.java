// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.dataflow.solver.Solver;
import org.sosy_lab.dataflow.solver.Solver.Result;
import org.sosy_lab.dataflow.value.AtomicBoolValue;
import org.sosy_lab.dataflow.value.BoolValue;
import org.sosy_lab.dataflow.value.BoolValueFormatter;

/**
 * Tracks flow conditions symbolically. Each flow condition is identified by a token, a fresh
 * atomic boolean value, that is bound to the constraints of the flow condition. Conceptually the
 * binding is an "iff" {@code FC <=> (C1 & C2 & ...)}, where {@code FC} is the token and the
 * {@code Ci} are the constraints added to it.
 *
 * <p>A flow condition that was created by {@link #forkFlowCondition} or {@link
 * #joinFlowConditions} depends on the flow conditions it was created from, and its constraints
 * mention their tokens. Dependencies always point to tokens that existed before, so the
 * dependency graph is acyclic. Formulas are built from this graph on demand only.
 */
public class FlowConditionGraph {

  private final BoolValueManager boolValues;
  private final Solver solver;
  private final LogManager logger;

  // An edge FC -> D means that flow condition FC depends on flow condition D.
  private final MutableGraph<AtomicBoolValue> dependencies =
      GraphBuilder.directed().allowsSelfLoops(false).build();

  // Conjunction of all constraints added to a token. Tokens without constraints are absent.
  private final Map<AtomicBoolValue, BoolValue> constraints = new HashMap<>();

  public FlowConditionGraph(BoolValueManager pBoolValues, Solver pSolver, LogManager pLogger) {
    boolValues = checkNotNull(pBoolValues);
    solver = checkNotNull(pSolver);
    logger = checkNotNull(pLogger);
  }

  /**
   * Creates a fresh flow condition and returns its token. The token can be used to add
   * constraints to the flow condition, to fork it, to join it with another flow condition, or to
   * check implications.
   */
  public AtomicBoolValue makeFlowConditionToken() {
    AtomicBoolValue token = boolValues.createAtomicBoolValue();
    dependencies.addNode(token);
    return token;
  }

  /** Adds a constraint to the flow condition identified by the given token. */
  public void addFlowConditionConstraint(AtomicBoolValue pToken, BoolValue pConstraint) {
    checkToken(pToken);
    checkNotNull(pConstraint);
    constraints.merge(pToken, pConstraint, boolValues::getOrCreateConjunction);
  }

  /**
   * Creates a new flow condition with the same constraints as the flow condition identified by
   * the given token and returns its token. Constraints added to the new flow condition later on
   * do not affect the original one.
   */
  public AtomicBoolValue forkFlowCondition(AtomicBoolValue pToken) {
    checkToken(pToken);
    AtomicBoolValue forkToken = makeFlowConditionToken();
    dependencies.putEdge(forkToken, pToken);
    addFlowConditionConstraint(forkToken, pToken);
    logger.log(Level.ALL, "Forked flow condition", pToken, "into", forkToken);
    return forkToken;
  }

  /**
   * Creates a new flow condition that represents the disjunction of the flow conditions
   * identified by the given tokens and returns its token.
   */
  public AtomicBoolValue joinFlowConditions(
      AtomicBoolValue pFirstToken, AtomicBoolValue pSecondToken) {
    checkToken(pFirstToken);
    checkToken(pSecondToken);
    AtomicBoolValue joinToken = makeFlowConditionToken();
    dependencies.putEdge(joinToken, pFirstToken);
    dependencies.putEdge(joinToken, pSecondToken);
    addFlowConditionConstraint(
        joinToken, boolValues.getOrCreateDisjunction(pFirstToken, pSecondToken));
    logger.log(
        Level.ALL, "Joined flow conditions", pFirstToken, "and", pSecondToken, "into", joinToken);
    return joinToken;
  }

  /**
   * Returns true if and only if the constraints of the flow condition identified by the given
   * token imply that the given value is true. If the solver gives up, the result is false.
   */
  public boolean flowConditionImplies(AtomicBoolValue pToken, BoolValue pValue)
      throws InterruptedException {
    checkToken(pToken);
    // The flow condition implies the value iff FC & !Val is unsatisfiable.
    Set<BoolValue> query = new LinkedHashSet<>();
    query.add(pToken);
    query.add(boolValues.getOrCreateNegation(pValue));
    addTransitiveFlowConditionConstraints(pToken, query);
    return isUnsatisfiable(query);
  }

  /**
   * Returns true if and only if the constraints of the flow condition identified by the given
   * token are always true. If the solver gives up, the result is false.
   */
  public boolean flowConditionIsTautology(AtomicBoolValue pToken) throws InterruptedException {
    checkToken(pToken);
    // The flow condition is a tautology iff it can never be false.
    Set<BoolValue> query = new LinkedHashSet<>();
    query.add(boolValues.getOrCreateNegation(pToken));
    addTransitiveFlowConditionConstraints(pToken, query);
    return isUnsatisfiable(query);
  }

  /**
   * Builds the formula that defines the flow condition identified by the given token. Every value
   * that is a key of {@code pSubstitutions} is replaced by the value it maps to.
   *
   * <p>For example, with the flow conditions {@code FC1: C1}, {@code FC2: C2} and {@code FC3:
   * (FC1 | FC2) & C3}, building {@code FC3} with the substitution {@code C1 -> C1'} returns
   * {@code (C1' | C2) & C3}.
   *
   * @throws IllegalArgumentException if one of the boolean literals is to be substituted
   */
  public BoolValue buildAndSubstituteFlowCondition(
      AtomicBoolValue pToken, Map<? extends BoolValue, ? extends BoolValue> pSubstitutions) {
    checkToken(pToken);
    checkArgument(
        !pSubstitutions.containsKey(boolValues.getBoolLiteralValue(true))
            && !pSubstitutions.containsKey(boolValues.getBoolLiteralValue(false)),
        "Boolean literals must not be substituted");
    return new FlowConditionFormulaBuilder(this, boolValues, pSubstitutions).build(pToken);
  }

  public boolean containsToken(AtomicBoolValue pToken) {
    return dependencies.nodes().contains(pToken);
  }

  /** Returns the tokens of the flow conditions the given flow condition was created from. */
  public ImmutableSet<AtomicBoolValue> getDependencies(AtomicBoolValue pToken) {
    checkToken(pToken);
    return ImmutableSet.copyOf(dependencies.successors(pToken));
  }

  /** Returns the conjunction of the constraints of the given token, or null if it has none. */
  @Nullable BoolValue getConstraint(AtomicBoolValue pToken) {
    return constraints.get(pToken);
  }

  /**
   * Returns true if the solver proves that the given constraints, together with the meaning of
   * the boolean literals, cannot be satisfied.
   */
  boolean isUnsatisfiable(Set<BoolValue> pConstraints) throws InterruptedException {
    return querySolver(pConstraints) == Result.UNSATISFIABLE;
  }

  private Result querySolver(Set<BoolValue> pConstraints) throws InterruptedException {
    // The literals are plain atoms for the solver.
    pConstraints.add(boolValues.getBoolLiteralValue(true));
    pConstraints.add(boolValues.getOrCreateNegation(boolValues.getBoolLiteralValue(false)));
    if (logger.wouldBeLogged(Level.FINEST)) {
      BoolValueFormatter formatter =
          new BoolValueFormatter(
              Map.of(
                  boolValues.getBoolLiteralValue(true), "true",
                  boolValues.getBoolLiteralValue(false), "false"));
      for (BoolValue constraint : pConstraints) {
        logger.log(
            Level.FINEST, "Flow-condition query constraint:", formatter.toDebugString(constraint));
      }
    }

    Result result = solver.solve(pConstraints);
    if (result == Result.TIMED_OUT) {
      logger.log(Level.FINE, "Solver timed out on a flow-condition query, assuming no entailment");
    } else {
      logger.log(
          Level.FINER, "Flow-condition query with", pConstraints.size(), "constraints:", result);
    }
    return result;
  }

  /**
   * Adds the binding of every flow condition the given token transitively depends on, including
   * the token itself, to the given set.
   */
  private void addTransitiveFlowConditionConstraints(
      AtomicBoolValue pToken, Set<BoolValue> pQuery) {
    Set<AtomicBoolValue> visited = new HashSet<>();
    Deque<AtomicBoolValue> waitlist = new ArrayDeque<>();
    waitlist.push(pToken);
    while (!waitlist.isEmpty()) {
      AtomicBoolValue token = waitlist.pop();
      if (!visited.add(token)) {
        continue;
      }

      BoolValue constraint = constraints.get(token);
      if (constraint == null) {
        // Without constraints, the token is just assumed to hold.
        pQuery.add(token);
      } else {
        pQuery.add(boolValues.getOrCreateIff(token, constraint));
      }

      for (AtomicBoolValue dependency : dependencies.successors(token)) {
        if (!visited.contains(dependency)) {
          waitlist.push(dependency);
        }
      }
    }
  }

  private void checkToken(AtomicBoolValue pToken) {
    checkNotNull(pToken);
    checkArgument(containsToken(pToken), "%s is not a flow-condition token of this graph", pToken);
  }
}
