// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.dataflow.ast.Expression;
import org.sosy_lab.dataflow.ast.FieldEnumerator;
import org.sosy_lab.dataflow.ast.Type;
import org.sosy_lab.dataflow.ast.ValueDeclaration;
import org.sosy_lab.dataflow.ast.VariableDeclaration;
import org.sosy_lab.dataflow.location.StorageLocation;
import org.sosy_lab.dataflow.solver.Solver;
import org.sosy_lab.dataflow.value.AtomicBoolValue;
import org.sosy_lab.dataflow.value.BoolValue;
import org.sosy_lab.dataflow.value.PointerValue;
import org.sosy_lab.dataflow.value.Value;

/**
 * Owns the objects that make up the state of a program during one dataflow analysis run, and the
 * flow conditions collected along the way.
 *
 * <p>A context is not thread-safe. It belongs to the analysis that created it; analyses that run
 * in parallel need contexts of their own.
 */
public class DataflowAnalysisContext {

  private final StateArena arena;
  private final BoolValueManager boolValues;
  private final FlowConditionGraph flowConditions;

  /**
   * @param pSolver answers the satisfiability queries behind implication and tautology checks
   * @param pFieldEnumerator enumerates the fields of record types when storage locations for
   *     objects are created
   * @param pLogger used for logging
   */
  public DataflowAnalysisContext(
      Solver pSolver, FieldEnumerator pFieldEnumerator, LogManager pLogger) {
    checkNotNull(pSolver);
    arena = new StateArena(pFieldEnumerator);
    boolValues = new BoolValueManager(arena);
    flowConditions = new FlowConditionGraph(boolValues, pSolver, pLogger);
  }

  public StateArena getArena() {
    return arena;
  }

  public BoolValueManager getBoolValueManager() {
    return boolValues;
  }

  public FlowConditionGraph getFlowConditionGraph() {
    return flowConditions;
  }

  // State arena

  public <T extends StorageLocation> T takeOwnership(T pLocation) {
    return arena.takeOwnership(pLocation);
  }

  public <T extends Value> T takeOwnership(T pValue) {
    return arena.takeOwnership(pValue);
  }

  public StorageLocation getStableStorageLocation(@Nullable Type pType) {
    return arena.getStableStorageLocation(pType);
  }

  public StorageLocation getStableStorageLocation(VariableDeclaration pDecl) {
    return arena.getStableStorageLocation(pDecl);
  }

  public StorageLocation getStableStorageLocation(Expression pExpression) {
    return arena.getStableStorageLocation(pExpression);
  }

  public void setStorageLocation(ValueDeclaration pDecl, StorageLocation pLocation) {
    arena.setStorageLocation(pDecl, pLocation);
  }

  public @Nullable StorageLocation getStorageLocation(ValueDeclaration pDecl) {
    return arena.getStorageLocation(pDecl);
  }

  public void setStorageLocation(Expression pExpression, StorageLocation pLocation) {
    arena.setStorageLocation(pExpression, pLocation);
  }

  public @Nullable StorageLocation getStorageLocation(Expression pExpression) {
    return arena.getStorageLocation(pExpression);
  }

  public void setThisPointeeStorageLocation(StorageLocation pLocation) {
    arena.setThisPointeeStorageLocation(pLocation);
  }

  public @Nullable StorageLocation getThisPointeeStorageLocation() {
    return arena.getThisPointeeStorageLocation();
  }

  public PointerValue getOrCreateNullPointerValue(@Nullable Type pPointeeType) {
    return arena.getOrCreateNullPointerValue(pPointeeType);
  }

  // Boolean values

  public AtomicBoolValue getBoolLiteralValue(boolean pValue) {
    return boolValues.getBoolLiteralValue(pValue);
  }

  public AtomicBoolValue createAtomicBoolValue() {
    return boolValues.createAtomicBoolValue();
  }

  public BoolValue getOrCreateConjunction(BoolValue pLeft, BoolValue pRight) {
    return boolValues.getOrCreateConjunction(pLeft, pRight);
  }

  public BoolValue getOrCreateDisjunction(BoolValue pLeft, BoolValue pRight) {
    return boolValues.getOrCreateDisjunction(pLeft, pRight);
  }

  public BoolValue getOrCreateNegation(BoolValue pValue) {
    return boolValues.getOrCreateNegation(pValue);
  }

  public BoolValue getOrCreateImplication(BoolValue pLeft, BoolValue pRight) {
    return boolValues.getOrCreateImplication(pLeft, pRight);
  }

  public BoolValue getOrCreateIff(BoolValue pLeft, BoolValue pRight) {
    return boolValues.getOrCreateIff(pLeft, pRight);
  }

  /** See {@link BoolValueManager#equivalentBoolValues}. */
  public boolean equivalentBoolValues(BoolValue pFirst, BoolValue pSecond) {
    return boolValues.equivalentBoolValues(pFirst, pSecond);
  }

  /**
   * Returns true if the solver proves that both values are equivalent under every assignment.
   * Constraints imposed by flow conditions are not taken into account. If the solver gives up,
   * the result is false.
   */
  public boolean provablyEquivalentBoolValues(BoolValue pFirst, BoolValue pSecond)
      throws InterruptedException {
    Set<BoolValue> query = new LinkedHashSet<>();
    query.add(boolValues.getOrCreateNegation(boolValues.getOrCreateIff(pFirst, pSecond)));
    return flowConditions.isUnsatisfiable(query);
  }

  // Flow conditions

  public AtomicBoolValue makeFlowConditionToken() {
    return flowConditions.makeFlowConditionToken();
  }

  public void addFlowConditionConstraint(AtomicBoolValue pToken, BoolValue pConstraint) {
    flowConditions.addFlowConditionConstraint(pToken, pConstraint);
  }

  public AtomicBoolValue forkFlowCondition(AtomicBoolValue pToken) {
    return flowConditions.forkFlowCondition(pToken);
  }

  public AtomicBoolValue joinFlowConditions(
      AtomicBoolValue pFirstToken, AtomicBoolValue pSecondToken) {
    return flowConditions.joinFlowConditions(pFirstToken, pSecondToken);
  }

  public boolean flowConditionImplies(AtomicBoolValue pToken, BoolValue pValue)
      throws InterruptedException {
    return flowConditions.flowConditionImplies(pToken, pValue);
  }

  public boolean flowConditionIsTautology(AtomicBoolValue pToken) throws InterruptedException {
    return flowConditions.flowConditionIsTautology(pToken);
  }

  public BoolValue buildAndSubstituteFlowCondition(
      AtomicBoolValue pToken, Map<? extends BoolValue, ? extends BoolValue> pSubstitutions) {
    return flowConditions.buildAndSubstituteFlowCondition(pToken, pSubstitutions);
  }
}
