// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dataflow.ast.CfgOmittedNodes;
import org.sosy_lab.dataflow.ast.Expression;
import org.sosy_lab.dataflow.ast.FieldDeclaration;
import org.sosy_lab.dataflow.ast.FieldEnumerator;
import org.sosy_lab.dataflow.ast.Type;
import org.sosy_lab.dataflow.ast.ValueDeclaration;
import org.sosy_lab.dataflow.ast.VariableDeclaration;
import org.sosy_lab.dataflow.location.AggregateStorageLocation;
import org.sosy_lab.dataflow.location.ScalarStorageLocation;
import org.sosy_lab.dataflow.location.StorageLocation;
import org.sosy_lab.dataflow.value.PointerValue;
import org.sosy_lab.dataflow.value.Value;

/**
 * Owns all storage locations and values created during one analysis run.
 *
 * <p>Entries are only ever appended, so every reference handed out stays valid as long as the
 * arena lives. The mappings from declarations and expressions to storage locations are global
 * (aggregated across all basic blocks) and write-once; they make sure that evaluating the same
 * basic block several times yields the same storage locations. Which locations are in scope at a
 * particular program point is not tracked here.
 */
public class StateArena {

  private final FieldEnumerator fieldEnumerator;

  private final List<StorageLocation> locations = new ArrayList<>();
  private final List<Value> values = new ArrayList<>();

  private final Map<Type, StorageLocation> typeToLoc = new HashMap<>();
  private final Map<ValueDeclaration, StorageLocation> declToLoc = new HashMap<>();
  private final Map<Expression, StorageLocation> exprToLoc = new HashMap<>();

  private @Nullable StorageLocation thisPointeeLoc = null;

  // Keyed by the canonical pointee type. The null key stands for the pointee of a type-erased
  // null pointer (nullptr_t).
  private final Map<@Nullable Type, PointerValue> nullPointerValues = new HashMap<>();

  public StateArena(FieldEnumerator pFieldEnumerator) {
    fieldEnumerator = checkNotNull(pFieldEnumerator);
  }

  /** Takes ownership of the given location and returns it. */
  public <T extends StorageLocation> T takeOwnership(T pLocation) {
    checkNotNull(pLocation, "Cannot take ownership of a null storage location");
    locations.add(pLocation);
    return pLocation;
  }

  /** Takes ownership of the given value and returns it. */
  public <T extends Value> T takeOwnership(T pValue) {
    checkNotNull(pValue, "Cannot take ownership of a null value");
    values.add(pValue);
    return pValue;
  }

  /**
   * Returns a stable storage location appropriate for the given type. Repeated calls with an
   * equal type return the same location.
   */
  public StorageLocation getStableStorageLocation(@Nullable Type pType) {
    StorageLocation loc = typeToLoc.get(pType);
    if (loc == null) {
      loc = createStorageLocation(pType);
      typeToLoc.put(pType, loc);
    }
    return loc;
  }

  /**
   * Returns the storage location of the given variable, creating and assigning a fresh one on
   * the first call.
   */
  public StorageLocation getStableStorageLocation(VariableDeclaration pDecl) {
    StorageLocation loc = getStorageLocation(pDecl);
    if (loc == null) {
      loc = createStorageLocation(pDecl.getType());
      setStorageLocation(pDecl, loc);
    }
    return loc;
  }

  /**
   * Returns the storage location of the given expression, creating and assigning a fresh one on
   * the first call. Expressions that differ only in nodes omitted by the CFG share a location.
   */
  public StorageLocation getStableStorageLocation(Expression pExpression) {
    StorageLocation loc = getStorageLocation(pExpression);
    if (loc == null) {
      loc = createStorageLocation(pExpression.getType());
      setStorageLocation(pExpression, loc);
    }
    return loc;
  }

  /**
   * Assigns the given location to the given declaration.
   *
   * @throws IllegalStateException if the declaration already has a storage location
   */
  public void setStorageLocation(ValueDeclaration pDecl, StorageLocation pLocation) {
    checkNotNull(pLocation);
    checkState(
        !declToLoc.containsKey(pDecl), "Declaration %s already has a storage location", pDecl);
    declToLoc.put(pDecl, pLocation);
  }

  /** Returns the storage location assigned to the given declaration, or null if there is none. */
  public @Nullable StorageLocation getStorageLocation(ValueDeclaration pDecl) {
    return declToLoc.get(pDecl);
  }

  /**
   * Assigns the given location to the given expression.
   *
   * @throws IllegalStateException if the expression already has a storage location
   */
  public void setStorageLocation(Expression pExpression, StorageLocation pLocation) {
    checkNotNull(pLocation);
    Expression canonical = CfgOmittedNodes.ignoreCfgOmittedNodes(pExpression);
    checkState(
        !exprToLoc.containsKey(canonical),
        "Expression %s already has a storage location",
        canonical);
    exprToLoc.put(canonical, pLocation);
  }

  /** Returns the storage location assigned to the given expression, or null if there is none. */
  public @Nullable StorageLocation getStorageLocation(Expression pExpression) {
    return exprToLoc.get(CfgOmittedNodes.ignoreCfgOmittedNodes(pExpression));
  }

  /**
   * Assigns the given location to the pointee of {@code this}.
   *
   * @throws IllegalStateException if the pointee already has a storage location
   */
  public void setThisPointeeStorageLocation(StorageLocation pLocation) {
    checkNotNull(pLocation);
    checkState(thisPointeeLoc == null, "The this pointee already has a storage location");
    thisPointeeLoc = pLocation;
  }

  public @Nullable StorageLocation getThisPointeeStorageLocation() {
    return thisPointeeLoc;
  }

  /**
   * Returns a pointer value that represents a null pointer. Calls with pointee types that are
   * canonically equivalent return the same value. A null pointee type models the pointee of
   * {@code std::nullptr_t}.
   */
  public PointerValue getOrCreateNullPointerValue(@Nullable Type pPointeeType) {
    Type canonicalPointeeType = pPointeeType == null ? null : pPointeeType.getCanonicalType();
    PointerValue nullPointer = nullPointerValues.get(canonicalPointeeType);
    if (nullPointer == null) {
      StorageLocation pointeeLoc = getStableStorageLocation(canonicalPointeeType);
      nullPointer = takeOwnership(new PointerValue(pointeeLoc));
      nullPointerValues.put(canonicalPointeeType, nullPointer);
    }
    return nullPointer;
  }

  public int getNumberOfLocations() {
    return locations.size();
  }

  public int getNumberOfValues() {
    return values.size();
  }

  public List<Value> getValues() {
    return Collections.unmodifiableList(values);
  }

  private StorageLocation createStorageLocation(@Nullable Type pType) {
    if (pType != null && pType.isRecordType()) {
      // TODO: fields are created eagerly; create them on first access instead, many analyses
      // only look at a few fields of large records.
      ImmutableMap.Builder<FieldDeclaration, StorageLocation> fieldLocs = ImmutableMap.builder();
      for (FieldDeclaration field : fieldEnumerator.getObjectFields(pType)) {
        fieldLocs.put(field, createStorageLocation(field.getType()));
      }
      return takeOwnership(new AggregateStorageLocation(pType, fieldLocs.buildOrThrow()));
    }
    return takeOwnership(new ScalarStorageLocation(pType));
  }
}
