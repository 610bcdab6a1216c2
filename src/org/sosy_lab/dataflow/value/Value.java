// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class for all values computed by the analysis. Values are owned by the arena of a {@link
 * org.sosy_lab.dataflow.DataflowAnalysisContext} and compared by identity.
 *
 * <p>The hierarchy is closed: every subclass is listed in {@link Kind}, and code that dispatches
 * over values switches on {@link #getKind()}.
 */
public abstract class Value {

  public enum Kind {
    INTEGER,
    REFERENCE,
    POINTER,
    STRUCT,

    // Synthetic boolean values are either atomic values or composites that represent
    // conjunctions, disjunctions, and negations.
    ATOMIC_BOOL,
    CONJUNCTION,
    DISJUNCTION,
    NEGATION
  }

  private final Kind kind;

  // Analyses use properties to attach facts (e.g. "has_value") to a value without changing its
  // identity.
  private final Map<String, Value> properties = new HashMap<>();

  Value(Kind pKind) {
    kind = checkNotNull(pKind);
  }

  public Kind getKind() {
    return kind;
  }

  /** Returns the value of the property with the given name, or null if it was never set. */
  public @Nullable Value getProperty(String pName) {
    return properties.get(pName);
  }

  /** Assigns a value to the property with the given name, replacing any previous value. */
  public void setProperty(String pName, Value pValue) {
    properties.put(checkNotNull(pName), checkNotNull(pValue));
  }

  public Map<String, Value> getProperties() {
    return Collections.unmodifiableMap(properties);
  }
}
