// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dataflow.ast.FieldDeclaration;

/** Models a value of a struct or class type, with one child value per modeled field. */
public final class StructValue extends Value {

  private final Map<FieldDeclaration, Value> children;

  public StructValue() {
    this(new HashMap<>());
  }

  public StructValue(Map<FieldDeclaration, Value> pChildren) {
    super(Kind.STRUCT);
    children = new HashMap<>(pChildren);
  }

  /** Returns the child value of the given field, or null if the field is not modeled. */
  public @Nullable Value getChild(FieldDeclaration pField) {
    return children.get(pField);
  }

  public void setChild(FieldDeclaration pField, Value pValue) {
    children.put(pField, pValue);
  }
}
