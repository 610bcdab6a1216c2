// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.location;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dataflow.ast.Type;

/**
 * Base class for every storage location. A storage location is a symbolic address at which the
 * runtime value of a declaration or an expression lives. Locations are compared by identity.
 */
public abstract class StorageLocation {

  public enum Kind {
    SCALAR,
    AGGREGATE
  }

  private final Kind kind;
  private final @Nullable Type type;

  StorageLocation(Kind pKind, @Nullable Type pType) {
    kind = pKind;
    type = pType;
  }

  public Kind getKind() {
    return kind;
  }

  /** Returns the type of the stored value, or null for the pointee of a type-erased null. */
  public @Nullable Type getType() {
    return type;
  }
}
