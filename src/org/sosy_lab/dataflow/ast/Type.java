// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.ast;

/**
 * A type of the analyzed program, as seen by the host front end.
 *
 * <p>Implementations compare by semantic identity: two objects describing the same type through
 * the same spelling are {@link Object#equals(Object) equal}. Aliases (typedefs) are distinct
 * objects that share a {@link #getCanonicalType() canonical type}.
 */
public interface Type {

  /** Returns the type with all aliases resolved. */
  Type getCanonicalType();

  /** Returns true for struct, class and union types, whose values have fields. */
  boolean isRecordType();
}
