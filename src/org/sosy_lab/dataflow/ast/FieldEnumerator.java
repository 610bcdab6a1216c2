// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.ast;

import java.util.Set;

/** Supplied by the host front end to tell which fields an object of a record type has. */
@FunctionalInterface
public interface FieldEnumerator {

  /**
   * Returns all fields of the given record type, including the fields of its base classes.
   *
   * @param pType a type for which {@link Type#isRecordType()} holds
   */
  Set<FieldDeclaration> getObjectFields(Type pType);
}
