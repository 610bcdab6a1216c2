// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

/** Base class for all boolean values, atomic as well as composite. */
public abstract class BoolValue extends Value {

  BoolValue(Kind pKind) {
    super(pKind);
  }

  @Override
  public String toString() {
    return getKind() + "@" + Integer.toHexString(System.identityHashCode(this));
  }
}
