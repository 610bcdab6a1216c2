// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

import static com.google.common.base.Preconditions.checkNotNull;

/** Models a boolean disjunction of two sub-values. */
public final class DisjunctionValue extends BoolValue {

  private final BoolValue leftSubValue;
  private final BoolValue rightSubValue;

  public DisjunctionValue(BoolValue pLeftSubValue, BoolValue pRightSubValue) {
    super(Kind.DISJUNCTION);
    leftSubValue = checkNotNull(pLeftSubValue);
    rightSubValue = checkNotNull(pRightSubValue);
  }

  public BoolValue getLeftSubValue() {
    return leftSubValue;
  }

  public BoolValue getRightSubValue() {
    return rightSubValue;
  }
}
