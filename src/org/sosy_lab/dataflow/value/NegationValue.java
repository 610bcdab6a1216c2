// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

import static com.google.common.base.Preconditions.checkNotNull;

/** Models a boolean negation of a sub-value. */
public final class NegationValue extends BoolValue {

  private final BoolValue subValue;

  public NegationValue(BoolValue pSubValue) {
    super(Kind.NEGATION);
    subValue = checkNotNull(pSubValue);
  }

  public BoolValue getSubValue() {
    return subValue;
  }
}
