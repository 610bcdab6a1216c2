// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

/** Models an integer whose concrete value is not tracked. */
public final class IntegerValue extends Value {

  public IntegerValue() {
    super(Kind.INTEGER);
  }
}
