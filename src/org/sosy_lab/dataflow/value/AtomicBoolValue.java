// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

/**
 * An independent boolean variable. Atomic values model the two boolean literals as well as flow
 * condition tokens. Every instance is a distinct variable.
 */
public final class AtomicBoolValue extends BoolValue {

  public AtomicBoolValue() {
    super(Kind.ATOMIC_BOOL);
  }
}
