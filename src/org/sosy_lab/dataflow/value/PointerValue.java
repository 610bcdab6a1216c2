// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.dataflow.location.StorageLocation;

/** Models a symbolic pointer. */
public final class PointerValue extends Value {

  private final StorageLocation pointeeLocation;

  public PointerValue(StorageLocation pPointeeLocation) {
    super(Kind.POINTER);
    pointeeLocation = checkNotNull(pPointeeLocation);
  }

  public StorageLocation getPointeeLocation() {
    return pointeeLocation;
  }
}
