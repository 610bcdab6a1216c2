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

/** Models a dereferenced pointer, e.g. a C++ reference or the value of an lvalue expression. */
public final class ReferenceValue extends Value {

  private final StorageLocation referentLocation;

  public ReferenceValue(StorageLocation pReferentLocation) {
    super(Kind.REFERENCE);
    referentLocation = checkNotNull(pReferentLocation);
  }

  public StorageLocation getReferentLocation() {
    return referentLocation;
  }
}
