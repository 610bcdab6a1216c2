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

/** A storage location that is not subdivided further for the purposes of the analysis. */
public final class ScalarStorageLocation extends StorageLocation {

  public ScalarStorageLocation(@Nullable Type pType) {
    super(Kind.SCALAR, pType);
  }

  @Override
  public String toString() {
    return "ScalarStorageLocation(" + getType() + ")";
  }
}
