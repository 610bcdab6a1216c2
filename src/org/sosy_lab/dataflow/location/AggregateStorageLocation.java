// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.location;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.sosy_lab.dataflow.ast.FieldDeclaration;
import org.sosy_lab.dataflow.ast.Type;

/**
 * A storage location of a struct, class or union object. It has one child location per field;
 * the children are fixed when the location is created.
 */
public final class AggregateStorageLocation extends StorageLocation {

  private final ImmutableMap<FieldDeclaration, StorageLocation> children;

  public AggregateStorageLocation(Type pType, Map<FieldDeclaration, StorageLocation> pChildren) {
    super(Kind.AGGREGATE, pType);
    children = ImmutableMap.copyOf(pChildren);
  }

  /**
   * Returns the child location of the given field.
   *
   * @throws IllegalArgumentException if the object has no such field
   */
  public StorageLocation getChild(FieldDeclaration pField) {
    StorageLocation child = children.get(pField);
    checkArgument(child != null, "Field %s is not a member of %s", pField, getType());
    return child;
  }

  public ImmutableMap<FieldDeclaration, StorageLocation> getChildren() {
    return children;
  }

  @Override
  public String toString() {
    return "AggregateStorageLocation(" + getType() + ", " + children.size() + " fields)";
  }
}
