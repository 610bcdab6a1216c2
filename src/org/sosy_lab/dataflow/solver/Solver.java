// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.solver;

import java.util.Set;
import org.sosy_lab.dataflow.value.BoolValue;

/**
 * An oracle that checks whether a set of boolean constraints can be satisfied at the same time.
 *
 * <p>Every atomic value in the constraints is an independent variable, including the atoms that
 * model the boolean literals; callers that rely on the literals have to constrain them explicitly.
 * Implementations keep no state between calls that influences the result.
 */
@FunctionalInterface
public interface Solver {

  enum Result {
    /** There is an assignment that satisfies all constraints. */
    SATISFIABLE,
    /** No assignment satisfies all constraints. */
    UNSATISFIABLE,
    /** The solver gave up before finding out. This is a normal outcome, not an error. */
    TIMED_OUT
  }

  /**
   * Checks the conjunction of the given constraints. An empty set is satisfiable.
   *
   * @throws InterruptedException if the analysis was asked to shut down during the query
   */
  Result solve(Set<BoolValue> pConstraints) throws InterruptedException;
}
