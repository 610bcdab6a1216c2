// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;
import java.io.PrintStream;
import java.util.Set;
import org.sosy_lab.common.time.Timer;
import org.sosy_lab.dataflow.value.BoolValue;

/** Wraps a solver and records how many queries it answered, with which outcome, in what time. */
public class StatisticsSolver implements Solver {

  private final Solver delegate;

  private final Timer solverTime = new Timer();
  private final Multiset<Result> results = EnumMultiset.create(Result.class);

  public StatisticsSolver(Solver pDelegate) {
    delegate = checkNotNull(pDelegate);
  }

  @Override
  public Result solve(Set<BoolValue> pConstraints) throws InterruptedException {
    solverTime.start();
    try {
      Result result = delegate.solve(pConstraints);
      results.add(result);
      return result;
    } finally {
      solverTime.stop();
    }
  }

  public int getNumberOfQueries() {
    return results.size();
  }

  public int getNumberOfQueries(Result pResult) {
    return results.count(pResult);
  }

  public void printStatistics(PrintStream pOut) {
    pOut.println("Number of flow-condition solver queries: " + results.size());
    for (Result result : Result.values()) {
      pOut.println("  " + result + ": " + results.count(result));
    }
    pOut.println("Time for flow-condition solver queries: " + solverTime.getSumTime());
  }
}
