// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.solver;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import org.junit.Test;
import org.sosy_lab.dataflow.solver.Solver.Result;

public class StatisticsSolverTest {

  @Test
  public void testCountsResults() throws InterruptedException {
    Deque<Result> answers =
        new ArrayDeque<>(
            ImmutableSet.of(Result.SATISFIABLE, Result.UNSATISFIABLE, Result.TIMED_OUT));
    StatisticsSolver solver = new StatisticsSolver(constraints -> answers.pop());

    assertThat(solver.solve(ImmutableSet.of())).isEqualTo(Result.SATISFIABLE);
    assertThat(solver.solve(ImmutableSet.of())).isEqualTo(Result.UNSATISFIABLE);
    assertThat(solver.solve(ImmutableSet.of())).isEqualTo(Result.TIMED_OUT);

    assertThat(solver.getNumberOfQueries()).isEqualTo(3);
    assertThat(solver.getNumberOfQueries(Result.SATISFIABLE)).isEqualTo(1);
    assertThat(solver.getNumberOfQueries(Result.TIMED_OUT)).isEqualTo(1);
  }

  @Test
  public void testInterruptIsNotCounted() {
    StatisticsSolver solver =
        new StatisticsSolver(
            constraints -> {
              throw new InterruptedException();
            });

    assertThrows(InterruptedException.class, () -> solver.solve(ImmutableSet.of()));
    assertThat(solver.getNumberOfQueries()).isEqualTo(0);
  }

  @Test
  public void testPrintStatistics() throws InterruptedException {
    StatisticsSolver solver = new StatisticsSolver(constraints -> Result.UNSATISFIABLE);
    solver.solve(ImmutableSet.of());
    solver.solve(ImmutableSet.of());

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
      solver.printStatistics(out);
    }
    String statistics = bytes.toString(StandardCharsets.UTF_8);

    assertThat(statistics).contains("Number of flow-condition solver queries: 2");
    assertThat(statistics).contains("UNSATISFIABLE: 2");
    assertThat(statistics).contains("TIMED_OUT: 0");
  }
}
