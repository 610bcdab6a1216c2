// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.solver;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Iterables;
import com.google.common.collect.MapMaker;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.dataflow.value.AtomicBoolValue;
import org.sosy_lab.dataflow.value.BoolValue;
import org.sosy_lab.dataflow.value.BoolValueFormatter;
import org.sosy_lab.dataflow.value.ConjunctionValue;
import org.sosy_lab.dataflow.value.DisjunctionValue;
import org.sosy_lab.dataflow.value.NegationValue;
import org.sosy_lab.java_smt.SolverContextFactory;
import org.sosy_lab.java_smt.api.BooleanFormula;
import org.sosy_lab.java_smt.api.BooleanFormulaManager;
import org.sosy_lab.java_smt.api.ProverEnvironment;
import org.sosy_lab.java_smt.api.SolverContext;
import org.sosy_lab.java_smt.api.SolverException;

/**
 * Answers satisfiability queries over boolean values with an SMT solver accessed through JavaSMT.
 * The backend is chosen with the JavaSMT option {@code solver.solver}.
 *
 * <p>Each atomic value becomes a boolean variable of its own. A {@link SolverException}, which
 * JavaSMT raises when the backend returns "unknown" or hits one of its resource limits, is
 * reported as {@link Result#TIMED_OUT}.
 */
@Options(prefix = "dataflow.solver")
public class JavaSmtSolver implements Solver, AutoCloseable {

  private static final String ATOM_PREFIX = "__dataflow_atom_";

  @Option(secure = true, description = "Log the constraints of every satisfiability query.")
  private boolean logQueries = false;

  private final LogManager logger;
  private final SolverContext context;
  private final BooleanFormulaManager bfmgr;

  // The variable of an atom must stay the same across queries. Keys are weak, so atoms of
  // contexts that are gone do not stay reachable through a solver shared between analyses.
  private final Map<AtomicBoolValue, BooleanFormula> atomVariables =
      new MapMaker().weakKeys().makeMap();
  private int nextAtomIndex = 0;

  private int translatedValues = 0;

  public JavaSmtSolver(Configuration pConfig, LogManager pLogger, SolverContext pContext)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = pLogger;
    context = pContext;
    bfmgr = pContext.getFormulaManager().getBooleanFormulaManager();
  }

  /** Creates a solver context for the backend configured in {@code pConfig} and wraps it. */
  public static JavaSmtSolver create(
      Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
      throws InvalidConfigurationException {
    SolverContext context =
        SolverContextFactory.createSolverContext(pConfig, pLogger, pShutdownNotifier);
    return new JavaSmtSolver(pConfig, pLogger, context);
  }

  @Override
  public Result solve(Set<BoolValue> pConstraints) throws InterruptedException {
    if (pConstraints.isEmpty()) {
      return Result.SATISFIABLE;
    }
    if (logQueries) {
      BoolValueFormatter formatter = new BoolValueFormatter();
      logger.log(
          Level.FINEST,
          "Satisfiability query:",
          Iterables.transform(pConstraints, formatter::toDebugString));
    }

    // Composite values are shared heavily, translate each of them only once per query.
    Map<BoolValue, BooleanFormula> translated = new HashMap<>();
    try (ProverEnvironment prover = context.newProverEnvironment()) {
      for (BoolValue constraint : pConstraints) {
        prover.addConstraint(toFormula(constraint, translated));
      }
      return prover.isUnsat() ? Result.UNSATISFIABLE : Result.SATISFIABLE;
    } catch (SolverException e) {
      logger.logDebugException(e, "Solver could not decide flow-condition query");
      return Result.TIMED_OUT;
    }
  }

  private BooleanFormula toFormula(BoolValue pValue, Map<BoolValue, BooleanFormula> pTranslated) {
    BooleanFormula formula = pTranslated.get(pValue);
    if (formula != null) {
      return formula;
    }
    translatedValues++;
    switch (pValue.getKind()) {
      case ATOMIC_BOOL:
        formula =
            atomVariables.computeIfAbsent(
                (AtomicBoolValue) pValue,
                atom -> bfmgr.makeVariable(ATOM_PREFIX + nextAtomIndex++));
        break;
      case NEGATION:
        formula = bfmgr.not(toFormula(((NegationValue) pValue).getSubValue(), pTranslated));
        break;
      case CONJUNCTION:
        ConjunctionValue conjunction = (ConjunctionValue) pValue;
        formula =
            bfmgr.and(
                toFormula(conjunction.getLeftSubValue(), pTranslated),
                toFormula(conjunction.getRightSubValue(), pTranslated));
        break;
      case DISJUNCTION:
        DisjunctionValue disjunction = (DisjunctionValue) pValue;
        formula =
            bfmgr.or(
                toFormula(disjunction.getLeftSubValue(), pTranslated),
                toFormula(disjunction.getRightSubValue(), pTranslated));
        break;
      default:
        throw new AssertionError("Unhandled boolean value kind " + pValue.getKind());
    }
    pTranslated.put(pValue, formula);
    return formula;
  }

  /** Returns how many values were translated into formulas, summed over all queries. */
  @VisibleForTesting
  int getNumberOfTranslatedValues() {
    return translatedValues;
  }

  @Override
  public void close() {
    context.close();
  }
}
