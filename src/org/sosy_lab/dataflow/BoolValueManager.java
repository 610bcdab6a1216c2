// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.HashMap;
import java.util.Map;
import org.sosy_lab.dataflow.value.AtomicBoolValue;
import org.sosy_lab.dataflow.value.BoolValue;
import org.sosy_lab.dataflow.value.ConjunctionValue;
import org.sosy_lab.dataflow.value.DisjunctionValue;
import org.sosy_lab.dataflow.value.NegationValue;

/**
 * Creates boolean values. Composite values are hash-consed: asking twice for the conjunction,
 * disjunction or negation of the same operands returns the same object, so formulas built over
 * and over while the analysis revisits a program point share their structure.
 *
 * <p>Operands are compared by identity. Beyond that, only {@code A & A = A} and {@code A | A = A}
 * are simplified; neither double negations nor operations on the literals are folded.
 */
public class BoolValueManager {

  private final StateArena arena;

  private final AtomicBoolValue trueValue;
  private final AtomicBoolValue falseValue;

  private final Map<OperandPair, ConjunctionValue> conjunctions = new HashMap<>();
  private final Map<OperandPair, DisjunctionValue> disjunctions = new HashMap<>();
  private final Map<BoolValue, NegationValue> negations = new HashMap<>();

  public BoolValueManager(StateArena pArena) {
    arena = checkNotNull(pArena);
    trueValue = createAtomicBoolValue();
    falseValue = createAtomicBoolValue();
  }

  /** Creates a fresh atomic value, distinct from every other value. */
  public AtomicBoolValue createAtomicBoolValue() {
    return arena.takeOwnership(new AtomicBoolValue());
  }

  /** Returns the atomic value that models the given boolean literal. */
  public AtomicBoolValue getBoolLiteralValue(boolean pValue) {
    return pValue ? trueValue : falseValue;
  }

  public BoolValue getOrCreateConjunction(BoolValue pLeft, BoolValue pRight) {
    checkNotNull(pLeft);
    checkNotNull(pRight);
    if (pLeft == pRight) {
      return pLeft;
    }
    return conjunctions.computeIfAbsent(
        new OperandPair(pLeft, pRight),
        key -> arena.takeOwnership(new ConjunctionValue(pLeft, pRight)));
  }

  public BoolValue getOrCreateDisjunction(BoolValue pLeft, BoolValue pRight) {
    checkNotNull(pLeft);
    checkNotNull(pRight);
    if (pLeft == pRight) {
      return pLeft;
    }
    return disjunctions.computeIfAbsent(
        new OperandPair(pLeft, pRight),
        key -> arena.takeOwnership(new DisjunctionValue(pLeft, pRight)));
  }

  public BoolValue getOrCreateNegation(BoolValue pValue) {
    checkNotNull(pValue);
    return negations.computeIfAbsent(pValue, key -> arena.takeOwnership(new NegationValue(key)));
  }

  /**
   * Returns {@code !pLeft | pRight}. If both arguments are the same value, the result is the true
   * literal.
   */
  public BoolValue getOrCreateImplication(BoolValue pLeft, BoolValue pRight) {
    if (pLeft == pRight) {
      return trueValue;
    }
    return getOrCreateDisjunction(getOrCreateNegation(pLeft), pRight);
  }

  /**
   * Returns {@code (pLeft => pRight) & (pRight => pLeft)}. The order of the arguments does not
   * matter. If both arguments are the same value, the result is the true literal.
   */
  public BoolValue getOrCreateIff(BoolValue pLeft, BoolValue pRight) {
    if (pLeft == pRight) {
      return trueValue;
    }
    return getOrCreateConjunction(
        getOrCreateImplication(pLeft, pRight), getOrCreateImplication(pRight, pLeft));
  }

  /**
   * Returns true if both values have the same structure: they are the same object, or composites
   * of the same kind whose operands are equivalent (in any order for conjunctions and
   * disjunctions). Distinct atoms are never equivalent. No solver and no flow condition is
   * consulted, so values that are equivalent only under the current path constraints are
   * reported as different.
   */
  public boolean equivalentBoolValues(BoolValue pFirst, BoolValue pSecond) {
    return new StructuralEquivalence().check(pFirst, pSecond);
  }

  /** Memoizes the pairs compared so far so that shared sub-values are compared once. */
  private static final class StructuralEquivalence {

    private final Map<OperandPair, Boolean> results = new HashMap<>();

    boolean check(BoolValue pFirst, BoolValue pSecond) {
      if (pFirst == pSecond) {
        return true;
      }
      if (pFirst.getKind() != pSecond.getKind()) {
        return false;
      }
      OperandPair key = new OperandPair(pFirst, pSecond);
      Boolean known = results.get(key);
      if (known != null) {
        return known;
      }
      boolean result;
      switch (pFirst.getKind()) {
        case ATOMIC_BOOL:
          result = false;
          break;
        case NEGATION:
          result =
              check(
                  ((NegationValue) pFirst).getSubValue(), ((NegationValue) pSecond).getSubValue());
          break;
        case CONJUNCTION:
          ConjunctionValue firstConjunction = (ConjunctionValue) pFirst;
          ConjunctionValue secondConjunction = (ConjunctionValue) pSecond;
          result =
              checkCommutative(
                  firstConjunction.getLeftSubValue(),
                  firstConjunction.getRightSubValue(),
                  secondConjunction.getLeftSubValue(),
                  secondConjunction.getRightSubValue());
          break;
        case DISJUNCTION:
          DisjunctionValue firstDisjunction = (DisjunctionValue) pFirst;
          DisjunctionValue secondDisjunction = (DisjunctionValue) pSecond;
          result =
              checkCommutative(
                  firstDisjunction.getLeftSubValue(),
                  firstDisjunction.getRightSubValue(),
                  secondDisjunction.getLeftSubValue(),
                  secondDisjunction.getRightSubValue());
          break;
        default:
          throw new AssertionError("Unhandled boolean value kind " + pFirst.getKind());
      }
      results.put(key, result);
      return result;
    }

    private boolean checkCommutative(
        BoolValue pLeft1, BoolValue pRight1, BoolValue pLeft2, BoolValue pRight2) {
      return (check(pLeft1, pLeft2) && check(pRight1, pRight2))
          || (check(pLeft1, pRight2) && check(pRight1, pLeft2));
    }
  }

  /**
   * Key of a commutative operation: equal to another key with the same operands in either order.
   * Operands are compared by identity.
   */
  private static final class OperandPair {

    private final BoolValue first;
    private final BoolValue second;

    OperandPair(BoolValue pFirst, BoolValue pSecond) {
      first = pFirst;
      second = pSecond;
    }

    @Override
    public boolean equals(Object pOther) {
      if (this == pOther) {
        return true;
      }
      if (!(pOther instanceof OperandPair)) {
        return false;
      }
      OperandPair other = (OperandPair) pOther;
      return (first == other.first && second == other.second)
          || (first == other.second && second == other.first);
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(first) + System.identityHashCode(second);
    }
  }
}
