// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders boolean values as s-expressions, e.g. {@code (and B0 (not B1))}, for debug output.
 *
 * <p>Atoms without a given name are called {@code B0}, {@code B1}, ... in the order in which the
 * formatter first meets them. A composite that occurs more than once inside the formatted value
 * is printed once as a definition {@code N0 := (and B0 B1)} in front of the value and referred to
 * as {@code N0} everywhere else, so the output grows linearly with the number of distinct
 * sub-values.
 */
public final class BoolValueFormatter {

  private final Map<AtomicBoolValue, String> atomNames;
  private int nextAtomIndex = 0;

  public BoolValueFormatter() {
    this(Map.of());
  }

  /**
   * @param pAtomNames fixed names for some atoms, e.g. for the two literals
   */
  public BoolValueFormatter(Map<AtomicBoolValue, String> pAtomNames) {
    atomNames = new HashMap<>(pAtomNames);
  }

  public static String format(BoolValue pValue) {
    return new BoolValueFormatter().toDebugString(pValue);
  }

  /**
   * Formats the given value. Atom names are remembered, so formatting several values with the
   * same formatter names shared atoms consistently. Names of shared composites are local to one
   * call.
   */
  public String toDebugString(BoolValue pValue) {
    Map<BoolValue, Integer> occurrences = new HashMap<>();
    countOccurrences(pValue, occurrences);

    ValuePrinter printer = new ValuePrinter(occurrences);
    StringBuilder sb = new StringBuilder();
    printer.append(pValue, sb);

    if (printer.definitions.isEmpty()) {
      return sb.toString();
    }
    StringBuilder result = new StringBuilder();
    for (String definition : printer.definitions) {
      result.append(definition).append("; ");
    }
    return result.append(sb).toString();
  }

  /** Counts for every composite how often it is referenced, visiting each of them once. */
  private static void countOccurrences(BoolValue pValue, Map<BoolValue, Integer> pOccurrences) {
    if (pValue.getKind() == Value.Kind.ATOMIC_BOOL) {
      return;
    }
    if (pOccurrences.merge(pValue, 1, Integer::sum) > 1) {
      return;
    }
    switch (pValue.getKind()) {
      case NEGATION:
        countOccurrences(((NegationValue) pValue).getSubValue(), pOccurrences);
        break;
      case CONJUNCTION:
        countOccurrences(((ConjunctionValue) pValue).getLeftSubValue(), pOccurrences);
        countOccurrences(((ConjunctionValue) pValue).getRightSubValue(), pOccurrences);
        break;
      case DISJUNCTION:
        countOccurrences(((DisjunctionValue) pValue).getLeftSubValue(), pOccurrences);
        countOccurrences(((DisjunctionValue) pValue).getRightSubValue(), pOccurrences);
        break;
      default:
        throw new AssertionError("Unhandled boolean value kind " + pValue.getKind());
    }
  }

  private String nameOf(AtomicBoolValue pAtom) {
    return atomNames.computeIfAbsent(pAtom, atom -> "B" + nextAtomIndex++);
  }

  /** State of a single {@link #toDebugString} call. */
  private final class ValuePrinter {

    private final Map<BoolValue, Integer> occurrences;
    private final Map<BoolValue, String> sharedNames = new HashMap<>();
    // in dependency order, every definition only mentions names defined before it
    private final List<String> definitions = new ArrayList<>();

    ValuePrinter(Map<BoolValue, Integer> pOccurrences) {
      occurrences = pOccurrences;
    }

    void append(BoolValue pValue, StringBuilder pOut) {
      if (pValue.getKind() == Value.Kind.ATOMIC_BOOL) {
        pOut.append(nameOf((AtomicBoolValue) pValue));
        return;
      }
      if (occurrences.get(pValue) < 2) {
        appendComposite(pValue, pOut);
        return;
      }

      String name = sharedNames.get(pValue);
      if (name == null) {
        StringBuilder definition = new StringBuilder();
        appendComposite(pValue, definition);
        name = "N" + definitions.size();
        definitions.add(name + " := " + definition);
        sharedNames.put(pValue, name);
      }
      pOut.append(name);
    }

    private void appendComposite(BoolValue pValue, StringBuilder pOut) {
      switch (pValue.getKind()) {
        case NEGATION:
          pOut.append("(not ");
          append(((NegationValue) pValue).getSubValue(), pOut);
          pOut.append(')');
          break;
        case CONJUNCTION:
          ConjunctionValue conjunction = (ConjunctionValue) pValue;
          appendBinary("and", conjunction.getLeftSubValue(), conjunction.getRightSubValue(), pOut);
          break;
        case DISJUNCTION:
          DisjunctionValue disjunction = (DisjunctionValue) pValue;
          appendBinary("or", disjunction.getLeftSubValue(), disjunction.getRightSubValue(), pOut);
          break;
        default:
          throw new AssertionError("Unhandled boolean value kind " + pValue.getKind());
      }
    }

    private void appendBinary(
        String pOperator, BoolValue pLeft, BoolValue pRight, StringBuilder pOut) {
      pOut.append('(').append(pOperator).append(' ');
      append(pLeft, pOut);
      pOut.append(' ');
      append(pRight, pOut);
      pOut.append(')');
    }
  }
}
