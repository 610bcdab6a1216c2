// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.dataflow.test.AstFixtures;
import org.sosy_lab.dataflow.value.AtomicBoolValue;
import org.sosy_lab.dataflow.value.BoolValue;
import org.sosy_lab.dataflow.value.ConjunctionValue;
import org.sosy_lab.dataflow.value.DisjunctionValue;
import org.sosy_lab.dataflow.value.NegationValue;
import org.sosy_lab.dataflow.value.Value;

public class BoolValueManagerTest {

  private StateArena arena;
  private BoolValueManager mgr;

  private AtomicBoolValue x;
  private AtomicBoolValue y;

  @Before
  public void setUp() {
    arena = new StateArena(AstFixtures.NO_FIELDS);
    mgr = new BoolValueManager(arena);
    x = mgr.createAtomicBoolValue();
    y = mgr.createAtomicBoolValue();
  }

  @Test
  public void testAtomicValuesAreDistinct() {
    assertThat(x).isNotSameInstanceAs(y);
    assertThat(x.getKind()).isEqualTo(Value.Kind.ATOMIC_BOOL);
    assertThat(arena.getValues()).containsAtLeast(x, y);
  }

  @Test
  public void testLiteralsAreSingletons() {
    AtomicBoolValue trueValue = mgr.getBoolLiteralValue(true);
    AtomicBoolValue falseValue = mgr.getBoolLiteralValue(false);
    int valuesBefore = arena.getNumberOfValues();

    assertThat(mgr.getBoolLiteralValue(true)).isSameInstanceAs(trueValue);
    assertThat(mgr.getBoolLiteralValue(false)).isSameInstanceAs(falseValue);
    assertThat(trueValue).isNotSameInstanceAs(falseValue);
    assertThat(arena.getNumberOfValues()).isEqualTo(valuesBefore);
  }

  @Test
  public void testLiteralsBelongToTheirManager() {
    BoolValueManager other = new BoolValueManager(new StateArena(AstFixtures.NO_FIELDS));
    assertThat(other.getBoolLiteralValue(true)).isNotSameInstanceAs(mgr.getBoolLiteralValue(true));
  }

  @Test
  public void testConjunctionIsHashConsedAndCommutative() {
    BoolValue xAndY = mgr.getOrCreateConjunction(x, y);

    assertThat(xAndY).isInstanceOf(ConjunctionValue.class);
    assertThat(((ConjunctionValue) xAndY).getLeftSubValue()).isSameInstanceAs(x);
    assertThat(((ConjunctionValue) xAndY).getRightSubValue()).isSameInstanceAs(y);
    assertThat(mgr.getOrCreateConjunction(x, y)).isSameInstanceAs(xAndY);
    assertThat(mgr.getOrCreateConjunction(y, x)).isSameInstanceAs(xAndY);
  }

  @Test
  public void testDisjunctionIsHashConsedAndCommutative() {
    BoolValue xOrY = mgr.getOrCreateDisjunction(x, y);

    assertThat(xOrY).isInstanceOf(DisjunctionValue.class);
    assertThat(mgr.getOrCreateDisjunction(y, x)).isSameInstanceAs(xOrY);
    assertThat(xOrY).isNotSameInstanceAs(mgr.getOrCreateConjunction(x, y));
  }

  @Test
  public void testSameOperandsCollapse() {
    assertThat(mgr.getOrCreateConjunction(x, x)).isSameInstanceAs(x);
    assertThat(mgr.getOrCreateDisjunction(x, x)).isSameInstanceAs(x);
  }

  @Test
  public void testNegationIsHashConsed() {
    BoolValue notX = mgr.getOrCreateNegation(x);

    assertThat(notX).isInstanceOf(NegationValue.class);
    assertThat(((NegationValue) notX).getSubValue()).isSameInstanceAs(x);
    assertThat(mgr.getOrCreateNegation(x)).isSameInstanceAs(notX);
    assertThat(mgr.getOrCreateNegation(y)).isNotSameInstanceAs(notX);
  }

  @Test
  public void testNoFoldingBeyondIdentity() {
    AtomicBoolValue trueValue = mgr.getBoolLiteralValue(true);

    assertThat(mgr.getOrCreateConjunction(x, trueValue)).isNotSameInstanceAs(x);
    BoolValue notNotX = mgr.getOrCreateNegation(mgr.getOrCreateNegation(x));
    assertThat(notNotX).isNotSameInstanceAs(x);
    assertThat(notNotX).isInstanceOf(NegationValue.class);
  }

  @Test
  public void testHashConsingDoesNotAllocateAgain() {
    mgr.getOrCreateConjunction(x, y);
    mgr.getOrCreateNegation(x);
    int valuesBefore = arena.getNumberOfValues();

    mgr.getOrCreateConjunction(y, x);
    mgr.getOrCreateNegation(x);
    mgr.getOrCreateConjunction(x, x);

    assertThat(arena.getNumberOfValues()).isEqualTo(valuesBefore);
  }

  @Test
  public void testImplicationOfSameValueIsTrue() {
    assertThat(mgr.getOrCreateImplication(x, x)).isSameInstanceAs(mgr.getBoolLiteralValue(true));
    BoolValue xAndY = mgr.getOrCreateConjunction(x, y);
    assertThat(mgr.getOrCreateImplication(xAndY, xAndY))
        .isSameInstanceAs(mgr.getBoolLiteralValue(true));
  }

  @Test
  public void testImplicationIsDerivedFromDisjunction() {
    BoolValue implication = mgr.getOrCreateImplication(x, y);

    assertThat(implication)
        .isSameInstanceAs(mgr.getOrCreateDisjunction(mgr.getOrCreateNegation(x), y));
    assertThat(mgr.getOrCreateImplication(x, y)).isSameInstanceAs(implication);
    assertThat(mgr.getOrCreateImplication(y, x)).isNotSameInstanceAs(implication);
  }

  @Test
  public void testIffIsDerivedAndOrderInsensitive() {
    BoolValue iff = mgr.getOrCreateIff(x, y);

    assertThat(iff)
        .isSameInstanceAs(
            mgr.getOrCreateConjunction(
                mgr.getOrCreateImplication(x, y), mgr.getOrCreateImplication(y, x)));
    assertThat(mgr.getOrCreateIff(y, x)).isSameInstanceAs(iff);
    assertThat(mgr.getOrCreateIff(x, x)).isSameInstanceAs(mgr.getBoolLiteralValue(true));
  }

  @Test
  public void testNullOperandsAreRejected() {
    assertThrows(NullPointerException.class, () -> mgr.getOrCreateConjunction(x, null));
    assertThrows(NullPointerException.class, () -> mgr.getOrCreateNegation(null));
  }

  @Test
  public void testEquivalenceOfIdenticalValues() {
    BoolValue formula = mgr.getOrCreateDisjunction(x, mgr.getOrCreateNegation(y));
    assertThat(mgr.equivalentBoolValues(formula, formula)).isTrue();
    assertThat(mgr.equivalentBoolValues(x, x)).isTrue();
  }

  @Test
  public void testDistinctAtomsAreNotEquivalent() {
    assertThat(mgr.equivalentBoolValues(x, y)).isFalse();
    assertThat(mgr.equivalentBoolValues(mgr.getOrCreateNegation(x), mgr.getOrCreateNegation(y)))
        .isFalse();
  }

  @Test
  public void testEquivalenceOfStructurallyEqualComposites() {
    // built outside of the manager, so hash-consing cannot make them identical
    BoolValue first =
        arena.takeOwnership(new ConjunctionValue(x, arena.takeOwnership(new NegationValue(y))));
    BoolValue second =
        arena.takeOwnership(new ConjunctionValue(arena.takeOwnership(new NegationValue(y)), x));

    assertThat(first).isNotSameInstanceAs(second);
    assertThat(mgr.equivalentBoolValues(first, second)).isTrue();
    assertThat(mgr.equivalentBoolValues(first, mgr.getOrCreateDisjunction(x, y))).isFalse();
  }

  @Test
  public void testEquivalenceIgnoresSemantics() {
    // x & y and y & x & x are logically equivalent, but differ structurally
    BoolValue xAndY = mgr.getOrCreateConjunction(x, y);
    BoolValue yAndXAndX = mgr.getOrCreateConjunction(mgr.getOrCreateConjunction(y, x), x);
    assertThat(mgr.equivalentBoolValues(xAndY, yAndXAndX)).isFalse();

    BoolValue notNotX = mgr.getOrCreateNegation(mgr.getOrCreateNegation(x));
    assertThat(mgr.equivalentBoolValues(notNotX, x)).isFalse();
  }
}
