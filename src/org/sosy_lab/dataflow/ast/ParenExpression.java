// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.ast;

/**
 * A parenthesized expression. The control-flow graph respects the precedence the parentheses
 * express but does not contain a node for them.
 */
public interface ParenExpression extends Expression {

  Expression getSubExpression();
}
