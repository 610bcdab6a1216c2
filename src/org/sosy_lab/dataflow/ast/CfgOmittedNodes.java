// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.ast;

/**
 * Skips past AST nodes that the control-flow graph does not emit. These nodes are invisible to a
 * flow-sensitive analysis, so every lookup keyed by an expression has to go through this class,
 * otherwise two forms of the same expression end up with different storage locations.
 *
 * <ul>
 *   <li>{@link ParenExpression}: the CFG takes operator precedence into account, but otherwise
 *       omits the node.
 *   <li>{@link ExprWithCleanups}: the CFG generates the calls to destructors and then omits the
 *       node.
 * </ul>
 */
public final class CfgOmittedNodes {

  private CfgOmittedNodes() {}

  public static Expression ignoreCfgOmittedNodes(Expression pExpression) {
    Expression current = pExpression;
    if (current instanceof ExprWithCleanups) {
      current = ((ExprWithCleanups) current).getSubExpression();
    }
    while (current instanceof ParenExpression) {
      current = ((ParenExpression) current).getSubExpression();
    }
    return current;
  }

  public static Statement ignoreCfgOmittedNodes(Statement pStatement) {
    if (pStatement instanceof Expression) {
      return ignoreCfgOmittedNodes((Expression) pStatement);
    }
    return pStatement;
  }
}
