// This file is part of CPAchecker,
// a tool for configurable software verification:
// https://cpachecker.sosy-lab.org
//
// SPDX-FileCopyrightText: 2021 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dataflow.ast;

/**
 * A full expression that needs temporaries to be destroyed afterwards. The control-flow graph
 * emits the destructor calls and then omits this node.
 */
public interface ExprWithCleanups extends Expression {

  Expression getSubExpression();
}
