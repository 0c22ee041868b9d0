/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.vyc.frontend;

import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import exm.vyc.ast.ConstantFolder;
import exm.vyc.ast.FoldResult;
import exm.vyc.ast.ModuleNode;
import exm.vyc.ast.Node;
import exm.vyc.ast.NodeKind;
import exm.vyc.common.Settings;
import exm.vyc.common.exceptions.UserException;

/**
 * Replace each constant expression in the module with its value.
 *
 * Expressions are visited outermost first, so a whole constant expression
 * is replaced in one step and its subexpressions are never visited.
 * Invalid constant operations, e.g. division by zero, are user errors.
 */
public class ConstantFoldPass implements AstPass {

  private static final Set<NodeKind> FOLDABLE = Sets.immutableEnumSet(
      NodeKind.UNARY_OP, NodeKind.BIN_OP, NodeKind.BOOL_OP, NodeKind.COMPARE,
      NodeKind.SUBSCRIPT);

  @Override
  public String getPassName() {
    return "Constant folding";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_CONSTANT_FOLD;
  }

  @Override
  public void run(Logger logger, ModuleNode module) throws UserException {
    ConstantFolder folder = ConstantFolder.fromSettings();
    List<Node> candidates = module.getDescendants(FOLDABLE,
                  ImmutableMap.<String, Object>of(), false, false);

    int folded = 0;
    for (Node expr: candidates) {
      if (expr.getRoot() != module) {
        // Part of an expression that was already replaced
        continue;
      }
      FoldResult result = folder.evaluate(expr);
      switch (result.getStatus()) {
        case FOLDED:
          Node literal = result.getValue();
          LogHelper.debug(expr.getSpan(), "Folded " +
                          expr.getDescription() + " to " + literal);
          module.replaceInTree(expr, literal);
          folded++;
          break;
        case INVALID_OPERATION:
          result.checkedGet();
          break;
        case NOT_CONSTANT:
          logger.trace("Not constant: " + expr.describe() + ": " +
                       result.getMessage());
          break;
      }
    }
    logger.debug("Folded " + folded + " constant expressions");
  }
}
