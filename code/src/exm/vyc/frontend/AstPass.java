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

import org.apache.log4j.Logger;

import exm.vyc.ast.ModuleNode;
import exm.vyc.common.exceptions.UserException;

/**
 * A pass that rewrites a module tree in place
 */
public interface AstPass {
  public String getPassName();

  /**
   * @return the name of a boolean Settings key that controls whether this
   *        pass runs, or null if it always runs
   */
  public String getConfigEnabledKey();

  public void run(Logger logger, ModuleNode module) throws UserException;
}
