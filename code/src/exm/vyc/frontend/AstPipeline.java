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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.vyc.ast.ModuleNode;
import exm.vyc.common.Settings;
import exm.vyc.common.exceptions.InvalidOptionException;
import exm.vyc.common.exceptions.UserException;
import exm.vyc.common.exceptions.VYCRuntimeError;

public class AstPipeline {

  private final List<AstPass> passes = new ArrayList<AstPass>();

  /**
   * @return pipeline with the standard rewriting passes
   */
  public static AstPipeline standard() {
    AstPipeline pipeline = new AstPipeline();
    pipeline.addPass(new ConstantFoldPass());
    return pipeline;
  }

  public void addPass(AstPass pass) {
    passes.add(pass);
  }

  public void runPipeline(Logger logger, ModuleNode module)
      throws UserException {
    for (AstPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        pass.run(logger, module);
      } else {
        logger.debug("Skipping disabled pass: " + pass.getPassName());
      }
    }
  }

  public boolean passEnabled(AstPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new VYCRuntimeError("Expected config key " +
                        pass.getConfigEnabledKey() + " to exist");
    }
  }
}
