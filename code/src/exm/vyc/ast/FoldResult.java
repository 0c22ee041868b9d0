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
package exm.vyc.ast;

import exm.vyc.common.exceptions.FoldException;
import exm.vyc.common.exceptions.InvalidConstantOperationException;
import exm.vyc.common.exceptions.NotConstantException;

/**
 * Outcome of trying to fold a node to a literal.  Failing to fold is a
 * common, expected outcome, so it is returned rather than thrown.
 */
public class FoldResult {

  public static enum Status {
    FOLDED,
    /** Depends on something only known at run time */
    NOT_CONSTANT,
    /** Constant, but the operation is undefined for its operands */
    INVALID_OPERATION,
  }

  private final Status status;
  private final Node value;
  private final FoldException failure;

  private FoldResult(Status status, Node value, FoldException failure) {
    this.status = status;
    this.value = value;
    this.failure = failure;
  }

  static FoldResult folded(Node literal) {
    return new FoldResult(Status.FOLDED, literal, null);
  }

  static FoldResult failed(FoldException e) {
    if (e instanceof NotConstantException) {
      return new FoldResult(Status.NOT_CONSTANT, null, e);
    } else {
      assert(e instanceof InvalidConstantOperationException);
      return new FoldResult(Status.INVALID_OPERATION, null, e);
    }
  }

  public Status getStatus() {
    return status;
  }

  public boolean isFolded() {
    return status == Status.FOLDED;
  }

  /**
   * @return detached literal node, or null if not folded
   */
  public Node getValue() {
    return value;
  }

  /**
   * @return reason for failure, or null if folded
   */
  public String getMessage() {
    return failure == null ? null : failure.getMessage();
  }

  /**
   * For callers that treat failure to fold as an error
   * @return the folded literal
   * @throws FoldException if not folded
   */
  public Node checkedGet() throws FoldException {
    if (failure != null) {
      throw failure;
    }
    return value;
  }

  /**
   * Fresh copy whose value can be attached to a tree
   */
  FoldResult copy() {
    if (value == null) {
      return this;
    }
    return folded(value.copy());
  }

  @Override
  public String toString() {
    if (isFolded()) {
      return status + ": " + value;
    }
    return status + ": " + failure.getMessage();
  }
}
