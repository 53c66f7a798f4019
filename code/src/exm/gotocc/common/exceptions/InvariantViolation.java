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
package exm.gotocc.common.exceptions;

import exm.gotocc.common.lang.SourceLocation;

/**
 * A malformed tree reached the lowering stage: wrong operand count,
 * non-boolean operand to a boolean operator and the like.  Never caught
 * inside the converter; the conversion of the current unit is abandoned.
 */
public class InvariantViolation extends GotoCCRuntimeError {

  private final SourceLocation location;

  public InvariantViolation(SourceLocation location, String message,
                            String diagnostic) {
    super(format(location, message, diagnostic));
    this.location = location;
  }

  public InvariantViolation(SourceLocation location, String message) {
    this(location, message, null);
  }

  /**
   * @return location of offending node, may be null
   */
  public SourceLocation getLocation() {
    return location;
  }

  private static String format(SourceLocation location, String message,
                               String diagnostic) {
    StringBuilder sb = new StringBuilder();
    if (location != null && !location.isNil()) {
      sb.append(location.toString());
      sb.append(": ");
    }
    sb.append(message);
    if (diagnostic != null) {
      sb.append("\n  ");
      sb.append(diagnostic);
    }
    return sb.toString();
  }

  private static final long serialVersionUID = 1L;
}
