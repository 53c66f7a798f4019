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
package exm.gotocc.common.lang;

/**
 * Position in the source program that an expression, statement or
 * instruction was derived from.
 */
public class SourceLocation {
  public static final SourceLocation NIL = new SourceLocation(null, 0, 0, null);

  private final String file;
  private final int line;
  private final int column;
  private final String function;

  public SourceLocation(String file, int line, int column, String function) {
    this.file = file;
    this.line = line;
    this.column = column;
    this.function = function;
  }

  public static SourceLocation create(String file, int line) {
    return new SourceLocation(file, line, 0, null);
  }

  public String file() {
    return file;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  /**
   * @return enclosing function, null if at file scope
   */
  public String function() {
    return function;
  }

  public boolean isNil() {
    return file == null && line == 0;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + line;
    result = prime * result + column;
    result = prime * result + ((function == null) ? 0 : function.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    SourceLocation other = (SourceLocation) obj;
    if (file == null) {
      if (other.file != null)
        return false;
    } else if (!file.equals(other.file)) {
      return false;
    }
    if (function == null) {
      if (other.function != null)
        return false;
    } else if (!function.equals(other.function)) {
      return false;
    }
    return line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    if (isNil()) {
      return "<no location>";
    }
    StringBuilder sb = new StringBuilder();
    sb.append(file == null ? "<unknown>" : file);
    sb.append(':');
    sb.append(line);
    if (column > 0) {
      sb.append(':');
      sb.append(column);
    }
    if (function != null) {
      sb.append(" (" + function + ")");
    }
    return sb.toString();
  }
}
