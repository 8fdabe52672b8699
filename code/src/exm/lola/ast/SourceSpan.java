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
package exm.lola.ast;

/**
 * Simple immutable class to record a source range, as reported by the
 * parser.  Lines and columns start at 1.
 */
public class SourceSpan implements Comparable<SourceSpan> {
  public static final SourceSpan UNKNOWN =
      new SourceSpan("<unknown>", 0, 0, 0, 0);

  public final String file;
  public final int line;
  public final int col;
  public final int endLine;
  public final int endCol;

  public SourceSpan(String file, int line, int col, int endLine, int endCol) {
    this.file = file;
    this.line = line;
    this.col = col;
    this.endLine = endLine;
    this.endCol = endCol;
  }

  public SourceSpan(String file, int line, int col) {
    this(file, line, col, line, col);
  }

  public boolean isKnown() {
    return line > 0;
  }

  /**
   * Unknown spans sort after all known ones
   */
  @Override
  public int compareTo(SourceSpan o) {
    if (isKnown() != o.isKnown()) {
      return isKnown() ? -1 : 1;
    }
    int c = file.compareTo(o.file);
    if (c != 0) {
      return c;
    }
    c = Integer.compare(line, o.line);
    if (c != 0) {
      return c;
    }
    c = Integer.compare(col, o.col);
    if (c != 0) {
      return c;
    }
    c = Integer.compare(endLine, o.endLine);
    if (c != 0) {
      return c;
    }
    return Integer.compare(endCol, o.endCol);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourceSpan)) {
      return false;
    }
    return compareTo((SourceSpan) obj) == 0;
  }

  @Override
  public int hashCode() {
    return file.hashCode() * 31 + line * 17 + col * 7 + endLine * 3 + endCol;
  }

  @Override
  public String toString() {
    return file + ":" + line + ":" + col;
  }
}
