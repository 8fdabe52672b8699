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
package exm.lola.frontend;

import exm.lola.ast.SourceSpan;
import exm.lola.common.lang.StreamAccess;

/**
 * Edge of the stream graph: the expression of target reads source with
 * the given access.
 */
public class Reference {
  private final int id;
  private final int source;
  private final int target;
  private final StreamAccess access;
  private final SourceSpan span;

  Reference(int id, int source, int target, StreamAccess access,
            SourceSpan span) {
    this.id = id;
    this.source = source;
    this.target = target;
    this.access = access;
    this.span = span;
  }

  public int id() {
    return id;
  }

  /**
   * @return the stream being read
   */
  public int source() {
    return source;
  }

  /**
   * @return the stream whose expression contains the read
   */
  public int target() {
    return target;
  }

  public StreamAccess access() {
    return access;
  }

  public SourceSpan span() {
    return span;
  }

  @Override
  public String toString() {
    return "#" + source + " -" + access + "-> #" + target;
  }
}
