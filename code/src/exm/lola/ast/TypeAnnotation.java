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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Type as written: a name with optional unit and type parameters,
 * e.g. <code>Float64[m/s]</code>, <code>Option&lt;Int8&gt;</code> or a
 * tuple <code>(Bool, String)</code>.
 */
public class TypeAnnotation {
  public static final String OPTION = "Option";
  public static final String TUPLE = "Tuple";

  private final String name;
  private final String unit;
  private final List<TypeAnnotation> params;
  private final SourceSpan span;

  public TypeAnnotation(String name, String unit,
                        List<TypeAnnotation> params, SourceSpan span) {
    this.name = name;
    this.unit = unit;
    this.params = ImmutableList.copyOf(params);
    this.span = span == null ? SourceSpan.UNKNOWN : span;
  }

  public static TypeAnnotation named(String name, SourceSpan span) {
    return new TypeAnnotation(name, null,
                  ImmutableList.<TypeAnnotation>of(), span);
  }

  public static TypeAnnotation withUnit(String name, String unit,
                                        SourceSpan span) {
    return new TypeAnnotation(name, unit,
                  ImmutableList.<TypeAnnotation>of(), span);
  }

  public static TypeAnnotation option(TypeAnnotation inner, SourceSpan span) {
    return new TypeAnnotation(OPTION, null, ImmutableList.of(inner), span);
  }

  public static TypeAnnotation tuple(List<TypeAnnotation> fields,
                                     SourceSpan span) {
    return new TypeAnnotation(TUPLE, null, fields, span);
  }

  public String getName() {
    return name;
  }

  /**
   * @return unit text, or null if none written
   */
  public String getUnit() {
    return unit;
  }

  public List<TypeAnnotation> getParams() {
    return params;
  }

  public SourceSpan getSpan() {
    return span;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name);
    if (unit != null) {
      sb.append("[").append(unit).append("]");
    }
    if (!params.isEmpty()) {
      sb.append(params);
    }
    return sb.toString();
  }
}
