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

public class CallExpr extends Expression {
  private final String function;
  private final List<Expression> args;

  public CallExpr(SourceSpan span, String function, List<Expression> args) {
    super(span);
    this.function = function;
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public ExprKind getKind() {
    return ExprKind.CALL;
  }

  public String getFunction() {
    return function;
  }

  public List<Expression> getArgs() {
    return args;
  }
}
