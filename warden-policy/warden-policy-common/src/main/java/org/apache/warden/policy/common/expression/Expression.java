/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.warden.policy.common.expression;

import java.util.List;
import java.util.function.Predicate;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Node of a parsed condition expression. Evaluation is lazy: operands of
 * {@link And} and {@link Or} are evaluated left to right and only until the
 * result is known, so atoms past that point are never checked.
 */
public abstract class Expression {

  private Expression() {
  }

  /**
   * @param atoms decides the truth value of a condition reference
   */
  public abstract boolean evaluate(Predicate<String> atoms);

  static final class Literal extends Expression {
    static final Literal TRUE = new Literal(true);
    static final Literal FALSE = new Literal(false);

    private final boolean value;

    private Literal(boolean value) {
      this.value = value;
    }

    @Override
    public boolean evaluate(Predicate<String> atoms) {
      return value;
    }

    @Override
    public String toString() {
      return value ? "True" : "False";
    }
  }

  static final class Atom extends Expression {
    private final String condition;

    Atom(String condition) {
      this.condition = condition;
    }

    String getCondition() {
      return condition;
    }

    @Override
    public boolean evaluate(Predicate<String> atoms) {
      return atoms.test(condition);
    }

    @Override
    public String toString() {
      return condition;
    }
  }

  static final class Not extends Expression {
    private final Expression operand;

    Not(Expression operand) {
      this.operand = operand;
    }

    @Override
    public boolean evaluate(Predicate<String> atoms) {
      return !operand.evaluate(atoms);
    }

    @Override
    public String toString() {
      return "~" + operand;
    }
  }

  static final class And extends Expression {
    private final ImmutableList<Expression> operands;

    And(List<Expression> operands) {
      this.operands = ImmutableList.copyOf(operands);
    }

    @Override
    public boolean evaluate(Predicate<String> atoms) {
      for (Expression operand : operands) {
        if (!operand.evaluate(atoms)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return "(" + Joiner.on(" & ").join(operands) + ")";
    }
  }

  static final class Or extends Expression {
    private final ImmutableList<Expression> operands;

    Or(List<Expression> operands) {
      this.operands = ImmutableList.copyOf(operands);
    }

    @Override
    public boolean evaluate(Predicate<String> atoms) {
      for (Expression operand : operands) {
        if (operand.evaluate(atoms)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return "(" + Joiner.on(" | ").join(operands) + ")";
    }
  }
}
