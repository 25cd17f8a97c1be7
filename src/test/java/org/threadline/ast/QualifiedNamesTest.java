/*
 * Copyright 2025 The Threadline Authors
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
 * limitations under the License.
 */

package org.threadline.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class QualifiedNamesTest {

  @Test
  public void simpleNames() {
    assertThat(QualifiedNames.isSimpleName("x")).isTrue();
    assertThat(QualifiedNames.isSimpleName("self.x")).isFalse();
    assertThat(QualifiedNames.isSimpleName("a[0]")).isFalse();
    assertThat(QualifiedNames.isIdentifier("_x1")).isTrue();
    assertThat(QualifiedNames.isIdentifier("1x")).isFalse();
    assertThat(QualifiedNames.isIdentifier("")).isFalse();
  }

  @Test
  public void rebuildsQualifiedNames(
      @TestParameter({"x", "self.x", "a[0]", "a.b[0]['k']", "a[i.j].c", "m[-1]"}) String name) {
    Expr expr = QualifiedNames.toExpression(name, Context.LOAD);
    assertThat(SourcePrinter.toSource(expr)).isEqualTo(name);
  }

  @Test
  public void onlyOutermostNodeGetsContext() {
    Expr expr = QualifiedNames.toExpression("a.b.c", Context.STORE);
    assertThat(expr.kind()).isEqualTo(NodeKind.ATTRIBUTE);
    Expr.Attribute outer = (Expr.Attribute) expr;
    assertThat(outer.ctx).isEqualTo(Context.STORE);
    assertThat(((Expr.Attribute) outer.value).ctx).isEqualTo(Context.LOAD);
  }

  @Test
  public void rejectsBadNames(
      @TestParameter({"", "a.", "a[0", "a b", "3", "a[]", "a.[0]"}) String name) {
    assertThrows(
        IllegalArgumentException.class, () -> QualifiedNames.toExpression(name, Context.LOAD));
  }

  @Test
  public void readsEscapedStringIndexes() {
    Expr.Subscript quoted =
        (Expr.Subscript) QualifiedNames.toExpression("a['it\\'s']", Context.LOAD);
    assertThat(((Expr.Constant) quoted.slice).value).isEqualTo("it's");

    Expr.Subscript backslash =
        (Expr.Subscript) QualifiedNames.toExpression("a['x\\\\y']", Context.LOAD);
    assertThat(((Expr.Constant) backslash.slice).value).isEqualTo("x\\y");
  }

  @Test
  public void printedStringIndexesReadBack() {
    for (String key : ImmutableList.of("it's", "x\\y", "two\nlines", "plain")) {
      Expr target =
          new Expr.Attribute(
              new Expr.Subscript(Nodes.name("a"), new Expr.Constant(key), Context.LOAD),
              "x",
              Context.STORE);
      String name = SourcePrinter.toSource(target);
      assertThat(QualifiedNames.isVariableName(name)).isTrue();
      assertThat(SourcePrinter.toSource(QualifiedNames.toExpression(name, Context.STORE)))
          .isEqualTo(name);
    }
  }

  @Test
  public void variableNamePredicate() {
    assertThat(QualifiedNames.isVariableName("a.b[0]")).isTrue();
    assertThat(QualifiedNames.isVariableName("a[i + 1].x")).isFalse();
    assertThat(QualifiedNames.isVariableName("g().x")).isFalse();
    assertThat(QualifiedNames.isVariableName("a['open")).isFalse();
    assertThat(QualifiedNames.parse("a[99999999999999999999]", Context.LOAD)).isNull();
  }

  @Test
  public void stringLiterals() {
    assertThat(QualifiedNames.toStringLiteral(ImmutableList.of())).isEqualTo("None");
    assertThat(QualifiedNames.toStringLiteral(ImmutableList.of("x"))).isEqualTo("('x', )");
    assertThat(QualifiedNames.toStringLiteral(ImmutableList.of("x", "y.z")))
        .isEqualTo("('x','y.z', )");
  }
}
