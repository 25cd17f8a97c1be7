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
import static org.threadline.ast.Nodes.assign;
import static org.threadline.ast.Nodes.attr;
import static org.threadline.ast.Nodes.binOp;
import static org.threadline.ast.Nodes.call;
import static org.threadline.ast.Nodes.constant;
import static org.threadline.ast.Nodes.functionDef;
import static org.threadline.ast.Nodes.ifStmt;
import static org.threadline.ast.Nodes.name;
import static org.threadline.ast.Nodes.pass;
import static org.threadline.ast.Nodes.returnStmt;
import static org.threadline.ast.Nodes.store;
import static org.threadline.ast.Nodes.tuple;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SourcePrinterTest {

  @Test
  public void functionWithBranches() {
    Stmt.FunctionDef f =
        functionDef(
            "f",
            ImmutableList.of("x"),
            assign(store("y"), binOp(name("x"), "+", constant(1))),
            ifStmt(
                name("y"), ImmutableList.of(returnStmt(name("y"))), ImmutableList.of(pass())));
    assertThat(SourcePrinter.toSource(f))
        .isEqualTo(
            "def f(x):\n"
                + "    y = x + 1\n"
                + "    if y:\n"
                + "        return y\n"
                + "    else:\n"
                + "        pass\n");
  }

  @Test
  public void emptyBlockPrintsPass() {
    assertThat(SourcePrinter.toSource(functionDef("g", ImmutableList.of())))
        .isEqualTo("def g():\n    pass\n");
  }

  @Test
  public void elifChain() {
    Stmt.If node =
        ifStmt(
            name("a"),
            ImmutableList.of(pass()),
            ImmutableList.of(ifStmt(name("b"), Nodes.breakStmt())));
    assertThat(node.toString()).isEqualTo("if a:\n    pass\nelif b:\n    break\n");
  }

  @Test
  public void loops() {
    Stmt.For loop =
        Nodes.forLoop(
            tuple(Context.STORE, store("i"), store("v")),
            call(name("enumerate"), name("xs")),
            Nodes.augAssign(store("total"), "+", name("v")));
    assertThat(loop.toString()).isEqualTo("for i, v in enumerate(xs):\n    total += v\n");
    Stmt.While whileLoop =
        Nodes.whileLoop(Nodes.unaryOp("not", name("done")), Nodes.continueStmt());
    assertThat(whileLoop.toString()).isEqualTo("while not done:\n    continue\n");
  }

  @Test
  public void parameters() {
    Stmt.Arguments params =
        new Stmt.Arguments(ImmutableList.of("a", "b"), "args", "kw", ImmutableList.of(constant(1)));
    Stmt.FunctionDef f = functionDef("f", params, ImmutableList.of(), FunctionRole.ORDINARY);
    assertThat(f.toString()).isEqualTo("def f(a, b=1, *args, **kw):\n    pass\n");
  }

  @Test
  public void tuples() {
    assertThat(assign(tuple(Context.STORE, store("a")), call(name("f"))).toString())
        .isEqualTo("a, = f()\n");
    assertThat(call(name("f"), tuple(Context.LOAD, name("a"))).toString()).isEqualTo("f((a,))");
    assertThat(returnStmt(tuple(Context.LOAD, name("x"), name("y"))).toString())
        .isEqualTo("return x, y\n");
    assertThat(tuple(Context.LOAD).toString()).isEqualTo("()");
  }

  @Test
  public void constants() {
    assertThat(constant(null).toString()).isEqualTo("None");
    assertThat(constant(true).toString()).isEqualTo("True");
    assertThat(constant(12).toString()).isEqualTo("12");
    assertThat(constant("it's\n").toString()).isEqualTo("'it\\'s\\n'");
  }

  @Test
  public void expressions() {
    assertThat(attr(binOp(name("a"), "+", name("b")), "c").toString()).isEqualTo("(a + b).c");
    Expr product = binOp(name("a"), "*", name("b"));
    assertThat(binOp(product, "-", Nodes.unaryOp("-", name("c"))).toString())
        .isEqualTo("(a * b) - (-c)");
    assertThat(Nodes.subscript(name("a"), Nodes.slice(constant(1), null, null)).toString())
        .isEqualTo("a[1:]");
    assertThat(
            call(
                    name("f"),
                    ImmutableList.of(name("a")),
                    ImmutableList.of(Nodes.keyword("k", constant(2))))
                .toString())
        .isEqualTo("f(a, k=2)");
    assertThat(Nodes.listComp(name("x"), store("x"), name("xs")).toString())
        .isEqualTo("[x for x in xs]");
    assertThat(Nodes.callMethod(name("a"), "append", constant(1)).toString())
        .isEqualTo("a.append(1)");
  }

  @Test
  public void declarations() {
    ImmutableList<Stmt> statements =
        ImmutableList.of(
            Nodes.global("i", "j"), Nodes.nonlocal("x"), Nodes.delete(name("x", Context.DEL)));
    assertThat(SourcePrinter.toSource(statements))
        .isEqualTo("global i, j\nnonlocal x\ndel x\n");
  }
}
