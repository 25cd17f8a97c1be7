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

package org.threadline.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.threadline.ast.Nodes.assign;
import static org.threadline.ast.Nodes.attr;
import static org.threadline.ast.Nodes.call;
import static org.threadline.ast.Nodes.callMethod;
import static org.threadline.ast.Nodes.constant;
import static org.threadline.ast.Nodes.exprStmt;
import static org.threadline.ast.Nodes.forLoop;
import static org.threadline.ast.Nodes.functionDef;
import static org.threadline.ast.Nodes.ifStmt;
import static org.threadline.ast.Nodes.list;
import static org.threadline.ast.Nodes.name;
import static org.threadline.ast.Nodes.store;
import static org.threadline.ast.Nodes.subscript;
import static org.threadline.ast.Nodes.tuple;
import static org.threadline.ast.Nodes.whileLoop;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.threadline.ast.Context;
import org.threadline.ast.FunctionRole;
import org.threadline.ast.NodeKind;
import org.threadline.ast.Nodes;
import org.threadline.ast.Stmt;

@RunWith(JUnit4.class)
public class LivenessAnalysisTest {

  /**
   * <pre>
   *   def func(*args, **kwargs):
   *       a = 12
   *       global i, j
   *       nonlocal x, y
   *       print(a)
   *       i = k
   *       b = []
   *       c = [1, 2, 3]
   *       for m in range(10):
   *           q = 12
   *           b.append(1)
   *           c.pop()
   * </pre>
   */
  @Test
  public void classifiesFunctionAndLoop() {
    Stmt.For loop =
        forLoop(
            store("m"),
            call(name("range"), constant(10)),
            assign(store("q"), constant(12)),
            exprStmt(callMethod(name("b"), "append", constant(1))),
            exprStmt(callMethod(name("c"), "pop")));
    Stmt.FunctionDef func =
        Nodes.functionDef(
            "func",
            new Stmt.Arguments(ImmutableList.of(), "args", "kwargs", ImmutableList.of()),
            ImmutableList.of(
                assign(store("a"), constant(12)),
                Nodes.global("i", "j"),
                Nodes.nonlocal("x", "y"),
                exprStmt(call(name("print"), name("a"))),
                assign(store("i"), name("k")),
                assign(store("b"), list(Context.LOAD)),
                assign(store("c"), list(Context.LOAD, constant(1), constant(2), constant(3))),
                loop),
            FunctionRole.ORDINARY);

    ScopeAnalysis analysis = LivenessAnalysis.analyze(func);
    assertThat(analysis.size()).isEqualTo(2);
    NameScope scope = analysis.rootScope();
    assertThat(scope.kind()).isEqualTo(NodeKind.FUNCTION_DEF);
    assertThat(scope.father()).isNull();
    assertThat(scope.globals()).containsExactly("i", "j").inOrder();
    assertThat(scope.nonlocals()).containsExactly("x", "y").inOrder();
    assertThat(scope.args()).containsExactly("args", "kwargs").inOrder();
    assertThat(scope.modifiedVars()).containsExactly("a", "b", "c", "i", "m", "q").inOrder();
    assertThat(scope.variadicMutatedVars()).containsExactly("b", "c").inOrder();
    assertThat(scope.createdVars()).containsExactly("m", "q").inOrder();
    assertThat(scope.existedVars()).containsExactly("a", "b", "c", "m", "q").inOrder();

    NameScope loopScope = analysis.scopeOf(loop);
    assertThat(loopScope.kind()).isEqualTo(NodeKind.FOR);
    assertThat(loopScope.father()).isSameInstanceAs(scope);
    assertThat(loopScope.parent()).isSameInstanceAs(scope);
    assertThat(loopScope.modifiedVars()).containsExactly("m", "q");
    assertThat(loopScope.createdVars()).containsExactly("m", "q");
    assertThat(loopScope.variadicMutatedVars()).containsExactly("b", "c");
  }

  @Test
  public void variableCreatedInBranch() {
    // def f(cond):
    //     if cond:
    //         y = 1
    Stmt.If branch = ifStmt(name("cond"), assign(store("y"), constant(1)));
    Stmt.FunctionDef f = functionDef("f", ImmutableList.of("cond"), branch);
    ScopeAnalysis analysis = LivenessAnalysis.analyze(f);
    assertThat(analysis.scopeOf(branch).createdVars()).containsExactly("y");
    assertThat(analysis.rootScope().modifiedVars()).contains("y");
    assertThat(analysis.rootScope().createdVars()).containsExactly("y");
  }

  @Test
  public void variableAssignedBeforeBranchIsNotCreated() {
    Stmt.If branch = ifStmt(name("cond"), assign(store("y"), constant(2)));
    Stmt.FunctionDef f =
        functionDef("f", ImmutableList.of("cond"), assign(store("y"), constant(1)), branch);
    ScopeAnalysis analysis = LivenessAnalysis.analyze(f);
    assertThat(analysis.scopeOf(branch).createdVars()).isEmpty();
    assertThat(analysis.rootScope().createdVars()).isEmpty();
  }

  @Test
  public void containerMutationIsNotAWrite() {
    // def f(a):
    //     a.append(1)
    Stmt.FunctionDef f =
        functionDef(
            "f", ImmutableList.of("a"), exprStmt(callMethod(name("a"), "append", constant(1))));
    NameScope scope = LivenessAnalysis.analyze(f).rootScope();
    assertThat(scope.variadicMutatedVars()).containsExactly("a");
    assertThat(scope.modifiedVars()).doesNotContain("a");
  }

  @Test
  public void containerMutationAfterAssignment() {
    // def f():
    //     a = []
    //     a.append(1)
    Stmt.FunctionDef f =
        functionDef(
            "f",
            ImmutableList.of(),
            assign(store("a"), list(Context.LOAD)),
            exprStmt(callMethod(name("a"), "append", constant(1))));
    NameScope scope = LivenessAnalysis.analyze(f).rootScope();
    assertThat(scope.variadicMutatedVars()).containsExactly("a");
    // Only the assignment counts as a write.
    assertThat(scope.modifiedVars()).containsExactly("a");
  }

  @Test
  public void noControlFlow() {
    // def f(d, k):
    //     x = 1
    //     y, [z, self.w] = g()
    //     d[k][0] = x
    //     self.v += 1
    Stmt.FunctionDef f =
        functionDef(
            "f",
            ImmutableList.of("d", "k"),
            assign(store("x"), constant(1)),
            assign(
                tuple(
                    Context.STORE,
                    store("y"),
                    list(Context.STORE, store("z"), attr(name("self"), "w", Context.STORE))),
                call(name("g"))),
            assign(
                subscript(subscript(name("d"), name("k")), constant(0), Context.STORE),
                name("x")),
            Nodes.augAssign(attr(name("self"), "v", Context.STORE), "+", constant(1)));
    ScopeAnalysis analysis = LivenessAnalysis.analyze(f);
    NameScope scope = analysis.rootScope();
    assertThat(analysis.size()).isEqualTo(1);
    assertThat(scope.createdVars()).isEmpty();
    assertThat(scope.modifiedVars()).containsExactly("d", "self.v", "self.w", "x", "y", "z");
    assertThat(scope.existedVars()).containsExactly("x", "y", "z");
  }

  @Test
  public void deleteIsAWrite() {
    Stmt.FunctionDef f =
        functionDef("f", ImmutableList.of(), Nodes.delete(name("x", Context.DEL)));
    assertThat(LivenessAnalysis.analyze(f).rootScope().modifiedVars()).containsExactly("x");
  }

  @Test
  public void comprehensionVariablesDoNotLeak() {
    // def f(xs):
    //     ys = [x for x in xs]
    Stmt.FunctionDef f =
        functionDef(
            "f",
            ImmutableList.of("xs"),
            assign(store("ys"), Nodes.listComp(name("x"), store("x"), name("xs"))));
    assertThat(LivenessAnalysis.analyze(f).rootScope().modifiedVars()).containsExactly("ys");
  }

  @Test
  public void globalsAreNotExisted() {
    Stmt.FunctionDef f =
        functionDef(
            "f", ImmutableList.of(), Nodes.global("g"), assign(store("g"), constant(1)));
    NameScope scope = LivenessAnalysis.analyze(f).rootScope();
    assertThat(scope.modifiedVars()).containsExactly("g");
    assertThat(scope.existedVars()).isEmpty();
    assertThat(scope.isGlobalVar("g")).isTrue();
  }

  @Test
  public void nestedControlFlow() {
    // def f(c):
    //     if c:
    //         while c:
    //             z = 1
    Stmt.While inner = whileLoop(name("c"), assign(store("z"), constant(1)));
    Stmt.If outer = ifStmt(name("c"), inner);
    Stmt.FunctionDef f = functionDef("f", ImmutableList.of("c"), outer);
    ScopeAnalysis analysis = LivenessAnalysis.analyze(f);
    NameScope root = analysis.rootScope();
    NameScope ifScope = analysis.scopeOf(outer);
    NameScope whileScope = analysis.scopeOf(inner);

    // Control-flow scopes are never fathers.
    assertThat(whileScope.father()).isSameInstanceAs(root);
    assertThat(whileScope.parent()).isSameInstanceAs(ifScope);
    assertThat(ifScope.modifiedVars()).containsExactly("z");
    assertThat(whileScope.createdVars()).containsExactly("z");
    assertThat(ifScope.createdVars()).containsExactly("z");
    assertThat(root.createdVars()).containsExactly("z");
    assertThat(analysis.scopes()).containsExactly(root, ifScope, whileScope).inOrder();
  }

  @Test
  public void siblingBranchesSeeEachOthersWrites() {
    Stmt.If first = ifStmt(name("c"), assign(store("x"), constant(1)));
    Stmt.If second = ifStmt(name("c"), assign(store("x"), constant(2)));
    Stmt.FunctionDef f = functionDef("f", ImmutableList.of("c"), first, second);
    ScopeAnalysis analysis = LivenessAnalysis.analyze(f);
    assertThat(analysis.scopeOf(first).createdVars()).containsExactly("x");
    assertThat(analysis.scopeOf(second).createdVars()).isEmpty();
  }

  @Test
  public void loweredBodyFoldsIntoEnclosingScope() {
    // def f():
    //     def true_fn_0():
    //         y = 1
    //         b.append(2)
    //     def helper():
    //         w = 1
    Stmt.FunctionDef lowered =
        Nodes.functionDef(
            "true_fn_0",
            Stmt.Arguments.NONE,
            ImmutableList.of(
                assign(store("y"), constant(1)),
                exprStmt(callMethod(name("b"), "append", constant(2)))),
            FunctionRole.TRUE_BRANCH);
    Stmt.FunctionDef helper =
        functionDef("helper", ImmutableList.of(), assign(store("w"), constant(1)));
    Stmt.FunctionDef f = functionDef("f", ImmutableList.of(), lowered, helper);
    ScopeAnalysis analysis = LivenessAnalysis.analyze(f);
    NameScope root = analysis.rootScope();
    assertThat(analysis.scopeOf(lowered).father()).isSameInstanceAs(root);
    assertThat(root.modifiedVars()).containsExactly("y");
    assertThat(root.variadicMutatedVars()).containsExactly("b");
    assertThat(analysis.scopeOf(helper).modifiedVars()).containsExactly("w");
  }

  @Test
  public void loweredBodyInsideBranchReachesFunction() {
    Stmt.FunctionDef lowered =
        Nodes.functionDef(
            "while_body_0",
            Stmt.Arguments.NONE,
            ImmutableList.of(assign(store("n"), constant(0))),
            FunctionRole.WHILE_BODY);
    Stmt.If branch = ifStmt(name("c"), lowered);
    Stmt.FunctionDef f = functionDef("f", ImmutableList.of("c"), branch);
    ScopeAnalysis analysis = LivenessAnalysis.analyze(f);
    assertThat(analysis.scopeOf(branch).modifiedVars()).containsExactly("n");
    assertThat(analysis.rootScope().modifiedVars()).containsExactly("n");
    assertThat(analysis.scopeOf(branch).createdVars()).containsExactly("n");
  }

  @Test
  public void rootMustBeFunction() {
    AnalysisError e =
        assertThrows(AnalysisError.class, () -> LivenessAnalysis.analyze(Nodes.pass()));
    assertThat(e).hasMessageThat().contains("function definition");
  }

  @Test
  public void rejectsBadTargets() {
    Stmt.FunctionDef callTarget =
        functionDef(
            "f", ImmutableList.of(), assign(Nodes.atLine(3, call(name("g"))), constant(1)));
    AnalysisError e =
        assertThrows(AnalysisError.class, () -> LivenessAnalysis.analyze(callTarget));
    assertThat(e.lineNum).isEqualTo(3);
    assertThat(e).hasMessageThat().isEqualTo("Cannot assign to 'g()' (line 3)");

    Stmt.FunctionDef loadTarget =
        functionDef("f", ImmutableList.of(), assign(name("x"), constant(1)));
    assertThrows(AnalysisError.class, () -> LivenessAnalysis.analyze(loadTarget));
  }

  @Test
  public void rejectsQualifiedDeclarations() {
    Stmt.FunctionDef f =
        functionDef(
            "f", ImmutableList.of(), Nodes.atLine(2, Nodes.nonlocal("a", "b.c")), Nodes.pass());
    AnalysisError e = assertThrows(AnalysisError.class, () -> LivenessAnalysis.analyze(f));
    assertThat(e.lineNum).isEqualTo(2);
    assertThat(e).hasMessageThat().isEqualTo("'b.c' cannot be declared nonlocal (line 2)");

    Stmt.FunctionDef g = functionDef("g", ImmutableList.of(), Nodes.global("x[0]"));
    assertThrows(AnalysisError.class, () -> LivenessAnalysis.analyze(g));
  }

  @Test
  public void rejectsSharedNodes() {
    Stmt.If branch = ifStmt(name("c"), Nodes.pass());
    Stmt.FunctionDef f = functionDef("f", ImmutableList.of("c"), branch, branch);
    assertThrows(AnalysisError.class, () -> LivenessAnalysis.analyze(f));
  }

  @Test
  public void scopeOfUnknownNode() {
    ScopeAnalysis analysis =
        LivenessAnalysis.analyze(functionDef("f", ImmutableList.of(), Nodes.pass()));
    assertThrows(
        IllegalArgumentException.class,
        () -> analysis.scopeOf(ifStmt(name("c"), Nodes.pass())));
  }
}
