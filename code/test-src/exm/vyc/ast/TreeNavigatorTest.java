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
package exm.vyc.ast;

import static exm.vyc.ast.ParseTrees.annAssign;
import static exm.vyc.ast.ParseTrees.binOp;
import static exm.vyc.ast.ParseTrees.buildModule;
import static exm.vyc.ast.ParseTrees.call;
import static exm.vyc.ast.ParseTrees.exprStmt;
import static exm.vyc.ast.ParseTrees.functionDef;
import static exm.vyc.ast.ParseTrees.intLit;
import static exm.vyc.ast.ParseTrees.name;
import static exm.vyc.ast.ParseTrees.tree;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Predicate;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import exm.vyc.common.Logging;
import exm.vyc.common.exceptions.NodeNotFoundError;

public class TreeNavigatorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private ModuleNode module;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TreeNavigatorTest.vyc.log", true);
  }

  /**
   * x: int = a + 1
   * def foo():
   *     bar(x, 2)
   *     return b
   */
  @Before
  public void buildTree() throws Exception {
    module = buildModule(
        annAssign("x", "int", binOp(name("a"), "Add", intLit(1))),
        functionDef("foo",
            exprStmt(call("bar", name("x"), intLit(2))),
            tree("Return").with("value", name("b"))));
  }

  private static List<String> ids(List<Node> names) {
    List<String> result = new ArrayList<String>();
    for (Node n: names) {
      result.add(n.getString("id"));
    }
    return result;
  }

  @Test
  public void testGetChildren() throws Exception {
    Node binOp = module.get(0).getNode("value");
    List<Node> children = binOp.getChildren();
    assertEquals(3, children.size());
    assertSame(binOp.getNode("left"), children.get(0));
    assertSame(binOp.getNode("op"), children.get(1));
    assertSame(binOp.getNode("right"), children.get(2));

    assertEquals(Lists.reverse(children), binOp.getChildren(
        Collections.<NodeKind>emptySet(),
        ImmutableMap.<String, Object>of(), true));
    assertEquals(1, binOp.getChildren(NodeKind.CONSTANT).size());
    assertEquals(2, module.getChildren(NodeKind.ANN_ASSIGN,
                                       NodeKind.FUNCTION_DEF).size());
  }

  @Test
  public void testGetChildrenFilter() throws Exception {
    Node call = module.get(1).getNodes("body").get(0).getNode("value");
    List<Node> args = call.getChildren(EnumSet.of(NodeKind.NAME),
        ImmutableMap.of("id", "x"), false);
    assertEquals(1, args.size());
    assertSame(call.getNodes("args").get(0), args.get(0));

    assertTrue(call.getChildren(EnumSet.of(NodeKind.NAME),
        ImmutableMap.of("id", "nope"), false).isEmpty());
  }

  @Test
  public void testFilterOnBytesValue() throws Exception {
    Node list = Node.create(NodeKind.LIST, ImmutableMap.of("elements",
        ImmutableList.of(Literals.bytesLit(new byte[] {1, 2}),
                         Literals.intLit(3))));
    List<Node> hits = list.getChildren(Collections.<NodeKind>emptySet(),
        ImmutableMap.of("value", new byte[] {1, 2}), false);
    assertEquals(1, hits.size());
    assertSame(list.getNodes("elements").get(0), hits.get(0));

    assertTrue(list.getChildren(Collections.<NodeKind>emptySet(),
        ImmutableMap.of("value", new byte[] {1, 3}), false).isEmpty());
  }

  @Test
  public void testGetDescendantsPreOrder() throws Exception {
    assertEquals(Lists.newArrayList("x", "int", "a", "bar", "x", "b"),
                 ids(module.getDescendants(NodeKind.NAME)));
    assertEquals(Lists.newArrayList("b", "x", "bar", "a", "int", "x"),
        ids(module.getDescendants(EnumSet.of(NodeKind.NAME),
            ImmutableMap.<String, Object>of(), false, true)));
  }

  @Test
  public void testGetDescendantsIncludeSelf() throws Exception {
    Node ret = module.get(1).getNodes("body").get(1);
    assertEquals(1, ret.getDescendants().size());
    List<Node> withSelf = ret.getDescendants(
        Collections.<NodeKind>emptySet(),
        ImmutableMap.<String, Object>of(), true, false);
    assertEquals(2, withSelf.size());
    assertSame(ret, withSelf.get(0));

    assertTrue(ret.getDescendants(EnumSet.of(NodeKind.RETURN),
        ImmutableMap.<String, Object>of(), false, false).isEmpty());
  }

  @Test
  public void testGetDescendantsFilters() throws Exception {
    List<Node> ints = module.getDescendants(EnumSet.of(NodeKind.INT),
        ImmutableMap.of("value", BigInteger.valueOf(2)), false, false);
    assertEquals(1, ints.size());
    assertEquals(NodeKind.CALL, ints.get(0).getParent().getKind());

    Predicate<Object> startsWithB = new Predicate<Object>() {
      @Override
      public boolean test(Object id) {
        return ((String)id).startsWith("b");
      }
    };
    assertEquals(Lists.newArrayList("bar", "b"), ids(module.getDescendants(
        EnumSet.of(NodeKind.NAME),
        ImmutableMap.<String, Object>of("id", startsWithB), false, false)));

    List<Node> assignsToX = module.getDescendants(
        EnumSet.of(NodeKind.ANN_ASSIGN),
        ImmutableMap.of("target.id", "x"), false, false);
    assertEquals(1, assignsToX.size());
  }

  @Test
  public void testGetAncestor() throws Exception {
    Node ret = module.get(1).getNodes("body").get(1);
    Node b = ret.getNode("value");

    assertSame(ret, b.getAncestor());
    assertSame(module.get(1), b.getAncestor(NodeKind.FUNCTION_DEF));
    assertSame(module.get(1), b.getAncestor(NodeKind.TOP_LEVEL));
    assertSame(module, b.getAncestor(NodeKind.MODULE));
    assertNull(b.getAncestor(NodeKind.FOR));
    assertNull(module.getAncestor());
    assertSame(module, b.checkedGetAncestor(NodeKind.MODULE));
  }

  @Test
  public void testCheckedGetAncestorMissing() throws Exception {
    exception.expect(NodeNotFoundError.class);
    module.get(0).checkedGetAncestor(NodeKind.FUNCTION_DEF);
  }

  @Test
  public void testGetPath() throws Exception {
    Node stmt = module.get(0);
    assertEquals("x", stmt.get("target.id"));
    assertEquals(BigInteger.ONE, stmt.get("value.right.value"));
    assertNull(stmt.get("value.nothing"));
    assertNull(stmt.get("target.id.length"));
    assertSame(stmt.getNode("value"), stmt.get("value"));
  }

  @Test
  public void testDepth() throws Exception {
    Node b = module.get(1).getNodes("body").get(1).getNode("value");
    assertEquals(0, module.getDepth());
    assertEquals(3, b.getDepth());
    assertSame(module, b.getRoot());
  }

  @Test
  public void testResultsAreSnapshots() throws Exception {
    List<Node> stmts = module.getChildren();
    module.removeFromBody(module.get(0));
    assertEquals(2, stmts.size());
    assertEquals(1, module.getChildren().size());
  }
}
