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
import static exm.vyc.ast.ParseTrees.build;
import static exm.vyc.ast.ParseTrees.buildModule;
import static exm.vyc.ast.ParseTrees.call;
import static exm.vyc.ast.ParseTrees.exprStmt;
import static exm.vyc.ast.ParseTrees.functionDef;
import static exm.vyc.ast.ParseTrees.intLit;
import static exm.vyc.ast.ParseTrees.name;
import static exm.vyc.ast.ParseTrees.tree;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.ImmutableMap;

import exm.vyc.common.Logging;
import exm.vyc.common.exceptions.NodeNotFoundError;
import exm.vyc.common.exceptions.NotInTreeError;
import exm.vyc.common.exceptions.VYCRuntimeError;

public class TreeEditorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TreeEditorTest.vyc.log", true);
  }

  private static List<Node> ancestors(Node node) {
    List<Node> result = new ArrayList<Node>();
    for (Node curr = node.getParent(); curr != null;
         curr = curr.getParent()) {
      result.add(curr);
    }
    return result;
  }

  private static boolean reachable(Node root, Node node) {
    for (Node n: root.getDescendants()) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void testReplaceInTree() throws Exception {
    ModuleNode module = buildModule(
        annAssign("x", "int", binOp(name("a"), "Add", intLit(1))));
    Node stmt = module.get(0);
    Node oldNode = stmt.getNode("value");
    List<Node> oldAncestors = ancestors(oldNode);
    oldNode.setAnnotation("type", "int256");

    Node newNode = Literals.intLit(7);
    module.replaceInTree(oldNode, newNode);

    assertSame(newNode, stmt.getNode("value"));
    assertEquals(oldAncestors, ancestors(newNode));
    assertSame(stmt, newNode.getAncestor());
    assertNull(oldNode.getParent());
    assertFalse(reachable(module, oldNode));
    assertTrue(reachable(module, newNode));
    assertFalse("Annotations cleared", oldNode.hasAnnotation("type"));
    assertEquals("Other fields untouched", "x", stmt.get("target.id"));
  }

  @Test
  public void testReplaceInList() throws Exception {
    ModuleNode module = buildModule(
        exprStmt(call("f", name("a"), name("b"), name("c"))));
    Node call = module.get(0).getNode("value");
    Node b = call.getNodes("args").get(1);

    module.replaceInTree(b, Literals.intLit(2));
    List<Node> args = call.getNodes("args");
    assertEquals(3, args.size());
    assertEquals("a", args.get(0).getString("id"));
    assertEquals(BigInteger.valueOf(2), args.get(1).getValue());
    assertEquals("c", args.get(2).getString("id"));
    assertSame(call, args.get(1).getParent());
  }

  @Test
  public void testReplaceByIdentity() throws Exception {
    ModuleNode module = buildModule(annAssign("x", "int", intLit(1)),
                                    annAssign("y", "int", intLit(1)));
    Node second = module.get(1).getNode("value");
    assertEquals(module.get(0).getNode("value"), second);

    module.replaceInTree(second, Literals.intLit(2));
    assertEquals(BigInteger.ONE, module.get(0).get("value.value"));
    assertEquals(BigInteger.valueOf(2), module.get(1).get("value.value"));
  }

  @Test
  public void testReplaceThenReuse() throws Exception {
    ModuleNode module = buildModule(annAssign("x", "int", name("a")));
    Node a = module.get(0).getNode("value");
    module.replaceInTree(a, Literals.intLit(0));

    Node stmt = Node.fromNode(NodeKind.EXPR, module.get(0),
        ImmutableMap.<String, Object>of("value", a));
    module.addToBody(stmt);
    assertSame(stmt, a.getParent());
    assertEquals(2, module.size());
  }

  @Test
  public void testReplaceNotInTree() throws Exception {
    ModuleNode module = buildModule(annAssign("x", "int", intLit(1)));
    ModuleNode other = buildModule(annAssign("x", "int", intLit(1)));

    exception.expect(NotInTreeError.class);
    module.replaceInTree(other.get(0).getNode("value"), Literals.intLit(2));
  }

  @Test
  public void testReplaceDetachedNotInTree() throws Exception {
    ModuleNode module = buildModule(annAssign("x", "int", intLit(1)));
    exception.expect(NotInTreeError.class);
    module.replaceInTree(build(intLit(1)), Literals.intLit(2));
  }

  @Test
  public void testReplaceWithAttached() throws Exception {
    ModuleNode module = buildModule(annAssign("x", "int", intLit(1)),
                                    annAssign("y", "int", intLit(2)));
    exception.expect(VYCRuntimeError.class);
    exception.expectMessage("already part of a tree");
    module.replaceInTree(module.get(0).getNode("value"),
                         module.get(1).getNode("value"));
  }

  @Test
  public void testReplaceRoot() throws Exception {
    ModuleNode module = buildModule(tree("Pass"));
    exception.expect(VYCRuntimeError.class);
    module.replaceInTree(module, build(tree("Pass")));
  }

  @Test
  public void testReplaceWithDisallowedKind() throws Exception {
    ModuleNode module = buildModule(exprStmt(
        binOp(intLit(1), "Add", intLit(2))));
    Node op = module.get(0).getNode("value").getNode("op");
    exception.expect(VYCRuntimeError.class);
    exception.expectMessage("'op'");
    module.replaceInTree(op, Literals.intLit(3));
  }

  @Test
  public void testAddAndRemove() throws Exception {
    ModuleNode module = buildModule(tree("Pass"));
    Node fn = build(functionDef("foo"));
    module.addToBody(fn);
    assertEquals(2, module.size());
    assertSame(module, fn.getParent());

    Node pass = module.get(0);
    module.removeFromBody(pass);
    assertEquals(1, module.size());
    assertSame(fn, module.get(0));
    assertNull(pass.getParent());
  }

  @Test
  public void testAddAttached() throws Exception {
    ModuleNode module = buildModule(tree("Pass"));
    exception.expect(VYCRuntimeError.class);
    module.addToBody(module.get(0));
  }

  @Test
  public void testAddDisallowedKind() throws Exception {
    ModuleNode module = buildModule(tree("Pass"));
    exception.expect(VYCRuntimeError.class);
    module.addToBody(Literals.intLit(1));
  }

  @Test
  public void testRemoveEqualButNotSame() throws Exception {
    ModuleNode module = buildModule(tree("Pass"));
    Node pass = build(tree("Pass"));
    assertTrue("Structurally present", module.contains(pass));

    exception.expect(NodeNotFoundError.class);
    module.removeFromBody(pass);
  }

  @Test
  public void testRemoveNested() throws Exception {
    ModuleNode module = buildModule(functionDef("foo", tree("Pass")));
    Node nested = ((TopLevelNode)module.get(0)).get(0);
    exception.expect(NodeNotFoundError.class);
    module.removeFromBody(nested);
  }
}
