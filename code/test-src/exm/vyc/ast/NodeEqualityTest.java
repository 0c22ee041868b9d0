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
import static exm.vyc.ast.ParseTrees.decimalLit;
import static exm.vyc.ast.ParseTrees.intLit;
import static exm.vyc.ast.ParseTrees.name;
import static exm.vyc.ast.ParseTrees.tree;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.Set;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.vyc.common.Logging;

public class NodeEqualityTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/NodeEqualityTest.vyc.log", true);
  }

  @Test
  public void testLocationInvariant() throws Exception {
    ModuleNode a = buildModule(
        annAssign("x", "int", binOp(intLit(1), "Add", name("y"))));
    ModuleNode b = buildModule(
        annAssign("x", "int", binOp(intLit(1), "Add", name("y"))));

    assertFalse("Fixtures should have different spans",
                a.get(0).getSpan().equals(b.get(0).getSpan()));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(a.get(0).getNode("value"), b.get(0).getNode("value"));
  }

  @Test
  public void testEqualityProperties() throws Exception {
    Node a = build(binOp(name("x"), "Mult", intLit(3)));
    Node b = build(binOp(name("x"), "Mult", intLit(3)));
    Node c = Literals.intLit(3);
    Node c2 = build(binOp(name("x"), "Mult", intLit(3)));

    assertEquals("reflexive", a, a);
    assertTrue("symmetric", a.equals(b) && b.equals(a));
    assertTrue("transitive", a.equals(b) && b.equals(c2) && a.equals(c2));
    assertFalse(a.equals(c));
    assertFalse(a.equals(null));
    assertFalse(a.equals("BinOp"));
  }

  @Test
  public void testDifferentFields() throws Exception {
    assertFalse(build(name("x")).equals(build(name("y"))));
    assertFalse(build(binOp(intLit(1), "Add", intLit(2))).equals(
                build(binOp(intLit(1), "Sub", intLit(2)))));
    assertFalse("Same value, different kind",
        build(intLit(1)).equals(build(decimalLit("1"))));
  }

  @Test
  public void testDecimalScaleIgnored() throws Exception {
    Node a = build(decimalLit("1.0"));
    Node b = build(decimalLit("1.00"));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());

    Node zero = build(decimalLit("0.000"));
    assertEquals(zero, build(decimalLit("0")));
    assertEquals(zero.hashCode(), build(decimalLit("0")).hashCode());
  }

  @Test
  public void testBytesByContent() throws Exception {
    Node a = build(tree("Bytes").with("value", "0x0102"));
    Node b = Literals.bytesLit(new byte[] {1, 2});
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }

  @Test
  public void testMetadataIgnored() throws Exception {
    Node a = build(name("x"));
    Node b = build(name("x"));
    a.setAnnotation("type", "uint256");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }

  @Test
  public void testHashSetLookup() throws Exception {
    Set<Node> seen = new HashSet<Node>();
    seen.add(build(binOp(intLit(1), "Add", name("z"))));
    assertTrue(seen.contains(build(binOp(intLit(1), "Add", name("z")))));
    assertFalse(seen.contains(build(binOp(intLit(2), "Add", name("z")))));
  }

  @Test
  public void testHashChangesWithEdit() throws Exception {
    ModuleNode module = buildModule(annAssign("x", "int", intLit(1)));
    Node stmt = module.get(0);
    int before = stmt.hashCode();
    module.replaceInTree(stmt.getNode("value"), Literals.intLit(2));
    assertFalse(before == stmt.hashCode());
  }
}
