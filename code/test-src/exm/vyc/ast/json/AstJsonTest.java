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
package exm.vyc.ast.json;

import static exm.vyc.ast.ParseTrees.annAssign;
import static exm.vyc.ast.ParseTrees.binOp;
import static exm.vyc.ast.ParseTrees.buildModule;
import static exm.vyc.ast.ParseTrees.decimalLit;
import static exm.vyc.ast.ParseTrees.exprStmt;
import static exm.vyc.ast.ParseTrees.functionDef;
import static exm.vyc.ast.ParseTrees.intLit;
import static exm.vyc.ast.ParseTrees.name;
import static exm.vyc.ast.ParseTrees.strLit;
import static exm.vyc.ast.ParseTrees.tree;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.vyc.ast.ModuleNode;
import exm.vyc.ast.Node;
import exm.vyc.ast.ParseTree;
import exm.vyc.ast.ParseTrees;
import exm.vyc.ast.SourceSpan;
import exm.vyc.common.Logging;
import exm.vyc.common.exceptions.UnsupportedSyntaxException;
import exm.vyc.common.lang.NumericLimits;

public class AstJsonTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/AstJsonTest.vyc.log", true);
  }

  private static ModuleNode sampleModule() throws Exception {
    return buildModule(
        annAssign("x", "uint256", binOp(intLit(1), "Add",
            tree("Int").with("value", NumericLimits.INT_MAX))),
        annAssign("rate", "decimal", decimalLit("1.50")),
        functionDef("foo",
            exprStmt(tree("Bytes").with("value", "0x00ff")),
            tree("Return").with("value", strLit("done <ok>")),
            tree("Return").with("value", tree("NameConstant")
                                             .with("value", true))));
  }

  @Test
  public void testCompactJson() throws Exception {
    String json = AstJson.toJson(sampleModule(), false);
    assertTrue(json, json.startsWith("{\"ast_type\":\"Module\",\"node_id\":0,"));
    assertTrue(json, json.contains("\"doc_string\":null"));
    assertTrue(json, json.contains("\"value\":\"0x00ff\""));
    assertTrue(json, json.contains("\"value\":1.50"));
    assertTrue(json, json.contains("\"value\":" + NumericLimits.INT_MAX));
    assertTrue("No HTML escaping", json.contains("done <ok>"));
    assertFalse(json.contains("\n"));
  }

  @Test
  public void testPrettyJson() throws Exception {
    String json = AstJson.toJson(sampleModule(), true);
    assertTrue(json.contains("\n  \"ast_type\": \"Module\""));
  }

  @Test
  public void testRoundTrip() throws Exception {
    ModuleNode module = sampleModule();
    ParseTree parsed = ParseTreeReader.read(AstJson.toJson(module, false));
    ModuleNode rebuilt = ParseTrees.builder().buildModule(parsed);

    assertEquals(module, rebuilt);
    List<Node> expected = module.getDescendants();
    List<Node> actual = rebuilt.getDescendants();
    assertEquals(expected.size(), actual.size());
    for (int i = 0; i < expected.size(); i++) {
      assertEquals("span of " + expected.get(i), expected.get(i).getSpan(),
                   actual.get(i).getSpan());
    }
    assertEquals(new BigDecimal("1.50"),
                 rebuilt.get(1).get("value.value"));
  }

  @Test
  public void testReadNumbers() throws Exception {
    ParseTree tree = ParseTreeReader.read("{\"ast_type\": \"Tuple\", "
        + "\"lineno\": 3, \"col_offset\": 4, \"elements\": ["
        + "{\"ast_type\": \"Int\", \"lineno\": 3, \"value\": 12}, "
        + "{\"ast_type\": \"Decimal\", \"lineno\": 3, \"value\": 1e2}]}");
    assertEquals("Tuple", tree.getTag());
    SourceSpan span = tree.getSpan();
    assertEquals(3, span.line);
    assertEquals(4, span.column);
    assertEquals("End defaults to start", 3, span.endLine);
    assertEquals(0, span.start);

    List<?> elements = (List<?>)tree.getField("elements");
    assertEquals(BigInteger.valueOf(12),
                 ((ParseTree)elements.get(0)).getField("value"));
    assertEquals(new BigDecimal("1e2"),
                 ((ParseTree)elements.get(1)).getField("value"));
  }

  @Test
  public void testReadWithoutSpan() throws Exception {
    ParseTree tree = ParseTreeReader.read("{\"ast_type\": \"Pass\"}");
    assertNull(tree.getSpan());
    assertTrue(tree.getFieldNames().isEmpty());
  }

  @Test
  public void testReadIgnoresMetadataKeys() throws Exception {
    ParseTree tree = ParseTreeReader.read("{\"ast_type\": \"Name\", "
        + "\"node_id\": 99, \"lineno\": 1, \"src\": \"5:1:2\", "
        + "\"node_source_code\": \"x\", \"id\": \"x\"}");
    assertEquals(1, tree.getFieldNames().size());
    assertEquals(5, tree.getSpan().start);
    assertEquals(2, tree.getSpan().sourceId);

    Node n = ParseTrees.build(tree);
    assertEquals("Builder assigns its own ids", 0, n.getNodeId());
  }

  @Test
  public void testMalformedJson() throws Exception {
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("Malformed JSON");
    ParseTreeReader.read("{\"ast_type\": ");
  }

  @Test
  public void testMissingType() throws Exception {
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("ast_type");
    ParseTreeReader.read("{\"ast_type\": \"Expr\", \"lineno\": 1, "
        + "\"value\": {\"id\": \"x\"}}");
  }

  @Test
  public void testBadSrc() throws Exception {
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("src");
    ParseTreeReader.read("{\"ast_type\": \"Pass\", \"lineno\": 1, "
        + "\"src\": \"1-2\"}");
  }

  @Test
  public void testSrcNotAString() throws Exception {
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("src");
    ParseTreeReader.read("{\"ast_type\": \"Module\", \"lineno\": 1, "
        + "\"src\": {}, \"body\": []}");
  }

  @Test
  public void testFractionalLineNumber() throws Exception {
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("lineno");
    ParseTreeReader.read("{\"ast_type\": \"Pass\", \"lineno\": 1.5}");
  }

  @Test
  public void testNotAnObject() throws Exception {
    exception.expect(UnsupportedSyntaxException.class);
    ParseTreeReader.read("[1, 2]");
  }

  @Test
  public void testUnsupportedTagFromJson() throws Exception {
    ParseTree tree = ParseTreeReader.read(
        "{\"ast_type\": \"Lambda\", \"lineno\": 1}");
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("Lambda");
    ParseTrees.build(tree);
  }

  @Test
  public void testNameIsPlainString() throws Exception {
    ParseTree tree = ParseTreeReader.read(
        "{\"ast_type\": \"Name\", \"lineno\": 1, \"id\": \"0x12\"}");
    assertEquals("0x12", ParseTrees.build(tree).getString("id"));
    assertEquals("Name", name("y").getTag());
  }
}
