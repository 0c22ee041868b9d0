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
package exm.vyc.ui;

import static exm.vyc.ast.ParseTrees.annAssign;
import static exm.vyc.ast.ParseTrees.binOp;
import static exm.vyc.ast.ParseTrees.buildModule;
import static exm.vyc.ast.ParseTrees.intLit;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.vyc.ast.json.AstJson;
import exm.vyc.common.Settings;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private ByteArrayOutputStream outBytes;
  private ByteArrayOutputStream errBytes;

  @Before
  public void setupStreams() {
    outBytes = new ByteArrayOutputStream();
    errBytes = new ByteArrayOutputStream();
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  private int run(String... args) {
    return Main.run(args, new PrintStream(outBytes, true),
                    new PrintStream(errBytes, true));
  }

  private String out() {
    return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
  }

  private String err() {
    return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
  }

  private File writeInput(String json) throws Exception {
    File input = tmp.newFile("input.json");
    FileUtils.writeStringToFile(input, json, StandardCharsets.UTF_8);
    return input;
  }

  private File onePlusTwo() throws Exception {
    return writeInput(AstJson.toJson(buildModule(
        annAssign("x", "int", binOp(intLit(1), "Add", intLit(2)))), false));
  }

  @Test
  public void testFoldCompact() throws Exception {
    File input = onePlusTwo();
    assertEquals(err(), ExitCode.SUCCESS.code(),
                 run("-f", "-c", input.getPath()));
    String json = out();
    assertTrue(json, json.contains("\"ast_type\":\"Int\""));
    assertTrue(json, json.contains("\"value\":3"));
    assertFalse(json, json.contains("BinOp"));
  }

  @Test
  public void testNoFold() throws Exception {
    File input = onePlusTwo();
    assertEquals(err(), ExitCode.SUCCESS.code(), run(input.getPath()));
    assertTrue(out().contains("\"ast_type\": \"BinOp\""));
  }

  @Test
  public void testOutputFile() throws Exception {
    File input = onePlusTwo();
    File output = new File(tmp.getRoot(), "out.json");
    assertEquals(err(), ExitCode.SUCCESS.code(),
        run("--fold", "--compact", "-o", output.getPath(), input.getPath()));
    assertEquals("", out());
    String json = FileUtils.readFileToString(output, StandardCharsets.UTF_8);
    assertTrue(json, json.startsWith("{\"ast_type\":\"Module\""));
  }

  @Test
  public void testHelp() throws Exception {
    assertEquals(ExitCode.SUCCESS.code(), run("-h"));
    assertTrue(out(), out().contains("vyc-ast"));
  }

  @Test
  public void testBadArguments() throws Exception {
    assertEquals(ExitCode.ERROR_COMMAND.code(), run());
    assertEquals(ExitCode.ERROR_COMMAND.code(), run("--bogus", "in.json"));
    assertEquals(ExitCode.ERROR_COMMAND.code(), run("a.json", "b.json"));
  }

  @Test
  public void testMissingInput() throws Exception {
    File missing = new File(tmp.getRoot(), "missing.json");
    assertEquals(ExitCode.ERROR_IO.code(), run(missing.getPath()));
    assertTrue(err(), err().contains("missing.json"));
  }

  @Test
  public void testMalformedInput() throws Exception {
    File input = writeInput("{\"ast_type\": \"Module\", \"body\": [");
    assertEquals(ExitCode.ERROR_PARSER.code(), run(input.getPath()));
  }

  @Test
  public void testUnsupportedSyntax() throws Exception {
    File input = writeInput("{\"ast_type\": \"Module\", \"lineno\": 1, "
        + "\"body\": [{\"ast_type\": \"Lambda\", \"lineno\": 2}]}");
    assertEquals(ExitCode.ERROR_PARSER.code(), run(input.getPath()));
    assertTrue(err(), err().contains("Lambda"));
  }

  @Test
  public void testInvalidConstant() throws Exception {
    File input = writeInput(AstJson.toJson(buildModule(
        annAssign("x", "int", binOp(intLit(1), "Mod", intLit(0)))), false));
    assertEquals(ExitCode.ERROR_USER.code(), run("-f", input.getPath()));
    assertTrue(err(), err().contains("Modulo by zero"));
  }
}
