package com.github.llfsm.binding;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;

import org.junit.Test;

/**
 * Tests for the text building blocks and identifier derivation used by the emitters.
 */
public class CodeTest {

  @Test
  public void testBlockDropsIgnoredLines() {
    assertEquals("a\nb", Code.block("a", Code.IGNORED, "b"));
    assertEquals("a", Code.block("a", Code.when(false, "b")));
    assertEquals("a\nb", Code.block("a", Code.when(true, "b")));
    assertEquals("", Code.block(Code.IGNORED));
    assertEquals("yes", Code.either(true, "yes", "no"));
  }

  @Test
  public void testIndentationSkipsEmptyLines() {
    assertEquals("    a\n\n    b", Code.indentedBlock("a", "", "b"));
    assertEquals("\ta\n\t\tb", Code.indentedBlockWith("\t", "a", "\tb"));
  }

  @Test
  public void testBracedBlocks() {
    assertEquals("{\n}", Code.bracedBlock());
    assertEquals("{\n}", Code.bracedBlock(Code.IGNORED));
    assertEquals("{\n    x;\n    y;\n}", Code.bracedBlock("x;", "y;"));
    assertEquals("{\n    {\n        x;\n    }\n}", Code.bracedBlock(Code.bracedBlock("x;")));
    assertEquals("(\n    a\n)", Code.bracketedBlock("(", ")", "a"));
  }

  @Test
  public void testIncludeFileGuard() {
    assertEquals("#ifndef LLFSM_MACHINE_RED_H\n#define LLFSM_MACHINE_RED_H\n\nbody\n\n"
        + "#endif /* LLFSM_MACHINE_RED_H */\n", Code.includeFile("LLFSM_MACHINE_Red_h", "body"));
    assertEquals("CLFSM_MACHINE_RED", Code.guardToken("clfsm_machine_Red_"));
    assertEquals("LIVES_H", Code.guardToken("9-lives.h"));
  }

  @Test
  public void testForEachAndEnumerating() {
    assertEquals("<a>\n<b>", Code.forEach(Arrays.asList("a", "b"), s -> "<" + s + ">"));
    assertEquals(Code.IGNORED, Code.forEach(Collections.<String>emptyList(), s -> s));
    assertEquals("0x\n1y", Code.enumerating(Arrays.asList("x", "y"), (i, s) -> i + s));
    assertEquals("head",
        Code.block("head", Code.enumerating(Collections.<String>emptyList(), (i, s) -> s)));
  }

  @Test
  public void testIdentifiers() {
    assertEquals("redlight", Identifiers.symbol("Red Light"));
    assertEquals("_2nd", Identifiers.symbol("2nd"));
    assertEquals("_", Identifiers.symbol("---"));
    assertEquals("my_state", Identifiers.symbol("My_State"));
    assertEquals("RED1", Identifiers.macro("Red-1"));
  }

  @Test
  public void testIdentifiersIgnoreDefaultLocale() {
    final Locale defaultLocale = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertEquals("idle", Identifiers.symbol("Idle"));
      assertEquals("IDLE", Identifiers.macro("Idle"));
      assertEquals("MACHINE_IDLE_H", Code.guardToken("Machine_idle.h"));
      assertEquals(Format.SWIFT, Format.parse("SWIFT").get());
    } finally {
      Locale.setDefault(defaultLocale);
    }
  }

}
