package com.github.llfsm.codec;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.junit.Test;

import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;

/**
 * Tests for the XML property list reader and writer.
 */
public class PropertyListTest {

  @Test
  public void testWriteAndReadNestedValues() throws LLFSMException {
    final Map<String, Object> root = new LinkedHashMap<>();
    root.put("zoom", 1.5);
    root.put("flags", Arrays.<Object>asList(Boolean.TRUE, Boolean.FALSE));
    root.put("count", 3L);
    root.put("label", "a < b && c > d");
    final Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("w", 100.0);
    root.put("nested", nested);

    final byte[] written = PropertyList.write(root);
    final String xml = new String(written, StandardCharsets.UTF_8);
    assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<!DOCTYPE plist"));
    assertTrue(xml.contains("<string>a &lt; b &amp;&amp; c &gt; d</string>"));
    assertTrue(xml.contains("<real>100</real>"));
    assertTrue(xml.contains("<integer>3</integer>"));
    // keys are sorted
    assertTrue(xml.indexOf("<key>count</key>") < xml.indexOf("<key>flags</key>"));
    assertTrue(xml.indexOf("<key>nested</key>") < xml.indexOf("<key>zoom</key>"));

    final Map<?, ?> read = (Map<?, ?>) PropertyList.read(written);
    assertEquals(1.5, read.get("zoom"));
    assertEquals(Arrays.asList(Boolean.TRUE, Boolean.FALSE), read.get("flags"));
    assertEquals(3L, read.get("count"));
    assertEquals("a < b && c > d", read.get("label"));
    assertEquals(100.0, ((Map<?, ?>) read.get("nested")).get("w"));
  }

  @Test
  public void testDataAndEmptyContainers() throws LLFSMException {
    final Map<String, Object> root = new LinkedHashMap<>();
    root.put("blob", new byte[] {0, 1, 2, (byte) 0xff});
    root.put("none", Arrays.asList());
    root.put("empty", new LinkedHashMap<String, Object>());
    final Map<?, ?> read = (Map<?, ?>) PropertyList.read(PropertyList.write(root));
    assertArrayEquals(new byte[] {0, 1, 2, (byte) 0xff}, (byte[]) read.get("blob"));
    assertTrue(((List<?>) read.get("none")).isEmpty());
    assertTrue(((Map<?, ?>) read.get("empty")).isEmpty());
  }

  @Test
  public void testRealsAreWrittenCompactly() {
    assertEquals("100", PropertyList.real(100.0));
    assertEquals("0.5", PropertyList.real(0.5));
    assertEquals("-12.25", PropertyList.real(-12.25));
    assertEquals("16.666666666666668", PropertyList.real(100.0 / 6));
  }

  @Test
  public void testReadsIntegersAsReals() throws LLFSMException {
    final String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
        + "<plist version=\"1.0\"><dict><key>x</key><real>42</real>"
        + "<key>y</key><integer>-7</integer></dict></plist>";
    final Map<?, ?> read = (Map<?, ?>) PropertyList.read(xml.getBytes(StandardCharsets.UTF_8));
    assertEquals(42.0, read.get("x"));
    assertEquals(-7L, read.get("y"));
  }

  @Test
  public void testSpecialRealsIgnoreDefaultLocale() throws LLFSMException {
    final Locale defaultLocale = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      final String xml = "<plist version=\"1.0\"><array><real>-INFINITY</real>"
          + "<real>NAN</real></array></plist>";
      final List<?> read = (List<?>) PropertyList.read(xml.getBytes(StandardCharsets.UTF_8));
      assertEquals(Double.NEGATIVE_INFINITY, read.get(0));
      assertEquals(Double.NaN, read.get(1));
    } finally {
      Locale.setDefault(defaultLocale);
    }
  }

  @Test
  public void testMalformedPropertyLists() {
    for (final String xml : new String[] {"not xml at all", "<dict></dict>",
        "<plist><dict><key>x</key></dict></plist>", "<plist><real>abc</real></plist>",
        "<plist><widget/></plist>"}) {
      try {
        PropertyList.read(xml.getBytes(StandardCharsets.UTF_8));
        fail("expected " + xml + " to be rejected");
      } catch (LLFSMException expected) {
        assertEquals(Code.MALFORMED_LAYOUT, expected.getCode());
      }
    }
  }

}
