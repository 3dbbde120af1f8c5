package bgcnet.main.test;

import bgcnet.main.io.ParseUtils;
import junit.framework.TestCase;

public class ParseUtilsTest extends TestCase {
	public void testParseString() {
		String [] items = ParseUtils.parseString("a\t\tb\t", '\t');
		assertEquals(4, items.length);
		assertEquals("a", items[0]);
		assertEquals("", items[1]);
		assertEquals("b", items[2]);
		assertEquals("", items[3]);
	}
	public void testParseDoubles() {
		double [] values = ParseUtils.parseDoubles("0, 0.5,0.75");
		assertEquals(3, values.length);
		assertEquals(0.5, values[1], 0);
		assertEquals(0.75, values[2], 0);
	}
	public void testFormatNumber() {
		assertEquals("0.25", ParseUtils.formatNumber(0.25));
		assertEquals("1.0", ParseUtils.formatNumber(1));
		assertEquals("0.333333", ParseUtils.formatNumber(1.0/3));
		assertEquals("inf", ParseUtils.formatNumber(Double.POSITIVE_INFINITY));
	}
}
