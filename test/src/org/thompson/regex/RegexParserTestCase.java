/* @LICENSE@
 */

package org.thompson.regex;

import java.util.regex.PatternSyntaxException;

public class RegexParserTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexParserTestCase.class);
    }

    public RegexParserTestCase(String name) {
        super(name);
    }

    private static void assertThrows(String normalized) {
        try {
            @SuppressWarnings("unused")
            String postfix = RegexParser.toPostfix(normalized);
            fail("should throw: " + normalized);
        } catch (PatternSyntaxException e) {}
    }

    public void testNormalize() {
        assertEquals("a.b", RegexParser.normalize("ab"));
        assertEquals("a.(a|b)*.b", RegexParser.normalize("a(a|b)*b"));
        assertEquals("a.(b|c)*", RegexParser.normalize("a(b|c)*"));
        assertEquals("a*.b*", RegexParser.normalize("a*b*"));
        assertEquals("(a).(b)", RegexParser.normalize("(a)(b)"));
        assertEquals("a|b.c", RegexParser.normalize("a|bc"));
    }

    public void testNormalizeDegenerate() {
        assertEquals("", RegexParser.normalize(""));
        assertEquals("a", RegexParser.normalize("a"));
        assertEquals("*", RegexParser.normalize("*"));
        assertEquals("(", RegexParser.normalize("("));
    }

    public void testNormalizeReservedDot() {
        try {
            RegexParser.normalize("a.b");
            fail("'.' is reserved");
        } catch (PatternSyntaxException e) {
            assertEquals(1, e.getIndex());
            assertEquals("a.b", e.getPattern());
        }
    }

    public void testSurrogatesRejected() {
        // U+1F600 is a surrogate pair in UTF-16
        String regex = "a\uD83D\uDE00*";
        try {
            RegexParser.normalize(regex);
            fail("supplementary symbol");
        } catch (PatternSyntaxException e) {
            assertEquals(1, e.getIndex());
        }
        try {
            Pattern.compile("\uDE00");
            fail("unpaired surrogate");
        } catch (PatternSyntaxException e) {
            assertEquals(0, e.getIndex());
        }
        assertEquals("\u00e9.b*", RegexParser.normalize("\u00e9b*"));
    }

    public void testToPostfix() {
        assertEquals("aa.b.", RegexParser.toPostfix("a.a.b"));
        assertEquals("ab|", RegexParser.toPostfix("a|b"));
        assertEquals("ab*|", RegexParser.toPostfix("a|b*"));
        assertEquals("aab|.", RegexParser.toPostfix("a.(a|b)"));
        assertEquals("aab|*.b.", RegexParser.toPostfix("a.(a|b)*.b"));
    }

    public void testLeftAssociative() {
        assertEquals("ab|c|", RegexParser.toPostfix("a|b|c"));
        assertEquals("ab.c.", RegexParser.toPostfix("a.b.c"));
        assertEquals("ab.cd.|", RegexParser.toPostfix("a.b|c.d"));
        assertEquals("abc|.", RegexParser.toPostfix("a.(b|c)"));
    }

    public void testClosureBindsTightest() {
        assertEquals("ab*.", RegexParser.toPostfix("a.b*"));
        assertEquals("ab.*", RegexParser.toPostfix("(a.b)*"));
        assertEquals("a**", RegexParser.toPostfix("a**"));
    }

    public void testToPostfixDegenerate() {
        assertEquals("", RegexParser.toPostfix(""));
        assertEquals("a", RegexParser.toPostfix("a"));
        assertEquals("a", RegexParser.toPostfix("((a))"));
    }

    public void testUnbalanced() {
        assertThrows("(a");
        assertThrows("a)");
        assertThrows("(a|b");
        assertThrows("((a)");
        assertThrows("(a).b)");
    }

    public void testUnclosedGroupIndex() {
        try {
            RegexParser.toPostfix("a.(b|(c)");
            fail();
        } catch (PatternSyntaxException e) {
            assertEquals(2, e.getIndex());
        }
    }

    public void testMissingOperand() {
        assertThrows("*");
        assertThrows("|a");
        assertThrows("a|");
        assertThrows("a.");
        assertThrows(".a");
        assertThrows("a||b");
        assertThrows("(|a)");
        assertThrows("(a|)");
        assertThrows("()");
    }

    public void testMissingOperator() {
        assertThrows("ab");             // not normalized
        assertThrows("a(b)");
        assertThrows("(a)b");
    }

    public void testErrorsBeforeConstruction() {
        try {
            Pattern.compile("a(b");
            fail();
        } catch (PatternSyntaxException e) {}
        try {
            Pattern.compile("a|");
            fail();
        } catch (PatternSyntaxException e) {}
    }
}
