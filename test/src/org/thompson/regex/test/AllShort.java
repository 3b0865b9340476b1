/* @LICENSE@
 */


package org.thompson.regex.test;

import org.thompson.regex.AutomatonReaderTestCase;
import org.thompson.regex.DFATestCase;
import org.thompson.regex.EpsilonClosureTestCase;
import org.thompson.regex.NFATestCase;
import org.thompson.regex.RegexParserTestCase;
import org.thompson.regex.ThompsonTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(RegexParserTestCase.class);
        suite.addTestSuite(ThompsonTestCase.class);
        suite.addTestSuite(EpsilonClosureTestCase.class);
        suite.addTestSuite(NFATestCase.class);
        suite.addTestSuite(DFATestCase.class);
        suite.addTestSuite(AutomatonReaderTestCase.class);
        suite.addTestSuite(MatcherTestCase.class);
        suite.addTestSuite(LanguageLawsTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
