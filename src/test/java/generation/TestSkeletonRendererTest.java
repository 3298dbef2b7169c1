package generation;

import coverage.CoverageResult;
import coverage.EdgeCoverage;
import coverage.EdgePairCoverage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static tree.TreeFixtures.*;

class TestSkeletonRendererTest {

    @Test
    void testRendersOneMethodPerTarget() {
        CoverageResult result = new EdgeCoverage().generate(function("sign",
                ifElse("x > 0", 1, block(simple("y = 1", 2)), block(simple("y = 2", 4)))));

        String source = new TestSkeletonRenderer().render("SignCoverageTest", result);

        assertTrue(source.startsWith("import org.junit.jupiter.api.Test;\n"));
        assertTrue(source.contains("class SignCoverageTest {"));
        assertTrue(source.contains("    // Edge Coverage targets for sign\n"));
        assertTrue(source.contains("    void test_sign__sign_edge_0() {\n"));
        assertTrue(source.contains("    void test_sign__sign_edge_1() {\n"));
        assertTrue(source.contains("    // Expected edges: n0->n2\n"));
        assertTrue(source.contains("        // sign(/* inputs that drive this path */);\n"));
        assertFalse(source.contains("Partial result"));
        assertTrue(source.endsWith("}\n"));
    }

    @Test
    void testMarksPartialResults() {
        CoverageResult result = new EdgePairCoverage().generate(function("count",
                simple("i = 0", 1),
                whileLoop("i < 3", 2, simple("i += 1", 3)),
                ret("return i", 4)));

        String source = new TestSkeletonRenderer().render("CountCoverageTest", result);

        assertTrue(source.contains("// Partial result, uncovered: [n2->n1->n2]\n"));
    }

    @Test
    void testDefaultClassName() {
        assertEquals("ParseHeaderCoverageTest", TestSkeletonRenderer.defaultClassName("parseHeader"));
        assertEquals("CoverageTest", TestSkeletonRenderer.defaultClassName(""));
    }
}
