package coverage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoverageCriterionTest {

    @Test
    void testFromName() {
        assertEquals(CoverageCriterion.EDGE_PAIR, CoverageCriterion.fromName("edge-pair"));
        assertEquals(CoverageCriterion.EDGE_PAIR, CoverageCriterion.fromName("EDGE_PAIR"));
        assertEquals(CoverageCriterion.PRIME_PATH, CoverageCriterion.fromName("prime"));
        assertEquals(CoverageCriterion.NODE, CoverageCriterion.fromName(" Node "));
        assertThrows(IllegalArgumentException.class, () -> CoverageCriterion.fromName("branch"));
        assertThrows(IllegalArgumentException.class, () -> CoverageCriterion.fromName(null));
    }

    @Test
    void testGeneratorsMatchCriterion() {
        for (CoverageCriterion criterion : CoverageCriterion.values()) {
            CoverageGenerator generator = criterion.newGenerator();
            assertEquals(criterion, generator.getCriterion());
            assertEquals(criterion.getDisplayName(), generator.getName());
        }
        assertTrue(CoverageCriterion.EDGE.newGenerator() instanceof EdgeCoverage);
    }
}
