package generation;

import coverage.CoverageResult;

/**
 * Renders coverage targets as a JUnit 5 test class skeleton: one test method per target,
 * preceded by the target description as comment lines.
 */
public class TestSkeletonRenderer {
    private static final String INDENT = "    ";

    public String render(String className, CoverageResult... results) {
        StringBuilder sb = new StringBuilder();
        sb.append("import org.junit.jupiter.api.Test;").append('\n').append('\n');
        sb.append("class ").append(className).append(" {").append('\n');

        for (CoverageResult result : results) {
            sb.append('\n');
            sb.append(INDENT).append("// ").append(result.getCriterion().getDisplayName())
                    .append(" targets for ").append(result.getFunctionName()).append('\n');
            if (!result.isComplete()) {
                sb.append(INDENT).append("// Partial result, uncovered: ").append(result.getUncovered())
                        .append(result.isTruncated() ? " (path enumeration truncated)" : "").append('\n');
            }
            for (CoverageTarget target : result.getTargets()) {
                sb.append('\n');
                for (String line : target.getDescription().split("\n")) {
                    sb.append(INDENT).append("// ").append(line).append('\n');
                }
                sb.append(INDENT).append("@Test").append('\n');
                sb.append(INDENT).append("void test_").append(result.getFunctionName()).append("__")
                        .append(target.getName()).append("() {").append('\n');
                sb.append(INDENT).append(INDENT).append("// ").append(target.getBody().orElse("")).append('\n');
                sb.append(INDENT).append("}").append('\n');
            }
        }

        sb.append("}").append('\n');
        return sb.toString();
    }

    /**
     * @return {@code FooCoverageTest} for function {@code foo}
     */
    public static String defaultClassName(String functionName) {
        if (functionName == null || functionName.isEmpty()) {
            return "CoverageTest";
        }
        return Character.toUpperCase(functionName.charAt(0)) + functionName.substring(1) + "CoverageTest";
    }
}
