package com.sentinel.core.tier;

import com.sentinel.core.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw test-runner output into a structured {@link TestResult}.
 * <p>
 * Recognises Maven/JUnit, pytest and Jest summaries. Without a summary the
 * process exit code decides, with build-failure markers as a final check.
 */
public class TestOutputParser {

    private static final Logger log = LoggerFactory.getLogger(TestOutputParser.class);

    /** Maven/JUnit style: "Tests run: 10, Failures: 2, Errors: 1" */
    private static final Pattern MAVEN_PATTERN =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+)(?:,\\s*Errors:\\s*(\\d+))?");

    /** Jest style: "Tests:       2 failed, 8 passed, 10 total" */
    private static final Pattern JEST_PATTERN =
            Pattern.compile("Tests:\\s+(?:(\\d+)\\s+failed,\\s+)?(?:(\\d+)\\s+passed,\\s+)?(\\d+)\\s+total");

    /** pytest style: "8 passed, 2 failed" or "8 passed" */
    private static final Pattern PYTEST_PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");

    private static final Pattern BUILD_FAILURE_PATTERN =
            Pattern.compile("(?i)(BUILD FAILURE|BUILD FAILED|COMPILATION ERROR|npm ERR!|^FAIL\\s)", Pattern.MULTILINE);

    /**
     * @param taskId     the task whose changes were validated
     * @param output     combined stdout/stderr of the test command
     * @param exitCode   process exit code
     * @param durationMs how long the run took
     */
    public TestResult parse(String taskId, String output, int exitCode, long durationMs) {
        String text = output != null ? output : "";

        // Maven prints one line per test class; the last one is the aggregate
        Matcher mavenMatcher = MAVEN_PATTERN.matcher(text);
        int mavenTotal = -1;
        int mavenFailed = 0;
        while (mavenMatcher.find()) {
            mavenTotal = Integer.parseInt(mavenMatcher.group(1));
            mavenFailed = Integer.parseInt(mavenMatcher.group(2))
                    + (mavenMatcher.group(3) != null ? Integer.parseInt(mavenMatcher.group(3)) : 0);
        }
        if (mavenTotal >= 0) {
            boolean passed = mavenFailed == 0 && exitCode == 0;
            log.info("Parsed Maven-style output for {}: {}/{} tests passed", taskId, mavenTotal - mavenFailed, mavenTotal);
            return new TestResult(taskId, passed, mavenTotal, mavenFailed, text, durationMs);
        }

        Matcher jestMatcher = JEST_PATTERN.matcher(text);
        if (jestMatcher.find()) {
            int failed = jestMatcher.group(1) != null ? Integer.parseInt(jestMatcher.group(1)) : 0;
            int total = Integer.parseInt(jestMatcher.group(3));
            log.info("Parsed Jest-style output for {}: {}/{} tests passed", taskId, total - failed, total);
            return new TestResult(taskId, failed == 0 && exitCode == 0, total, failed, text, durationMs);
        }

        Matcher passedMatcher = PYTEST_PASSED_PATTERN.matcher(text);
        Matcher failedMatcher = PYTEST_FAILED_PATTERN.matcher(text);
        boolean foundPassed = passedMatcher.find();
        boolean foundFailed = failedMatcher.find();
        if (foundPassed || foundFailed) {
            int passedCount = foundPassed ? Integer.parseInt(passedMatcher.group(1)) : 0;
            int failedCount = foundFailed ? Integer.parseInt(failedMatcher.group(1)) : 0;
            log.info("Parsed pytest-style output for {}: {}/{} tests passed",
                    taskId, passedCount, passedCount + failedCount);
            return new TestResult(taskId, failedCount == 0 && exitCode == 0,
                    passedCount + failedCount, failedCount, text, durationMs);
        }

        if (exitCode != 0) {
            log.info("No test summary for {}, command exited {}", taskId, exitCode);
            return new TestResult(taskId, false, 0, 0, text, durationMs);
        }
        if (BUILD_FAILURE_PATTERN.matcher(text).find()) {
            log.info("Build/test failure marker found in output for {} despite exit 0", taskId);
            return new TestResult(taskId, false, 0, 0, text, durationMs);
        }
        log.info("No test framework output found for {}, exit 0 treated as passed", taskId);
        return new TestResult(taskId, true, 0, 0, text, durationMs);
    }
}
