package com.funnelduck.test;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for funnelduck tests: logs test names, steps and intermediate data.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @BeforeEach
    void logTestName(TestInfo testInfo) {
        logger.info("Running {}", testInfo.getDisplayName());
    }

    protected void logStep(String step) {
        logger.info("  step: {}", step);
    }

    protected void logData(String label, Object data) {
        logger.debug("  {}: {}", label, data);
    }
}
