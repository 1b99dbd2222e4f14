package com.laborjustice.casechain.configuration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Interpretation Executor Config Tests")
class InterpretationExecutorConfigTest {

    @ParameterizedTest(name = "{0} threads")
    @ValueSource(ints = {1, 4})
    @DisplayName("Pool is sized by the configured thread count, one thread included")
    void testPoolSize(int threads) {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getEngine().setInterpretationThreads(threads);

        ThreadPoolTaskExecutor executor = new InterpretationExecutorConfig().interpretationExecutor(properties);
        try {
            assertEquals(threads, executor.getCorePoolSize());
            assertEquals(threads, executor.getMaxPoolSize());
            assertEquals("interpret-", executor.getThreadNamePrefix());
        } finally {
            executor.shutdown();
        }
    }
}
