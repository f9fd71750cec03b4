package io.github.goodees.docsaga.core.config;

/*-
 * #%L
 * ese
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.junit.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.Assert.assertEquals;

public class DefaultEngineConfigurationTest {

    @Test
    public void missing_keys_keep_defaults() {
        DefaultEngineConfiguration conf = DefaultEngineConfiguration.fromProperties(new Properties());
        assertEquals(Duration.ofSeconds(5), conf.getCommandTimeout());
        assertEquals(5, conf.getSagaMaxRetries());
        assertEquals(100, conf.getBatchSize());
        assertEquals(4, conf.getPoolSize());
    }

    @Test
    public void prefixed_keys_are_read_as_milliseconds() {
        Properties props = new Properties();
        props.setProperty("docsaga.commandTimeout", "1500");
        props.setProperty("docsaga.sagaRetryDelay", " 20 ");
        props.setProperty("docsaga.optimisticLockAttempts", "9");
        props.setProperty("commandTimeout", "1");

        DefaultEngineConfiguration conf = DefaultEngineConfiguration.fromProperties(props);
        assertEquals(Duration.ofMillis(1500), conf.getCommandTimeout());
        assertEquals(Duration.ofMillis(20), conf.getSagaRetryDelay());
        assertEquals(9, conf.getOptimisticLockAttempts());
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformed_number_is_reported() {
        Properties props = new Properties();
        props.setProperty("docsaga.pollInterval", "soon");
        DefaultEngineConfiguration.fromProperties(props);
    }
}
