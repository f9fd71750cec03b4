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

import java.time.Duration;
import java.util.Properties;

public class DefaultEngineConfiguration implements EngineConfiguration {

    public static final String PREFIX = "docsaga.";

    private Duration commandTimeout = Duration.ofSeconds(5);
    private Duration sagaDispatchTimeout = Duration.ofSeconds(5);
    private Duration sagaRetryDelay = Duration.ofSeconds(1);
    private int sagaMaxRetries = 5;
    private int optimisticLockAttempts = 5;
    private Duration correlationTimeout = Duration.ofSeconds(10);
    private Duration pollInterval = Duration.ofMillis(200);
    private int batchSize = 100;
    private Duration idleTimeout = Duration.ofMinutes(10);
    private int poolSize = 4;

    /**
     * Read settings from properties. Keys are prefixed with {@code docsaga.}, durations are given in milliseconds,
     * e. g. {@code docsaga.commandTimeout=5000}. Missing keys keep their defaults.
     * @param properties the properties
     * @return new configuration
     * @throws IllegalArgumentException when a value is not a number
     */
    public static DefaultEngineConfiguration fromProperties(Properties properties) {
        DefaultEngineConfiguration conf = new DefaultEngineConfiguration();
        conf.setCommandTimeout(duration(properties, "commandTimeout", conf.getCommandTimeout()));
        conf.setSagaDispatchTimeout(duration(properties, "sagaDispatchTimeout", conf.getSagaDispatchTimeout()));
        conf.setSagaRetryDelay(duration(properties, "sagaRetryDelay", conf.getSagaRetryDelay()));
        conf.setSagaMaxRetries(integer(properties, "sagaMaxRetries", conf.getSagaMaxRetries()));
        conf.setOptimisticLockAttempts(integer(properties, "optimisticLockAttempts",
            conf.getOptimisticLockAttempts()));
        conf.setCorrelationTimeout(duration(properties, "correlationTimeout", conf.getCorrelationTimeout()));
        conf.setPollInterval(duration(properties, "pollInterval", conf.getPollInterval()));
        conf.setBatchSize(integer(properties, "batchSize", conf.getBatchSize()));
        conf.setIdleTimeout(duration(properties, "idleTimeout", conf.getIdleTimeout()));
        conf.setPoolSize(integer(properties, "poolSize", conf.getPoolSize()));
        return conf;
    }

    private static Duration duration(Properties properties, String key, Duration defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        return value == null ? defaultValue : Duration.ofMillis(parse(key, value));
    }

    private static int integer(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        return value == null ? defaultValue : (int) parse(key, value);
    }

    private static long parse(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + PREFIX + key + " is not a number: " + value, e);
        }
    }

    @Override
    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    @Override
    public Duration getSagaDispatchTimeout() {
        return sagaDispatchTimeout;
    }

    public void setSagaDispatchTimeout(Duration sagaDispatchTimeout) {
        this.sagaDispatchTimeout = sagaDispatchTimeout;
    }

    @Override
    public Duration getSagaRetryDelay() {
        return sagaRetryDelay;
    }

    public void setSagaRetryDelay(Duration sagaRetryDelay) {
        this.sagaRetryDelay = sagaRetryDelay;
    }

    @Override
    public int getSagaMaxRetries() {
        return sagaMaxRetries;
    }

    public void setSagaMaxRetries(int sagaMaxRetries) {
        this.sagaMaxRetries = sagaMaxRetries;
    }

    @Override
    public int getOptimisticLockAttempts() {
        return optimisticLockAttempts;
    }

    public void setOptimisticLockAttempts(int optimisticLockAttempts) {
        this.optimisticLockAttempts = optimisticLockAttempts;
    }

    @Override
    public Duration getCorrelationTimeout() {
        return correlationTimeout;
    }

    public void setCorrelationTimeout(Duration correlationTimeout) {
        this.correlationTimeout = correlationTimeout;
    }

    @Override
    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    @Override
    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    @Override
    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    @Override
    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    @Override
    public String toString() {
        return "DefaultEngineConfiguration{" + "commandTimeout=" + commandTimeout + ", sagaDispatchTimeout="
                + sagaDispatchTimeout + ", sagaRetryDelay=" + sagaRetryDelay + ", sagaMaxRetries=" + sagaMaxRetries
                + ", optimisticLockAttempts=" + optimisticLockAttempts + ", correlationTimeout="
                + correlationTimeout + ", pollInterval=" + pollInterval + ", batchSize=" + batchSize
                + ", idleTimeout=" + idleTimeout + ", poolSize=" + poolSize + '}';
    }
}
