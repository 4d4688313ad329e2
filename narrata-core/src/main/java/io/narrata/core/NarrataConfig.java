package io.narrata.core;

import java.util.Properties;

/// Configuration options for Narrata debug sessions.
///
/// Controls the runaway-loop guard, auto-play pacing and the project whose
/// variables seed new sessions. Use the {@link Builder} for fluent configuration,
/// {@link #fromProperties(Properties)} to read a properties file, or construct
/// directly with setters.
///
/// ### Default Values
/// - `maxSteps`: `1000`
/// - `stepLimitIncrement`: `1000` (added by "continue past limit")
/// - `autoPlayDelayMillis`: `800`, clamped to `200..3000`
/// - `projectId`: `"default"`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link NarrataFactory}
/// and do not modify afterwards.
///
/// @see NarrataFactory#bootstrap(NarrataConfig, io.narrata.core.flow.FlowRepository,
///     io.narrata.core.sheet.SheetRepository)
public class NarrataConfig {

    public static final String MAX_STEPS = "narrata.max-steps";
    public static final String STEP_LIMIT_INCREMENT = "narrata.step-limit-increment";
    public static final String AUTO_PLAY_DELAY = "narrata.auto-play-delay-ms";
    public static final String PROJECT_ID = "narrata.project-id";

    private int maxSteps = 1000;
    private int stepLimitIncrement = 1000;
    private long autoPlayDelayMillis = 800;
    private long minAutoPlayDelayMillis = 200;
    private long maxAutoPlayDelayMillis = 3000;
    private String projectId = "default";

    /// Creates a configuration with default values.
    public NarrataConfig() {}

    /// Reads a configuration from properties, keeping defaults for absent keys.
    ///
    /// @param properties source properties, not null
    /// @return a new configuration, never null
    /// @throws IllegalArgumentException if a numeric property is not a number
    public static NarrataConfig fromProperties(Properties properties) {
        NarrataConfig config = new NarrataConfig();
        config.setMaxSteps(intProperty(properties, MAX_STEPS, config.maxSteps));
        config.setStepLimitIncrement(
                intProperty(properties, STEP_LIMIT_INCREMENT, config.stepLimitIncrement));
        config.setAutoPlayDelayMillis(
                intProperty(properties, AUTO_PLAY_DELAY, (int) config.autoPlayDelayMillis));
        config.setProjectId(properties.getProperty(PROJECT_ID, config.projectId).trim());
        return config;
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer: " + raw, e);
        }
    }

    /// Returns the step limit of a fresh session.
    public int getMaxSteps() {
        return maxSteps;
    }

    /// Sets the step limit of a fresh session.
    ///
    /// @param maxSteps step limit, must be positive
    public void setMaxSteps(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
        this.maxSteps = maxSteps;
    }

    public int getStepLimitIncrement() {
        return stepLimitIncrement;
    }

    /// Sets how many steps "continue past limit" adds.
    ///
    /// @param stepLimitIncrement increment, must be positive
    public void setStepLimitIncrement(int stepLimitIncrement) {
        if (stepLimitIncrement <= 0) {
            throw new IllegalArgumentException("stepLimitIncrement must be positive");
        }
        this.stepLimitIncrement = stepLimitIncrement;
    }

    public long getAutoPlayDelayMillis() {
        return autoPlayDelayMillis;
    }

    /// Sets the pause between auto-play steps, clamped to the allowed range.
    public void setAutoPlayDelayMillis(long autoPlayDelayMillis) {
        this.autoPlayDelayMillis = clampAutoPlayDelay(autoPlayDelayMillis);
    }

    public long getMinAutoPlayDelayMillis() {
        return minAutoPlayDelayMillis;
    }

    public long getMaxAutoPlayDelayMillis() {
        return maxAutoPlayDelayMillis;
    }

    /// Clamps a delay to `[minAutoPlayDelayMillis, maxAutoPlayDelayMillis]`.
    public long clampAutoPlayDelay(long delayMillis) {
        return Math.max(minAutoPlayDelayMillis, Math.min(maxAutoPlayDelayMillis, delayMillis));
    }

    /// Returns the project whose variables seed new sessions.
    ///
    /// @return the project id, never null
    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be blank");
        }
        this.projectId = projectId;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link NarrataConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it
    /// on {@link #build()}.
    public static class Builder {
        private final NarrataConfig config = new NarrataConfig();

        public Builder maxSteps(int maxSteps) {
            config.setMaxSteps(maxSteps);
            return this;
        }

        public Builder stepLimitIncrement(int stepLimitIncrement) {
            config.setStepLimitIncrement(stepLimitIncrement);
            return this;
        }

        public Builder autoPlayDelayMillis(long autoPlayDelayMillis) {
            config.setAutoPlayDelayMillis(autoPlayDelayMillis);
            return this;
        }

        public Builder projectId(String projectId) {
            config.setProjectId(projectId);
            return this;
        }

        public NarrataConfig build() {
            return config;
        }
    }
}
