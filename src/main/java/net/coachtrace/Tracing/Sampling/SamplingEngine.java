package net.coachtrace.Tracing.Sampling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a trace is recorded.
 *
 * Rules are evaluated in order and the first matching rule's rate is used, even if
 * a later rule would also match. When no rule matches the default rate applies.
 * The rate and the rule list are replaced wholesale, last writer wins.
 */
public class SamplingEngine {

    private static final Logger logger = LoggerFactory.getLogger(SamplingEngine.class);

    private final DoubleSupplier random;
    private volatile double samplingRate;
    private volatile List<SamplingRule> rules;

    public SamplingEngine(double samplingRate, List<SamplingRule> rules) {
        this(samplingRate, rules, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1)
     */
    public SamplingEngine(double samplingRate, List<SamplingRule> rules, DoubleSupplier random) {
        if (Double.isNaN(samplingRate) || samplingRate < 0 || samplingRate > 1) {
            throw new IllegalArgumentException("samplingRate must be between 0 and 1, was " + samplingRate);
        }
        this.samplingRate = samplingRate;
        this.rules = List.copyOf(rules);
        this.random = random;
    }

    public boolean shouldSample(String traceName, @Nullable Map<String, ?> metadata) {
        for (SamplingRule rule : rules) {
            if (rule.matches(traceName, metadata)) {
                return random.getAsDouble() < rule.getRate();
            }
        }
        return random.getAsDouble() < samplingRate;
    }

    /**
     * Sets the rate used when no rule matches. An out-of-range rate is logged and ignored.
     */
    public void setSamplingRate(double rate) {
        if (Double.isNaN(rate) || rate < 0 || rate > 1) {
            logger.warn("invalid sampling rate {}, must be between 0 and 1", rate);
            return;
        }
        this.samplingRate = rate;
        logger.info("sampling rate updated to {}%", rate * 100);
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    public void setSamplingRules(List<SamplingRule> rules) {
        this.rules = List.copyOf(rules);
        logger.info("sampling rules updated: {} rule(s) configured", this.rules.size());
    }

    /**
     * @return an immutable snapshot of the current rules
     */
    public List<SamplingRule> getSamplingRules() {
        return rules;
    }
}
