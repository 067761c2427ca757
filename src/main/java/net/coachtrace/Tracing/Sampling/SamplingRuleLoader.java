package net.coachtrace.Tracing.Sampling;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.coachtrace.Tracing.Config.TracingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the startup sampling rules from configuration: inline rules first, then the
 * JSON array found at sampling.rules-location. Invalid rules are logged and skipped.
 */
public class SamplingRuleLoader {

    private static final Logger logger = LoggerFactory.getLogger(SamplingRuleLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public SamplingRuleLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public List<SamplingRule> load(TracingProperties.Sampling sampling) {
        List<SamplingRule> rules = new ArrayList<>();

        for (TracingProperties.Rule rule : sampling.getRules()) {
            try {
                rules.add(new SamplingRule(rule.getName(), rule.getMatch(), rule.getTraceNamePattern(), rule.getRate()));
            } catch (IllegalArgumentException e) {
                logger.warn("skipping invalid sampling rule {}: {}", rule.getName(), e.getMessage());
            }
        }

        if (StringUtils.hasText(sampling.getRulesLocation())) {
            rules.addAll(load(resourceLoader.getResource(sampling.getRulesLocation())));
        }

        return rules;
    }

    /**
     * Reads a JSON array of rules. An unreadable resource yields no rules.
     */
    public List<SamplingRule> load(Resource resource) {
        List<SamplingRule> rules = new ArrayList<>();
        if (!resource.exists()) {
            logger.warn("sampling rules resource {} does not exist", resource.getDescription());
            return rules;
        }

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            logger.error("failed to read sampling rules from {}: {}", resource.getDescription(), e.getMessage());
            return rules;
        }

        if (root == null || !root.isArray()) {
            logger.error("sampling rules in {} must be a JSON array", resource.getDescription());
            return rules;
        }

        for (JsonNode node : root) {
            try {
                rules.add(objectMapper.treeToValue(node, SamplingRule.class));
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("skipping invalid sampling rule {} in {}: {}", node, resource.getDescription(), e.getMessage());
            }
        }

        logger.info("loaded {} sampling rule(s) from {}", rules.size(), resource.getDescription());
        return rules;
    }
}
