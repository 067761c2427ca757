package net.coachtrace;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.coachtrace.Tracing.Config.TracingProperties;
import net.coachtrace.Tracing.Sampling.SamplingRule;
import net.coachtrace.Tracing.Sampling.SamplingRuleLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SamplingRuleLoaderTest {

    private SamplingRuleLoader loader;

    @BeforeEach
    void setUp() {
        loader = new SamplingRuleLoader(new ObjectMapper(), new DefaultResourceLoader());
    }

    @Test
    void testLoadResource_SkipsInvalidRules() {
        // When
        List<SamplingRule> rules = loader.load(new ClassPathResource("sampling-rules.json"));

        // Then - broken_rate and broken_pattern are skipped
        assertEquals(3, rules.size());
        assertEquals("always_sample_shark", rules.get(0).getName());
        assertEquals(Map.of("agent", "shark_auditor"), rules.get(0).getMatch());
        assertEquals("cashflow_chains", rules.get(1).getName());
        assertEquals(0.5, rules.get(1).getRate());
        assertEquals("production_sampling", rules.get(2).getName());
    }

    @Test
    void testLoadResource_NotAnArrayYieldsNoRules() {
        ByteArrayResource resource = new ByteArrayResource(
                "{\"name\":\"x\",\"rate\":1.0}".getBytes(StandardCharsets.UTF_8));

        assertTrue(loader.load(resource).isEmpty());
    }

    @Test
    void testLoadResource_MalformedJsonYieldsNoRules() {
        ByteArrayResource resource = new ByteArrayResource("[{".getBytes(StandardCharsets.UTF_8));

        assertTrue(loader.load(resource).isEmpty());
    }

    @Test
    void testLoadResource_MissingResourceYieldsNoRules() {
        assertTrue(loader.load(new ClassPathResource("does-not-exist.json")).isEmpty());
    }

    @Test
    void testLoadProperties_InlineRulesFirstThenLocation() {
        // Given
        TracingProperties.Rule inline = new TracingProperties.Rule();
        inline.setName("inline_goal_tracker");
        inline.setMatch(Map.of("agent", "goal_tracker"));
        inline.setRate(0.2);

        TracingProperties.Rule invalid = new TracingProperties.Rule();
        invalid.setName("inline_invalid");
        invalid.setRate(3.0);

        TracingProperties.Sampling sampling = new TracingProperties.Sampling();
        sampling.setRules(List.of(inline, invalid));
        sampling.setRulesLocation("classpath:sampling-rules.json");

        // When
        List<SamplingRule> rules = loader.load(sampling);

        // Then
        assertEquals(4, rules.size());
        assertEquals("inline_goal_tracker", rules.get(0).getName());
        assertEquals(0.2, rules.get(0).getRate());
        assertEquals("always_sample_shark", rules.get(1).getName());
    }

    @Test
    void testLoadProperties_NoRulesConfigured() {
        assertTrue(loader.load(new TracingProperties.Sampling()).isEmpty());
    }
}
