package com.questrail.gateway.topic;

import com.questrail.gateway.api.PublishDecision;
import com.questrail.gateway.api.QualityOfService;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PublishPolicyTest
{
    private final PublishPolicy policy = PublishPolicy.defaults();

    @Test
    void steadyStateValuesAreRetainedAtLeastOnce()
    {
        PublishDecision d = policy.resolve("LEVEL");

        assertEquals(QualityOfService.AT_LEAST_ONCE, d.qos());
        assertTrue(d.retain());
    }

    @Test
    void keyPressesAreTransient()
    {
        for (String p : new String[] { "PRESS_SHORT", "PRESS_LONG", "PRESS_LONG_RELEASE", "PRESS_" }) {
            PublishDecision d = policy.resolve(p);
            assertEquals(QualityOfService.EXACTLY_ONCE, d.qos(), p);
            assertFalse(d.retain(), p);
        }
    }

    @Test
    void installTestIsTransient()
    {
        assertEquals(PublishDecision.TRANSIENT, policy.resolve("INSTALL_TEST"));
    }

    @Test
    void matchingIsCaseSensitiveAndAnchored()
    {
        assertEquals(PublishDecision.STEADY_STATE, policy.resolve("press_short"));
        assertEquals(PublishDecision.STEADY_STATE, policy.resolve("LAST_PRESS_SHORT"));
        assertEquals(PublishDecision.STEADY_STATE, policy.resolve("INSTALL_TEST_2"));
    }

    @Test
    void resolveIsDeterministic()
    {
        assertEquals(policy.resolve("STATE"), policy.resolve("STATE"));
        assertEquals(policy.resolve("PRESS_SHORT"), policy.resolve("PRESS_SHORT"));
    }

    @Test
    void configuredTransientsExtendTheDefaults()
    {
        PublishPolicy extended = PublishPolicy.withTransient(Set.of("MOTION_EVENT"), Set.of("KEY_"));

        assertEquals(PublishDecision.TRANSIENT, extended.resolve("MOTION_EVENT"));
        assertEquals(PublishDecision.TRANSIENT, extended.resolve("KEY_1"));
        assertEquals(PublishDecision.TRANSIENT, extended.resolve("PRESS_SHORT"));
        assertEquals(PublishDecision.TRANSIENT, extended.resolve("INSTALL_TEST"));
        assertEquals(PublishDecision.STEADY_STATE, extended.resolve("LEVEL"));
    }
}
