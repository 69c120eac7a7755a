package com.questrail.gateway.events;

import com.questrail.gateway.broker.RecordingMessageBroker;
import com.questrail.gateway.codec.impl.JsonPvCodec;
import com.questrail.gateway.internal.time.FixedWallClock;
import com.questrail.gateway.observability.GatewayErrorEvent;
import com.questrail.gateway.observability.RecordingObservabilitySink;
import com.questrail.gateway.topic.AddressFormatException;
import com.questrail.gateway.topic.PublishPolicy;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MqttEventTranslatorTest
 * -----------------------------------------------------------------------------
 * Translation of controller value changes into broker publications, and the
 * forwarding guarantee of the handler chain when publishing fails.
 */
final class MqttEventTranslatorTest
{
    private static final Instant NOW = Instant.ofEpochMilli(1_700_000_000_000L);

    private final RecordingMessageBroker broker = new RecordingMessageBroker();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FixedWallClock clock = new FixedWallClock(NOW);
    private final MqttEventTranslator translator = new MqttEventTranslator(
        broker, new JsonPvCodec(clock), PublishPolicy.defaults(), sink, clock);

    @Test
    void valueChangeIsPublishedRetainedAtLeastOnce()
    {
        translator.handle(new ControllerNotification.ValueChanged("BidCos-RF", "ABC123:1", "LEVEL", 42.5));

        List<RecordingMessageBroker.Published> published = broker.published();
        assertEquals(1, published.size());
        RecordingMessageBroker.Published p = published.get(0);
        assertEquals("device/status/ABC123/1/LEVEL", p.topic());
        assertEquals(1, p.qos());
        assertTrue(p.retain());
        assertEquals("{\"v\":42.5,\"ts\":1700000000000,\"s\":0}",
            new String(p.payload(), StandardCharsets.UTF_8));
    }

    @Test
    void keyPressIsPublishedExactlyOnceNotRetained()
    {
        translator.handle(new ControllerNotification.ValueChanged("BidCos-RF", "KEY0001:2", "PRESS_SHORT", true));

        RecordingMessageBroker.Published p = broker.published().get(0);
        assertEquals("device/status/KEY0001/2/PRESS_SHORT", p.topic());
        assertEquals(2, p.qos());
        assertFalse(p.retain());
    }

    @Test
    void otherNotificationsAreIgnored()
    {
        translator.handle(new ControllerNotification.DevicesDeleted("BidCos-RF", List.of("ABC123")));
        translator.handle(new ControllerNotification.DeviceUpdated("BidCos-RF", "ABC123", 0));
        translator.handle(new ControllerNotification.DevicesReadded("BidCos-RF", List.of("ABC123")));

        assertTrue(broker.published().isEmpty());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void malformedAddressIsReportedNotThrown()
    {
        assertDoesNotThrow(() -> translator.handle(
            new ControllerNotification.ValueChanged("BidCos-RF", "ABC123", "LEVEL", 1)));

        assertTrue(broker.published().isEmpty());
        List<GatewayErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertInstanceOf(AddressFormatException.class, errors.get(0).cause());
        assertTrue(errors.get(0).message().startsWith("Publish of event failed"));
    }

    @Test
    void unencodableValueIsReported()
    {
        translator.handle(new ControllerNotification.ValueChanged("BidCos-RF", "ABC123:1", "LEVEL", Map.of()));

        assertTrue(broker.published().isEmpty());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void downstreamReceivesEveryNotificationWhilePublishingFails()
    {
        // GIVEN: a chain [translator, downstream] and a broker rejecting every publication
        List<ControllerNotification> downstream = new ArrayList<>();
        HandlerChain chain = HandlerChain.of(translator, downstream::add);
        broker.setRejecting(true);

        List<ControllerNotification> sent = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            sent.add(new ControllerNotification.ValueChanged("BidCos-RF", "ABC123:1", "LEVEL", i));
        }
        sent.add(new ControllerNotification.ValueChanged("BidCos-RF", "bad-address", "LEVEL", 0));

        // WHEN
        for (ControllerNotification n : sent) {
            chain.handle(n);
        }

        // THEN: downstream saw exactly the same notifications in the same order
        assertEquals(sent, downstream);
        assertEquals(6, sink.getErrors().size());
        assertTrue(broker.published().isEmpty());
    }
}
