package com.questrail.gateway.topic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Topic
 * -----------------------------------------------------------------------------
 * A gateway topic: {@code {category}/{service}/{identifier segments...}}.
 *
 * <p>Identifier segments are {@code {serial}/{channel}/{parameter}} for
 * devices and a single identifier for system variables and programs.</p>
 */
public final class Topic
{
    private final TopicCategory category;
    private final TopicService service;
    private final List<String> segments;

    private Topic(TopicCategory category, TopicService service, List<String> segments) {
        this.category = Objects.requireNonNull(category, "category");
        this.service = Objects.requireNonNull(service, "service");
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));

        int expected = category == TopicCategory.DEVICE ? 3 : 1;
        if (this.segments.size() != expected) {
            throw new AddressFormatException("Topic " + category.segment() + " requires "
                    + expected + " identifier segment(s), got " + this.segments.size());
        }
        for (String segment : this.segments) {
            DeviceAddress.requireSegment(segment, "topic segment");
        }
    }

    public static Topic device(TopicService service, DeviceAddress address) {
        return new Topic(TopicCategory.DEVICE, service,
                List.of(address.device(), address.channel(), address.parameter()));
    }

    public static Topic sysvar(TopicService service, SysvarAddress address) {
        return new Topic(TopicCategory.SYSVAR, service, List.of(address.id()));
    }

    public static Topic program(TopicService service, ProgramAddress address) {
        return new Topic(TopicCategory.PROGRAM, service, List.of(address.id()));
    }

    /**
     * Parses a topic name following the gateway grammar.
     *
     * @throws AddressFormatException if the name does not follow the grammar
     */
    public static Topic parse(String name) {
        Objects.requireNonNull(name, "name");
        List<String> levels = Arrays.asList(name.split("/", -1));
        if (levels.size() < 3) {
            throw new AddressFormatException("Topic too short: " + name);
        }
        return new Topic(
                TopicCategory.fromSegment(levels.get(0)),
                TopicService.fromSegment(levels.get(1)),
                levels.subList(2, levels.size())
        );
    }

    /**
     * Subscription filter matching every topic of a category and service,
     * e.g. {@code device/set/#}.
     */
    public static String filter(TopicCategory category, TopicService service) {
        return category.segment() + "/" + service.segment() + "/#";
    }

    public TopicCategory category() {
        return category;
    }

    public TopicService service() {
        return service;
    }

    public List<String> segments() {
        return segments;
    }

    /**
     * Device address of a device topic.
     *
     * @throws IllegalStateException if this is not a device topic
     */
    public DeviceAddress deviceAddress() {
        if (category != TopicCategory.DEVICE) {
            throw new IllegalStateException("Not a device topic: " + this);
        }
        return new DeviceAddress(segments.get(0), segments.get(1), segments.get(2));
    }

    /**
     * @throws IllegalStateException if this is not a system variable topic
     */
    public SysvarAddress sysvarAddress() {
        if (category != TopicCategory.SYSVAR) {
            throw new IllegalStateException("Not a sysvar topic: " + this);
        }
        return new SysvarAddress(segments.get(0));
    }

    /**
     * @throws IllegalStateException if this is not a program topic
     */
    public ProgramAddress programAddress() {
        if (category != TopicCategory.PROGRAM) {
            throw new IllegalStateException("Not a program topic: " + this);
        }
        return new ProgramAddress(segments.get(0));
    }

    /**
     * Same identifier, different service. Used to answer {@code get} and
     * {@code set} requests on the matching {@code status} topic.
     */
    public Topic withService(TopicService newService) {
        return new Topic(category, newService, segments);
    }

    /**
     * Topic name as published on the broker.
     */
    public String name() {
        return category.segment() + "/" + service.segment() + "/" + String.join("/", segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Topic)) return false;
        Topic other = (Topic) o;
        return category == other.category && service == other.service && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, service, segments);
    }

    @Override
    public String toString() {
        return name();
    }
}
