package com.channelcatalog.generator;

import com.channelcatalog.verifier.Channel;

import java.util.Comparator;

/**
 * Channel attributes the index engine can sort by. Each comparator is ascending, with missing
 * values (null status, zero height, empty strings) first.
 */
public enum SortKey {
    NAME(Comparator.comparing(Channel::getName)),
    STATUS(Comparator.comparing(Channel::getStatus, Comparator.nullsFirst(Comparator.naturalOrder()))),
    RESOLUTION_HEIGHT(Comparator.comparingInt(c -> c.getResolution().height())),
    URL(Comparator.comparing(Channel::getUrl)),
    CATEGORY(Comparator.comparing(Channel::getCategoryId));

    private final Comparator<Channel> ascending;

    SortKey(Comparator<Channel> ascending) {
        this.ascending = ascending;
    }

    public Comparator<Channel> comparator(Direction direction) {
        return direction == Direction.DESC ? ascending.reversed() : ascending;
    }

    public enum Direction { ASC, DESC }
}
