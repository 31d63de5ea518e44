package com.execmetrics.domain.model;

import com.execmetrics.domain.enums.GroupDimension;
import java.util.Comparator;
import lombok.Value;

/** Grouping key of an aggregate row. The overall group has no value. */
@Value
public class GroupKey implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator.comparing(GroupKey::getDimension)
            .thenComparing(GroupKey::getValue, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static final GroupKey OVERALL = new GroupKey(GroupDimension.OVERALL, null);

    GroupDimension dimension;
    String value;

    public static GroupKey instrument(String instrumentId) {
        return new GroupKey(GroupDimension.INSTRUMENT, instrumentId);
    }

    public static GroupKey side(String side) {
        return new GroupKey(GroupDimension.SIDE, side);
    }

    public static GroupKey venue(String venue) {
        return new GroupKey(GroupDimension.VENUE, venue);
    }

    /** Label used in the report, e.g. "INSTRUMENT:XYZ" or "OVERALL". */
    public String label() {
        return value == null ? dimension.name() : dimension.name() + ":" + value;
    }

    @Override
    public int compareTo(GroupKey other) {
        return ORDER.compare(this, other);
    }
}
