package schemamigrator.port.memory;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Orders column values: numbers numerically regardless of boxed type, other
 * comparables naturally, nulls first. Mixed incomparable types fall back to
 * their string form.
 */
enum ValueComparator implements Comparator<Object> {
    INSTANCE;

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public int compare(Object a, Object b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        if (a instanceof Number && b instanceof Number) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }
}
