package com.shafts.catalog.model.filter;

final class ValueMatching {

    private ValueMatching() {
    }

    static boolean sameValue(final Object actual, final Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
        }
        return actual.equals(expected);
    }
}
