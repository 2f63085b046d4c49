package schemamigrator.runner;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Orders version tokens: numerically when both are all digits, lexically otherwise.
 * Timestamp tokens such as {@code 2024_01_15_093000} sort correctly either way.
 */
enum VersionComparator implements Comparator<String> {
    INSTANCE;

    @Override
    public int compare(String a, String b) {
        if (isDigits(a) && isDigits(b)) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        return a.compareTo(b);
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}
