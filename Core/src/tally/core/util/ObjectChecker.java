package tally.core.util;

public final class ObjectChecker {

    public static void assertNonNull(Object object) {
        if (object == null) {
            throw new NullPointerException("object must be non-null.");
        }
    }

    public static void assertNonNull(Object... objects) {
        for (int i = 0; i < objects.length; i++) {
            if (objects[i] == null) {
                throw new NullPointerException("object must be non-null: violated by object at index " + i);
            }
        }
    }

    public static void assertNonNegative(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("value must be non-negative but was: " + value);
        }
    }

    public static void assertNonBlank(String string, String what) {
        if (string == null) {
            throw new NullPointerException(what + " must be non-null.");
        }
        if (string.trim().isEmpty()) {
            throw new IllegalArgumentException(what + " must be non-blank.");
        }
    }
}
