package com.faultguard.common;

/**
 * Resolves the kind name recorded in retry statistics and matched by {@link ErrorClassifier#kinds}.
 */
public final class ErrorKinds {

    private ErrorKinds() {
    }

    /**
     * Explicit kind for {@link KindedError}s with a non-blank kind, simple class name otherwise
     * (binary name for anonymous classes).
     */
    public static String kindOf(Throwable error) {
        if (error == null) {
            return "null";
        }
        if (error instanceof KindedError kinded) {
            String kind = kinded.kind();
            if (kind != null && !kind.isBlank()) {
                return kind;
            }
        }
        String simple = error.getClass().getSimpleName();
        return simple.isEmpty() ? error.getClass().getName() : simple;
    }
}
