package com.hubrelay.webhooks.model.action;

/**
 * Common view of the per-kind action enumerations.
 *
 * <p>GitHub qualifies most event kinds with an {@code action} field
 * ("opened", "labeled", "created", ...).  Every kind has its own enum so the
 * compiler keeps issue actions apart from pull request actions; this
 * interface lets the aggregation policy table key on either.
 */
public interface EventAction {

    /** The wire value GitHub sends in the {@code action} field. */
    String value();

    /**
     * Finds the constant of {@code type} whose wire value is {@code value}.
     *
     * @return the matching constant, or {@code fallback} for values GitHub added after this build
     */
    static <E extends Enum<E> & EventAction> E lookup(Class<E> type, String value, E fallback) {
        if (value == null) {
            return fallback;
        }
        for (E candidate : type.getEnumConstants()) {
            if (candidate.value().equals(value)) {
                return candidate;
            }
        }
        return fallback;
    }
}
