package io.causelog.projection;

/**
 * Outcome of one dispatch: either the handler's value (possibly {@code null}) or the error
 * that was reported through the hooks.
 */
public record DispatchResult(boolean success, Object value, DispatchError error) {
    public static DispatchResult ok(Object value) {
        return new DispatchResult(true, value, null);
    }

    public static DispatchResult fail(DispatchError error) {
        return new DispatchResult(false, null, error);
    }
}
