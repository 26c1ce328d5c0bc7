package radar.core.exception;

/**
 * Transport-level failure kinds, independent of any HTTP status.
 */
public enum NetworkErrorCode {
    CONNECTION_RESET,
    CONNECTION_REFUSED,
    TIMED_OUT,
    DNS_FAILURE,
    OTHER;

    /**
     * Whether the default retry condition treats this kind as transient.
     *
     * @return true for reset, timeout and DNS failures
     */
    public boolean isTransient() {
        return this == CONNECTION_RESET || this == TIMED_OUT || this == DNS_FAILURE;
    }
}
