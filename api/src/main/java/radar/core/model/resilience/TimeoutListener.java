package radar.core.model.resilience;

/**
 * Side effect run once when a guarded operation misses its deadline, before the
 * timeout failure is raised.
 */
@FunctionalInterface
public interface TimeoutListener {

    void onTimeout();
}
