package com.realtimeanalytics.core.event;

import com.realtimeanalytics.core.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Subscriber lists for the engine's three event types.
 *
 * <p>
 * Listeners are invoked synchronously on the publishing thread, in
 * registration order. Anomaly listeners therefore run on the thread that
 * called {@code recordMetric} and should hand heavy work off. An exception
 * thrown by a listener is logged and does not reach the publisher or the
 * remaining listeners.
 * </p>
 *
 * @since 1.0.0
 */
public class EventChannel {

    private static final Logger LOG = LoggerFactory.getLogger(EventChannel.class);

    private final List<Consumer<AnomalyEvent>> anomalyListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<AggregationEvent>> aggregationListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<EngineError>> errorListeners = new CopyOnWriteArrayList<>();

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    public void onAnomaly(Consumer<AnomalyEvent> listener) {
        anomalyListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void onAggregation(Consumer<AggregationEvent> listener) {
        aggregationListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void onError(Consumer<EngineError> listener) {
        errorListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Remove a listener from whichever list holds it.
     *
     * @param listener previously registered listener
     * @return {@code true} if it was registered
     */
    public boolean remove(Consumer<?> listener) {
        return anomalyListeners.remove(listener)
                | aggregationListeners.remove(listener)
                | errorListeners.remove(listener);
    }

    // ---------------------------------------------------------------
    // Publishing
    // ---------------------------------------------------------------

    public void publishAnomaly(AnomalyEvent event) {
        dispatch(anomalyListeners, event, "anomaly");
    }

    public void publishAggregation(AggregationEvent event) {
        dispatch(aggregationListeners, event, "aggregation");
    }

    public void publishError(EngineError error) {
        dispatch(errorListeners, error, "error");
    }

    private static <T> void dispatch(List<Consumer<T>> listeners, T event, String type) {
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOG.error("{} listener threw an exception – continuing with next listener", type, e);
            }
        }
    }
}
