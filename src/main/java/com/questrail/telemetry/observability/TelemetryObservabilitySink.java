package com.questrail.telemetry.observability;

/**
 * Main interface for receiving relay observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on the thread that produced the event (the link
 * supervisor thread, a pump thread, or the caller of a schema reload) and must
 * not block.</p>
 */
public interface TelemetryObservabilitySink {
    /**
     * Called when the link supervisor changes state.
     */
    void onLinkStateTransition(LinkStateTransitionEvent event);

    /**
     * Called after each failed attempt to open the link.
     */
    void onConnectAttemptFailed(ConnectAttemptFailedEvent event);

    /**
     * Called when a frame or unframeable bytes are discarded.
     */
    void onFrameDropped(FrameDroppedEvent event);

    /**
     * Called when a schema load is applied or rejected.
     */
    void onSchemaChange(SchemaChangeEvent event);

    /**
     * Called when a frame carries a schema version other than the active one.
     */
    void onSchemaDrift(SchemaDriftEvent event);

    /**
     * Called when a subscriber becomes slow, recovers, or is disconnected.
     */
    void onSubscriberStateChange(SubscriberStateEvent event);

    /**
     * Called when an error or anomaly occurs.
     */
    void onError(TelemetryErrorEvent event);
}
