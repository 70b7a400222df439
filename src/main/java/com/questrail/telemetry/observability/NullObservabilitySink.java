package com.questrail.telemetry.observability;

/**
 * No-op implementation of TelemetryObservabilitySink.
 */
public final class NullObservabilitySink implements TelemetryObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLinkStateTransition(LinkStateTransitionEvent event) {}

    @Override
    public void onConnectAttemptFailed(ConnectAttemptFailedEvent event) {}

    @Override
    public void onFrameDropped(FrameDroppedEvent event) {}

    @Override
    public void onSchemaChange(SchemaChangeEvent event) {}

    @Override
    public void onSchemaDrift(SchemaDriftEvent event) {}

    @Override
    public void onSubscriberStateChange(SubscriberStateEvent event) {}

    @Override
    public void onError(TelemetryErrorEvent event) {}
}
