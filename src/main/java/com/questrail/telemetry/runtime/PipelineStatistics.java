package com.questrail.telemetry.runtime;

/**
 * Point-in-time snapshot of {@link TelemetryPipeline} counters.
 *
 * @param framesReceived          frames handed to the pipeline by the framer
 * @param framesDecoded           frames decoded into a batch
 * @param framesDropped           frames rejected by integrity checks
 * @param bytesDiscarded          stream bytes the framer could not attribute to a valid frame
 * @param schemaVersionMismatches decoded frames whose version differed from the active schema
 * @param partialFrames           decoded frames that were truncated
 * @param invalidReadings         readings delivered with {@code valid=false}
 * @param batchesPublished        batches handed to the distribution hub
 */
public record PipelineStatistics(
    long framesReceived,
    long framesDecoded,
    long framesDropped,
    long bytesDiscarded,
    long schemaVersionMismatches,
    long partialFrames,
    long invalidReadings,
    long batchesPublished
) {
}
