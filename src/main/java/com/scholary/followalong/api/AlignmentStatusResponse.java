package com.scholary.followalong.api;

/**
 * Alignment state of a document.
 *
 * @param job the latest alignment job, null if none was ever started
 * @param alignmentQuality quality of the stored alignment, null if there is none
 */
public record AlignmentStatusResponse(
    JobResponse job,
    Integer pageCount,
    boolean scanned,
    boolean hasAlignment,
    Integer alignmentQuality) {}
