package org.pipesteps.datapipeline.services;

/**
 * Lifecycle states of a single {@link BatchPipeline#run(boolean)} call.
 * <pre>
 * INIT -> [LOAD_FRONTIER] -> FETCHING <-> RUNNING_STEP -> ADVANCE_FRONTIER -> FETCHING ...
 *                            FETCHING -> DONE            (fetcher exhausted)
 *                            any      -> FAILED          (fetch, step or storage failure)
 * </pre>
 */
public enum PipelineState {
    /** Constructed, or between runs. */
    INIT,
    /** Reading the persisted frontier to find the resume point. */
    LOAD_FRONTIER,
    /** Waiting for the fetcher to return the next batch. */
    FETCHING,
    /** Running a step and writing its checkpoint artifact. */
    RUNNING_STEP,
    /** All steps succeeded; advancing and persisting the frontier. */
    ADVANCE_FRONTIER,
    /** The run stopped on an error; the frontier is at the last committed batch. */
    FAILED,
    /** The fetcher signaled exhaustion; terminal success. */
    DONE
}
