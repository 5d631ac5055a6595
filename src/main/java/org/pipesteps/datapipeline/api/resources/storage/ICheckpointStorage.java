package org.pipesteps.datapipeline.api.resources.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.pipesteps.datapipeline.api.batch.Table;

/**
 * Storage for per-step checkpoint artifacts and the location of the frontier record.
 * <p>
 * Exactly one artifact exists per (step name, batch id) pair. Writing an artifact that already
 * exists replaces it atomically, so artifacts left behind by a failed batch attempt are simply
 * overwritten on retry.
 * <p>
 * <strong>Ownership:</strong> A storage instance assumes exclusive use of its location. Two
 * pipelines sharing one location concurrently is undefined behavior.
 */
public interface ICheckpointStorage {

    /**
     * Persists the output of one step for one batch, replacing any previous artifact.
     *
     * @param stepName Name of the step that produced the table
     * @param batchId Id of the batch
     * @param table The step output
     * @throws IOException if the artifact cannot be written
     */
    void writeArtifact(String stepName, long batchId, Table table) throws IOException;

    /**
     * Reads the artifact of one step for one batch.
     *
     * @param stepName Name of the step
     * @param batchId Id of the batch
     * @return The stored table
     * @throws java.nio.file.NoSuchFileException if no artifact exists
     * @throws IOException if the artifact cannot be read or decoded
     */
    Table readArtifact(String stepName, long batchId) throws IOException;

    /**
     * @param stepName Name of the step
     * @param batchId Id of the batch
     * @return true if an artifact exists for the pair
     */
    boolean hasArtifact(String stepName, long batchId);

    /**
     * Lists the batch ids for which a step has an artifact.
     *
     * @param stepName Name of the step
     * @return Ascending batch ids (empty if the step has no artifacts)
     * @throws IOException if the location cannot be listed
     */
    List<Long> listArtifactBatchIds(String stepName) throws IOException;

    /**
     * Deletes every artifact of every step, including leftover temporary files.
     *
     * @return Number of artifact files deleted
     * @throws IOException if a file cannot be deleted
     */
    int deleteAllArtifacts() throws IOException;

    /**
     * @return the well-known path of the frontier record under this storage's location
     */
    Path getFrontierPath();
}
