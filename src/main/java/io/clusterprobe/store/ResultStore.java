package io.clusterprobe.store;

import io.clusterprobe.models.Result;

import java.io.IOException;

/**
 * Destination for accepted results. Called once per filled slot.
 */
public interface ResultStore {

    /**
     * Persist an accepted result
     */
    void save(Result result) throws IOException;
}
