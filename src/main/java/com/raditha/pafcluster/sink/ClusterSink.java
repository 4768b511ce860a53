package com.raditha.pafcluster.sink;

import com.raditha.pafcluster.model.MemberCluster;

import java.io.IOException;

/**
 * Stores emitted clusters.
 * Clusters arrive one at a time; they only become authoritative once
 * {@link #commit()} returns. After a failure the emitter calls
 * {@link #abort()} and the stored clusters must be discarded.
 */
public interface ClusterSink {

    void store(MemberCluster cluster) throws IOException;

    default void commit() throws IOException {
    }

    default void abort() {
    }
}
