package com.raditha.pafcluster.sink;

import java.io.IOException;

/**
 * Hands stored clusters to the downstream per-cluster jobs.
 * After a failed dispatch the emitter calls {@link #abort()} instead of
 * {@link #finish()}.
 */
public interface FanOutSink {

    void dispatch(long clusterId) throws IOException;

    default void finish() throws IOException {
    }

    default void abort() {
    }
}
