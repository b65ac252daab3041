package com.hting007.logiq.io;

import com.hting007.logiq.model.AnomalyRecord;

/**
 * Append-only destination for anomaly records. A publish may be retried after a transient
 * failure, so implementations must tolerate receiving the same record twice.
 */
public interface AnomalySink {

    void publish(AnomalyRecord record) throws TransientIoException;
}
