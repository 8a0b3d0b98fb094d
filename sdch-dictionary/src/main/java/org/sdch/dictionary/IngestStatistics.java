//
// ========================================================================
// Copyright (c) 1995-2021 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.sdch.dictionary;

import java.util.concurrent.atomic.LongAdder;

import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.eclipse.jetty.util.annotation.ManagedOperation;

/**
 * <p>Process wide ingestion counters of a {@link SharedDictionaryEngine}.</p>
 * <p>Counters only increase, except when explicitly {@link #reset()}.
 * They are updated by the ingestion path and may be read by any thread.</p>
 */
@ManagedObject("Shared dictionary ingestion statistics")
public class IngestStatistics
{
    private final LongAdder _bytesIngested = new LongAdder();
    private final LongAdder _bytesMatchedAsDuplicate = new LongAdder();
    private final LongAdder _accepted = new LongAdder();
    private final LongAdder _completed = new LongAdder();
    private final LongAdder _failed = new LongAdder();
    private final LongAdder _dropped = new LongAdder();
    private final LongAdder _rebuilds = new LongAdder();

    @ManagedOperation(value = "Resets the statistics", impact = "ACTION")
    public void reset()
    {
        _bytesIngested.reset();
        _bytesMatchedAsDuplicate.reset();
        _accepted.reset();
        _completed.reset();
        _failed.reset();
        _dropped.reset();
        _rebuilds.reset();
    }

    void recordBytesIngested(long bytes)
    {
        _bytesIngested.add(bytes);
    }

    void recordAccepted()
    {
        _accepted.increment();
    }

    void recordCompleted()
    {
        _completed.increment();
    }

    void recordFailed()
    {
        _failed.increment();
    }

    void recordDropped()
    {
        _dropped.increment();
    }

    void recordRebuild()
    {
        _rebuilds.increment();
    }

    @ManagedAttribute("The total number of bytes chunked")
    public long getTotalBytesIngested()
    {
        return _bytesIngested.sum();
    }

    /**
     * @return the number of bytes matched as duplicate, which nothing records yet
     */
    @ManagedAttribute("The total number of bytes matched as duplicate")
    public long getTotalBytesMatchedAsDuplicate()
    {
        return _bytesMatchedAsDuplicate.sum();
    }

    @ManagedAttribute("The number of contents queued for ingestion")
    public long getIngestionsAccepted()
    {
        return _accepted.sum();
    }

    @ManagedAttribute("The number of contents ingested")
    public long getIngestionsCompleted()
    {
        return _completed.sum();
    }

    @ManagedAttribute("The number of contents whose ingestion failed")
    public long getIngestionsFailed()
    {
        return _failed.sum();
    }

    @ManagedAttribute("The number of contents dropped because the ingestion queue was full")
    public long getIngestionsDropped()
    {
        return _dropped.sum();
    }

    @ManagedAttribute("The number of dictionary rebuilds")
    public long getRebuilds()
    {
        return _rebuilds.sum();
    }

    /**
     * @return the number of queued contents that are neither ingested nor failed yet
     */
    public long getIngestionsPending()
    {
        return getIngestionsAccepted() - getIngestionsCompleted() - getIngestionsFailed();
    }

    @Override
    public String toString()
    {
        return String.format("matched %d out of %d bytes, %d/%d ingested, %d failed, %d dropped, %d rebuilds",
            getTotalBytesMatchedAsDuplicate(), getTotalBytesIngested(),
            getIngestionsCompleted(), getIngestionsAccepted(), getIngestionsFailed(), getIngestionsDropped(), getRebuilds());
    }
}
