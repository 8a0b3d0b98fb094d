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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.util.BlockingArrayQueue;
import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.eclipse.jetty.util.component.ContainerLifeCycle;
import org.eclipse.jetty.util.thread.AutoLock;
import org.sdch.dictionary.delta.DeltaEncoder;
import org.sdch.dictionary.delta.DeltaException;
import org.sdch.dictionary.store.ChunkStore;
import org.sdch.dictionary.store.ChunkStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Delta encodes contents against a shared dictionary, and learns from the
 * same contents which dictionary to use.</p>
 * <p>{@link #ingest(byte[])} encodes the content on the calling thread against
 * the current {@link DictionaryRevision} and returns the delta. The content is
 * then queued for ingestion, which a single ingestion thread performs later:
 * the content is split by the {@link Chunker}, its chunks are counted by the
 * {@link ChunkStore} in one batch, and the {@link DictionaryBuilder} decides
 * whether to publish a new dictionary. Ingestions are therefore serialized,
 * and a delta already returned is never affected by a later dictionary.</p>
 * <p>The ingestion queue is bounded; contents that do not fit are not ingested.
 * Neither are contents whose encoding completes after {@link #stop()} began.</p>
 * <p><b>Usage:</b></p>
 * <pre>
 *   JDBCChunkStore store = new JDBCChunkStore("jdbc:derby:chunks;create=true");
 *   DictionaryStaging staging = new DictionaryStaging(Path.of("dict"), "example.com", "/");
 *   SharedDictionaryEngine engine = new SharedDictionaryEngine(store, new VCDiffProcessCodec(), staging);
 *   engine.start();
 *   byte[] delta = engine.ingest(body);
 * </pre>
 */
@ManagedObject("Shared dictionary engine")
public class SharedDictionaryEngine extends ContainerLifeCycle
{
    private static final Logger LOG = LoggerFactory.getLogger(SharedDictionaryEngine.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final IngestStatistics _statistics = new IngestStatistics();
    private final ChunkStore _store;
    private final DeltaEncoder _encoder;
    private final DictionaryStaging _staging;
    private final DictionaryBuilder _builder;
    private final AutoLock _lock = new AutoLock();
    private Chunker _chunker = new Chunker();
    private int _queueCapacity = DEFAULT_QUEUE_CAPACITY;
    private BlockingQueue<byte[]> _queue;
    private IngestThread _thread;
    private volatile boolean _accepting;
    private volatile boolean _warnedFull;

    public SharedDictionaryEngine(ChunkStore store, DeltaEncoder encoder, DictionaryStaging staging)
    {
        _store = Objects.requireNonNull(store);
        _encoder = Objects.requireNonNull(encoder);
        _staging = Objects.requireNonNull(staging);
        _builder = new DictionaryBuilder(store, staging);
        addBean(store);
        addBean(_builder);
        addBean(_statistics);
    }

    public ChunkStore getChunkStore()
    {
        return _store;
    }

    public DictionaryBuilder getDictionaryBuilder()
    {
        return _builder;
    }

    public IngestStatistics getStatistics()
    {
        return _statistics;
    }

    public Chunker getChunker()
    {
        return _chunker;
    }

    public void setChunker(Chunker chunker)
    {
        if (isRunning())
            throw new IllegalStateException("Running");
        _chunker = Objects.requireNonNull(chunker);
    }

    @ManagedAttribute("The maximum number of contents waiting for ingestion")
    public int getQueueCapacity()
    {
        return _queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity)
    {
        if (isRunning())
            throw new IllegalStateException("Running");
        if (queueCapacity <= 0)
            throw new IllegalArgumentException("Invalid queue capacity: " + queueCapacity);
        _queueCapacity = queueCapacity;
    }

    @ManagedAttribute("The number of contents waiting for ingestion")
    public int getQueueSize()
    {
        BlockingQueue<byte[]> queue = _queue;
        return queue == null ? 0 : queue.size();
    }

    public DictionaryRevision getCurrentRevision()
    {
        return _staging.getCurrent();
    }

    public List<ChunkHash> getActiveHashes()
    {
        return _builder.getActiveHashes();
    }

    @Override
    protected void doStart() throws Exception
    {
        _staging.load();
        _queue = new BlockingArrayQueue<>(_queueCapacity);
        _warnedFull = false;
        super.doStart();
        _accepting = true;
        _thread = new IngestThread();
        _thread.start();
        LOG.info("Started {} with {}", this, _staging.getCurrent());
    }

    @Override
    protected void doStop() throws Exception
    {
        // No offer may happen once the ingestion thread can see the flag cleared.
        try (AutoLock l = _lock.lock())
        {
            _accepting = false;
        }
        IngestThread thread = _thread;
        _thread = null;
        if (thread != null)
            thread.join();
        super.doStop();
        LOG.info("Stopped {}: {}", this, _statistics);
    }

    /**
     * <p>Delta encodes the given content against the current dictionary, then
     * queues the content for ingestion.</p>
     *
     * @param content the decoded content of a response
     * @return the delta of the content against the current dictionary
     * @throws DeltaException if the content could not be encoded, in which case it is not ingested
     */
    public byte[] ingest(byte[] content) throws DeltaException
    {
        if (!isRunning())
            throw new IllegalStateException("Not running: " + this);

        byte[] delta = _encoder.encode(content, _staging.getCurrent());

        try (AutoLock l = _lock.lock())
        {
            if (!_accepting)
            {
                _statistics.recordDropped();
                if (LOG.isDebugEnabled())
                    LOG.debug("Not ingesting {} bytes, {} is stopping", content.length, this);
                return delta;
            }
            if (_queue.offer(content.clone()))
            {
                _statistics.recordAccepted();
                _warnedFull = false;
                return delta;
            }
        }

        _statistics.recordDropped();
        if (!_warnedFull)
            LOG.warn("Ingestion queue overflow, dropping contents");
        _warnedFull = true;
        return delta;
    }

    /**
     * <p>Chunks the content, counts its chunks and updates the dictionary.</p>
     *
     * @param content the content to ingest
     * @throws ChunkStoreException if the chunks could not be counted
     */
    protected void process(byte[] content) throws ChunkStoreException
    {
        List<Chunk> chunks = _chunker.chunk(content);
        _statistics.recordBytesIngested(content.length);
        _store.upsert(chunks);
        if (_builder.update())
            _statistics.recordRebuild();
        if (LOG.isDebugEnabled())
            LOG.debug("Ingested {} bytes in {} chunks", content.length, chunks.size());
    }

    private void processQueued(byte[] content)
    {
        try
        {
            process(content);
            _statistics.recordCompleted();
        }
        catch (ChunkStoreException x)
        {
            _statistics.recordFailed();
            LOG.warn("Unable to ingest {} bytes", content.length, x);
        }
        catch (Throwable x)
        {
            _statistics.recordFailed();
            LOG.warn("Failed to ingest {} bytes", content.length, x);
        }
    }

    private class IngestThread extends Thread
    {
        IngestThread()
        {
            setName("SharedDictionaryEngine@" + Integer.toString(SharedDictionaryEngine.this.hashCode(), 16));
            setDaemon(true);
        }

        @Override
        public void run()
        {
            while (_accepting)
            {
                try
                {
                    byte[] content = _queue.poll(1, TimeUnit.SECONDS);
                    if (content != null)
                        processQueued(content);
                }
                catch (InterruptedException e)
                {
                    LOG.trace("IGNORED", e);
                }
            }

            // Contents queued before the stop are still ingested.
            byte[] content = _queue.poll();
            while (content != null)
            {
                processQueued(content);
                content = _queue.poll();
            }
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,queue=%d/%d}", getClass().getSimpleName(), hashCode(), getState(), getQueueSize(), _queueCapacity);
    }
}
