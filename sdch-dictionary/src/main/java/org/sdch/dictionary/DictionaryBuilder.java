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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.sdch.dictionary.store.ChunkStore;
import org.sdch.dictionary.store.ChunkStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Decides whether the active dictionary must be replaced by one built from
 * the current popular chunks, and replaces it.</p>
 * <p>The hashes of the active dictionary and those of the popular chunks are
 * merged and sorted, and the number of hashes that appear in only one of the
 * two lists is counted. When this number, relative to the size of the active
 * dictionary, is strictly greater than the {@link #getThreshold() threshold},
 * the popular chunks become the new dictionary.</p>
 * <p>Before any dictionary exists, the popular chunks are adopted as the active
 * hashes without publishing a dictionary.</p>
 * <p>This class is not thread safe: {@link #update()} must be called by a
 * single thread at a time, which the {@link SharedDictionaryEngine} ensures.</p>
 */
@ManagedObject("Shared dictionary builder")
public class DictionaryBuilder
{
    private static final Logger LOG = LoggerFactory.getLogger(DictionaryBuilder.class);

    public static final double DEFAULT_THRESHOLD = 0.10D;

    private final ChunkStore _store;
    private final DictionaryStaging _staging;
    private double _threshold = DEFAULT_THRESHOLD;
    private volatile List<ChunkHash> _active = List.of();
    private volatile long _rebuilds;

    public DictionaryBuilder(ChunkStore store, DictionaryStaging staging)
    {
        _store = Objects.requireNonNull(store);
        _staging = Objects.requireNonNull(staging);
    }

    @ManagedAttribute("The proportion of changed chunks above which the dictionary is rebuilt")
    public double getThreshold()
    {
        return _threshold;
    }

    public void setThreshold(double threshold)
    {
        if (threshold < 0 || Double.isNaN(threshold))
            throw new IllegalArgumentException("Invalid threshold: " + threshold);
        _threshold = threshold;
    }

    /**
     * @return the hashes of the active dictionary, in dictionary order
     */
    public List<ChunkHash> getActiveHashes()
    {
        return _active;
    }

    @ManagedAttribute("The number of chunks of the active dictionary")
    public int getActiveSize()
    {
        return _active.size();
    }

    @ManagedAttribute("The number of times the dictionary was rebuilt")
    public long getRebuilds()
    {
        return _rebuilds;
    }

    public DictionaryStaging getStaging()
    {
        return _staging;
    }

    /**
     * <p>Re-evaluates the popular chunks and rebuilds the dictionary if they
     * changed enough.</p>
     * <p>Failures are logged and leave the active dictionary unchanged.</p>
     *
     * @return whether a new dictionary was published
     */
    public boolean update()
    {
        List<Chunk> candidates;
        try
        {
            candidates = _store.getPopularChunks();
        }
        catch (ChunkStoreException x)
        {
            LOG.warn("Unable to query popular chunks from {}", _store, x);
            return false;
        }

        List<ChunkHash> hashes = new ArrayList<>(candidates.size());
        for (Chunk candidate : candidates)
        {
            hashes.add(candidate.getHash());
        }
        hashes = Collections.unmodifiableList(hashes);

        List<ChunkHash> active = _active;
        if (active.isEmpty())
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Adopting {} popular chunks without dictionary", hashes.size());
            _active = hashes;
            return false;
        }

        int unique = countUnique(active, hashes);
        double ratio = (double)unique / active.size();
        if (LOG.isDebugEnabled())
            LOG.debug("{} unique of {} active and {} popular chunks, ratio {}", unique, active.size(), hashes.size(), ratio);
        if (ratio <= _threshold)
            return false;

        ByteArrayOutputStream content = new ByteArrayOutputStream();
        for (Chunk candidate : candidates)
        {
            content.writeBytes(candidate.getContent());
        }

        DictionaryRevision revision;
        try
        {
            revision = _staging.publish(content.toByteArray());
        }
        catch (IOException x)
        {
            LOG.warn("Unable to publish dictionary of {} chunks", hashes.size(), x);
            return false;
        }
        _active = hashes;
        _rebuilds++;
        LOG.info("Changed dictionary to {} with {} chunks, {}/{} unique", revision, hashes.size(), unique, active.size());
        return true;
    }

    /**
     * <p>Counts the hashes that are not paired in the merge of the two lists.</p>
     * <p>The merged hashes are sorted and scanned, each compared with the previous
     * one. The first equal pair of a run marks the whole run as duplicate; a run
     * without a pair counts as one unique hash. A run of three or more equal
     * hashes is therefore counted as a single duplicate, exactly like a pair.</p>
     *
     * @param active the hashes of the active dictionary
     * @param candidates the hashes of the popular chunks
     * @return the number of unpaired hashes
     */
    static int countUnique(List<ChunkHash> active, List<ChunkHash> candidates)
    {
        List<ChunkHash> all = new ArrayList<>(active.size() + candidates.size());
        all.addAll(active);
        all.addAll(candidates);
        Collections.sort(all);
        return countUnique(all);
    }

    static int countUnique(List<ChunkHash> sorted)
    {
        if (sorted.isEmpty())
            return 0;

        int unique = 0;
        boolean duplicate = false;
        ChunkHash last = sorted.get(0);
        for (int i = 1; i < sorted.size(); ++i)
        {
            ChunkHash hash = sorted.get(i);
            if (hash.equals(last))
            {
                duplicate = true;
                continue;
            }
            if (!duplicate)
                unique++;
            duplicate = false;
            last = hash;
        }
        // The last run has no successor to close it.
        if (!duplicate)
            unique++;
        return unique;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{active=%d,threshold=%s}", getClass().getSimpleName(), hashCode(), _active.size(), _threshold);
    }
}
