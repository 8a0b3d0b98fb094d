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

package org.sdch.dictionary.store;

import java.util.List;

import org.sdch.dictionary.Chunk;

/**
 * <p>A persistent, content addressed table of {@link Chunk}s and of the number
 * of times each chunk has been seen.</p>
 * <p>Implementations must be safe for concurrent callers: an upsert is never
 * a read followed by a write that another caller can interleave with.</p>
 */
public interface ChunkStore
{
    /**
     * <p>Counts one more occurrence of each of the given chunks, atomically:
     * either all the chunks are counted or, if this method throws, none is.</p>
     * <p>A chunk not yet stored is inserted with a count of one, otherwise its
     * count is incremented. A chunk appearing several times in the list is
     * counted once per appearance.</p>
     *
     * @param chunks the chunks to count
     * @return the count of each chunk after the upsert, in list order
     * @throws ChunkStoreException if the chunks could not be counted
     */
    long[] upsert(List<Chunk> chunks) throws ChunkStoreException;

    /**
     * @param chunk the chunk to count
     * @return the count of the chunk after the upsert
     * @throws ChunkStoreException if the chunk could not be counted
     */
    default long upsert(Chunk chunk) throws ChunkStoreException
    {
        return upsert(List.of(chunk))[0];
    }

    /**
     * <p>Returns the chunks seen more than once, least popular first: ordered by
     * count ascending, then by hash descending.</p>
     *
     * @return the popular chunks, with their counts
     * @throws ChunkStoreException if the chunks could not be read
     */
    List<Chunk> getPopularChunks() throws ChunkStoreException;
}
