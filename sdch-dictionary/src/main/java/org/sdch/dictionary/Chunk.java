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

import java.util.Objects;

/**
 * <p>A content addressed run of bytes, as produced by a {@link Chunker} or
 * read back from a {@link org.sdch.dictionary.store.ChunkStore}.</p>
 * <p>Chunks produced by chunking have not been counted yet and report zero
 * occurrences; chunks read from a store report their persisted count.</p>
 */
public final class Chunk
{
    private final ChunkHash _hash;
    private final byte[] _content;
    private final long _occurrences;

    public Chunk(byte[] content)
    {
        this(ChunkHash.digest(content), content, 0);
    }

    public Chunk(ChunkHash hash, byte[] content, long occurrences)
    {
        _hash = Objects.requireNonNull(hash);
        _content = Objects.requireNonNull(content);
        _occurrences = occurrences;
    }

    public ChunkHash getHash()
    {
        return _hash;
    }

    /**
     * @return the chunk bytes; callers must not modify the returned array
     */
    public byte[] getContent()
    {
        return _content;
    }

    public int getLength()
    {
        return _content.length;
    }

    public long getOccurrences()
    {
        return _occurrences;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{hash=%s,length=%d,occurrences=%d}",
            getClass().getSimpleName(), hashCode(), _hash, _content.length, _occurrences);
    }
}
