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

import java.util.ArrayList;
import java.util.List;

import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;

/**
 * <p>Splits content into content defined {@link Chunk}s.</p>
 * <p>A {@link RollingChecksum} is rolled over every byte of the content and
 * a chunk is closed, inclusive of the current byte, each time the low
 * {@link #getBoundaryBits() boundary bits} of the checksum are all zero.
 * The bytes after the last boundary form a final, shorter chunk.
 * Since a boundary only depends on the bytes in the checksum window, equal
 * runs of bytes tend to be cut at the same places wherever they appear,
 * which is what allows chunks to be found again across different contents.</p>
 * <p>The average chunk length is {@code 2^boundaryBits} bytes, but neither
 * a minimum nor a maximum chunk length is enforced.</p>
 */
@ManagedObject("Content defined chunker")
public class Chunker
{
    public static final int DEFAULT_BOUNDARY_BITS = 5;

    private final int _boundaryBits;

    public Chunker()
    {
        this(DEFAULT_BOUNDARY_BITS);
    }

    public Chunker(int boundaryBits)
    {
        if (boundaryBits < 1 || boundaryBits > 31)
            throw new IllegalArgumentException("Invalid boundary bits: " + boundaryBits);
        _boundaryBits = boundaryBits;
    }

    @ManagedAttribute("The number of low order checksum bits that must be zero at a chunk boundary")
    public int getBoundaryBits()
    {
        return _boundaryBits;
    }

    /**
     * @param content the content to split
     * @return the chunks of the content in content order, empty if the content is empty
     */
    public List<Chunk> chunk(byte[] content)
    {
        List<Chunk> chunks = new ArrayList<>();
        RollingChecksum checksum = new RollingChecksum();
        int start = 0;
        for (int i = 0; i < content.length; ++i)
        {
            checksum.roll(content[i]);
            if (checksum.isBoundary(_boundaryBits))
            {
                chunks.add(newChunk(content, start, i + 1));
                start = i + 1;
            }
        }
        if (start < content.length)
            chunks.add(newChunk(content, start, content.length));
        return chunks;
    }

    private static Chunk newChunk(byte[] content, int from, int to)
    {
        byte[] bytes = new byte[to - from];
        System.arraycopy(content, from, bytes, 0, bytes.length);
        return new Chunk(bytes);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{bits=%d}", getClass().getSimpleName(), hashCode(), _boundaryBits);
    }
}
