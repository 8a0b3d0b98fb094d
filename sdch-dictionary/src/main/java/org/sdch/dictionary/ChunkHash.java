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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * <p>The content address of a {@link Chunk}: the SHA-1 digest of its bytes.</p>
 * <p>Hashes order by the unsigned value of their bytes, which is also the
 * order of their lowercase hexadecimal text form, so an ordering done by a
 * database on the text form agrees with {@link #compareTo(ChunkHash)}.</p>
 */
public final class ChunkHash implements Comparable<ChunkHash>
{
    public static final String ALGORITHM = "SHA-1";
    public static final int LENGTH = 20;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] _bytes;

    private ChunkHash(byte[] bytes)
    {
        _bytes = bytes;
    }

    public static ChunkHash digest(byte[] content)
    {
        return digest(content, 0, content.length);
    }

    public static ChunkHash digest(byte[] content, int offset, int length)
    {
        MessageDigest digest = newMessageDigest();
        digest.update(content, offset, length);
        return new ChunkHash(digest.digest());
    }

    public static ChunkHash fromBytes(byte[] bytes)
    {
        if (bytes == null || bytes.length != LENGTH)
            throw new IllegalArgumentException("Invalid chunk hash length: " + (bytes == null ? null : bytes.length));
        return new ChunkHash(bytes.clone());
    }

    public static ChunkHash fromString(String hex)
    {
        Objects.requireNonNull(hex);
        return fromBytes(HEX.parseHex(hex));
    }

    static MessageDigest newMessageDigest()
    {
        try
        {
            return MessageDigest.getInstance(ALGORITHM);
        }
        catch (NoSuchAlgorithmException x)
        {
            // Every JVM is required to provide SHA-1.
            throw new IllegalStateException(x);
        }
    }

    public byte[] getBytes()
    {
        return _bytes.clone();
    }

    @Override
    public int compareTo(ChunkHash other)
    {
        return Arrays.compareUnsigned(_bytes, other._bytes);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof ChunkHash))
            return false;
        return Arrays.equals(_bytes, ((ChunkHash)obj)._bytes);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(_bytes);
    }

    @Override
    public String toString()
    {
        return HEX.formatHex(_bytes);
    }
}
