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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ChunkHashTest
{
    @Test
    public void testDigestIsSha1()
    {
        ChunkHash hash = ChunkHash.digest("abc".getBytes(StandardCharsets.US_ASCII));
        assertThat(hash.toString(), is("a9993e364706816aba3e25717850c26c9cd0d89d"));
        assertThat(hash.getBytes().length, is(ChunkHash.LENGTH));
    }

    @Test
    public void testDigestOfRange()
    {
        byte[] bytes = "xxabcxx".getBytes(StandardCharsets.US_ASCII);
        assertThat(ChunkHash.digest(bytes, 2, 3), is(ChunkHash.digest("abc".getBytes(StandardCharsets.US_ASCII))));
    }

    @Test
    public void testFromString()
    {
        ChunkHash hash = ChunkHash.digest(new byte[]{1, 2, 3});
        assertThat(ChunkHash.fromString(hash.toString()), is(hash));
        assertThat(ChunkHash.fromString(hash.toString()).hashCode(), is(hash.hashCode()));
        assertThrows(IllegalArgumentException.class, () -> ChunkHash.fromString("abcd"));
        assertThrows(IllegalArgumentException.class, () -> ChunkHash.fromBytes(new byte[19]));
    }

    @Test
    public void testOrderIsUnsigned()
    {
        byte[] low = new byte[ChunkHash.LENGTH];
        low[0] = 0x7F;
        byte[] high = new byte[ChunkHash.LENGTH];
        high[0] = (byte)0x80;
        assertThat(ChunkHash.fromBytes(high).compareTo(ChunkHash.fromBytes(low)), greaterThan(0));
    }

    @Test
    public void testOrderMatchesTextOrder()
    {
        Random random = new Random(11);
        List<ChunkHash> hashes = new ArrayList<>();
        for (int i = 0; i < 200; ++i)
        {
            byte[] content = new byte[16];
            random.nextBytes(content);
            hashes.add(ChunkHash.digest(content));
        }
        List<String> texts = new ArrayList<>();
        Collections.sort(hashes);
        for (ChunkHash hash : hashes)
        {
            texts.add(hash.toString());
        }
        List<String> sortedTexts = new ArrayList<>(texts);
        Collections.sort(sortedTexts);
        assertThat(texts, is(sortedTexts));
    }
}
