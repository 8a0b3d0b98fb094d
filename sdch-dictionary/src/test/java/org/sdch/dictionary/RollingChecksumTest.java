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

import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class RollingChecksumTest
{
    private static byte[] random(long seed, int length)
    {
        byte[] bytes = new byte[length];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }

    private static long digest(byte[]... parts)
    {
        RollingChecksum checksum = new RollingChecksum();
        for (byte[] part : parts)
        {
            for (byte b : part)
            {
                checksum.roll(b);
            }
        }
        return checksum.getDigest();
    }

    @Test
    public void testDigestOnlyDependsOnWindow()
    {
        byte[] window = random(1, RollingChecksum.WINDOW_SIZE);
        long expected = digest(window);
        assertThat(digest(random(2, 100), window), is(expected));
        assertThat(digest(random(3, 1000), window), is(expected));
        assertThat(digest(random(4, 1), window), is(expected));
    }

    @Test
    public void testDigestDependsOnWindowOrder()
    {
        byte[] window = random(5, RollingChecksum.WINDOW_SIZE);
        window[0] = 1;
        window[1] = 2;
        byte[] swapped = window.clone();
        swapped[0] = 2;
        swapped[1] = 1;
        assertThat(digest(swapped), not(is(digest(window))));
    }

    @Test
    public void testReset()
    {
        RollingChecksum checksum = new RollingChecksum();
        long initial = checksum.getDigest();
        for (byte b : random(6, 10))
        {
            checksum.roll(b);
        }
        assertThat(checksum.getDigest(), not(is(initial)));
        checksum.reset();
        assertThat(checksum.getDigest(), is(initial));
    }

    @Test
    public void testBoundaryTestsLowBits()
    {
        RollingChecksum checksum = new RollingChecksum();
        int boundaries = 0;
        for (byte b : random(7, 1 << 16))
        {
            checksum.roll(b);
            boolean boundary = checksum.isBoundary(5);
            assertThat(boundary, is((checksum.getDigest() & 0x1F) == 0));
            if (boundary)
                boundaries++;
        }
        assertThat(boundaries > 0, is(true));
    }
}
