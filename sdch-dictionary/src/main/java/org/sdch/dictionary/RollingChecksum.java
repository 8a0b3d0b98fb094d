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

import java.util.Arrays;

/**
 * <p>A rolling checksum over the last {@value #WINDOW_SIZE} bytes seen.</p>
 * <p>Two running sums are kept: {@code s1} is the sum of the bytes in the window
 * and {@code s2} is the sum of the successive values of {@code s1}. Rolling one
 * byte in adds its contribution and removes the contribution of the byte that
 * leaves the window, in constant time. The sums wrap around as unsigned 32 bit
 * integers, which Java {@code int} arithmetic does for additions, subtractions
 * and multiplications.</p>
 * <p>Instances are not thread safe.</p>
 */
public class RollingChecksum
{
    public static final int WINDOW_SIZE = 64;
    public static final int CHAR_OFFSET = 31;

    private final byte[] _window = new byte[WINDOW_SIZE];
    private int _s1;
    private int _s2;
    private int _offset;

    public RollingChecksum()
    {
        reset();
    }

    public void reset()
    {
        Arrays.fill(_window, (byte)0);
        _s1 = WINDOW_SIZE * CHAR_OFFSET;
        _s2 = WINDOW_SIZE * (WINDOW_SIZE - 1) * CHAR_OFFSET;
        _offset = 0;
    }

    /**
     * @param b the byte entering the window
     */
    public void roll(byte b)
    {
        int drop = _window[_offset] & 0xFF;
        int add = b & 0xFF;
        _s1 += add - drop;
        _s2 += _s1 - WINDOW_SIZE * (drop + CHAR_OFFSET);
        _window[_offset] = b;
        _offset = (_offset + 1) & (WINDOW_SIZE - 1);
    }

    /**
     * @param bits the number of low order bits to test, from 1 to 31
     * @return whether the given number of low order bits of the checksum are all zero
     */
    public boolean isBoundary(int bits)
    {
        int mask = (1 << bits) - 1;
        return (_s2 & mask) == 0;
    }

    /**
     * @return the current checksum, as an unsigned 32 bit value
     */
    public long getDigest()
    {
        return _s2 & 0xFFFFFFFFL;
    }
}
