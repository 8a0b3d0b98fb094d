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

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * <p>One published dictionary: the concatenated content of the popular chunks
 * it was built from, together with its header and identity.</p>
 * <p>A revision is immutable. Its {@link #getPath() file}, when it has one,
 * is never rewritten, so a delta encoded against the file is encoded against
 * this revision even if a newer revision is published meanwhile.</p>
 */
public final class DictionaryRevision
{
    public static final String CONTENT_TYPE = "application/x-sdch-dictionary";

    /**
     * The revision in force before any dictionary has been built.
     */
    public static final DictionaryRevision EMPTY = new DictionaryRevision(new byte[0], new byte[0], null, Instant.EPOCH);

    private final byte[] _header;
    private final byte[] _content;
    private final Path _path;
    private final Instant _created;
    private final DictionaryIdentity _identity;

    public DictionaryRevision(byte[] header, byte[] content, Path path, Instant created)
    {
        _header = Objects.requireNonNull(header);
        _content = Objects.requireNonNull(content);
        _path = path;
        _created = Objects.requireNonNull(created);
        _identity = DictionaryIdentity.of(header, content);
    }

    public boolean isEmpty()
    {
        return _path == null && _content.length == 0;
    }

    /**
     * @return the dictionary bytes; callers must not modify the returned array
     */
    public byte[] getContent()
    {
        return _content;
    }

    public byte[] getHeader()
    {
        return _header.clone();
    }

    /**
     * @return the file holding the dictionary bytes, or null if the revision was never written
     */
    public Path getPath()
    {
        return _path;
    }

    public Instant getCreated()
    {
        return _created;
    }

    public DictionaryIdentity getIdentity()
    {
        return _identity;
    }

    /**
     * @return the bytes to serve for this dictionary: the header followed by the content
     */
    public byte[] getResource()
    {
        byte[] resource = new byte[_header.length + _content.length];
        System.arraycopy(_header, 0, resource, 0, _header.length);
        System.arraycopy(_content, 0, resource, _header.length, _content.length);
        return resource;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,length=%d,path=%s}", getClass().getSimpleName(), hashCode(), _identity.getName(), _content.length, _path);
    }
}
