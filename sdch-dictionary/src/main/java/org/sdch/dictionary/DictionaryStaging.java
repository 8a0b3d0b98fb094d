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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;

import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Publishes {@link DictionaryRevision}s to a directory.</p>
 * <p>Each revision is archived under its name in the {@value #REVISIONS}
 * sub directory, and its bytes are also written to the staging file that
 * always holds the current revision. Every file is first written to a
 * temporary file of the same directory and then atomically moved into place,
 * so readers see either the previous or the new bytes, never a mix.
 * The {@link #getCurrent() current revision} is switched once the files are
 * in place.</p>
 */
@ManagedObject("Dictionary revision staging")
public class DictionaryStaging
{
    private static final Logger LOG = LoggerFactory.getLogger(DictionaryStaging.class);

    public static final String DEFAULT_STAGING_FILE = "dictionary.raw";
    public static final String REVISIONS = "revisions";

    private final Path _directory;
    private final String _domain;
    private final String _path;
    private final byte[] _header;
    private volatile DictionaryRevision _current = DictionaryRevision.EMPTY;

    public DictionaryStaging(Path directory, String domain, String path)
    {
        _directory = Objects.requireNonNull(directory);
        _domain = Objects.requireNonNull(domain);
        _path = Objects.requireNonNull(path);
        _header = DictionaryIdentity.header(domain, path);
    }

    @ManagedAttribute("The dictionary directory")
    public Path getDirectory()
    {
        return _directory;
    }

    @ManagedAttribute("The domain announced in the dictionary header")
    public String getDomain()
    {
        return _domain;
    }

    @ManagedAttribute("The path announced in the dictionary header")
    public String getPath()
    {
        return _path;
    }

    public Path getStagingFile()
    {
        return _directory.resolve(DEFAULT_STAGING_FILE);
    }

    public DictionaryRevision getCurrent()
    {
        return _current;
    }

    /**
     * <p>Makes the revision left in the staging file by a previous run current again.</p>
     *
     * @return the current revision, {@link DictionaryRevision#EMPTY} if there is no staging file
     * @throws IOException if the staging file could not be read
     */
    public DictionaryRevision load() throws IOException
    {
        Path staging = getStagingFile();
        if (!Files.isRegularFile(staging))
            return _current;

        byte[] content = Files.readAllBytes(staging);
        String name = DictionaryIdentity.of(_header, content).getName();
        Path archive = _directory.resolve(REVISIONS).resolve(name);
        if (!Files.isRegularFile(archive))
            writeAtomically(archive, content);
        DictionaryRevision revision = new DictionaryRevision(_header, content, archive, Files.getLastModifiedTime(staging).toInstant());
        _current = revision;
        LOG.info("Loaded dictionary {}", revision);
        return revision;
    }

    /**
     * @param content the bytes of the new dictionary
     * @return the new current revision
     * @throws IOException if the revision could not be written, in which case the current revision is unchanged
     */
    public DictionaryRevision publish(byte[] content) throws IOException
    {
        String name = DictionaryIdentity.of(_header, content).getName();
        Path archive = _directory.resolve(REVISIONS).resolve(name);
        writeAtomically(archive, content);
        writeAtomically(getStagingFile(), content);
        DictionaryRevision revision = new DictionaryRevision(_header, content, archive, Instant.now());
        _current = revision;
        if (LOG.isDebugEnabled())
            LOG.debug("Published {}", revision);
        return revision;
    }

    /**
     * <p>Looks up an archived revision by name, for serving to user agents.</p>
     *
     * @param name the dictionary name
     * @return the dictionary header followed by the dictionary content, or null if there is no such dictionary
     * @throws IOException if the dictionary could not be read
     */
    public byte[] getResource(String name) throws IOException
    {
        if (name == null || !name.matches("[A-Za-z0-9_-]+"))
            return null;
        Path archive = _directory.resolve(REVISIONS).resolve(name);
        if (!Files.isRegularFile(archive))
            return null;
        return new DictionaryRevision(_header, Files.readAllBytes(archive), archive, Instant.now()).getResource();
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException
    {
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try
        {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        finally
        {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{dir=%s,current=%s}", getClass().getSimpleName(), hashCode(), _directory, _current);
    }
}
