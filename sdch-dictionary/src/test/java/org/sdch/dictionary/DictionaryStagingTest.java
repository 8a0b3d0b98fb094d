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
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;
import java.util.stream.Stream;

import org.eclipse.jetty.toolchain.test.jupiter.WorkDir;
import org.eclipse.jetty.toolchain.test.jupiter.WorkDirExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(WorkDirExtension.class)
public class DictionaryStagingTest
{
    public WorkDir workDir;

    private static byte[] bytes(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testHeader()
    {
        assertArrayEquals(bytes("Domain: example.com\nPath: /static\n\n"), DictionaryIdentity.header("example.com", "/static"));
    }

    @Test
    public void testIdentity() throws Exception
    {
        byte[] header = DictionaryIdentity.header("example.com", "/");
        byte[] content = bytes("dictionary content");
        DictionaryIdentity identity = DictionaryIdentity.of(header, content);

        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        digest.update(header);
        byte[] hash = digest.digest(content);
        assertThat(identity.getUserAgentId(), is(Base64.getUrlEncoder().encodeToString(Arrays.copyOfRange(hash, 0, 6))));
        assertThat(identity.getServerId(), is(Base64.getUrlEncoder().encodeToString(Arrays.copyOfRange(hash, 6, 12))));
        assertThat(identity.getUserAgentId().length(), is(8));
        assertThat(identity.getServerId().length(), is(8));
        assertThat(identity.getName(), is(identity.getUserAgentId()));

        assertThat(DictionaryIdentity.of(header, bytes("dictionary content")), is(identity));
        assertThat(DictionaryIdentity.of(DictionaryIdentity.header("example.org", "/"), content), is(not(identity)));
    }

    @Test
    public void testNothingPublished() throws Exception
    {
        DictionaryStaging staging = new DictionaryStaging(workDir.getEmptyPathDir(), "example.com", "/");
        assertThat(staging.getCurrent(), sameInstance(DictionaryRevision.EMPTY));
        assertThat(staging.load(), sameInstance(DictionaryRevision.EMPTY));
        assertThat(DictionaryRevision.EMPTY.isEmpty(), is(true));
        assertThat(DictionaryRevision.EMPTY.getContent().length, is(0));
    }

    @Test
    public void testPublish() throws Exception
    {
        Path directory = workDir.getEmptyPathDir();
        DictionaryStaging staging = new DictionaryStaging(directory, "example.com", "/");
        byte[] content = bytes("first dictionary");

        DictionaryRevision revision = staging.publish(content);

        assertThat(staging.getCurrent(), sameInstance(revision));
        assertThat(revision.isEmpty(), is(false));
        assertArrayEquals(content, revision.getContent());
        assertArrayEquals(content, Files.readAllBytes(directory.resolve(DictionaryStaging.DEFAULT_STAGING_FILE)));
        assertThat(revision.getPath(), is(directory.resolve(DictionaryStaging.REVISIONS).resolve(revision.getIdentity().getName())));
        assertArrayEquals(content, Files.readAllBytes(revision.getPath()));
        assertArrayEquals(bytes("Domain: example.com\nPath: /\n\nfirst dictionary"), revision.getResource());

        // No temporary file is left behind.
        try (Stream<Path> files = Files.list(directory))
        {
            assertThat(files.filter(p -> p.getFileName().toString().endsWith(".tmp")).count(), is(0L));
        }
    }

    @Test
    public void testPublishKeepsPreviousRevisionFile() throws Exception
    {
        Path directory = workDir.getEmptyPathDir();
        DictionaryStaging staging = new DictionaryStaging(directory, "example.com", "/");
        DictionaryRevision first = staging.publish(bytes("first dictionary"));
        DictionaryRevision second = staging.publish(bytes("second dictionary"));

        assertThat(staging.getCurrent(), sameInstance(second));
        assertThat(first.getPath(), is(not(second.getPath())));
        assertArrayEquals(bytes("first dictionary"), Files.readAllBytes(first.getPath()));
        assertArrayEquals(bytes("second dictionary"), Files.readAllBytes(staging.getStagingFile()));
    }

    @Test
    public void testGetResource() throws Exception
    {
        DictionaryStaging staging = new DictionaryStaging(workDir.getEmptyPathDir(), "example.com", "/app");
        DictionaryRevision first = staging.publish(bytes("first"));
        staging.publish(bytes("second"));

        assertArrayEquals(first.getResource(), staging.getResource(first.getIdentity().getName()));
        assertArrayEquals(bytes("Domain: example.com\nPath: /app\n\nfirst"), staging.getResource(first.getIdentity().getName()));
        assertThat(staging.getResource("unknown"), nullValue());
        assertThat(staging.getResource("../dictionary.raw"), nullValue());
        assertThat(staging.getResource(""), nullValue());
        assertThat(staging.getResource(null), nullValue());
    }

    @Test
    public void testLoadAfterRestart() throws Exception
    {
        Path directory = workDir.getEmptyPathDir();
        DictionaryRevision published = new DictionaryStaging(directory, "example.com", "/").publish(bytes("persistent"));

        DictionaryStaging restarted = new DictionaryStaging(directory, "example.com", "/");
        DictionaryRevision loaded = restarted.load();
        assertThat(restarted.getCurrent(), sameInstance(loaded));
        assertThat(loaded.getIdentity(), is(published.getIdentity()));
        assertArrayEquals(bytes("persistent"), loaded.getContent());
        assertThat(loaded.getPath(), is(published.getPath()));
    }

    @Test
    public void testLoadRecreatesMissingRevisionFile() throws Exception
    {
        Path directory = workDir.getEmptyPathDir();
        Files.write(directory.resolve(DictionaryStaging.DEFAULT_STAGING_FILE), bytes("staged by hand"));

        DictionaryStaging staging = new DictionaryStaging(directory, "example.com", "/");
        DictionaryRevision loaded = staging.load();
        assertTrue(Files.isRegularFile(loaded.getPath()));
        assertArrayEquals(bytes("staged by hand"), Files.readAllBytes(loaded.getPath()));
        assertArrayEquals(loaded.getResource(), staging.getResource(loaded.getIdentity().getName()));
    }
}
