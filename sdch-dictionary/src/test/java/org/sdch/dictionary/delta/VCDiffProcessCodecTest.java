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

package org.sdch.dictionary.delta;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import org.eclipse.jetty.toolchain.test.jupiter.WorkDir;
import org.eclipse.jetty.toolchain.test.jupiter.WorkDirExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.extension.ExtendWith;
import org.sdch.dictionary.DictionaryIdentity;
import org.sdch.dictionary.DictionaryRevision;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.condition.OS.LINUX;
import static org.junit.jupiter.api.condition.OS.MAC;

@EnabledOnOs({LINUX, MAC})
@ExtendWith(WorkDirExtension.class)
public class VCDiffProcessCodecTest
{
    public WorkDir workDir;

    private Path _dir;
    private Path _temp;
    private VCDiffProcessCodec _codec;

    @BeforeEach
    public void before() throws Exception
    {
        _dir = workDir.getEmptyPathDir();
        _temp = Files.createDirectories(_dir.resolve("tmp"));
        _codec = new VCDiffProcessCodec();
        _codec.setTempDirectory(_temp);
    }

    private static byte[] bytes(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private long countTempFiles() throws Exception
    {
        try (Stream<Path> files = Files.list(_temp))
        {
            return files.count();
        }
    }

    @Test
    public void testDefaultCommands()
    {
        assertThat(_codec.getEncodeCommand(), is(List.of("vcdiff", "delta", "-dictionary", "{dictionary}", "-interleaved", "-checksum")));
        assertThat(_codec.getDecodeCommand(), is(List.of("vcdiff", "patch", "-dictionary", "{dictionary}")));
        assertThrows(IllegalArgumentException.class, () -> _codec.setEncodeCommand(List.of()));
    }

    @Test
    public void testInputFedToProcess() throws Exception
    {
        _codec.setEncodeCommand(List.of("cat"));
        _codec.setDecodeCommand(List.of("cat"));
        byte[] content = bytes("some content to encode");
        assertArrayEquals(content, _codec.encode(content, DictionaryRevision.EMPTY));
        assertArrayEquals(content, _codec.decode(content, DictionaryRevision.EMPTY));
        assertThat(countTempFiles(), is(0L));
    }

    @Test
    public void testEmptyDictionaryWrittenToTemporaryFile() throws Exception
    {
        _codec.setEncodeCommand(List.of("sh", "-c", "cat {dictionary}; printf :; cat"));
        assertArrayEquals(bytes(":input"), _codec.encode(bytes("input"), DictionaryRevision.EMPTY));
        assertThat(countTempFiles(), is(0L));
    }

    @Test
    public void testDictionaryFile() throws Exception
    {
        Path file = _dir.resolve("dictionary.bin");
        Files.write(file, bytes("DICT"));
        byte[] header = DictionaryIdentity.header("example.com", "/");
        DictionaryRevision revision = new DictionaryRevision(header, bytes("DICT"), file, Instant.now());

        _codec.setEncodeCommand(List.of("cat", "{dictionary}"));
        assertArrayEquals(bytes("DICT"), _codec.encode(bytes("ignored"), revision));
    }

    @Test
    public void testFailingProcess() throws Exception
    {
        _codec.setEncodeCommand(List.of("sh", "-c", "echo broken >&2; exit 3"));
        DeltaException x = assertThrows(DeltaException.class, () -> _codec.encode(bytes("input"), DictionaryRevision.EMPTY));
        assertThat(x.getMessage(), containsString("exited with 3"));
        assertThat(x.getMessage(), containsString("broken"));
        assertThat(countTempFiles(), is(0L));
    }

    @Test
    public void testMissingCommand()
    {
        _codec.setEncodeCommand(List.of("no-such-vcdiff-command"));
        assertThrows(DeltaException.class, () -> _codec.encode(bytes("input"), DictionaryRevision.EMPTY));
    }

    @Test
    public void testTimeout() throws Exception
    {
        _codec.setEncodeCommand(List.of("sleep", "5"));
        _codec.setTimeout(100);
        DeltaException x = assertThrows(DeltaException.class, () -> _codec.encode(bytes("input"), DictionaryRevision.EMPTY));
        assertThat(x.getMessage(), containsString("timed out"));
        assertThat(countTempFiles(), is(0L));
    }
}
