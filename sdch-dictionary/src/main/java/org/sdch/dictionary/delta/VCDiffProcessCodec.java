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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.sdch.dictionary.DictionaryRevision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A {@link DeltaCodec} that runs the external {@code vcdiff} tool.</p>
 * <p>Encoding runs {@code vcdiff delta -dictionary <file> -interleaved -checksum},
 * which produces a checksummed VCDIFF stream referencing the dictionary file, and
 * decoding runs {@code vcdiff patch -dictionary <file>}. Both commands can be
 * replaced; the {@value #DICTIONARY} argument is replaced by the path of the
 * dictionary file. The input is fed to the standard input of the process and
 * the result is read from its standard output.</p>
 * <p>When the dictionary has no file, for example before any dictionary has been
 * built, its content is written to a temporary file for the duration of the call.</p>
 */
@ManagedObject("VCDIFF delta codec running an external process")
public class VCDiffProcessCodec implements DeltaCodec
{
    private static final Logger LOG = LoggerFactory.getLogger(VCDiffProcessCodec.class);

    public static final String DICTIONARY = "{dictionary}";
    public static final List<String> DEFAULT_ENCODE_COMMAND = List.of("vcdiff", "delta", "-dictionary", DICTIONARY, "-interleaved", "-checksum");
    public static final List<String> DEFAULT_DECODE_COMMAND = List.of("vcdiff", "patch", "-dictionary", DICTIONARY);
    public static final long DEFAULT_TIMEOUT = 30000;

    private List<String> _encodeCommand = DEFAULT_ENCODE_COMMAND;
    private List<String> _decodeCommand = DEFAULT_DECODE_COMMAND;
    private long _timeout = DEFAULT_TIMEOUT;
    private Path _tempDirectory;

    @ManagedAttribute("The encode command line")
    public List<String> getEncodeCommand()
    {
        return _encodeCommand;
    }

    public void setEncodeCommand(List<String> encodeCommand)
    {
        _encodeCommand = checkCommand(encodeCommand);
    }

    @ManagedAttribute("The decode command line")
    public List<String> getDecodeCommand()
    {
        return _decodeCommand;
    }

    public void setDecodeCommand(List<String> decodeCommand)
    {
        _decodeCommand = checkCommand(decodeCommand);
    }

    private static List<String> checkCommand(List<String> command)
    {
        if (command == null || command.isEmpty())
            throw new IllegalArgumentException("Empty command");
        return List.copyOf(command);
    }

    /**
     * @return the time in ms a process may run before it is killed
     */
    @ManagedAttribute("The process timeout in ms")
    public long getTimeout()
    {
        return _timeout;
    }

    public void setTimeout(long timeout)
    {
        _timeout = timeout;
    }

    public Path getTempDirectory()
    {
        return _tempDirectory;
    }

    /**
     * @param tempDirectory the directory of the temporary files, or null for the default temporary directory
     */
    public void setTempDirectory(Path tempDirectory)
    {
        _tempDirectory = tempDirectory;
    }

    @Override
    public byte[] encode(byte[] content, DictionaryRevision dictionary) throws DeltaException
    {
        return run(_encodeCommand, content, dictionary);
    }

    @Override
    public byte[] decode(byte[] delta, DictionaryRevision dictionary) throws DeltaException
    {
        return run(_decodeCommand, delta, dictionary);
    }

    private byte[] run(List<String> template, byte[] input, DictionaryRevision dictionary) throws DeltaException
    {
        List<Path> temporary = new ArrayList<>();
        try
        {
            Path dictionaryFile = dictionary.getPath();
            if (dictionaryFile == null)
                dictionaryFile = newTempFile(temporary, "dictionary", dictionary.getContent());
            Path in = newTempFile(temporary, "in", input);
            Path out = newTempFile(temporary, "out", new byte[0]);
            Path err = newTempFile(temporary, "err", new byte[0]);

            List<String> command = new ArrayList<>(template.size());
            for (String argument : template)
            {
                command.add(argument.replace(DICTIONARY, dictionaryFile.toString()));
            }

            if (LOG.isDebugEnabled())
                LOG.debug("Running {} on {} bytes", command, input.length);
            Process process = new ProcessBuilder(command)
                .redirectInput(in.toFile())
                .redirectOutput(out.toFile())
                .redirectError(err.toFile())
                .start();

            if (!process.waitFor(_timeout, TimeUnit.MILLISECONDS))
            {
                process.destroyForcibly();
                throw new DeltaException(command.get(0) + " timed out after " + _timeout + " ms");
            }

            int exit = process.exitValue();
            String errors = Files.readString(err, StandardCharsets.UTF_8).trim();
            if (exit != 0)
                throw new DeltaException(command.get(0) + " exited with " + exit + (errors.isEmpty() ? "" : ": " + errors));
            if (LOG.isDebugEnabled() && !errors.isEmpty())
                LOG.debug("{} reported: {}", command.get(0), errors);

            return Files.readAllBytes(out);
        }
        catch (IOException x)
        {
            throw new DeltaException("Unable to run " + template.get(0), x);
        }
        catch (InterruptedException x)
        {
            Thread.currentThread().interrupt();
            throw new DeltaException("Interrupted running " + template.get(0), x);
        }
        finally
        {
            for (Path path : temporary)
            {
                try
                {
                    Files.deleteIfExists(path);
                }
                catch (IOException x)
                {
                    LOG.warn("Unable to delete {}", path, x);
                }
            }
        }
    }

    private Path newTempFile(List<Path> temporary, String suffix, byte[] content) throws IOException
    {
        Path file = _tempDirectory == null
            ? Files.createTempFile("vcdiff-", "." + suffix)
            : Files.createTempFile(_tempDirectory, "vcdiff-", "." + suffix);
        temporary.add(file);
        Files.write(file, content);
        return file;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{encode=%s,decode=%s}", getClass().getSimpleName(), hashCode(), _encodeCommand, _decodeCommand);
    }
}
