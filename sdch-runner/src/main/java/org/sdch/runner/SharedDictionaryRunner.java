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

package org.sdch.runner;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.util.StringUtil;
import org.sdch.dictionary.Chunker;
import org.sdch.dictionary.DictionaryBuilder;
import org.sdch.dictionary.DictionaryStaging;
import org.sdch.dictionary.IngestStatistics;
import org.sdch.dictionary.SharedDictionaryEngine;
import org.sdch.dictionary.delta.DeltaException;
import org.sdch.dictionary.delta.VCDiffProcessCodec;
import org.sdch.dictionary.store.JDBCChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SharedDictionaryRunner
 * <p>
 * Ingests files into a shared dictionary from the command line, printing the
 * size of the delta of each file and the ingestion statistics.
 * The configuration is read from an optional properties file given with
 * {@code --config}, then overridden by {@code --<key> <value>} arguments where
 * the key is a configuration key without its {@code sdch.} prefix.
 */
public class SharedDictionaryRunner
{
    private static final Logger LOG = LoggerFactory.getLogger(SharedDictionaryRunner.class);

    public static final String DICTIONARY_DIR = "sdch.dictionary.dir";
    public static final String CHUNK_BITS = "sdch.chunk.bits";
    public static final String REBUILD_THRESHOLD = "sdch.rebuild.threshold";
    public static final String QUEUE_CAPACITY = "sdch.queue.capacity";
    public static final String DOMAIN = "sdch.domain";
    public static final String PATH = "sdch.path";
    public static final String JDBC_DRIVER = "sdch.jdbc.driver";
    public static final String JDBC_URL = "sdch.jdbc.url";
    public static final String JDBC_USERNAME = "sdch.jdbc.username";
    public static final String JDBC_PASSWORD = "sdch.jdbc.password";
    public static final String VCDIFF_ENCODE = "sdch.vcdiff.encode";
    public static final String VCDIFF_DECODE = "sdch.vcdiff.decode";
    public static final String VCDIFF_TIMEOUT = "sdch.vcdiff.timeout";

    public static final String DEFAULT_DICTIONARY_DIR = "dict";
    public static final String DEFAULT_DOMAIN = "localhost";
    public static final String DEFAULT_PATH = "/";
    public static final long DRAIN_TIMEOUT = TimeUnit.MINUTES.toMillis(5);

    private final Properties _properties = new Properties();
    private final List<Path> _files = new ArrayList<>();
    private final PrintStream _out;

    public SharedDictionaryRunner()
    {
        this(System.out);
    }

    public SharedDictionaryRunner(PrintStream out)
    {
        _out = out;
    }

    public static void usage(String error)
    {
        if (error != null)
            System.err.println("ERROR: " + error);
        System.err.println("Usage: java [-Dorg.sdch.LEVEL=DEBUG] -jar sdch-runner.jar [--config <file>] [--<key> <value>]... <file>...");
        System.err.println("Keys:");
        System.err.println(" --dictionary.dir <dir>     - directory of the dictionary files (default " + DEFAULT_DICTIONARY_DIR + ")");
        System.err.println(" --chunk.bits <n>           - checksum bits per chunk boundary (default " + Chunker.DEFAULT_BOUNDARY_BITS + ")");
        System.err.println(" --rebuild.threshold <r>    - ratio of changed chunks above which the dictionary is rebuilt (default " + DictionaryBuilder.DEFAULT_THRESHOLD + ")");
        System.err.println(" --queue.capacity <n>       - maximum number of contents waiting for ingestion (default " + SharedDictionaryEngine.DEFAULT_QUEUE_CAPACITY + ")");
        System.err.println(" --domain <domain>          - domain announced by the dictionary (default " + DEFAULT_DOMAIN + ")");
        System.err.println(" --path <path>              - path announced by the dictionary (default " + DEFAULT_PATH + ")");
        System.err.println(" --jdbc.driver <class>      - JDBC driver class (default " + JDBCChunkStore.DEFAULT_DRIVER + ")");
        System.err.println(" --jdbc.url <url>           - JDBC URL of the chunk database (default a Derby database in the dictionary directory)");
        System.err.println(" --jdbc.username <name>     - JDBC user name");
        System.err.println(" --jdbc.password <password> - JDBC password");
        System.err.println(" --vcdiff.encode <command>  - delta command line, " + VCDiffProcessCodec.DICTIONARY + " is the dictionary file");
        System.err.println(" --vcdiff.decode <command>  - patch command line, " + VCDiffProcessCodec.DICTIONARY + " is the dictionary file");
        System.err.println(" --vcdiff.timeout <ms>      - delta command timeout (default " + VCDiffProcessCodec.DEFAULT_TIMEOUT + ")");
        System.exit(1);
    }

    /**
     * @param args the command line arguments
     * @throws IOException if the configuration file could not be read
     */
    public void configure(String[] args) throws IOException
    {
        for (int i = 0; i < args.length; i++)
        {
            String arg = args[i];
            if ("--config".equals(arg))
            {
                if (++i == args.length)
                    throw new IllegalArgumentException("Missing value for " + arg);
                try (InputStream in = Files.newInputStream(Path.of(args[i])))
                {
                    _properties.load(in);
                }
            }
            else if (arg.startsWith("--"))
            {
                if (++i == args.length)
                    throw new IllegalArgumentException("Missing value for " + arg);
                _properties.setProperty("sdch." + arg.substring(2), args[i]);
            }
            else
            {
                _files.add(Path.of(arg));
            }
        }
    }

    public Properties getProperties()
    {
        return _properties;
    }

    public List<Path> getFiles()
    {
        return _files;
    }

    /**
     * @return a new, not started, engine configured from the properties
     */
    public SharedDictionaryEngine newEngine()
    {
        Path directory = Path.of(_properties.getProperty(DICTIONARY_DIR, DEFAULT_DICTIONARY_DIR));

        JDBCChunkStore store = new JDBCChunkStore();
        String url = _properties.getProperty(JDBC_URL);
        if (StringUtil.isBlank(url))
            url = "jdbc:derby:" + directory.resolve("chunks").toAbsolutePath() + ";create=true";
        store.setDriverInfo(_properties.getProperty(JDBC_DRIVER, JDBCChunkStore.DEFAULT_DRIVER), url);
        String userName = _properties.getProperty(JDBC_USERNAME);
        if (userName != null)
            store.setCredentials(userName, _properties.getProperty(JDBC_PASSWORD));

        VCDiffProcessCodec codec = new VCDiffProcessCodec();
        String encode = _properties.getProperty(VCDIFF_ENCODE);
        if (!StringUtil.isBlank(encode))
            codec.setEncodeCommand(split(encode));
        String decode = _properties.getProperty(VCDIFF_DECODE);
        if (!StringUtil.isBlank(decode))
            codec.setDecodeCommand(split(decode));
        codec.setTimeout(getLong(VCDIFF_TIMEOUT, VCDiffProcessCodec.DEFAULT_TIMEOUT));

        DictionaryStaging staging = new DictionaryStaging(directory,
            _properties.getProperty(DOMAIN, DEFAULT_DOMAIN),
            _properties.getProperty(PATH, DEFAULT_PATH));

        SharedDictionaryEngine engine = new SharedDictionaryEngine(store, codec, staging);
        engine.setChunker(new Chunker((int)getLong(CHUNK_BITS, Chunker.DEFAULT_BOUNDARY_BITS)));
        engine.setQueueCapacity((int)getLong(QUEUE_CAPACITY, SharedDictionaryEngine.DEFAULT_QUEUE_CAPACITY));
        engine.getDictionaryBuilder().setThreshold(getDouble(REBUILD_THRESHOLD, DictionaryBuilder.DEFAULT_THRESHOLD));
        return engine;
    }

    private static List<String> split(String command)
    {
        return Arrays.asList(command.trim().split("\\s+"));
    }

    private long getLong(String key, long defaultValue)
    {
        String value = _properties.getProperty(key);
        if (StringUtil.isBlank(value))
            return defaultValue;
        try
        {
            return Long.parseLong(value.trim());
        }
        catch (NumberFormatException x)
        {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, x);
        }
    }

    private double getDouble(String key, double defaultValue)
    {
        String value = _properties.getProperty(key);
        if (StringUtil.isBlank(value))
            return defaultValue;
        try
        {
            return Double.parseDouble(value.trim());
        }
        catch (NumberFormatException x)
        {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, x);
        }
    }

    /**
     * <p>Starts an engine, ingests the files in order, waits for their
     * ingestion and stops the engine.</p>
     *
     * @return the statistics of the run
     * @throws Exception if the engine could not be started or stopped
     */
    public IngestStatistics run() throws Exception
    {
        SharedDictionaryEngine engine = newEngine();
        engine.start();
        try
        {
            for (Path file : _files)
            {
                byte[] content = Files.readAllBytes(file);
                try
                {
                    byte[] delta = engine.ingest(content);
                    double ratio = content.length == 0 ? 100D : 100D * delta.length / content.length;
                    _out.printf(Locale.ENGLISH, "%s: %d/%d (%.2f%%)%n", file, delta.length, content.length, ratio);
                }
                catch (DeltaException x)
                {
                    LOG.warn("Unable to encode {}", file, x);
                    _out.printf(Locale.ENGLISH, "%s: not encoded (%s)%n", file, x.getMessage());
                }
            }
            awaitIngestion(engine);
            _out.println(engine.getStatistics());
            _out.println("dictionary " + engine.getCurrentRevision().getIdentity().getName() +
                " of " + engine.getCurrentRevision().getContent().length + " bytes");
            return engine.getStatistics();
        }
        finally
        {
            engine.stop();
        }
    }

    private void awaitIngestion(SharedDictionaryEngine engine) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(DRAIN_TIMEOUT);
        while (engine.getStatistics().getIngestionsPending() > 0)
        {
            if (System.nanoTime() - deadline > 0)
            {
                LOG.warn("Gave up waiting for {} pending ingestions", engine.getStatistics().getIngestionsPending());
                return;
            }
            Thread.sleep(50);
        }
    }

    public static void main(String[] args)
    {
        SharedDictionaryRunner runner = new SharedDictionaryRunner();
        try
        {
            if (args.length == 0 || "--help".equals(args[0]) || "-?".equals(args[0]))
                usage(null);
            runner.configure(args);
            if (runner.getFiles().isEmpty())
                usage("No files to ingest");
            runner.run();
        }
        catch (IllegalArgumentException e)
        {
            usage(e.getMessage());
        }
        catch (Throwable e)
        {
            LOG.warn("Unable to run", e);
            System.exit(1);
        }
    }
}
