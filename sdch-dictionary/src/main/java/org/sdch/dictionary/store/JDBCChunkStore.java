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

package org.sdch.dictionary.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.eclipse.jetty.util.StringUtil;
import org.eclipse.jetty.util.annotation.ManagedAttribute;
import org.eclipse.jetty.util.annotation.ManagedObject;
import org.eclipse.jetty.util.component.AbstractLifeCycle;
import org.eclipse.jetty.util.thread.AutoLock;
import org.sdch.dictionary.Chunk;
import org.sdch.dictionary.ChunkHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A {@link ChunkStore} backed by a single table of a JDBC database.</p>
 * <p>The table holds, for each chunk, its hash as lowercase hexadecimal text
 * (the unique key), its content and its count of occurrences. It is created
 * when the store starts if it does not exist yet. Failing to connect or to
 * create the table fails the start of the store.</p>
 * <p>The connection details are either set with {@link #setDriverInfo(String, String)}
 * and {@link #setCredentials(String, String)}, or loaded when the store starts
 * from the properties file set with {@link #setConfig(String)}, which may contain
 * the keys {@code jdbcdriver}, {@code url}, {@code username}, {@code password}
 * and {@code table}.</p>
 * <p>Writers are serialized and each {@link #upsert(List)} runs in its own
 * transaction, which is rolled back if any of its statements fails.</p>
 */
@ManagedObject("JDBC chunk store")
public class JDBCChunkStore extends AbstractLifeCycle implements ChunkStore
{
    private static final Logger LOG = LoggerFactory.getLogger(JDBCChunkStore.class);

    public static final String DEFAULT_DRIVER = "org.apache.derby.jdbc.EmbeddedDriver";
    public static final String DEFAULT_TABLE = "chunks";

    private final AutoLock _lock = new AutoLock();
    private String _config;
    private String _driverClassName = DEFAULT_DRIVER;
    private String _url;
    private String _userName;
    private String _password;
    private String _tableName = DEFAULT_TABLE;
    private Connection _connection;
    private String _updateSql;
    private String _insertSql;
    private String _countSql;
    private String _popularSql;
    private String _sizeSql;

    public JDBCChunkStore()
    {
    }

    public JDBCChunkStore(String url)
    {
        setDriverInfo(DEFAULT_DRIVER, url);
    }

    /**
     * @param driverClassName the JDBC driver class to load, or null if the driver registers itself
     * @param url the JDBC connection URL
     */
    public void setDriverInfo(String driverClassName, String url)
    {
        checkNotRunning();
        _driverClassName = driverClassName;
        _url = url;
    }

    public void setCredentials(String userName, String password)
    {
        checkNotRunning();
        _userName = userName;
        _password = password;
    }

    /**
     * @param config the path of a properties file with the connection details
     */
    public void setConfig(String config)
    {
        checkNotRunning();
        _config = config;
    }

    public String getConfig()
    {
        return _config;
    }

    @ManagedAttribute("The JDBC driver class")
    public String getDriverClassName()
    {
        return _driverClassName;
    }

    @ManagedAttribute("The JDBC connection URL")
    public String getUrl()
    {
        return _url;
    }

    @ManagedAttribute("The name of the chunk table")
    public String getTableName()
    {
        return _tableName;
    }

    public void setTableName(String tableName)
    {
        checkNotRunning();
        _tableName = checkIdentifier(tableName);
    }

    private void checkNotRunning()
    {
        if (isRunning())
            throw new IllegalStateException("Running");
    }

    private static String checkIdentifier(String name)
    {
        if (StringUtil.isBlank(name) || !name.matches("[A-Za-z_][A-Za-z0-9_]*"))
            throw new IllegalArgumentException("Invalid table name: " + name);
        return name;
    }

    @Override
    protected void doStart() throws Exception
    {
        if (_config != null)
            loadConfig(Path.of(_config));

        if (StringUtil.isBlank(_url))
            throw new IllegalStateException("No JDBC URL configured for " + this);

        _updateSql = "update " + _tableName + " set occurrences = occurrences + 1 where hash = ?";
        _insertSql = "insert into " + _tableName + " (hash, content, occurrences) values (?, ?, 1)";
        _countSql = "select occurrences from " + _tableName + " where hash = ?";
        _popularSql = "select hash, content, occurrences from " + _tableName + " where occurrences > 1 order by occurrences asc, hash desc";
        _sizeSql = "select count(*) from " + _tableName;

        try (AutoLock l = _lock.lock())
        {
            _connection = connect();
            try
            {
                prepareTable();
            }
            catch (SQLException x)
            {
                closeConnection();
                throw x;
            }
        }
        super.doStart();
        if (LOG.isDebugEnabled())
            LOG.debug("Started {}", this);
    }

    @Override
    protected void doStop() throws Exception
    {
        super.doStop();
        try (AutoLock l = _lock.lock())
        {
            closeConnection();
        }
    }

    private void loadConfig(Path config) throws IOException
    {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(config))
        {
            properties.load(in);
        }
        _driverClassName = properties.getProperty("jdbcdriver", _driverClassName);
        _url = properties.getProperty("url", _url);
        _userName = properties.getProperty("username", _userName);
        _password = properties.getProperty("password", _password);
        String table = properties.getProperty("table");
        if (table != null)
            _tableName = checkIdentifier(table);
    }

    private Connection connect() throws ClassNotFoundException, SQLException
    {
        if (!StringUtil.isBlank(_driverClassName))
            Class.forName(_driverClassName);
        if (_userName != null)
            return DriverManager.getConnection(_url, _userName, _password);
        return DriverManager.getConnection(_url);
    }

    private void prepareTable() throws SQLException
    {
        DatabaseMetaData metaData = _connection.getMetaData();
        String table = _tableName;
        if (metaData.storesUpperCaseIdentifiers())
            table = table.toUpperCase(Locale.ENGLISH);
        else if (metaData.storesLowerCaseIdentifiers())
            table = table.toLowerCase(Locale.ENGLISH);

        try (ResultSet result = metaData.getTables(null, null, table, null))
        {
            if (result.next())
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Using existing table {}", _tableName);
                return;
            }
        }

        try (Statement statement = _connection.createStatement())
        {
            statement.executeUpdate("create table " + _tableName +
                " (hash varchar(" + (ChunkHash.LENGTH * 2) + ") not null primary key, content blob, occurrences bigint not null)");
        }
        LOG.info("Created chunk table {}", _tableName);
    }

    private void closeConnection()
    {
        if (_connection == null)
            return;
        try
        {
            _connection.close();
        }
        catch (SQLException x)
        {
            LOG.warn("Unable to close connection to {}", _url, x);
        }
        finally
        {
            _connection = null;
        }
    }

    private Connection getConnection() throws ChunkStoreException
    {
        if (_connection == null)
            throw new ChunkStoreException("Not started: " + this);
        return _connection;
    }

    @Override
    public long[] upsert(List<Chunk> chunks) throws ChunkStoreException
    {
        long[] counts = new long[chunks.size()];
        if (chunks.isEmpty())
            return counts;

        try (AutoLock l = _lock.lock())
        {
            Connection connection = getConnection();
            try
            {
                connection.setAutoCommit(false);
                try (PreparedStatement update = connection.prepareStatement(_updateSql);
                     PreparedStatement insert = connection.prepareStatement(_insertSql);
                     PreparedStatement count = connection.prepareStatement(_countSql))
                {
                    for (int i = 0; i < counts.length; ++i)
                    {
                        Chunk chunk = chunks.get(i);
                        String hash = chunk.getHash().toString();
                        update.setString(1, hash);
                        if (update.executeUpdate() == 0)
                        {
                            insert.setString(1, hash);
                            insert.setBytes(2, chunk.getContent());
                            insert.executeUpdate();
                            counts[i] = 1;
                        }
                        else
                        {
                            counts[i] = queryCount(count, hash);
                        }
                    }
                }
                connection.commit();
            }
            catch (SQLException x)
            {
                rollback(connection);
                throw new ChunkStoreException("Unable to upsert " + chunks.size() + " chunks", x);
            }
            finally
            {
                restoreAutoCommit(connection);
            }
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Upserted {} chunks in {}", counts.length, this);
        return counts;
    }

    private static long queryCount(PreparedStatement count, String hash) throws SQLException
    {
        count.setString(1, hash);
        try (ResultSet result = count.executeQuery())
        {
            if (!result.next())
                throw new SQLException("No chunk " + hash);
            return result.getLong(1);
        }
    }

    private void rollback(Connection connection)
    {
        try
        {
            connection.rollback();
        }
        catch (SQLException x)
        {
            LOG.warn("Unable to rollback upsert in {}", this, x);
        }
    }

    private void restoreAutoCommit(Connection connection)
    {
        try
        {
            connection.setAutoCommit(true);
        }
        catch (SQLException x)
        {
            LOG.warn("Unable to restore auto commit in {}", this, x);
        }
    }

    @Override
    public List<Chunk> getPopularChunks() throws ChunkStoreException
    {
        try (AutoLock l = _lock.lock())
        {
            List<Chunk> chunks = new ArrayList<>();
            try (PreparedStatement statement = getConnection().prepareStatement(_popularSql);
                 ResultSet result = statement.executeQuery())
            {
                while (result.next())
                {
                    ChunkHash hash = ChunkHash.fromString(result.getString(1));
                    chunks.add(new Chunk(hash, result.getBytes(2), result.getLong(3)));
                }
            }
            catch (SQLException x)
            {
                throw new ChunkStoreException("Unable to query popular chunks", x);
            }
            return chunks;
        }
    }

    /**
     * @param hash the hash of the chunk
     * @return the number of times the chunk has been counted, or zero if it is not stored
     * @throws ChunkStoreException if the count could not be read
     */
    public long getOccurrences(ChunkHash hash) throws ChunkStoreException
    {
        try (AutoLock l = _lock.lock())
        {
            try (PreparedStatement statement = getConnection().prepareStatement(_countSql))
            {
                statement.setString(1, hash.toString());
                try (ResultSet result = statement.executeQuery())
                {
                    return result.next() ? result.getLong(1) : 0;
                }
            }
            catch (SQLException x)
            {
                throw new ChunkStoreException("Unable to query chunk " + hash, x);
            }
        }
    }

    /**
     * @return the number of distinct chunks stored
     * @throws ChunkStoreException if the table could not be read
     */
    public long getChunkCount() throws ChunkStoreException
    {
        try (AutoLock l = _lock.lock())
        {
            try (PreparedStatement statement = getConnection().prepareStatement(_sizeSql);
                 ResultSet result = statement.executeQuery())
            {
                return result.next() ? result.getLong(1) : 0;
            }
            catch (SQLException x)
            {
                throw new ChunkStoreException("Unable to count chunks", x);
            }
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,url=%s,table=%s}", getClass().getSimpleName(), hashCode(), getState(), _url, _tableName);
    }
}
