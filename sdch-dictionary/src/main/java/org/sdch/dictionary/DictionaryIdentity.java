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
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * <p>The identifiers of a shared dictionary, as announced to user agents.</p>
 * <p>Both identifiers derive from the SHA-256 digest of the dictionary resource,
 * that is the dictionary header followed by the dictionary content: the user
 * agent identifier encodes the first 6 bytes of the digest and the server
 * identifier the next 6 bytes, each as 8 characters of URL safe base 64.</p>
 */
public final class DictionaryIdentity
{
    private static final int ID_LENGTH = 6;

    private final String _userAgentId;
    private final String _serverId;

    private DictionaryIdentity(String userAgentId, String serverId)
    {
        _userAgentId = userAgentId;
        _serverId = serverId;
    }

    /**
     * @param domain the domain the dictionary applies to
     * @param path the path the dictionary applies to
     * @return the dictionary header announcing the given domain and path
     */
    public static byte[] header(String domain, String path)
    {
        Objects.requireNonNull(domain);
        Objects.requireNonNull(path);
        return ("Domain: " + domain + "\nPath: " + path + "\n\n").getBytes(StandardCharsets.US_ASCII);
    }

    public static DictionaryIdentity of(byte[] header, byte[] content)
    {
        MessageDigest digest;
        try
        {
            digest = MessageDigest.getInstance("SHA-256");
        }
        catch (NoSuchAlgorithmException x)
        {
            throw new IllegalStateException(x);
        }
        digest.update(header);
        digest.update(content);
        byte[] hash = digest.digest();
        Base64.Encoder encoder = Base64.getUrlEncoder();
        return new DictionaryIdentity(
            encoder.encodeToString(Arrays.copyOfRange(hash, 0, ID_LENGTH)),
            encoder.encodeToString(Arrays.copyOfRange(hash, ID_LENGTH, 2 * ID_LENGTH)));
    }

    public String getUserAgentId()
    {
        return _userAgentId;
    }

    public String getServerId()
    {
        return _serverId;
    }

    /**
     * @return the name of the dictionary resource, which is its user agent identifier
     */
    public String getName()
    {
        return _userAgentId;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof DictionaryIdentity))
            return false;
        DictionaryIdentity that = (DictionaryIdentity)obj;
        return _userAgentId.equals(that._userAgentId) && _serverId.equals(that._serverId);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_userAgentId, _serverId);
    }

    @Override
    public String toString()
    {
        return String.format("%s{ua=%s,server=%s}", getClass().getSimpleName(), _userAgentId, _serverId);
    }
}
