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

import org.sdch.dictionary.DictionaryRevision;

/**
 * Encodes content as a delta against a dictionary.
 */
@FunctionalInterface
public interface DeltaEncoder
{
    /**
     * @param content the content to encode
     * @param dictionary the dictionary to encode against, possibly {@link DictionaryRevision#isEmpty() empty}
     * @return a self describing delta from which the content can be rebuilt given the same dictionary
     * @throws DeltaException if the content could not be encoded
     */
    byte[] encode(byte[] content, DictionaryRevision dictionary) throws DeltaException;
}
