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
 * Rebuilds content from a delta produced by a {@link DeltaEncoder}.
 */
@FunctionalInterface
public interface DeltaDecoder
{
    /**
     * @param delta the delta to decode
     * @param dictionary the dictionary the delta was encoded against
     * @return the original content, exactly
     * @throws DeltaException if the delta could not be decoded
     */
    byte[] decode(byte[] delta, DictionaryRevision dictionary) throws DeltaException;
}
