/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.gson.keno.blocktree;

import java.io.IOException;

import org.apache.lucene.index.TermState;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefIterator;

/**
 * Sequential, forward-only walk over the terms of one field.
 * <p>
 * Statistics and postings metadata are only decoded when one of
 * {@link #docFreq()}, {@link #totalTermFreq()} or {@link #termState()}
 * is called; these throw {@link IllegalStateException} when the cursor
 * is not positioned on a term.
 *
 * @see SeekableTermCursor
 * @lucene.experimental
 */
public interface TermCursor extends BytesRefIterator {

  /** Advances to the next term, returning it, or {@code null} when the
   *  field is exhausted. The returned bytes may be reused by the next call. */
  @Override
  BytesRef next() throws IOException;

  /** Returns the current term. */
  BytesRef term() throws IOException;

  /** Number of documents containing the current term. */
  int docFreq() throws IOException;

  /** Total occurrences of the current term, or -1 if the field omits
   *  frequencies. */
  long totalTermFreq() throws IOException;

  /** Snapshot of the current term's decoded state, including the postings
   *  metadata. */
  TermState termState() throws IOException;
}
