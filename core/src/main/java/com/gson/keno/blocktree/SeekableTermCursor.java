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
import org.apache.lucene.index.TermsEnum.SeekStatus;
import org.apache.lucene.util.BytesRef;

/**
 * {@link TermCursor} that can also be positioned by term.
 *
 * @lucene.experimental
 */
public interface SeekableTermCursor extends TermCursor {

  /**
   * Attempts to seek to the exact term, returning true if the term is
   * found. When false is returned, a following {@link #next()} returns
   * the smallest term greater than {@code text}, or null.
   */
  boolean seekExact(BytesRef text) throws IOException;

  /**
   * Seeks to the specified term if it exists, or to the next (ceiling)
   * term. Returns {@link SeekStatus#END} if no term follows
   * {@code text}, in which case the cursor is unpositioned.
   */
  SeekStatus seekCeil(BytesRef text) throws IOException;

  /**
   * Positions on {@code term} using a {@link TermState} previously
   * obtained from {@link #termState()} of a cursor over the same field.
   * No I/O is done until the cursor is moved.
   */
  void seekExact(BytesRef term, TermState state) throws IOException;
}
