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

/**
 * Block-based terms dictionary.
 * <p>
 * {@link com.gson.keno.blocktree.BlockTreeTermsWriter} splits the sorted
 * terms of each field into blocks of terms sharing a prefix (with floor
 * blocks when one prefix has too many entries) and indexes the block
 * prefixes in an FST. {@link com.gson.keno.blocktree.BlockTreeTermsReader}
 * keeps only the FSTs and the field summaries in memory and serves
 * {@link com.gson.keno.blocktree.SeekableTermCursor seekable cursors} and
 * automaton intersection over the on-disk blocks. Postings are encoded by
 * a {@link com.gson.keno.blocktree.PostingsWriterBase} /
 * {@link com.gson.keno.blocktree.PostingsReaderBase} pair; the dictionary
 * only stores the metadata those hand it.
 */
package com.gson.keno.blocktree;
