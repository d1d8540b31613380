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
import java.util.Collection;
import java.util.Collections;

import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.Accountables;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.RamUsageEstimator;
import org.apache.lucene.util.automaton.CompiledAutomaton;
import org.apache.lucene.util.fst.FST;

/**
 * BlockTree's implementation of the terms of one field.
 * <p>
 * Only the field summary and the prefix index are held in memory;
 * blocks are read from the terms file by the cursors, each on its own
 * clone of the input.
 *
 * @lucene.internal
 */
public final class FieldReader implements Accountable {

  private static final long BASE_RAM_BYTES_USED =
      RamUsageEstimator.shallowSizeOfInstance(FieldReader.class)
      + 3 * RamUsageEstimator.shallowSizeOfInstance(BytesRef.class);

  final long numTerms;
  final FieldInfo fieldInfo;
  final long sumTotalTermFreq;
  final long sumDocFreq;
  final int docCount;
  final long indexStartFP;
  final long rootBlockFP;
  final BytesRef rootCode;
  final int longsSize;
  final BlockTreeTermsReader parent;

  final FST<BytesRef> index;

  FieldReader(BlockTreeTermsReader parent, FieldInfo fieldInfo, long numTerms, BytesRef rootCode, long sumTotalTermFreq, long sumDocFreq, int docCount,
              long indexStartFP, int longsSize, IndexInput indexIn) throws IOException {
    assert numTerms > 0;
    this.fieldInfo = fieldInfo;
    this.parent = parent;
    this.numTerms = numTerms;
    this.sumTotalTermFreq = sumTotalTermFreq;
    this.sumDocFreq = sumDocFreq;
    this.docCount = docCount;
    this.indexStartFP = indexStartFP;
    this.rootCode = rootCode;
    this.longsSize = longsSize;

    rootBlockFP = (new ByteArrayDataInput(rootCode.bytes, rootCode.offset, rootCode.length)).readVLong() >>> BlockTreeTermsReader.OUTPUT_FLAGS_NUM_BITS;

    final IndexInput clone = indexIn.clone();
    clone.seek(indexStartFP);
    index = new FST<>(clone, clone, BlockTreeTermsReader.FST_OUTPUTS);
  }

  /** Returns the {@link FieldInfo} of this field. */
  public FieldInfo getFieldInfo() {
    return fieldInfo;
  }

  /** Walks every block of the field and reports how the terms were blocked. */
  public Stats computeStats() throws IOException {
    return new SegmentTermsEnum(this).computeBlockStats();
  }

  /** Whether the field records term frequencies. */
  public boolean hasFreqs() {
    return fieldInfo.getIndexOptions().compareTo(IndexOptions.DOCS_AND_FREQS) >= 0;
  }

  /** Whether the field records positions. */
  public boolean hasPositions() {
    return fieldInfo.getIndexOptions().compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
  }

  /** Number of {@code long}s the postings codec records for each term. */
  public int getMetadataArity() {
    return longsSize;
  }

  /** Returns a cursor over the field's terms that also supports seeking. */
  public SeekableTermCursor iterator() throws IOException {
    return new SegmentTermsEnum(this);
  }

  /** Number of terms in the field. */
  public long size() {
    return numTerms;
  }

  /** Sum of {@code totalTermFreq} over all terms, or -1 if the field omits frequencies. */
  public long getSumTotalTermFreq() {
    return sumTotalTermFreq;
  }

  /** Sum of {@code docFreq} over all terms. */
  public long getSumDocFreq() {
    return sumDocFreq;
  }

  /** Number of documents with at least one term in this field. */
  public int getDocCount() {
    return docCount;
  }

  /**
   * Returns a cursor over the terms accepted by {@code compiled}, in
   * order. When {@code startTerm} is not null only terms strictly
   * greater than it are returned.
   */
  public TermCursor intersect(CompiledAutomaton compiled, BytesRef startTerm) throws IOException {
    if (compiled.type != CompiledAutomaton.AUTOMATON_TYPE.NORMAL) {
      throw new IllegalArgumentException("please use CompiledAutomaton.getTermsEnum instead");
    }
    return new IntersectTermsEnum(this, compiled, startTerm);
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + index.ramBytesUsed();
  }

  @Override
  public Collection<Accountable> getChildResources() {
    return Collections.singleton(Accountables.namedAccountable("term index", index));
  }

  @Override
  public String toString() {
    return "BlockTreeTerms(seg=" + parent.segment +" terms=" + numTerms + ",postings=" + sumDocFreq + ",positions=" + sumTotalTermFreq + ",docs=" + docCount + ")";
  }
}
