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

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.Accountables;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.InfoStream;
import org.apache.lucene.util.RamUsageEstimator;
import org.apache.lucene.util.fst.ByteSequenceOutputs;
import org.apache.lucene.util.fst.Outputs;

/** A block-based terms index and dictionary that assigns
 *  terms to variable length blocks according to how they
 *  share prefixes.  The terms index is a prefix trie
 *  whose leaves are term blocks.  The advantage of this
 *  approach is that seekExact is often able to
 *  determine a term cannot exist without doing any IO, and
 *  intersection with Automata is very fast.  Note that this
 *  terms dictionary has its own fixed terms index (ie, it
 *  does not support a pluggable terms index
 *  implementation).
 *
 *  <p><b>NOTE</b>: this terms dictionary supports
 *  min/maxItemsPerBlock during indexing to control how
 *  much memory the terms index uses.</p>
 *
 *  <p>The data structure used by this implementation is very
 *  similar to a burst trie
 *  (http://citeseer.ist.psu.edu/viewdoc/summary?doi=10.1.1.18.3499),
 *  but with added logic to break up too-large blocks of all
 *  terms sharing a given prefix into smaller ones.</p>
 *
 *  <p>Use {@link FieldReader#computeStats} to see summary
 *  statistics about the blocks in this field.</p>
 *
 * @lucene.experimental
 */
public final class BlockTreeTermsReader implements Closeable, Accountable {

  static final Outputs<BytesRef> FST_OUTPUTS = ByteSequenceOutputs.getSingleton();

  static final BytesRef NO_OUTPUT = FST_OUTPUTS.getNoOutput();

  static final int OUTPUT_FLAGS_NUM_BITS = 2;
  static final int OUTPUT_FLAGS_MASK = 0x3;
  static final int OUTPUT_FLAG_IS_FLOOR = 0x1;
  static final int OUTPUT_FLAG_HAS_TERMS = 0x2;

  /** Extension of terms file */
  static final String TERMS_EXTENSION = "tim";
  final static String TERMS_CODEC_NAME = "BLOCK_TREE_TERMS_DICT";

  /** Initial terms format. */
  public static final int VERSION_APPEND_ONLY = 1;

  /** Records the postings metadata arity per field. */
  public static final int VERSION_META_ARRAY = 2;

  /** Header bound to the segment, checksummed footer. */
  public static final int VERSION_CHECKSUM = 3;

  /** Oldest version this reader accepts. */
  public static final int VERSION_START = VERSION_APPEND_ONLY;

  /** Current terms format. */
  public static final int VERSION_CURRENT = VERSION_CHECKSUM;

  /** Extension of terms index file */
  static final String TERMS_INDEX_EXTENSION = "tip";
  final static String TERMS_INDEX_CODEC_NAME = "BLOCK_TREE_TERMS_INDEX";

  /** {@link InfoStream} component name. */
  static final String INFO_STREAM_COMPONENT = "BTTR";

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(BlockTreeTermsReader.class);

  // Open input to the main terms dict file (_X.tim)
  final IndexInput termsIn;

  // Reads the terms dict entries, to gather state to
  // produce DocsEnum on demand
  final PostingsReaderBase postingsReader;

  private final TreeMap<String,FieldReader> fields = new TreeMap<>();

  final String segment;

  final int version;

  private final HeaderCodec headerCodec;

  private volatile boolean closed;

  /** Sole constructor. */
  public BlockTreeTermsReader(TermsSegmentState state, PostingsReaderBase postingsReader) throws IOException {
    boolean success = false;
    IndexInput indexIn = null;

    this.postingsReader = postingsReader;
    this.segment = state.segmentName;

    termsIn = state.directory.openInput(state.fileName(TERMS_EXTENSION), state.context);
    try {
      headerCodec = HeaderCodec.open(termsIn, TERMS_CODEC_NAME, state);
      version = headerCodec.getVersion();

      indexIn = state.directory.openInput(state.fileName(TERMS_INDEX_EXTENSION), state.context);
      final HeaderCodec indexHeaderCodec = HeaderCodec.open(indexIn, TERMS_INDEX_CODEC_NAME, state);
      if (indexHeaderCodec.getVersion() != version) {
        throw new CorruptIndexException("mixmatched version files: " + termsIn + "=" + version + "," + indexIn + "=" + indexHeaderCodec.getVersion(), indexIn);
      }

      // verify the whole index file, it is read entirely anyway
      headerCodec.verify(indexIn);

      // Have PostingsReader init itself
      postingsReader.init(termsIn);

      // detects truncation and flipped bytes before any block is decoded
      headerCodec.verify(termsIn);

      // Read per-field details
      final long termsTrailerFP = headerCodec.trailerPosition(termsIn);
      seekDir(termsIn);
      seekDir(indexIn);

      final int numFields = termsIn.readVInt();
      if (numFields < 0) {
        throw new CorruptIndexException("invalid numFields: " + numFields, termsIn);
      }

      for (int i = 0; i < numFields; ++i) {
        final int field = termsIn.readVInt();
        if (field < 0) {
          throw new CorruptIndexException("invalid field number: " + field, termsIn);
        }
        final long numTerms = termsIn.readVLong();
        if (numTerms <= 0) {
          throw new CorruptIndexException("Illegal numTerms for field number: " + field, termsIn);
        }
        final int numBytes = termsIn.readVInt();
        if (numBytes <= 0) {
          throw new CorruptIndexException("invalid rootCode for field number: " + field + ", numBytes=" + numBytes, termsIn);
        }
        final BytesRef rootCode = new BytesRef(new byte[numBytes]);
        termsIn.readBytes(rootCode.bytes, 0, numBytes);
        rootCode.length = numBytes;
        final FieldInfo fieldInfo = state.fieldInfos.fieldInfo(field);
        if (fieldInfo == null) {
          throw new CorruptIndexException("invalid field number: " + field, termsIn);
        }
        final long sumTotalTermFreq = fieldInfo.getIndexOptions() == IndexOptions.DOCS ? -1 : termsIn.readVLong();
        final long sumDocFreq = termsIn.readVLong();
        final int docCount = termsIn.readVInt();
        final int longsSize = headerCodec.hasMetadataArity() ? termsIn.readVInt() : 0;
        if (longsSize < 0) {
          throw new CorruptIndexException("invalid longsSize for field: " + fieldInfo.name + ", longsSize=" + longsSize, termsIn);
        }
        if (docCount < 0 || docCount > state.maxDoc) { // #docs with field must be <= #docs
          throw new CorruptIndexException("invalid docCount: " + docCount + " maxDoc: " + state.maxDoc, termsIn);
        }
        if (sumDocFreq < docCount) {  // #postings must be >= #docs with field
          throw new CorruptIndexException("invalid sumDocFreq: " + sumDocFreq + " docCount: " + docCount, termsIn);
        }
        if (sumTotalTermFreq != -1 && sumTotalTermFreq < sumDocFreq) { // #positions must be >= #postings
          throw new CorruptIndexException("invalid sumTotalTermFreq: " + sumTotalTermFreq + " sumDocFreq: " + sumDocFreq, termsIn);
        }
        final long indexStartFP = indexIn.readVLong();
        FieldReader previous = fields.put(fieldInfo.name,
                                          new FieldReader(this, fieldInfo, numTerms, rootCode, sumTotalTermFreq, sumDocFreq, docCount,
                                                          indexStartFP, longsSize, indexIn));
        if (previous != null) {
          throw new CorruptIndexException("duplicate field: " + fieldInfo.name, termsIn);
        }
      }
      if (termsIn.getFilePointer() != termsTrailerFP) {
        throw new CorruptIndexException("unread bytes after field directory: fp=" + termsIn.getFilePointer() + " vs trailer=" + termsTrailerFP, termsIn);
      }

      indexIn.close();

      if (state.infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
        state.infoStream.message(INFO_STREAM_COMPONENT, "seg=" + segment + " version=" + version + " fields=" + fields.size()
            + " termsBytes=" + termsIn.length());
      }
      success = true;
    } finally {
      if (!success) {
        // this.close() will close in:
        IOUtils.closeWhileHandlingException(indexIn, this);
      }
    }
  }

  /** Seek {@code input} to the directory offset. */
  private void seekDir(IndexInput input) throws IOException {
    final long dirOffset = headerCodec.readTrailer(input);
    if (dirOffset < 0 || dirOffset >= input.length()) {
      throw new CorruptIndexException("invalid directory offset: " + dirOffset, input);
    }
    input.seek(dirOffset);
  }

  @Override
  public void close() throws IOException {
    closed = true;
    try {
      IOUtils.close(termsIn, postingsReader);
    } finally {
      // Clear so refs to terms index is GCable even if
      // app hangs onto us:
      fields.clear();
    }
  }

  /** Sorted names of the fields that have terms. */
  public Collection<String> fields() {
    ensureOpen();
    return Collections.unmodifiableSet(fields.keySet());
  }

  /** Returns the {@link FieldReader} for {@code field}, or null if it has no terms. */
  public FieldReader terms(String field) throws IOException {
    ensureOpen();
    assert field != null;
    return fields.get(field);
  }

  /** Number of fields that have terms. */
  public int size() {
    ensureOpen();
    return fields.size();
  }

  @Override
  public long ramBytesUsed() {
    long sizeInBytes = BASE_RAM_BYTES_USED + postingsReader.ramBytesUsed();
    for(FieldReader reader : fields.values()) {
      sizeInBytes += reader.ramBytesUsed();
    }
    return sizeInBytes;
  }

  @Override
  public Collection<Accountable> getChildResources() {
    List<Accountable> resources = new ArrayList<>(Accountables.namedAccountables("field", fields));
    resources.add(Accountables.namedAccountable("delegate", postingsReader));
    return Collections.unmodifiableList(resources);
  }

  /** Verifies the checksum of the whole terms file and asks the postings reader to do the same. */
  public void checkIntegrity() throws IOException {
    ensureOpen();
    // term dictionary
    headerCodec.verify(termsIn);

    // postings
    postingsReader.checkIntegrity();
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("this terms reader is closed");
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(fields=" + fields.size() + ",delegate=" + postingsReader + ")";
  }
}
