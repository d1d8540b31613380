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

import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;

/**
 * Header and trailer policy of one on-disk version of the terms
 * dictionary and terms index files.
 * <p>
 * Both files start with a {@link CodecUtil#writeHeader codec header}
 * carrying the version; {@link #open} reads it and picks the matching
 * policy, which then decides what follows the common header, how the
 * offset of the trailing directory is stored, and whether the file can
 * be checksummed.
 *
 * @lucene.experimental
 */
public abstract class HeaderCodec {

  /** Returns the policy for the given on-disk version. */
  public static HeaderCodec forVersion(int version) {
    switch (version) {
      case BlockTreeTermsReader.VERSION_APPEND_ONLY:
      case BlockTreeTermsReader.VERSION_META_ARRAY:
        return new AppendOnlyHeaderCodec(version);
      case BlockTreeTermsReader.VERSION_CHECKSUM:
        return new ChecksumHeaderCodec();
      default:
        throw new IllegalArgumentException("unsupported terms dictionary version: " + version);
    }
  }

  /**
   * Checks the common codec header of {@code in}, then the
   * version specific remainder, and returns the policy to keep reading
   * the file with.
   */
  public static HeaderCodec open(IndexInput in, String codecName, TermsSegmentState state) throws IOException {
    final int version = CodecUtil.checkHeader(in, codecName,
        BlockTreeTermsReader.VERSION_START, BlockTreeTermsReader.VERSION_CURRENT);
    final HeaderCodec codec = forVersion(version);
    codec.checkHeaderSuffix(in, state);
    return codec;
  }

  private final int version;

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected HeaderCodec(int version) {
    this.version = version;
  }

  /** Version this policy reads and writes. */
  public final int getVersion() {
    return version;
  }

  /** Whether the field directory records the postings metadata arity. */
  public boolean hasMetadataArity() {
    return version >= BlockTreeTermsReader.VERSION_META_ARRAY;
  }

  /** Writes the full header of a new file. */
  public abstract void writeHeader(IndexOutput out, String codecName, TermsSegmentState state) throws IOException;

  /** Reads whatever this version stores after the common codec header. */
  protected abstract void checkHeaderSuffix(IndexInput in, TermsSegmentState state) throws IOException;

  /** Writes the offset of the trailing directory and closes the file's content. */
  public abstract void writeTrailer(IndexOutput out, long dirStart) throws IOException;

  /** File position at which the directory offset was written. */
  public abstract long trailerPosition(IndexInput in) throws IOException;

  /** Reads the directory offset written by {@link #writeTrailer}; the trailer must lie past the current position. */
  public final long readTrailer(IndexInput in) throws IOException {
    final long trailerFP = trailerPosition(in);
    if (trailerFP < in.getFilePointer()) {
      throw new CorruptIndexException("file too short to hold a trailer: length=" + in.length() + " headerEnd=" + in.getFilePointer(), in);
    }
    in.seek(trailerFP);
    return in.readLong();
  }

  /** Verifies the integrity of the whole file, when this version allows it. */
  public abstract void verify(IndexInput in) throws IOException;

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(version=" + version + ")";
  }
}
