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
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;

/**
 * Current format: an index header bound to the segment id and suffix,
 * and a checksummed footer after the directory offset.
 */
final class ChecksumHeaderCodec extends HeaderCodec {

  ChecksumHeaderCodec() {
    super(BlockTreeTermsReader.VERSION_CHECKSUM);
  }

  @Override
  public void writeHeader(IndexOutput out, String codecName, TermsSegmentState state) throws IOException {
    CodecUtil.writeIndexHeader(out, codecName, getVersion(), state.segmentId, state.segmentSuffix);
  }

  @Override
  protected void checkHeaderSuffix(IndexInput in, TermsSegmentState state) throws IOException {
    CodecUtil.checkIndexHeaderID(in, state.segmentId);
    CodecUtil.checkIndexHeaderSuffix(in, state.segmentSuffix);
  }

  @Override
  public void writeTrailer(IndexOutput out, long dirStart) throws IOException {
    out.writeLong(dirStart);
    CodecUtil.writeFooter(out);
  }

  @Override
  public long trailerPosition(IndexInput in) throws IOException {
    return in.length() - CodecUtil.footerLength() - Long.BYTES;
  }

  @Override
  public void verify(IndexInput in) throws IOException {
    CodecUtil.checksumEntireFile(in);
  }
}
