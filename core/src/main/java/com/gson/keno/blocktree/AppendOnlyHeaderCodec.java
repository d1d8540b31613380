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
 * Legacy formats: a plain codec header and the directory offset in the
 * last 8 bytes of the file. There is no footer, so nothing to verify.
 */
final class AppendOnlyHeaderCodec extends HeaderCodec {

  AppendOnlyHeaderCodec(int version) {
    super(version);
    assert version < BlockTreeTermsReader.VERSION_CHECKSUM : "version=" + version;
  }

  @Override
  public void writeHeader(IndexOutput out, String codecName, TermsSegmentState state) throws IOException {
    CodecUtil.writeHeader(out, codecName, getVersion());
  }

  @Override
  protected void checkHeaderSuffix(IndexInput in, TermsSegmentState state) {
    // nothing after the codec header
  }

  @Override
  public void writeTrailer(IndexOutput out, long dirStart) throws IOException {
    out.writeLong(dirStart);
  }

  @Override
  public long trailerPosition(IndexInput in) throws IOException {
    return in.length() - Long.BYTES;
  }

  @Override
  public void verify(IndexInput in) {
    // no checksum before VERSION_CHECKSUM
  }
}
