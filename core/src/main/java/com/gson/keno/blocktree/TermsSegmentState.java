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

import java.util.Objects;

import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexFileNames;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.util.InfoStream;
import org.apache.lucene.util.StringHelper;

/**
 * Everything the terms dictionary needs to know about the segment it
 * reads or writes: where the files live, how they are named, which
 * fields exist and how many documents the segment holds.
 * <p>
 * The same instance is handed to {@link BlockTreeTermsWriter} and
 * {@link BlockTreeTermsReader}; the segment id and suffix are only
 * consumed by the {@link HeaderCodec} of the version being read or
 * written.
 *
 * @lucene.experimental
 */
public final class TermsSegmentState {

  /** {@link Directory} holding the terms and index files. */
  public final Directory directory;

  /** Segment name, the common prefix of both file names. */
  public final String segmentName;

  /** Optional suffix appended to the segment name, may be empty. */
  public final String segmentSuffix;

  /** Unique id of the segment, {@link StringHelper#ID_LENGTH} bytes. */
  public final byte[] segmentId;

  /** Number of documents in the segment. */
  public final int maxDoc;

  /** Fields that may appear in the terms dictionary. */
  public final FieldInfos fieldInfos;

  /** {@link IOContext} for opening and creating files. */
  public final IOContext context;

  /** Diagnostic output, {@link InfoStream#NO_OUTPUT} by default. */
  public final InfoStream infoStream;

  /** Creates a state with an empty suffix, the default context and no diagnostic output. */
  public TermsSegmentState(Directory directory, String segmentName, byte[] segmentId, int maxDoc, FieldInfos fieldInfos) {
    this(directory, segmentName, "", segmentId, maxDoc, fieldInfos, IOContext.DEFAULT, InfoStream.NO_OUTPUT);
  }

  /** Sole full constructor. */
  public TermsSegmentState(Directory directory, String segmentName, String segmentSuffix, byte[] segmentId,
                           int maxDoc, FieldInfos fieldInfos, IOContext context, InfoStream infoStream) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.segmentName = Objects.requireNonNull(segmentName, "segmentName");
    this.segmentSuffix = Objects.requireNonNull(segmentSuffix, "segmentSuffix");
    if (segmentId == null || segmentId.length != StringHelper.ID_LENGTH) {
      throw new IllegalArgumentException("segmentId must be " + StringHelper.ID_LENGTH + " bytes; got "
          + (segmentId == null ? "null" : segmentId.length + " bytes"));
    }
    if (maxDoc < 0) {
      throw new IllegalArgumentException("maxDoc must be >= 0; got " + maxDoc);
    }
    this.segmentId = segmentId.clone();
    this.maxDoc = maxDoc;
    this.fieldInfos = Objects.requireNonNull(fieldInfos, "fieldInfos");
    this.context = Objects.requireNonNull(context, "context");
    this.infoStream = Objects.requireNonNull(infoStream, "infoStream");
  }

  /** Returns a copy of this state that logs to the given {@link InfoStream}. */
  public TermsSegmentState withInfoStream(InfoStream infoStream) {
    return new TermsSegmentState(directory, segmentName, segmentSuffix, segmentId, maxDoc, fieldInfos, context, infoStream);
  }

  /** Full file name for the given extension, honoring the segment suffix. */
  public String fileName(String extension) {
    return IndexFileNames.segmentFileName(segmentName, segmentSuffix, extension);
  }
}
