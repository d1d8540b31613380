package com.gson.keno.blocktree;

import org.apache.lucene.codecs.BlockTermState;
import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.IndexOutput;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Postings writer that stores no postings at all. Every finished term gets
 * made-up, strictly increasing doc and position file pointers, so the terms
 * dictionary has real metadata to delta-encode and hand back.
 * <p>
 * With {@code useLongs} the pointers travel in the metadata longs,
 * otherwise they are written as vLongs into the metadata bytes (the only
 * option for dictionaries that cannot record a metadata arity).
 */
class MockPostingsWriter extends PostingsWriterBase {
    static final String CODEC_NAME = "MOCK_POSTINGS";
    static final int VERSION = 0;

    private final boolean useLongs;
    private final Map<String, List<MockTermState>> finished = new HashMap<>();

    private FieldInfo fieldInfo;
    private int longsSize;
    private boolean hasPositions;
    private long docFP;
    private long posFP;
    private MockTermState lastState = new MockTermState();
    boolean closed;

    MockPostingsWriter(boolean useLongs) {
        this.useLongs = useLongs;
    }

    /** States of the finished terms of {@code field}, in the order they were added. */
    List<MockTermState> finishedStates(String field) {
        return finished.getOrDefault(field, new ArrayList<>());
    }

    @Override
    public void init(IndexOutput termsOut) throws IOException {
        CodecUtil.writeHeader(termsOut, CODEC_NAME, VERSION);
    }

    @Override
    public BlockTermState newTermState() {
        return new MockTermState();
    }

    @Override
    public void startTerm() {
    }

    @Override
    public void finishTerm(BlockTermState state) {
        MockTermState termState = (MockTermState) state;
        termState.docStartFP = docFP;
        docFP += 7 + termState.docFreq;
        if (hasPositions) {
            termState.posStartFP = posFP;
            posFP += termState.totalTermFreq;
        }
        termState.singletonDocID = termState.docFreq == 1 ? (int) (docFP % 1000) : -1;
        finished.computeIfAbsent(fieldInfo.name, k -> new ArrayList<>()).add(termState.clone());
    }

    @Override
    public int setField(FieldInfo fieldInfo) {
        this.fieldInfo = fieldInfo;
        this.hasPositions = fieldInfo.getIndexOptions().compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
        this.longsSize = useLongs ? (hasPositions ? 2 : 1) : 0;
        this.lastState = new MockTermState();
        return longsSize;
    }

    @Override
    public void encodeTerm(long[] longs, DataOutput out, FieldInfo fieldInfo, BlockTermState state, boolean absolute) throws IOException {
        MockTermState termState = (MockTermState) state;
        if (absolute) {
            lastState = new MockTermState();
        }
        long docDelta = termState.docStartFP - lastState.docStartFP;
        long posDelta = termState.posStartFP - lastState.posStartFP;
        if (useLongs) {
            longs[0] = docDelta;
            if (longsSize > 1) {
                longs[1] = posDelta;
            }
        } else {
            out.writeVLong(docDelta);
            if (hasPositions) {
                out.writeVLong(posDelta);
            }
        }
        if (termState.docFreq == 1) {
            out.writeVInt(termState.singletonDocID);
        }
        lastState = termState;
    }

    @Override
    public void close() {
        closed = true;
    }
}
