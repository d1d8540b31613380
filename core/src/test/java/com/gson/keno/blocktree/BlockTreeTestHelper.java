package com.gson.keno.blocktree;

import org.apache.lucene.index.DocValuesType;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.util.BytesRef;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Shared fixtures: field metadata, segment state, and a writer loop with
 * stats derived from each term's ordinal.
 */
final class BlockTreeTestHelper {
    static final String SEGMENT = "_0";
    static final int MAX_DOC = 100;
    static final int DOC_COUNT = 3;

    private BlockTreeTestHelper() {
    }

    static byte[] segmentId() {
        byte[] id = new byte[16];
        for (int i = 0; i < id.length; i++) {
            id[i] = (byte) (i * 7 + 1);
        }
        return id;
    }

    static FieldInfo fieldInfo(String name, int number, IndexOptions indexOptions) {
        return new FieldInfo(name, number, false, false, false, indexOptions, DocValuesType.NONE,
                -1, new HashMap<>(), 0, 0, 0, false);
    }

    static FieldInfos fieldInfos(FieldInfo... infos) {
        return new FieldInfos(infos);
    }

    static TermsSegmentState segmentState(Directory dir, FieldInfos fieldInfos) {
        return new TermsSegmentState(dir, SEGMENT, segmentId(), MAX_DOC, fieldInfos);
    }

    static int docFreq(int ord) {
        return 1 + ord % 3;
    }

    static long totalTermFreq(int ord, boolean hasFreqs) {
        return hasFreqs ? docFreq(ord) + ord % 5 : -1;
    }

    /** Adds {@code terms}, which must already be sorted, and finishes the field. */
    static void writeField(BlockTreeTermsWriter writer, FieldInfo fieldInfo, List<BytesRef> terms) throws IOException {
        boolean hasFreqs = fieldInfo.getIndexOptions() != IndexOptions.DOCS;
        BlockTreeTermsWriter.TermsWriter termsWriter = writer.addField(fieldInfo);
        long sumDocFreq = 0;
        long sumTotalTermFreq = 0;
        for (int ord = 0; ord < terms.size(); ord++) {
            BytesRef term = terms.get(ord);
            termsWriter.startTerm(term);
            termsWriter.finishTerm(term, new TermStats(docFreq(ord), totalTermFreq(ord, hasFreqs)));
            sumDocFreq += docFreq(ord);
            sumTotalTermFreq += totalTermFreq(ord, hasFreqs);
        }
        termsWriter.finish(hasFreqs ? sumTotalTermFreq : -1, sumDocFreq, terms.isEmpty() ? 0 : DOC_COUNT);
    }

    static List<BytesRef> terms(String... terms) {
        BytesRef[] refs = new BytesRef[terms.length];
        for (int i = 0; i < terms.length; i++) {
            refs[i] = new BytesRef(terms[i]);
        }
        return Arrays.asList(refs);
    }

    static byte[] readFile(Directory dir, String name) throws IOException {
        try (IndexInput in = dir.openInput(name, IOContext.DEFAULT)) {
            byte[] bytes = new byte[(int) in.length()];
            in.readBytes(bytes, 0, bytes.length);
            return bytes;
        }
    }

    /** Replaces the content of {@code name} with what {@code change} makes of it. */
    static void rewriteFile(Directory dir, String name, UnaryOperator<byte[]> change) throws IOException {
        byte[] bytes = change.apply(readFile(dir, name));
        dir.deleteFile(name);
        try (IndexOutput out = dir.createOutput(name, IOContext.DEFAULT)) {
            out.writeBytes(bytes, 0, bytes.length);
        }
    }
}
