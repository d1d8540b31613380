package com.gson.keno.blocktree;

import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.BytesRef;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.List;

import static com.gson.keno.blocktree.BlockTreeTestHelper.fieldInfo;
import static com.gson.keno.blocktree.BlockTreeTestHelper.fieldInfos;
import static com.gson.keno.blocktree.BlockTreeTestHelper.segmentState;
import static com.gson.keno.blocktree.BlockTreeTestHelper.terms;
import static com.gson.keno.blocktree.BlockTreeTestHelper.writeField;

public class BlockTreeTermsWriterTest {

    @Test
    public void testEncodeOutput() {
        Assert.assertEquals(0, BlockTreeTermsWriter.encodeOutput(0, false, false));
        Assert.assertEquals(BlockTreeTermsReader.OUTPUT_FLAG_HAS_TERMS, BlockTreeTermsWriter.encodeOutput(0, true, false));
        Assert.assertEquals(BlockTreeTermsReader.OUTPUT_FLAG_IS_FLOOR, BlockTreeTermsWriter.encodeOutput(0, false, true));
        // file pointer goes above the two flag bits
        long code = BlockTreeTermsWriter.encodeOutput(1234, true, true);
        Assert.assertEquals(1234, code >>> BlockTreeTermsReader.OUTPUT_FLAGS_NUM_BITS);
        Assert.assertEquals(BlockTreeTermsReader.OUTPUT_FLAGS_MASK, code & BlockTreeTermsReader.OUTPUT_FLAGS_MASK);
    }

    @Test
    public void testValidateSettings() {
        BlockTreeTermsWriter.validateSettings(BlockTreeTermsWriter.DEFAULT_MIN_BLOCK_SIZE, BlockTreeTermsWriter.DEFAULT_MAX_BLOCK_SIZE);
        BlockTreeTermsWriter.validateSettings(2, 2);
        BlockTreeTermsWriter.validateSettings(2, 4);

        Assert.assertThrows(IllegalArgumentException.class, () -> BlockTreeTermsWriter.validateSettings(1, 10));
        Assert.assertThrows(IllegalArgumentException.class, () -> BlockTreeTermsWriter.validateSettings(10, 9));
        // max must be at least 2*(min-1)
        Assert.assertThrows(IllegalArgumentException.class, () -> BlockTreeTermsWriter.validateSettings(10, 17));
        BlockTreeTermsWriter.validateSettings(10, 18);
    }

    @Test
    public void testInvalidSettingsCreateNoFiles() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfos infos = fieldInfos(fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS));
            Assert.assertThrows(IllegalArgumentException.class,
                    () -> new BlockTreeTermsWriter(segmentState(dir, infos), new MockPostingsWriter(true), 5, 6));
            Assert.assertEquals(0, dir.listAll().length);
        }
    }

    @Test
    public void testFloorBlocks() throws IOException {
        // 7 terms under prefix "a" with at most 4 entries per block
        List<BytesRef> terms = terms("aa", "ab", "ac", "ad", "ae", "af", "ag");
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            FieldInfos infos = fieldInfos(body);
            try (BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, infos), new MockPostingsWriter(true), 2, 4)) {
                writeField(writer, body, terms);
            }

            try (BlockTreeTermsReader reader = new BlockTreeTermsReader(segmentState(dir, infos), new MockPostingsReader())) {
                FieldReader field = reader.terms("body");
                Assert.assertEquals(7, field.size());

                Stats stats = field.computeStats();
                Assert.assertEquals(7, stats.totalTermCount);
                Assert.assertEquals(14, stats.totalTermBytes);
                // root block plus "a" split into {aa,ab} {ac,ad} {ae,af,ag}
                Assert.assertEquals(4, stats.totalBlockCount);
                Assert.assertEquals(1, stats.nonFloorBlockCount);
                Assert.assertEquals(1, stats.floorBlockCount);
                Assert.assertEquals(3, stats.floorSubBlockCount);
                Assert.assertEquals(3, stats.termsOnlyBlockCount);
                Assert.assertEquals(1, stats.subBlocksOnlyBlockCount);
                Assert.assertEquals(0, stats.mixedBlockCount);
                Assert.assertEquals(1, stats.blockCountByPrefixLen[0]);
                Assert.assertEquals(3, stats.blockCountByPrefixLen[1]);

                TermCursor cursor = field.iterator();
                for (int ord = 0; ord < terms.size(); ord++) {
                    Assert.assertEquals(terms.get(ord), cursor.next());
                    Assert.assertEquals(BlockTreeTestHelper.docFreq(ord), cursor.docFreq());
                }
                Assert.assertNull(cursor.next());
            }
        }
    }

    @Test
    public void testEmptyFieldIsOmitted() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            FieldInfo title = fieldInfo("title", 1, IndexOptions.DOCS);
            FieldInfos infos = fieldInfos(body, title);
            try (BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, infos), new MockPostingsWriter(true), 25, 48)) {
                writeField(writer, title, terms());
                writeField(writer, body, terms("hello", "world"));
            }
            try (BlockTreeTermsReader reader = new BlockTreeTermsReader(segmentState(dir, infos), new MockPostingsReader())) {
                Assert.assertEquals(1, reader.size());
                Assert.assertNull(reader.terms("title"));
                Assert.assertNotNull(reader.terms("body"));
            }
        }
    }

    @Test
    public void testTermOrderIsEnforced() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            try (BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, fieldInfos(body)), new MockPostingsWriter(true), 25, 48)) {
                BlockTreeTermsWriter.TermsWriter termsWriter = writer.addField(body);
                termsWriter.startTerm(new BytesRef("b"));
                termsWriter.finishTerm(new BytesRef("b"), new TermStats(1, 1));

                termsWriter.startTerm(new BytesRef("a"));
                Assert.assertThrows(IllegalArgumentException.class,
                        () -> termsWriter.finishTerm(new BytesRef("a"), new TermStats(1, 1)));
                // duplicates are out of order too
                Assert.assertThrows(IllegalArgumentException.class,
                        () -> termsWriter.finishTerm(new BytesRef("b"), new TermStats(1, 1)));

                termsWriter.startTerm(new BytesRef("c"));
                termsWriter.finishTerm(new BytesRef("c"), new TermStats(1, 1));
                termsWriter.finish(2, 2, 1);
            }
        }
    }

    @Test
    public void testTermStatsAreValidated() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            FieldInfo id = fieldInfo("id", 1, IndexOptions.DOCS);
            try (BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, fieldInfos(body, id)), new MockPostingsWriter(true), 25, 48)) {
                BlockTreeTermsWriter.TermsWriter bodyWriter = writer.addField(body);
                BytesRef term = new BytesRef("foo");
                Assert.assertThrows(IllegalArgumentException.class, () -> bodyWriter.finishTerm(term, new TermStats(0, 0)));
                Assert.assertThrows(IllegalArgumentException.class, () -> bodyWriter.finishTerm(term, new TermStats(3, 2)));
                bodyWriter.finishTerm(term, new TermStats(3, 3));
                bodyWriter.finish(3, 3, 3);

                BlockTreeTermsWriter.TermsWriter idWriter = writer.addField(id);
                // a field without frequencies only takes -1
                Assert.assertThrows(IllegalArgumentException.class, () -> idWriter.finishTerm(term, new TermStats(1, 1)));
                idWriter.finishTerm(term, new TermStats(1, -1));
                idWriter.finish(-1, 1, 1);
            }
        }
    }

    @Test
    public void testAggregatesMustMatchTerms() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            FieldInfo title = fieldInfo("title", 1, IndexOptions.DOCS_AND_FREQS);
            FieldInfo id = fieldInfo("id", 2, IndexOptions.DOCS_AND_FREQS);
            try (BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, fieldInfos(body, title, id)), new MockPostingsWriter(true), 25, 48)) {
                BlockTreeTermsWriter.TermsWriter bodyWriter = writer.addField(body);
                bodyWriter.finishTerm(new BytesRef("a"), new TermStats(2, 5));
                Assert.assertThrows(IllegalArgumentException.class, () -> bodyWriter.finish(5, 3, 2));

                BlockTreeTermsWriter.TermsWriter titleWriter = writer.addField(title);
                titleWriter.finishTerm(new BytesRef("a"), new TermStats(2, 5));
                Assert.assertThrows(IllegalArgumentException.class, () -> titleWriter.finish(4, 2, 2));

                BlockTreeTermsWriter.TermsWriter idWriter = writer.addField(id);
                idWriter.finishTerm(new BytesRef("a"), new TermStats(2, 5));
                // more documents than the segment holds
                Assert.assertThrows(IllegalArgumentException.class, () -> idWriter.finish(5, 2, BlockTreeTestHelper.MAX_DOC + 1));
            }
        }
    }

    @Test
    public void testFinishRetriedAfterAggregateMismatch() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            FieldInfos infos = fieldInfos(body);
            try (BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, infos), new MockPostingsWriter(true), 25, 48)) {
                BlockTreeTermsWriter.TermsWriter bodyWriter = writer.addField(body);
                bodyWriter.finishTerm(new BytesRef("a"), new TermStats(2, 5));
                bodyWriter.finishTerm(new BytesRef("b"), new TermStats(1, 1));
                Assert.assertThrows(IllegalArgumentException.class, () -> bodyWriter.finish(6, 4, 2));
                // a rejected finish leaves the field open
                bodyWriter.finish(6, 3, 2);
                Assert.assertThrows(IllegalStateException.class, () -> bodyWriter.finish(6, 3, 2));
            }

            try (BlockTreeTermsReader reader = new BlockTreeTermsReader(segmentState(dir, infos), new MockPostingsReader())) {
                FieldReader field = reader.terms("body");
                Assert.assertEquals(2, field.size());
                Assert.assertEquals(3, field.getSumDocFreq());
                Assert.assertEquals(2, field.getDocCount());
            }
        }
    }

    @Test
    public void testFieldLifecycle() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            FieldInfo unknown = fieldInfo("unknown", 7, IndexOptions.DOCS_AND_FREQS);
            FieldInfo notIndexed = fieldInfo("stored", 1, IndexOptions.NONE);
            BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, fieldInfos(body, notIndexed)), new MockPostingsWriter(true), 25, 48);

            Assert.assertThrows(IllegalArgumentException.class, () -> writer.addField(unknown));
            Assert.assertThrows(IllegalArgumentException.class, () -> writer.addField(notIndexed));

            BlockTreeTermsWriter.TermsWriter termsWriter = writer.addField(body);
            Assert.assertThrows(IllegalArgumentException.class, () -> writer.addField(body));
            termsWriter.finishTerm(new BytesRef("x"), new TermStats(1, 1));
            termsWriter.finish(1, 1, 1);
            Assert.assertThrows(IllegalStateException.class,
                    () -> termsWriter.finishTerm(new BytesRef("y"), new TermStats(1, 1)));

            writer.close();
            // closing twice is a no-op
            writer.close();
            Assert.assertThrows(IllegalStateException.class, () -> writer.addField(body));
        }
    }

    @Test
    public void testCloseClosesPostingsWriter() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            MockPostingsWriter postingsWriter = new MockPostingsWriter(true);
            new BlockTreeTermsWriter(segmentState(dir, fieldInfos(body)), postingsWriter, 25, 48).close();
            Assert.assertTrue(postingsWriter.closed);
        }
    }
}
