package com.gson.keno.blocktree;

import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.InfoStream;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static com.gson.keno.blocktree.BlockTreeTestHelper.fieldInfo;
import static com.gson.keno.blocktree.BlockTreeTestHelper.fieldInfos;
import static com.gson.keno.blocktree.BlockTreeTestHelper.segmentState;
import static com.gson.keno.blocktree.BlockTreeTestHelper.terms;
import static com.gson.keno.blocktree.BlockTreeTestHelper.writeField;

public class BlockTreeTermsReaderTest {
    private static final String TERMS_FILE = "_0.tim";
    private static final String INDEX_FILE = "_0.tip";

    private Directory dir;
    private FieldInfo body;
    private FieldInfo id;
    private FieldInfo title;
    private FieldInfos infos;
    private final List<BytesRef> bodyTerms = new ArrayList<>();

    @Before
    public void setUp() {
        dir = new ByteBuffersDirectory();
        body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS_AND_POSITIONS);
        id = fieldInfo("id", 1, IndexOptions.DOCS);
        title = fieldInfo("title", 2, IndexOptions.DOCS_AND_FREQS);
        infos = fieldInfos(body, id, title);
        for (int i = 0; i < 200; i++) {
            bodyTerms.add(new BytesRef(String.format(Locale.ROOT, "w%04d", i * 3)));
        }
    }

    @After
    public void tearDown() throws IOException {
        dir.close();
    }

    private void writeSegment(BlockTreeTermsWriter writer) throws IOException {
        try {
            writeField(writer, title, terms("hello", "lucene", "world"));
            writeField(writer, body, bodyTerms);
            writeField(writer, id, terms("1", "2", "3", "4"));
        } finally {
            writer.close();
        }
    }

    private void writeSegment() throws IOException {
        writeSegment(new BlockTreeTermsWriter(segmentState(dir, infos), new MockPostingsWriter(true), 10, 20));
    }

    private BlockTreeTermsReader open() throws IOException {
        return new BlockTreeTermsReader(segmentState(dir, infos), new MockPostingsReader());
    }

    @Test
    public void testFieldSummaries() throws IOException {
        writeSegment();
        try (BlockTreeTermsReader reader = open()) {
            Assert.assertEquals(3, reader.size());
            Assert.assertEquals(Arrays.asList("body", "id", "title"), new ArrayList<>(reader.fields()));
            Assert.assertNull(reader.terms("missing"));
            Assert.assertEquals(BlockTreeTermsReader.VERSION_CURRENT, reader.version);

            FieldReader bodyReader = reader.terms("body");
            long sumDocFreq = 0;
            long sumTotalTermFreq = 0;
            for (int ord = 0; ord < bodyTerms.size(); ord++) {
                sumDocFreq += BlockTreeTestHelper.docFreq(ord);
                sumTotalTermFreq += BlockTreeTestHelper.totalTermFreq(ord, true);
            }
            Assert.assertEquals(bodyTerms.size(), bodyReader.size());
            Assert.assertEquals(sumDocFreq, bodyReader.getSumDocFreq());
            Assert.assertEquals(sumTotalTermFreq, bodyReader.getSumTotalTermFreq());
            Assert.assertEquals(BlockTreeTestHelper.DOC_COUNT, bodyReader.getDocCount());
            Assert.assertEquals(2, bodyReader.getMetadataArity());
            Assert.assertTrue(bodyReader.hasFreqs());
            Assert.assertTrue(bodyReader.hasPositions());
            Assert.assertSame(body, bodyReader.getFieldInfo());

            FieldReader idReader = reader.terms("id");
            Assert.assertEquals(4, idReader.size());
            Assert.assertEquals(-1, idReader.getSumTotalTermFreq());
            Assert.assertEquals(1, idReader.getMetadataArity());
            Assert.assertFalse(idReader.hasFreqs());
        }
    }

    @Test
    public void testRamBytesUsed() throws IOException {
        writeSegment();
        try (BlockTreeTermsReader reader = open()) {
            Assert.assertTrue(reader.ramBytesUsed() > 0);
            Assert.assertTrue(reader.terms("body").ramBytesUsed() > 0);
            // three fields plus the postings reader
            Assert.assertEquals(4, reader.getChildResources().size());
        }
    }

    @Test
    public void testCheckIntegrity() throws IOException {
        writeSegment();
        MockPostingsReader postingsReader = new MockPostingsReader();
        try (BlockTreeTermsReader reader = new BlockTreeTermsReader(segmentState(dir, infos), postingsReader)) {
            reader.checkIntegrity();
            Assert.assertEquals(1, postingsReader.checkIntegrityCalls);
        }
        Assert.assertTrue(postingsReader.closed);
    }

    @Test
    public void testClosedReader() throws IOException {
        writeSegment();
        BlockTreeTermsReader reader = open();
        reader.close();
        Assert.assertThrows(IllegalStateException.class, () -> reader.terms("body"));
        Assert.assertThrows(IllegalStateException.class, reader::fields);
        Assert.assertThrows(IllegalStateException.class, reader::size);
        Assert.assertThrows(IllegalStateException.class, reader::checkIntegrity);
    }

    @Test
    public void testFlippedByteInTermsFile() throws IOException {
        writeSegment();
        BlockTreeTestHelper.rewriteFile(dir, TERMS_FILE, bytes -> {
            bytes[bytes.length / 2] ^= 0x55;
            return bytes;
        });
        Assert.assertThrows(CorruptIndexException.class, this::open);
    }

    @Test
    public void testFlippedChecksumInIndexFile() throws IOException {
        writeSegment();
        BlockTreeTestHelper.rewriteFile(dir, INDEX_FILE, bytes -> {
            bytes[bytes.length - 1] ^= 0x01;
            return bytes;
        });
        Assert.assertThrows(CorruptIndexException.class, this::open);
    }

    @Test
    public void testFlippedByteInIndexFile() throws IOException {
        writeSegment();
        // lands in the directory offset, just before the footer
        BlockTreeTestHelper.rewriteFile(dir, INDEX_FILE, bytes -> {
            bytes[bytes.length - 20] ^= 0x55;
            return bytes;
        });
        Assert.assertThrows(CorruptIndexException.class, this::open);
    }

    @Test
    public void testTruncatedTermsFile() throws IOException {
        writeSegment();
        BlockTreeTestHelper.rewriteFile(dir, TERMS_FILE, bytes -> Arrays.copyOf(bytes, bytes.length - 5));
        Assert.assertThrows(CorruptIndexException.class, this::open);
    }

    @Test
    public void testWrongSegmentId() throws IOException {
        writeSegment();
        byte[] otherId = BlockTreeTestHelper.segmentId();
        otherId[0]++;
        TermsSegmentState other = new TermsSegmentState(dir, BlockTreeTestHelper.SEGMENT, otherId, BlockTreeTestHelper.MAX_DOC, infos);
        Assert.assertThrows(CorruptIndexException.class, () -> new BlockTreeTermsReader(other, new MockPostingsReader()));
    }

    @Test
    public void testSegmentSuffix() throws IOException {
        TermsSegmentState state = new TermsSegmentState(dir, BlockTreeTestHelper.SEGMENT, "Terms_0", BlockTreeTestHelper.segmentId(),
                BlockTreeTestHelper.MAX_DOC, infos, IOContext.DEFAULT, InfoStream.NO_OUTPUT);
        writeSegment(new BlockTreeTermsWriter(state, new MockPostingsWriter(true), 10, 20));
        Assert.assertTrue(Arrays.asList(dir.listAll()).contains("_0_Terms_0.tim"));
        try (BlockTreeTermsReader reader = new BlockTreeTermsReader(state, new MockPostingsReader())) {
            Assert.assertEquals(3, reader.size());
        }
    }

    @Test
    public void testAppendOnlyVersion() throws IOException {
        // this version has no room for metadata longs
        MockPostingsWriter postingsWriter = new MockPostingsWriter(false);
        writeSegment(new BlockTreeTermsWriter(segmentState(dir, infos), postingsWriter, 10, 20, BlockTreeTermsReader.VERSION_APPEND_ONLY));
        try (BlockTreeTermsReader reader = open()) {
            Assert.assertEquals(BlockTreeTermsReader.VERSION_APPEND_ONLY, reader.version);
            assertAllTerms(reader.terms("body"), postingsWriter.finishedStates("body"));
            reader.checkIntegrity();
        }
    }

    @Test
    public void testAppendOnlyVersionRejectsMetadataLongs() throws IOException {
        try (BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, infos), new MockPostingsWriter(true), 10, 20,
                BlockTreeTermsReader.VERSION_APPEND_ONLY)) {
            Assert.assertThrows(IllegalArgumentException.class, () -> writer.addField(body));
        }
    }

    @Test
    public void testMetaArrayVersion() throws IOException {
        MockPostingsWriter postingsWriter = new MockPostingsWriter(true);
        writeSegment(new BlockTreeTermsWriter(segmentState(dir, infos), postingsWriter, 10, 20, BlockTreeTermsReader.VERSION_META_ARRAY));
        try (BlockTreeTermsReader reader = open()) {
            Assert.assertEquals(BlockTreeTermsReader.VERSION_META_ARRAY, reader.version);
            Assert.assertEquals(2, reader.terms("body").getMetadataArity());
            assertAllTerms(reader.terms("body"), postingsWriter.finishedStates("body"));
        }
    }

    @Test
    public void testCurrentVersionWithoutMetadataLongs() throws IOException {
        MockPostingsWriter postingsWriter = new MockPostingsWriter(false);
        writeSegment(new BlockTreeTermsWriter(segmentState(dir, infos), postingsWriter, 10, 20));
        try (BlockTreeTermsReader reader = open()) {
            Assert.assertEquals(0, reader.terms("body").getMetadataArity());
            assertAllTerms(reader.terms("body"), postingsWriter.finishedStates("body"));
        }
    }

    @Test
    public void testInfoStream() throws IOException {
        CollectingInfoStream infoStream = new CollectingInfoStream();
        TermsSegmentState state = segmentState(dir, infos).withInfoStream(infoStream);
        writeSegment(new BlockTreeTermsWriter(state, new MockPostingsWriter(true), 10, 20));
        new BlockTreeTermsReader(state, new MockPostingsReader()).close();

        Assert.assertTrue(infoStream.messages.stream().anyMatch(m -> m.startsWith("BTTW: seg=_0 field=body numTerms=200")));
        Assert.assertTrue(infoStream.messages.stream().anyMatch(m -> m.startsWith("BTTW: seg=_0 version=3 fields=3")));
        Assert.assertTrue(infoStream.messages.stream().anyMatch(m -> m.startsWith("BTTR: seg=_0 version=3 fields=3")));
    }

    private static void assertAllTerms(FieldReader field, List<MockTermState> expected) throws IOException {
        TermCursor cursor = field.iterator();
        for (MockTermState state : expected) {
            Assert.assertNotNull(cursor.next());
            MockTermState actual = (MockTermState) cursor.termState();
            Assert.assertEquals(state.docFreq, actual.docFreq);
            Assert.assertEquals(state.totalTermFreq, actual.totalTermFreq);
            Assert.assertEquals(state.docStartFP, actual.docStartFP);
            Assert.assertEquals(state.posStartFP, actual.posStartFP);
            Assert.assertEquals(state.singletonDocID, actual.singletonDocID);
        }
        Assert.assertNull(cursor.next());
    }

    private static class CollectingInfoStream extends InfoStream {
        final List<String> messages = new ArrayList<>();

        @Override
        public void message(String component, String message) {
            messages.add(component + ": " + message);
        }

        @Override
        public boolean isEnabled(String component) {
            return true;
        }

        @Override
        public void close() {
        }
    }
}
