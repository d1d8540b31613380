package com.gson.keno.blocktree;

import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.fst.Util;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;

import static com.gson.keno.blocktree.BlockTreeTestHelper.fieldInfo;
import static com.gson.keno.blocktree.BlockTreeTestHelper.fieldInfos;
import static com.gson.keno.blocktree.BlockTreeTestHelper.segmentState;
import static com.gson.keno.blocktree.BlockTreeTestHelper.terms;
import static com.gson.keno.blocktree.BlockTreeTestHelper.writeField;

/**
 * Looks at the prefix index directly: which prefixes have an entry and
 * what their block codes hold.
 */
public class TermsIndexTest {

    @Test
    public void testFloorBlockCode() throws IOException {
        try (Directory dir = new ByteBuffersDirectory()) {
            FieldInfo body = fieldInfo("body", 0, IndexOptions.DOCS_AND_FREQS);
            FieldInfos infos = fieldInfos(body);
            try (BlockTreeTermsWriter writer = new BlockTreeTermsWriter(segmentState(dir, infos), new MockPostingsWriter(true), 2, 4)) {
                writeField(writer, body, terms("aa", "ab", "ac", "ad", "ae", "af", "ag"));
            }

            try (BlockTreeTermsReader reader = new BlockTreeTermsReader(segmentState(dir, infos), new MockPostingsReader())) {
                FieldReader field = reader.terms("body");

                BytesRef root = Util.get(field.index, new BytesRef());
                Assert.assertEquals(field.rootCode, root);
                ByteArrayDataInput rootIn = new ByteArrayDataInput(root.bytes, root.offset, root.length);
                long rootCode = rootIn.readVLong();
                // the root only points at the "a" block
                Assert.assertEquals(0, rootCode & BlockTreeTermsReader.OUTPUT_FLAGS_MASK);
                Assert.assertEquals(field.rootBlockFP, rootCode >>> BlockTreeTermsReader.OUTPUT_FLAGS_NUM_BITS);

                BytesRef output = Util.get(field.index, new BytesRef("a"));
                Assert.assertNotNull(output);
                ByteArrayDataInput in = new ByteArrayDataInput(output.bytes, output.offset, output.length);
                long code = in.readVLong();
                Assert.assertEquals(BlockTreeTermsReader.OUTPUT_FLAG_HAS_TERMS | BlockTreeTermsReader.OUTPUT_FLAG_IS_FLOOR,
                        code & BlockTreeTermsReader.OUTPUT_FLAGS_MASK);
                long fp = code >>> BlockTreeTermsReader.OUTPUT_FLAGS_NUM_BITS;
                Assert.assertTrue(fp < field.rootBlockFP);

                Assert.assertEquals(2, in.readVInt());
                Assert.assertEquals('c', in.readByte());
                long first = in.readVLong();
                Assert.assertEquals(1, first & 1);
                Assert.assertEquals('e', in.readByte());
                long second = in.readVLong();
                Assert.assertEquals(1, second & 1);
                Assert.assertTrue((second >>> 1) > (first >>> 1));
                Assert.assertTrue(in.eof());

                Assert.assertNull(Util.get(field.index, new BytesRef("aa")));
                Assert.assertNull(Util.get(field.index, new BytesRef("b")));
            }
        }
    }
}
