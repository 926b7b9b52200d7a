package org.cloudstorage.images.metadata;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteSource;
import org.cloudstorage.images.TestBase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class MetadataExtractorTest extends TestBase {

    private final MetadataExtractor extractor = new MetadataExtractor();

    @Test
    public void testReadsOrientation() throws Exception {
        for (int orientation = 1; orientation <= 8; orientation++) {
            byte[] jpeg = orientedJpeg(quadrants(40, 20), orientation);
            MetadataTags tags = extractor.readTags(ByteSource.wrap(jpeg));
            dumpTags(tags);
            assertTrue(tags.contains(MetadataTags.ORIENTATION));
            assertEquals(orientation, tags.getOrientation().getAsInt());
        }
    }

    @Test
    public void testNoExif() throws Exception {
        MetadataTags tags = extractor.readTags(ByteSource.wrap(pngBytes(gradient(8, 8))));
        assertFalse(tags.getOrientation().isPresent());
    }

    @Test
    public void testUnreadableMetadataIsEmpty() {
        MetadataTags tags = extractor.readTags(ByteSource.wrap("not an image".getBytes(StandardCharsets.UTF_8)));
        assertTrue(tags.isEmpty());
    }

    @Test
    public void testDetectContentType() throws Exception {
        assertEquals("image/png", extractor.detectContentType(ByteSource.wrap(pngBytes(gradient(8, 8))), null));
        assertEquals("image/jpeg", extractor.detectContentType(ByteSource.wrap(jpegBytes(gradient(8, 8))), "photo.jpg"));

        String text = extractor.detectContentType(ByteSource.wrap("hello world".getBytes(StandardCharsets.UTF_8)), "hello.txt");
        assertFalse(extractor.isImageContentType(text));
        assertTrue(extractor.isImageContentType("image/png"));
        assertFalse(extractor.isImageContentType(null));
    }

    @Test
    public void testTagKeysAreLowerCase() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("Orientation", 6);
        raw.put("Make", "Canon");
        raw.put("Model", null);
        MetadataTags tags = MetadataTags.of(raw);

        assertEquals(6, tags.getOrientation().getAsInt());
        assertEquals("Canon", tags.get("make"));
        assertEquals("Canon", tags.get("MAKE"));
        assertFalse(tags.contains("model"));
        assertEquals(ImmutableMap.of("orientation", 6, "make", "Canon"), tags.asMap());
    }

    @Test(expected = IllegalStateException.class)
    public void testNonNumericOrientation() {
        MetadataTags.of(ImmutableMap.of("Orientation", "sideways")).getOrientation();
    }

    private void dumpTags(MetadataTags tags) {
        for (Map.Entry<String, Object> entry : tags.asMap().entrySet()) {
            println("%s: %s", entry.getKey(), entry.getValue());
        }
    }
}
