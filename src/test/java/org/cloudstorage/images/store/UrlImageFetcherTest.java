package org.cloudstorage.images.store;

import com.google.common.io.ByteSource;
import org.apache.commons.io.FileUtils;
import org.cloudstorage.images.FetchException;
import org.cloudstorage.images.InvalidParameterException;
import org.cloudstorage.images.TestBase;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.File;
import java.nio.file.Files;

import static org.junit.Assert.assertArrayEquals;

@RunWith(JUnit4.class)
public class UrlImageFetcherTest extends TestBase {

    private File tempDir;

    @Before
    public void setUp() throws Exception {
        tempDir = Files.createTempDirectory("fetcher").toFile();
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(tempDir);
    }

    @Test
    public void testFetchFileUrl() throws Exception {
        byte[] png = pngBytes(gradient(10, 10));
        File file = new File(tempDir, "image.png");
        FileUtils.writeByteArrayToFile(file, png);

        ByteSource fetched = UrlImageFetcher.INSTANCE.fetch(file.toURI().toString());
        assertArrayEquals(png, fetched.read());
    }

    @Test(expected = FetchException.class)
    public void testMissingFile() {
        UrlImageFetcher.INSTANCE.fetch(new File(tempDir, "missing.png").toURI().toString());
    }

    @Test(expected = FetchException.class)
    public void testMalformedUrl() {
        UrlImageFetcher.INSTANCE.fetch("nope://what");
    }

    @Test(expected = InvalidParameterException.class)
    public void testBlankUrl() {
        UrlImageFetcher.INSTANCE.fetch(" ");
    }
}
