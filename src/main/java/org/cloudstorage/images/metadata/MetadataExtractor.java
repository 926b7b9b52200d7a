package org.cloudstorage.images.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.google.common.io.ByteSource;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.apache.tika.parser.AutoDetectParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects the content type of source bytes and extracts their EXIF tags.
 * <p>
 * Only the primary image directory and the EXIF sub-directory are read; thumbnail and maker-note
 * directories are skipped so that their orientation tags never shadow the image's own.
 */
public class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private static final Pattern IMAGE_CONTENT_TYPE = Pattern.compile("^image/(.*)$");

    /**
     * Reads the EXIF tags of an encoded image. A missing or unreadable metadata block yields an empty map.
     * @param byteSource The encoded image
     * @return the tags keyed by lower-cased tag name
     */
    public MetadataTags readTags(ByteSource byteSource) {
        Metadata metadata;
        try (InputStream bis = byteSource.openBufferedStream()) {
            metadata = ImageMetadataReader.readMetadata(bis);
            // Consume the stream to allow eg HTTP sources to reuse underlying connections
            IOUtils.consume(bis);
        } catch (ImageProcessingException | IOException e) {
            log.debug("No readable metadata in source image: {}", e.getMessage());
            return MetadataTags.empty();
        }

        Map<String, Object> tags = new LinkedHashMap<>();
        for (Directory directory : metadata.getDirectories()) {
            if (!(directory instanceof ExifIFD0Directory) && !(directory instanceof ExifSubIFDDirectory)) {
                continue;
            }
            for (Tag tag : directory.getTags()) {
                if (!tag.hasTagName()) {
                    continue;
                }
                Object value = directory.getObject(tag.getTagType());
                if (value != null) {
                    tags.putIfAbsent(tag.getTagName().toLowerCase(Locale.ROOT), value);
                }
            }
        }
        log.trace("Extracted {} exif tags", tags.size());
        return MetadataTags.of(tags);
    }

    /**
     * @param byteSource The encoded bytes
     * @param filename An optional file name hint, may be null
     * @return the detected media type, or null if detection failed
     */
    public String detectContentType(ByteSource byteSource, String filename) {
        try (InputStream bis = byteSource.openBufferedStream()) {
            String result = detectContentTypeInternal(bis, filename);
            IOUtils.consume(bis);
            return result;
        } catch (IOException ex) {
            log.error("Exception occurred detecting content type", ex);
        }
        return null;
    }

    public boolean isImageContentType(String contentType) {
        return StringUtils.isNotEmpty(contentType) && IMAGE_CONTENT_TYPE.matcher(contentType).matches();
    }

    private String detectContentTypeInternal(InputStream inputStream, String filename) throws IOException {
        AutoDetectParser parser = new AutoDetectParser();
        Detector detector = parser.getDetector();

        org.apache.tika.metadata.Metadata md = new org.apache.tika.metadata.Metadata();
        if (filename != null) {
            md.add(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        }
        MediaType mediaType = detector.detect(inputStream, md);
        return mediaType.getBaseType().toString();
    }
}
