package org.cloudstorage.images.store;

import com.google.common.io.ByteSink;
import com.google.common.io.ByteSource;
import com.google.common.io.MoreFiles;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.cloudstorage.images.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link ObjectStorage} on the local filesystem. Each bucket is a directory below the root, each object a file.
 * Content type, visibility and user metadata live in a {@code <key>.metadata.properties} file next to the object.
 */
public class LocalObjectStorage implements ObjectStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalObjectStorage.class);

    static final String METADATA_SUFFIX = ".metadata.properties";
    static final String CONTENT_TYPE_PROPERTY = "content-type";
    static final String PUBLIC_PROPERTY = "public";
    static final String USER_METADATA_PREFIX = "x-meta-";

    private final File rootDir;

    public LocalObjectStorage(File rootDir) {
        this.rootDir = rootDir;
    }

    @Override
    public LocalBucket getBucket(String name) throws IOException {
        if (StringUtils.isBlank(name) || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            throw new ValidationException("Invalid bucket name: " + name);
        }
        File dir = new File(rootDir, name);
        FileUtils.forceMkdir(dir);
        return new LocalBucket(name, dir.toPath().toAbsolutePath().normalize());
    }

    public static class LocalBucket implements StorageBucket {

        private final String name;
        private final Path dir;

        LocalBucket(String name, Path dir) {
            this.name = name;
            this.dir = dir;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void upload(String key, ByteSource content, String contentType, Map<String, String> metadata) throws IOException {
            Path path = resolve(key);
            FileUtils.forceMkdirParent(path.toFile());
            ByteSink sink = MoreFiles.asByteSink(path);
            long written = content.copyTo(sink);

            Properties properties = new Properties();
            properties.setProperty(CONTENT_TYPE_PROPERTY, Objects.toString(contentType, ""));
            properties.setProperty(PUBLIC_PROPERTY, Boolean.FALSE.toString());
            if (metadata != null) {
                metadata.forEach((k, v) -> properties.setProperty(USER_METADATA_PREFIX + k, v));
            }
            writeProperties(key, properties);
            log.debug("Wrote {} bytes to {}", written, path);
        }

        @Override
        public void makePublic(String key) throws IOException {
            Properties properties = readProperties(key);
            properties.setProperty(PUBLIC_PROPERTY, Boolean.TRUE.toString());
            writeProperties(key, properties);
        }

        @Override
        public String getPublicUrl(String key) {
            return resolve(key).toUri().toString();
        }

        public ByteSource getContent(String key) {
            return MoreFiles.asByteSource(resolve(key));
        }

        public boolean exists(String key) {
            return Files.isRegularFile(resolve(key));
        }

        public String getContentType(String key) throws IOException {
            return readProperties(key).getProperty(CONTENT_TYPE_PROPERTY);
        }

        public boolean isPublic(String key) throws IOException {
            return Boolean.parseBoolean(readProperties(key).getProperty(PUBLIC_PROPERTY));
        }

        public Map<String, String> getMetadata(String key) throws IOException {
            Map<String, String> result = new HashMap<>();
            Properties properties = readProperties(key);
            for (String property : properties.stringPropertyNames()) {
                if (property.startsWith(USER_METADATA_PREFIX)) {
                    result.put(property.substring(USER_METADATA_PREFIX.length()), properties.getProperty(property));
                }
            }
            return result;
        }

        private Path resolve(String key) {
            if (StringUtils.isBlank(key)) {
                throw new ValidationException("Invalid object key: " + key);
            }
            Path path = dir.resolve(key).normalize();
            if (!path.startsWith(dir) || path.equals(dir)) {
                throw new ValidationException("Object key escapes its bucket: " + key);
            }
            return path;
        }

        private Path metadataPath(String key) {
            Path path = resolve(key);
            return path.resolveSibling(path.getFileName() + METADATA_SUFFIX);
        }

        private Properties readProperties(String key) throws IOException {
            Properties properties = new Properties();
            try (InputStream is = MoreFiles.asByteSource(metadataPath(key)).openBufferedStream()) {
                properties.load(is);
            }
            return properties;
        }

        private void writeProperties(String key, Properties properties) throws IOException {
            try (OutputStream os = MoreFiles.asByteSink(metadataPath(key)).openBufferedStream()) {
                properties.store(os, null);
            }
        }
    }
}
