package org.cloudstorage.images;

import com.google.common.io.ByteSource;
import com.google.common.io.Files;
import org.apache.commons.lang3.StringUtils;
import org.cloudstorage.images.buffer.ImageBuffer;
import org.cloudstorage.images.buffer.Size;
import org.cloudstorage.images.codec.EncodeOptions;
import org.cloudstorage.images.codec.EncodedImage;
import org.cloudstorage.images.codec.ImageDecoder;
import org.cloudstorage.images.codec.ImageEncoder;
import org.cloudstorage.images.codec.ImageFormat;
import org.cloudstorage.images.metadata.MetadataExtractor;
import org.cloudstorage.images.metadata.MetadataTags;
import org.cloudstorage.images.store.ImageFetcher;
import org.cloudstorage.images.store.ObjectStorage;
import org.cloudstorage.images.store.StorageBucket;
import org.cloudstorage.images.store.StoreRequest;
import org.cloudstorage.images.store.StoredImage;
import org.cloudstorage.images.store.UrlImageFetcher;
import org.cloudstorage.images.transform.Cropper;
import org.cloudstorage.images.transform.ImageNormalizer;
import org.cloudstorage.images.transform.Orientation;
import org.cloudstorage.images.transform.OrientationCorrector;
import org.cloudstorage.images.transform.Resizer;
import org.cloudstorage.images.transform.RoundMasker;
import org.slf4j.Logger;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

/**
 * A handle on one decoded image on its way to an object store.
 * <p>
 * A handle starts out empty and is populated by a single {@code load} or {@code fetch}, which returns a new, loaded
 * handle. Every transform ({@link #orient()}, {@link #resize}, {@link #crop}, {@link #fit}, {@link #makeRound()})
 * likewise returns a new handle holding its own freshly allocated buffer and leaves the receiver untouched, so a
 * loaded handle can be branched into several renditions:
 * <pre>
 * ImagePipeline original = new ImagePipeline(storage).load(bytes).orient();
 * original.resize(200, null).store(StoreRequest.builder().bucket("pics").key("w200.png").build());
 * original.crop(100, 100).makeRound().store(StoreRequest.builder().bucket("pics").key("avatar.png").build());
 * </pre>
 * The one exception is {@link #capSizeInPlace}, which replaces the buffer of the receiver itself.
 * <p>
 * Handles are not thread safe; the in-place cap is the only mutation.
 */
public class ImagePipeline {

    private final ObjectStorage storage;
    private final ImageFetcher fetcher;
    private final ResizerConfig config;
    private final Stages stages;
    private final Logger log;
    private final String bucket;
    private final MetadataTags tags;
    private final String sourceContentType;
    private ImageBuffer buffer;

    public ImagePipeline(ObjectStorage storage) {
        this(storage, new ResizerConfig());
    }

    public ImagePipeline(ObjectStorage storage, ResizerConfig config) {
        this(storage, UrlImageFetcher.INSTANCE, config);
    }

    /**
     * @param storage the store encoded images are handed to
     * @param fetcher used by {@link #fetch(String)}
     * @param config pipeline settings, including the logger to report to
     * @throws InvalidParameterException if storage or fetcher is missing
     */
    public ImagePipeline(ObjectStorage storage, ImageFetcher fetcher, ResizerConfig config) {
        if (storage == null) {
            throw new InvalidParameterException("An ObjectStorage is required");
        }
        if (fetcher == null) {
            throw new InvalidParameterException("An ImageFetcher is required");
        }
        this.storage = storage;
        this.fetcher = fetcher;
        this.config = config != null ? config : new ResizerConfig();
        this.stages = new Stages(this.config);
        this.log = this.config.getLogger();
        this.bucket = null;
        this.tags = MetadataTags.empty();
        this.sourceContentType = null;
        this.buffer = null;
    }

    private ImagePipeline(ImagePipeline parent, String bucket, MetadataTags tags, String sourceContentType, ImageBuffer buffer) {
        this.storage = parent.storage;
        this.fetcher = parent.fetcher;
        this.config = parent.config;
        this.stages = parent.stages;
        this.log = parent.log;
        this.bucket = bucket;
        this.tags = tags;
        this.sourceContentType = sourceContentType;
        this.buffer = buffer;
    }

    private ImagePipeline derive(ImageBuffer newBuffer) {
        return new ImagePipeline(this, bucket, tags, sourceContentType, newBuffer);
    }

    /**
     * @return a handle on the same image (copied) whose store requests default to {@code bucket}
     */
    public ImagePipeline withBucket(String bucket) {
        ImageBuffer copy = buffer != null ? buffer.withLayout(buffer.getLayout()) : null;
        return new ImagePipeline(this, bucket, tags, sourceContentType, copy);
    }

    /**
     * Fetches the image behind {@code url} with the configured {@link ImageFetcher} and loads it.
     * @throws FetchException if the bytes could not be retrieved
     */
    public ImagePipeline fetch(String url) {
        requireEmpty("fetch");
        log.atDebug().addKeyValue("url", url).log("Fetching image");
        ByteSource bytes = fetcher.fetch(url);
        return load(bytes, url);
    }

    public ImagePipeline load(byte[] imageBytes) {
        if (imageBytes == null) {
            throw new InvalidParameterException("No image bytes given");
        }
        return load(ByteSource.wrap(imageBytes), null);
    }

    public ImagePipeline load(File file) {
        if (file == null) {
            throw new InvalidParameterException("No image file given");
        }
        return load(Files.asByteSource(file), file.getName());
    }

    public ImagePipeline load(ByteSource imageBytes) {
        return load(imageBytes, null);
    }

    /**
     * Decodes the bytes, reads their EXIF tags and normalizes the pixels to RGBA over white.
     * @param filename optional hint for content type detection
     * @throws DecodeException if the bytes are not a supported image
     * @throws SequencingException if this handle already holds an image
     */
    public ImagePipeline load(ByteSource imageBytes, String filename) {
        requireEmpty("load");
        if (imageBytes == null) {
            throw new InvalidParameterException("No image bytes given");
        }

        String contentType = stages.metadataExtractor.detectContentType(imageBytes, filename);
        if (!stages.metadataExtractor.isImageContentType(contentType)) {
            log.atError().addKeyValue("contentType", contentType).log("Source is not an image");
            throw new DecodeException("Source is not a supported image, detected content type " + contentType);
        }

        BufferedImage decoded = stages.decoder.decode(imageBytes);
        MetadataTags sourceTags = stages.metadataExtractor.readTags(imageBytes);
        ImageBuffer normalized = stages.normalizer.normalize(decoded);
        decoded.flush();

        log.atInfo()
                .addKeyValue("contentType", contentType)
                .addKeyValue("width", normalized.getWidth())
                .addKeyValue("height", normalized.getHeight())
                .addKeyValue("tags", sourceTags.asMap().size())
                .log("Loaded image");
        log.atDebug().addKeyValue("tags", sourceTags.asMap()).log("Image has exif tags");
        return new ImagePipeline(this, bucket, sourceTags, contentType, normalized);
    }

    /**
     * Applies the EXIF orientation, if any, so that later geometry works on the upright image.
     * @throws IllegalStateException if the orientation tag is outside 1..8
     */
    public ImagePipeline orient() {
        requireLoaded("orient");
        Orientation orientation = stages.orientationCorrector.orientationOf(tags);
        if (orientation == Orientation.Normal) {
            log.atInfo().log("No exif orientation to apply");
        } else {
            log.atInfo().addKeyValue("orientation", orientation.value()).log("Applying exif orientation");
        }
        return derive(stages.orientationCorrector.apply(buffer, orientation));
    }

    /**
     * Exact resize; see {@link Resizer#resize}. Either side may be null, not both.
     */
    public ImagePipeline resize(Integer width, Integer height) {
        Resizer.checkRequested(width, height);
        requireLoaded("resize");
        Size target = Resizer.computeExactSize(buffer.getSize(), width, height);
        log.atInfo()
                .addKeyValue("fromWidth", buffer.getWidth()).addKeyValue("fromHeight", buffer.getHeight())
                .addKeyValue("toWidth", target.width).addKeyValue("toHeight", target.height)
                .log("Resizing image");
        return derive(stages.resizer.resize(buffer, target.width, target.height));
    }

    /**
     * Caps the size of this handle's own image, keeping its aspect ratio and never enlarging it. Unlike the other
     * transforms this replaces the buffer of the receiver rather than returning a new handle; the replacement
     * happens only once the shrunk buffer is complete.
     * @return this handle
     */
    public ImagePipeline capSizeInPlace(Integer width, Integer height) {
        Resizer.checkRequested(width, height);
        requireLoaded("capSizeInPlace");
        ImageBuffer shrunk = stages.resizer.shrinkToFit(buffer, width, height);
        if (shrunk != buffer) {
            log.atInfo()
                    .addKeyValue("fromWidth", buffer.getWidth()).addKeyValue("fromHeight", buffer.getHeight())
                    .addKeyValue("toWidth", shrunk.getWidth()).addKeyValue("toHeight", shrunk.getHeight())
                    .log("Capped image size in place");
            buffer = shrunk;
        }
        return this;
    }

    /**
     * Centered crop to exactly {@code width} x {@code height}.
     * @throws ValidationException if either side exceeds the image
     */
    public ImagePipeline crop(Integer width, Integer height) {
        if (width == null || height == null) {
            throw new InvalidParameterException("Both width and height must be specified to crop");
        }
        requireLoaded("crop");
        log.atInfo().addKeyValue("width", width).addKeyValue("height", height).log("Cropping image");
        return derive(stages.cropper.centerCrop(buffer, width, height));
    }

    /**
     * Scale to cover {@code width} x {@code height} then crop the overflow evenly.
     */
    public ImagePipeline fit(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidParameterException("Fit size must be positive, got " + width + "x" + height);
        }
        requireLoaded("fit");
        log.atInfo().addKeyValue("width", width).addKeyValue("height", height).log("Fitting image");
        return derive(stages.cropper.fitCentered(buffer, new Size(width, height)));
    }

    /**
     * Cuts the image to the ellipse inscribed in its bounds, with an antialiased transparent outside.
     */
    public ImagePipeline makeRound() {
        requireLoaded("makeRound");
        log.atInfo()
                .addKeyValue("supersampleFactor", stages.roundMasker.getSupersampleFactor())
                .addKeyValue("inset", stages.roundMasker.getInset())
                .log("Applying round mask");
        return derive(stages.roundMasker.apply(buffer));
    }

    /**
     * @param format {@code png}, {@code jpg} or {@code jpeg}, encoded with the configured defaults
     */
    public EncodedImage encode(String format) {
        return encode(encodeOptionsFor(ImageFormat.parse(format), null, null));
    }

    public EncodedImage encode(EncodeOptions options) {
        if (options == null) {
            throw new InvalidParameterException("No encode options given");
        }
        requireLoaded("encode");
        EncodedImage encoded = stages.encoder.encode(buffer, options);
        log.atDebug()
                .addKeyValue("contentType", encoded.getContentType())
                .addKeyValue("length", encoded.getLength())
                .log("Encoded image");
        return encoded;
    }

    /**
     * Encodes the image and hands it to the storage collaborator, making it public if requested.
     * @throws InvalidParameterException if no bucket (and no default bucket) or no key is given
     * @throws StorageException if the storage collaborator fails
     */
    public StoredImage store(StoreRequest request) {
        if (request == null) {
            throw new InvalidParameterException("No store request given");
        }
        String bucketName = StringUtils.isNotBlank(request.getBucket()) ? request.getBucket() : bucket;
        if (StringUtils.isBlank(bucketName)) {
            throw new InvalidParameterException("No bucket specified");
        }
        String key = request.getKey();
        if (StringUtils.isBlank(key)) {
            throw new InvalidParameterException("No key specified");
        }
        if (request.getFormat() == null) {
            throw new InvalidParameterException("No output format specified");
        }
        requireLoaded("store");

        EncodedImage encoded = encode(encodeOptionsFor(request.getFormat(), request.getQuality(), request.getProgressive()));
        log.atInfo().addKeyValue("bucket", bucketName).addKeyValue("key", key).log("Storing image");
        try {
            StorageBucket target = storage.getBucket(bucketName);
            target.upload(key, encoded.asByteSource(), encoded.getContentType(), request.getMetadata());
            if (request.isPublicRead()) {
                target.makePublic(key);
            }
            return new StoredImage(bucketName, key, encoded.getContentType(), target.getPublicUrl(key),
                    encoded.getLength(), request.isPublicRead());
        } catch (IOException e) {
            log.atError().addKeyValue("bucket", bucketName).addKeyValue("key", key).setCause(e).log("Failed to store image");
            throw new StorageException("Failed to store image into " + bucketName + "/" + key, e);
        }
    }

    private EncodeOptions encodeOptionsFor(ImageFormat format, Integer quality, Boolean progressive) {
        return new EncodeOptions(
                format,
                quality != null ? quality : config.getJpegQuality(),
                progressive != null ? progressive : config.isProgressive(),
                format.isLossless() && config.isPngOptimize());
    }

    public boolean isLoaded() {
        return buffer != null;
    }

    /**
     * @throws SequencingException if nothing is loaded
     */
    public ImageBuffer getBuffer() {
        requireLoaded("getBuffer");
        return buffer;
    }

    public int getWidth() {
        return getBuffer().getWidth();
    }

    public int getHeight() {
        return getBuffer().getHeight();
    }

    public MetadataTags getTags() {
        return tags;
    }

    public String getSourceContentType() {
        return sourceContentType;
    }

    public String getBucket() {
        return bucket;
    }

    public ResizerConfig getConfig() {
        return config;
    }

    private void requireLoaded(String operation) {
        if (buffer == null) {
            throw new SequencingException("No image loaded! You must call load() or fetch() before " + operation + "()");
        }
    }

    private void requireEmpty(String operation) {
        if (buffer != null) {
            throw new SequencingException("An image is already loaded, " + operation + "() needs an empty handle");
        }
    }

    /**
     * The stateless processing stages, built once per configuration and shared by derived handles.
     */
    private static final class Stages {
        final MetadataExtractor metadataExtractor = new MetadataExtractor();
        final ImageDecoder decoder;
        final ImageNormalizer normalizer = new ImageNormalizer();
        final OrientationCorrector orientationCorrector = new OrientationCorrector();
        final Resizer resizer = new Resizer();
        final Cropper cropper = new Cropper();
        final RoundMasker roundMasker;
        final ImageEncoder encoder = new ImageEncoder();

        Stages(ResizerConfig config) {
            this.decoder = new ImageDecoder(config.getReaderSelectionStrategy());
            this.roundMasker = new RoundMasker(config.getSupersampleFactor(), config.getMaskInset());
        }
    }
}
