package org.cloudstorage.images;

import org.cloudstorage.images.codec.PreferTwelveMonkeysStrategy;
import org.cloudstorage.images.codec.ReaderSelectionStrategy;
import org.cloudstorage.images.transform.RoundMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

public class ResizerConfig {

    public static final String PROPERTY_PREFIX = "resizer.";

    private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(ImagePipeline.class);

    private int _supersampleFactor = RoundMasker.DEFAULT_SUPERSAMPLE_FACTOR;
    private int _maskInset = RoundMasker.DEFAULT_INSET;
    private int _jpegQuality = 95;
    private boolean _progressive = false;
    private boolean _pngOptimize = true;
    private ReaderSelectionStrategy _readerSelectionStrategy = PreferTwelveMonkeysStrategy.INSTANCE;
    private Logger _logger = DEFAULT_LOGGER;

    public ResizerConfig() {
    }

    public ResizerConfig(Logger logger) {
        setLogger(logger);
    }

    public ResizerConfig(int supersampleFactor, int maskInset, int jpegQuality, boolean progressive) {
        _supersampleFactor = supersampleFactor;
        _maskInset = maskInset;
        _jpegQuality = jpegQuality;
        _progressive = progressive;
    }

    /**
     * Reads {@code resizer.supersampleFactor}, {@code resizer.maskInset}, {@code resizer.jpegQuality},
     * {@code resizer.progressive} and {@code resizer.pngOptimize}; absent keys keep their defaults.
     */
    public static ResizerConfig fromProperties(Properties properties) {
        ResizerConfig config = new ResizerConfig();
        config.setSupersampleFactor(intProperty(properties, "supersampleFactor", config.getSupersampleFactor()));
        config.setMaskInset(intProperty(properties, "maskInset", config.getMaskInset()));
        config.setJpegQuality(intProperty(properties, "jpegQuality", config.getJpegQuality()));
        config.setProgressive(booleanProperty(properties, "progressive", config.isProgressive()));
        config.setPngOptimize(booleanProperty(properties, "pngOptimize", config.isPngOptimize()));
        return config;
    }

    private static int intProperty(Properties properties, String name, int defaultValue) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("Property " + PROPERTY_PREFIX + name + " is not an integer: " + value);
        }
    }

    private static boolean booleanProperty(Properties properties, String name, boolean defaultValue) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        return value == null || value.isBlank() ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    public int getSupersampleFactor() { return _supersampleFactor; }
    public void setSupersampleFactor(int supersampleFactor) { _supersampleFactor = supersampleFactor; }

    public int getMaskInset() { return _maskInset; }
    public void setMaskInset(int maskInset) { _maskInset = maskInset; }

    public int getJpegQuality() { return _jpegQuality; }
    public void setJpegQuality(int jpegQuality) { _jpegQuality = jpegQuality; }

    public boolean isProgressive() { return _progressive; }
    public void setProgressive(boolean progressive) { _progressive = progressive; }

    public boolean isPngOptimize() { return _pngOptimize; }
    public void setPngOptimize(boolean pngOptimize) { _pngOptimize = pngOptimize; }

    public ReaderSelectionStrategy getReaderSelectionStrategy() { return _readerSelectionStrategy; }
    public void setReaderSelectionStrategy(ReaderSelectionStrategy strategy) { _readerSelectionStrategy = strategy; }

    public Logger getLogger() { return _logger; }
    /**
     * @param logger the sink for pipeline events; null restores the default {@code ImagePipeline} logger
     */
    public void setLogger(Logger logger) { _logger = logger != null ? logger : DEFAULT_LOGGER; }
}
