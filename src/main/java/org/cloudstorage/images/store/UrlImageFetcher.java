package org.cloudstorage.images.store;

import com.google.common.io.ByteSource;
import com.google.common.io.Resources;
import org.apache.commons.lang3.StringUtils;
import org.cloudstorage.images.FetchException;
import org.cloudstorage.images.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;

/**
 * Reads the whole resource behind a URL into memory. HTTP error statuses surface as {@link FetchException}.
 */
public class UrlImageFetcher implements ImageFetcher {

    private static final Logger log = LoggerFactory.getLogger(UrlImageFetcher.class);

    public static final UrlImageFetcher INSTANCE = new UrlImageFetcher();

    @Override
    public ByteSource fetch(String location) {
        if (StringUtils.isBlank(location)) {
            throw new InvalidParameterException("No url specified");
        }
        URL url;
        try {
            url = new URL(location);
        } catch (MalformedURLException e) {
            throw new FetchException("Malformed url " + location, e);
        }

        log.debug("Fetching image at url {}", url);
        try {
            byte[] bytes = Resources.asByteSource(url).read();
            return ByteSource.wrap(bytes);
        } catch (IOException e) {
            throw new FetchException("Failed to load image at url " + location, e);
        }
    }
}
