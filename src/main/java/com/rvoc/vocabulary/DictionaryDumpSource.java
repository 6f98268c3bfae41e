package com.rvoc.vocabulary;

import com.rvoc.config.RVocProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * Opens the configured dictionary dump. The location is any Spring resource location
 * ({@code classpath:}, {@code file:}, {@code https:}); dumps ending in {@code .gz} are decompressed.
 */
@Component
public class DictionaryDumpSource {

    private final ResourceLoader resourceLoader;
    private final RVocProperties.Dictionary properties;

    public DictionaryDumpSource(ResourceLoader resourceLoader, RVocProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties.getDictionary();
    }

    public InputStream open() throws IOException {
        String location = properties.getDumpLocation();
        if (location == null || location.isBlank()) {
            throw new FileNotFoundException("No dictionary dump location configured (rvoc.dictionary.dump-location)");
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new FileNotFoundException("Dictionary dump not found at " + location);
        }
        InputStream input = new BufferedInputStream(resource.getInputStream());
        if (location.endsWith(".gz")) {
            try {
                return new GZIPInputStream(input);
            } catch (IOException e) {
                input.close();
                throw e;
            }
        }
        return input;
    }

    public String getLocation() {
        return properties.getDumpLocation();
    }
}
