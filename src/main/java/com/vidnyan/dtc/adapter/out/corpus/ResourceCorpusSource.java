package com.vidnyan.dtc.adapter.out.corpus;

import com.vidnyan.dtc.DtcProperties;
import com.vidnyan.dtc.application.port.out.CorpusSource;
import com.vidnyan.dtc.domain.error.CorpusLoadException;
import com.vidnyan.dtc.domain.model.CorpusEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.ResourceUtils;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Corpus source backed by a Spring resource (classpath or file system).
 * Location and format come from {@code dtc.corpus.*}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResourceCorpusSource implements CorpusSource {

    private final DtcProperties properties;
    private final ResourceLoader resourceLoader;

    @Override
    public List<CorpusEntry> readEntries() {
        Resource resource = resolve(properties.getCorpus().getLocation());
        if (!resource.exists()) {
            throw new CorpusLoadException(0, "corpus not found at " + describe());
        }

        CorpusFormat format = CorpusFormat.parse(properties.getCorpus().getFormat())
                .resolve(resource.getFilename());
        log.debug("Reading {} corpus from {}", format, resource.getDescription());

        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return switch (format) {
                case CSV -> new CsvCorpusParser().parse(reader);
                default -> new BlockCorpusParser().parse(reader);
            };
        } catch (IOException e) {
            throw new CorpusLoadException(0, "failed to read corpus " + describe() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return properties.getCorpus().getLocation();
    }

    /**
     * Plain paths that exist on disk are read from the file system; anything else goes through the resource loader.
     */
    private Resource resolve(String location) {
        if (!ResourceUtils.isUrl(location)) {
            Path path = Path.of(location);
            if (Files.exists(path)) {
                return new FileSystemResource(path);
            }
        }
        return resourceLoader.getResource(location);
    }
}
