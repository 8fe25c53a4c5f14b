package com.leadtracker.leadtracker.pipeline;

import com.leadtracker.leadtracker.ingest.IngestConstants;
import com.leadtracker.leadtracker.ingest.IngestProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds source files through the Spring resource pattern in {@code ingest.source-pattern}, e.g.
 * {@code file:./inbox/*.xlsx} or {@code classpath*:exports/*.csv}.
 */
@Component
public class PatternSourceFileProvider implements SourceFileProvider {

    private final IngestProperties ingestProperties;
    private final PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    public PatternSourceFileProvider(IngestProperties ingestProperties) {
        this.ingestProperties = ingestProperties;
    }

    @Override
    public List<String> listSourceNames() {
        List<String> names = new ArrayList<>();
        for (Resource resource : resolveSources()) {
            names.add(resource.getFilename());
        }
        return names;
    }

    @Override
    public SourceFile fetch(String fileName) {
        for (Resource resource : resolveSources()) {
            if (!resource.getFilename().equals(fileName)) {
                continue;
            }
            try {
                return new SourceFile(fileName, resource.getInputStream().readAllBytes());
            } catch (IOException ex) {
                throw new IllegalStateException(IngestConstants.MSG_SOURCE_READ_FAILED.formatted(fileName), ex);
            }
        }
        throw new IllegalArgumentException(IngestConstants.MSG_SOURCE_READ_FAILED.formatted(fileName));
    }

    private List<Resource> resolveSources() {
        String pattern = ingestProperties.getSourcePattern();
        try {
            List<Resource> valid = new ArrayList<>();
            for (Resource resource : resolver.getResources(pattern)) {
                if (resource == null || !resource.exists() || !resource.isReadable()) {
                    continue;
                }
                String name = resource.getFilename();
                if (name != null && isSupported(name)) {
                    valid.add(resource);
                }
            }
            valid.sort((left, right) -> left.getFilename().compareTo(right.getFilename()));
            return valid;
        } catch (IOException ex) {
            throw new IllegalStateException(IngestConstants.MSG_SOURCE_LIST_FAILED.formatted(pattern), ex);
        }
    }

    private boolean isSupported(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(IngestConstants.FILE_EXT_CSV)
                || lower.endsWith(IngestConstants.FILE_EXT_TXT)
                || lower.endsWith(IngestConstants.FILE_EXT_XLSX)
                || lower.endsWith(IngestConstants.FILE_EXT_XLS);
    }
}
