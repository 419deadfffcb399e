/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.ValidationRunDTO;
import com.ammann.riskscore.exception.RiskScoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jboss.logging.Logger;

/**
 * Serializes validation runs to JSON for downstream table and figure generation.
 */
@ApplicationScoped
public class ReportExportService {

    private static final Logger LOG = Logger.getLogger(ReportExportService.class);

    private final ObjectMapper objectMapper;

    @Inject
    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(ValidationRunDTO run) {
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new RiskScoreException("Failed to serialize validation run", e);
        }
    }

    /**
     * Writes the run as JSON, creating parent directories as needed.
     */
    public Path write(ValidationRunDTO run, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(run), StandardCharsets.UTF_8);
        LOG.infof("Validation report with %d cells written to %s", run.results().size(), target);
        return target;
    }
}
