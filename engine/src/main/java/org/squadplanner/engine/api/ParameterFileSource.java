package org.squadplanner.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.squadplanner.engine.api.dto.ParameterSetDto;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parameter source reading a JSON parameter set from the local file system.
 */
public final class ParameterFileSource implements ParameterSource {

    private static final Logger LOG = Logger.getLogger(ParameterFileSource.class.getName());

    private final Path file;
    private final ObjectMapper mapper;

    public ParameterFileSource(Path file) {
        this(file, new ObjectMapper());
    }

    public ParameterFileSource(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ParameterSetDto fetchParameters() {
        if (!Files.isRegularFile(file)) {
            LOG.warning(() -> "Parameter file not found: " + file.toAbsolutePath());
            return null;
        }
        try {
            return mapper.readValue(file.toFile(), ParameterSetDto.class);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to read parameter file " + file, e);
            return null;
        }
    }

    @Override
    public String describe() {
        return "parameter file " + file;
    }
}
