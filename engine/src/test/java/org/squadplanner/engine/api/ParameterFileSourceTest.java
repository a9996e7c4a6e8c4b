package org.squadplanner.engine.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.squadplanner.engine.api.dto.ParameterSetDto;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ParameterFileSourceTest {

    @TempDir
    Path dir;

    @Test
    void readsParameterFile() throws IOException {
        Path file = dir.resolve("parameters.json");
        Files.write(file, "{\"config\": [{\"key\": \"horizon_length\", \"value\": 2}]}".getBytes(StandardCharsets.UTF_8));

        ParameterSetDto parameters = new ParameterFileSource(file).fetchParameters();

        assertEquals(1, parameters.getConfig().size());
        assertNull(parameters.getCurves());
    }

    @Test
    void missingFileYieldsNull() {
        assertNull(new ParameterFileSource(dir.resolve("absent.json")).fetchParameters());
    }

    @Test
    void unreadableJsonYieldsNull() throws IOException {
        Path file = dir.resolve("broken.json");
        Files.write(file, "{\"config\": [".getBytes(StandardCharsets.UTF_8));

        assertNull(new ParameterFileSource(file).fetchParameters());
    }
}
