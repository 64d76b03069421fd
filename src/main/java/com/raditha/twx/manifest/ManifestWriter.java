package com.raditha.twx.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.twx.exceptions.OutputException;
import com.raditha.twx.pipeline.AtomicFileWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes manifests to pretty-printed JSON. Timestamps are ISO-8601
 * strings.
 */
public class ManifestWriter {

    private final ObjectMapper mapper;

    public ManifestWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(Manifest manifest) throws JsonProcessingException {
        return mapper.writeValueAsString(manifest) + "\n";
    }

    /**
     * Write the manifest atomically.
     */
    public void write(Manifest manifest, Path target) throws OutputException {
        String json;
        try {
            json = toJson(manifest);
        } catch (JsonProcessingException e) {
            throw new OutputException(target, "cannot serialize manifest: " + e.getOriginalMessage(), e);
        }
        AtomicFileWriter.write(target, json);
    }

    public Manifest read(Path source) throws IOException {
        return mapper.readValue(source.toFile(), Manifest.class);
    }
}
