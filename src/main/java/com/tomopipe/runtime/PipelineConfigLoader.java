package com.tomopipe.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

public class PipelineConfigLoader {
    private final ObjectMapper mapper = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    public PipelineConfig load(Path path) throws ConfigurationException {
        if (path == null || !Files.exists(path)) {
            return new PipelineConfig();
        }
        try {
            PipelineConfig config = mapper.readValue(path.toFile(), PipelineConfig.class);
            return config == null ? new PipelineConfig() : config;
        } catch (InvalidFormatException e) {
            throw new ConfigurationException("Invalid value '" + e.getValue() + "' for " + fieldPath(e)
                    + expectedValues(e.getTargetType()) + " in " + path, e);
        } catch (JsonMappingException e) {
            throw new ConfigurationException("Invalid configuration at " + fieldPath(e) + " in " + path + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    private static String fieldPath(JsonMappingException e) {
        String joined = e.getPath().stream()
                .map(reference -> reference.getFieldName() != null
                        ? reference.getFieldName()
                        : "[" + reference.getIndex() + "]")
                .collect(Collectors.joining("."));
        return joined.isBlank() ? "<root>" : joined;
    }

    private static String expectedValues(Class<?> targetType) {
        if (targetType == null || !targetType.isEnum()) {
            return "";
        }
        return " (expected one of " + Arrays.toString(targetType.getEnumConstants()) + ")";
    }
}
