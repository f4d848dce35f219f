/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.store.yaml;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import io.sealdoc.metadata.MetadataMapper;
import io.sealdoc.store.jackson.AbstractJacksonStore;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * YAML documents. Only the first document of a stream is read, and comments are not kept.
 */
public class YamlStore extends AbstractJacksonStore {

    public YamlStore(@NonNull MetadataMapper metadataMapper) {
        super(createObjectMapper(), metadataMapper);
    }

    @Override
    protected String formatName() {
        return "YAML";
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper(YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .build())
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }
}
