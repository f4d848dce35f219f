/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.store.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import io.sealdoc.metadata.MetadataMapper;
import io.sealdoc.store.jackson.AbstractJacksonStore;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * JSON documents, written tab indented.
 */
public class JsonStore extends AbstractJacksonStore {

    public JsonStore(@NonNull MetadataMapper metadataMapper) {
        super(createObjectMapper(), metadataMapper);
    }

    @Override
    protected String formatName() {
        return "JSON";
    }

    static ObjectMapper createObjectMapper() {
        var indenter = new DefaultIndenter("\t", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return new ObjectMapper()
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setDefaultPrettyPrinter(printer);
    }
}
