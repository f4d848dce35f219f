/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.store;

import io.sealdoc.DocumentParseException;
import io.sealdoc.MetadataNotFoundException;
import io.sealdoc.UnsupportedValueException;
import io.sealdoc.metadata.Metadata;
import io.sealdoc.tree.TreeBranch;
import io.sealdoc.tree.TreeValue;

/**
 * Reads and writes documents of one format. The metadata of an encrypted document is kept under
 * the reserved top level key {@value Metadata#RESERVED_KEY}, separate from the document's values.
 */
public interface Store {

    /**
     * @param document document bytes
     * @return the values of the document, without the metadata
     * @throws DocumentParseException if the document is malformed
     * @throws UnsupportedValueException if the document holds a value that cannot be represented exactly
     */
    TreeBranch unmarshal(byte[] document);

    /**
     * @param document document bytes
     * @return the metadata of the document
     * @throws MetadataNotFoundException if the document has no metadata
     * @throws DocumentParseException if the document or its metadata is malformed
     */
    Metadata unmarshalMetadata(byte[] document);

    /**
     * @param tree values
     * @return the document
     */
    byte[] marshal(TreeBranch tree);

    /**
     * @param tree values
     * @param metadata metadata
     * @return the document, with the metadata under the reserved key
     */
    byte[] marshalWithMetadata(TreeBranch tree, Metadata metadata);

    /**
     * Writes a single value, as extracted from a document. Strings are written as their raw text.
     * @param value value
     * @return the value
     */
    byte[] marshalValue(TreeValue value);
}
