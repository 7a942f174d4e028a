package org.vaultprep.engine.serialization;

import org.vaultprep.engine.relation.Relation;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Interface for serializing compiled relations to a text format.
 */
public interface RelationSerializer {

    /**
     * Returns the format identifier, also used as file extension (e.g. "csv").
     */
    String formatId();

    /**
     * Serializes a relation, header first, to a string.
     */
    String serialize(Relation relation);

    /**
     * Writes the serialized relation as UTF-8.
     */
    default void serialize(Relation relation, OutputStream out) throws IOException {
        out.write(serialize(relation).getBytes(StandardCharsets.UTF_8));
    }
}
