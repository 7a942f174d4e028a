package org.vaultprep.engine.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.serialization.RelationSerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes serialized relations as {@code <relation name>.<format>} files
 * into one output directory. Blank content is not written.
 */
public class ExportWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExportWriter.class);

    private final Path outputDirectory;
    private final RelationSerializer serializer;

    public ExportWriter(Path outputDirectory, RelationSerializer serializer) {
        this.outputDirectory = outputDirectory;
        this.serializer = serializer;
    }

    /**
     * @return the files written, in relation order
     */
    public List<Path> write(List<Relation> relations) throws IOException {
        Files.createDirectories(outputDirectory);
        List<Path> written = new ArrayList<>(relations.size());
        for (Relation relation : relations) {
            String content = serializer.serialize(relation);
            if (content.isBlank()) {
                LOGGER.info("Skipping {}: nothing to write", relation.name());
                continue;
            }
            Path file = outputDirectory.resolve(relation.name() + "." + serializer.formatId());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            LOGGER.info("Wrote {} rows to {}", relation.rowCount(), file);
            written.add(file);
        }
        return written;
    }
}
