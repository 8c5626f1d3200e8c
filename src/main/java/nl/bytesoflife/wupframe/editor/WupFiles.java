package nl.bytesoflife.wupframe.editor;

import nl.bytesoflife.wupframe.model.WupModel;
import nl.bytesoflife.wupframe.serializer.SerializedWup;
import nl.bytesoflife.wupframe.serializer.WupSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saving edited models next to the file they came from.
 */
public final class WupFiles {

    private static final Logger log = LoggerFactory.getLogger(WupFiles.class);

    public static final String DEFAULT_SUFFIX = "-modified";

    private WupFiles() {
    }

    public static String suggestModifiedFilename(String originalName) {
        return suggestModifiedFilename(originalName, DEFAULT_SUFFIX);
    }

    /**
     * {@code wall.wup} becomes {@code wall<suffix>.wup}; a name without extension gets
     * {@code .wup} appended.
     */
    public static String suggestModifiedFilename(String originalName, String suffix) {
        if (originalName == null || originalName.isBlank()) {
            return "modified.wup";
        }
        int dot = originalName.lastIndexOf('.');
        if (dot <= 0) {
            return originalName + suffix + ".wup";
        }
        return originalName.substring(0, dot) + suffix + originalName.substring(dot);
    }

    /**
     * Writes the serialized model (or its fallback text) to a sibling of {@code original}.
     *
     * @return the written file
     */
    public static Path saveAsModified(WupModel model, Path original, String suffix) throws IOException {
        Path fileName = original.getFileName();
        String name = suggestModifiedFilename(fileName != null ? fileName.toString() : null, suffix);
        return save(model, original, original.resolveSibling(name));
    }

    public static Path save(WupModel model, Path original, Path target) throws IOException {
        if (target.toAbsolutePath().normalize().equals(original.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Refusing to overwrite " + original);
        }
        SerializedWup serialized = new WupSerializer().serialize(model);
        if (serialized.isEmpty()) {
            log.warn("No statements left, writing the original text to {}", target);
        }
        Files.writeString(target, serialized.payload(), StandardCharsets.UTF_8);
        log.info("Saved {} ({} chars)", target, serialized.payload().length());
        return target;
    }
}
