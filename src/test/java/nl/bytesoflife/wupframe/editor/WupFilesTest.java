package nl.bytesoflife.wupframe.editor;

import nl.bytesoflife.wupframe.model.Axis;
import nl.bytesoflife.wupframe.model.EntityKind;
import nl.bytesoflife.wupframe.parser.WupParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WupFilesTest {

    @TempDir
    Path dir;

    @Test
    void suggestsSiblingNames() {
        assertEquals("wall-modified.wup", WupFiles.suggestModifiedFilename("wall.wup"));
        assertEquals("wall.v2-edit.WUP", WupFiles.suggestModifiedFilename("wall.v2.WUP", "-edit"));
        assertEquals("wall-modified.wup", WupFiles.suggestModifiedFilename("wall"));
        assertEquals(".hidden-modified.wup", WupFiles.suggestModifiedFilename(".hidden"));
        assertEquals("modified.wup", WupFiles.suggestModifiedFilename(" "));
        assertEquals("modified.wup", WupFiles.suggestModifiedFilename(null));
    }

    @Test
    void savesNextToOriginal() throws IOException {
        Path original = dir.resolve("wall.wup");
        Files.writeString(original, "QS 2400,45,0,0,0,0; NR 10,10,10,500;");
        ModelHandle handle = new ModelHandle(new WupParser().parse(Files.readString(original)));
        new WupEditor(handle).translate(EntityKind.NAIL_ROW, Axis.X, 5, 1);

        Path saved = WupFiles.saveAsModified(handle.get(), original, WupFiles.DEFAULT_SUFFIX);

        assertEquals(dir.resolve("wall-modified.wup"), saved);
        assertEquals("QS 2400,45,0,0,0,0;\nNR 15,10,15,500;\n", Files.readString(saved));
        assertEquals("QS 2400,45,0,0,0,0; NR 10,10,10,500;", Files.readString(original));
    }

    @Test
    void refusesToOverwriteOriginal() throws IOException {
        Path original = dir.resolve("wall.wup");
        Files.writeString(original, "QS 2400,45,0,0,0,0;");
        ModelHandle handle = new ModelHandle(new WupParser().parse(Files.readString(original)));

        assertThrows(IllegalArgumentException.class,
                () -> WupFiles.save(handle.get(), original, dir.resolve(".").resolve("wall.wup")));
    }
}
