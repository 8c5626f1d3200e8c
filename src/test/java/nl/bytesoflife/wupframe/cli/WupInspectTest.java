package nl.bytesoflife.wupframe.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WupInspectTest {

    @TempDir
    Path dir;

    private Path input;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private WupInspect inspect;

    @BeforeEach
    void setUp() throws IOException {
        input = dir.resolve("outlet-wall.wup");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/outlet-wall.wup")) {
            Files.copy(in, input);
        }
        inspect = new WupInspect(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsUsageWithoutArguments() throws IOException {
        assertEquals(2, inspect.run(new String[0]));
        assertTrue(output().startsWith("Usage:"));
    }

    @Test
    void printsSummary() throws IOException {
        assertEquals(0, inspect.run(new String[]{input.toString()}));

        String out = output();
        assertTrue(out.contains("Wall 2400.0 x 2600.0 mm"), out);
        assertTrue(out.contains("Studs 3, blocking 1, plates 2, sheathing 1, nail rows 2, BOY 2, PAF 2, unhandled 0"), out);
        assertTrue(out.contains("POLYGON code 311 (Cylindrical trimmer, CENTER) footprint 87.0 x 87.0"), out);
        assertTrue(out.contains("BOY #1 x=67.0 z=30.0, direction -1, BLOCKING"), out);
    }

    @Test
    void appliesEditAndSavesSibling() throws IOException {
        assertEquals(0, inspect.run(new String[]{input.toString(), "translate", "nr", "2", "x", "10"}));

        Path saved = dir.resolve("outlet-wall-modified.wup");
        assertTrue(Files.exists(saved));
        assertTrue(Files.readString(saved).contains("NR 32.5,100,32.5,2500,75,2.8;"));
        assertTrue(output().contains("Moved 1 item 10 mm along X"), output());
    }

    @Test
    void missedEditReturnsOne() throws IOException {
        assertEquals(1, inspect.run(new String[]{input.toString(), "delete", "boy", "99"}));
        assertFalse(Files.exists(dir.resolve("outlet-wall-modified.wup")));
    }

    @Test
    void rejectsUnknownEdit() {
        assertThrows(IllegalArgumentException.class,
                () -> inspect.run(new String[]{input.toString(), "rotate", "nr", "2"}));
        assertThrows(IllegalArgumentException.class,
                () -> inspect.run(new String[]{input.toString(), "translate", "nr", "2"}));
    }
}
