package org.brahmic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class AppTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return App.run(
            args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)
        );
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void inlineCode() {
        assertEquals(0, run("-c", "(\"hi\") cheppu"));
        assertEquals("print(\"hi\")\n", stdout());
        assertEquals("", stderr());
    }

    @Test
    void fileToFile(@TempDir Path dir) throws IOException {
        var input = dir.resolve("prog.teng");
        var output = dir.resolve("prog.py");
        Files.writeString(input, "x = 1\nx lo i ki:\n    (i) cheppu\n");

        assertEquals(0, run(input.toString(), "-o", output.toString()));
        assertEquals("x = 1\nfor i in x:\n    print(i)\n", Files.readString(output));
        assertEquals("", stdout());
    }

    @Test
    void tokensAndTree() {
        assertEquals(0, run("--tokens", "--tree", "-c", "x = 1"));

        var text = stdout();
        assertTrue(text.contains("\"ident\": \"x\""));
        assertTrue(text.contains("AssignStmt (assignIdent=x)"));
        assertTrue(text.endsWith("x = 1\n"));
    }

    @Test
    void syntaxErrorFails() {
        assertEquals(1, run("-c", "okavela x > 5 aite:"));
        assertTrue(stderr().contains("empty body"));
        assertEquals("", stdout());
    }

    @Test
    void lexicalErrorFailsButStillTranslates() {
        assertEquals(1, run("-c", "x = 1 #"));
        assertTrue(stderr().contains("E101"));
        assertEquals("x = 1\n", stdout());
    }

    @Test
    void missingFile(@TempDir Path dir) {
        assertEquals(1, run(dir.resolve("nope.teng").toString()));
        assertTrue(stderr().contains("cannot find file"));
    }

    @Test
    void badArguments() {
        assertEquals(1, run());
        assertEquals(1, run("-c"));
        assertEquals(1, run("--colour", "-c", "x = 1"));
        assertEquals(1, run("a.teng", "-c", "x = 1"));
        assertTrue(stderr().contains("usage:"));
    }
}
