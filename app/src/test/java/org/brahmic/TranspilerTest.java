package org.brahmic;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import au.com.origin.snapshots.Expect;
import au.com.origin.snapshots.junit5.SnapshotExtension;

import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

class TranspilerTest {
    @Test
    void helloWorld() {
        assertEquals("print(\"Hello World\")", Transpiler.toPython("(\"Hello World\") cheppu"));
    }

    @Test
    void assignmentThenPrint() {
        var python = Transpiler.toPython("name = \"Ravi\"\n(\"My name is\", name) cheppu\n");

        assertEquals("name = \"Ravi\"\nprint(\"My name is\", name)", python);
    }

    @Test
    void ifElse() {
        var python = Transpiler.toPython("""
            okavela x > 5 aite:
                ("big") cheppu
            lekapothe:
                ("small") cheppu
            """);

        assertEquals("""
            if x > 5:
                print("big")
            else:
                print("small")""", python);
    }

    @Test
    void rangeLoop() {
        var python = Transpiler.toPython("range(5) lo i ki:\n    (i) cheppu");

        assertEquals("for i in range(5):\n    print(i)", python);
    }

    @Test
    void emptyBodyProducesNoOutput() {
        var error = assertThrows(SyntaxError.class, () -> Transpiler.transpile("okavela x > 5 aite:"));

        assertTrue(error.getMessage().contains("empty body"));
    }

    @Test
    void precedenceNeedsNoParens() {
        assertEquals("x = y + z * 2", Transpiler.toPython("x = y + z * 2"));
    }

    @Test
    void redundantParensAreDropped() {
        assertEquals("x = a * b + c", Transpiler.toPython("x = ((a * b)) + (c)"));
        assertEquals("x = a - (b - c)", Transpiler.toPython("x = a - (b - c)"));
    }

    @Test
    void negatedHeader() {
        var python = Transpiler.toPython("okavela x == 1 avvakapote:\n    aagipo");

        assertEquals("if not (x == 1):\n    break", python);
    }

    @Test
    void stringsSurviveTheRoundTrip() {
        var python = Transpiler.toPython("(\"tab\\there \\\"quoted\\\"\") cheppu");

        assertEquals("print(\"tab\\there \\\"quoted\\\"\")", python);
    }

    @Test
    void multiLineArguments() {
        var python = Transpiler.toPython("(\"a\",\n    \"b\") cheppu\nx = 1");

        assertEquals("print(\"a\", \"b\")\nx = 1", python);
    }

    @Test
    void lexicalErrorsAreCollected() {
        var result = Transpiler.transpile("x = 5 $");

        assertTrue(result.hasLexicalErrors());
        assertEquals("E101", result.lexicalErrors().get(0).code());
        // the bad character is skipped, what remains is still parsed
        assertThrows(SyntaxError.class, () -> Transpiler.transpile("x = 5 $ 3 4"));
    }

    @Test
    void cleanSourceHasNoErrors() {
        var result = Transpiler.transpile("x = 1");

        assertFalse(result.hasLexicalErrors());
        assertEquals(1, result.tree().stmts().size());
    }

    @Test
    void emptySource() {
        assertEquals("", Transpiler.toPython(""));
        assertEquals("", Transpiler.toPython("\n\n   \n"));
    }
}

@ExtendWith({SnapshotExtension.class})
class SampleProgramTest {
    private Expect expect;

    private static String readSample() throws IOException {
        return Files.readString(Paths.get("sample/basic.teng"), StandardCharsets.UTF_8);
    }

    @Test
    void sampleTranslatesAsExpected() throws IOException {
        var python = Transpiler.toPython(readSample());

        var expected = """
            def factorial(n):
                if n <= 1:
                    return 1
                return n * factorial(n - 1)

            def classify(x):
                if x > 0:
                    return "positive"
                elif x < 0:
                    return "negative"
                else:
                    return "zero"

            numbers = [1, 2, 3, 4, 5]
            total = 0
            for n in numbers:
                total = total + n

            print("total:", total)
            for i in range(3):
                if not (i % 2 == 0):
                    continue
                print(i, factorial(i))

            count = 0
            while count < 10:
                count = count + 1
                if count == 5 and True:
                    break

            if 3 in numbers or False:
                print("found", classify(-2))

            name = "Tenglish"
            print(name.upper(), "says \\"hi\\"")""";

        assertEquals(expected, python);
    }

    @Test
    void sampleSnapshot() throws IOException {
        var result = Transpiler.transpile(readSample());

        expect.toMatchSnapshot(result.python());
        expect.scenario("tree").toMatchSnapshot(new PrinterST().print(result.tree()));
    }
}
