package org.autosemi;

import org.autosemi.asi.AsiConfig;
import org.autosemi.asi.AsiResult;
import org.autosemi.asi.AutoSemicolonPass;
import org.autosemi.lexer.Lexer;
import org.autosemi.parser.Parser;
import org.autosemi.parser.TokenUtils;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs semicolon insertion over the sources in the corpus resource directory.
 * Every {@code name.src} has a {@code name.out} next to it holding the expected
 * source with the inserted terminators.
 */
public class AsiCorpusTest {

    /**
     * Provides the names of the corpus sources.
     *
     * @return a Stream of resource names relative to the class path root.
     * @throws IOException if an I/O error occurs while accessing the resources.
     */
    static Stream<String> provideCorpusSources() throws IOException {
        URL resourceUrl = AsiCorpusTest.class.getClassLoader().getResource("corpus/blocks.src");
        if (resourceUrl == null) {
            throw new IOException("Resource directory not found");
        }
        Path resourcePath;
        try {
            resourcePath = Paths.get(resourceUrl.toURI()).getParent();
        } catch (URISyntaxException e) {
            throw new RuntimeException(e);
        }

        return Files.walk(resourcePath)
                .filter(path -> path.toString().endsWith(".src"))
                .map(resourcePath::relativize)
                .map(path -> "corpus/" + path.toString().replace('\\', '/'))
                .sorted();
    }

    private String readResource(String name) throws IOException {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(name)) {
            assertNotNull(inputStream, "Resource file not found: " + name);
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @ParameterizedTest(name = "Corpus file: {0}")
    @MethodSource("provideCorpusSources")
    void testCorpusFile(String filename) throws IOException {
        String source = readResource(filename);
        String expected = readResource(filename.replaceAll("\\.src$", ".out"));

        ArgumentParser.CompilerOptions options = new ArgumentParser.CompilerOptions();
        options.fileName = filename;
        options.code = source;
        CompilerContext ctx = new CompilerContext(filename, options);

        AsiResult result = new AutoSemicolonPass(AsiConfig.DEFAULT, ctx).run(new Lexer(source, filename).tokenize());

        assertFalse(result.hasErrors(), () -> "Unexpected diagnostics: " + result.diagnostics);
        assertEquals(expected, TokenUtils.toText(result.tokens, 0, result.tokens.size() - 1));
        assertDoesNotThrow(() -> new Parser(ctx, result.tokens).parse());
    }
}
