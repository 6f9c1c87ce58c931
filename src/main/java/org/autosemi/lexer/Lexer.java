package org.autosemi.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import org.autosemi.runtime.CompilerException;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer class is responsible for converting a sequence of characters (input string)
 * into a sequence of tokens.
 * <p>
 * Unlike a lexer feeding a whitespace-insensitive parser, this one keeps every layout
 * token: runs of blanks, newlines, line comments and line-continuation markers are all
 * emitted, each with its source span. The semicolon insertion pass derives indentation
 * and continuation from them; the parser skips them.
 * <p>
 * The main responsibilities of the Lexer class include:
 * - Identifying identifiers (Unicode XID rules), numbers, string literals and operators.
 * - Tracking offset, line and column for every token.
 * - Rejecting a continuation marker that is not the last symbol on its line.
 */
public class Lexer {
    // End of File token text
    public static final String EOF = "";
    // Array to mark operator characters
    public static boolean[] isOperator;

    // Static block to initialize the isOperator array
    static {
        isOperator = new boolean[128];
        for (char c : "!%&()*+,-./:;<=>?@[]^{|}~".toCharArray()) {
            isOperator[c] = true;
        }
    }

    // Input characters to be tokenized
    public String input;
    // Name used in error messages
    public final String fileName;
    // Current position in the input
    public int position;
    // Length of the input
    public int length;
    // Position of the next token
    private int line = 1;
    private int column = 1;

    public Lexer(String input) {
        this(input, "-");
    }

    public Lexer(String input, String fileName) {
        this.input = input;
        this.fileName = fileName;
        this.length = this.input.length();
        this.position = 0;
    }

    private int getCurrentCodePoint() {
        if (position >= length) {
            return -1;
        }
        char c1 = input.charAt(position);
        if (Character.isHighSurrogate(c1) && position + 1 < length) {
            char c2 = input.charAt(position + 1);
            if (Character.isLowSurrogate(c2)) {
                return Character.toCodePoint(c1, c2);
            }
        }
        return c1;
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }

    private void advanceCodePoint(int codePoint) {
        position += Character.charCount(codePoint);
    }

    // Main method for testing the Lexer
    public static void main(String[] args) {
        String code = "let x = 1\n    + 2 \\\nreturn x // done\n";
        if (args.length >= 2 && args[0].equals("-e")) {
            code = args[1]; // Read the code from the command line parameter
        }

        Lexer lexer = new Lexer(code);
        List<LexerToken> tokens = lexer.tokenize();

        for (LexerToken token : tokens) {
            System.out.println(token);
        }
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }

    // Method to tokenize the input string into a list of tokens
    public List<LexerToken> tokenize() {
        List<LexerToken> tokens = new ArrayList<>();
        LexerToken token;

        while ((token = nextToken()) != null) {
            tokens.add(token);
        }
        // Two EOF tokens so that one-token lookahead never runs off the list
        tokens.add(new LexerToken(LexerTokenType.EOF, EOF, length, line, column));
        tokens.add(new LexerToken(LexerTokenType.EOF, EOF, length, line, column));

        this.input = null;  // Throw away input to spare memory
        return tokens;
    }

    public LexerToken nextToken() {
        if (position >= length) {
            return null;
        }

        char current = input.charAt(position);
        int currentCp = getCurrentCodePoint();
        int start = position;

        LexerToken token;
        if (current == '\n') {
            position++;
            token = new LexerToken(LexerTokenType.NEWLINE, "\n", start, line, column);
            line++;
            column = 1;
            return token;
        } else if (current == '\r') {
            // Skip carriage return characters
            position++;
            return nextToken();
        } else if (isBlank(current)) {
            token = consumeWhitespace();
        } else if (current >= '0' && current <= '9') {
            token = consumeNumber();
        } else if (isIdentifierStart(currentCp)) {
            token = consumeIdentifier();
        } else if (current == '"' || current == '\'') {
            token = consumeString(current);
        } else if (current == '\\') {
            token = consumeContinuation();
        } else if (current == '/' && position + 1 < length && input.charAt(position + 1) == '/') {
            token = consumeComment();
        } else if (current < 128 && isOperator[current]) {
            token = consumeOperator();
        } else {
            throw error("Unrecognized character " + new String(Character.toChars(currentCp)));
        }
        column += position - start;
        return token;
    }

    private CompilerException error(String message) {
        return new CompilerException(message + " at " + fileName + " line " + line + ", column " + column + ".");
    }

    private LexerToken token(LexerTokenType type, int start) {
        return new LexerToken(type, input.substring(start, position), start, line, column);
    }

    public LexerToken consumeWhitespace() {
        int start = position;
        while (position < length && isBlank(input.charAt(position))) {
            position++;
        }
        return token(LexerTokenType.WHITESPACE, start);
    }

    public LexerToken consumeNumber() {
        int start = position;
        while (position < length && (Character.isDigit(input.charAt(position)) || input.charAt(position) == '_')) {
            position++;
        }
        // A fraction needs a digit after the dot, so that `1..5` stays a range
        if (position + 1 < length && input.charAt(position) == '.' && Character.isDigit(input.charAt(position + 1))) {
            position++;
            while (position < length && (Character.isDigit(input.charAt(position)) || input.charAt(position) == '_')) {
                position++;
            }
        }
        return token(LexerTokenType.NUMBER, start);
    }

    public LexerToken consumeIdentifier() {
        int start = position;
        int cp = getCurrentCodePoint();
        advanceCodePoint(cp); // Move past the initial character we already validated

        while (position < length) {
            int curCp = getCurrentCodePoint();
            if (isIdentifierPart(curCp)) {
                advanceCodePoint(curCp);
            } else {
                break;
            }
        }
        // Build token text using substring to preserve surrogate pairs correctly
        return token(LexerTokenType.IDENTIFIER, start);
    }

    public LexerToken consumeString(char quote) {
        int start = position;
        position++; // opening quote
        while (position < length) {
            char c = input.charAt(position);
            if (c == '\\' && position + 1 < length && input.charAt(position + 1) != '\n') {
                position += 2;
            } else if (c == quote) {
                position++;
                return token(LexerTokenType.STRING, start);
            } else if (c == '\n') {
                break;
            } else {
                position++;
            }
        }
        throw error("Can't find string terminator " + quote + " anywhere before EOL");
    }

    public LexerToken consumeComment() {
        int start = position;
        while (position < length && input.charAt(position) != '\n' && input.charAt(position) != '\r') {
            position++;
        }
        return token(LexerTokenType.COMMENT, start);
    }

    /**
     * Consumes a line-continuation marker. Only blanks may follow it on the same line.
     */
    public LexerToken consumeContinuation() {
        int start = position;
        int i = position + 1;
        while (i < length && isBlank(input.charAt(i))) {
            i++;
        }
        if (i < length && input.charAt(i) != '\n' && input.charAt(i) != '\r') {
            throw error("Continuation marker '\\' must be the last symbol on its line");
        }
        position++;
        return token(LexerTokenType.CONTINUATION, start);
    }

    private boolean followedBy(char c) {
        return position + 1 < length && input.charAt(position + 1) == c;
    }

    private LexerToken operator(int start, int size) {
        position += size;
        return token(LexerTokenType.OPERATOR, start);
    }

    public LexerToken consumeOperator() {
        int start = position;
        char current = input.charAt(position);
        switch (current) {
            case '=':
                if (followedBy('=') || followedBy('>')) {
                    return operator(start, 2);
                }
                break;
            case '!':
            case '<':
            case '>':
            case '*':
            case '/':
            case '%':
                if (followedBy('=')) {
                    return operator(start, 2);
                }
                break;
            case '+':
                if (followedBy('=')) {
                    return operator(start, 2);
                }
                break;
            case '-':
                if (followedBy('=') || followedBy('>')) {
                    return operator(start, 2);
                }
                break;
            case '&':
                if (followedBy('&')) {
                    return operator(start, 2);
                }
                break;
            case '|':
                if (followedBy('|')) {
                    return operator(start, 2);
                }
                break;
            case ':':
                if (followedBy(':')) {
                    return operator(start, 2);
                }
                break;
            case '.':
                if (followedBy('.')) {
                    if (position + 2 < length && input.charAt(position + 2) == '=') {
                        return operator(start, 3);
                    }
                    return operator(start, 2);
                }
                break;
            default:
                break;
        }
        return operator(start, 1);
    }
}
