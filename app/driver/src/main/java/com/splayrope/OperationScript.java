package com.splayrope;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The input of a driver run: the initial text and the list of operations to
 * apply to it.
 */
public class OperationScript {
    private static final Logger LOGGER = LoggerFactory.getLogger(OperationScript.class);

    @JsonProperty("text")
    public final String text;
    @JsonProperty("operations")
    public final List<MoveOperation> operations;

    /**
     * Create a new script. Used directly by Jackson for the JSON format.
     *
     * @param text
     *            The initial text.
     * @param operations
     *            The operations, {@code null} meaning none.
     */
    @JsonCreator
    public OperationScript(
            @JsonProperty(value = "text", required = true) String text,
            @JsonProperty("operations") List<MoveOperation> operations) {
        this.text = text == null ? "" : text;
        this.operations = operations == null ? List.of() : operations;
    }

    /**
     * Read a script in the given format.
     *
     * @param format
     *            The input format.
     * @param reader
     *            The input to read.
     * @param objectMapper
     *            The mapper used for the JSON format.
     * @return The parsed script.
     * @throws IOException
     *             If reading fails or the input is malformed.
     */
    public static OperationScript read(InputFormat format, Reader reader, ObjectMapper objectMapper)
            throws IOException {
        switch (format) {
            case JSON:
                return readJson(reader, objectMapper);
            case TEXT:
            default:
                return readText(reader);
        }
    }

    /**
     * Read a script in the JSON format.
     *
     * @param reader
     *            The input to read.
     * @param objectMapper
     *            The mapper to deserialize with.
     * @return The parsed script.
     * @throws IOException
     *             If reading fails or the input is not a valid script.
     */
    public static OperationScript readJson(Reader reader, ObjectMapper objectMapper) throws IOException {
        try {
            OperationScript script = objectMapper.readValue(reader, OperationScript.class);
            if (script == null) {
                throw new InputFormatException("Input contains no script", 0);
            }
            LOGGER.debug("Read JSON script with {} characters and {} operations", script.text.length(),
                    script.operations.size());
            return script;
        } catch (JsonProcessingException e) {
            throw new InputFormatException("Malformed JSON script: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Read a script in the line based text format. The first line holds the
     * text, the next token is the number of operations, followed by that many
     * triples of indices. All tokens after the first line may be separated by
     * any whitespace.
     *
     * @param reader
     *            The input to read.
     * @return The parsed script.
     * @throws IOException
     *             If reading fails or the input is malformed.
     */
    public static OperationScript readText(Reader reader) throws IOException {
        BufferedReader input = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader);
        String text = input.readLine();
        text = text == null ? "" : text.strip();
        TokenReader tokens = new TokenReader(input);
        List<MoveOperation> operations = new ArrayList<>();
        if (tokens.hasNext()) {
            int count = tokens.nextInt("operation count");
            for (int n = 0; n < count; n++) {
                if (!tokens.hasNext()) {
                    throw new InputFormatException(
                            "Expected " + count + " operations, found only " + n, tokens.line);
                }
                int i = tokens.nextInt("start index");
                int j = tokens.nextInt("end index");
                int k = tokens.nextInt("paste position");
                operations.add(new MoveOperation(i, j, k));
            }
        }
        LOGGER.debug("Read text script with {} characters and {} operations", text.length(), operations.size());
        return new OperationScript(text, operations);
    }

    /**
     * Splits the remainder of the input into whitespace separated non-negative
     * integers. Line numbers start at 2, since the first line is the text.
     */
    private static class TokenReader {
        private final BufferedReader input;
        private int next;
        private int line = 2;

        private TokenReader(BufferedReader input) throws IOException {
            this.input = input;
            this.next = input.read();
            skipWhitespace();
        }

        private void advance() throws IOException {
            if (next == '\n') {
                line++;
            }
            next = input.read();
        }

        private void skipWhitespace() throws IOException {
            while (next != -1 && Character.isWhitespace(next)) {
                advance();
            }
        }

        private boolean hasNext() {
            return next != -1;
        }

        private int nextInt(String what) throws IOException {
            if (next == -1) {
                throw new InputFormatException("Unexpected end of input, expected " + what, line);
            }
            StringBuilder token = new StringBuilder();
            while (next != -1 && !Character.isWhitespace(next)) {
                token.append((char) next);
                advance();
            }
            int startLine = line;
            skipWhitespace();
            try {
                int value = Integer.parseInt(token.toString());
                if (value < 0) {
                    throw new InputFormatException("Negative " + what + " " + value, startLine);
                }
                return value;
            } catch (NumberFormatException e) {
                throw new InputFormatException("Invalid " + what + " '" + token + "'", startLine);
            }
        }
    }
}
