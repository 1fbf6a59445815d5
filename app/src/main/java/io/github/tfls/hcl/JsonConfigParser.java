package io.github.tfls.hcl;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.tfls.indexer.Attribute;
import io.github.tfls.indexer.Block;
import io.github.tfls.indexer.ConfigFiles;
import io.github.tfls.indexer.Diagnostic;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.indexer.ParseResult;
import io.github.tfls.indexer.Parser;
import io.github.tfls.indexer.SourcePos;
import io.github.tfls.indexer.SourceRange;
import io.github.tfls.indexer.SyntaxTree;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Parser for JSON-syntax configuration files ({@code .tf.json} and friends), built on the Jackson streaming API so
 * that every block and attribute keeps its source position.
 *
 * <p>Each top-level property is a block type; its nested object keys are the block labels, as many levels deep as the
 * block type takes ({@link #labelCount}). Variable files hold only top-level attributes. Inside a block body, object
 * values are nested blocks and everything else is an attribute.
 */
public final class JsonConfigParser implements Parser {
    private static final Logger logger = LogManager.getLogger(JsonConfigParser.class);

    private static final Map<String, Integer> LABEL_COUNTS = Map.of(
            "resource", 2,
            "data", 2,
            "ephemeral", 2,
            "terraform", 0,
            "locals", 0,
            "moved", 0,
            "import", 0,
            "check", 1);

    private final ObjectMapper mapper = new ObjectMapper();

    static int labelCount(String blockType) {
        return LABEL_COUNTS.getOrDefault(blockType, 1);
    }

    @Override
    public ParseResult parse(DocumentId document, String content) {
        var attributes = new ArrayList<Attribute>();
        var blocks = new ArrayList<Block>();
        var diagnostics = new ArrayList<Diagnostic>();
        boolean variablesOnly = ConfigFiles.isVariablesFile(document.getFileName());
        try (var parser = mapper.getFactory().createParser(content)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                diagnostics.add(Diagnostic.error("Expected a JSON object at top level", rangeOf(parser)));
                return new ParseResult(SyntaxTree.EMPTY, diagnostics);
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                var key = parser.currentName();
                var keyStart = start(parser);
                var value = parser.nextToken();
                if (variablesOnly) {
                    attributes.add(attribute(parser, key, keyStart));
                } else if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
                    labelled(parser, key, List.of(), labelCount(key), keyStart, blocks);
                } else {
                    attributes.add(attribute(parser, key, keyStart));
                    diagnostics.add(Diagnostic.error("Block '" + key + "' must be an object", rangeFrom(keyStart, parser)));
                }
            }
        } catch (JsonProcessingException e) {
            var location = e.getLocation();
            var pos = location != null ? toPos(location) : new SourcePos(0, 0);
            diagnostics.add(Diagnostic.error(e.getOriginalMessage(), new SourceRange(pos, pos)));
            logger.debug("{}: invalid JSON: {}", document, e.getOriginalMessage());
        } catch (IOException e) {
            // reading from a String only fails through JsonProcessingException
            throw new UncheckedIOException(e);
        }
        return new ParseResult(new SyntaxTree(attributes, blocks), diagnostics);
    }

    /**
     * Reads the value the parser is positioned on as one or more blocks of {@code type}, consuming {@code remaining}
     * more levels of object keys as labels first.
     */
    private void labelled(
            JsonParser parser, String type, List<String> labels, int remaining, SourcePos start, List<Block> out)
            throws IOException {
        if (parser.currentToken() == JsonToken.START_ARRAY) {
            // repeated blocks: [ {...}, {...} ]
            while (parser.nextToken() != JsonToken.END_ARRAY) {
                if (parser.currentToken() == JsonToken.START_OBJECT) {
                    labelled(parser, type, labels, remaining, start(parser), out);
                } else {
                    parser.skipChildren();
                }
            }
            return;
        }
        if (parser.currentToken() != JsonToken.START_OBJECT) {
            parser.skipChildren();
            return;
        }
        if (remaining == 0) {
            out.add(block(parser, type, labels, start));
            return;
        }
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            var label = parser.currentName();
            var labelStart = start(parser);
            parser.nextToken();
            var nextLabels = new ArrayList<>(labels);
            nextLabels.add(label);
            labelled(parser, type, nextLabels, remaining - 1, labelStart, out);
        }
    }

    /** Reads a block body; the parser is positioned on its START_OBJECT. */
    private Block block(JsonParser parser, String type, List<String> labels, SourcePos start) throws IOException {
        var attributes = new ArrayList<Attribute>();
        var nested = new ArrayList<Block>();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            var key = parser.currentName();
            var keyStart = start(parser);
            var value = parser.nextToken();
            if (value == JsonToken.START_OBJECT) {
                nested.add(block(parser, key, List.of(), keyStart));
            } else {
                attributes.add(attribute(parser, key, keyStart));
            }
        }
        return new Block(type, labels, attributes, nested, rangeFrom(start, parser));
    }

    private Attribute attribute(JsonParser parser, String key, SourcePos keyStart) throws IOException {
        var token = parser.currentToken();
        String literal = token == JsonToken.VALUE_STRING ? parser.getText() : null;
        String expression;
        if (token == JsonToken.START_ARRAY || token == JsonToken.START_OBJECT) {
            expression = mapper.readTree(parser).toString();
        } else if (token == JsonToken.VALUE_STRING) {
            expression = '"' + parser.getText() + '"';
        } else {
            expression = parser.getText();
        }
        return new Attribute(key, expression, literal, rangeFrom(keyStart, parser));
    }

    private static SourcePos start(JsonParser parser) {
        return toPos(parser.currentTokenLocation());
    }

    /** From {@code start} to just past the current token. */
    private static SourceRange rangeFrom(SourcePos start, JsonParser parser) {
        return new SourceRange(start, toPos(parser.currentLocation()));
    }

    private static SourceRange rangeOf(JsonParser parser) {
        return rangeFrom(start(parser), parser);
    }

    // Jackson counts lines and columns from 1
    private static SourcePos toPos(JsonLocation location) {
        return new SourcePos(Math.max(0, location.getLineNr() - 1), Math.max(0, location.getColumnNr() - 1));
    }
}
