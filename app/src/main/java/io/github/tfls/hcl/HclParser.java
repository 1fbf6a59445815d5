package io.github.tfls.hcl;

import io.github.tfls.hcl.HclLexer.Token;
import io.github.tfls.hcl.HclLexer.TokenType;
import io.github.tfls.indexer.Attribute;
import io.github.tfls.indexer.Block;
import io.github.tfls.indexer.Diagnostic;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.indexer.ParseResult;
import io.github.tfls.indexer.Parser;
import io.github.tfls.indexer.SourceRange;
import io.github.tfls.indexer.SyntaxTree;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Structural parser for native-syntax configuration files. It recognizes bodies made of attributes
 * ({@code name = expression}) and blocks ({@code type "label"... { body }}); expressions are kept as source text and
 * not evaluated.
 *
 * <p>The parser recovers from errors by skipping to the end of the offending line, so a single typo still yields the
 * blocks around it. Any error diagnostic marks the whole result as failed.
 */
public final class HclParser implements Parser {
    private static final Logger logger = LogManager.getLogger(HclParser.class);

    @Override
    public ParseResult parse(DocumentId document, String content) {
        var diagnostics = new ArrayList<Diagnostic>();
        var tokens = new HclLexer(content, diagnostics).tokenize();
        var state = new State(content, tokens, diagnostics);
        var body = state.body(null);
        if (!diagnostics.isEmpty()) {
            logger.debug("{}: {} diagnostics", document, diagnostics.size());
        }
        return new ParseResult(new SyntaxTree(body.attributes, body.blocks), diagnostics);
    }

    private static final class Body {
        final List<Attribute> attributes = new ArrayList<>();
        final List<Block> blocks = new ArrayList<>();
        Token end;

        Body(Token end) {
            this.end = end;
        }
    }

    private static final class State {
        private final String content;
        private final List<Token> tokens;
        private final List<Diagnostic> diagnostics;
        private int index;

        State(String content, List<Token> tokens, List<Diagnostic> diagnostics) {
            this.content = content;
            this.tokens = tokens;
            this.diagnostics = diagnostics;
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token take() {
            var token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        /**
         * Parses a body. With a non-null {@code open} brace the body ends at the matching closing brace, which is
         * consumed and recorded as {@link Body#end}; otherwise it runs to end of input.
         */
        Body body(@Nullable Token open) {
            var body = new Body(peek());
            while (true) {
                var token = peek();
                switch (token.type()) {
                    case NEWLINE -> take();
                    case EOF -> {
                        if (open != null) {
                            diagnostics.add(Diagnostic.error("Unclosed block, expected '}'", open.range()));
                        }
                        body.end = token;
                        return body;
                    }
                    case RBRACE -> {
                        take();
                        if (open != null) {
                            body.end = token;
                            return body;
                        }
                        diagnostics.add(Diagnostic.error("Unexpected '}'", token.range()));
                    }
                    case IDENT -> item(body);
                    default -> {
                        diagnostics.add(
                                Diagnostic.error("Expected an attribute or block, found '" + token.value() + "'", token.range()));
                        skipLine();
                    }
                }
            }
        }

        private void item(Body body) {
            var name = take();
            var next = peek();
            if (next.type() == TokenType.EQUALS) {
                take();
                body.attributes.add(attribute(name));
                return;
            }

            var labels = new ArrayList<String>();
            while (peek().type() == TokenType.STRING || peek().type() == TokenType.IDENT) {
                labels.add(take().value());
            }
            if (peek().type() != TokenType.LBRACE) {
                var bad = peek();
                diagnostics.add(Diagnostic.error(
                        "Expected '=' or '{' after '" + name.value() + "'",
                        bad.type() == TokenType.NEWLINE || bad.type() == TokenType.EOF ? name.range() : bad.range()));
                skipLine();
                return;
            }
            var open = take();
            var inner = body(open);
            var range = new SourceRange(name.start(), inner.end.end());
            body.blocks.add(new Block(name.value(), labels, inner.attributes, inner.blocks, range));
        }

        private Attribute attribute(Token name) {
            int first = index;
            int depth = 0;
            while (true) {
                var token = peek();
                if (token.type() == TokenType.EOF) {
                    break;
                }
                if (depth == 0 && (token.type() == TokenType.NEWLINE || token.type() == TokenType.RBRACE)) {
                    break;
                }
                if (token.type() == TokenType.OPEN || token.type() == TokenType.LBRACE) {
                    depth++;
                } else if (token.type() == TokenType.CLOSE || token.type() == TokenType.RBRACE) {
                    depth--;
                }
                take();
            }
            if (index == first) {
                diagnostics.add(Diagnostic.error("Missing expression for '" + name.value() + "'", name.range()));
                return new Attribute(name.value(), "", null, name.range());
            }
            if (depth != 0) {
                diagnostics.add(Diagnostic.error(
                        "Unbalanced brackets in '" + name.value() + "'",
                        new SourceRange(name.start(), tokens.get(index - 1).end())));
            }
            var firstToken = tokens.get(first);
            var lastToken = tokens.get(index - 1);
            var expression = content.substring(firstToken.startOffset(), lastToken.endOffset());
            String literal = null;
            if (index - first == 1
                    && (firstToken.type() == TokenType.STRING || firstToken.type() == TokenType.HEREDOC)
                    && firstToken.literal()) {
                literal = firstToken.value();
            }
            return new Attribute(name.value(), expression, literal, new SourceRange(name.start(), lastToken.end()));
        }

        private void skipLine() {
            int depth = 0;
            while (true) {
                var token = peek();
                if (token.type() == TokenType.EOF || (token.type() == TokenType.NEWLINE && depth <= 0)) {
                    return;
                }
                if (token.type() == TokenType.LBRACE) {
                    depth++;
                } else if (token.type() == TokenType.RBRACE) {
                    if (depth == 0) {
                        // leave the enclosing block's closing brace alone
                        return;
                    }
                    depth--;
                }
                take();
            }
        }
    }
}
