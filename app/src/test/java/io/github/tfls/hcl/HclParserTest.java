package io.github.tfls.hcl;

import static org.junit.jupiter.api.Assertions.*;

import io.github.tfls.indexer.Block;
import io.github.tfls.indexer.Diagnostic;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.indexer.ParseResult;
import io.github.tfls.indexer.SourceRange;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class HclParserTest {

    private static final DocumentId DOC = new DocumentId(Path.of("/workspace").toAbsolutePath().normalize(), "main.tf");

    private final HclParser parser = new HclParser();

    private ParseResult parse(String content) {
        return parser.parse(DOC, content);
    }

    private static List<String> messages(ParseResult result) {
        return result.diagnostics().stream().map(Diagnostic::message).toList();
    }

    @Test
    void testEmptyBlockRanges() {
        var provider = parse("provider \"github\" {}").tree().blocks().get(0);
        assertEquals("provider", provider.type());
        assertEquals(List.of("github"), provider.labels());
        assertEquals(SourceRange.of(0, 0, 0, 20), provider.range());

        var custom = parse("myblock \"custom\" {}\n").tree().blocks().get(0);
        assertEquals("myblock \"custom\"", custom.displayName());
        assertEquals(SourceRange.of(0, 0, 0, 19), custom.range());
    }

    @Test
    void testBlockWithAttributesAndNestedBlocks() {
        var result = parse(
                """
                resource "aws_instance" "web" {
                  ami           = "ami-123"
                  instance_type = var.size

                  lifecycle {
                    create_before_destroy = true
                  }
                }
                """);
        assertFalse(result.hasErrors(), () -> messages(result).toString());

        var resource = result.tree().blocks().get(0);
        assertEquals("resource \"aws_instance\" \"web\"", resource.displayName());
        assertEquals(SourceRange.of(0, 0, 7, 1), resource.range());

        var ami = resource.attribute("ami").orElseThrow();
        assertEquals("\"ami-123\"", ami.expression());
        assertEquals("ami-123", ami.literalValue());
        assertEquals(SourceRange.of(1, 2, 1, 27), ami.range());

        var size = resource.attribute("instance_type").orElseThrow();
        assertEquals("var.size", size.expression());
        assertNull(size.literalValue());

        Block lifecycle = resource.blocks().get(0);
        assertEquals("lifecycle", lifecycle.type());
        assertEquals(List.of(), lifecycle.labels());
        assertEquals("true", lifecycle.attribute("create_before_destroy").orElseThrow().expression());
    }

    @Test
    void testMultiLineExpressionsStayOneAttribute() {
        var result = parse(
                """
                locals {
                  tags = {
                    Name = "web"
                  }
                  zones = [
                    "a",
                    "b",
                  ]
                  enabled = var.x != 0
                }
                """);
        assertFalse(result.hasErrors(), () -> messages(result).toString());

        var locals = result.tree().blocks().get(0);
        assertEquals(List.of("tags", "zones", "enabled"), locals.attributes().stream().map(a -> a.name()).toList());
        assertTrue(locals.blocks().isEmpty(), "an object value is not a nested block");
        assertEquals("{\n    Name = \"web\"\n  }", locals.attribute("tags").orElseThrow().expression());
        assertEquals("var.x != 0", locals.attribute("enabled").orElseThrow().expression());
    }

    @Test
    void testStringEscapesAndTemplates() {
        var attributes = parse(
                        """
                        quoted   = "a\\"b\\\\c\\n"
                        template = "web-${var.env}"
                        escaped  = "$${not_a_template}"
                        unicode  = "\\u00e9"
                        """)
                .tree()
                .attributes();

        assertEquals("a\"b\\c\n", attributes.get(0).literalValue());
        assertNull(attributes.get(1).literalValue(), "interpolation is not a literal");
        assertEquals("\"web-${var.env}\"", attributes.get(1).expression());
        assertEquals("${not_a_template}", attributes.get(2).literalValue());
        assertEquals("é", attributes.get(3).literalValue());
    }

    @Test
    void testHeredocs() {
        var result = parse(
                """
                plain = <<EOT
                hello
                  world
                EOT
                indented = <<-EOT
                    hello
                      world
                    EOT
                after = 1
                """);
        assertFalse(result.hasErrors(), () -> messages(result).toString());

        var attributes = result.tree().attributes();
        assertEquals(List.of("plain", "indented", "after"), attributes.stream().map(a -> a.name()).toList());
        assertEquals("hello\n  world\n", attributes.get(0).literalValue());
        assertEquals("hello\n  world\n", attributes.get(1).literalValue());
        assertEquals(SourceRange.of(4, 0, 7, 7), attributes.get(1).range());
    }

    @Test
    void testCommentsAreIgnored() {
        var result = parse(
                """
                # hash comment
                // slash comment
                /* block
                   comment { */
                provider "aws" { # trailing
                  region = "eu-west-1" // trailing
                }
                """);
        assertFalse(result.hasErrors(), () -> messages(result).toString());
        var provider = result.tree().blocks().get(0);
        assertEquals(4, provider.range().start().line());
        assertEquals("eu-west-1", provider.attribute("region").orElseThrow().literalValue());
    }

    @Test
    void testIdentifierLabels() {
        var block = parse("provider aws {}\n").tree().blocks().get(0);
        assertEquals(List.of("aws"), block.labels());
    }

    @Test
    void testUnclosedBlockIsAnError() {
        var result = parse("provider \"github\" {\n  region = \"x\"\n");

        assertTrue(result.hasErrors());
        assertEquals(List.of("Unclosed block, expected '}'"), messages(result));
        assertEquals(1, result.tree().blocks().size(), "the partial block is still in the tree");
    }

    @Test
    void testUnexpectedClosingBrace() {
        var result = parse("}\nprovider \"a\" {}\n");

        assertTrue(result.hasErrors());
        assertEquals(List.of("Unexpected '}'"), messages(result));
        assertEquals("provider \"a\"", result.tree().blocks().get(0).displayName());
    }

    @Test
    void testUnterminatedString() {
        var result = parse("name = \"abc\nprovider \"a\" {}\n");

        assertTrue(result.hasErrors());
        assertTrue(messages(result).contains("Unterminated string"));
        assertEquals(SourceRange.of(1, 0, 1, 15), result.tree().blocks().get(0).range());
    }

    @Test
    void testRecoversAtNextLine() {
        var result = parse("garbage\n= 1\nprovider \"a\" {}\nmissing =\n");

        assertEquals(
                List.of(
                        "Expected '=' or '{' after 'garbage'",
                        "Expected an attribute or block, found '='",
                        "Missing expression for 'missing'"),
                messages(result));
        assertEquals(1, result.tree().blocks().size());
    }

    @Test
    void testUnbalancedBrackets() {
        var result = parse("list = [1, 2\n");
        assertTrue(messages(result).contains("Unbalanced brackets in 'list'"));
    }

    @Test
    void testUnterminatedHeredocAndComment() {
        assertTrue(messages(parse("a = <<EOT\nline\n")).contains("Unterminated heredoc, expected EOT"));
        assertTrue(messages(parse("/* never closed")).contains("Unterminated comment"));
    }
}
