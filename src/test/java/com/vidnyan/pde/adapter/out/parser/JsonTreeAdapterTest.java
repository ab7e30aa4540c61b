package com.vidnyan.pde.adapter.out.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.domain.tree.Visibility;
import com.vidnyan.pde.exception.ParseFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonTreeAdapterTest {

    @TempDir
    Path tempDir;

    private final JsonTreeAdapter adapter = new JsonTreeAdapter(new ObjectMapper());

    private Path write(String name, String json) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, json);
        return file;
    }

    @Test
    void parse_ShouldBuildTreeFromDocument() throws IOException {
        // Arrange
        Path file = write("config.ast.json", """
                {
                  "kind": "TYPE_DECL",
                  "name": "Config",
                  "visibility": "public",
                  "line": 3,
                  "column": 1,
                  "properties": { "final": true, "note": null },
                  "children": [
                    { "kind": "FIELD", "name": "instance", "type": "Config", "visibility": "private",
                      "properties": { "static": "true" } },
                    { "kind": "constructor", "name": "Config", "visibility": "private" }
                  ]
                }
                """);

        // Act
        TreeNode tree = adapter.parse(file);

        // Assert
        assertEquals(NodeKind.TYPE_DECL, tree.kind());
        assertEquals(Visibility.PUBLIC, tree.visibility());
        assertEquals("true", tree.properties().get("final"));
        assertFalse(tree.properties().containsKey("note"));
        assertEquals(3, tree.location().line());
        assertEquals(file.toString(), tree.location().filePath());

        TreeNode field = tree.children().get(0);
        assertEquals("Config", field.typeText());
        assertTrue(field.flag("static"));
        assertEquals(NodeKind.CONSTRUCTOR, tree.children().get(1).kind());
        assertEquals(Visibility.PRIVATE, tree.children().get(1).visibility());
    }

    @Test
    void parse_UnknownKind_ShouldMapToOtherAndKeepSyntax() throws IOException {
        Path file = write("module.ast.json", """
                { "kind": "MODULE", "name": "core",
                  "children": [ { "kind": "PROCEDURE", "name": "init", "extra": 1 } ] }
                """);

        TreeNode tree = adapter.parse(file);

        assertEquals(NodeKind.OTHER, tree.kind());
        assertEquals("MODULE", tree.properties().get("syntax"));
        assertEquals("init", tree.children().get(0).name());
    }

    @Test
    void parse_MalformedDocument_ShouldThrowParseFailure() throws IOException {
        Path file = write("broken.ast.json", "{ \"kind\": \"TYPE_DECL\", ");

        ParseFailureException e = assertThrows(ParseFailureException.class, () -> adapter.parse(file));
        assertEquals(file, e.getFile());
    }

    @Test
    void parse_MissingFile_ShouldThrowParseFailure() {
        Path file = tempDir.resolve("absent.ast.json");

        ParseFailureException e = assertThrows(ParseFailureException.class, () -> adapter.parse(file));
        assertEquals(file, e.getFile());
        assertTrue(e.getMessage().endsWith("cannot read file"), e.getMessage());
    }

    @Test
    void parse_MissingRootKind_ShouldThrowParseFailure() throws IOException {
        Path file = write("nokind.ast.json", "{ \"name\": \"Config\" }");

        assertThrows(ParseFailureException.class, () -> adapter.parse(file));
    }

    @Test
    void supports_ShouldAcceptSerializedTreesOnly() {
        assertTrue(adapter.supports(Path.of("out/Config.ast.json")));
        assertFalse(adapter.supports(Path.of("patterns/singleton.json")));
        assertFalse(adapter.supports(Path.of("Config.java")));
    }
}
