package com.signallint.plugins.react.tree;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EstreeReaderTest {

    private final EstreeReader reader = new EstreeReader();

    private JsNode read(String source, String json) throws EstreeReadException {
        JsonNode program = reader.readEnvelope(json);
        return reader.toTree(program, new LineIndex(source));
    }

    @Test
    void testBuildsTypedTreeWithParents() throws EstreeReadException {
        String source = "x.value;";
        JsNode root = read(source, """
                {"type": "Program", "start": 0, "end": 8, "body": [
                  {"type": "ExpressionStatement", "start": 0, "end": 8, "expression":
                    {"type": "MemberExpression", "start": 0, "end": 7, "computed": false,
                     "object": {"type": "Identifier", "start": 0, "end": 1, "name": "x"},
                     "property": {"type": "Identifier", "start": 2, "end": 7, "name": "value"}}}
                ]}
                """);

        assertEquals(NodeKind.PROGRAM, root.kind());
        JsNode statement = root.children(Field.BODY).get(0);
        JsNode member = statement.child(Field.EXPRESSION);
        assertEquals(NodeKind.MEMBER_EXPRESSION, member.kind());
        assertSame(statement, member.parent(), "Parent link should point at the statement");
        assertEquals(Field.EXPRESSION, member.parentField());

        JsNode object = member.child(Field.OBJECT);
        assertEquals("x", object.name());
        assertTrue(Nodes.isValueAccess(member), "x.value is a value access");
        assertTrue(Nodes.isReference(object), "The member object is a reference");
        assertFalse(Nodes.isReference(member.child(Field.PROPERTY)), "A member property is not a reference");
        assertTrue(object.isDescendantOf(statement));
    }

    @Test
    void testChildrenAreInSourceOrder() throws EstreeReadException {
        String source = "a + b;";
        JsNode root = read(source, """
                {"type": "Program", "start": 0, "end": 6, "body": [
                  {"type": "ExpressionStatement", "start": 0, "end": 6, "expression":
                    {"type": "BinaryExpression", "start": 0, "end": 5, "operator": "+",
                     "left": {"type": "Identifier", "start": 0, "end": 1, "name": "a"},
                     "right": {"type": "Identifier", "start": 4, "end": 5, "name": "b"}}}
                ]}
                """);

        JsNode binary = root.children(Field.BODY).get(0).child(Field.EXPRESSION);
        assertEquals("+", binary.operator());
        List<JsNode> children = binary.children();
        assertEquals(2, children.size());
        assertEquals("a", children.get(0).name());
        assertEquals("b", children.get(1).name());
        assertEquals(1, children.get(1).range().getLine());
        assertEquals(4, children.get(1).range().getColumn());
    }

    @Test
    void testRejectsUnknownNodeType() {
        EstreeReadException e = assertThrows(EstreeReadException.class, () -> read("x", """
                {"type": "Program", "start": 0, "end": 1, "body": [
                  {"type": "NotARealNode", "start": 0, "end": 1}
                ]}
                """));
        assertTrue(e.getMessage().contains("NotARealNode"), "Message should name the type: " + e.getMessage());
    }

    @Test
    void testRejectsNonProgramRoot() {
        assertThrows(EstreeReadException.class,
                () -> read("x", "{\"type\": \"Identifier\", \"start\": 0, \"end\": 1, \"name\": \"x\"}"));
    }

    @Test
    void testRejectsMalformedJson() {
        assertThrows(EstreeReadException.class, () -> reader.readEnvelope("{\"type\": "));
    }
}
