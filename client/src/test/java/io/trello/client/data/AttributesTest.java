package io.trello.client.data;

import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.trello.util.Utils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AttributesTest {

    private static final Schema SCHEMA = Schema.builder()
            .attribute("name", "desc", "pos")
            .readonly("url")
            .build();

    private static ObjectNode json(String json) throws Exception {
        return (ObjectNode) Utils.OBJECT_MAPPER.readTree(json);
    }

    @Test
    public void testLoadIsClean() throws Exception {
        Attributes attributes = new Attributes(SCHEMA);

        attributes.load(json("{\"id\":\"x\",\"name\":\"A\",\"url\":\"u\",\"unknown\":1}"));

        assertFalse(attributes.isDirty());
        assertEquals("A", attributes.get("name").asText());
        assertEquals("u", attributes.get("url").asText());
        assertFalse(attributes.values().has("unknown"));
        assertNull(attributes.get("desc"));
    }

    @Test
    public void testSetMarksDirtyInSchemaOrder() throws Exception {
        Attributes attributes = new Attributes(SCHEMA);
        attributes.load(json("{\"id\":\"x\",\"name\":\"A\",\"pos\":1}"));

        attributes.set("pos", IntNode.valueOf(2));
        attributes.set("name", TextNode.valueOf("B"));

        assertEquals(List.of("name", "pos"), List.copyOf(attributes.changed()));
        assertEquals("{\"name\":\"B\",\"pos\":2}", attributes.changedValues().toString());
    }

    @Test
    public void testWritingBackOriginalValueIsClean() throws Exception {
        Attributes attributes = new Attributes(SCHEMA);
        attributes.load(json("{\"id\":\"x\",\"name\":\"A\"}"));

        attributes.set("name", TextNode.valueOf("B"));
        attributes.set("name", TextNode.valueOf("A"));

        assertFalse(attributes.isDirty());
    }

    @Test
    public void testClearingIsAChange() throws Exception {
        Attributes attributes = new Attributes(SCHEMA);
        attributes.load(json("{\"id\":\"x\",\"desc\":\"text\"}"));

        attributes.set("desc", null);

        assertEquals(Set.of("desc"), attributes.changed());
        assertTrue(attributes.changedValues().get("desc").isNull());
        assertNull(attributes.get("desc"));
    }

    @Test
    public void testClearingUnsetAttributeIsNotAChange() throws Exception {
        Attributes attributes = new Attributes(SCHEMA);
        attributes.load(json("{\"id\":\"x\",\"name\":\"A\"}"));

        attributes.set("desc", null);

        assertFalse(attributes.isDirty());
        assertEquals(0, attributes.changedValues().size());
        assertFalse(attributes.values().has("desc"));
    }

    @Test
    public void testClearingLoadedNullIsNotAChange() throws Exception {
        Attributes attributes = new Attributes(SCHEMA);
        attributes.load(json("{\"id\":\"x\",\"desc\":null}"));

        attributes.set("desc", null);

        assertFalse(attributes.isDirty());
    }

    @Test
    public void testNumbersCompareByValue() throws Exception {
        Attributes attributes = new Attributes(SCHEMA);
        attributes.load(json("{\"id\":\"x\",\"pos\":16384}"));

        attributes.set("pos", DoubleNode.valueOf(16384.0));
        assertFalse(attributes.isDirty());

        attributes.set("pos", DoubleNode.valueOf(16384.5));
        assertEquals(Set.of("pos"), attributes.changed());
    }

    @Test
    public void testSameValue() throws Exception {
        assertTrue(Attributes.sameValue(null, NullNode.getInstance()));
        assertTrue(Attributes.sameValue(IntNode.valueOf(3), DoubleNode.valueOf(3.0)));
        assertTrue(Attributes.sameValue(json("{\"a\":[1,2]}"), json("{\"a\":[1.0,2]}")));
        assertFalse(Attributes.sameValue(null, TextNode.valueOf("")));
        assertFalse(Attributes.sameValue(TextNode.valueOf("1"), IntNode.valueOf(1)));
    }

    @Test
    public void testReadOnlyAndUnknown() {
        Attributes attributes = new Attributes(SCHEMA);

        assertThrows(IllegalArgumentException.class, () -> attributes.set("url", TextNode.valueOf("u")));
        assertThrows(IllegalArgumentException.class, () -> attributes.set("id", TextNode.valueOf("y")));
        assertThrows(IllegalArgumentException.class, () -> attributes.set("nope", TextNode.valueOf("v")));
        assertThrows(IllegalArgumentException.class, () -> attributes.get("nope"));
    }

    @Test
    public void testMarkClean() {
        Attributes attributes = new Attributes(SCHEMA);
        attributes.set("name", TextNode.valueOf("A"));
        assertTrue(attributes.isDirty());

        attributes.markClean();

        assertFalse(attributes.isDirty());
        assertEquals("A", attributes.get("name").asText());
    }

    @Test
    public void testValuesIsACopy() {
        Attributes attributes = new Attributes(SCHEMA);
        attributes.set("name", TextNode.valueOf("A"));

        attributes.values().put("name", "B");

        assertEquals("A", attributes.get("name").asText());
    }
}
