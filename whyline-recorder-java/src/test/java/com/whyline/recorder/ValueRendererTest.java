package com.whyline.recorder;

import org.junit.jupiter.api.Test;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ValueRendererTest {

    private static final RenderLimits DEFAULT_LIMITS = RenderLimits.defaults(); // depth=2, max_elements=3

    @Test
    void nullRendersAsNull() {
        assertEquals("null", ValueRenderer.render(null, DEFAULT_LIMITS));
        assertTrue(ValueRenderer.flatten(null, DEFAULT_LIMITS).isEmpty());
    }

    @Test
    void scalarsRenderDirectly() {
        assertEquals("42", ValueRenderer.render(42, DEFAULT_LIMITS));
        assertEquals("hello", ValueRenderer.render("hello", DEFAULT_LIMITS));
        assertEquals("3.14", ValueRenderer.render(3.14, DEFAULT_LIMITS));
    }

    @Test
    void placeholderRendersItsOwnText() {
        ValuePlaceholder p = new ValuePlaceholder("Socket", "java.net.Socket", 4);
        assertEquals("<unserializable: Socket#4>", ValueRenderer.render(p, DEFAULT_LIMITS));
    }

    static class Point {
        int x = 1;
        int y = 2;
        String label = null;
    }

    @Test
    void pojoFields() {
        assertEquals("Point{x=1, y=2, label=null}", ValueRenderer.render(new Point(), DEFAULT_LIMITS));
    }

    static class Outer {
        String name = "outer";
        Inner inner = new Inner();
    }
    static class Inner {
        String value = "inner-value";
        Deep deep = new Deep();
    }
    static class Deep {
        String deepValue = "very-deep";
    }

    @Test
    void depthLimitEmitsTypeName() {
        Map<String, String> flat = ValueRenderer.flatten(new Outer(), DEFAULT_LIMITS);
        assertEquals("outer", flat.get("name"));
        assertEquals("inner-value", flat.get("inner.value"));
        assertEquals("<Deep>", flat.get("inner.deep"));
        assertFalse(flat.containsKey("inner.deep.deepValue"));
    }

    @Test
    void collectionsAreTruncated() {
        Map<String, String> flat = ValueRenderer.flatten(List.of(1, 2, 3, 4, 5), DEFAULT_LIMITS);
        assertEquals("5", flat.get("length"));
        assertEquals("1", flat.get("[0]"));
        assertEquals("3", flat.get("[2]"));
        assertFalse(flat.containsKey("[3]"));
    }

    @Test
    void arraysAndMaps() {
        Map<String, String> array = ValueRenderer.flatten(new int[]{7, 8}, DEFAULT_LIMITS);
        assertEquals("2", array.get("length"));
        assertEquals("8", array.get("[1]"));

        Map<String, Integer> scores = new LinkedHashMap<>();
        scores.put("ada", 3);
        Map<String, String> map = ValueRenderer.flatten(scores, DEFAULT_LIMITS);
        assertEquals("1", map.get("length"));
        assertEquals("3", map.get("[ada]"));
    }

    static class Node {
        String id = "n";
        Node next;
    }

    @Test
    void cyclesAreMarked() {
        Node node = new Node();
        node.next = node;
        Map<String, String> flat = ValueRenderer.flatten(node, new RenderLimits(5, 3));
        assertEquals("n", flat.get("id"));
        assertEquals("<circular>", flat.get("next"));
    }
}
