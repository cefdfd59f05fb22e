package com.document.merge.path;

import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.structure.StructureEnforcer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.document.merge.support.TestDocuments.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathResolver Tests")
class PathResolverTest {

    private PathResolver resolver;
    private Node pdu;
    private Node signal;
    private Document doc;

    @BeforeEach
    void setUp() {
        resolver = new PathResolver();
        signal = element("I-SIGNAL", "Speed");
        pdu = element("I-SIGNAL-I-PDU", "Pdu", Node.of("I-SIGNAL-TO-PDU-MAPPINGS").addChild(signal));
        doc = document("Com.arxml", pkg("Communication", pdu));
    }

    @Nested
    @DisplayName("absolutePath")
    class AbsolutePath {

        @Test
        @DisplayName("Anonymous ancestors contribute no segment")
        void anonymousAncestorsSkipped() {
            assertEquals("/Communication/Pdu", resolver.absolutePath(pdu, doc));
            assertEquals("/Communication/Pdu/Speed", resolver.absolutePath(signal, doc));
        }

        @Test
        @DisplayName("Anonymous root resolves to /")
        void anonymousRoot() {
            assertEquals("/", resolver.absolutePath(doc.getRoot(), doc));
        }

        @Test
        @DisplayName("Anonymous node resolves to its nearest named ancestor")
        void anonymousNodePath() {
            Node mappings = pdu.findChild("I-SIGNAL-TO-PDU-MAPPINGS").orElseThrow();
            assertEquals("/Communication/Pdu", resolver.absolutePath(mappings, doc));
            assertTrue(resolver.referencePath(mappings, doc).isEmpty());
            assertEquals("/Communication/Pdu", resolver.referencePath(pdu, doc).orElseThrow());
        }

        @Test
        @DisplayName("Named root contributes a segment")
        void namedRoot() {
            Node child = element("X", "Child");
            Document named = Document.of("n", element("ROOT", "Top", child));
            assertEquals("/Top/Child", resolver.absolutePath(child, named));
        }

        @Test
        @DisplayName("Resolving twice without mutation gives the same path")
        void idempotent() {
            String first = resolver.absolutePath(signal, doc);
            String second = resolver.absolutePath(signal, doc);
            assertEquals(first, second);
        }

        @Test
        @DisplayName("A node added by raw tree manipulation has no parent entry")
        void rawAddChildFails() {
            Node raw = element("I-SIGNAL", "Raw");
            pdu.addChild(raw);

            PathResolutionException e = assertThrows(PathResolutionException.class,
                    () -> resolver.absolutePath(raw, doc));
            assertTrue(e.getMessage().contains("Com.arxml"));
        }

        @Test
        @DisplayName("A node attached through the enforcer resolves")
        void attachedNodeResolves() {
            Node added = element("I-SIGNAL", "Added");
            new StructureEnforcer(resolver).attach(pdu, added, doc);
            assertEquals("/Communication/Pdu/Added", resolver.absolutePath(added, doc));
        }
    }

    @ParameterizedTest(name = "{0} -> trailing {1}, parent {2}")
    @CsvSource({
            "/A/B/C, /C, /A/B",
            "/A, /A, /",
            "/, /, /"
    })
    @DisplayName("Path helpers")
    void pathHelpers(String path, String trailing, String parent) {
        assertEquals(trailing, PathResolver.trailingSegment(path));
        assertEquals(parent, PathResolver.parentPath(path));
    }
}
