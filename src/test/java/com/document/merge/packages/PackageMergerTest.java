package com.document.merge.packages;

import com.document.merge.audit.AuditAction;
import com.document.merge.audit.AuditService;
import com.document.merge.audit.MergeLedger;
import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.core.model.NodeTags;
import com.document.merge.core.model.PathMap;
import com.document.merge.merge.DuplicateSourceKeyException;
import com.document.merge.merge.MergeEngine;
import com.document.merge.merge.MergeMode;
import com.document.merge.merge.NameClashSet;
import com.document.merge.metrics.NoOpMetricsService;
import com.document.merge.path.PathLookup;
import com.document.merge.path.PathResolver;
import com.document.merge.structure.StructureEnforcer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.document.merge.support.TestDocuments.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PackageMerger Tests")
class PackageMergerTest {

    private NameClashSet clashes;
    private AuditService audit;
    private MissingPackages missing;
    private MergeLedger ledger;
    private PackageMerger merger;

    @BeforeEach
    void setUp() {
        clashes = new NameClashSet();
        audit = new AuditService();
        missing = new MissingPackages();
        ledger = new MergeLedger();
        StructureEnforcer enforcer = new StructureEnforcer(new PathResolver());
        MergeEngine engine = new MergeEngine(enforcer, clashes, ledger, audit,
                new NoOpMetricsService(), MergeMode.STRICT);
        merger = new PackageMerger(engine, enforcer, () -> "id", missing, audit);
    }

    private static Node packagesOf(Document doc) {
        return doc.getRoot().findChild(NodeTags.PACKAGES).orElseThrow();
    }

    @Nested
    @DisplayName("copyPackage")
    class CopyPackage {

        @Test
        @DisplayName("Missing destination packages are created, with sub-packages, recursively")
        void createsMissingPackages() {
            Node src = pkg("Com", List.of(element("I-SIGNAL", "S1")),
                    pkg("Pdus", element("I-SIGNAL-I-PDU", "P1")));
            Document srcDoc = document("EthDp.arxml", src);
            Document dstDoc = document("Com.arxml");

            PathMap map = merger.copyPackage(src, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.strict());

            Node created = PackageNodes.find(packagesOf(dstDoc), "Com").orElseThrow();
            assertEquals("id-Com", created.getAttribute("UUID"));
            assertTrue(PackageNodes.validate(created));
            assertNotNull(PathLookup.findByPath(dstDoc, "/Com/Pdus/P1").orElse(null));
            assertEquals("/Com/S1", map.lookup("/Com/S1").orElseThrow());
            assertEquals("/Com/Pdus/P1", map.lookup("/Com/Pdus/P1").orElseThrow());
            assertEquals(2, audit.getEntriesByAction(AuditAction.PACKAGE_CREATED).size());
        }

        @Test
        @DisplayName("Existing packages are reused and completed with a sub-package container")
        void reusesExistingPackage() {
            Node src = pkg("Com", List.of(element("I-SIGNAL", "S2")), pkg("Pdus"));
            Document srcDoc = document("EthDp.arxml", src);
            Node dstCom = pkg("Com", element("I-SIGNAL", "S1"));
            Document dstDoc = document("Com.arxml", dstCom);

            merger.copyPackage(src, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.strict());

            assertEquals(1, packagesOf(dstDoc).childCount());
            assertEquals(List.of("SHORT-NAME", "ELEMENTS", "AR-PACKAGES"),
                    dstCom.getChildren().stream().map(Node::getTag).toList());
            assertEquals(2, elementsOf(dstCom).childCount());
            assertTrue(PackageNodes.find(dstCom.findChild(NodeTags.PACKAGES).orElseThrow(), "Pdus").isPresent());
        }

        @Test
        @DisplayName("The clash policy picks the mode per package")
        void policyPerPackage() {
            Node src = pkg("Com", List.of(element("I-SIGNAL", "S1"), element("I-SIGNAL", "S2")),
                    pkg("Pdus", element("I-SIGNAL-I-PDU", "P1"), element("I-SIGNAL-I-PDU", "P2")));
            Document srcDoc = document("s", src);
            Node dstPdus = pkg("Pdus", element("I-SIGNAL-I-PDU", "P1"));
            Node dstCom = pkg("Com", List.of(element("I-SIGNAL", "S1")), dstPdus);
            Document dstDoc = document("d", dstCom);

            merger.copyPackage(src, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.gracefulFor("Pdus"));

            assertEquals(1, elementsOf(dstCom).childCount());
            assertEquals(2, elementsOf(dstPdus).childCount());
            assertEquals(MergeMode.STRICT, clashes.getStrictClashes().get(0).mode());
            assertEquals("/Com", clashes.getStrictClashes().get(0).destinationContainerPath());
            assertEquals("/Com/Pdus", clashes.getGracefulClashes().get(0).destinationContainerPath());
        }

        @Test
        @DisplayName("A malformed source package is rejected")
        void malformedSource() {
            Node bad = Node.named(NodeTags.PACKAGE, "Bad");
            Document srcDoc = document("s", bad);
            Document dstDoc = document("d");

            assertThrows(InvalidPackageStructureException.class,
                    () -> merger.copyPackage(bad, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.graceful()));
        }

        @Test
        @DisplayName("Packages created by a failing copy are removed again")
        void rollbackOnFailure() {
            Node broken = Node.named(NodeTags.PACKAGE, "Broken").addChild(Node.of("UNEXPECTED"));
            Node src = pkg("Com", List.of(element("I-SIGNAL", "S1")), broken);
            Document srcDoc = document("s", src);
            Document dstDoc = document("d");

            assertThrows(InvalidPackageStructureException.class,
                    () -> merger.copyPackage(src, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.graceful()));

            assertEquals(0, packagesOf(dstDoc).childCount());
        }

        @Test
        @DisplayName("A malformed sub-package fails the copy before an existing package is touched")
        void malformedSubPackageLeavesExistingPackageUntouched() {
            Node broken = Node.named(NodeTags.PACKAGE, "Broken").addChild(Node.of("UNEXPECTED"));
            Node s2 = element("I-SIGNAL", "S2");
            Node src = pkg("Com", List.of(s2), broken);
            Document srcDoc = document("s", src);
            Node s1 = element("I-SIGNAL", "S1");
            Node dstCom = pkg("Com", s1);
            Document dstDoc = document("d", dstCom);

            assertThrows(InvalidPackageStructureException.class,
                    () -> merger.copyPackage(src, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.graceful()));

            assertEquals(List.of(s1), elementsOf(dstCom).getChildren());
            assertEquals(List.of("SHORT-NAME", "ELEMENTS"),
                    dstCom.getChildren().stream().map(Node::getTag).toList());
            assertFalse(dstDoc.contains(s2));
            assertEquals(0, ledger.size());
        }

        @Test
        @DisplayName("Elements merged into an existing package are detached when a later step fails")
        void rollbackOnFailureIntoExistingPackage() {
            Node s2 = element("I-SIGNAL", "S2");
            Node src = pkg("Com", List.of(s2),
                    pkg("Pdus", element("I-SIGNAL-I-PDU", "P1"), element("I-SIGNAL-I-PDU", "P1")));
            Document srcDoc = document("s", src);
            Node s1 = element("I-SIGNAL", "S1");
            Node dstCom = pkg("Com", s1);
            Document dstDoc = document("d", dstCom);

            assertThrows(DuplicateSourceKeyException.class,
                    () -> merger.copyPackage(src, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.graceful()));

            assertEquals(List.of(s1), elementsOf(dstCom).getChildren());
            assertEquals(List.of("SHORT-NAME", "ELEMENTS"),
                    dstCom.getChildren().stream().map(Node::getTag).toList());
            assertFalse(dstDoc.contains(s2));
            assertTrue(srcDoc.contains(s2));
            assertEquals(0, ledger.size());
        }

        @Test
        @DisplayName("A failing copy keeps the ledger records of earlier copies")
        void rollbackKeepsEarlierLedgerRecords() {
            Node first = pkg("Signals", element("I-SIGNAL", "S1"));
            Node second = pkg("Com", List.of(element("I-SIGNAL", "S2")),
                    pkg("Pdus", element("I-SIGNAL-I-PDU", "P1"), element("I-SIGNAL-I-PDU", "P1")));
            Document srcDoc = document("s", first, second);
            Document dstDoc = document("d");

            merger.copyPackage(first, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.strict());
            assertEquals(1, ledger.size());

            assertThrows(DuplicateSourceKeyException.class,
                    () -> merger.copyPackage(second, packagesOf(dstDoc), srcDoc, dstDoc, ClashPolicy.strict()));

            assertEquals(1, ledger.size());
            assertEquals("/Signals", ledger.getAllRecords().get(0).destinationContainerPath());
            assertTrue(PackageNodes.find(packagesOf(dstDoc), "Com").isEmpty());
        }
    }

    @Nested
    @DisplayName("copyRootPackages")
    class CopyRootPackages {

        @Test
        @DisplayName("Copies every listed package found anywhere in the source")
        void copiesListedPackages() {
            Node nested = pkg("Signals", element("I-SIGNAL", "S1"));
            Document srcDoc = document("s", pkg("Outer", List.of(), nested), pkg("Unlisted"));
            Document dstDoc = document("d");

            merger.copyRootPackages(srcDoc, dstDoc, List.of(RootPackageSpec.of("Signals")), Set.of());

            assertTrue(PackageNodes.find(packagesOf(dstDoc), "Signals").isPresent());
            assertTrue(PackageNodes.find(packagesOf(dstDoc), "Unlisted").isEmpty());
            assertFalse(missing.any());
        }

        @Test
        @DisplayName("Missing packages are recorded unless tolerated")
        void missingPackages() {
            Document srcDoc = document("EthDp.arxml", pkg("Present"));
            Document dstDoc = document("d");

            merger.copyRootPackages(srcDoc, dstDoc, List.of(
                    RootPackageSpec.of("Present"),
                    RootPackageSpec.of("Gone"),
                    RootPackageSpec.of("Optional")), Set.of("Optional"));

            assertTrue(missing.any());
            assertEquals(1, missing.size());
            assertEquals("Package Gone is missing in EthDp.arxml", missing.list().get(0).describe());
            assertEquals(1, audit.getEntriesByAction(AuditAction.SOURCE_PACKAGE_MISSING).size());
        }

        @Test
        @DisplayName("The destination package container is created when absent")
        void createsDestinationContainer() {
            Document srcDoc = document("s", pkg("Com"));
            Document dstDoc = Document.of("d", Node.of("AUTOSAR"));

            merger.copyRootPackages(srcDoc, dstDoc, List.of(RootPackageSpec.of("Com")), Set.of());

            assertTrue(PackageNodes.find(packagesOf(dstDoc), "Com").isPresent());
        }
    }
}
