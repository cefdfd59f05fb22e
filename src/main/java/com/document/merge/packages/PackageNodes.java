package com.document.merge.packages;

import com.document.merge.core.model.Node;
import com.document.merge.core.model.NodeTags;
import com.document.merge.structure.ContainerSchema;

import java.util.List;
import java.util.Optional;

/**
 * Shape of package nodes:
 * <pre>
 * &lt;AR-PACKAGE UUID="..."&gt;
 *   &lt;SHORT-NAME&gt;Name&lt;/SHORT-NAME&gt;
 *   &lt;ELEMENTS/&gt;
 *   &lt;AR-PACKAGES/&gt;   (optional)
 * &lt;/AR-PACKAGE&gt;
 * </pre>
 */
public final class PackageNodes {

    static final ContainerSchema FLAT = ContainerSchema.builder()
            .required(NodeTags.NAME)
            .synthesized(NodeTags.ELEMENTS)
            .build();

    static final ContainerSchema NESTED = ContainerSchema.builder()
            .required(NodeTags.NAME)
            .synthesized(NodeTags.ELEMENTS)
            .synthesized(NodeTags.PACKAGES)
            .build();

    private PackageNodes() {
    }

    /**
     * New, detached package with a name and an empty element container.
     */
    public static Node create(String name, String identity) {
        Node pkg = Node.named(NodeTags.PACKAGE, name).addChild(Node.of(NodeTags.ELEMENTS));
        if (identity != null) {
            pkg.setAttribute(NodeTags.IDENTITY_ATTRIBUTE, identity);
        }
        return pkg;
    }

    /**
     * Checks the package shape.
     *
     * @return whether the package has a sub-package container
     * @throws InvalidPackageStructureException if the shape is not
     *         {@code SHORT-NAME, ELEMENTS[, AR-PACKAGES]}
     */
    public static boolean validate(Node pkg) {
        if (!pkg.hasTag(NodeTags.PACKAGE)) {
            throw new InvalidPackageStructureException("Expected " + NodeTags.PACKAGE + " but got " + pkg.getTag());
        }
        List<Node> children = pkg.getChildren();
        if (children.size() < 2
                || !children.get(0).hasTag(NodeTags.NAME)
                || !children.get(1).hasTag(NodeTags.ELEMENTS)) {
            throw new InvalidPackageStructureException("Package " + pkg
                    + " must start with " + NodeTags.NAME + " and " + NodeTags.ELEMENTS);
        }
        if (children.size() > 3) {
            throw new InvalidPackageStructureException("Unhandled package " + pkg + " detected (children > 3)");
        }
        if (children.size() == 3) {
            if (!children.get(2).hasTag(NodeTags.PACKAGES)) {
                throw new InvalidPackageStructureException("Package " + pkg + " has unexpected third child "
                        + children.get(2).getTag());
            }
            return true;
        }
        return false;
    }

    /**
     * Direct child package with the given name.
     */
    public static Optional<Node> find(Node parent, String name) {
        return parent.findChildren(NodeTags.PACKAGE).stream()
                .filter(pkg -> pkg.localName().filter(name::equals).isPresent())
                .findFirst();
    }

    public static List<Node> subPackages(Node pkg) {
        return pkg.findChild(NodeTags.PACKAGES)
                .map(container -> container.findChildren(NodeTags.PACKAGE))
                .orElse(List.of());
    }
}
